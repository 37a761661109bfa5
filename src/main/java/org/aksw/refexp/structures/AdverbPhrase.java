package org.aksw.refexp.structures;

public class AdverbPhrase extends Phrase {

	public AdverbPhrase() {
		super(ElementType.ADVERB_PHRASE);
	}

	public AdverbPhrase(Element head) {
		super(ElementType.ADVERB_PHRASE, head);
	}

	protected AdverbPhrase(AdverbPhrase other) {
		super(other);
	}

	@Override
	public AdverbPhrase copy() {
		return new AdverbPhrase(this);
	}
}
