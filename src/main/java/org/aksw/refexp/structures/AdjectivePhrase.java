package org.aksw.refexp.structures;

public class AdjectivePhrase extends Phrase {

	public AdjectivePhrase() {
		super(ElementType.ADJECTIVE_PHRASE);
	}

	public AdjectivePhrase(Element head) {
		super(ElementType.ADJECTIVE_PHRASE, head);
	}

	protected AdjectivePhrase(AdjectivePhrase other) {
		super(other);
	}

	@Override
	public AdjectivePhrase copy() {
		return new AdjectivePhrase(this);
	}
}
