package org.aksw.refexp.structures;

/**
 * A prepositional phrase; the preposition is the head, its object a complement.
 */
public class PrepositionalPhrase extends Phrase {

	public PrepositionalPhrase() {
		super(ElementType.PREPOSITIONAL_PHRASE);
	}

	public PrepositionalPhrase(Element head) {
		super(ElementType.PREPOSITIONAL_PHRASE, head);
	}

	public PrepositionalPhrase(Element preposition, Element complement) {
		this(preposition);
		addComplement(complement);
	}

	protected PrepositionalPhrase(PrepositionalPhrase other) {
		super(other);
	}

	@Override
	public PrepositionalPhrase copy() {
		return new PrepositionalPhrase(this);
	}
}
