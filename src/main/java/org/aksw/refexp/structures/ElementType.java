package org.aksw.refexp.structures;

/**
 * The closed set of node variants of a constituent tree.
 */
public enum ElementType {

	EMPTY,
	TEXT,
	WORD,
	PLACEHOLDER,
	CLAUSE,
	COORDINATION,
	NOUN_PHRASE,
	VERB_PHRASE,
	PREPOSITIONAL_PHRASE,
	ADJECTIVE_PHRASE,
	ADVERB_PHRASE;

	public boolean isPhrase() {
		return this == NOUN_PHRASE || this == VERB_PHRASE || this == PREPOSITIONAL_PHRASE
				|| this == ADJECTIVE_PHRASE || this == ADVERB_PHRASE;
	}
}
