package org.aksw.refexp.lexicon;

/**
 * The case a pronoun is used in, e.g. "he", "him", "himself" and "his".
 */
public enum PronounUse {
	SUBJECTIVE, OBJECTIVE, REFLEXIVE, POSSESSIVE;
}
