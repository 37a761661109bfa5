package org.aksw.refexp.lexicon;

/**
 * Grammatical gender. Epicene covers referents of unknown or mixed gender and is
 * realised with plural pronouns.
 */
public enum Gender {
	MASCULINE, FEMININE, NEUTER, EPICENE;
}
