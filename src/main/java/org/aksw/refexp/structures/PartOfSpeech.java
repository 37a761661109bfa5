package org.aksw.refexp.structures;

/**
 * Part-of-speech tags of {@link Word}s. The names match the lexical categories of SimpleNLG.
 */
public final class PartOfSpeech {

	public static final String NOUN = "NOUN";
	public static final String VERB = "VERB";
	public static final String ADJECTIVE = "ADJECTIVE";
	public static final String ADVERB = "ADVERB";
	public static final String DETERMINER = "DETERMINER";
	public static final String PRONOUN = "PRONOUN";
	public static final String PREPOSITION = "PREPOSITION";
	public static final String CONJUNCTION = "CONJUNCTION";
	public static final String COMPLEMENTISER = "COMPLEMENTISER";
	public static final String MODAL = "MODAL";
	public static final String ANY = "ANY";

	private PartOfSpeech() {
	}
}
