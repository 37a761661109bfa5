package org.aksw.refexp.lexicon;

import java.util.Map;

import org.aksw.refexp.structures.Element;
import org.aksw.refexp.structures.Word;

/**
 * Language dependent knowledge needed to choose referring expressions.
 */
public interface Lexicon {

	Gender guessPhraseGender(Element phrase);

	NumberAgreement guessPhraseNumber(Element phrase);

	/**
	 * Returns the pronoun for the given features. Missing features default to
	 * third person, singular, neuter and subjective use.
	 */
	Word pronounForFeatures(Map<String, String> features);
}
