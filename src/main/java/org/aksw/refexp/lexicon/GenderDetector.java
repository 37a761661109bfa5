package org.aksw.refexp.lexicon;

import com.google.common.base.Optional;

/**
 * Guesses the gender of a name or noun.
 */
public interface GenderDetector {

	/**
	 * @return the gender, or absent if the name is unknown
	 */
	Optional<Gender> getGender(String name);
}
