package org.aksw.refexp.lexicon;

import java.io.IOException;
import java.net.URL;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.base.Charsets;
import com.google.common.base.Optional;
import com.google.common.io.Resources;

/**
 * Looks names and nouns up in lists of male and female words. By default the lists
 * are read from the class path files <code>male.txt</code> and <code>female.txt</code>,
 * one entry per line, lines starting with # are ignored.
 */
public class LexiconBasedGenderDetector implements GenderDetector {

	private static final Logger logger = Logger.getLogger(LexiconBasedGenderDetector.class.getName());

	private final Set<String> male;
	private final Set<String> female;

	public LexiconBasedGenderDetector(Set<String> male, Set<String> female) {
		this.male = normalise(male);
		this.female = normalise(female);
	}

	public LexiconBasedGenderDetector() {
		this(readLines("male.txt"), readLines("female.txt"));
	}

	@Override
	public Optional<Gender> getGender(String name) {
		String key = name.trim().toLowerCase(Locale.ENGLISH);
		if (male.contains(key)) {
			return Optional.of(Gender.MASCULINE);
		} else if (female.contains(key)) {
			return Optional.of(Gender.FEMININE);
		}
		return Optional.absent();
	}

	private static Set<String> normalise(Set<String> words) {
		Set<String> normalised = new HashSet<>();
		for (String word : words) {
			normalised.add(word.trim().toLowerCase(Locale.ENGLISH));
		}
		return normalised;
	}

	static Set<String> readLines(String resource) {
		URL url = LexiconBasedGenderDetector.class.getClassLoader().getResource(resource);
		if (url == null) {
			throw new IllegalStateException("Missing class path resource " + resource);
		}
		try {
			Set<String> words = new HashSet<>();
			List<String> lines = Resources.readLines(url, Charsets.UTF_8);
			for (String l : lines) {
				l = l.trim();
				if (!l.startsWith("#") && !l.isEmpty()) {
					words.add(l);
				}
			}
			logger.debug("Loaded " + words.size() + " entries from " + resource);
			return words;
		} catch (IOException e) {
			throw new IllegalStateException("Could not read " + resource, e);
		}
	}
}
