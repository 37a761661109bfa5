package org.aksw.refexp.lexicon;

import static org.junit.Assert.*;

import org.junit.Test;

import com.google.common.collect.Sets;

public class LexiconBasedGenderDetectorTest {

	@Test
	public void testDefaultLists() {
		GenderDetector detector = new LexiconBasedGenderDetector();
		assertEquals(Gender.MASCULINE, detector.getGender("John").get());
		assertEquals(Gender.FEMININE, detector.getGender(" mary ").get());
		assertEquals(Gender.MASCULINE, detector.getGender("man").get());
		assertFalse(detector.getGender("block").isPresent());
	}

	@Test
	public void testGivenLists() {
		GenderDetector detector = new LexiconBasedGenderDetector(Sets.newHashSet("Bob"), Sets.newHashSet("Alice"));
		assertEquals(Gender.MASCULINE, detector.getGender("bob").get());
		assertEquals(Gender.FEMININE, detector.getGender("ALICE").get());
		assertFalse(detector.getGender("John").isPresent());
	}
}
