package org.aksw.refexp.realisation;

import static org.junit.Assert.*;

import org.aksw.refexp.macroplanning.Document;
import org.aksw.refexp.macroplanning.Message;
import org.aksw.refexp.macroplanning.Paragraph;
import org.aksw.refexp.macroplanning.Section;
import org.aksw.refexp.structures.Clause;
import org.aksw.refexp.structures.EmptyElement;
import org.aksw.refexp.structures.Features;
import org.aksw.refexp.structures.NounPhrase;
import org.aksw.refexp.structures.PartOfSpeech;
import org.aksw.refexp.structures.Text;
import org.aksw.refexp.structures.VerbPhrase;
import org.aksw.refexp.structures.Word;
import org.junit.BeforeClass;
import org.junit.Test;

public class SimpleNLGRealiserTest {

	private static SimpleNLGRealiser realiser;

	@BeforeClass
	public static void init() {
		realiser = new SimpleNLGRealiser();
	}

	private static NounPhrase theBlock() {
		return new NounPhrase(new Word("block", PartOfSpeech.NOUN), new Word("the", PartOfSpeech.DETERMINER));
	}

	private static Clause falls() {
		return new Clause(theBlock(), new VerbPhrase(new Word("fall", PartOfSpeech.VERB)));
	}

	private static Clause itIsRed() {
		VerbPhrase vp = new VerbPhrase(new Word("is", PartOfSpeech.VERB));
		vp.addComplement(new Word("red", PartOfSpeech.ADJECTIVE));
		return new Clause(new Word("it", PartOfSpeech.PRONOUN), vp);
	}

	@Test
	public void testSentence() {
		assertEquals("The block falls.", realiser.realiseSentence(falls()));
		assertEquals("It is red.", realiser.realiseSentence(itIsRed()));
	}

	@Test
	public void testTense() {
		Clause clause = falls();
		clause.setFeature(Features.TENSE, "PAST");
		assertEquals("The block fell.", realiser.realiseSentence(clause));
	}

	@Test
	public void testPhrase() {
		assertEquals("the block", realiser.realise(theBlock()));
		assertEquals("", realiser.realise(new EmptyElement()));
	}

	@Test
	public void testDocument() {
		Message contrast = new Message("contrast", falls(), new Clause(new NounPhrase(new Word("pyramid",
				PartOfSpeech.NOUN), new Word("the", PartOfSpeech.DETERMINER)), new VerbPhrase(new Word("stand",
				PartOfSpeech.VERB))));
		contrast.setMarker("but");
		Document document = new Document(new Text("Blocks"), new Section(null, new Paragraph(new Message(
				"elaboration", itIsRed()), contrast)));

		String text = realiser.realise(document);
		assertTrue(text, text.startsWith("Blocks"));
		assertTrue(text, text.contains("It is red."));
		assertTrue(text, text.contains("falls but the pyramid stands"));
	}
}
