package org.aksw.refexp.microplanning;

import static org.junit.Assert.*;

import org.aksw.refexp.structures.Clause;
import org.aksw.refexp.structures.Coordination;
import org.aksw.refexp.structures.NounPhrase;
import org.aksw.refexp.structures.PartOfSpeech;
import org.aksw.refexp.structures.Placeholder;
import org.aksw.refexp.structures.PrepositionalPhrase;
import org.aksw.refexp.structures.Text;
import org.aksw.refexp.structures.VerbPhrase;
import org.aksw.refexp.structures.Word;
import org.junit.Test;

public class SimpleStrVisitorTest {

	@Test
	public void testClause() {
		VerbPhrase vp = new VerbPhrase(new Word("sits", PartOfSpeech.VERB));
		vp.addComplement(new PrepositionalPhrase(new Word("on", PartOfSpeech.PREPOSITION), new NounPhrase(new Word(
				"table", PartOfSpeech.NOUN), new Word("the", PartOfSpeech.DETERMINER))));
		Clause clause = new Clause(new NounPhrase(new Word("block", PartOfSpeech.NOUN), new Word("the",
				PartOfSpeech.DETERMINER)), vp);
		assertEquals("the block sits on the table", SimpleStrVisitor.toSurface(clause));
	}

	@Test
	public void testCoordination() {
		Coordination coordination = new Coordination(new Text("red"), new Text("green"), new Text("blue"));
		assertEquals("red, green and blue", SimpleStrVisitor.toSurface(coordination));
		assertEquals("red or green", SimpleStrVisitor.toSurface(new Coordination("or", new Text("red"), new Text(
				"green"))));
	}

	@Test
	public void testPlaceholders() {
		assertEquals("block1", SimpleStrVisitor.toSurface(new Placeholder("block1")));
		assertEquals("table", SimpleStrVisitor.toSurface(new Placeholder("0", new Text("table"))));
	}

	@Test
	public void testWhitespaceIsCollapsed() {
		assertEquals("a b", SimpleStrVisitor.toSurface(new Text("  a   b ")));
	}
}
