package org.aksw.refexp.microplanning;

import static org.junit.Assert.*;

import java.util.List;

import org.aksw.refexp.macroplanning.MalformedArgumentReferenceException;
import org.aksw.refexp.macroplanning.Message;
import org.aksw.refexp.macroplanning.PredicateMsgSpec;
import org.aksw.refexp.macroplanning.StringMsgSpec;
import org.aksw.refexp.structures.Clause;
import org.aksw.refexp.structures.Element;
import org.aksw.refexp.structures.ElementType;
import org.aksw.refexp.structures.Features;
import org.aksw.refexp.structures.PartOfSpeech;
import org.aksw.refexp.structures.Placeholder;
import org.aksw.refexp.structures.Text;
import org.aksw.refexp.structures.VerbPhrase;
import org.aksw.refexp.structures.Word;
import org.junit.Before;
import org.junit.Test;

public class LexicaliserTest {

	private Lexicaliser lexicaliser;
	private Clause onTemplate;

	@Before
	public void setUp() {
		lexicaliser = new Lexicaliser();
		VerbPhrase vp = new VerbPhrase(new Word("is", PartOfSpeech.VERB));
		vp.addComplement(new Word("on", PartOfSpeech.PREPOSITION));
		vp.addComplement(new Placeholder("1"));
		onTemplate = new Clause(new Placeholder("0"), vp);
		lexicaliser.addTemplate("on", onTemplate);
		lexicaliser.addTemplate("falls", new Clause(new Placeholder("object"), new Word("fall", PartOfSpeech.VERB)));
	}

	@Test
	public void testBindsArgumentsByIndex() {
		Element sentence = lexicaliser.lexicalise(new PredicateMsgSpec("on", "block1", "table1"));
		List<Placeholder> arguments = sentence.arguments();
		assertEquals(2, arguments.size());
		assertEquals(new Text("block1"), arguments.get(0).getValue());
		assertEquals(new Text("table1"), arguments.get(1).getValue());
		// the template itself is not bound
		assertFalse(onTemplate.arguments().get(0).isBound());
	}

	@Test
	public void testBindsNamedValues() {
		PredicateMsgSpec msg = new PredicateMsgSpec("falls");
		msg.putValue("object", "block1");
		msg.setFeature(Features.TENSE, "PAST");
		Element sentence = lexicaliser.lexicalise(msg);
		assertEquals("block1", sentence.arguments().get(0).getString());
		assertEquals("PAST", sentence.getFeature(Features.TENSE).get());
	}

	@Test(expected = MalformedArgumentReferenceException.class)
	public void testMissingArgument() {
		lexicaliser.lexicalise(new PredicateMsgSpec("on", "block1"));
	}

	@Test
	public void testUnknownMessageBecomesText() {
		Element sentence = lexicaliser.lexicalise(new PredicateMsgSpec("under", "block1", "table1"));
		assertEquals(new Text("under(block1, table1)"), sentence);
	}

	@Test
	public void testStringMessage() {
		assertEquals(new Text("Hello world"), lexicaliser.lexicalise(new StringMsgSpec("Hello world")));
	}

	@Test
	public void testMessage() {
		Message message = lexicaliser.lexicalise("sequence", new PredicateMsgSpec("on", "block1", "table1"),
				new StringMsgSpec("That is all."));
		assertTrue(message.isMultinuclear());
		assertEquals(ElementType.CLAUSE, message.getNucleus().getType());
		assertEquals(2, message.getSentences().size());
	}
}
