package org.aksw.refexp.reg;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.aksw.refexp.lexicon.EnglishLexicon;
import org.aksw.refexp.lexicon.Gender;
import org.aksw.refexp.lexicon.NumberAgreement;
import org.aksw.refexp.lexicon.Person;
import org.aksw.refexp.lexicon.PronounUse;
import org.aksw.refexp.macroplanning.Document;
import org.aksw.refexp.macroplanning.Message;
import org.aksw.refexp.macroplanning.Paragraph;
import org.aksw.refexp.macroplanning.Section;
import org.aksw.refexp.microplanning.SimpleStrVisitor;
import org.aksw.refexp.ontology.Ontology;
import org.aksw.refexp.ontology.OntologyException;
import org.aksw.refexp.structures.Clause;
import org.aksw.refexp.structures.Coordination;
import org.aksw.refexp.structures.Element;
import org.aksw.refexp.structures.Features;
import org.aksw.refexp.structures.NounPhrase;
import org.aksw.refexp.structures.PartOfSpeech;
import org.aksw.refexp.structures.Placeholder;
import org.aksw.refexp.structures.PrepositionalPhrase;
import org.aksw.refexp.structures.Text;
import org.aksw.refexp.structures.VerbPhrase;
import org.aksw.refexp.structures.Word;
import org.junit.BeforeClass;
import org.junit.Test;

public class ReferringExpressionGeneratorTest {

	/**
	 * Blocks world: one block, one table, two pyramids and two cubes.
	 */
	static class MapOntology implements Ontology {

		private final Map<String, String> types = new HashMap<>();

		MapOntology() {
			types.put("block1", "Block");
			types.put("table1", "table");
			types.put("pyramid1", "pyramid");
			types.put("pyramid2", "pyramid");
			types.put("redcube", "cube");
			types.put("bluecube", "cube");
		}

		@Override
		public String bestEntityType(String entity) throws OntologyException {
			if (entity.equals("broken1")) {
				throw new IllegalStateException("store unavailable");
			}
			String type = types.get(entity);
			if (type == null) {
				throw new OntologyException("No type known for entity " + entity);
			}
			return type;
		}

		@Override
		public Set<String> entitiesOfType(String type) {
			Set<String> entities = new TreeSet<>();
			for (Map.Entry<String, String> entry : types.entrySet()) {
				if (entry.getValue().equals(type)) {
					entities.add(entry.getKey());
				}
			}
			return entities;
		}
	}

	private static EnglishLexicon lexicon;

	@BeforeClass
	public static void init() {
		lexicon = new EnglishLexicon();
	}

	private static ReferringExpressionGenerator generator() {
		return new ReferringExpressionGenerator(lexicon, new MapOntology());
	}

	private static Clause falls(String entity) {
		return new Clause(new Placeholder(entity), new VerbPhrase(new Word("fall", PartOfSpeech.VERB)));
	}

	private static Clause isRed(String entity) {
		VerbPhrase vp = new VerbPhrase(new Word("is", PartOfSpeech.VERB));
		vp.addComplement(new Word("red", PartOfSpeech.ADJECTIVE));
		return new Clause(new Placeholder(entity), vp);
	}

	private static Clause named(String name, String verb, String object) {
		VerbPhrase vp = new VerbPhrase(new Word(verb, PartOfSpeech.VERB));
		if (object != null) {
			vp.setObject(new Placeholder("1", new Text(object)));
		}
		return new Clause(new Placeholder("0", new Text(name)), vp);
	}

	private static String surface(Element element) {
		return SimpleStrVisitor.toSurface(element);
	}

	@Test
	public void testInitialThenPronoun() {
		ReferringExpressionGenerator reg = generator();
		DiscourseContext context = new DiscourseContext();

		Element first = reg.generateForElement(falls("block1"), context);
		assertEquals("the block fall", surface(first));

		Element second = reg.generateForElement(isRed("block1"), context);
		assertEquals("it is red", surface(second));
		Word pronoun = (Word) ((NounPhrase) ((Clause) second).getSubject()).getHead();
		assertTrue(pronoun.isPronoun());
		assertEquals("SUBJECTIVE", pronoun.getFeature(Features.CASE).get());

		assertEquals(2, context.getHistory().size());
		assertTrue(context.getReferent("block1").isUnique());
		// the recorded sentence keeps the full noun phrase
		assertEquals("the block is red", surface(context.getHistory().get(1)));
	}

	@Test
	public void testInputIsNotModified() {
		Clause sentence = falls("block1");
		Clause copy = sentence.copy();
		generator().generateForElement(sentence, new DiscourseContext());
		assertEquals(copy, sentence);
	}

	@Test
	public void testWithoutPronouns() {
		ReferringExpressionGenerator reg = generator();
		reg.setPronominalisation(false);
		DiscourseContext context = new DiscourseContext();
		reg.generateForElement(falls("block1"), context);
		assertEquals("the block is red", surface(reg.generateForElement(isRed("block1"), context)));
	}

	@Test
	public void testSharedTypeGetsNumber() {
		ReferringExpressionGenerator reg = generator();
		DiscourseContext context = new DiscourseContext();
		Element sentence = reg.generateForElement(falls("pyramid2"), context);
		assertEquals("pyramid 2 fall", surface(sentence));
		NounPhrase subject = (NounPhrase) ((Clause) sentence).getSubject();
		assertTrue(subject.hasFeature(Features.PROPER, Features.TRUE));
		assertFalse(subject.hasSpecifier());
		assertFalse(context.getReferent("pyramid2").isUnique());
	}

	@Test
	public void testNumbersCanBeTurnedOff() {
		ReferringExpressionGenerator reg = generator();
		reg.setDistinguishByNumber(false);
		assertEquals("a pyramid fall", surface(reg.generateForElement(falls("pyramid2"), new DiscourseContext())));
	}

	@Test
	public void testSharedTypeIsIndefinite() {
		ReferringExpressionGenerator reg = generator();
		DiscourseContext context = new DiscourseContext();
		assertEquals("a cube fall", surface(reg.generateForElement(falls("redcube"), context)));
		assertFalse(context.getReferent("redcube").isUnique());

		Element repeated = reg.generateRefExp(new Text("redcube"), context);
		assertEquals("a cube", surface(repeated));
		// later mentions build on the same expression
		assertSame(context.getReferent("redcube").getExpression(), repeated);
	}

	@Test
	public void testRepeatedMentionBecomesDefinite() {
		ReferringExpressionGenerator reg = generator();
		DiscourseContext context = new DiscourseContext();
		assertEquals("a cube fall", surface(reg.generateForElement(falls("redcube"), context)));
		assertEquals("the table fall", surface(reg.generateForElement(falls("table1"), context)));
		// the table is more salient, so no pronoun, but the cube was mentioned before
		assertEquals("the cube fall", surface(reg.generateForElement(falls("redcube"), context)));
	}

	@Test
	public void testUniqueObjectIsDefinite() {
		ReferringExpressionGenerator reg = generator();
		VerbPhrase vp = new VerbPhrase(new Word("is", PartOfSpeech.VERB));
		vp.addComplement(new PrepositionalPhrase(new Word("on", PartOfSpeech.PREPOSITION), new Placeholder("table1")));
		Element sentence = reg.generateForElement(new Clause(new Placeholder("block1"), vp), new DiscourseContext());
		assertEquals("the block is on the table", surface(sentence));
	}

	@Test
	public void testUnknownEntityFallsBackToItsName() {
		ReferringExpressionGenerator reg = generator();
		DiscourseContext context = new DiscourseContext();
		Element sentence = reg.generateForElement(falls("sphere1"), context);
		assertEquals("a sphere1 fall", surface(sentence));
		assertFalse(context.getReferent("sphere1").isUnique());

		assertEquals("a broken1 fall", surface(reg.generateForElement(falls("broken1"), context)));
		assertTrue(context.hasReferent("broken1"));
	}

	@Test
	public void testWithoutOntology() {
		ReferringExpressionGenerator reg = new ReferringExpressionGenerator(lexicon, null);
		DiscourseContext context = new DiscourseContext();
		Element refExp = reg.generateRefExp(new Word("block1", PartOfSpeech.NOUN), context);
		assertEquals(new NounPhrase(new Word("block1", PartOfSpeech.NOUN)), refExp);
		assertFalse(context.getReferent("block1").isUnique());
	}

	@Test
	public void testOtherElementsAreNotReferents() {
		DiscourseContext context = new DiscourseContext();
		NounPhrase np = new NounPhrase(new Word("block", PartOfSpeech.NOUN));
		assertSame(np, generator().generateRefExp(np, context));
		assertNull(generator().generateRefExp(null, context));
		assertTrue(context.getReferents().isEmpty());
	}

	@Test
	public void testProperNames() {
		ReferringExpressionGenerator reg = generator();
		DiscourseContext context = new DiscourseContext();
		Element first = reg.generateForElement(named("Mary", "sleep", null), context);
		assertEquals("Mary sleep", surface(first));
		assertTrue(((Clause) first).getSubject().hasFeature(Features.PROPER, Features.TRUE));
		assertEquals("she sleep", surface(reg.generateForElement(named("Mary", "sleep", null), context)));
	}

	@Test
	public void testReflexive() {
		Element sentence = generator().generateForElement(named("John", "see", "John"), new DiscourseContext());
		assertEquals("John see himself", surface(sentence));
	}

	@Test
	public void testReflexiveInSubject() {
		ReferringExpressionGenerator reg = generator();
		DiscourseContext context = new DiscourseContext();
		reg.generateForElement(named("John", "sleep", null), context);

		NounPhrase picture = new NounPhrase(new Word("picture", PartOfSpeech.NOUN));
		picture.addComplement(new PrepositionalPhrase(new Word("of", PartOfSpeech.PREPOSITION), new Placeholder("0",
				new Text("John"))));
		VerbPhrase vp = new VerbPhrase(new Word("show", PartOfSpeech.VERB));
		vp.setObject(new Placeholder("1", new Text("John")));
		Element sentence = reg.generateForElement(new Clause(picture, vp), context);
		assertEquals("a picture of himself show himself", surface(sentence));

		PrepositionalPhrase of = (PrepositionalPhrase) ((NounPhrase) ((Clause) sentence).getSubject())
				.getComplements().get(0);
		Word pronoun = (Word) of.getComplements().get(0);
		assertEquals("REFLEXIVE", pronoun.getFeature(Features.CASE).get());
	}

	@Test
	public void testObjective() {
		ReferringExpressionGenerator reg = generator();
		DiscourseContext context = new DiscourseContext();
		assertEquals("John see Mary", surface(reg.generateForElement(named("John", "see", "Mary"), context)));
		assertEquals("she like him", surface(reg.generateForElement(named("Mary", "like", "John"), context)));
	}

	@Test
	public void testGendersKeepApart() {
		ReferringExpressionGenerator reg = generator();
		DiscourseContext context = new DiscourseContext();
		reg.generateForElement(named("John", "see", "Mary"), context);
		// the most salient masculine phrase is John
		assertEquals("he sleep", surface(reg.generateForElement(named("John", "sleep", null), context)));
	}

	@Test
	public void testCoordination() {
		ReferringExpressionGenerator reg = generator();
		DiscourseContext context = new DiscourseContext();
		Clause sentence = new Clause(new Coordination(new Placeholder("0", new Text("John")), new Placeholder("1",
				new Text("Mary"))), new Word("sleep", PartOfSpeech.VERB));
		assertEquals("John and Mary sleep", surface(reg.generateForElement(sentence, context)));
		assertEquals("they sleep", surface(reg.generateForElement(sentence, context)));
	}

	@Test
	public void testLastSpeakerIsFirstPerson() {
		ReferringExpressionGenerator reg = generator();
		DiscourseContext context = new DiscourseContext();
		NounPhrase john = new NounPhrase(new Text("John"));
		john.setFeature(Features.PROPER, Features.TRUE);
		context.setLastSpeaker(john);
		reg.generateForElement(named("John", "sleep", null), context);
		assertEquals("I sleep", surface(reg.generateForElement(named("John", "sleep", null), context)));
	}

	@Test
	public void testDeterminers() {
		ReferringExpressionGenerator reg = generator();
		DiscourseContext context = new DiscourseContext();
		List<Element> none = Collections.emptyList();

		NounPhrase apple = new NounPhrase(new Word("apple", PartOfSpeech.NOUN));
		assertEquals("an apple", surface(reg.optimiseDeterminer(apple, none, context)));

		NounPhrase block = new NounPhrase(new Word("block", PartOfSpeech.NOUN));
		List<Element> pool = new ArrayList<>();
		pool.add(new NounPhrase(new Word("block", PartOfSpeech.NOUN)));
		assertEquals("the block", surface(reg.optimiseDeterminer(block.copy(), pool, context)));

		NounPhrase redBlock = new NounPhrase(new Word("block", PartOfSpeech.NOUN));
		redBlock.addPreModifier(new Word("red", PartOfSpeech.ADJECTIVE));
		pool.add(redBlock);
		assertEquals("a block", surface(reg.optimiseDeterminer(block.copy(), pool, context)));

		NounPhrase blocks = new NounPhrase(new Word("blocks", PartOfSpeech.NOUN));
		blocks.setFeature(Features.NUMBER, "PLURAL");
		assertFalse(reg.optimiseDeterminer(blocks, none, context).hasSpecifier());

		NounPhrase these = new NounPhrase(new Word("blocks", PartOfSpeech.NOUN), new Word("these",
				PartOfSpeech.DETERMINER));
		these.setFeature(Features.NUMBER, "PLURAL");
		assertEquals("these blocks", surface(reg.optimiseDeterminer(these, none, context)));

		NounPhrase definite = new NounPhrase(new Word("block", PartOfSpeech.NOUN), new Word("the",
				PartOfSpeech.DETERMINER));
		assertEquals("the block", surface(reg.optimiseDeterminer(definite, none, context)));

		NounPhrase given = new NounPhrase(new Word("block", PartOfSpeech.NOUN), new Word("this",
				PartOfSpeech.DETERMINER));
		assertEquals("a block", surface(reg.optimiseDeterminer(given, none, context)));

		// an indefinite repeat of the only phrase with its head turns definite
		NounPhrase repeated = new NounPhrase(new Word("block", PartOfSpeech.NOUN), new Word("a",
				PartOfSpeech.DETERMINER));
		assertEquals("the block", surface(reg.optimiseDeterminer(repeated, Collections.<Element> singletonList(
				repeated.copy()), context)));

		NounPhrase name = new NounPhrase(new Text("John"), new Word("the", PartOfSpeech.DETERMINER));
		name.setFeature(Features.PROPER, Features.TRUE);
		assertEquals("John", surface(reg.optimiseDeterminer(name, none, context)));
	}

	@Test
	public void testPronounFeaturesOfPhraseTakePrecedence() {
		DiscourseContext context = new DiscourseContext();
		NounPhrase ship = new NounPhrase(new Word("ship", PartOfSpeech.NOUN));
		ship.setFeature("gender", "female");
		ship.setFeature(Features.DISCOURSE_FUNCTION, Features.OBJECT);
		Word pronoun = generator().pronominalise(ship, Gender.NEUTER, NumberAgreement.SINGULAR, Person.THIRD,
				PronounUse.OBJECTIVE, context);
		assertEquals("her", pronoun.getWord());
		assertEquals(Features.OBJECT, pronoun.getFeature(Features.DISCOURSE_FUNCTION).get());

		Word epicene = generator().pronominalise(new NounPhrase(new Text("Kim")), Gender.EPICENE,
				NumberAgreement.SINGULAR, Person.THIRD, PronounUse.SUBJECTIVE, context);
		assertEquals("they", epicene.getWord());
	}

	@Test
	public void testDocument() {
		Message message = new Message("sequence", falls("block1"), isRed("block1"));
		Document document = new Document(new Text("Blocks"), new Section(null, new Paragraph(message)));

		generator().generate(document, new DiscourseContext());
		assertEquals(new Text("Blocks"), document.getTitle());
		List<Element> sentences = message.getSentences();
		assertEquals("the block fall", surface(sentences.get(0)));
		assertEquals("it is red", surface(sentences.get(1)));
	}

	@Test
	public void testDocumentsInParallel() throws Exception {
		final ReferringExpressionGenerator reg = generator();
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Future<String>> results = new ArrayList<>();
			for (int i = 0; i < 8; i++) {
				results.add(executor.submit(new Callable<String>() {
					@Override
					public String call() {
						Message message = new Message("sequence", falls("block1"), isRed("block1"), falls("table1"));
						reg.generate(new Paragraph(message), new DiscourseContext());
						List<String> surfaces = new ArrayList<>();
						for (Element sentence : message.getSentences()) {
							surfaces.add(surface(sentence));
						}
						return surfaces.toString();
					}
				}));
			}
			for (Future<String> result : results) {
				assertEquals("[the block fall, it is red, the table fall]", result.get());
			}
		} finally {
			executor.shutdown();
		}
	}
}
