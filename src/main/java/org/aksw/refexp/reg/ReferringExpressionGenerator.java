package org.aksw.refexp.reg;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.aksw.refexp.lexicon.Gender;
import org.aksw.refexp.lexicon.Lexicon;
import org.aksw.refexp.lexicon.NumberAgreement;
import org.aksw.refexp.lexicon.Person;
import org.aksw.refexp.lexicon.PronounUse;
import org.aksw.refexp.macroplanning.Document;
import org.aksw.refexp.macroplanning.Message;
import org.aksw.refexp.macroplanning.Paragraph;
import org.aksw.refexp.macroplanning.Section;
import org.aksw.refexp.ontology.Ontology;
import org.aksw.refexp.ontology.OntologyException;
import org.aksw.refexp.structures.Clause;
import org.aksw.refexp.structures.Element;
import org.aksw.refexp.structures.ElementType;
import org.aksw.refexp.structures.Features;
import org.aksw.refexp.structures.NounPhrase;
import org.aksw.refexp.structures.PartOfSpeech;
import org.aksw.refexp.structures.Placeholder;
import org.aksw.refexp.structures.Word;
import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Logger;

import com.google.common.base.Enums;
import com.google.common.base.Optional;

/**
 * Decides how entities are referred to: by name, by a definite or indefinite
 * description, or by a pronoun.
 * <p>
 * The first mention of an entity is described by its most specific type in the
 * ontology, with a definite article if no other entity shares that type. Later
 * mentions reuse that description. Within a sentence, a noun phrase that repeats
 * the most salient phrase of the same gender becomes a pronoun.
 * <p>
 * All discourse state lives in the {@link DiscourseContext} passed to each call,
 * so one generator can serve several documents at the same time.
 */
public class ReferringExpressionGenerator {

	private static final Pattern NUMBERED_NAME = Pattern.compile("([^0-9]+)([0-9]+)$");
	private static final String VOWELS = "aeiou";

	private final Lexicon lexicon;
	private final Ontology ontology;

	private boolean pronominalisation = true;
	private boolean distinguishByNumber = true;

	/**
	 * @param ontology may be null, entities are then referred to by their names
	 */
	public ReferringExpressionGenerator(Lexicon lexicon, Ontology ontology) {
		this.lexicon = lexicon;
		this.ontology = ontology;
	}

	/**
	 * Enables or disables the use of pronouns. Determiners are fixed either way.
	 */
	public void setPronominalisation(boolean pronominalisation) {
		this.pronominalisation = pronominalisation;
	}

	/**
	 * Entities sharing their type are told apart by the number their name ends
	 * with, e.g. "block 3", instead of getting an indefinite article. Enabled by
	 * default.
	 */
	public void setDistinguishByNumber(boolean distinguishByNumber) {
		this.distinguishByNumber = distinguishByNumber;
	}

	public Document generate(Document document, DiscourseContext context) {
		if (document.getTitle() != null) {
			document.setTitle(generateForElement(document.getTitle(), context));
		}
		for (Section section : document.getSections()) {
			generate(section, context);
		}
		return document;
	}

	public Section generate(Section section, DiscourseContext context) {
		if (section.getTitle() != null) {
			section.setTitle(generateForElement(section.getTitle(), context));
		}
		for (Paragraph paragraph : section.getParagraphs()) {
			generate(paragraph, context);
		}
		return section;
	}

	public Paragraph generate(Paragraph paragraph, DiscourseContext context) {
		for (Message message : paragraph.getMessages()) {
			generate(message, context);
		}
		return paragraph;
	}

	public Message generate(Message message, DiscourseContext context) {
		List<Element> sentences = message.getSentences();
		for (int i = 0; i < sentences.size(); i++) {
			message.setSentence(i, generateForElement(sentences.get(i), context));
		}
		return message;
	}

	/**
	 * Generates the referring expressions of a single sentence: every placeholder is
	 * replaced by an expression for the entity it stands for, then repeated mentions
	 * are turned into pronouns. The given element is not modified.
	 */
	public Element generateForElement(Element element, DiscourseContext context) {
		Element sentence = replacePlaceholders(element.copy(), context);
		return optimiseRefExp(sentence, context);
	}

	private Element replacePlaceholders(Element sentence, DiscourseContext context) {
		if (sentence.getType() == ElementType.PLACEHOLDER) {
			return generateRefExp(((Placeholder) sentence).getReferent(), context).copy();
		}
		for (Placeholder argument : sentence.arguments()) {
			Element refExp = generateRefExp(argument.getReferent(), context);
			context.getLogger().debug("Replacing argument " + argument.getId() + " with " + refExp);
			sentence.replaceByHandle(argument.getHandle(), refExp.copy());
		}
		return sentence;
	}

	/**
	 * Returns an expression referring to the entity named by the given text or word.
	 * Other elements are returned unchanged.
	 */
	public Element generateRefExp(Element referent, DiscourseContext context) {
		if (referent == null) {
			return null;
		}
		if (referent.getType() != ElementType.TEXT && referent.getType() != ElementType.WORD) {
			context.getLogger().debug("Not a referent, left as it is: " + referent);
			return referent;
		}
		if (!context.hasReferent(referent.getString())) {
			return doInitialReference(referent, context);
		}
		return doRepeatedReference(referent, context);
	}

	protected Element doInitialReference(Element referent, DiscourseContext context) {
		Logger logger = context.getLogger();
		String name = referent.getString();
		logger.debug("Initial reference to " + name);

		if (!name.isEmpty() && Character.isUpperCase(name.charAt(0))) {
			NounPhrase result = new NounPhrase(referent.copy());
			result.addFeatures(referent.getFeatures());
			result.setFeature(Features.PROPER, Features.TRUE);
			return result;
		}

		if (ontology == null) {
			logger.error("No ontology available to describe " + name + ", using its name.");
		} else {
			try {
				return describeByType(name, context);
			} catch (OntologyException e) {
				logger.error("Failed to look up the type of " + name + ", using its name.", e);
			} catch (RuntimeException e) {
				logger.error("Ontology failed while describing " + name + ", using its name.", e);
			}
		}
		NounPhrase result = new NounPhrase(referent.copy());
		context.putReferent(name, new Referent(false, result));
		return result;
	}

	private NounPhrase describeByType(String name, DiscourseContext context) throws OntologyException {
		Logger logger = context.getLogger();
		String entity = stripPrefix(name);
		String type = stripPrefix(ontology.bestEntityType(entity));
		// class names are capitalised, the noun is not
		NounPhrase result = new NounPhrase(new Word(StringUtils.uncapitalize(type), PartOfSpeech.NOUN));

		Set<String> distractors = ontology.entitiesOfType(type);
		logger.debug("Entities of type " + type + ": " + distractors);
		boolean unique = distractors.isEmpty()
				|| (distractors.size() == 1 && stripPrefix(distractors.iterator().next()).equals(entity));
		if (unique) {
			context.putReferent(name, new Referent(true, result.copy()));
			result.setSpecifier(new Word("the", PartOfSpeech.DETERMINER));
		} else {
			context.putReferent(name, new Referent(false, result));
			Matcher m = NUMBERED_NAME.matcher(entity);
			if (distinguishByNumber && m.find()) {
				result.addComplement(new Word(m.group(2), PartOfSpeech.ANY));
				result.setFeature(Features.PROPER, Features.TRUE);
			}
		}
		logger.debug("Described " + name + " as " + result);
		return result;
	}

	protected Element doRepeatedReference(Element referent, DiscourseContext context) {
		Referent cached = context.getReferent(referent.getString());
		context.getLogger().debug("Repeated reference to " + referent.getString() + ": " + cached);
		if (cached.isUnique()) {
			Element result = cached.getExpression().copy();
			if (result.getType() == ElementType.NOUN_PHRASE) {
				((NounPhrase) result).setSpecifier(new Word("the", PartOfSpeech.DETERMINER));
			}
			return result;
		}
		// shared with the cache, so later mentions see the same expression
		Element result = cached.getExpression();
		if (result.getType() == ElementType.NOUN_PHRASE && !result.hasFeature(Features.PROPER, Features.TRUE)) {
			((NounPhrase) result).setSpecifier(new Word("a", PartOfSpeech.DETERMINER));
		}
		return result;
	}

	/**
	 * Replaces noun phrases that repeat the most salient phrase of their gender by
	 * pronouns and fixes missing determiners. Returns a rewritten copy; the
	 * sentence is recorded in the context.
	 */
	public Element optimiseRefExp(Element phrase, DiscourseContext context) {
		Logger logger = context.getLogger();
		Element result = phrase.copy();

		List<Element> candidates = new ArrayList<>();
		Iterator<Element> it = result.constituents();
		while (it.hasNext()) {
			Element element = it.next();
			if (element.getType() == ElementType.NOUN_PHRASE || element.getType() == ElementType.COORDINATION) {
				candidates.add(element);
			}
		}
		Clause clause = result.getType() == ElementType.CLAUSE ? (Clause) result : null;

		List<Element> uttered = new ArrayList<>();
		Set<Long> processed = new HashSet<>();
		Map<Long, Element> pronouns = new LinkedHashMap<>();
		for (Element np : candidates) {
			if (processed.contains(np.getHandle())) {
				logger.debug("Already processed: " + np);
				continue;
			}
			Gender gender = lexicon.guessPhraseGender(np);
			NumberAgreement number = lexicon.guessPhraseNumber(np);
			Person person = personOf(np, context);

			List<Element> pool = new ArrayList<>(context.getSalienceStack());
			pool.addAll(uttered);
			List<Element> salient = new ArrayList<>();
			for (Element other : pool) {
				if (lexicon.guessPhraseGender(other) == gender) {
					salient.add(other);
				}
			}
			logger.debug("NP " + np + ": " + gender + ", " + number + ", " + person);

			if (pronominalisation && !salient.isEmpty() && salient.get(salient.size() - 1).equals(np)) {
				Word pronoun = pronominalise(np, gender, number, person, pronounUse(np, clause), context);
				logger.debug("Replacing " + np + " with " + pronoun);
				pronouns.put(np.getHandle(), pronoun);
				Iterator<Element> covered = np.constituents();
				while (covered.hasNext()) {
					processed.add(covered.next().getHandle());
				}
			} else {
				if (np.getType() == ElementType.NOUN_PHRASE) {
					optimiseDeterminer((NounPhrase) np, pool, context);
				}
				Element unspecified = np.copy();
				if (unspecified.getType() == ElementType.NOUN_PHRASE) {
					((NounPhrase) unspecified).setSpecifier(null);
				}
				uttered.add(unspecified);
			}
		}

		context.addSentence(result.copy());
		for (Map.Entry<Long, Element> pronoun : pronouns.entrySet()) {
			result.replaceByHandle(pronoun.getKey(), pronoun.getValue());
		}
		return result;
	}

	private Person personOf(Element np, DiscourseContext context) {
		Optional<String> explicit = np.getFeature(Features.PERSON);
		if (explicit.isPresent()) {
			String value = context.getFeatureTable().canonicalValue(Features.PERSON, explicit.get());
			Optional<Person> person = Enums.getIfPresent(Person.class, value);
			if (person.isPresent()) {
				return person.get();
			}
			context.getLogger().warn("Unknown person " + explicit.get() + " of " + np);
		}
		return context.isLastSpeaker(np) ? Person.FIRST : Person.THIRD;
	}

	/**
	 * The subject of the clause is subjective. A phrase inside the subject or the
	 * predicate that also occurs in the other one is reflexive, any other phrase of
	 * the predicate is objective.
	 */
	private PronounUse pronounUse(Element np, Clause clause) {
		if (clause == null) {
			return PronounUse.SUBJECTIVE;
		}
		if (clause.getSubject().getHandle() == np.getHandle()) {
			return PronounUse.SUBJECTIVE;
		}
		if (clause.getSubject().containsHandle(np.getHandle()) && clause.getPredicate().containsEqual(np)) {
			return PronounUse.REFLEXIVE;
		}
		if (clause.getPredicate().containsHandle(np.getHandle())) {
			if (clause.getSubject().containsEqual(np)) {
				return PronounUse.REFLEXIVE;
			}
			return PronounUse.OBJECTIVE;
		}
		return PronounUse.SUBJECTIVE;
	}

	/**
	 * Chooses the determiner of a noun phrase: "the" if the phrase is the only one
	 * mentioned before with its head, otherwise "a" or "an" for singular phrases
	 * that are not already definite. Plural phrases keep their determiner. Proper
	 * names and pronouns never get a determiner.
	 *
	 * @param pool the phrases mentioned before
	 */
	public NounPhrase optimiseDeterminer(NounPhrase phrase, List<Element> pool, DiscourseContext context) {
		Logger logger = context.getLogger();
		Element head = phrase.getHead();
		boolean pronounHead = head.getType() == ElementType.WORD && ((Word) head).isPronoun();
		if (phrase.hasFeature(Features.PROPER, Features.TRUE) || pronounHead) {
			logger.debug("Proper name or pronoun, no determiner: " + phrase);
			phrase.setSpecifier(null);
			return phrase;
		}
		List<Element> distractors = new ArrayList<>();
		for (Element other : pool) {
			if (other.getType() == ElementType.NOUN_PHRASE && head.equals(((NounPhrase) other).getHead())) {
				distractors.add(other);
			}
		}
		if (distractors.size() == 1 && distractors.get(0).equals(phrase)) {
			logger.debug("Last mentioned, definite: " + phrase);
			phrase.setSpecifier(new Word("the", PartOfSpeech.DETERMINER));
		} else if (isDefinite(phrase)) {
			logger.debug("Already definite: " + phrase);
		} else if (lexicon.guessPhraseNumber(phrase) != NumberAgreement.PLURAL) {
			String text = StringUtils.defaultString(head.getString());
			boolean vowel = !text.isEmpty() && VOWELS.indexOf(Character.toLowerCase(text.charAt(0))) >= 0;
			phrase.setSpecifier(new Word(vowel ? "an" : "a", PartOfSpeech.DETERMINER));
			logger.debug("Indefinite: " + phrase);
		}
		return phrase;
	}

	private static boolean isDefinite(NounPhrase phrase) {
		Element specifier = phrase.getSpecifier();
		return specifier.getType() == ElementType.WORD && "the".equalsIgnoreCase(((Word) specifier).getWord());
	}

	/**
	 * Builds the pronoun for a noun phrase. Phrases of epicene gender get plural
	 * pronouns. Features of the phrase itself take precedence.
	 */
	public Word pronominalise(Element np, Gender gender, NumberAgreement number, Person person, PronounUse use,
			DiscourseContext context) {
		Map<String, String> features = new LinkedHashMap<>();
		features.put(Features.PERSON, person.name());
		features.put(Features.CASE, use.name());
		if (gender == Gender.EPICENE) {
			features.put(Features.NUMBER, NumberAgreement.PLURAL.name());
		} else {
			features.put(Features.NUMBER, number.name());
			features.put(Features.GENDER, gender.name());
		}
		features.putAll(context.getFeatureTable().normalise(np.getFeatures()));
		context.getLogger().debug("Pronominalising " + np + " with " + features);
		Word pronoun = lexicon.pronounForFeatures(features);
		Optional<String> function = np.getFeature(Features.DISCOURSE_FUNCTION);
		if (function.isPresent()) {
			pronoun.setFeature(Features.DISCOURSE_FUNCTION, function.get());
		}
		return pronoun;
	}

	private static String stripPrefix(String name) {
		return StringUtils.removeStart(name, ":");
	}
}
