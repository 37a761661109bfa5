package org.aksw.refexp.realisation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.aksw.refexp.microplanning.ElementVisitor;
import org.aksw.refexp.structures.AdjectivePhrase;
import org.aksw.refexp.structures.AdverbPhrase;
import org.aksw.refexp.structures.Clause;
import org.aksw.refexp.structures.Coordination;
import org.aksw.refexp.structures.Element;
import org.aksw.refexp.structures.EmptyElement;
import org.aksw.refexp.structures.Features;
import org.aksw.refexp.structures.NounPhrase;
import org.aksw.refexp.structures.Phrase;
import org.aksw.refexp.structures.Placeholder;
import org.aksw.refexp.structures.PrepositionalPhrase;
import org.aksw.refexp.structures.Text;
import org.aksw.refexp.structures.VerbPhrase;
import org.aksw.refexp.structures.Word;
import org.apache.log4j.Logger;

import simplenlg.features.Feature;
import simplenlg.features.Gender;
import simplenlg.features.LexicalFeature;
import simplenlg.features.NumberAgreement;
import simplenlg.features.Person;
import simplenlg.features.Tense;
import simplenlg.framework.CoordinatedPhraseElement;
import simplenlg.framework.LexicalCategory;
import simplenlg.framework.NLGElement;
import simplenlg.framework.NLGFactory;
import simplenlg.framework.PhraseElement;
import simplenlg.framework.StringElement;
import simplenlg.phrasespec.AdjPhraseSpec;
import simplenlg.phrasespec.AdvPhraseSpec;
import simplenlg.phrasespec.NPPhraseSpec;
import simplenlg.phrasespec.PPPhraseSpec;
import simplenlg.phrasespec.SPhraseSpec;
import simplenlg.phrasespec.VPPhraseSpec;

import com.google.common.base.Enums;
import com.google.common.base.Optional;

/**
 * Converts constituent trees into SimpleNLG elements. Empty elements convert to null
 * and are left out of their parents.
 */
public class SimpleNLGConverter implements ElementVisitor {

	private static final Logger logger = Logger.getLogger(SimpleNLGConverter.class.getName());

	private final NLGFactory nlgFactory;
	private NLGElement result;

	public SimpleNLGConverter(NLGFactory nlgFactory) {
		this.nlgFactory = nlgFactory;
	}

	/**
	 * @return the SimpleNLG element, or null for an empty element
	 */
	public NLGElement convert(Element element) {
		result = null;
		element.accept(this);
		NLGElement converted = result;
		if (converted != null) {
			applyFeatures(element.getFeatures(), converted);
		}
		return converted;
	}

	@Override
	public void visitEmpty(EmptyElement element) {
		result = null;
	}

	@Override
	public void visitText(Text text) {
		result = new StringElement(text.getValue());
	}

	@Override
	public void visitWord(Word word) {
		if (word.isPronoun()) {
			// pronouns are already inflected
			result = new StringElement(word.getWord());
			return;
		}
		if (!word.getWord().equals(word.getBase())) {
			// keep the inflected form given by the word
			result = new StringElement(word.getWord());
			return;
		}
		LexicalCategory category = Enums.getIfPresent(LexicalCategory.class, word.getPos()).or(LexicalCategory.ANY);
		String base = word.getBase();
		if (category == LexicalCategory.VERB && "is".equals(base)) {
			base = "be";
		}
		if (word.getFeatures().isEmpty()) {
			result = nlgFactory.createWord(base, category);
		} else {
			// lexicon entries are shared, features go on an inflected copy
			result = nlgFactory.createInflectedWord(base, category);
		}
	}

	@Override
	public void visitPlaceholder(Placeholder placeholder) {
		result = convert(placeholder.getReferent());
	}

	@Override
	public void visitClause(Clause clause) {
		NLGElement subject = convert(clause.getSubject());
		NLGElement vp = convert(clause.getPredicate());
		SPhraseSpec sentence = nlgFactory.createClause(subject, vp);
		for (Element modifier : clause.getFrontModifiers()) {
			NLGElement converted = convert(modifier);
			if (converted != null) {
				sentence.addFrontModifier(converted);
			}
		}
		for (Element modifier : clause.getPreModifiers()) {
			NLGElement converted = convert(modifier);
			if (converted != null) {
				sentence.addPreModifier(converted);
			}
		}
		for (Element complement : clause.getComplements()) {
			NLGElement converted = convert(complement);
			if (converted != null) {
				sentence.addComplement(converted);
			}
		}
		for (Element modifier : clause.getPostModifiers()) {
			NLGElement converted = convert(modifier);
			if (converted != null) {
				sentence.addPostModifier(converted);
			}
		}
		result = sentence;
	}

	@Override
	public void visitCoordination(Coordination coordination) {
		CoordinatedPhraseElement coordinated = nlgFactory.createCoordinatedPhrase();
		for (Element coordinate : coordination.getCoordinates()) {
			NLGElement converted = convert(coordinate);
			if (converted != null) {
				coordinated.addCoordinate(converted);
			}
		}
		coordinated.setConjunction(coordination.getConjunction());
		result = coordinated;
	}

	@Override
	public void visitNounPhrase(NounPhrase phrase) {
		NPPhraseSpec np = nlgFactory.createNounPhrase();
		NLGElement specifier = convert(phrase.getSpecifier());
		NLGElement head = convert(phrase.getHead());
		if (head != null) {
			np.setHead(head);
		}
		if (specifier != null) {
			np.setSpecifier(specifier);
		}
		addModifiers(phrase, np);
		result = np;
	}

	@Override
	public void visitVerbPhrase(VerbPhrase phrase) {
		VPPhraseSpec vp = nlgFactory.createVerbPhrase();
		NLGElement head = convert(phrase.getHead());
		if (head != null) {
			vp.setVerb(head);
		}
		addModifiers(phrase, vp);
		result = vp;
	}

	@Override
	public void visitPrepositionalPhrase(PrepositionalPhrase phrase) {
		PPPhraseSpec pp = nlgFactory.createPrepositionPhrase();
		NLGElement head = convert(phrase.getHead());
		if (head != null) {
			pp.setPreposition(head);
		}
		addModifiers(phrase, pp);
		result = pp;
	}

	@Override
	public void visitAdjectivePhrase(AdjectivePhrase phrase) {
		AdjPhraseSpec adjp = nlgFactory.createAdjectivePhrase();
		NLGElement head = convert(phrase.getHead());
		if (head != null) {
			adjp.setAdjective(head);
		}
		addModifiers(phrase, adjp);
		result = adjp;
	}

	@Override
	public void visitAdverbPhrase(AdverbPhrase phrase) {
		AdvPhraseSpec advp = nlgFactory.createAdverbPhrase();
		NLGElement head = convert(phrase.getHead());
		if (head != null) {
			advp.setAdverb(head);
		}
		addModifiers(phrase, advp);
		result = advp;
	}

	private void addModifiers(Phrase phrase, PhraseElement target) {
		for (NLGElement modifier : convertAll(phrase.getFrontModifiers())) {
			target.addFrontModifier(modifier);
		}
		for (NLGElement modifier : convertAll(phrase.getPreModifiers())) {
			target.addPreModifier(modifier);
		}
		for (NLGElement complement : convertAll(phrase.getComplements())) {
			target.addComplement(complement);
		}
		for (NLGElement modifier : convertAll(phrase.getPostModifiers())) {
			target.addPostModifier(modifier);
		}
	}

	private List<NLGElement> convertAll(List<Element> elements) {
		List<NLGElement> converted = new ArrayList<>();
		for (Element element : elements) {
			NLGElement nlgElement = convert(element);
			if (nlgElement != null) {
				converted.add(nlgElement);
			}
		}
		return converted;
	}

	private void applyFeatures(Map<String, String> features, NLGElement element) {
		for (Map.Entry<String, String> feature : features.entrySet()) {
			String key = feature.getKey();
			String value = feature.getValue();
			if (Features.TENSE.equals(key)) {
				setEnumFeature(element, Feature.TENSE, Tense.class, value);
			} else if (Features.NUMBER.equals(key)) {
				setEnumFeature(element, Feature.NUMBER, NumberAgreement.class, value);
			} else if (Features.PERSON.equals(key)) {
				setEnumFeature(element, Feature.PERSON, Person.class, value);
			} else if (Features.GENDER.equals(key)) {
				setEnumFeature(element, LexicalFeature.GENDER, Gender.class, value);
			} else if (Features.NEGATED.equals(key)) {
				element.setFeature(Feature.NEGATED, Features.TRUE.equals(value));
			} else if (Features.POSSESSIVE.equals(key)) {
				element.setFeature(Feature.POSSESSIVE, Features.TRUE.equals(value));
			} else if (Features.PROPER.equals(key)) {
				element.setFeature(LexicalFeature.PROPER, Features.TRUE.equals(value));
			}
		}
	}

	private static <E extends Enum<E>> void setEnumFeature(NLGElement element, String feature, Class<E> type,
			String value) {
		Optional<E> parsed = Enums.getIfPresent(type, value);
		if (parsed.isPresent()) {
			element.setFeature(feature, parsed.get());
		} else {
			logger.debug("Ignoring " + feature + "=" + value + " of " + element);
		}
	}
}
