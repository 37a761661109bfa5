package org.aksw.refexp.lexicon;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.aksw.refexp.structures.Coordination;
import org.aksw.refexp.structures.Element;
import org.aksw.refexp.structures.ElementType;
import org.aksw.refexp.structures.Features;
import org.aksw.refexp.structures.NounPhrase;
import org.aksw.refexp.structures.PartOfSpeech;
import org.aksw.refexp.structures.Phrase;
import org.aksw.refexp.structures.Placeholder;
import org.aksw.refexp.structures.Word;
import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Logger;

import simplenlg.framework.LexicalCategory;
import simplenlg.framework.WordElement;

import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

/**
 * English pronouns, and gender and number guesses based on word lists and the
 * SimpleNLG default lexicon.
 */
public class EnglishLexicon implements Lexicon {

	private static final Logger logger = Logger.getLogger(EnglishLexicon.class.getName());

	/**
	 * Rows are the uses, columns are person, number and, for the third person singular, gender.
	 */
	private static final Table<PronounUse, String, String> PRONOUNS = ImmutableTable.<PronounUse, String, String> builder()
			.put(PronounUse.SUBJECTIVE, "FIRST_SINGULAR", "I")
			.put(PronounUse.SUBJECTIVE, "FIRST_PLURAL", "we")
			.put(PronounUse.SUBJECTIVE, "SECOND_SINGULAR", "you")
			.put(PronounUse.SUBJECTIVE, "SECOND_PLURAL", "you")
			.put(PronounUse.SUBJECTIVE, "THIRD_SINGULAR_MASCULINE", "he")
			.put(PronounUse.SUBJECTIVE, "THIRD_SINGULAR_FEMININE", "she")
			.put(PronounUse.SUBJECTIVE, "THIRD_SINGULAR_NEUTER", "it")
			.put(PronounUse.SUBJECTIVE, "THIRD_SINGULAR_EPICENE", "they")
			.put(PronounUse.SUBJECTIVE, "THIRD_PLURAL", "they")
			.put(PronounUse.OBJECTIVE, "FIRST_SINGULAR", "me")
			.put(PronounUse.OBJECTIVE, "FIRST_PLURAL", "us")
			.put(PronounUse.OBJECTIVE, "SECOND_SINGULAR", "you")
			.put(PronounUse.OBJECTIVE, "SECOND_PLURAL", "you")
			.put(PronounUse.OBJECTIVE, "THIRD_SINGULAR_MASCULINE", "him")
			.put(PronounUse.OBJECTIVE, "THIRD_SINGULAR_FEMININE", "her")
			.put(PronounUse.OBJECTIVE, "THIRD_SINGULAR_NEUTER", "it")
			.put(PronounUse.OBJECTIVE, "THIRD_SINGULAR_EPICENE", "them")
			.put(PronounUse.OBJECTIVE, "THIRD_PLURAL", "them")
			.put(PronounUse.REFLEXIVE, "FIRST_SINGULAR", "myself")
			.put(PronounUse.REFLEXIVE, "FIRST_PLURAL", "ourselves")
			.put(PronounUse.REFLEXIVE, "SECOND_SINGULAR", "yourself")
			.put(PronounUse.REFLEXIVE, "SECOND_PLURAL", "yourselves")
			.put(PronounUse.REFLEXIVE, "THIRD_SINGULAR_MASCULINE", "himself")
			.put(PronounUse.REFLEXIVE, "THIRD_SINGULAR_FEMININE", "herself")
			.put(PronounUse.REFLEXIVE, "THIRD_SINGULAR_NEUTER", "itself")
			.put(PronounUse.REFLEXIVE, "THIRD_SINGULAR_EPICENE", "themselves")
			.put(PronounUse.REFLEXIVE, "THIRD_PLURAL", "themselves")
			.put(PronounUse.POSSESSIVE, "FIRST_SINGULAR", "mine")
			.put(PronounUse.POSSESSIVE, "FIRST_PLURAL", "ours")
			.put(PronounUse.POSSESSIVE, "SECOND_SINGULAR", "yours")
			.put(PronounUse.POSSESSIVE, "SECOND_PLURAL", "yours")
			.put(PronounUse.POSSESSIVE, "THIRD_SINGULAR_MASCULINE", "his")
			.put(PronounUse.POSSESSIVE, "THIRD_SINGULAR_FEMININE", "hers")
			.put(PronounUse.POSSESSIVE, "THIRD_SINGULAR_NEUTER", "its")
			.put(PronounUse.POSSESSIVE, "THIRD_SINGULAR_EPICENE", "theirs")
			.put(PronounUse.POSSESSIVE, "THIRD_PLURAL", "theirs")
			.build();

	private static final Map<String, Gender> PRONOUN_GENDERS = new HashMap<>();
	private static final Map<String, NumberAgreement> PRONOUN_NUMBERS = new HashMap<>();

	static {
		for (Table.Cell<PronounUse, String, String> cell : PRONOUNS.cellSet()) {
			String pronoun = cell.getValue().toLowerCase(Locale.ENGLISH);
			String column = cell.getColumnKey();
			if (column.startsWith("THIRD_SINGULAR_")) {
				Gender gender = Gender.valueOf(column.substring("THIRD_SINGULAR_".length()));
				// singular they is counted as plural
				if (gender != Gender.EPICENE) {
					PRONOUN_GENDERS.put(pronoun, gender);
					PRONOUN_NUMBERS.put(pronoun, NumberAgreement.SINGULAR);
				}
			} else {
				if (!PRONOUN_GENDERS.containsKey(pronoun)) {
					PRONOUN_GENDERS.put(pronoun, Gender.EPICENE);
				}
				if (!PRONOUN_NUMBERS.containsKey(pronoun)) {
					PRONOUN_NUMBERS.put(pronoun,
							column.endsWith("_PLURAL") && !column.startsWith("SECOND") ? NumberAgreement.PLURAL
									: NumberAgreement.SINGULAR);
				}
			}
		}
	}

	private final GenderDetector genderDetector;
	private final simplenlg.lexicon.Lexicon nlgLexicon;

	public EnglishLexicon() {
		this(new LexiconBasedGenderDetector(), simplenlg.lexicon.Lexicon.getDefaultLexicon());
	}

	public EnglishLexicon(GenderDetector genderDetector, simplenlg.lexicon.Lexicon nlgLexicon) {
		this.genderDetector = genderDetector;
		this.nlgLexicon = nlgLexicon;
	}

	@Override
	public Gender guessPhraseGender(Element phrase) {
		Optional<Gender> explicit = parse(Gender.class, phrase.getFeature(Features.GENDER));
		if (explicit.isPresent()) {
			return explicit.get();
		}
		switch (phrase.getType()) {
		case EMPTY:
			return Gender.NEUTER;
		case COORDINATION:
			Gender common = null;
			for (Element coordinate : ((Coordination) phrase).getCoordinates()) {
				Gender gender = guessPhraseGender(coordinate);
				if (common == null) {
					common = gender;
				} else if (common != gender) {
					return Gender.EPICENE;
				}
			}
			return common == null ? Gender.NEUTER : common;
		case PLACEHOLDER:
			return guessPhraseGender(((Placeholder) phrase).getReferent());
		case TEXT:
		case WORD:
			return guessWordGender(phrase, false);
		case CLAUSE:
			return Gender.NEUTER;
		default:
			Element head = ((Phrase) phrase).getHead();
			if (head.getType() == ElementType.TEXT || head.getType() == ElementType.WORD) {
				boolean proper = phrase.hasFeature(Features.PROPER, Features.TRUE);
				return guessWordGender(head, proper);
			}
			return guessPhraseGender(head);
		}
	}

	private Gender guessWordGender(Element leaf, boolean proper) {
		Optional<Gender> explicit = parse(Gender.class, leaf.getFeature(Features.GENDER));
		if (explicit.isPresent()) {
			return explicit.get();
		}
		String text = StringUtils.trimToEmpty(leaf.getString());
		if (text.isEmpty()) {
			return Gender.NEUTER;
		}
		Gender pronounGender = PRONOUN_GENDERS.get(text.toLowerCase(Locale.ENGLISH));
		if (pronounGender != null && (leaf.getType() != ElementType.WORD || ((Word) leaf).isPronoun())) {
			return pronounGender;
		}
		proper |= Character.isUpperCase(text.charAt(0));
		// first names decide the gender of full names
		String name = proper ? StringUtils.split(text)[0] : text;
		Optional<Gender> detected = genderDetector.getGender(name);
		if (detected.isPresent()) {
			return detected.get();
		}
		return proper ? Gender.EPICENE : Gender.NEUTER;
	}

	@Override
	public NumberAgreement guessPhraseNumber(Element phrase) {
		Optional<NumberAgreement> explicit = parse(NumberAgreement.class, phrase.getFeature(Features.NUMBER));
		if (explicit.isPresent()) {
			return explicit.get();
		}
		switch (phrase.getType()) {
		case COORDINATION:
			Coordination coordination = (Coordination) phrase;
			List<Element> coordinates = coordination.getCoordinates();
			if (coordinates.size() > 1 && Coordination.DEFAULT_CONJUNCTION.equals(coordination.getConjunction())) {
				return NumberAgreement.PLURAL;
			}
			return coordinates.isEmpty() ? NumberAgreement.SINGULAR : guessPhraseNumber(coordinates.get(coordinates
					.size() - 1));
		case PLACEHOLDER:
			return guessPhraseNumber(((Placeholder) phrase).getReferent());
		case WORD:
			return guessWordNumber((Word) phrase);
		case NOUN_PHRASE:
			if (phrase.hasFeature(Features.PROPER, Features.TRUE)) {
				return NumberAgreement.SINGULAR;
			}
			return guessPhraseNumber(((NounPhrase) phrase).getHead());
		case VERB_PHRASE:
		case PREPOSITIONAL_PHRASE:
		case ADJECTIVE_PHRASE:
		case ADVERB_PHRASE:
			return guessPhraseNumber(((Phrase) phrase).getHead());
		default:
			return NumberAgreement.SINGULAR;
		}
	}

	private NumberAgreement guessWordNumber(Word word) {
		String text = word.getWord().toLowerCase(Locale.ENGLISH);
		if (word.isPronoun()) {
			NumberAgreement number = PRONOUN_NUMBERS.get(text);
			return number != null ? number : NumberAgreement.SINGULAR;
		}
		if (PartOfSpeech.NOUN.equals(word.getPos()) && !text.isEmpty() && !Character.isUpperCase(word.getWord().charAt(0))) {
			WordElement entry = nlgLexicon.getWordFromVariant(text, LexicalCategory.NOUN);
			if (entry != null && entry.getBaseForm() != null && !text.equals(entry.getBaseForm())) {
				logger.debug("Plural noun " + text + " of " + entry.getBaseForm());
				return NumberAgreement.PLURAL;
			}
		}
		return NumberAgreement.SINGULAR;
	}

	@Override
	public Word pronounForFeatures(Map<String, String> features) {
		Person person = parse(Person.class, features.get(Features.PERSON)).or(Person.THIRD);
		NumberAgreement number = parse(NumberAgreement.class, features.get(Features.NUMBER)).or(
				NumberAgreement.SINGULAR);
		Gender gender = parse(Gender.class, features.get(Features.GENDER)).or(Gender.NEUTER);
		PronounUse use = parse(PronounUse.class, features.get(Features.CASE)).or(PronounUse.SUBJECTIVE);

		String column = person.name() + "_" + number.name();
		if (person == Person.THIRD && number == NumberAgreement.SINGULAR) {
			column += "_" + gender.name();
		}
		Word pronoun = new Word(PRONOUNS.get(use, column), PartOfSpeech.PRONOUN);
		pronoun.setFeature(Features.PERSON, person.name());
		pronoun.setFeature(Features.NUMBER, number.name());
		pronoun.setFeature(Features.GENDER, gender.name());
		pronoun.setFeature(Features.CASE, use.name());
		return pronoun;
	}

	private static <E extends Enum<E>> Optional<E> parse(Class<E> type, Optional<String> value) {
		return value.isPresent() ? parse(type, value.get()) : Optional.<E> absent();
	}

	private static <E extends Enum<E>> Optional<E> parse(Class<E> type, String value) {
		if (value == null) {
			return Optional.absent();
		}
		return Enums.getIfPresent(type, value.trim().toUpperCase(Locale.ENGLISH));
	}
}
