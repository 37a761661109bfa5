package org.aksw.refexp.realisation;

import java.util.ArrayList;
import java.util.List;

import org.aksw.refexp.macroplanning.Document;
import org.aksw.refexp.macroplanning.Message;
import org.aksw.refexp.macroplanning.Paragraph;
import org.aksw.refexp.macroplanning.Section;
import org.aksw.refexp.structures.Element;
import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Logger;

import simplenlg.framework.CoordinatedPhraseElement;
import simplenlg.framework.DocumentElement;
import simplenlg.framework.NLGElement;
import simplenlg.framework.NLGFactory;
import simplenlg.lexicon.Lexicon;
import simplenlg.realiser.english.Realiser;

/**
 * Realises constituent trees and documents as English text with SimpleNLG.
 */
public class SimpleNLGRealiser {

	private static final Logger logger = Logger.getLogger(SimpleNLGRealiser.class.getName());

	private final NLGFactory nlgFactory;
	private final Realiser realiser;

	public SimpleNLGRealiser() {
		this(Lexicon.getDefaultLexicon());
	}

	public SimpleNLGRealiser(Lexicon lexicon) {
		this.nlgFactory = new NLGFactory(lexicon);
		this.realiser = new Realiser(lexicon);
	}

	/**
	 * Realises the element without sentence punctuation.
	 */
	public String realise(Element element) {
		NLGElement converted = convert(element);
		if (converted == null) {
			return "";
		}
		return realiser.realise(converted).getRealisation();
	}

	/**
	 * Realises the element as a sentence, capitalised and with a full stop.
	 */
	public String realiseSentence(Element element) {
		NLGElement converted = convert(element);
		if (converted == null) {
			return "";
		}
		String sentence = realiser.realiseSentence(converted);
		logger.debug("Realised " + element + " as \"" + sentence + "\"");
		return sentence;
	}

	/**
	 * Realises the document: the title, then each section's title and paragraphs.
	 */
	public String realise(Document document) {
		DocumentElement doc = document.getTitle() == null ? nlgFactory.createDocument() : nlgFactory
				.createDocument(realise(document.getTitle()));
		for (Section section : document.getSections()) {
			DocumentElement sec = section.getTitle() == null ? nlgFactory.createSection() : nlgFactory
					.createSection(realise(section.getTitle()));
			for (Paragraph paragraph : section.getParagraphs()) {
				sec.addComponent(toParagraph(paragraph));
			}
			doc.addComponent(sec);
		}
		return realiser.realise(doc).getRealisation().trim();
	}

	private DocumentElement toParagraph(Paragraph paragraph) {
		DocumentElement par = nlgFactory.createParagraph();
		for (Message message : paragraph.getMessages()) {
			for (NLGElement sentence : toSentences(message)) {
				par.addComponent(nlgFactory.createSentence(sentence));
			}
		}
		return par;
	}

	/**
	 * A message with a marker becomes a single sentence joined by the marker,
	 * otherwise every nucleus and satellite is a sentence of its own.
	 */
	private List<NLGElement> toSentences(Message message) {
		List<NLGElement> sentences = new ArrayList<>();
		for (Element sentence : message.getSentences()) {
			NLGElement converted = convert(sentence);
			if (converted != null) {
				sentences.add(converted);
			}
		}
		if (StringUtils.isNotBlank(message.getMarker()) && sentences.size() > 1) {
			CoordinatedPhraseElement joined = nlgFactory.createCoordinatedPhrase();
			for (NLGElement sentence : sentences) {
				joined.addCoordinate(sentence);
			}
			joined.setConjunction(message.getMarker().trim());
			sentences.clear();
			sentences.add(joined);
		}
		return sentences;
	}

	private NLGElement convert(Element element) {
		return new SimpleNLGConverter(nlgFactory).convert(element);
	}
}
