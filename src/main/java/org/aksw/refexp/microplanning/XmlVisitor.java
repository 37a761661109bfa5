package org.aksw.refexp.microplanning;

import java.util.List;
import java.util.Map;

import org.aksw.refexp.structures.AdjectivePhrase;
import org.aksw.refexp.structures.AdverbPhrase;
import org.aksw.refexp.structures.Clause;
import org.aksw.refexp.structures.Coordination;
import org.aksw.refexp.structures.Element;
import org.aksw.refexp.structures.EmptyElement;
import org.aksw.refexp.structures.NounPhrase;
import org.aksw.refexp.structures.Phrase;
import org.aksw.refexp.structures.Placeholder;
import org.aksw.refexp.structures.PrepositionalPhrase;
import org.aksw.refexp.structures.Text;
import org.aksw.refexp.structures.VerbPhrase;
import org.aksw.refexp.structures.Word;

import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

/**
 * Writes elements in the XML request format understood by the SimpleNLG server.
 * Every slot becomes a nested block named after the slot, features become attributes.
 */
public class XmlVisitor extends PrintVisitor {

	public static final String HEADER = "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n"
			+ "<nlg:NLGSpec xmlns=\"http://simplenlg.googlecode.com/svn/trunk/res/xml\"\n"
			+ "xmlns:nlg=\"http://simplenlg.googlecode.com/svn/trunk/res/xml\"\n"
			+ "xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\"\n"
			+ "xsi:schemaLocation=\"http://simplenlg.googlecode.com/svn/trunk/res/xml \">\n"
			+ "<nlg:Request>\n\n"
			+ "<Document cat=\"PARAGRAPH\">\n";

	public static final String FOOTER = "\n</Document>\n</nlg:Request>\n</nlg:NLGSpec>";

	private static final Escaper ESCAPER = UrlEscapers.urlFormParameterEscaper();

	public XmlVisitor() {
		super("child", "  ");
	}

	/**
	 * Writes a single element wrapped in a complete request.
	 */
	public static String toXml(Element element) {
		XmlVisitor visitor = new XmlVisitor();
		element.accept(visitor);
		return visitor.toXml();
	}

	public String toXml() {
		return (HEADER + text + FOOTER).trim();
	}

	public void clear() {
		text.setLength(0);
	}

	@Override
	public void visitEmpty(EmptyElement element) {
	}

	@Override
	public void visitText(Text node) {
		text.append(outerIndent()).append('<').append(currentLabel())
				.append(" xsi:type=\"WordElement\" canned=\"true\"").append(attributes(node.getFeatures()))
				.append(">\n");
		text.append(innerIndent()).append("<base>").append(ESCAPER.escape(node.getValue())).append("</base>\n");
		closeTag();
	}

	@Override
	public void visitWord(Word node) {
		// SimpleNLG only inflects the base form
		String word = "is".equals(node.getWord()) ? "be" : node.getWord();
		text.append(outerIndent()).append('<').append(currentLabel()).append(" xsi:type=\"WordElement\" cat=\"")
				.append(node.getPos()).append('"').append(attributes(node.getFeatures())).append(">\n");
		text.append(innerIndent()).append("<base>").append(ESCAPER.escape(word)).append("</base>\n");
		closeTag();
	}

	@Override
	public void visitPlaceholder(Placeholder node) {
		node.getReferent().accept(this);
	}

	@Override
	public void visitClause(Clause node) {
		openTag("SPhraseSpec", node);
		processElements("frontMod", node.getFrontModifiers());
		processElements("preMod", node.getPreModifiers());
		processElement("subj", node.getSubject());
		processElement("vp", node.getPredicate());
		processElements("compl", node.getComplements());
		processElements("postMod", node.getPostModifiers());
		closeTag();
	}

	@Override
	public void visitCoordination(Coordination node) {
		openTag("CoordinatedPhraseElement", node);
		processElements("coord", node.getCoordinates());
		closeTag();
	}

	@Override
	public void visitNounPhrase(NounPhrase node) {
		openTag("NPPhraseSpec", node);
		processElement("spec", node.getSpecifier());
		processPhraseSlots(node);
		closeTag();
	}

	@Override
	public void visitVerbPhrase(VerbPhrase node) {
		phrase("VPPhraseSpec", node);
	}

	@Override
	public void visitPrepositionalPhrase(PrepositionalPhrase node) {
		phrase("PPPhraseSpec", node);
	}

	@Override
	public void visitAdjectivePhrase(AdjectivePhrase node) {
		phrase("AdjPhraseSpec", node);
	}

	@Override
	public void visitAdverbPhrase(AdverbPhrase node) {
		phrase("AdvPhraseSpec", node);
	}

	private void phrase(String type, Phrase node) {
		openTag(type, node);
		processPhraseSlots(node);
		closeTag();
	}

	private void processPhraseSlots(Phrase node) {
		processElements("frontMod", node.getFrontModifiers());
		processElements("preMod", node.getPreModifiers());
		processElement("head", node.getHead());
		processElements("compl", node.getComplements());
		processElements("postMod", node.getPostModifiers());
	}

	private void processElement(String label, Element element) {
		enter(label);
		element.accept(this);
		exit();
	}

	private void processElements(String label, List<Element> elements) {
		for (Element element : elements) {
			processElement(label, element);
		}
	}

	private void openTag(String type, Element node) {
		text.append(outerIndent()).append('<').append(currentLabel()).append(" xsi:type=\"").append(type)
				.append('"').append(attributes(node.getFeatures())).append(">\n");
	}

	private void closeTag() {
		text.append(outerIndent()).append("</").append(currentLabel()).append(">\n");
	}

	private static String attributes(Map<String, String> features) {
		StringBuilder sb = new StringBuilder();
		for (Map.Entry<String, String> feature : features.entrySet()) {
			sb.append(' ').append(ESCAPER.escape(feature.getKey())).append("=\"")
					.append(ESCAPER.escape(feature.getValue())).append('"');
		}
		return sb.toString();
	}
}
