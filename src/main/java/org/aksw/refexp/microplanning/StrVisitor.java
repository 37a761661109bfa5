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

/**
 * Writes the structure of an element on a single line, e.g.
 * <code>NounPhrase(spec=Word(the, DETERMINER), head=Word(block, NOUN))</code>.
 * Empty slots are left out.
 */
public class StrVisitor extends PrintVisitor {

	private boolean firstSlot;

	@Override
	public void visitEmpty(EmptyElement element) {
		text.append("Empty");
		appendFeatures(element);
	}

	@Override
	public void visitText(Text node) {
		text.append("Text('").append(node.getValue()).append("')");
		appendFeatures(node);
	}

	@Override
	public void visitWord(Word node) {
		text.append("Word(").append(node.getWord()).append(", ").append(node.getPos()).append(')');
		appendFeatures(node);
	}

	@Override
	public void visitPlaceholder(Placeholder node) {
		text.append("Placeholder(").append(node.getId());
		if (node.isBound()) {
			text.append(", ");
			node.getValue().accept(this);
		}
		text.append(')');
		appendFeatures(node);
	}

	@Override
	public void visitClause(Clause node) {
		open("Clause");
		slots("front", node.getFrontModifiers());
		slots("pre", node.getPreModifiers());
		slot("subj", node.getSubject());
		slot("vp", node.getPredicate());
		slots("compl", node.getComplements());
		slots("post", node.getPostModifiers());
		close(node);
	}

	@Override
	public void visitCoordination(Coordination node) {
		open("Coordination");
		slots("coords", node.getCoordinates());
		slot("conj", new Text(node.getConjunction()));
		close(node);
	}

	@Override
	public void visitNounPhrase(NounPhrase node) {
		open("NounPhrase");
		slot("spec", node.getSpecifier());
		phraseSlots(node);
		close(node);
	}

	@Override
	public void visitVerbPhrase(VerbPhrase node) {
		phrase("VerbPhrase", node);
	}

	@Override
	public void visitPrepositionalPhrase(PrepositionalPhrase node) {
		phrase("PrepositionalPhrase", node);
	}

	@Override
	public void visitAdjectivePhrase(AdjectivePhrase node) {
		phrase("AdjectivePhrase", node);
	}

	@Override
	public void visitAdverbPhrase(AdverbPhrase node) {
		phrase("AdverbPhrase", node);
	}

	private void phrase(String name, Phrase node) {
		open(name);
		phraseSlots(node);
		close(node);
	}

	private void phraseSlots(Phrase node) {
		slots("front", node.getFrontModifiers());
		slots("pre", node.getPreModifiers());
		slot("head", node.getHead());
		slots("compl", node.getComplements());
		slots("post", node.getPostModifiers());
	}

	private void open(String name) {
		text.append(name).append('(');
		firstSlot = true;
	}

	private void close(Element node) {
		text.append(')');
		appendFeatures(node);
	}

	private void slot(String label, Element element) {
		if (element.isEmpty()) {
			return;
		}
		separate();
		enter(label);
		text.append(label).append('=');
		element.accept(this);
		exit();
		firstSlot = false;
	}

	private void slots(String label, List<Element> elements) {
		if (elements.isEmpty()) {
			return;
		}
		separate();
		enter(label);
		text.append(label).append("=[");
		for (int i = 0; i < elements.size(); i++) {
			if (i > 0) {
				text.append(", ");
			}
			firstSlot = true;
			elements.get(i).accept(this);
		}
		text.append(']');
		exit();
		firstSlot = false;
	}

	private void separate() {
		if (!firstSlot) {
			text.append(", ");
		}
	}

	private void appendFeatures(Element node) {
		Map<String, String> features = node.getFeatures();
		if (!features.isEmpty()) {
			text.append(features);
		}
	}
}
