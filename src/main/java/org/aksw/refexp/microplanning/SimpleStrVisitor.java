package org.aksw.refexp.microplanning;

import java.util.List;

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

import com.google.common.base.CharMatcher;

/**
 * Concatenates the words of a tree in slot order, without any inflection.
 */
public class SimpleStrVisitor extends PrintVisitor {

	public static String toSurface(Element element) {
		SimpleStrVisitor visitor = new SimpleStrVisitor();
		element.accept(visitor);
		return visitor.toString();
	}

	@Override
	public void visitEmpty(EmptyElement element) {
	}

	@Override
	public void visitText(Text node) {
		append(node.getValue());
	}

	@Override
	public void visitWord(Word node) {
		append(node.getWord());
	}

	@Override
	public void visitPlaceholder(Placeholder node) {
		node.getReferent().accept(this);
	}

	@Override
	public void visitClause(Clause node) {
		all(node.getFrontModifiers());
		all(node.getPreModifiers());
		node.getSubject().accept(this);
		node.getPredicate().accept(this);
		all(node.getComplements());
		all(node.getPostModifiers());
	}

	@Override
	public void visitCoordination(Coordination node) {
		List<Element> coordinates = node.getCoordinates();
		for (int i = 0; i < coordinates.size(); i++) {
			if (i > 0 && i == coordinates.size() - 1) {
				append(node.getConjunction());
			} else if (i > 0) {
				text.append(',');
			}
			coordinates.get(i).accept(this);
		}
	}

	@Override
	public void visitNounPhrase(NounPhrase node) {
		node.getSpecifier().accept(this);
		phrase(node);
	}

	@Override
	public void visitVerbPhrase(VerbPhrase node) {
		phrase(node);
	}

	@Override
	public void visitPrepositionalPhrase(PrepositionalPhrase node) {
		phrase(node);
	}

	@Override
	public void visitAdjectivePhrase(AdjectivePhrase node) {
		phrase(node);
	}

	@Override
	public void visitAdverbPhrase(AdverbPhrase node) {
		phrase(node);
	}

	private void phrase(Phrase node) {
		all(node.getFrontModifiers());
		all(node.getPreModifiers());
		node.getHead().accept(this);
		all(node.getComplements());
		all(node.getPostModifiers());
	}

	private void all(List<Element> elements) {
		for (Element element : elements) {
			element.accept(this);
		}
	}

	private void append(String word) {
		if (text.length() > 0) {
			text.append(' ');
		}
		text.append(word);
	}

	@Override
	public String toString() {
		return CharMatcher.WHITESPACE.trimAndCollapseFrom(text, ' ');
	}
}
