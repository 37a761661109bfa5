package org.aksw.refexp.microplanning;

import org.aksw.refexp.structures.AdjectivePhrase;
import org.aksw.refexp.structures.AdverbPhrase;
import org.aksw.refexp.structures.Clause;
import org.aksw.refexp.structures.Coordination;
import org.aksw.refexp.structures.EmptyElement;
import org.aksw.refexp.structures.NounPhrase;
import org.aksw.refexp.structures.Placeholder;
import org.aksw.refexp.structures.PrepositionalPhrase;
import org.aksw.refexp.structures.Text;
import org.aksw.refexp.structures.VerbPhrase;
import org.aksw.refexp.structures.Word;

/**
 * One method per element type. Elements dispatch to it via
 * {@link org.aksw.refexp.structures.Element#accept(ElementVisitor)}.
 */
public interface ElementVisitor {

	void visitEmpty(EmptyElement element);

	void visitText(Text text);

	void visitWord(Word word);

	void visitPlaceholder(Placeholder placeholder);

	void visitClause(Clause clause);

	void visitCoordination(Coordination coordination);

	void visitNounPhrase(NounPhrase phrase);

	void visitVerbPhrase(VerbPhrase phrase);

	void visitPrepositionalPhrase(PrepositionalPhrase phrase);

	void visitAdjectivePhrase(AdjectivePhrase phrase);

	void visitAdverbPhrase(AdverbPhrase phrase);
}
