package org.aksw.refexp.reg;

import org.aksw.refexp.structures.Element;

/**
 * What was decided about an entity when it was first mentioned: whether its
 * type alone identifies it, and the expression to build on for later mentions.
 */
public class Referent {

	private final boolean unique;
	private final Element expression;

	public Referent(boolean unique, Element expression) {
		this.unique = unique;
		this.expression = expression;
	}

	public boolean isUnique() {
		return unique;
	}

	public Element getExpression() {
		return expression;
	}

	@Override
	public String toString() {
		return (unique ? "unique " : "") + expression;
	}
}
