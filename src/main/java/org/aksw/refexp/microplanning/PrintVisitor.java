package org.aksw.refexp.microplanning;

import java.util.ArrayDeque;
import java.util.Deque;

import com.google.common.base.Strings;

/**
 * Base class of the visitors that write a tree as text. Keeps the stack of
 * labels of the slots being written, which also gives the indentation depth.
 */
public abstract class PrintVisitor implements ElementVisitor {

	private final Deque<String> ancestors = new ArrayDeque<>();
	private final String rootLabel;
	protected final String indent;
	protected final StringBuilder text = new StringBuilder();

	protected PrintVisitor() {
		this("child", "  ");
	}

	protected PrintVisitor(String rootLabel, String indent) {
		this.rootLabel = rootLabel;
		this.indent = indent;
	}

	/**
	 * Starts writing the slot with the given label.
	 */
	public void enter(String label) {
		ancestors.push(label);
	}

	/**
	 * Finishes the slot last entered.
	 *
	 * @throws IllegalStateException if there is no such slot
	 */
	public String exit() {
		if (ancestors.isEmpty()) {
			throw new IllegalStateException("exit() called without matching enter()");
		}
		return ancestors.pop();
	}

	/**
	 * @return the label of the slot being written
	 */
	public String currentLabel() {
		return ancestors.isEmpty() ? rootLabel : ancestors.peek();
	}

	public int depth() {
		return ancestors.size();
	}

	protected String outerIndent() {
		return Strings.repeat(indent, depth());
	}

	protected String innerIndent() {
		return Strings.repeat(indent, depth() + 1);
	}

	@Override
	public String toString() {
		return text.toString();
	}
}
