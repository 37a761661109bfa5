package org.aksw.refexp.macroplanning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.aksw.refexp.structures.Element;
import org.aksw.refexp.structures.Features;

import com.google.common.base.Joiner;

/**
 * A predicate with arguments, e.g. <code>on(block1, table)</code>. Placeholders
 * named by a number refer to the argument at that index.
 */
public class PredicateMsgSpec extends MsgSpec {

	private final List<Element> arguments = new ArrayList<>();

	public PredicateMsgSpec(String predicate, Object... arguments) {
		super(predicate);
		for (Object argument : arguments) {
			this.arguments.add(toElement(argument));
		}
	}

	public String getPredicate() {
		return getName();
	}

	public List<Element> getArguments() {
		return Collections.unmodifiableList(arguments);
	}

	public boolean isNegated() {
		return Features.TRUE.equals(getFeatures().get(Features.NEGATED));
	}

	/**
	 * Returns the argument with the given index, or the named value for other keys.
	 *
	 * @throws MalformedArgumentReferenceException if the index is out of range
	 */
	@Override
	public Element valueFor(String key) {
		int index;
		try {
			index = Integer.parseInt(key.trim());
		} catch (NumberFormatException e) {
			return super.valueFor(key);
		}
		if (index < 0 || index >= arguments.size()) {
			throw new MalformedArgumentReferenceException("Requested index (" + index
					+ ") is not within the arguments of the predicate \"" + this + "\"");
		}
		return arguments.get(index);
	}

	@Override
	public String toString() {
		if (arguments.isEmpty()) {
			return getName();
		}
		List<String> args = new ArrayList<>();
		for (Element argument : arguments) {
			args.add(argument.getString());
		}
		return (isNegated() ? "not " : "") + getName() + "(" + Joiner.on(", ").useForNull("?").join(args) + ")";
	}
}
