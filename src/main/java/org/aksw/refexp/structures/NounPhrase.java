package org.aksw.refexp.structures;

import java.util.Iterator;

import com.google.common.base.Predicate;
import com.google.common.collect.Iterators;

/**
 * A noun phrase. The specifier holds the determiner, if any.
 */
public class NounPhrase extends Phrase {

	private Element specifier;

	public NounPhrase() {
		this(null, null);
	}

	public NounPhrase(Element head) {
		this(head, null);
	}

	public NounPhrase(Element head, Element specifier) {
		super(ElementType.NOUN_PHRASE, head);
		setSpecifier(specifier);
	}

	protected NounPhrase(NounPhrase other) {
		super(other);
		specifier = copyOf(other.specifier, this);
	}

	public Element getSpecifier() {
		return specifier;
	}

	/**
	 * Sets the specifier; null clears it.
	 */
	public void setSpecifier(Element specifier) {
		this.specifier = specifier == null ? new EmptyElement() : specifier;
		this.specifier.setParent(this);
	}

	public boolean hasSpecifier() {
		return !specifier.isEmpty();
	}

	@Override
	public Iterator<Element> constituents() {
		return Iterators.concat(Iterators.singletonIterator((Element) this), specifier.constituents(),
				slotConstituents());
	}

	@Override
	protected boolean replace(Predicate<Element> matcher, Element replacement) {
		if (super.replace(matcher, replacement)) {
			return true;
		}
		if (matcher.apply(specifier)) {
			specifier.setParent(null);
			setSpecifier(replacement);
			return true;
		}
		return specifier.replace(matcher, replacement);
	}

	@Override
	public NounPhrase copy() {
		return new NounPhrase(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (!super.equals(obj)) {
			return false;
		}
		return specifier.equals(((NounPhrase) obj).specifier);
	}

	@Override
	public int hashCode() {
		return 31 * super.hashCode() + specifier.hashCode();
	}
}
