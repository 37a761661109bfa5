package org.aksw.refexp.structures;

/**
 * Stands in for an unset slot, e.g. a noun phrase without specifier.
 */
public class EmptyElement extends Element {

	public EmptyElement() {
		super(ElementType.EMPTY);
	}

	protected EmptyElement(EmptyElement other) {
		super(other);
	}

	@Override
	public boolean isEmpty() {
		return true;
	}

	@Override
	public EmptyElement copy() {
		return new EmptyElement(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof EmptyElement)) {
			return false;
		}
		return featuresEqual((EmptyElement) obj);
	}

	@Override
	public int hashCode() {
		return featuresHashCode();
	}
}
