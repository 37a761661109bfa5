package org.aksw.refexp.structures;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * An argument slot of a template. Once bound, the value is what the placeholder
 * refers to; an unbound placeholder refers to a noun named after its id.
 */
public class Placeholder extends Element {

	private final String id;
	private Element value;

	public Placeholder(String id) {
		this(id, null);
	}

	public Placeholder(String id, Element value) {
		super(ElementType.PLACEHOLDER);
		this.id = Preconditions.checkNotNull(id);
		setValue(value);
	}

	protected Placeholder(Placeholder other) {
		super(other);
		this.id = other.id;
		if (other.value != null) {
			setValue(other.value.copy());
		}
	}

	public String getId() {
		return id;
	}

	/**
	 * @return the bound value, or null
	 */
	public Element getValue() {
		return value;
	}

	public void setValue(Element value) {
		this.value = value;
		if (value != null) {
			value.setParent(this);
		}
	}

	public boolean isBound() {
		return value != null;
	}

	/**
	 * @return the bound value, or a noun made of the id
	 */
	public Element getReferent() {
		return value != null ? value : new Word(id, PartOfSpeech.NOUN);
	}

	@Override
	public String getString() {
		return value != null ? value.getString() : id;
	}

	@Override
	public Placeholder copy() {
		return new Placeholder(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Placeholder)) {
			return false;
		}
		Placeholder other = (Placeholder) obj;
		return featuresEqual(other) && id.equals(other.id) && Objects.equal(value, other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(featuresHashCode(), id, value);
	}
}
