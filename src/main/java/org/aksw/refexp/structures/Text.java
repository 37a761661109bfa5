package org.aksw.refexp.structures;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Canned text that is passed through realisation unchanged.
 */
public class Text extends Element {

	private String value;

	public Text(String value) {
		super(ElementType.TEXT);
		this.value = Preconditions.checkNotNull(value);
	}

	protected Text(Text other) {
		super(other);
		this.value = other.value;
	}

	public String getValue() {
		return value;
	}

	public void setValue(String value) {
		this.value = Preconditions.checkNotNull(value);
	}

	@Override
	public String getString() {
		return value;
	}

	@Override
	public Text copy() {
		return new Text(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Text)) {
			return false;
		}
		Text other = (Text) obj;
		return featuresEqual(other) && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(featuresHashCode(), value);
	}
}
