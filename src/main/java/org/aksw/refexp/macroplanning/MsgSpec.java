package org.aksw.refexp.macroplanning;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.aksw.refexp.structures.Element;
import org.aksw.refexp.structures.Text;

import com.google.common.base.Preconditions;

/**
 * A message specification. The name selects the template that lexicalises the
 * message, the values fill the placeholders of that template.
 */
public abstract class MsgSpec {

	private final String name;
	private final Map<String, String> features = new LinkedHashMap<>();
	private final Map<String, Element> values = new HashMap<>();

	protected MsgSpec(String name) {
		this.name = Preconditions.checkNotNull(name);
	}

	public String getName() {
		return name;
	}

	public Map<String, String> getFeatures() {
		return features;
	}

	public void setFeature(String key, String value) {
		features.put(key, value);
	}

	/**
	 * Registers a named value, text is wrapped as {@link Text}.
	 */
	public void putValue(String key, Object value) {
		values.put(key, toElement(value));
	}

	/**
	 * Returns the value for a placeholder key.
	 *
	 * @throws MalformedArgumentReferenceException if the message has no such value
	 */
	public Element valueFor(String key) {
		Element value = values.get(key);
		if (value == null) {
			throw new MalformedArgumentReferenceException("Cannot find value for key: " + key + " in message " + name);
		}
		return value;
	}

	protected static Element toElement(Object value) {
		Preconditions.checkNotNull(value);
		if (value instanceof Element) {
			return (Element) value;
		}
		return new Text(value.toString());
	}

	@Override
	public String toString() {
		return name;
	}
}
