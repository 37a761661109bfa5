package org.aksw.refexp.structures;

/**
 * A verb phrase. Its object is the complement marked with the discourse function
 * {@link Features#OBJECT}.
 */
public class VerbPhrase extends Phrase {

	public VerbPhrase() {
		super(ElementType.VERB_PHRASE);
	}

	public VerbPhrase(Element head) {
		super(ElementType.VERB_PHRASE, head);
	}

	public VerbPhrase(Element head, Element object) {
		this(head);
		setObject(object);
	}

	protected VerbPhrase(VerbPhrase other) {
		super(other);
	}

	/**
	 * @return the first complement marked as object, or null
	 */
	public Element getObject() {
		for (Element complement : getComplements()) {
			if (complement.hasFeature(Features.DISCOURSE_FUNCTION, Features.OBJECT)) {
				return complement;
			}
		}
		return null;
	}

	/**
	 * Replaces the current object, if any, and puts the new one in front of the other complements.
	 */
	public void setObject(Element object) {
		removeObject();
		object.setFeature(Features.DISCOURSE_FUNCTION, Features.OBJECT);
		addComplement(0, object);
	}

	public Element removeObject() {
		Element object = getObject();
		if (object != null) {
			replaceByHandle(object.getHandle(), null);
		}
		return object;
	}

	@Override
	public VerbPhrase copy() {
		return new VerbPhrase(this);
	}
}
