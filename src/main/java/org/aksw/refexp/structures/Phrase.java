package org.aksw.refexp.structures;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.google.common.base.Objects;
import com.google.common.base.Predicate;
import com.google.common.collect.Iterators;

/**
 * A phrase: a head surrounded by modifiers and complements.
 */
public abstract class Phrase extends Element {

	private final List<Element> frontModifiers = new ArrayList<>();
	private final List<Element> preModifiers = new ArrayList<>();
	private Element head;
	private final List<Element> complements = new ArrayList<>();
	private final List<Element> postModifiers = new ArrayList<>();

	protected Phrase(ElementType type) {
		this(type, null);
	}

	protected Phrase(ElementType type, Element head) {
		super(type);
		setHead(head);
	}

	protected Phrase(Phrase other) {
		super(other);
		frontModifiers.addAll(copyOf(other.frontModifiers, this));
		preModifiers.addAll(copyOf(other.preModifiers, this));
		head = copyOf(other.head, this);
		complements.addAll(copyOf(other.complements, this));
		postModifiers.addAll(copyOf(other.postModifiers, this));
	}

	public Element getHead() {
		return head;
	}

	/**
	 * Sets the head; null clears it.
	 */
	public void setHead(Element head) {
		this.head = head == null ? new EmptyElement() : head;
		this.head.setParent(this);
	}

	public List<Element> getFrontModifiers() {
		return Collections.unmodifiableList(frontModifiers);
	}

	public List<Element> getPreModifiers() {
		return Collections.unmodifiableList(preModifiers);
	}

	public List<Element> getComplements() {
		return Collections.unmodifiableList(complements);
	}

	public List<Element> getPostModifiers() {
		return Collections.unmodifiableList(postModifiers);
	}

	public void addFrontModifier(Element modifier) {
		add(frontModifiers, modifier);
	}

	public void addPreModifier(Element modifier) {
		add(preModifiers, modifier);
	}

	public void addComplement(Element complement) {
		add(complements, complement);
	}

	public void addComplement(int index, Element complement) {
		complements.add(index, complement);
		complement.setParent(this);
	}

	public void addPostModifier(Element modifier) {
		add(postModifiers, modifier);
	}

	private void add(List<Element> slot, Element element) {
		slot.add(element);
		element.setParent(this);
	}

	@Override
	public String getString() {
		return null;
	}

	@Override
	public Iterator<Element> constituents() {
		return Iterators.concat(Iterators.singletonIterator((Element) this), slotConstituents());
	}

	/**
	 * The constituents of the slots, without the phrase itself.
	 */
	protected Iterator<Element> slotConstituents() {
		return Iterators.concat(constituentsOf(frontModifiers), constituentsOf(preModifiers), head.constituents(),
				constituentsOf(complements), constituentsOf(postModifiers));
	}

	@Override
	protected boolean replace(Predicate<Element> matcher, Element replacement) {
		if (replaceInListReversed(postModifiers, this, matcher, replacement)) {
			return true;
		}
		if (replaceInListReversed(complements, this, matcher, replacement)) {
			return true;
		}
		if (matcher.apply(head)) {
			head.setParent(null);
			setHead(replacement);
			return true;
		}
		if (head.replace(matcher, replacement)) {
			return true;
		}
		if (replaceInListReversed(preModifiers, this, matcher, replacement)) {
			return true;
		}
		return replaceInListReversed(frontModifiers, this, matcher, replacement);
	}

	@Override
	public abstract Phrase copy();

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Phrase)) {
			return false;
		}
		Phrase other = (Phrase) obj;
		return featuresEqual(other) && head.equals(other.head) && frontModifiers.equals(other.frontModifiers)
				&& preModifiers.equals(other.preModifiers) && complements.equals(other.complements)
				&& postModifiers.equals(other.postModifiers);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(featuresHashCode(), frontModifiers, preModifiers, head, complements, postModifiers);
	}
}
