package org.aksw.refexp.structures;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.aksw.refexp.microplanning.ElementVisitor;
import org.aksw.refexp.microplanning.StrVisitor;

import com.google.common.base.Function;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.Iterators;

/**
 * Base class of all nodes of a constituent tree.
 * <p>
 * Every node has a feature map, a non-owning reference to its parent and a
 * handle that identifies the node itself, as opposed to its structure. Handles
 * are allocated from a process wide counter and are never reused, so a copy of
 * a node is equal to the node but never has the same handle.
 */
public abstract class Element {

	private static final AtomicLong HANDLES = new AtomicLong();

	static final Function<Element, Iterator<Element>> TO_CONSTITUENTS = new Function<Element, Iterator<Element>>() {
		@Override
		public Iterator<Element> apply(Element element) {
			return element.constituents();
		}
	};

	private final long handle = HANDLES.incrementAndGet();
	private final ElementType type;
	private final Map<String, String> features = new LinkedHashMap<>();
	private Element parent;

	protected Element(ElementType type) {
		this.type = Preconditions.checkNotNull(type);
	}

	/**
	 * Copies the type and the features of the given element. The parent is not copied.
	 */
	protected Element(Element other) {
		this(other.type);
		features.putAll(other.features);
	}

	public long getHandle() {
		return handle;
	}

	public ElementType getType() {
		return type;
	}

	public Element getParent() {
		return parent;
	}

	void setParent(Element parent) {
		this.parent = parent;
	}

	public Optional<String> getFeature(String key) {
		return Optional.fromNullable(features.get(key));
	}

	public boolean hasFeature(String key) {
		return features.containsKey(key);
	}

	public boolean hasFeature(String key, String value) {
		return value.equals(features.get(key));
	}

	public void setFeature(String key, String value) {
		features.put(Preconditions.checkNotNull(key), Preconditions.checkNotNull(value));
	}

	public void addFeatures(Map<String, String> features) {
		for (Map.Entry<String, String> entry : features.entrySet()) {
			setFeature(entry.getKey(), entry.getValue());
		}
	}

	public Optional<String> removeFeature(String key) {
		return Optional.fromNullable(features.remove(key));
	}

	/**
	 * @return a read-only view of the features of this element
	 */
	public Map<String, String> getFeatures() {
		return Collections.unmodifiableMap(features);
	}

	/**
	 * @return true for the empty element standing in for an unset slot
	 */
	public boolean isEmpty() {
		return false;
	}

	/**
	 * @return the surface text of a leaf, or null if the element has none
	 */
	public String getString() {
		return null;
	}

	/**
	 * Deep copy. The copy gets a fresh handle, has no parent and is equal to this element.
	 */
	public abstract Element copy();

	/**
	 * Returns this element followed by all its descendants, depth first and in slot order.
	 * The iterator is lazy, so the tree must not be modified while it is consumed.
	 */
	public Iterator<Element> constituents() {
		return Iterators.singletonIterator(this);
	}

	public final void accept(ElementVisitor visitor) {
		switch (type) {
		case EMPTY:
			visitor.visitEmpty((EmptyElement) this);
			break;
		case TEXT:
			visitor.visitText((Text) this);
			break;
		case WORD:
			visitor.visitWord((Word) this);
			break;
		case PLACEHOLDER:
			visitor.visitPlaceholder((Placeholder) this);
			break;
		case CLAUSE:
			visitor.visitClause((Clause) this);
			break;
		case COORDINATION:
			visitor.visitCoordination((Coordination) this);
			break;
		case NOUN_PHRASE:
			visitor.visitNounPhrase((NounPhrase) this);
			break;
		case VERB_PHRASE:
			visitor.visitVerbPhrase((VerbPhrase) this);
			break;
		case PREPOSITIONAL_PHRASE:
			visitor.visitPrepositionalPhrase((PrepositionalPhrase) this);
			break;
		case ADJECTIVE_PHRASE:
			visitor.visitAdjectivePhrase((AdjectivePhrase) this);
			break;
		case ADVERB_PHRASE:
			visitor.visitAdverbPhrase((AdverbPhrase) this);
			break;
		default:
			throw new IllegalStateException("No visit method for element type " + type);
		}
	}

	/**
	 * Replaces the first descendant that is equal to <code>target</code>.
	 *
	 * @param replacement the new element, or null to remove the matched one
	 * @return true if an element was replaced
	 */
	public boolean replace(final Element target, Element replacement) {
		Preconditions.checkNotNull(target);
		return replace(new Predicate<Element>() {
			@Override
			public boolean apply(Element element) {
				return target.equals(element);
			}
		}, replacement);
	}

	/**
	 * Replaces the descendant with the given handle.
	 *
	 * @param replacement the new element, or null to remove the matched one
	 * @return true if an element was replaced
	 */
	public boolean replaceByHandle(final long handle, Element replacement) {
		return replace(new Predicate<Element>() {
			@Override
			public boolean apply(Element element) {
				return element.getHandle() == handle;
			}
		}, replacement);
	}

	/**
	 * Leaves have no slots to search.
	 */
	protected boolean replace(Predicate<Element> matcher, Element replacement) {
		return false;
	}

	/**
	 * @return all placeholders of this tree in traversal order
	 */
	public List<Placeholder> arguments() {
		List<Placeholder> arguments = new ArrayList<>();
		Iterator<Element> it = constituents();
		while (it.hasNext()) {
			Element element = it.next();
			if (element.getType() == ElementType.PLACEHOLDER) {
				arguments.add((Placeholder) element);
			}
		}
		return arguments;
	}

	/**
	 * Replaces the first placeholder with the given id.
	 */
	public boolean replaceArgument(String id, Element replacement) {
		for (Placeholder placeholder : arguments()) {
			if (placeholder.getId().equals(id)) {
				return replaceByHandle(placeholder.getHandle(), replacement);
			}
		}
		return false;
	}

	/**
	 * Checks whether the handle belongs to this element or one of its descendants.
	 */
	public boolean containsHandle(long handle) {
		Iterator<Element> it = constituents();
		while (it.hasNext()) {
			if (it.next().getHandle() == handle) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Checks whether this element or one of its descendants is equal to the given one.
	 */
	public boolean containsEqual(Element element) {
		Iterator<Element> it = constituents();
		while (it.hasNext()) {
			if (it.next().equals(element)) {
				return true;
			}
		}
		return false;
	}

	protected boolean featuresEqual(Element other) {
		return type == other.type && features.equals(other.features);
	}

	protected int featuresHashCode() {
		return 31 * type.hashCode() + features.hashCode();
	}

	@Override
	public String toString() {
		StrVisitor visitor = new StrVisitor();
		accept(visitor);
		return visitor.toString();
	}

	static Iterator<Element> constituentsOf(List<Element> elements) {
		return Iterators.concat(Iterators.transform(elements.iterator(), TO_CONSTITUENTS));
	}

	static List<Element> copyOf(List<Element> elements, Element parent) {
		List<Element> copies = new ArrayList<>(elements.size());
		for (Element element : elements) {
			Element copy = element.copy();
			copy.setParent(parent);
			copies.add(copy);
		}
		return copies;
	}

	static Element copyOf(Element element, Element parent) {
		Element copy = element.copy();
		copy.setParent(parent);
		return copy;
	}

	/**
	 * Scans the list backwards, testing each element before descending into it.
	 */
	static boolean replaceInListReversed(List<Element> elements, Element container, Predicate<Element> matcher,
			Element replacement) {
		for (int i = elements.size() - 1; i >= 0; i--) {
			if (replaceAt(elements, i, container, matcher, replacement)) {
				return true;
			}
		}
		return false;
	}

	static boolean replaceInList(List<Element> elements, Element container, Predicate<Element> matcher,
			Element replacement) {
		for (int i = 0; i < elements.size(); i++) {
			if (replaceAt(elements, i, container, matcher, replacement)) {
				return true;
			}
		}
		return false;
	}

	private static boolean replaceAt(List<Element> elements, int i, Element container, Predicate<Element> matcher,
			Element replacement) {
		Element element = elements.get(i);
		if (matcher.apply(element)) {
			if (replacement == null) {
				elements.remove(i);
			} else {
				elements.set(i, replacement);
				replacement.setParent(container);
			}
			element.setParent(null);
			return true;
		}
		return element.replace(matcher, replacement);
	}
}
