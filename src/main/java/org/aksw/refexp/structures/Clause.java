package org.aksw.refexp.structures;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.google.common.base.Objects;
import com.google.common.base.Predicate;
import com.google.common.collect.Iterators;

/**
 * A clause: subject, predicate and their modifiers and complements.
 * Text and words given as subject are raised to noun phrases, anything other than a
 * verb phrase given as predicate becomes the head of a new verb phrase.
 */
public class Clause extends Element {

	private final List<Element> frontModifiers = new ArrayList<>();
	private final List<Element> preModifiers = new ArrayList<>();
	private Element subject;
	private VerbPhrase predicate;
	private final List<Element> complements = new ArrayList<>();
	private final List<Element> postModifiers = new ArrayList<>();

	public Clause() {
		this(null, null);
	}

	public Clause(Element subject, Element predicate) {
		super(ElementType.CLAUSE);
		setSubject(subject);
		setPredicate(predicate);
	}

	protected Clause(Clause other) {
		super(other);
		frontModifiers.addAll(copyOf(other.frontModifiers, this));
		preModifiers.addAll(copyOf(other.preModifiers, this));
		subject = copyOf(other.subject, this);
		predicate = other.predicate.copy();
		predicate.setParent(this);
		complements.addAll(copyOf(other.complements, this));
		postModifiers.addAll(copyOf(other.postModifiers, this));
	}

	public Element getSubject() {
		return subject;
	}

	public void setSubject(Element subject) {
		this.subject = raiseToNounPhrase(subject);
		this.subject.setParent(this);
	}

	public VerbPhrase getPredicate() {
		return predicate;
	}

	public void setPredicate(Element predicate) {
		this.predicate = raiseToVerbPhrase(predicate);
		this.predicate.setParent(this);
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

	public void addPostModifier(Element modifier) {
		add(postModifiers, modifier);
	}

	private void add(List<Element> slot, Element element) {
		slot.add(element);
		element.setParent(this);
	}

	/**
	 * Front modifiers are not part of the constituents.
	 */
	@Override
	public Iterator<Element> constituents() {
		return Iterators.concat(Iterators.singletonIterator((Element) this), constituentsOf(preModifiers),
				subject.constituents(), predicate.constituents(), constituentsOf(complements),
				constituentsOf(postModifiers));
	}

	@Override
	protected boolean replace(Predicate<Element> matcher, Element replacement) {
		if (matcher.apply(subject)) {
			subject.setParent(null);
			setSubject(replacement);
			return true;
		}
		if (subject.replace(matcher, replacement)) {
			return true;
		}
		if (matcher.apply(predicate)) {
			predicate.setParent(null);
			setPredicate(replacement);
			return true;
		}
		if (predicate.replace(matcher, replacement)) {
			return true;
		}
		if (replaceInListReversed(complements, this, matcher, replacement)) {
			return true;
		}
		if (replaceInListReversed(postModifiers, this, matcher, replacement)) {
			return true;
		}
		if (replaceInListReversed(preModifiers, this, matcher, replacement)) {
			return true;
		}
		return replaceInListReversed(frontModifiers, this, matcher, replacement);
	}

	@Override
	public Clause copy() {
		return new Clause(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Clause)) {
			return false;
		}
		Clause other = (Clause) obj;
		return featuresEqual(other) && subject.equals(other.subject) && predicate.equals(other.predicate)
				&& frontModifiers.equals(other.frontModifiers) && preModifiers.equals(other.preModifiers)
				&& complements.equals(other.complements) && postModifiers.equals(other.postModifiers);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(featuresHashCode(), frontModifiers, preModifiers, subject, predicate, complements,
				postModifiers);
	}

	/**
	 * Wraps text and words in a noun phrase; null becomes the empty element.
	 */
	public static Element raiseToNounPhrase(Element element) {
		if (element == null) {
			return new EmptyElement();
		}
		if (element.getType() == ElementType.TEXT || element.getType() == ElementType.WORD) {
			return new NounPhrase(element);
		}
		return element;
	}

	/**
	 * Wraps anything that is not a verb phrase in a verb phrase; null becomes an empty verb phrase.
	 */
	public static VerbPhrase raiseToVerbPhrase(Element element) {
		if (element == null || element.isEmpty()) {
			return new VerbPhrase();
		}
		if (element.getType() == ElementType.VERB_PHRASE) {
			return (VerbPhrase) element;
		}
		return new VerbPhrase(element);
	}
}
