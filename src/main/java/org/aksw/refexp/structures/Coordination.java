package org.aksw.refexp.structures;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.Iterators;

/**
 * Coordinated elements, e.g. "the block and the pyramid".
 * <p>
 * Coordinations are mutable containers and cannot be hashed.
 */
public class Coordination extends Element {

	public static final String DEFAULT_CONJUNCTION = "and";

	private final List<Element> coordinates = new ArrayList<>();
	private String conjunction;

	public Coordination(Element... coordinates) {
		this(DEFAULT_CONJUNCTION, coordinates);
	}

	public Coordination(String conjunction, Element... coordinates) {
		super(ElementType.COORDINATION);
		this.conjunction = Preconditions.checkNotNull(conjunction);
		for (Element coordinate : coordinates) {
			addCoordinate(coordinate);
		}
	}

	protected Coordination(Coordination other) {
		super(other);
		conjunction = other.conjunction;
		coordinates.addAll(copyOf(other.coordinates, this));
	}

	public List<Element> getCoordinates() {
		return Collections.unmodifiableList(coordinates);
	}

	public void addCoordinate(Element coordinate) {
		coordinates.add(coordinate);
		coordinate.setParent(this);
	}

	public String getConjunction() {
		return conjunction;
	}

	public void setConjunction(String conjunction) {
		this.conjunction = Preconditions.checkNotNull(conjunction);
	}

	/**
	 * @return the text of the first coordinate
	 */
	@Override
	public String getString() {
		return coordinates.isEmpty() ? null : coordinates.get(0).getString();
	}

	@Override
	public Iterator<Element> constituents() {
		return Iterators.concat(Iterators.singletonIterator((Element) this), constituentsOf(coordinates));
	}

	@Override
	protected boolean replace(Predicate<Element> matcher, Element replacement) {
		return replaceInList(coordinates, this, matcher, replacement);
	}

	@Override
	public Coordination copy() {
		return new Coordination(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Coordination)) {
			return false;
		}
		Coordination other = (Coordination) obj;
		return featuresEqual(other) && conjunction.equals(other.conjunction) && coordinates.equals(other.coordinates);
	}

	@Override
	public int hashCode() {
		throw new UnsupportedOperationException("Coordinations are mutable and cannot be hashed");
	}
}
