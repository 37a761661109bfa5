package org.aksw.refexp.macroplanning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.aksw.refexp.structures.Element;

import com.google.common.base.Preconditions;

/**
 * A rhetorical relation between sentences: one or more nuclei and an optional satellite,
 * e.g. a contrast between two clauses joined by the marker "but".
 */
public class Message {

	private final String relation;
	private final List<Element> nuclei = new ArrayList<>();
	private Element satellite;
	private String marker = "";

	public Message(String relation, Element... nuclei) {
		Preconditions.checkArgument(nuclei.length > 0, "At least one nucleus required for a message.");
		this.relation = relation;
		Collections.addAll(this.nuclei, nuclei);
	}

	public String getRelation() {
		return relation;
	}

	public List<Element> getNuclei() {
		return nuclei;
	}

	public Element getNucleus() {
		return nuclei.get(0);
	}

	public Element getSatellite() {
		return satellite;
	}

	public void setSatellite(Element satellite) {
		this.satellite = satellite;
	}

	public String getMarker() {
		return marker;
	}

	public void setMarker(String marker) {
		this.marker = marker == null ? "" : marker;
	}

	public boolean isMultinuclear() {
		return nuclei.size() > 1;
	}

	/**
	 * @return the sentences of the message in the order they are uttered
	 */
	public List<Element> getSentences() {
		List<Element> sentences = new ArrayList<>(nuclei);
		if (!isMultinuclear() && satellite != null) {
			sentences.add(satellite);
		}
		return sentences;
	}

	/**
	 * Replaces the sentence at the given position of {@link #getSentences()}.
	 */
	public void setSentence(int index, Element sentence) {
		if (index < nuclei.size()) {
			nuclei.set(index, sentence);
		} else if (index == nuclei.size() && satellite != null && !isMultinuclear()) {
			satellite = sentence;
		} else {
			throw new IndexOutOfBoundsException("No sentence at index " + index);
		}
	}

	@Override
	public String toString() {
		return relation + getSentences();
	}
}
