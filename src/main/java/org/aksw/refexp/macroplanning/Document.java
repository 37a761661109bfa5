package org.aksw.refexp.macroplanning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.aksw.refexp.structures.Element;

/**
 * A document: a title and its sections.
 */
public class Document {

	private Element title;
	private final List<Section> sections = new ArrayList<>();

	public Document(Element title, Section... sections) {
		this.title = title;
		Collections.addAll(this.sections, sections);
	}

	/**
	 * @return the title, or null for an untitled document
	 */
	public Element getTitle() {
		return title;
	}

	public void setTitle(Element title) {
		this.title = title;
	}

	public List<Section> getSections() {
		return sections;
	}

	public void addSection(Section section) {
		sections.add(section);
	}
}
