package org.aksw.refexp.macroplanning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.aksw.refexp.structures.Element;

public class Section {

	private Element title;
	private final List<Paragraph> paragraphs = new ArrayList<>();

	public Section(Element title, Paragraph... paragraphs) {
		this.title = title;
		Collections.addAll(this.paragraphs, paragraphs);
	}

	/**
	 * @return the title, or null for an untitled section
	 */
	public Element getTitle() {
		return title;
	}

	public void setTitle(Element title) {
		this.title = title;
	}

	public List<Paragraph> getParagraphs() {
		return paragraphs;
	}

	public void addParagraph(Paragraph paragraph) {
		paragraphs.add(paragraph);
	}
}
