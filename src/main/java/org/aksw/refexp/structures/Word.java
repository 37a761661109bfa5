package org.aksw.refexp.structures;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A single word with its part-of-speech tag (see {@link PartOfSpeech}) and base form.
 */
public class Word extends Element {

	private String word;
	private String pos;
	private String base;

	public Word(String word, String pos) {
		this(word, pos, word);
	}

	public Word(String word, String pos, String base) {
		super(ElementType.WORD);
		this.word = Preconditions.checkNotNull(word);
		this.pos = pos == null ? PartOfSpeech.ANY : pos;
		this.base = base == null ? word : base;
	}

	protected Word(Word other) {
		super(other);
		this.word = other.word;
		this.pos = other.pos;
		this.base = other.base;
	}

	public String getWord() {
		return word;
	}

	public void setWord(String word) {
		this.word = Preconditions.checkNotNull(word);
	}

	public String getPos() {
		return pos;
	}

	public void setPos(String pos) {
		this.pos = Preconditions.checkNotNull(pos);
	}

	public String getBase() {
		return base;
	}

	public boolean isPronoun() {
		return PartOfSpeech.PRONOUN.equals(pos);
	}

	@Override
	public String getString() {
		return word;
	}

	@Override
	public Word copy() {
		return new Word(this);
	}

	/**
	 * The base form does not take part in equality.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Word)) {
			return false;
		}
		Word other = (Word) obj;
		return featuresEqual(other) && word.equals(other.word) && pos.equals(other.pos);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(featuresHashCode(), word, pos);
	}
}
