package org.aksw.refexp.lexicon;

public enum Person {
	FIRST, SECOND, THIRD;
}
