package org.aksw.refexp.structures;

/**
 * Well-known feature keys and values.
 */
public final class Features {

	public static final String PROPER = "PROPER";
	public static final String PERSON = "PERSON";
	public static final String NUMBER = "NUMBER";
	public static final String GENDER = "GENDER";
	public static final String CASE = "CASE";
	public static final String TENSE = "TENSE";
	public static final String NEGATED = "NEGATED";
	public static final String POSSESSIVE = "POSSESSIVE";
	public static final String DISCOURSE_FUNCTION = "discourseFunction";

	public static final String TRUE = "true";
	public static final String FALSE = "false";

	public static final String OBJECT = "OBJECT";
	public static final String SUBJECT = "SUBJECT";

	private Features() {
	}
}
