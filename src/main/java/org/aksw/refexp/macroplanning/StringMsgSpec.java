package org.aksw.refexp.macroplanning;

import org.aksw.refexp.structures.Element;
import org.aksw.refexp.structures.Text;

/**
 * A message that is just canned text.
 */
public class StringMsgSpec extends MsgSpec {

	public static final String NAME = "string_message_spec";

	private final String text;

	public StringMsgSpec(String text) {
		super(NAME);
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public Element valueFor(String key) {
		return new Text(text);
	}

	@Override
	public String toString() {
		return text;
	}
}
