package org.aksw.refexp.macroplanning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Paragraph {

	private final List<Message> messages = new ArrayList<>();

	public Paragraph(Message... messages) {
		Collections.addAll(this.messages, messages);
	}

	public List<Message> getMessages() {
		return messages;
	}

	public void addMessage(Message message) {
		messages.add(message);
	}
}
