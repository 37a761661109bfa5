package org.aksw.refexp.microplanning;

import java.util.HashMap;
import java.util.Map;

import org.aksw.refexp.macroplanning.MalformedArgumentReferenceException;
import org.aksw.refexp.macroplanning.Message;
import org.aksw.refexp.macroplanning.MsgSpec;
import org.aksw.refexp.macroplanning.StringMsgSpec;
import org.aksw.refexp.structures.Element;
import org.aksw.refexp.structures.Placeholder;
import org.aksw.refexp.structures.Text;
import org.apache.log4j.Logger;

/**
 * Turns message specifications into sentence trees by filling the placeholders
 * of the template registered for the message name.
 */
public class Lexicaliser {

	private static final Logger logger = Logger.getLogger(Lexicaliser.class.getName());

	private final Map<String, Element> templates = new HashMap<>();

	public Lexicaliser() {
	}

	public Lexicaliser(Map<String, Element> templates) {
		this.templates.putAll(templates);
	}

	public void addTemplate(String name, Element template) {
		templates.put(name, template);
	}

	/**
	 * @throws MalformedArgumentReferenceException if the template refers to an argument the message lacks
	 */
	public Element lexicalise(MsgSpec msg) {
		if (msg instanceof StringMsgSpec) {
			return new Text(((StringMsgSpec) msg).getText());
		}
		Element template = templates.get(msg.getName());
		if (template == null) {
			logger.warn("No template for message " + msg.getName() + ", using its text instead.");
			return new Text(msg.toString());
		}
		Element sentence = template.copy();
		for (Placeholder placeholder : sentence.arguments()) {
			placeholder.setValue(msg.valueFor(placeholder.getId()).copy());
		}
		// e.g. NEGATED or TENSE of the message
		sentence.addFeatures(msg.getFeatures());
		logger.debug("Lexicalised " + msg + " as " + sentence);
		return sentence;
	}

	/**
	 * Lexicalises each message spec into a nucleus of a new message.
	 */
	public Message lexicalise(String relation, MsgSpec... specs) {
		Element[] nuclei = new Element[specs.length];
		for (int i = 0; i < specs.length; i++) {
			nuclei[i] = lexicalise(specs[i]);
		}
		return new Message(relation, nuclei);
	}
}
