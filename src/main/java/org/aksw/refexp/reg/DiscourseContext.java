package org.aksw.refexp.reg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.aksw.refexp.lexicon.FeatureTable;
import org.aksw.refexp.structures.Element;
import org.aksw.refexp.structures.ElementType;
import org.apache.log4j.Logger;

/**
 * What has been said so far in a document: the referents mentioned, the noun
 * phrases in order of mention and the finished sentences.
 * <p>
 * A context belongs to one document and is not thread-safe.
 */
public class DiscourseContext {

	private final Map<String, Referent> referents = new HashMap<>();
	private final List<Element> salienceStack = new ArrayList<>();
	private final List<Element> history = new ArrayList<>();
	private Element lastSpeaker;

	private final FeatureTable featureTable;
	private Logger logger;

	public DiscourseContext() {
		this(FeatureTable.getDefault());
	}

	public DiscourseContext(FeatureTable featureTable) {
		this(featureTable, Logger.getLogger(ReferringExpressionGenerator.class.getName()));
	}

	public DiscourseContext(FeatureTable featureTable, Logger logger) {
		this.featureTable = featureTable;
		this.logger = logger;
	}

	public boolean hasReferent(String key) {
		return referents.containsKey(key);
	}

	/**
	 * @return the referent, or null if the key was never mentioned
	 */
	public Referent getReferent(String key) {
		return referents.get(key);
	}

	public void putReferent(String key, Referent referent) {
		referents.put(key, referent);
	}

	public Map<String, Referent> getReferents() {
		return Collections.unmodifiableMap(referents);
	}

	/**
	 * Records a finished sentence and pushes its noun phrases and coordinations
	 * onto the salience stack in traversal order.
	 */
	public void addSentence(Element sentence) {
		history.add(sentence);
		Iterator<Element> it = sentence.constituents();
		while (it.hasNext()) {
			Element element = it.next();
			if (element.getType() == ElementType.NOUN_PHRASE || element.getType() == ElementType.COORDINATION) {
				salienceStack.add(element);
			}
		}
		logger.debug("Salience stack has " + salienceStack.size() + " entries after sentence " + history.size());
	}

	/**
	 * @return the noun phrases mentioned so far, the most recent last
	 */
	public List<Element> getSalienceStack() {
		return Collections.unmodifiableList(salienceStack);
	}

	public List<Element> getHistory() {
		return Collections.unmodifiableList(history);
	}

	public Element getLastSpeaker() {
		return lastSpeaker;
	}

	public void setLastSpeaker(Element lastSpeaker) {
		this.lastSpeaker = lastSpeaker;
	}

	public boolean isLastSpeaker(Element element) {
		return lastSpeaker != null && lastSpeaker.equals(element);
	}

	public FeatureTable getFeatureTable() {
		return featureTable;
	}

	public Logger getLogger() {
		return logger;
	}

	public void setLogger(Logger logger) {
		this.logger = logger;
	}
}
