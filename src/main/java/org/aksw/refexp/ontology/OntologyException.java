package org.aksw.refexp.ontology;

/**
 * Signals that the ontology could not answer a lookup.
 */
public class OntologyException extends Exception {

	private static final long serialVersionUID = -2270473626419915207L;

	public OntologyException(String message) {
		super(message);
	}

	public OntologyException(String message, Throwable cause) {
		super(message, cause);
	}
}
