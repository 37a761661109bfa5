package org.aksw.refexp.macroplanning;

/**
 * Thrown when a template asks a message for an argument it does not have.
 */
public class MalformedArgumentReferenceException extends IllegalArgumentException {

	private static final long serialVersionUID = 4409137271620781326L;

	public MalformedArgumentReferenceException(String message) {
		super(message);
	}
}
