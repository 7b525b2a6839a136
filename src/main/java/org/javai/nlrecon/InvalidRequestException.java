package org.javai.nlrecon;

/**
 * Thrown when a reconciliation request is rejected before any definition is processed.
 */
public class InvalidRequestException extends RuntimeException {

	public InvalidRequestException(String message) {
		super(message);
	}
}
