package org.javai.nlrecon.intent.extract;

/**
 * Thrown when an entity extractor cannot produce a usable result.
 */
public class ExtractionException extends RuntimeException {

	public ExtractionException(String message) {
		super(message);
	}

	public ExtractionException(String message, Throwable cause) {
		super(message, cause);
	}
}
