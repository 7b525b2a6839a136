package org.javai.nlrecon.kg;

/**
 * Thrown when a knowledge graph document cannot be read or describes an invalid graph.
 */
public class KnowledgeGraphLoadException extends RuntimeException {

	public KnowledgeGraphLoadException(String message) {
		super(message);
	}

	public KnowledgeGraphLoadException(String message, Throwable cause) {
		super(message, cause);
	}
}
