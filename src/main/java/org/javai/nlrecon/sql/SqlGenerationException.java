package org.javai.nlrecon.sql;

/**
 * Thrown when a plan cannot be rendered for an archetype, or the rendered statement is
 * not a valid single {@code SELECT}.
 */
public class SqlGenerationException extends RuntimeException {

	public SqlGenerationException(String message) {
		super(message);
	}

	public SqlGenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
