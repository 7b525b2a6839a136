package org.javai.nlrecon.sql;

/**
 * A row limit and where it goes in the statement.
 *
 * @param placement position of the clause
 * @param text clause text, e.g. {@code TOP 1000} or {@code LIMIT 1000}
 */
public record LimitClause(Placement placement, String text) {

	public enum Placement {
		/** Directly after the {@code SELECT} keyword. */
		AFTER_SELECT,
		/** At the end of the statement. */
		END
	}

	public LimitClause {
		if (placement == null || text == null || text.isBlank()) {
			throw new IllegalArgumentException("placement and text are required");
		}
	}
}
