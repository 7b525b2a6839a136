package org.javai.nlrecon.intent;

/**
 * An extra column to show from another table ("also show ops planner from hana master").
 */
public record ProjectionMention(String columnHint, String tableMention) {

	public ProjectionMention {
		if (columnHint == null || columnHint.isBlank()) {
			throw new IllegalArgumentException("columnHint must not be blank");
		}
		if (tableMention == null || tableMention.isBlank()) {
			throw new IllegalArgumentException("tableMention must not be blank");
		}
	}
}
