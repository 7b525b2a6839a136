package org.javai.nlrecon.join;

import org.javai.nlrecon.intent.FilterOperator;

/**
 * A {@code column operator literal} predicate on one table of a plan.
 */
public record FilterClause(String table, String column, FilterOperator operator, String value) {

	public FilterClause {
		if (table == null || column == null || operator == null || value == null) {
			throw new IllegalArgumentException("filter clause parts must not be null");
		}
	}
}
