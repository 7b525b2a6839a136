package org.javai.nlrecon.intent;

/**
 * A filter as written in the definition, before any column is resolved.
 *
 * @param columnHint the column wording ({@code "Region"}) or a semantic hint ({@code "status"})
 * @param operator comparison operator
 * @param value literal value as written
 * @param semantic true when {@code columnHint} is a semantic hint rather than column wording
 */
public record FilterMention(String columnHint, FilterOperator operator, String value, boolean semantic) {

	public static final String STATUS_HINT = "status";

	public FilterMention {
		if (columnHint == null || columnHint.isBlank()) {
			throw new IllegalArgumentException("columnHint must not be blank");
		}
		if (operator == null) {
			throw new IllegalArgumentException("operator must not be null");
		}
		if (value == null) {
			throw new IllegalArgumentException("value must not be null");
		}
	}

	public static FilterMention status(String value) {
		return new FilterMention(STATUS_HINT, FilterOperator.EQ, value, true);
	}

	public static FilterMention explicit(String column, FilterOperator operator, String value) {
		return new FilterMention(column, operator, value, false);
	}

	boolean sameAs(FilterMention other) {
		return columnHint.equalsIgnoreCase(other.columnHint)
				&& operator == other.operator
				&& value.equalsIgnoreCase(other.value);
	}
}
