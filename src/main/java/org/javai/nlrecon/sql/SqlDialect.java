package org.javai.nlrecon.sql;

/**
 * Database-family specific rendering rules used by the {@link SqlGenerator}.
 */
public interface SqlDialect {

	/**
	 * Quotes an identifier, escaping the closing quote character where it occurs in the name.
	 */
	String quoteIdentifier(String identifier);

	/**
	 * The clause limiting the result to {@code limit} rows.
	 */
	LimitClause limitClause(int limit);

	/**
	 * Renders a string literal including its surrounding quotes.
	 */
	default String escapeLiteral(String value) {
		return "'" + value.replace("'", "''") + "'";
	}

	/**
	 * Quotes a table name, prefixed with its schema when one is given.
	 */
	default String qualifiedTable(String schema, String table) {
		if (schema == null || schema.isBlank()) {
			return quoteIdentifier(table);
		}
		return quoteIdentifier(schema) + "." + quoteIdentifier(table);
	}
}
