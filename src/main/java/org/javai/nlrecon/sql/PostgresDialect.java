package org.javai.nlrecon.sql;

/**
 * PostgreSQL: double-quote quoting and {@code LIMIT n}.
 */
public class PostgresDialect implements SqlDialect {

	@Override
	public String quoteIdentifier(String identifier) {
		return "\"" + identifier.replace("\"", "\"\"") + "\"";
	}

	@Override
	public LimitClause limitClause(int limit) {
		return new LimitClause(LimitClause.Placement.END, "LIMIT " + limit);
	}
}
