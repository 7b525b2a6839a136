package org.javai.nlrecon.sql;

/**
 * Oracle: double-quote quoting and {@code FETCH FIRST n ROWS ONLY}.
 */
public class OracleDialect extends PostgresDialect {

	@Override
	public LimitClause limitClause(int limit) {
		return new LimitClause(LimitClause.Placement.END, "FETCH FIRST " + limit + " ROWS ONLY");
	}
}
