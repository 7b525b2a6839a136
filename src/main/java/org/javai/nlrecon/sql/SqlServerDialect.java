package org.javai.nlrecon.sql;

/**
 * SQL Server: bracket quoting and {@code TOP n}.
 */
public class SqlServerDialect implements SqlDialect {

	@Override
	public String quoteIdentifier(String identifier) {
		return "[" + identifier.replace("]", "]]") + "]";
	}

	@Override
	public LimitClause limitClause(int limit) {
		return new LimitClause(LimitClause.Placement.AFTER_SELECT, "TOP " + limit);
	}
}
