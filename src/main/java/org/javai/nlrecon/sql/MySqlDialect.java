package org.javai.nlrecon.sql;

/**
 * MySQL: backtick quoting, {@code LIMIT n}, and backslash escaping in literals.
 */
public class MySqlDialect implements SqlDialect {

	@Override
	public String quoteIdentifier(String identifier) {
		return "`" + identifier.replace("`", "``") + "`";
	}

	@Override
	public LimitClause limitClause(int limit) {
		return new LimitClause(LimitClause.Placement.END, "LIMIT " + limit);
	}

	@Override
	public String escapeLiteral(String value) {
		return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
	}
}
