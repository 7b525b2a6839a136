package org.javai.nlrecon.sql;

import java.util.ArrayList;
import java.util.List;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;

/**
 * JSqlParser-backed checks and rewrites of generated statements.
 *
 * <p>Square-bracket identifiers are enabled so SQL Server statements parse alongside the
 * other dialects.</p>
 */
public final class SqlStatements {

	private SqlStatements() {
	}

	/**
	 * Parses the statement and checks it is a single {@code SELECT}.
	 *
	 * @throws SqlGenerationException when the statement does not parse or is not a SELECT
	 */
	public static Select parseSelect(String sql) {
		if (sql == null || sql.isBlank()) {
			throw new SqlGenerationException("SQL string cannot be null or blank");
		}
		Statement stmt;
		try {
			stmt = CCJSqlParserUtil.parse(sql, parser -> parser.withSquareBracketQuotation(true));
		}
		catch (JSQLParserException e) {
			throw new SqlGenerationException("Invalid SQL syntax: " + e.getMessage(), e);
		}
		if (!(stmt instanceof Select select)) {
			throw new SqlGenerationException(
					"Only SELECT statements are allowed, got: " + stmt.getClass().getSimpleName());
		}
		return select;
	}

	/**
	 * Whether any table in the {@code FROM} clause or its joins carries a schema qualifier.
	 *
	 * @throws SqlGenerationException when the statement does not parse
	 */
	public static boolean isSchemaQualified(String sql) {
		return tables(parseSelect(sql)).stream().anyMatch(table -> table.getSchemaName() != null);
	}

	/**
	 * Rewrites the statement with every table reference reduced to its bare name.
	 * The rewrite works on the parsed tree, so literals and column names are untouched.
	 *
	 * @throws SqlGenerationException when the statement does not parse
	 */
	public static String stripSchema(String sql) {
		Select select = parseSelect(sql);
		if (!(select instanceof PlainSelect plainSelect)) {
			return sql;
		}
		if (plainSelect.getFromItem() instanceof Table fromTable) {
			plainSelect.setFromItem(unqualified(fromTable));
		}
		if (plainSelect.getJoins() != null) {
			for (Join join : plainSelect.getJoins()) {
				if (join.getRightItem() instanceof Table joinTable) {
					join.setRightItem(unqualified(joinTable));
				}
			}
		}
		return plainSelect.toString();
	}

	private static Table unqualified(Table table) {
		Table bare = new Table(table.getName());
		bare.setAlias(table.getAlias());
		return bare;
	}

	private static List<Table> tables(Select select) {
		List<Table> tables = new ArrayList<>();
		if (select instanceof PlainSelect plainSelect) {
			if (plainSelect.getFromItem() instanceof Table fromTable) {
				tables.add(fromTable);
			}
			if (plainSelect.getJoins() != null) {
				for (Join join : plainSelect.getJoins()) {
					if (join.getRightItem() instanceof Table joinTable) {
						tables.add(joinTable);
					}
				}
			}
		}
		return tables;
	}
}
