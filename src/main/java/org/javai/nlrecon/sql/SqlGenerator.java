package org.javai.nlrecon.sql;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.nlrecon.intent.Archetype;
import org.javai.nlrecon.join.FilterClause;
import org.javai.nlrecon.join.JoinCondition;
import org.javai.nlrecon.join.JoinPlan;
import org.javai.nlrecon.join.JoinType;
import org.javai.nlrecon.join.SelectColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a {@link JoinPlan} as dialect-specific SQL for an archetype.
 *
 * <p>Tables are aliased {@code s}, {@code t}, {@code t3}, {@code t4}, ... in plan order and
 * schema-qualified when the schema lookup knows their schema. Anti-joins are rendered as
 * {@code LEFT JOIN ... WHERE <excluded key> IS NULL}; predicates on the kept side follow.
 * Every statement is parsed before it is returned.</p>
 */
public final class SqlGenerator {

	private static final Logger logger = LoggerFactory.getLogger(SqlGenerator.class);

	public static final int DEFAULT_LIMIT = 1000;

	private final SchemaLookup schemaLookup;

	public SqlGenerator() {
		this(SchemaLookup.NONE);
	}

	public SqlGenerator(SchemaLookup schemaLookup) {
		this.schemaLookup = schemaLookup != null ? schemaLookup : SchemaLookup.NONE;
	}

	public String generate(Archetype archetype, JoinPlan plan, Dialect dialect) {
		return generate(archetype, plan, dialect, DEFAULT_LIMIT);
	}

	/**
	 * @param archetype query shape
	 * @param plan tables, joins, selections and filters
	 * @param dialect target database family
	 * @param limit maximum number of rows; ignored for {@link Archetype#INACTIVE_COUNT}
	 * @throws SqlGenerationException when the plan does not fit the archetype
	 */
	public String generate(Archetype archetype, JoinPlan plan, Dialect dialect, int limit) {
		Objects.requireNonNull(archetype, "archetype must not be null");
		Objects.requireNonNull(plan, "plan must not be null");
		Objects.requireNonNull(dialect, "dialect must not be null");
		if (limit < 1) {
			throw new IllegalArgumentException("limit must be positive");
		}
		checkShape(archetype, plan);

		SqlDialect sqlDialect = dialect.adapter();
		Map<String, String> aliases = aliases(plan);
		boolean count = archetype == Archetype.INACTIVE_COUNT;
		LimitClause limitClause = count ? null : sqlDialect.limitClause(limit);

		StringBuilder sql = new StringBuilder("SELECT ");
		if (limitClause != null && limitClause.placement() == LimitClause.Placement.AFTER_SELECT) {
			sql.append(limitClause.text()).append(' ');
		}
		sql.append(count ? "COUNT(*)" : selectList(plan, aliases, sqlDialect));

		String driving = plan.drivingTable();
		sql.append("\nFROM ").append(table(driving, sqlDialect)).append(' ').append(alias(aliases, driving));
		for (JoinCondition join : plan.joins()) {
			sql.append('\n')
					.append(join.joinType().keyword()).append(' ')
					.append(table(join.rightTable(), sqlDialect)).append(' ').append(alias(aliases, join.rightTable()))
					.append(" ON ")
					.append(column(aliases, join.leftTable(), join.leftColumn(), sqlDialect))
					.append(" = ")
					.append(column(aliases, join.rightTable(), join.rightColumn(), sqlDialect));
		}

		List<String> predicates = new ArrayList<>();
		if (archetype.isAntiJoin()) {
			JoinCondition antiJoin = plan.joinIntroducing(plan.excludedTable())
					.orElseThrow(() -> new SqlGenerationException("Excluded table is not joined: " + plan.excludedTable()));
			predicates.add(column(aliases, antiJoin.rightTable(), antiJoin.rightColumn(), sqlDialect) + " IS NULL");
		}
		for (FilterClause filter : plan.filters()) {
			predicates.add(predicate(filter, aliases, sqlDialect));
		}
		if (!predicates.isEmpty()) {
			sql.append("\nWHERE ").append(String.join("\n  AND ", predicates));
		}

		if (limitClause != null && limitClause.placement() == LimitClause.Placement.END) {
			sql.append('\n').append(limitClause.text());
		}

		String rendered = sql.toString();
		SqlStatements.parseSelect(rendered);
		logger.debug("Generated {} SQL for {}:\n{}", dialect, archetype, rendered);
		return rendered;
	}

	private static void checkShape(Archetype archetype, JoinPlan plan) {
		switch (archetype) {
			case MATCHED -> {
				if (plan.tables().size() < 2) {
					throw new SqlGenerationException("MATCHED needs at least two tables, got " + plan.tables());
				}
			}
			case UNMATCHED_SOURCE, UNMATCHED_TARGET -> {
				if (plan.tables().size() < 2 || plan.excludedTable() == null) {
					throw new SqlGenerationException(archetype + " needs a kept and an excluded table");
				}
				boolean leftJoined = plan.joinIntroducing(plan.excludedTable())
						.map(join -> join.joinType() == JoinType.LEFT)
						.orElse(false);
				if (!leftJoined) {
					throw new SqlGenerationException("The excluded table must be left-joined");
				}
			}
			case FILTERED, INACTIVE_COUNT -> {
				if (plan.excludedTable() != null) {
					throw new SqlGenerationException(archetype + " does not exclude a table");
				}
			}
		}
	}

	private static Map<String, String> aliases(JoinPlan plan) {
		Map<String, String> aliases = new HashMap<>();
		List<String> tables = plan.tables();
		for (int i = 0; i < tables.size(); i++) {
			String alias = switch (i) {
				case 0 -> "s";
				case 1 -> "t";
				default -> "t" + (i + 1);
			};
			aliases.put(tables.get(i).toLowerCase(Locale.ROOT), alias);
		}
		return aliases;
	}

	private static String alias(Map<String, String> aliases, String table) {
		String alias = aliases.get(table.toLowerCase(Locale.ROOT));
		if (alias == null) {
			throw new SqlGenerationException("Table is not part of the plan: " + table);
		}
		return alias;
	}

	private static String selectList(JoinPlan plan, Map<String, String> aliases, SqlDialect dialect) {
		if (plan.selectColumns().isEmpty()) {
			return alias(aliases, plan.drivingTable()) + ".*";
		}
		List<String> items = new ArrayList<>();
		for (Map.Entry<String, SelectColumns> entry : plan.selectColumns().entrySet()) {
			String alias = alias(aliases, entry.getKey());
			if (entry.getValue().all()) {
				items.add(alias + ".*");
			}
			else {
				entry.getValue().columns().forEach(column -> items.add(alias + "." + dialect.quoteIdentifier(column)));
			}
		}
		return String.join(", ", items);
	}

	private String table(String table, SqlDialect dialect) {
		return dialect.qualifiedTable(schemaLookup.schemaOf(table).orElse(null), table);
	}

	private static String column(Map<String, String> aliases, String table, String column, SqlDialect dialect) {
		return alias(aliases, table) + "." + dialect.quoteIdentifier(column);
	}

	private static String predicate(FilterClause filter, Map<String, String> aliases, SqlDialect dialect) {
		// Column types are unknown; values are always string literals.
		return column(aliases, filter.table(), filter.column(), dialect)
				+ " " + filter.operator().sql() + " " + dialect.escapeLiteral(filter.value());
	}
}
