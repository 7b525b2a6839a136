package org.javai.nlrecon.join;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tables, joins, projections and filters of one query.
 *
 * <p>Invariants checked on construction:</p>
 * <ul>
 *   <li>table names are distinct</li>
 *   <li>every table after the first is introduced by a join whose left table comes earlier</li>
 *   <li>joins, selections and filters only reference tables of the plan</li>
 *   <li>the excluded table, if any, is not the first table and carries no filter</li>
 * </ul>
 *
 * @param tables tables in join order; the first is the driving table
 * @param joins join conditions in order
 * @param selectColumns selected columns per table, in select-list order
 * @param filters predicates
 * @param excludedTable anti-join side, or null
 * @param confidence minimum confidence of the relationships used, 1.0 without joins
 */
public record JoinPlan(
		List<String> tables,
		List<JoinCondition> joins,
		Map<String, SelectColumns> selectColumns,
		List<FilterClause> filters,
		String excludedTable,
		double confidence
) {

	public JoinPlan {
		tables = tables != null ? List.copyOf(tables) : List.of();
		joins = joins != null ? List.copyOf(joins) : List.of();
		selectColumns = selectColumns != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(selectColumns))
				: Map.of();
		filters = filters != null ? List.copyOf(filters) : List.of();
		validate(tables, joins, selectColumns, filters, excludedTable, confidence);
	}

	public static JoinPlan singleTable(String table) {
		return new JoinPlan(List.of(table), List.of(), Map.of(table, SelectColumns.ALL), List.of(), null, 1.0);
	}

	public String drivingTable() {
		return tables.get(0);
	}

	public Optional<JoinCondition> joinIntroducing(String table) {
		return joins.stream().filter(join -> join.rightTable().equalsIgnoreCase(table)).findFirst();
	}

	public int indexOf(String table) {
		return position(tables, table);
	}

	private static void validate(List<String> tables, List<JoinCondition> joins, Map<String, SelectColumns> selectColumns,
			List<FilterClause> filters, String excludedTable, double confidence) {
		if (tables.isEmpty()) {
			throw new IllegalArgumentException("a join plan needs at least one table");
		}
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be within [0, 1]");
		}
		for (int i = 0; i < tables.size(); i++) {
			for (int j = i + 1; j < tables.size(); j++) {
				if (tables.get(i).equalsIgnoreCase(tables.get(j))) {
					throw new IllegalArgumentException("duplicate table in plan: " + tables.get(i));
				}
			}
		}
		for (JoinCondition join : joins) {
			int left = position(tables, join.leftTable());
			int right = position(tables, join.rightTable());
			if (left < 0 || right < 0) {
				throw new IllegalArgumentException("join references a table outside the plan: " + join);
			}
			if (left >= right) {
				throw new IllegalArgumentException("join must introduce a later table from an earlier one: " + join);
			}
		}
		for (int i = 1; i < tables.size(); i++) {
			String table = tables.get(i);
			boolean introduced = joins.stream().anyMatch(join -> join.rightTable().equalsIgnoreCase(table));
			if (!introduced) {
				throw new IllegalArgumentException("table " + table + " is not connected to an earlier table");
			}
		}
		for (String table : selectColumns.keySet()) {
			if (position(tables, table) < 0) {
				throw new IllegalArgumentException("selection references a table outside the plan: " + table);
			}
		}
		for (FilterClause filter : filters) {
			if (position(tables, filter.table()) < 0) {
				throw new IllegalArgumentException("filter references a table outside the plan: " + filter.table());
			}
			if (excludedTable != null && filter.table().equalsIgnoreCase(excludedTable)) {
				throw new IllegalArgumentException("filters may not apply to the excluded table " + excludedTable);
			}
		}
		if (excludedTable != null && position(tables, excludedTable) < 1) {
			throw new IllegalArgumentException("excluded table must be a joined table of the plan: " + excludedTable);
		}
	}

	private static int position(List<String> tables, String table) {
		for (int i = 0; i < tables.size(); i++) {
			if (tables.get(i).equalsIgnoreCase(table)) {
				return i;
			}
		}
		return -1;
	}
}
