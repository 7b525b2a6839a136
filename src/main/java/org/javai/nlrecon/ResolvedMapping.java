package org.javai.nlrecon;

import java.util.ArrayList;
import java.util.List;
import org.javai.nlrecon.join.JoinCondition;
import org.javai.nlrecon.join.JoinPlan;
import org.javai.nlrecon.resolve.Resolution;

/**
 * The physical tables and join columns a definition was mapped to.
 *
 * @param sourceTable resolved source table, or null
 * @param targetTable resolved target table, or null
 * @param joinColumns column pairs of the plan's joins, in join order; empty before planning
 * @param additionalTables further tables in the plan, including projection and bridge tables
 */
public record ResolvedMapping(
		String sourceTable,
		String targetTable,
		List<ColumnPair> joinColumns,
		List<String> additionalTables
) {

	public ResolvedMapping {
		joinColumns = joinColumns != null ? List.copyOf(joinColumns) : List.of();
		additionalTables = additionalTables != null ? List.copyOf(additionalTables) : List.of();
	}

	public static ResolvedMapping of(Resolution resolution) {
		return new ResolvedMapping(resolution.sourceTable(), resolution.targetTable(), List.of(),
				resolution.additionalTables());
	}

	public static ResolvedMapping of(Resolution resolution, JoinPlan plan) {
		List<ColumnPair> pairs = new ArrayList<>();
		for (JoinCondition join : plan.joins()) {
			pairs.add(new ColumnPair(join.leftTable(), join.leftColumn(), join.rightTable(), join.rightColumn()));
		}
		List<String> additional = new ArrayList<>();
		for (String table : plan.tables()) {
			if (!table.equalsIgnoreCase(String.valueOf(resolution.sourceTable()))
					&& !table.equalsIgnoreCase(String.valueOf(resolution.targetTable()))) {
				additional.add(table);
			}
		}
		return new ResolvedMapping(resolution.sourceTable(), resolution.targetTable(), pairs, additional);
	}

	public record ColumnPair(String leftTable, String leftColumn, String rightTable, String rightColumn) {
	}
}
