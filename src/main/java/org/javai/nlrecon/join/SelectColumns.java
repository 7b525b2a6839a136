package org.javai.nlrecon.join;

import java.util.ArrayList;
import java.util.List;

/**
 * Columns selected from one table: all of them, or an explicit list.
 */
public record SelectColumns(boolean all, List<String> columns) {

	public static final SelectColumns ALL = new SelectColumns(true, List.of());

	public SelectColumns {
		columns = columns != null ? List.copyOf(columns) : List.of();
		if (!all && columns.isEmpty()) {
			throw new IllegalArgumentException("an explicit column selection needs at least one column");
		}
		if (all && !columns.isEmpty()) {
			throw new IllegalArgumentException("ALL cannot carry explicit columns");
		}
	}

	public static SelectColumns of(String... columns) {
		return new SelectColumns(false, List.of(columns));
	}

	public SelectColumns plus(String column) {
		if (all || columns.stream().anyMatch(column::equalsIgnoreCase)) {
			return this;
		}
		List<String> extended = new ArrayList<>(columns);
		extended.add(column);
		return new SelectColumns(false, extended);
	}
}
