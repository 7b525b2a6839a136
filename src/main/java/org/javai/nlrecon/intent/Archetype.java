package org.javai.nlrecon.intent;

/**
 * The closed set of reconciliation query shapes.
 */
public enum Archetype {
	/** Rows present in both the source and the target. */
	MATCHED,
	/** Source rows with no counterpart in the target. */
	UNMATCHED_SOURCE,
	/** Target rows with no counterpart in the source. */
	UNMATCHED_TARGET,
	/** Rows of one table, or a join, restricted by filter predicates. */
	FILTERED,
	/** Number of rows matching a status predicate. */
	INACTIVE_COUNT;

	public boolean isAntiJoin() {
		return this == UNMATCHED_SOURCE || this == UNMATCHED_TARGET;
	}

	/**
	 * Whether the archetype is meaningless without a second table.
	 */
	public boolean requiresJoin() {
		return this == MATCHED || isAntiJoin();
	}
}
