package org.javai.nlrecon.join;

/**
 * One equality join. The left table is already part of the plan when the right table is
 * introduced.
 *
 * @param leftTable table already included
 * @param leftColumn join column on the left table
 * @param rightTable table introduced by this join
 * @param rightColumn join column on the right table
 * @param joinType join type
 * @param confidence confidence of the relationship the join was derived from
 */
public record JoinCondition(
		String leftTable,
		String leftColumn,
		String rightTable,
		String rightColumn,
		JoinType joinType,
		double confidence
) {

	public JoinCondition {
		if (leftTable == null || leftColumn == null || rightTable == null || rightColumn == null) {
			throw new IllegalArgumentException("join condition endpoints must not be null");
		}
		if (joinType == null) {
			throw new IllegalArgumentException("joinType must not be null");
		}
		if (leftTable.equalsIgnoreCase(rightTable)) {
			throw new IllegalArgumentException("a table cannot be joined to itself: " + leftTable);
		}
	}
}
