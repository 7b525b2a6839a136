package org.javai.nlrecon.kg;

/**
 * A join-capable relationship between two table columns.
 *
 * @param sourceTable physical name of the source table
 * @param sourceColumn join column on the source table
 * @param targetTable physical name of the target table
 * @param targetColumn join column on the target table
 * @param relationshipType free-form type such as {@code MATCHES} or {@code REFERENCES}
 * @param confidence how much the edge is trusted, in {@code [0, 1]}
 * @param bidirectional whether the edge may also be read from target to source
 */
public record RelationshipEdge(
		String sourceTable,
		String sourceColumn,
		String targetTable,
		String targetColumn,
		String relationshipType,
		double confidence,
		boolean bidirectional
) {

	public static final String DEFAULT_TYPE = "MATCHES";

	public RelationshipEdge {
		requireText(sourceTable, "sourceTable");
		requireText(sourceColumn, "sourceColumn");
		requireText(targetTable, "targetTable");
		requireText(targetColumn, "targetColumn");
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
		}
		relationshipType = (relationshipType == null || relationshipType.isBlank())
				? DEFAULT_TYPE
				: relationshipType;
	}

	public static RelationshipEdge matches(String sourceTable, String sourceColumn,
			String targetTable, String targetColumn, double confidence) {
		return new RelationshipEdge(sourceTable, sourceColumn, targetTable, targetColumn,
				DEFAULT_TYPE, confidence, true);
	}

	public boolean connects(String a, String b) {
		return (sourceTable.equalsIgnoreCase(a) && targetTable.equalsIgnoreCase(b))
				|| (sourceTable.equalsIgnoreCase(b) && targetTable.equalsIgnoreCase(a));
	}

	public boolean touches(String table) {
		return sourceTable.equalsIgnoreCase(table) || targetTable.equalsIgnoreCase(table);
	}

	/**
	 * Join column on the given endpoint.
	 */
	public String columnOf(String table) {
		if (sourceTable.equalsIgnoreCase(table)) {
			return sourceColumn;
		}
		if (targetTable.equalsIgnoreCase(table)) {
			return targetColumn;
		}
		throw new IllegalArgumentException("Table " + table + " is not an endpoint of " + this);
	}

	/**
	 * The other endpoint of the edge.
	 */
	public String otherEnd(String table) {
		if (sourceTable.equalsIgnoreCase(table)) {
			return targetTable;
		}
		if (targetTable.equalsIgnoreCase(table)) {
			return sourceTable;
		}
		throw new IllegalArgumentException("Table " + table + " is not an endpoint of " + this);
	}

	/**
	 * The same edge read from target to source, with the relationship type inverted.
	 */
	public RelationshipEdge reversed() {
		return new RelationshipEdge(targetTable, targetColumn, sourceTable, sourceColumn,
				RelationshipTypes.inverse(relationshipType), confidence, bidirectional);
	}

	private static void requireText(String value, String field) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(field + " must not be blank");
		}
	}
}
