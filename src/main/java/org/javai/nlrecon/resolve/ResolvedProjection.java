package org.javai.nlrecon.resolve;

/**
 * A projected column bound to its physical table and column.
 */
public record ResolvedProjection(String table, String column, double confidence) {
}
