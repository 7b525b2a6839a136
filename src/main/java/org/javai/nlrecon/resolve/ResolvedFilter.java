package org.javai.nlrecon.resolve;

import org.javai.nlrecon.intent.FilterOperator;
import org.javai.nlrecon.kg.MatchStrategy;

/**
 * A filter bound to a physical column.
 *
 * @param table physical table the column belongs to
 * @param column physical column
 * @param operator comparison operator
 * @param value literal value
 * @param hint wording the column was resolved from
 * @param matchStrategy how the column was matched
 * @param confidence match confidence
 */
public record ResolvedFilter(
		String table,
		String column,
		FilterOperator operator,
		String value,
		String hint,
		MatchStrategy matchStrategy,
		double confidence
) {
}
