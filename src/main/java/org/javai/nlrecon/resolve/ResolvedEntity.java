package org.javai.nlrecon.resolve;

import java.util.List;
import org.javai.nlrecon.kg.MatchStrategy;

/**
 * A mention after resolution against the knowledge graph.
 *
 * @param mention the mention as written
 * @param resolvedTable physical table, or null when unresolved
 * @param resolvedColumn physical column when the mention named one, otherwise null
 * @param matchStrategy strategy that produced the match, null when unresolved
 * @param matchConfidence confidence of the match; for unresolved mentions the best score seen
 * @param candidates tables considered, best first
 */
public record ResolvedEntity(
		String mention,
		String resolvedTable,
		String resolvedColumn,
		MatchStrategy matchStrategy,
		double matchConfidence,
		List<String> candidates
) {

	public ResolvedEntity {
		candidates = candidates != null ? List.copyOf(candidates) : List.of();
	}

	public boolean isResolved() {
		return resolvedTable != null;
	}
}
