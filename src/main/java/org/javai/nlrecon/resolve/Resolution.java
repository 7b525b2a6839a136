package org.javai.nlrecon.resolve;

import java.util.ArrayList;
import java.util.List;

/**
 * The result of resolving an intent's mentions.
 *
 * <p>A resolution is complete when it has no issues. {@link #confidence()} is the minimum
 * over every match made, and is capped by the best score of any mention that failed to
 * resolve.</p>
 */
public record Resolution(
		ResolvedEntity source,
		ResolvedEntity target,
		List<ResolvedEntity> additional,
		List<ResolvedFilter> filters,
		List<ResolvedProjection> projections,
		List<ResolutionIssue> issues,
		double confidence
) {

	public Resolution {
		additional = additional != null ? List.copyOf(additional) : List.of();
		filters = filters != null ? List.copyOf(filters) : List.of();
		projections = projections != null ? List.copyOf(projections) : List.of();
		issues = issues != null ? List.copyOf(issues) : List.of();
	}

	public boolean isComplete() {
		return issues.isEmpty();
	}

	/**
	 * @throws ResolutionException carrying the first issue when the resolution is incomplete
	 */
	public Resolution requireComplete() {
		if (!issues.isEmpty()) {
			throw new ResolutionException(issues.get(0));
		}
		return this;
	}

	public String sourceTable() {
		return source != null ? source.resolvedTable() : null;
	}

	public String targetTable() {
		return target != null ? target.resolvedTable() : null;
	}

	public List<String> additionalTables() {
		List<String> tables = new ArrayList<>();
		for (ResolvedEntity entity : additional) {
			if (entity.isResolved() && !contains(tables, entity.resolvedTable())) {
				tables.add(entity.resolvedTable());
			}
		}
		return tables;
	}

	private static boolean contains(List<String> tables, String table) {
		return tables.stream().anyMatch(table::equalsIgnoreCase);
	}
}
