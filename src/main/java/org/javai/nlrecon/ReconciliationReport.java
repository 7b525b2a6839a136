package org.javai.nlrecon;

import java.time.Instant;
import java.util.List;
import org.javai.nlrecon.sql.Dialect;

/**
 * Outcome of a batch, one entry per definition in request order.
 */
public record ReconciliationReport(
		String kgName,
		Dialect dialect,
		Instant startedAt,
		Instant finishedAt,
		List<DefinitionOutcome> outcomes,
		BatchStatistics statistics
) {

	public ReconciliationReport {
		outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
		statistics = statistics != null ? statistics : BatchStatistics.of(outcomes);
	}

	public static ReconciliationReport of(String kgName, Dialect dialect, Instant startedAt, Instant finishedAt,
			List<DefinitionOutcome> outcomes) {
		return new ReconciliationReport(kgName, dialect, startedAt, finishedAt, outcomes, BatchStatistics.of(outcomes));
	}
}
