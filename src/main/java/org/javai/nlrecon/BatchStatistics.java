package org.javai.nlrecon;

import java.util.List;
import org.javai.nlrecon.exec.ExecutionResult;
import org.javai.nlrecon.exec.ExecutionStatus;

/**
 * Counts over the outcomes of a batch.
 */
public record BatchStatistics(
		int total,
		int successful,
		int failed,
		int timedOut,
		long totalRecords,
		double averageConfidence
) {

	public static BatchStatistics of(List<DefinitionOutcome> outcomes) {
		int successful = 0;
		int failed = 0;
		int timedOut = 0;
		long records = 0;
		double confidenceSum = 0.0;
		for (DefinitionOutcome outcome : outcomes) {
			ExecutionResult result = outcome.result();
			if (result.status() == ExecutionStatus.SUCCESS) {
				successful++;
				records += result.recordCount();
			}
			else if (result.status() == ExecutionStatus.TIMEOUT) {
				timedOut++;
			}
			else {
				failed++;
			}
			confidenceSum += result.confidence();
		}
		double average = outcomes.isEmpty() ? 0.0 : confidenceSum / outcomes.size();
		return new BatchStatistics(outcomes.size(), successful, failed, timedOut, records, average);
	}

	public double successRate() {
		return total == 0 ? 0.0 : (double) successful / total;
	}
}
