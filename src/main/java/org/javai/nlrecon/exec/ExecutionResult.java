package org.javai.nlrecon.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.nlrecon.ReconciliationErrorType;

/**
 * Terminal, immutable result of executing (or declining to execute) one definition.
 *
 * @param attempts every attempt made, in order; empty when nothing was executed
 * @param status terminal status
 * @param recordCount number of rows returned
 * @param sampleRecords up to the sample cap of rows, column label to value
 * @param errorMessage explanation when the status is not SUCCESS
 * @param errorType classified error when the status is not SUCCESS
 * @param confidence minimum confidence across classification, resolution and join planning
 */
public record ExecutionResult(
		List<ExecutionAttempt> attempts,
		ExecutionStatus status,
		int recordCount,
		List<Map<String, Object>> sampleRecords,
		String errorMessage,
		ReconciliationErrorType errorType,
		double confidence
) {

	public ExecutionResult {
		if (status == null) {
			throw new IllegalArgumentException("status must not be null");
		}
		if (recordCount < 0) {
			throw new IllegalArgumentException("recordCount must be >= 0");
		}
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be within [0, 1]");
		}
		if (status == ExecutionStatus.SUCCESS && errorType != null) {
			throw new IllegalArgumentException("a successful result carries no error type");
		}
		if (status != ExecutionStatus.SUCCESS && errorType == null) {
			throw new IllegalArgumentException("an unsuccessful result needs an error type");
		}
		attempts = attempts != null ? List.copyOf(attempts) : List.of();
		sampleRecords = copyRows(sampleRecords);
	}

	public static ExecutionResult success(List<ExecutionAttempt> attempts, int recordCount,
			List<Map<String, Object>> sampleRecords, double confidence) {
		return new ExecutionResult(attempts, ExecutionStatus.SUCCESS, recordCount, sampleRecords, null, null, confidence);
	}

	public static ExecutionResult failed(List<ExecutionAttempt> attempts, ReconciliationErrorType errorType,
			String errorMessage, double confidence) {
		return new ExecutionResult(attempts, ExecutionStatus.FAILED, 0, List.of(), errorMessage, errorType, confidence);
	}

	public static ExecutionResult timeout(List<ExecutionAttempt> attempts, String errorMessage, double confidence) {
		return new ExecutionResult(attempts, ExecutionStatus.TIMEOUT, 0, List.of(), errorMessage,
				ReconciliationErrorType.TIMEOUT, confidence);
	}

	/**
	 * A failure decided before any statement ran.
	 */
	public static ExecutionResult notExecuted(ReconciliationErrorType errorType, String errorMessage, double confidence) {
		return failed(List.of(), errorType, errorMessage, confidence);
	}

	public boolean isSuccess() {
		return status == ExecutionStatus.SUCCESS;
	}

	/**
	 * The statement of the last attempt, or null when nothing ran.
	 */
	public String lastSql() {
		return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).sqlText();
	}

	private static List<Map<String, Object>> copyRows(List<Map<String, Object>> rows) {
		if (rows == null || rows.isEmpty()) {
			return List.of();
		}
		List<Map<String, Object>> copy = new ArrayList<>(rows.size());
		for (Map<String, Object> row : rows) {
			copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
		}
		return Collections.unmodifiableList(copy);
	}
}
