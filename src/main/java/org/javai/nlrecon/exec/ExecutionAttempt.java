package org.javai.nlrecon.exec;

import java.time.Instant;

/**
 * Record of one statement execution.
 *
 * @param kind first attempt or schema-less retry
 * @param sqlText statement sent to the database
 * @param startedAt when the attempt started
 * @param outcome result of the attempt
 * @param durationMillis time taken in milliseconds
 * @param errorDetails driver message when the attempt did not succeed, null otherwise
 */
public record ExecutionAttempt(
		AttemptKind kind,
		String sqlText,
		Instant startedAt,
		AttemptOutcome outcome,
		long durationMillis,
		String errorDetails
) {

	public ExecutionAttempt {
		if (kind == null) {
			throw new IllegalArgumentException("kind must not be null");
		}
		if (sqlText == null || sqlText.isBlank()) {
			throw new IllegalArgumentException("sqlText must not be blank");
		}
		if (startedAt == null) {
			throw new IllegalArgumentException("startedAt must not be null");
		}
		if (outcome == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
	}

	public boolean isSuccess() {
		return outcome == AttemptOutcome.SUCCESS;
	}
}
