package org.javai.nlrecon.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ExecutionLogger {

	private static final int MAX_SQL_LENGTH = 400;

	private final Logger logger;

	public ExecutionLogger(Class<?> executorClass) {
		this.logger = LoggerFactory.getLogger(executorClass);
	}

	public void attemptStarted(AttemptKind kind, String sql, int timeoutSeconds) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug("[{}] executing with timeout {}s: {}", kind, timeoutSeconds, summarize(sql));
	}

	public void attemptSucceeded(ExecutionAttempt attempt, int recordCount) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("[{}] succeeded in {} ms with {} records", attempt.kind(), attempt.durationMillis(), recordCount);
	}

	public void attemptFailed(ExecutionAttempt attempt, FailureClass failureClass) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("[{}] failed after {} ms ({}): {} | sql: {}",
				attempt.kind(),
				attempt.durationMillis(),
				failureClass,
				attempt.errorDetails(),
				summarize(attempt.sqlText()));
	}

	public void attemptTimedOut(ExecutionAttempt attempt, int timeoutSeconds) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("[{}] timed out after {} ms (limit {}s); statement cancelled and connection closed",
				attempt.kind(), attempt.durationMillis(), timeoutSeconds);
	}

	public void attemptCancelled(AttemptKind kind) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("[{}] cancelled", kind);
	}

	public void retryingWithoutSchema(String retrySql) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("Object not found with schema-qualified names; retrying once without schema: {}",
				summarize(retrySql));
	}

	public void debug(String format, Object... args) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug(format, args);
	}

	public void warn(String format, Object... args) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn(format, args);
	}

	private static String summarize(String sql) {
		if (sql == null) {
			return "<null>";
		}
		String flat = sql.replaceAll("\\s+", " ").trim();
		return flat.length() > MAX_SQL_LENGTH ? flat.substring(0, MAX_SQL_LENGTH) + "..." : flat;
	}
}
