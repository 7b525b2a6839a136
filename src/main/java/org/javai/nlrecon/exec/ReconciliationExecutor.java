package org.javai.nlrecon.exec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.nlrecon.ReconciliationConfig;
import org.javai.nlrecon.ReconciliationErrorType;
import org.javai.nlrecon.sql.SqlGenerationException;
import org.javai.nlrecon.sql.SqlStatements;

/**
 * Runs a generated statement on a connection and produces an {@link ExecutionResult}.
 *
 * <p>An execution moves from {@code PENDING} to {@code RUNNING} and ends in exactly one of
 * {@code SUCCESS}, {@code FAILED} or {@code TIMEOUT}. At most two attempts are made: the
 * statement as given and, only when the first attempt fails because an object was not
 * found and the statement uses schema-qualified tables, the same statement without
 * schema qualifiers.</p>
 *
 * <p>Timeouts are enforced by the driver. On timeout the statement is cancelled and the
 * connection closed.</p>
 */
public final class ReconciliationExecutor {

	private static final ExecutionLogger executionLogger = new ExecutionLogger(ReconciliationExecutor.class);

	enum State {
		PENDING,
		RUNNING,
		SUCCESS,
		FAILED,
		TIMEOUT
	}

	private final int sampleCap;
	private final FailureClassifier failureClassifier;

	public ReconciliationExecutor() {
		this(ReconciliationConfig.defaults());
	}

	public ReconciliationExecutor(ReconciliationConfig config) {
		ReconciliationConfig effective = config != null ? config : ReconciliationConfig.defaults();
		this.sampleCap = effective.sampleCap();
		this.failureClassifier = new FailureClassifier(effective.notFoundMessagePatterns());
	}

	public ExecutionResult execute(String sql, Connection connection, int timeoutSeconds) {
		return execute(sql, connection, timeoutSeconds, 1.0, new ExecutionCancellation());
	}

	public ExecutionResult execute(String sql, Connection connection, int timeoutSeconds, double confidence) {
		return execute(sql, connection, timeoutSeconds, confidence, new ExecutionCancellation());
	}

	/**
	 * @param sql statement to run
	 * @param connection connection owned by this execution
	 * @param timeoutSeconds driver query timeout per attempt
	 * @param confidence pipeline confidence carried into the result
	 * @param cancellation batch cancellation
	 */
	public ExecutionResult execute(String sql, Connection connection, int timeoutSeconds, double confidence,
			ExecutionCancellation cancellation) {
		Objects.requireNonNull(sql, "sql must not be null");
		Objects.requireNonNull(connection, "connection must not be null");
		Objects.requireNonNull(cancellation, "cancellation must not be null");
		if (timeoutSeconds < 1) {
			throw new IllegalArgumentException("timeoutSeconds must be positive");
		}

		Run run = new Run();
		List<ExecutionAttempt> attempts = new ArrayList<>();
		AttemptKind kind = AttemptKind.FIRST;
		String statementSql = sql;

		while (true) {
			if (cancellation.isCancelled()) {
				executionLogger.attemptCancelled(kind);
				run.advance(State.FAILED);
				return ExecutionResult.failed(attempts, ReconciliationErrorType.CANCELLED,
						"Cancelled before " + kind + " attempt", confidence);
			}

			run.advance(State.RUNNING);
			AttemptResult result = runAttempt(kind, statementSql, connection, timeoutSeconds, cancellation);
			attempts.add(result.attempt());

			switch (result.attempt().outcome()) {
				case SUCCESS -> {
					run.advance(State.SUCCESS);
					return ExecutionResult.success(attempts, result.recordCount(), result.rows(), confidence);
				}
				case TIMEOUT -> {
					run.advance(State.TIMEOUT);
					return ExecutionResult.timeout(attempts,
							"Query exceeded timeout of " + timeoutSeconds + "s", confidence);
				}
				case CANCELLED -> {
					run.advance(State.FAILED);
					return ExecutionResult.failed(attempts, ReconciliationErrorType.CANCELLED,
							"Cancelled while running", confidence);
				}
				case FAILED -> {
					String retrySql = kind == AttemptKind.FIRST && result.failureClass() == FailureClass.OBJECT_NOT_FOUND
							? withoutSchema(statementSql)
							: null;
					if (retrySql == null) {
						run.advance(State.FAILED);
						return ExecutionResult.failed(attempts, ReconciliationErrorType.EXECUTION_FAILURE,
								result.attempt().errorDetails(), confidence);
					}
					executionLogger.retryingWithoutSchema(retrySql);
					kind = AttemptKind.RETRY_NO_SCHEMA;
					statementSql = retrySql;
				}
			}
		}
	}

	/**
	 * The statement without schema qualifiers, or null when it has none or cannot be parsed.
	 */
	private static String withoutSchema(String sql) {
		try {
			if (!SqlStatements.isSchemaQualified(sql)) {
				return null;
			}
			return SqlStatements.stripSchema(sql);
		}
		catch (SqlGenerationException e) {
			executionLogger.debug("Statement not eligible for schema fallback: {}", e.getMessage());
			return null;
		}
	}

	private AttemptResult runAttempt(AttemptKind kind, String sql, Connection connection, int timeoutSeconds,
			ExecutionCancellation cancellation) {
		Instant startedAt = Instant.now();
		long start = System.nanoTime();
		executionLogger.attemptStarted(kind, sql, timeoutSeconds);

		Statement statement = null;
		try {
			statement = connection.createStatement();
			cancellation.register(statement);
			// cancel() may have run before the statement was registered
			if (cancellation.isCancelled()) {
				executionLogger.attemptCancelled(kind);
				return AttemptResult.failure(new ExecutionAttempt(kind, sql, startedAt, AttemptOutcome.CANCELLED,
						elapsedMillis(start), "Cancelled before the statement ran"), null);
			}
			statement.setQueryTimeout(timeoutSeconds);
			List<Map<String, Object>> rows = new ArrayList<>();
			int count = 0;
			try (ResultSet resultSet = statement.executeQuery(sql)) {
				ResultSetMetaData metaData = resultSet.getMetaData();
				int columns = metaData.getColumnCount();
				while (resultSet.next()) {
					count++;
					if (rows.size() < sampleCap) {
						rows.add(readRow(resultSet, metaData, columns));
					}
				}
			}
			ExecutionAttempt attempt = new ExecutionAttempt(kind, sql, startedAt, AttemptOutcome.SUCCESS,
					elapsedMillis(start), null);
			executionLogger.attemptSucceeded(attempt, count);
			return new AttemptResult(attempt, null, count, rows);
		}
		catch (SQLException e) {
			String details = describe(e);
			if (cancellation.isCancelled()) {
				executionLogger.attemptCancelled(kind);
				return AttemptResult.failure(new ExecutionAttempt(kind, sql, startedAt, AttemptOutcome.CANCELLED,
						elapsedMillis(start), details), null);
			}
			FailureClass failureClass = failureClassifier.classify(e);
			if (failureClass == FailureClass.TIMEOUT) {
				ExecutionAttempt attempt = new ExecutionAttempt(kind, sql, startedAt, AttemptOutcome.TIMEOUT,
						elapsedMillis(start), details);
				abandon(statement, connection);
				executionLogger.attemptTimedOut(attempt, timeoutSeconds);
				return AttemptResult.failure(attempt, failureClass);
			}
			ExecutionAttempt attempt = new ExecutionAttempt(kind, sql, startedAt, AttemptOutcome.FAILED,
					elapsedMillis(start), details);
			executionLogger.attemptFailed(attempt, failureClass);
			return AttemptResult.failure(attempt, failureClass);
		}
		finally {
			if (statement != null) {
				cancellation.unregister(statement);
				close(statement);
			}
		}
	}

	private static Map<String, Object> readRow(ResultSet resultSet, ResultSetMetaData metaData, int columns)
			throws SQLException {
		Map<String, Object> row = new LinkedHashMap<>();
		for (int i = 1; i <= columns; i++) {
			String label = metaData.getColumnLabel(i);
			if (label == null || label.isBlank()) {
				label = metaData.getColumnName(i);
			}
			row.put(label, resultSet.getObject(i));
		}
		return row;
	}

	private static void abandon(Statement statement, Connection connection) {
		if (statement != null) {
			try {
				statement.cancel();
			}
			catch (SQLException e) {
				executionLogger.warn("Failed to cancel timed-out statement: {}", e.getMessage());
			}
		}
		try {
			connection.close();
		}
		catch (SQLException e) {
			executionLogger.warn("Failed to close connection after timeout: {}", e.getMessage());
		}
	}

	private static void close(Statement statement) {
		try {
			statement.close();
		}
		catch (SQLException e) {
			executionLogger.debug("Failed to close statement: {}", e.getMessage());
		}
	}

	private static String describe(SQLException e) {
		StringBuilder details = new StringBuilder(String.valueOf(e.getMessage()));
		if (e.getSQLState() != null) {
			details.append(" [SQLState ").append(e.getSQLState()).append(']');
		}
		if (e.getErrorCode() != 0) {
			details.append(" [code ").append(e.getErrorCode()).append(']');
		}
		return details.toString();
	}

	private static long elapsedMillis(long startNanos) {
		return Math.max(0L, (System.nanoTime() - startNanos) / 1_000_000L);
	}

	private record AttemptResult(ExecutionAttempt attempt, FailureClass failureClass, int recordCount,
			List<Map<String, Object>> rows) {

		static AttemptResult failure(ExecutionAttempt attempt, FailureClass failureClass) {
			return new AttemptResult(attempt, failureClass, 0, List.of());
		}
	}

	/**
	 * Tracks the execution state and rejects transitions out of a terminal state.
	 */
	private static final class Run {
		private State state = State.PENDING;

		void advance(State next) {
			if (state == State.SUCCESS || state == State.FAILED || state == State.TIMEOUT) {
				throw new IllegalStateException("Execution already finished with " + state);
			}
			executionLogger.debug("Execution state {} -> {}", state, next);
			state = next;
		}
	}
}
