package org.javai.nlrecon.exec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.nlrecon.ReconciliationConfig;
import org.javai.nlrecon.ReconciliationErrorType;
import org.javai.nlrecon.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ReconciliationExecutor")
class ReconciliationExecutorTest {

	private static final String QUALIFIED_SQL = """
			SELECT TOP 1000 s.*
			FROM [dbo].[brz_lnd_RBP_GPU] s
			LEFT JOIN [dbo].[brz_lnd_OPS_EXCEL_GPU] t ON s.[Material] = t.[PLANNING_SKU]
			WHERE t.[PLANNING_SKU] IS NULL""";

	private static final String BARE_SQL = "SELECT TOP 1000 s.*\nFROM [brz_lnd_RBP_GPU] s";

	private Connection connection;
	private Statement statement;
	private ResultSet resultSet;

	private final ReconciliationExecutor executor = new ReconciliationExecutor();

	@BeforeEach
	void setUp() throws SQLException {
		connection = mock(Connection.class);
		statement = mock(Statement.class);
		resultSet = mock(ResultSet.class);
		ResultSetMetaData metaData = mock(ResultSetMetaData.class);

		when(connection.createStatement()).thenReturn(statement);
		when(resultSet.getMetaData()).thenReturn(metaData);
		when(metaData.getColumnCount()).thenReturn(2);
		when(metaData.getColumnLabel(1)).thenReturn("Material");
		when(metaData.getColumnLabel(2)).thenReturn("Plant");
		when(resultSet.next()).thenReturn(true, true, false);
		when(resultSet.getObject(1)).thenReturn("M-100", "M-200");
		when(resultSet.getObject(2)).thenReturn("DE01", "US02");
	}

	private static SQLException invalidObjectName() {
		return new SQLException("Invalid object name 'dbo.brz_lnd_RBP_GPU'.", "S0002", 208);
	}

	@Nested
	@DisplayName("Success")
	class Success {

		@Test
		@DisplayName("counts rows and keeps them as label-keyed samples")
		void rows() throws SQLException {
			when(statement.executeQuery(anyString())).thenReturn(resultSet);

			ExecutionResult result = executor.execute(QUALIFIED_SQL, connection, 30, 0.85);

			assertThat(result.status()).isEqualTo(ExecutionStatus.SUCCESS);
			assertThat(result.recordCount()).isEqualTo(2);
			assertThat(result.sampleRecords()).containsExactly(
					Map.of("Material", "M-100", "Plant", "DE01"),
					Map.of("Material", "M-200", "Plant", "US02"));
			assertThat(result.confidence()).isEqualTo(0.85);
			assertThat(result.errorType()).isNull();
			assertThat(result.attempts()).singleElement()
					.satisfies(attempt -> {
						assertThat(attempt.kind()).isEqualTo(AttemptKind.FIRST);
						assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.SUCCESS);
						assertThat(attempt.errorDetails()).isNull();
					});
			verify(statement).setQueryTimeout(30);
			verify(statement).close();
		}

		@Test
		@DisplayName("the sample is capped but the count is not")
		void sampleCap() throws SQLException {
			when(statement.executeQuery(anyString())).thenReturn(resultSet);
			ReconciliationExecutor capped = new ReconciliationExecutor(ReconciliationConfig.builder().sampleCap(1).build());

			ExecutionResult result = capped.execute(QUALIFIED_SQL, connection, 30);

			assertThat(result.recordCount()).isEqualTo(2);
			assertThat(result.sampleRecords()).hasSize(1);
		}
	}

	@Nested
	@DisplayName("Schema fallback")
	class SchemaFallback {

		@Test
		@DisplayName("retries once without schema after a missing object")
		void retriesWithoutSchema() throws SQLException {
			when(statement.executeQuery(anyString())).thenAnswer(invocation -> {
				String sql = invocation.getArgument(0);
				if (sql.contains("[dbo].")) {
					throw invalidObjectName();
				}
				return resultSet;
			});

			ExecutionResult result;
			try (LogCaptorAppender logs = LogCaptorAppender.capture(ReconciliationExecutor.class, Level.INFO)) {
				result = executor.execute(QUALIFIED_SQL, connection, 30);

				assertThat(logs.messagesAt(Level.INFO)).anyMatch(message -> message.contains("retrying once without schema"));
			}

			assertThat(result.isSuccess()).isTrue();
			assertThat(result.attempts()).hasSize(2);
			assertThat(result.attempts().get(0).outcome()).isEqualTo(AttemptOutcome.FAILED);
			assertThat(result.attempts().get(0).errorDetails()).contains("Invalid object name", "[SQLState S0002]", "[code 208]");
			assertThat(result.attempts().get(1).kind()).isEqualTo(AttemptKind.RETRY_NO_SCHEMA);
			assertThat(result.lastSql()).doesNotContain("[dbo].").contains("[brz_lnd_RBP_GPU]");
			verify(statement, times(2)).close();
		}

		@Test
		@DisplayName("fails after the retry fails too")
		void retryFails() throws SQLException {
			when(statement.executeQuery(anyString())).thenThrow(invalidObjectName());

			ExecutionResult result = executor.execute(QUALIFIED_SQL, connection, 30);

			assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
			assertThat(result.errorType()).isEqualTo(ReconciliationErrorType.EXECUTION_FAILURE);
			assertThat(result.attempts()).extracting(ExecutionAttempt::kind)
					.containsExactly(AttemptKind.FIRST, AttemptKind.RETRY_NO_SCHEMA);
		}

		@Test
		@DisplayName("other failures are not retried")
		void otherFailure() throws SQLException {
			when(statement.executeQuery(anyString()))
					.thenThrow(new SQLException("Invalid column name 'Foo'.", "42S22", 207));

			ExecutionResult result = executor.execute(QUALIFIED_SQL, connection, 30);

			assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
			assertThat(result.attempts()).hasSize(1);
			assertThat(result.errorMessage()).contains("Invalid column name");
		}

		@Test
		@DisplayName("unqualified statements are not retried")
		void unqualified() throws SQLException {
			when(statement.executeQuery(anyString())).thenThrow(invalidObjectName());

			ExecutionResult result = executor.execute(BARE_SQL, connection, 30);

			assertThat(result.attempts()).hasSize(1);
			assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
		}
	}

	@Nested
	@DisplayName("Timeout and cancellation")
	class TimeoutAndCancellation {

		@Test
		@DisplayName("a timeout cancels the statement and closes the connection")
		void timeout() throws SQLException {
			when(statement.executeQuery(anyString())).thenThrow(new SQLTimeoutException("Query timed out"));

			ExecutionResult result = executor.execute(QUALIFIED_SQL, connection, 5);

			assertThat(result.status()).isEqualTo(ExecutionStatus.TIMEOUT);
			assertThat(result.errorType()).isEqualTo(ReconciliationErrorType.TIMEOUT);
			assertThat(result.errorMessage()).contains("5s");
			assertThat(result.attempts()).singleElement()
					.satisfies(attempt -> assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.TIMEOUT));
			verify(statement).setQueryTimeout(5);
			verify(statement).cancel();
			verify(connection).close();
		}

		@Test
		@DisplayName("a cancelled batch runs nothing")
		void cancelledBefore() {
			ExecutionCancellation cancellation = new ExecutionCancellation();
			cancellation.cancel();

			ExecutionResult result = executor.execute(QUALIFIED_SQL, connection, 30, 0.9, cancellation);

			assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
			assertThat(result.errorType()).isEqualTo(ReconciliationErrorType.CANCELLED);
			assertThat(result.attempts()).isEmpty();
			verifyNoInteractions(connection);
		}

		@Test
		@DisplayName("cancelling a running statement ends the execution without retry")
		void cancelledWhileRunning() throws SQLException {
			ExecutionCancellation cancellation = new ExecutionCancellation();
			when(statement.executeQuery(anyString())).thenAnswer(invocation -> {
				cancellation.cancel();
				throw invalidObjectName();
			});

			ExecutionResult result = executor.execute(QUALIFIED_SQL, connection, 30, 0.9, cancellation);

			assertThat(result.errorType()).isEqualTo(ReconciliationErrorType.CANCELLED);
			assertThat(result.attempts()).singleElement()
					.satisfies(attempt -> assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.CANCELLED));
			verify(statement).cancel();
			verify(connection, never()).close();
		}

		@Test
		@DisplayName("a cancel arriving before the statement is registered still stops the attempt")
		void cancelledBeforeRegistration() throws SQLException {
			ExecutionCancellation cancellation = new ExecutionCancellation();
			when(connection.createStatement()).thenAnswer(invocation -> {
				cancellation.cancel();
				return statement;
			});

			ExecutionResult result = executor.execute(QUALIFIED_SQL, connection, 30, 0.9, cancellation);

			assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
			assertThat(result.errorType()).isEqualTo(ReconciliationErrorType.CANCELLED);
			assertThat(result.attempts()).singleElement()
					.satisfies(attempt -> assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.CANCELLED));
			verify(statement, never()).executeQuery(anyString());
			verify(statement).close();
		}

		@Test
		@DisplayName("the timeout must be positive")
		void invalidTimeout() {
			assertThatThrownBy(() -> executor.execute(QUALIFIED_SQL, connection, 0))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}
}
