package org.javai.nlrecon.exec;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.List;
import org.javai.nlrecon.ReconciliationConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("FailureClassifier")
class FailureClassifierTest {

	private final FailureClassifier classifier =
			new FailureClassifier(ReconciliationConfig.DEFAULT_NOT_FOUND_PATTERNS);

	@ParameterizedTest(name = "{0} / {1} -> {3}")
	@CsvSource(delimiter = '|', value = {
			"42S02 | 0    | Base table not found                        | OBJECT_NOT_FOUND",
			"42P01 | 0    | relation x does not exist                   | OBJECT_NOT_FOUND",
			"S0002 | 208  | Invalid object name dbo.x                   | OBJECT_NOT_FOUND",
			"42000 | 1146 | Table db.x does not exist                   | OBJECT_NOT_FOUND",
			"42000 | 942  | ORA-00942: table or view does not exist     | OBJECT_NOT_FOUND",
			"HYT00 | 0    | Query timeout expired                       | TIMEOUT",
			"57014 | 0    | canceling statement due to statement timeout | TIMEOUT",
			"42S22 | 207  | Invalid column name x                       | OTHER",
			"08S01 | 0    | Communication link failure                  | OTHER"
	})
	@DisplayName("classifies by state, vendor code and message")
	void classifies(String state, int code, String message, FailureClass expected) {
		assertThat(classifier.classify(new SQLException(message, state, code))).isEqualTo(expected);
	}

	@Test
	@DisplayName("falls back to message fragments without state or code")
	void messageOnly() {
		assertThat(classifier.classify(new SQLException("no such table: staging"))).isEqualTo(FailureClass.OBJECT_NOT_FOUND);
		assertThat(classifier.classify(new SQLException("deadlock victim"))).isEqualTo(FailureClass.OTHER);
	}

	@Test
	@DisplayName("SQLTimeoutException is a timeout")
	void timeoutException() {
		assertThat(classifier.classify(new SQLTimeoutException("timed out"))).isEqualTo(FailureClass.TIMEOUT);
	}

	@Test
	@DisplayName("looks through chained exceptions")
	void chained() {
		SQLException outer = new SQLException("Statement could not be prepared", "42000", 8180);
		outer.setNextException(invalidObject());

		assertThat(classifier.classify(outer)).isEqualTo(FailureClass.OBJECT_NOT_FOUND);
	}

	@Test
	@DisplayName("uses the configured message patterns")
	void customPatterns() {
		FailureClassifier custom = new FailureClassifier(List.of("OBJEKT NICHT GEFUNDEN"));

		assertThat(custom.classify(new SQLException("Objekt nicht gefunden: x"))).isEqualTo(FailureClass.OBJECT_NOT_FOUND);
		assertThat(custom.classify(new SQLException("no such table: x"))).isEqualTo(FailureClass.OTHER);
	}

	private static SQLException invalidObject() {
		return new SQLException("Invalid object name 'dbo.x'.", "S0002", 208);
	}
}
