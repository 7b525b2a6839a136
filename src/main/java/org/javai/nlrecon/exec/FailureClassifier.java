package org.javai.nlrecon.exec;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies {@link SQLException}s by SQLState, vendor code and message.
 *
 * <ul>
 *   <li>SQLState {@code 42S02} (ODBC), {@code 42P01} and {@code 3F000} (PostgreSQL),
 *   {@code 42Y07} (Derby) mean a missing table or schema</li>
 *   <li>vendor codes 208 (SQL Server "Invalid object name"), 1146 (MySQL) and 942
 *   (Oracle ORA-00942) mean the same</li>
 *   <li>otherwise the message is searched for the configured fragments</li>
 * </ul>
 */
public final class FailureClassifier {

	private static final Set<String> NOT_FOUND_STATES = Set.of("42S02", "42P01", "3F000", "42Y07");
	private static final Set<String> MISSING_COLUMN_STATES = Set.of("42S22", "42703");
	private static final Set<String> TIMEOUT_STATES = Set.of("HYT00", "HYT01", "57014");
	private static final Set<Integer> NOT_FOUND_VENDOR_CODES = Set.of(208, 1146, 942);

	private final List<String> messagePatterns;

	public FailureClassifier(List<String> messagePatterns) {
		this.messagePatterns = messagePatterns.stream()
				.map(pattern -> pattern.toLowerCase(Locale.ROOT))
				.toList();
	}

	public FailureClass classify(SQLException exception) {
		SQLException current = exception;
		int guard = 0;
		while (current != null && guard++ < 10) {
			FailureClass found = classifyOne(current);
			if (found != FailureClass.OTHER) {
				return found;
			}
			current = next(current);
		}
		return FailureClass.OTHER;
	}

	private FailureClass classifyOne(SQLException exception) {
		if (exception instanceof SQLTimeoutException) {
			return FailureClass.TIMEOUT;
		}
		String state = exception.getSQLState();
		if (state != null) {
			if (TIMEOUT_STATES.contains(state)) {
				return FailureClass.TIMEOUT;
			}
			if (NOT_FOUND_STATES.contains(state)) {
				return FailureClass.OBJECT_NOT_FOUND;
			}
			if (MISSING_COLUMN_STATES.contains(state)) {
				return FailureClass.OTHER;
			}
		}
		if (NOT_FOUND_VENDOR_CODES.contains(exception.getErrorCode())) {
			return FailureClass.OBJECT_NOT_FOUND;
		}
		String message = exception.getMessage();
		if (message != null) {
			String lower = message.toLowerCase(Locale.ROOT);
			if (messagePatterns.stream().anyMatch(lower::contains)) {
				return FailureClass.OBJECT_NOT_FOUND;
			}
		}
		return FailureClass.OTHER;
	}

	private static SQLException next(SQLException exception) {
		if (exception.getNextException() != null) {
			return exception.getNextException();
		}
		return exception.getCause() instanceof SQLException cause ? cause : null;
	}
}
