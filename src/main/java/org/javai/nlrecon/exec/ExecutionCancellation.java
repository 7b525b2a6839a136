package org.javai.nlrecon.exec;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cancellation shared by the executions of one batch.
 *
 * <p>Cancelling stops attempts that have not started and cancels statements that are
 * running. Completed attempts are unaffected.</p>
 */
public final class ExecutionCancellation {

	private static final Logger logger = LoggerFactory.getLogger(ExecutionCancellation.class);

	private final Set<Statement> running = ConcurrentHashMap.newKeySet();
	private volatile boolean cancelled;

	public void cancel() {
		cancelled = true;
		for (Statement statement : running) {
			try {
				statement.cancel();
			}
			catch (SQLException e) {
				logger.warn("Failed to cancel running statement: {}", e.getMessage());
			}
		}
	}

	public boolean isCancelled() {
		return cancelled;
	}

	void register(Statement statement) {
		running.add(statement);
	}

	void unregister(Statement statement) {
		running.remove(statement);
	}
}
