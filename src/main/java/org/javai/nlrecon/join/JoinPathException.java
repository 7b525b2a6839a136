package org.javai.nlrecon.join;

import java.util.List;
import org.javai.nlrecon.ReconciliationErrorType;
import org.javai.nlrecon.ReconciliationException;

/**
 * Thrown when two requested tables are not connected through the knowledge graph.
 */
public class JoinPathException extends ReconciliationException {

	public JoinPathException(String from, String to) {
		super(ReconciliationErrorType.NO_JOIN_PATH,
				"No join path from " + from + " to " + to + " in the knowledge graph",
				List.of(from, to));
	}
}
