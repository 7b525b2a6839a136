package org.javai.nlrecon;

/**
 * Classified reasons a definition did not produce a successful result.
 */
public enum ReconciliationErrorType {
	/** A table or column mention could not be resolved, or resolved ambiguously. */
	UNRESOLVED_ENTITY,
	/** The resolved tables are not connected by the knowledge graph. */
	NO_JOIN_PATH,
	/** A column hint matched several columns equally well. */
	AMBIGUOUS_COLUMN,
	/** The database rejected the statement. */
	EXECUTION_FAILURE,
	/** The statement exceeded its timeout. */
	TIMEOUT,
	/** The pipeline confidence fell below the requested minimum; nothing was executed. */
	LOW_CONFIDENCE,
	/** The batch was cancelled before the definition completed. */
	CANCELLED
}
