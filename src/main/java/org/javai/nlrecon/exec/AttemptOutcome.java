package org.javai.nlrecon.exec;

/**
 * Outcome of a single execution attempt.
 */
public enum AttemptOutcome {
	SUCCESS,
	FAILED,
	TIMEOUT,
	CANCELLED
}
