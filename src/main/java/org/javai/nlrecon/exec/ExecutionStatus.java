package org.javai.nlrecon.exec;

/**
 * Terminal status of an execution.
 */
public enum ExecutionStatus {
	SUCCESS,
	FAILED,
	TIMEOUT
}
