package org.javai.nlrecon.exec;

/**
 * Coarse classification of a driver failure.
 */
public enum FailureClass {
	/** The referenced table, view or schema does not exist. */
	OBJECT_NOT_FOUND,
	/** The statement exceeded its timeout. */
	TIMEOUT,
	OTHER
}
