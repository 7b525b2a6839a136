package org.javai.nlrecon.exec;

public enum AttemptKind {
	/** The statement as generated. */
	FIRST,
	/** The statement with schema qualifiers removed, after a missing-object failure. */
	RETRY_NO_SCHEMA
}
