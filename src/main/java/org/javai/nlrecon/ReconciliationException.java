package org.javai.nlrecon;

import java.util.List;

/**
 * Base exception for classified reconciliation failures.
 */
public class ReconciliationException extends RuntimeException {

	private final ReconciliationErrorType errorType;
	private final List<String> details;

	public ReconciliationException(ReconciliationErrorType errorType, String message) {
		this(errorType, message, List.of());
	}

	public ReconciliationException(ReconciliationErrorType errorType, String message, List<String> details) {
		super(message);
		this.errorType = errorType;
		this.details = details != null ? List.copyOf(details) : List.of();
	}

	public ReconciliationErrorType errorType() {
		return errorType;
	}

	/**
	 * Diagnostic details such as the candidates considered for an unresolved mention.
	 */
	public List<String> details() {
		return details;
	}
}
