package org.javai.nlrecon.resolve;

import org.javai.nlrecon.ReconciliationException;

/**
 * Thrown when an incomplete resolution is used as if it were complete.
 */
public class ResolutionException extends ReconciliationException {

	private final ResolutionIssue issue;

	public ResolutionException(ResolutionIssue issue) {
		super(issue.type(), issue.message(), issue.candidates());
		this.issue = issue;
	}

	public ResolutionIssue issue() {
		return issue;
	}
}
