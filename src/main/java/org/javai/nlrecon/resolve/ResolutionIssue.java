package org.javai.nlrecon.resolve;

import java.util.List;
import org.javai.nlrecon.ReconciliationErrorType;

/**
 * Why part of an intent could not be resolved.
 *
 * @param type classified error
 * @param mention mention or hint concerned
 * @param message human-readable explanation
 * @param candidates names considered, best first
 */
public record ResolutionIssue(ReconciliationErrorType type, String mention, String message, List<String> candidates) {

	public ResolutionIssue {
		candidates = candidates != null ? List.copyOf(candidates) : List.of();
	}
}
