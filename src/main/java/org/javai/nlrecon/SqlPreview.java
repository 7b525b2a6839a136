package org.javai.nlrecon;

import org.javai.nlrecon.intent.QueryIntent;

/**
 * The statement a definition would run, without running it.
 *
 * @param definition the definition text
 * @param intent classification result
 * @param mapping resolved tables, null when resolution was not reached
 * @param sql generated statement, null when it could not be generated
 * @param confidence pipeline confidence so far
 * @param errorType why no statement was generated, null when one was
 * @param errorMessage explanation accompanying {@code errorType}
 */
public record SqlPreview(
		String definition,
		QueryIntent intent,
		ResolvedMapping mapping,
		String sql,
		double confidence,
		ReconciliationErrorType errorType,
		String errorMessage
) {

	public boolean hasSql() {
		return sql != null;
	}
}
