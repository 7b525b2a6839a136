package org.javai.nlrecon;

import org.javai.nlrecon.exec.ExecutionResult;
import org.javai.nlrecon.intent.QueryIntent;

/**
 * Everything produced for one definition of a request.
 *
 * @param definition the definition text
 * @param intent classification result
 * @param mapping resolved tables and join columns, null when resolution was not reached
 * @param sql generated statement, null when generation was not reached
 * @param result execution result; always present
 */
public record DefinitionOutcome(
		String definition,
		QueryIntent intent,
		ResolvedMapping mapping,
		String sql,
		ExecutionResult result
) {

	public DefinitionOutcome {
		if (result == null) {
			throw new IllegalArgumentException("result must not be null");
		}
	}
}
