package org.javai.nlrecon;

import java.util.ArrayList;
import java.util.List;
import org.javai.nlrecon.sql.Dialect;

/**
 * A batch of natural-language reconciliation definitions to run against one knowledge graph.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ReconciliationRequest request = ReconciliationRequest.builder()
 *         .definition("Show me all products in RBP which are not in OPS Excel")
 *         .kgName("gpu-planning")
 *         .dialect(Dialect.SQL_SERVER)
 *         .build();
 * }</pre>
 *
 * @param definitions the definitions, processed independently and reported in this order
 * @param kgName name of a registered knowledge graph; never {@code "default"}
 * @param schemas schemas table resolution is restricted to; empty for all
 * @param useLlm whether the configured entity extractor assists classification
 * @param minConfidence definitions below this confidence are not executed
 * @param dialect target database family
 * @param limitRecords row limit per statement, null for the configured default
 * @param timeoutSeconds statement timeout, null for the configured default
 */
public record ReconciliationRequest(
		List<String> definitions,
		String kgName,
		List<String> schemas,
		boolean useLlm,
		double minConfidence,
		Dialect dialect,
		Integer limitRecords,
		Integer timeoutSeconds
) {

	static final String RESERVED_KG_NAME = "default";

	public ReconciliationRequest {
		definitions = definitions != null ? List.copyOf(definitions) : List.of();
		schemas = schemas != null ? List.copyOf(schemas) : List.of();
		dialect = dialect != null ? dialect : Dialect.SQL_SERVER;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Checks everything that can be checked without the knowledge graph registry.
	 *
	 * @throws InvalidRequestException describing the first problem found
	 */
	public ReconciliationRequest validate() {
		if (kgName == null || kgName.isBlank()) {
			throw new InvalidRequestException("A knowledge graph name is required");
		}
		if (RESERVED_KG_NAME.equalsIgnoreCase(kgName.trim())) {
			throw new InvalidRequestException(
					"Knowledge graph name '" + kgName + "' is reserved; select a specific knowledge graph");
		}
		if (definitions.isEmpty()) {
			throw new InvalidRequestException("At least one definition is required");
		}
		for (int i = 0; i < definitions.size(); i++) {
			String definition = definitions.get(i);
			if (definition == null || definition.isBlank()) {
				throw new InvalidRequestException("Definition " + (i + 1) + " is blank");
			}
		}
		if (limitRecords != null && limitRecords < 1) {
			throw new InvalidRequestException("limitRecords must be positive, was " + limitRecords);
		}
		if (timeoutSeconds != null && timeoutSeconds < 1) {
			throw new InvalidRequestException("timeoutSeconds must be positive, was " + timeoutSeconds);
		}
		if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
			throw new InvalidRequestException("minConfidence must be within [0, 1], was " + minConfidence);
		}
		return this;
	}

	public int effectiveLimit(ReconciliationConfig config) {
		return limitRecords != null ? limitRecords : config.defaultLimitRecords();
	}

	public int effectiveTimeout(ReconciliationConfig config) {
		return timeoutSeconds != null ? timeoutSeconds : config.defaultTimeoutSeconds();
	}

	public static class Builder {
		private final List<String> definitions = new ArrayList<>();
		private String kgName;
		private List<String> schemas = List.of();
		private boolean useLlm;
		private double minConfidence;
		private Dialect dialect = Dialect.SQL_SERVER;
		private Integer limitRecords;
		private Integer timeoutSeconds;

		private Builder() {}

		public Builder definition(String definition) {
			this.definitions.add(definition);
			return this;
		}

		public Builder definitions(List<String> definitions) {
			this.definitions.addAll(definitions);
			return this;
		}

		public Builder kgName(String kgName) {
			this.kgName = kgName;
			return this;
		}

		public Builder schemas(List<String> schemas) {
			this.schemas = schemas;
			return this;
		}

		public Builder useLlm(boolean useLlm) {
			this.useLlm = useLlm;
			return this;
		}

		public Builder minConfidence(double minConfidence) {
			this.minConfidence = minConfidence;
			return this;
		}

		public Builder dialect(Dialect dialect) {
			this.dialect = dialect;
			return this;
		}

		public Builder limitRecords(int limitRecords) {
			this.limitRecords = limitRecords;
			return this;
		}

		public Builder timeoutSeconds(int timeoutSeconds) {
			this.timeoutSeconds = timeoutSeconds;
			return this;
		}

		public ReconciliationRequest build() {
			return new ReconciliationRequest(definitions, kgName, schemas, useLlm, minConfidence, dialect,
					limitRecords, timeoutSeconds);
		}
	}
}
