package org.javai.nlrecon;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunable thresholds and limits for the reconciliation pipeline.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ReconciliationConfig config = ReconciliationConfig.defaults();
 *
 * ReconciliationConfig strict = ReconciliationConfig.builder()
 *         .matchThreshold(0.7)
 *         .maxConcurrency(2)
 *         .build();
 * }</pre>
 *
 * @param matchThreshold minimum confidence for a mention to resolve to a table or column
 * @param ambiguityMargin two candidates from different tables closer than this are ambiguous
 * @param ambiguousConfidenceCap confidence ceiling for an ambiguous mention
 * @param fallbackConfidence confidence assigned when no archetype cue is found
 * @param hintSynonyms semantic filter hints mapped to the column names tried for them
 * @param defaultLimitRecords row limit used when a request does not set one
 * @param defaultTimeoutSeconds statement timeout used when a request does not set one
 * @param sampleCap maximum number of rows kept in a result's sample
 * @param maxConcurrency size of the worker pool used for a batch
 * @param allowBridgeTables whether join paths may pass through tables nobody mentioned
 * @param maxBridgeHops maximum number of unmentioned tables on one join path
 * @param notFoundMessagePatterns lowercase message fragments that mark a missing-object failure
 */
public record ReconciliationConfig(
		double matchThreshold,
		double ambiguityMargin,
		double ambiguousConfidenceCap,
		double fallbackConfidence,
		Map<String, List<String>> hintSynonyms,
		int defaultLimitRecords,
		int defaultTimeoutSeconds,
		int sampleCap,
		int maxConcurrency,
		boolean allowBridgeTables,
		int maxBridgeHops,
		List<String> notFoundMessagePatterns
) {

	public static final double DEFAULT_MATCH_THRESHOLD = 0.5;
	public static final double DEFAULT_AMBIGUITY_MARGIN = 0.05;
	public static final double DEFAULT_AMBIGUOUS_CONFIDENCE_CAP = 0.3;
	public static final double DEFAULT_FALLBACK_CONFIDENCE = 0.3;
	public static final int DEFAULT_LIMIT_RECORDS = 1000;
	public static final int DEFAULT_TIMEOUT_SECONDS = 30;
	public static final int DEFAULT_SAMPLE_CAP = 1000;
	public static final int DEFAULT_MAX_CONCURRENCY = 4;
	public static final int DEFAULT_MAX_BRIDGE_HOPS = 2;

	public static final Map<String, List<String>> DEFAULT_HINT_SYNONYMS = Map.of(
			"status", List.of("status", "state", "lifecycle"));

	public static final List<String> DEFAULT_NOT_FOUND_PATTERNS = List.of(
			"invalid object name",
			"table or view does not exist",
			"doesn't exist",
			"does not exist",
			"unknown table",
			"object not found",
			"no such table");

	public ReconciliationConfig {
		requireUnit(matchThreshold, "matchThreshold");
		requireUnit(ambiguityMargin, "ambiguityMargin");
		requireUnit(ambiguousConfidenceCap, "ambiguousConfidenceCap");
		requireUnit(fallbackConfidence, "fallbackConfidence");
		if (defaultLimitRecords < 1) {
			throw new IllegalArgumentException("defaultLimitRecords must be positive");
		}
		if (defaultTimeoutSeconds < 1) {
			throw new IllegalArgumentException("defaultTimeoutSeconds must be positive");
		}
		if (sampleCap < 0) {
			throw new IllegalArgumentException("sampleCap must be non-negative");
		}
		if (maxConcurrency < 1) {
			throw new IllegalArgumentException("maxConcurrency must be positive");
		}
		if (maxBridgeHops < 0) {
			throw new IllegalArgumentException("maxBridgeHops must be non-negative");
		}
		hintSynonyms = hintSynonyms != null ? copy(hintSynonyms) : Map.of();
		notFoundMessagePatterns = notFoundMessagePatterns != null ? List.copyOf(notFoundMessagePatterns) : List.of();
	}

	public static ReconciliationConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Column names to try for a filter hint; the hint itself when no synonyms are configured.
	 */
	public List<String> synonymsFor(String hint) {
		if (hint == null) {
			return List.of();
		}
		List<String> synonyms = hintSynonyms.get(hint.toLowerCase());
		return synonyms != null ? synonyms : List.of(hint);
	}

	private static Map<String, List<String>> copy(Map<String, List<String>> source) {
		Map<String, List<String>> copy = new LinkedHashMap<>();
		source.forEach((hint, names) -> copy.put(hint.toLowerCase(), List.copyOf(names)));
		return Map.copyOf(copy);
	}

	private static void requireUnit(double value, String field) {
		if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
			throw new IllegalArgumentException(field + " must be within [0, 1]");
		}
	}

	/**
	 * Builder for {@link ReconciliationConfig}.
	 */
	public static class Builder {
		private double matchThreshold = DEFAULT_MATCH_THRESHOLD;
		private double ambiguityMargin = DEFAULT_AMBIGUITY_MARGIN;
		private double ambiguousConfidenceCap = DEFAULT_AMBIGUOUS_CONFIDENCE_CAP;
		private double fallbackConfidence = DEFAULT_FALLBACK_CONFIDENCE;
		private Map<String, List<String>> hintSynonyms = DEFAULT_HINT_SYNONYMS;
		private int defaultLimitRecords = DEFAULT_LIMIT_RECORDS;
		private int defaultTimeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
		private int sampleCap = DEFAULT_SAMPLE_CAP;
		private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
		private boolean allowBridgeTables = false;
		private int maxBridgeHops = DEFAULT_MAX_BRIDGE_HOPS;
		private List<String> notFoundMessagePatterns = DEFAULT_NOT_FOUND_PATTERNS;

		private Builder() {}

		public Builder matchThreshold(double matchThreshold) {
			this.matchThreshold = matchThreshold;
			return this;
		}

		public Builder ambiguityMargin(double ambiguityMargin) {
			this.ambiguityMargin = ambiguityMargin;
			return this;
		}

		public Builder ambiguousConfidenceCap(double ambiguousConfidenceCap) {
			this.ambiguousConfidenceCap = ambiguousConfidenceCap;
			return this;
		}

		public Builder fallbackConfidence(double fallbackConfidence) {
			this.fallbackConfidence = fallbackConfidence;
			return this;
		}

		public Builder hintSynonyms(Map<String, List<String>> hintSynonyms) {
			this.hintSynonyms = hintSynonyms;
			return this;
		}

		public Builder defaultLimitRecords(int defaultLimitRecords) {
			this.defaultLimitRecords = defaultLimitRecords;
			return this;
		}

		public Builder defaultTimeoutSeconds(int defaultTimeoutSeconds) {
			this.defaultTimeoutSeconds = defaultTimeoutSeconds;
			return this;
		}

		/**
		 * Rows kept per result. The row limit is already part of the generated SQL, so
		 * this only bounds memory when a statement returns more than expected.
		 */
		public Builder sampleCap(int sampleCap) {
			this.sampleCap = sampleCap;
			return this;
		}

		public Builder maxConcurrency(int maxConcurrency) {
			this.maxConcurrency = maxConcurrency;
			return this;
		}

		public Builder allowBridgeTables(boolean allowBridgeTables) {
			this.allowBridgeTables = allowBridgeTables;
			return this;
		}

		public Builder maxBridgeHops(int maxBridgeHops) {
			this.maxBridgeHops = maxBridgeHops;
			return this;
		}

		public Builder notFoundMessagePatterns(List<String> notFoundMessagePatterns) {
			this.notFoundMessagePatterns = notFoundMessagePatterns;
			return this;
		}

		public ReconciliationConfig build() {
			return new ReconciliationConfig(matchThreshold, ambiguityMargin, ambiguousConfidenceCap,
					fallbackConfidence, hintSynonyms, defaultLimitRecords, defaultTimeoutSeconds, sampleCap,
					maxConcurrency, allowBridgeTables, maxBridgeHops, notFoundMessagePatterns);
		}
	}
}
