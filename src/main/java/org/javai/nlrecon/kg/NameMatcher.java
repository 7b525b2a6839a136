package org.javai.nlrecon.kg;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Staged name matching shared by table and column resolution.
 *
 * <p>{@link #match(String, List)} applies the strategies in order and stops at the first
 * stage that produces at least one candidate at or above the minimum confidence:</p>
 * <ol>
 *   <li>case-insensitive equality with the name ({@link MatchStrategy#EXACT}) or an alias
 *   ({@link MatchStrategy#ALIAS})</li>
 *   <li>equality of the normalised forms ({@link MatchStrategy#PATTERN})</li>
 *   <li>weighted token-set similarity ({@link MatchStrategy#FUZZY})</li>
 * </ol>
 */
public final class NameMatcher {

	public static final double DEFAULT_MIN_CONFIDENCE = 0.5;
	public static final double EXACT_CONFIDENCE = 1.0;
	public static final double ALIAS_CONFIDENCE = 0.95;
	public static final double PATTERN_CONFIDENCE = 0.85;
	public static final double FUZZY_WEIGHT = 0.8;

	private final double minConfidence;

	public NameMatcher() {
		this(DEFAULT_MIN_CONFIDENCE);
	}

	public NameMatcher(double minConfidence) {
		if (minConfidence < 0.0 || minConfidence > 1.0) {
			throw new IllegalArgumentException("minConfidence must be within [0, 1]");
		}
		this.minConfidence = minConfidence;
	}

	public double minConfidence() {
		return minConfidence;
	}

	/**
	 * Something that can be matched: the target object, its physical name and its aliases.
	 */
	public record Candidate<T>(T target, String name, Collection<String> aliases) {
		public Candidate {
			if (target == null) {
				throw new IllegalArgumentException("target must not be null");
			}
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("name must not be blank");
			}
			aliases = aliases != null ? List.copyOf(aliases) : List.of();
		}
	}

	/**
	 * A scored match of a mention against one candidate.
	 */
	public record Match<T>(T target, MatchStrategy strategy, double confidence, String matchedName) {
	}

	/**
	 * Staged match; returns the matches of the first successful stage, best first.
	 */
	public <T> List<Match<T>> match(String mention, List<Candidate<T>> candidates) {
		if (mention == null || mention.isBlank() || candidates.isEmpty()) {
			return List.of();
		}
		String trimmed = mention.trim();

		List<Match<T>> exact = new ArrayList<>();
		for (Candidate<T> candidate : candidates) {
			Match<T> match = exactMatch(trimmed, candidate);
			if (match != null && match.confidence() >= minConfidence) {
				exact.add(match);
			}
		}
		if (!exact.isEmpty()) {
			return sorted(exact);
		}

		List<Match<T>> pattern = new ArrayList<>();
		for (Candidate<T> candidate : candidates) {
			Match<T> match = patternMatch(trimmed, candidate);
			if (match != null && match.confidence() >= minConfidence) {
				pattern.add(match);
			}
		}
		if (!pattern.isEmpty()) {
			return sorted(pattern);
		}

		List<Match<T>> fuzzy = new ArrayList<>();
		for (Candidate<T> candidate : candidates) {
			Match<T> match = fuzzyMatch(trimmed, candidate);
			if (match != null && match.confidence() >= minConfidence) {
				fuzzy.add(match);
			}
		}
		return sorted(fuzzy);
	}

	/**
	 * Scores every candidate with its best strategy, ignoring the minimum confidence.
	 * Candidates with a zero score are left out.
	 */
	public <T> List<Match<T>> rank(String mention, List<Candidate<T>> candidates) {
		if (mention == null || mention.isBlank()) {
			return List.of();
		}
		String trimmed = mention.trim();
		List<Match<T>> ranked = new ArrayList<>();
		for (Candidate<T> candidate : candidates) {
			Match<T> best = exactMatch(trimmed, candidate);
			if (best == null) {
				best = patternMatch(trimmed, candidate);
			}
			if (best == null) {
				best = fuzzyMatch(trimmed, candidate);
			}
			if (best != null && best.confidence() > 0.0) {
				ranked.add(best);
			}
		}
		return sorted(ranked);
	}

	private static <T> Match<T> exactMatch(String mention, Candidate<T> candidate) {
		if (candidate.name().equalsIgnoreCase(mention)) {
			return new Match<>(candidate.target(), MatchStrategy.EXACT, EXACT_CONFIDENCE, candidate.name());
		}
		for (String alias : candidate.aliases()) {
			if (alias.equalsIgnoreCase(mention)) {
				return new Match<>(candidate.target(), MatchStrategy.ALIAS, ALIAS_CONFIDENCE, alias);
			}
		}
		return null;
	}

	private static <T> Match<T> patternMatch(String mention, Candidate<T> candidate) {
		String normalized = FuzzySimilarity.normalize(mention);
		if (normalized.isEmpty()) {
			return null;
		}
		if (normalized.equals(FuzzySimilarity.normalize(candidate.name()))) {
			return new Match<>(candidate.target(), MatchStrategy.PATTERN, PATTERN_CONFIDENCE, candidate.name());
		}
		for (String alias : candidate.aliases()) {
			if (normalized.equals(FuzzySimilarity.normalize(alias))) {
				return new Match<>(candidate.target(), MatchStrategy.PATTERN, PATTERN_CONFIDENCE, alias);
			}
		}
		return null;
	}

	private static <T> Match<T> fuzzyMatch(String mention, Candidate<T> candidate) {
		double best = FuzzySimilarity.tokenSetRatio(mention, candidate.name());
		String bestName = candidate.name();
		for (String alias : candidate.aliases()) {
			double score = FuzzySimilarity.tokenSetRatio(mention, alias);
			if (score > best) {
				best = score;
				bestName = alias;
			}
		}
		if (best <= 0.0) {
			return null;
		}
		return new Match<>(candidate.target(), MatchStrategy.FUZZY, best * FUZZY_WEIGHT, bestName);
	}

	private static <T> List<Match<T>> sorted(List<Match<T>> matches) {
		// stable sort keeps registration order among equal scores
		matches.sort(Comparator.comparingDouble((Match<T> m) -> m.confidence()).reversed());
		return List.copyOf(matches);
	}
}
