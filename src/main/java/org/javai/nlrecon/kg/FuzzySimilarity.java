package org.javai.nlrecon.kg;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * String similarity helpers used by {@link NameMatcher}.
 *
 * <p>{@link #tokenSetRatio(String, String)} compares the sorted token sets of both
 * strings, so word order and extra qualifiers ("brz_lnd" prefixes and the like) do not
 * penalise a mention whose words are all present in the candidate.</p>
 */
public final class FuzzySimilarity {

	private FuzzySimilarity() {
	}

	/**
	 * Lowercases and removes everything that is not a letter or digit.
	 */
	public static String normalize(String text) {
		if (text == null) {
			return "";
		}
		return text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
	}

	/**
	 * Splits on anything that is not a letter or digit, lowercased.
	 */
	public static Set<String> tokens(String text) {
		if (text == null || text.isBlank()) {
			return Set.of();
		}
		return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
				.filter(token -> !token.isEmpty())
				.collect(Collectors.toCollection(TreeSet::new));
	}

	/**
	 * Token-set similarity in {@code [0, 1]}.
	 *
	 * <p>Builds the sorted intersection of both token sets and compares it against each side
	 * extended with its remaining tokens. A mention whose tokens are a subset of the
	 * candidate's tokens scores 1.0.</p>
	 */
	public static double tokenSetRatio(String left, String right) {
		Set<String> leftTokens = tokens(left);
		Set<String> rightTokens = tokens(right);
		if (leftTokens.isEmpty() || rightTokens.isEmpty()) {
			return 0.0;
		}

		TreeSet<String> intersection = new TreeSet<>(leftTokens);
		intersection.retainAll(rightTokens);
		TreeSet<String> leftOnly = new TreeSet<>(leftTokens);
		leftOnly.removeAll(rightTokens);
		TreeSet<String> rightOnly = new TreeSet<>(rightTokens);
		rightOnly.removeAll(leftTokens);

		String common = String.join(" ", intersection);
		String leftCombined = join(common, String.join(" ", leftOnly));
		String rightCombined = join(common, String.join(" ", rightOnly));

		if (!common.isEmpty() && (leftOnly.isEmpty() || rightOnly.isEmpty())) {
			return 1.0;
		}
		double best = ratio(leftCombined, rightCombined);
		if (!common.isEmpty()) {
			best = Math.max(best, ratio(common, leftCombined));
			best = Math.max(best, ratio(common, rightCombined));
		}
		return best;
	}

	/**
	 * Normalised Levenshtein similarity: {@code 1 - distance / maxLength}.
	 */
	public static double ratio(String left, String right) {
		if (left.isEmpty() && right.isEmpty()) {
			return 1.0;
		}
		int maxLength = Math.max(left.length(), right.length());
		return 1.0 - (double) levenshteinDistance(left, right) / maxLength;
	}

	static int levenshteinDistance(String s1, String s2) {
		int[] costs = new int[s2.length() + 1];
		for (int j = 0; j < costs.length; j++) {
			costs[j] = j;
		}
		for (int i = 1; i <= s1.length(); i++) {
			costs[0] = i;
			int nw = i - 1;
			for (int j = 1; j <= s2.length(); j++) {
				int cj = Math.min(1 + Math.min(costs[j], costs[j - 1]),
						s1.charAt(i - 1) == s2.charAt(j - 1) ? nw : nw + 1);
				nw = costs[j];
				costs[j] = cj;
			}
		}
		return costs[s2.length()];
	}

	private static String join(String head, String tail) {
		if (head.isEmpty()) {
			return tail;
		}
		if (tail.isEmpty()) {
			return head;
		}
		return head + " " + tail;
	}
}
