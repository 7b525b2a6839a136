package org.javai.nlrecon.intent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.nlrecon.kg.KnowledgeGraph;
import org.javai.nlrecon.kg.TableNode;

/**
 * Finds table mentions in definition text.
 *
 * <p>Known terms from the knowledge graph (table names and aliases, longest first) are
 * found first. Quoted phrases and runs of capitalised words that are not common words are
 * added afterwards. A capitalised run directly next to a known term is read as a qualifier
 * of that term ("RBP GPU") and not as a mention of its own.</p>
 */
final class MentionExtractor {

	static final double KNOWN_TERM_CONFIDENCE = 0.9;
	static final double QUOTED_CONFIDENCE = 0.7;
	static final double CAPITALIZED_CONFIDENCE = 0.6;

	private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9_\\-]*");
	private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"|(?<![A-Za-z])'([^']+)'(?![A-Za-z])");

	static final Set<String> STOP_WORDS = Set.of(
			"a", "an", "the", "and", "or", "but", "not", "no", "in", "on", "at", "of", "from", "to", "into",
			"for", "by", "with", "without", "except", "as", "is", "are", "was", "were", "be", "been", "do",
			"does", "did", "don't", "doesn't", "that", "which", "who", "what", "where", "when", "how", "many",
			"much", "this", "these", "those", "there", "their", "it", "its", "me", "my", "i", "we", "us", "you",
			"all", "any", "each", "every", "both", "either", "also", "only", "just", "than", "then", "so",
			"show", "list", "find", "get", "give", "display", "return", "fetch", "select", "compare",
			"identify", "check", "tell", "please", "can", "could", "would", "should", "want", "need",
			"count", "number", "total", "sum", "average", "records", "record", "rows", "row", "items", "item",
			"products", "product", "materials", "material", "skus", "sku", "parts", "part", "entries", "entry",
			"data", "table", "tables", "lists", "missing", "present", "absent", "exist", "exists",
			"existing", "matching", "matched", "unmatched", "match", "common", "same", "other", "others",
			"active", "inactive", "obsolete", "discontinued", "deprecated", "status", "having",
			"available", "found", "yes", "vs", "versus", "between", "against", "side");

	private final List<String> knownTerms;

	MentionExtractor(KnowledgeGraph kg) {
		Map<String, String> terms = new LinkedHashMap<>();
		if (kg != null) {
			for (TableNode table : kg.tables()) {
				addTerm(terms, table.name());
				table.aliases().forEach(alias -> addTerm(terms, alias));
			}
		}
		List<String> ordered = new ArrayList<>(terms.values());
		ordered.sort(Comparator.comparingInt(String::length).reversed());
		this.knownTerms = List.copyOf(ordered);
	}

	List<Mention> extract(String text) {
		if (text == null || text.isBlank()) {
			return List.of();
		}
		List<Mention> mentions = new ArrayList<>();
		findKnownTerms(text, mentions);
		List<Mention> known = List.copyOf(mentions);
		findQuoted(text, mentions);
		findCapitalizedRuns(text, known, mentions);
		mentions.sort(Comparator.comparingInt(Mention::start));
		return List.copyOf(mentions);
	}

	private void findKnownTerms(String text, List<Mention> mentions) {
		for (String term : knownTerms) {
			Pattern pattern = Pattern.compile(
					"(?<![A-Za-z0-9_])" + Pattern.quote(term) + "(?![A-Za-z0-9_])", Pattern.CASE_INSENSITIVE);
			Matcher matcher = pattern.matcher(text);
			while (matcher.find()) {
				if (isFree(mentions, matcher.start(), matcher.end())) {
					mentions.add(new Mention(matcher.group(), matcher.start(), matcher.end(),
							KNOWN_TERM_CONFIDENCE, Mention.Source.KNOWN_TERM));
				}
			}
		}
	}

	private static void findQuoted(String text, List<Mention> mentions) {
		Matcher matcher = QUOTED.matcher(text);
		while (matcher.find()) {
			int group = matcher.group(1) != null ? 1 : 2;
			String phrase = matcher.group(group).trim();
			if (phrase.isEmpty() || STOP_WORDS.contains(phrase.toLowerCase(Locale.ROOT))) {
				continue;
			}
			if (isFree(mentions, matcher.start(), matcher.end())) {
				mentions.add(new Mention(phrase, matcher.start(group), matcher.end(group),
						QUOTED_CONFIDENCE, Mention.Source.QUOTED));
			}
		}
	}

	private static void findCapitalizedRuns(String text, List<Mention> known, List<Mention> mentions) {
		Matcher matcher = TOKEN.matcher(text);
		int runStart = -1;
		int runEnd = -1;
		while (matcher.find()) {
			boolean qualifies = qualifies(matcher.group()) && isFree(mentions, matcher.start(), matcher.end());
			if (qualifies && runStart >= 0 && isGap(text, runEnd, matcher.start())) {
				runEnd = matcher.end();
				continue;
			}
			closeRun(text, runStart, runEnd, known, mentions);
			runStart = qualifies ? matcher.start() : -1;
			runEnd = qualifies ? matcher.end() : -1;
		}
		closeRun(text, runStart, runEnd, known, mentions);
	}

	private static void closeRun(String text, int start, int end, List<Mention> known, List<Mention> mentions) {
		if (start < 0) {
			return;
		}
		for (Mention term : known) {
			if (isGap(text, term.end(), start) || isGap(text, end, term.start())) {
				return;
			}
		}
		mentions.add(new Mention(text.substring(start, end), start, end,
				CAPITALIZED_CONFIDENCE, Mention.Source.CAPITALIZED));
	}

	private static boolean qualifies(String token) {
		if (STOP_WORDS.contains(token.toLowerCase(Locale.ROOT))) {
			return false;
		}
		if (token.chars().allMatch(Character::isDigit)) {
			return false;
		}
		return Character.isUpperCase(token.charAt(0)) || token.indexOf('_') > 0;
	}

	private static boolean isGap(String text, int from, int to) {
		if (from < 0 || to < from) {
			return false;
		}
		return text.substring(from, to).isBlank();
	}

	private static boolean isFree(List<Mention> mentions, int start, int end) {
		return mentions.stream().noneMatch(m -> m.overlaps(start, end));
	}

	private static void addTerm(Map<String, String> terms, String term) {
		if (term == null || term.trim().length() < 2) {
			return;
		}
		String key = term.trim().toLowerCase(Locale.ROOT);
		if (!STOP_WORDS.contains(key)) {
			terms.putIfAbsent(key, term.trim());
		}
	}
}
