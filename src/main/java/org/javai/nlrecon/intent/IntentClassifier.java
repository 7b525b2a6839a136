package org.javai.nlrecon.intent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.nlrecon.ReconciliationConfig;
import org.javai.nlrecon.intent.extract.EntityExtractor;
import org.javai.nlrecon.intent.extract.ExtractedEntity;
import org.javai.nlrecon.intent.extract.ExtractionResult;
import org.javai.nlrecon.kg.KnowledgeGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a free-text reconciliation definition into a {@link QueryIntent}.
 *
 * <p>The rule pass looks for keyword cues, in this order of precedence:</p>
 * <ol>
 *   <li>anti-join cues ("not in", "missing", "without", ...): {@link Archetype#UNMATCHED_SOURCE},
 *   or {@link Archetype#UNMATCHED_TARGET} when the excluded side is the first mention</li>
 *   <li>count cues ("count", "how many", "number of"): {@link Archetype#INACTIVE_COUNT}</li>
 *   <li>match cues ("in both", "matching", "common"): {@link Archetype#MATCHED}</li>
 *   <li>status words or explicit {@code where} clauses: {@link Archetype#FILTERED}</li>
 *   <li>two table mentions without a cue: {@link Archetype#MATCHED} at reduced confidence</li>
 *   <li>otherwise {@link Archetype#FILTERED} at the configured fallback confidence</li>
 * </ol>
 *
 * <p>Status words become semantic hints ({@code status = inactive}); the physical column is
 * chosen per table during resolution.</p>
 *
 * <p>When an {@link EntityExtractor} is supplied and requested, its result is merged slot by
 * slot, keeping the higher-confidence mention. Extractor failures are logged and the rule
 * result is used alone.</p>
 */
public final class IntentClassifier {

	private static final Logger logger = LoggerFactory.getLogger(IntentClassifier.class);

	private static final Pattern ANTI_JOIN_CUE = Pattern.compile(
			"\\b(?:not\\s+(?:in|present\\s+in|found\\s+in|available\\s+in|matching)"
					+ "|missing(?:\\s+(?:in|from))?|absent\\s+(?:in|from)|without|except"
					+ "|(?:do|does)\\s+not\\s+exist\\s+in|(?:don't|doesn't)\\s+exist\\s+in|unmatched)\\b",
			Pattern.CASE_INSENSITIVE);
	private static final Pattern COUNT_CUE = Pattern.compile(
			"\\b(?:count|how\\s+many|number\\s+of)\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern MATCHED_CUE = Pattern.compile(
			"\\b(?:in\\s+both|matching|matched|common|exists?\\s+in\\s+both|also\\s+in)\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern STATUS_CUE = Pattern.compile(
			"\\b(inactive|obsolete|discontinued|deprecated|active)\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern PROJECTION = Pattern.compile(
			"\\balso\\s+(?:show|include|display|add|get|return)\\s+(.+?)\\s+from\\s+(.+?)\\s*(?=,|;|\\.(?:\\s|$)|\\balso\\b|$)",
			Pattern.CASE_INSENSITIVE);
	private static final Pattern EXPLICIT_FILTER = Pattern.compile(
			"\\b(?:where|with)\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*"
					+ "(>=|<=|!=|<>|==|=|>|<|\\bis\\s+not\\b|\\bis\\b|\\bequals\\b|\\blike\\b)\\s*"
					+ "('[^']*'|\"[^\"]*\"|[A-Za-z0-9_.\\-]+)",
			Pattern.CASE_INSENSITIVE);

	static final double CUED_PAIR_CONFIDENCE = 0.85;
	static final double COUNT_CONFIDENCE = 0.8;
	static final double FILTER_CONFIDENCE = 0.75;
	static final double UNCUED_PAIR_CONFIDENCE = 0.6;
	static final double PARTIAL_CONFIDENCE = 0.5;
	static final double WEAK_CONFIDENCE = 0.4;

	private final MentionExtractor mentionExtractor;
	private final EntityExtractor entityExtractor;
	private final ReconciliationConfig config;

	public IntentClassifier(KnowledgeGraph kg) {
		this(kg, null, ReconciliationConfig.defaults());
	}

	/**
	 * @param kg knowledge graph whose names and aliases are recognised as mentions
	 * @param entityExtractor optional semantic extractor, may be null
	 * @param config thresholds
	 */
	public IntentClassifier(KnowledgeGraph kg, EntityExtractor entityExtractor, ReconciliationConfig config) {
		this.mentionExtractor = new MentionExtractor(kg);
		this.entityExtractor = entityExtractor;
		this.config = config != null ? config : ReconciliationConfig.defaults();
	}

	public QueryIntent classify(String text) {
		return classify(text, entityExtractor != null);
	}

	public QueryIntent classify(String text, boolean useLlm) {
		String raw = text != null ? text : "";
		StringBuilder working = new StringBuilder(raw);
		List<ProjectionMention> projections = extractProjections(working);
		List<FilterMention> filters = extractExplicitFilters(working);
		String scrubbed = working.toString();

		List<Mention> mentions = mentionExtractor.extract(scrubbed);
		for (FilterMention hint : extractStatusHints(scrubbed, mentions)) {
			if (filters.stream().noneMatch(hint::sameAs)) {
				filters.add(hint);
			}
		}

		RuleOutcome rules = applyRules(scrubbed, mentions, filters);
		QueryIntent intent = new QueryIntent(raw, rules.archetype(),
				rules.mentionText(0), rules.mentionText(1), rules.remainingMentions(),
				filters, projections, rules.confidence(), false);

		if (useLlm) {
			intent = mergeExtraction(intent, rules);
		}
		if (logger.isDebugEnabled()) {
			logger.debug("Classified '{}' as {} (source={}, target={}, filters={}, confidence={})",
					raw, intent.archetype(), intent.sourceMention(), intent.targetMention(),
					intent.filterMentions().size(), intent.extractionConfidence());
		}
		return intent;
	}

	private RuleOutcome applyRules(String text, List<Mention> mentions, List<FilterMention> filters) {
		int count = mentions.size();

		Optional<Matcher> antiJoin = firstCue(ANTI_JOIN_CUE, text, mentions);
		if (antiJoin.isPresent()) {
			int excluded = excludedMentionIndex(antiJoin.get(), mentions);
			Archetype archetype = (excluded == 0 && count >= 2) ? Archetype.UNMATCHED_TARGET : Archetype.UNMATCHED_SOURCE;
			return new RuleOutcome(archetype, count >= 2 ? CUED_PAIR_CONFIDENCE : PARTIAL_CONFIDENCE, true, mentions);
		}
		if (firstCue(COUNT_CUE, text, mentions).isPresent()) {
			return new RuleOutcome(Archetype.INACTIVE_COUNT, count >= 1 ? COUNT_CONFIDENCE : WEAK_CONFIDENCE, true, mentions);
		}
		if (firstCue(MATCHED_CUE, text, mentions).isPresent()) {
			return new RuleOutcome(Archetype.MATCHED, count >= 2 ? CUED_PAIR_CONFIDENCE : PARTIAL_CONFIDENCE, true, mentions);
		}
		if (!filters.isEmpty()) {
			return new RuleOutcome(Archetype.FILTERED, count >= 1 ? FILTER_CONFIDENCE : WEAK_CONFIDENCE, true, mentions);
		}
		if (count >= 2) {
			return new RuleOutcome(Archetype.MATCHED, UNCUED_PAIR_CONFIDENCE, false, mentions);
		}
		return new RuleOutcome(Archetype.FILTERED, config.fallbackConfidence(), false, mentions);
	}

	/**
	 * The excluded side is the first mention after the cue, or the last one before it when
	 * the cue closes the sentence.
	 */
	private static int excludedMentionIndex(Matcher cue, List<Mention> mentions) {
		for (int i = 0; i < mentions.size(); i++) {
			if (mentions.get(i).start() >= cue.end()) {
				return i;
			}
		}
		return mentions.size() - 1;
	}

	private QueryIntent mergeExtraction(QueryIntent intent, RuleOutcome rules) {
		if (entityExtractor == null) {
			logger.debug("LLM assistance requested but no entity extractor is configured");
			return intent;
		}
		ExtractionResult extraction;
		try {
			extraction = entityExtractor.extract(intent.rawText());
		}
		catch (RuntimeException e) {
			logger.warn("Entity extraction failed, using rule-based intent only: {}", e.getMessage(), e);
			return intent;
		}
		if (extraction == null) {
			return intent;
		}

		String source = pick(rules.mention(0), extraction.best(ExtractedEntity.Role.SOURCE));
		String target = pick(rules.mention(1), extraction.best(ExtractedEntity.Role.TARGET));

		List<String> additional = new ArrayList<>();
		List<String> candidates = new ArrayList<>(intent.additionalMentions());
		extraction.all(ExtractedEntity.Role.ADDITIONAL).forEach(e -> candidates.add(e.mention()));
		for (String candidate : candidates) {
			boolean duplicate = candidate.equalsIgnoreCase(source) || candidate.equalsIgnoreCase(target)
					|| additional.stream().anyMatch(candidate::equalsIgnoreCase);
			if (!duplicate) {
				additional.add(candidate);
			}
		}

		List<FilterMention> filters = new ArrayList<>(intent.filterMentions());
		for (FilterMention filter : extraction.filters()) {
			if (filters.stream().noneMatch(filter::sameAs)) {
				filters.add(filter);
			}
		}

		Archetype archetype = intent.archetype();
		if (!rules.cued()) {
			if (extraction.archetype() != null) {
				archetype = extraction.archetype();
			}
			else if (source != null && target != null) {
				archetype = Archetype.MATCHED;
			}
		}
		double confidence = Math.max(intent.extractionConfidence(), extraction.confidence());

		return new QueryIntent(intent.rawText(), archetype, source, target, additional, filters,
				intent.projections(), confidence, true);
	}

	private static String pick(Mention ruleMention, Optional<ExtractedEntity> extracted) {
		if (extracted.isEmpty()) {
			return ruleMention != null ? ruleMention.text() : null;
		}
		if (ruleMention == null || extracted.get().confidence() > ruleMention.confidence()) {
			return extracted.get().mention();
		}
		return ruleMention.text();
	}

	private static List<ProjectionMention> extractProjections(StringBuilder working) {
		List<ProjectionMention> projections = new ArrayList<>();
		Matcher matcher = PROJECTION.matcher(working.toString());
		while (matcher.find()) {
			String column = matcher.group(1).trim();
			String table = matcher.group(2).trim();
			if (!column.isEmpty() && !table.isEmpty()) {
				projections.add(new ProjectionMention(column, table));
			}
			blank(working, matcher.start(), matcher.end());
		}
		return projections;
	}

	private static List<FilterMention> extractExplicitFilters(StringBuilder working) {
		List<FilterMention> filters = new ArrayList<>();
		Matcher matcher = EXPLICIT_FILTER.matcher(working.toString());
		while (matcher.find()) {
			Optional<FilterOperator> operator = FilterOperator.parse(matcher.group(2));
			if (operator.isEmpty()) {
				continue;
			}
			filters.add(FilterMention.explicit(matcher.group(1), operator.get(), unquote(matcher.group(3))));
			blank(working, matcher.start(), matcher.end());
		}
		return filters;
	}

	private static List<FilterMention> extractStatusHints(String text, List<Mention> mentions) {
		List<FilterMention> hints = new ArrayList<>();
		Matcher matcher = STATUS_CUE.matcher(text);
		while (matcher.find()) {
			int start = matcher.start();
			int end = matcher.end();
			if (mentions.stream().anyMatch(m -> m.overlaps(start, end))) {
				continue;
			}
			FilterMention hint = FilterMention.status(matcher.group(1).toLowerCase(Locale.ROOT));
			if (hints.stream().noneMatch(hint::sameAs)) {
				hints.add(hint);
			}
		}
		return hints;
	}

	private static Optional<Matcher> firstCue(Pattern cue, String text, List<Mention> mentions) {
		Matcher matcher = cue.matcher(text);
		while (matcher.find()) {
			int start = matcher.start();
			int end = matcher.end();
			if (mentions.stream().noneMatch(m -> m.overlaps(start, end))) {
				return Optional.of(matcher);
			}
		}
		return Optional.empty();
	}

	private static String unquote(String value) {
		if (value.length() >= 2
				&& ((value.startsWith("'") && value.endsWith("'")) || (value.startsWith("\"") && value.endsWith("\"")))) {
			return value.substring(1, value.length() - 1);
		}
		return value;
	}

	private static void blank(StringBuilder text, int start, int end) {
		for (int i = start; i < end; i++) {
			text.setCharAt(i, ' ');
		}
	}

	private record RuleOutcome(Archetype archetype, double confidence, boolean cued, List<Mention> mentions) {

		Mention mention(int index) {
			return index < mentions.size() ? mentions.get(index) : null;
		}

		String mentionText(int index) {
			Mention mention = mention(index);
			return mention != null ? mention.text() : null;
		}

		List<String> remainingMentions() {
			if (mentions.size() <= 2) {
				return List.of();
			}
			return mentions.subList(2, mentions.size()).stream().map(Mention::text).toList();
		}
	}
}
