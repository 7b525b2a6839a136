package org.javai.nlrecon.resolve;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.nlrecon.ReconciliationConfig;
import org.javai.nlrecon.ReconciliationErrorType;
import org.javai.nlrecon.intent.Archetype;
import org.javai.nlrecon.intent.FilterMention;
import org.javai.nlrecon.intent.ProjectionMention;
import org.javai.nlrecon.intent.QueryIntent;
import org.javai.nlrecon.kg.KnowledgeGraph;
import org.javai.nlrecon.kg.NameMatcher;
import org.javai.nlrecon.kg.TableMatch;
import org.javai.nlrecon.kg.TableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the table mentions, filter hints and projections of an intent against a
 * knowledge graph.
 *
 * <p>A mention resolves only when its best candidate reaches the match threshold and no
 * other table scores within the ambiguity margin of it. Column hints are matched against
 * the columns of the resolved table only; a hint that matches nothing stays unresolved.</p>
 */
public final class EntityResolver {

	private static final Logger logger = LoggerFactory.getLogger(EntityResolver.class);

	private static final int MAX_REPORTED_CANDIDATES = 5;

	private final KnowledgeGraph kg;
	private final ReconciliationConfig config;
	private final NameMatcher columnMatcher;

	public EntityResolver(KnowledgeGraph kg) {
		this(kg, ReconciliationConfig.defaults());
	}

	public EntityResolver(KnowledgeGraph kg, ReconciliationConfig config) {
		this.kg = Objects.requireNonNull(kg, "kg must not be null");
		this.config = config != null ? config : ReconciliationConfig.defaults();
		this.columnMatcher = new NameMatcher(this.config.matchThreshold());
	}

	public Resolution resolve(QueryIntent intent) {
		return resolve(intent, List.of());
	}

	/**
	 * @param intent classified intent
	 * @param schemas schemas to search; empty searches every table
	 */
	public Resolution resolve(QueryIntent intent, Collection<String> schemas) {
		Objects.requireNonNull(intent, "intent must not be null");
		Context context = new Context(schemas);

		ResolvedEntity source = resolveRequired(intent.sourceMention(), "source", context);
		ResolvedEntity target = null;
		if (intent.targetMention() != null) {
			target = resolveTable(intent.targetMention(), context);
		}
		else if (intent.archetype().requiresJoin()) {
			context.issue(ReconciliationErrorType.UNRESOLVED_ENTITY, null,
					"No target table mentioned for " + intent.archetype(), List.of());
		}
		if (source != null && target != null && source.isResolved() && target.isResolved()
				&& source.resolvedTable().equalsIgnoreCase(target.resolvedTable())) {
			context.issue(ReconciliationErrorType.UNRESOLVED_ENTITY, intent.targetMention(),
					"Source and target both resolve to " + source.resolvedTable(), List.of(source.resolvedTable()));
		}

		List<ResolvedEntity> additional = new ArrayList<>();
		for (String mention : intent.additionalMentions()) {
			additional.add(resolveTable(mention, context));
		}

		ResolvedEntity anchor = intent.archetype() == Archetype.UNMATCHED_TARGET ? target : source;
		List<String> filterTables = filterTables(intent.archetype(), anchor, source, target, additional);
		List<ResolvedFilter> filters = new ArrayList<>();
		if (!filterTables.isEmpty()) {
			for (FilterMention filter : intent.filterMentions()) {
				resolveFilter(filter, filterTables, context).ifPresent(filters::add);
			}
		}

		List<ResolvedProjection> projections = new ArrayList<>();
		for (ProjectionMention projection : intent.projections()) {
			resolveProjection(projection, context).ifPresent(projections::add);
		}

		Resolution resolution = new Resolution(source, target, additional, filters, projections,
				context.issues, context.confidence());
		if (!resolution.isComplete() && logger.isInfoEnabled()) {
			logger.info("Resolution of '{}' incomplete: {}", intent.rawText(), resolution.issues().get(0).message());
		}
		return resolution;
	}

	private ResolvedEntity resolveRequired(String mention, String role, Context context) {
		if (mention == null) {
			context.issue(ReconciliationErrorType.UNRESOLVED_ENTITY, null, "No " + role + " table mentioned", List.of());
			return null;
		}
		return resolveTable(mention, context);
	}

	ResolvedEntity resolveTable(String mention, Context context) {
		List<TableMatch> matches = kg.findTable(mention, context.schemas);
		if (matches.isEmpty()) {
			List<TableMatch> ranked = kg.rankTables(mention, context.schemas);
			double best = ranked.isEmpty() ? 0.0 : ranked.get(0).confidence();
			List<String> candidates = names(ranked);
			context.confidences.add(best);
			context.issue(ReconciliationErrorType.UNRESOLVED_ENTITY, mention,
					"No table matches '%s' (best score %.2f)".formatted(mention, best), candidates);
			return new ResolvedEntity(mention, null, null, null, best, candidates);
		}

		TableMatch top = matches.get(0);
		List<String> candidates = names(matches);
		if (matches.size() > 1 && top.confidence() - matches.get(1).confidence() <= config.ambiguityMargin()) {
			double capped = Math.min(top.confidence(), config.ambiguousConfidenceCap());
			context.confidences.add(capped);
			context.issue(ReconciliationErrorType.UNRESOLVED_ENTITY, mention,
					"Mention '%s' is ambiguous between %s".formatted(mention, String.join(", ", candidates)), candidates);
			return new ResolvedEntity(mention, null, null, null, capped, candidates);
		}

		context.confidences.add(top.confidence());
		logger.debug("Resolved '{}' to {} via {} ({})", mention, top.tableName(), top.strategy(), top.confidence());
		return new ResolvedEntity(mention, top.tableName(), null, top.strategy(), top.confidence(), candidates);
	}

	private Optional<ResolvedFilter> resolveFilter(FilterMention filter, List<String> tables, Context context) {
		for (String table : tables) {
			ColumnResolution column = resolveColumn(table, filter.columnHint());
			switch (column.outcome()) {
				case FOUND -> {
					context.confidences.add(column.match().confidence());
					return Optional.of(new ResolvedFilter(table, column.match().target(), filter.operator(),
							filter.value(), filter.columnHint(), column.match().strategy(), column.match().confidence()));
				}
				case AMBIGUOUS -> {
					context.issue(ReconciliationErrorType.AMBIGUOUS_COLUMN, filter.columnHint(),
							"Filter hint '%s' matches several columns of %s: %s".formatted(
									filter.columnHint(), table, String.join(", ", column.candidates())),
							column.candidates());
					return Optional.empty();
				}
				case NONE -> {
					// try the next permitted table
				}
			}
		}
		context.issue(ReconciliationErrorType.UNRESOLVED_ENTITY, filter.columnHint(),
				"No column of %s matches filter hint '%s'".formatted(String.join(", ", tables), filter.columnHint()),
				List.of());
		return Optional.empty();
	}

	private Optional<ResolvedProjection> resolveProjection(ProjectionMention projection, Context context) {
		ResolvedEntity table = resolveTable(projection.tableMention(), context);
		if (!table.isResolved()) {
			return Optional.empty();
		}
		ColumnResolution column = resolveColumn(table.resolvedTable(), projection.columnHint());
		switch (column.outcome()) {
			case FOUND -> {
				context.confidences.add(column.match().confidence());
				return Optional.of(new ResolvedProjection(table.resolvedTable(), column.match().target(),
						Math.min(table.matchConfidence(), column.match().confidence())));
			}
			case AMBIGUOUS -> context.issue(ReconciliationErrorType.AMBIGUOUS_COLUMN, projection.columnHint(),
					"Projected column '%s' matches several columns of %s: %s".formatted(
							projection.columnHint(), table.resolvedTable(), String.join(", ", column.candidates())),
					column.candidates());
			case NONE -> context.issue(ReconciliationErrorType.UNRESOLVED_ENTITY, projection.columnHint(),
					"No column of %s matches '%s'".formatted(table.resolvedTable(), projection.columnHint()),
					List.of());
		}
		return Optional.empty();
	}

	/**
	 * Matches a column hint, trying each configured synonym in turn.
	 */
	ColumnResolution resolveColumn(String table, String hint) {
		TableNode node = kg.table(table).orElse(null);
		if (node == null || node.columns().isEmpty()) {
			return ColumnResolution.none();
		}
		List<NameMatcher.Candidate<String>> columns = node.columns().stream()
				.map(column -> new NameMatcher.Candidate<>(column, column, List.<String>of()))
				.toList();
		List<String> attempts = new ArrayList<>();
		attempts.add(hint);
		config.synonymsFor(hint).stream()
				.filter(synonym -> !synonym.equalsIgnoreCase(hint))
				.forEach(attempts::add);

		for (String attempt : attempts) {
			List<NameMatcher.Match<String>> matches = columnMatcher.match(attempt, columns);
			if (matches.isEmpty()) {
				continue;
			}
			NameMatcher.Match<String> top = matches.get(0);
			if (matches.size() > 1 && top.confidence() - matches.get(1).confidence() <= config.ambiguityMargin()) {
				List<String> candidates = matches.stream().map(NameMatcher.Match::target).toList();
				return ColumnResolution.ambiguous(candidates);
			}
			return ColumnResolution.found(top);
		}
		return ColumnResolution.none();
	}

	private static List<String> filterTables(Archetype archetype, ResolvedEntity anchor, ResolvedEntity source,
			ResolvedEntity target, List<ResolvedEntity> additional) {
		List<String> tables = new ArrayList<>();
		if (anchor == null || !anchor.isResolved()) {
			return tables;
		}
		tables.add(anchor.resolvedTable());
		// anti-joins filter the kept side; counts read the counted table only
		if (archetype.isAntiJoin() || archetype == Archetype.INACTIVE_COUNT) {
			return tables;
		}
		List<ResolvedEntity> others = new ArrayList<>();
		others.add(source);
		others.add(target);
		others.addAll(additional);
		for (ResolvedEntity other : others) {
			if (other != null && other.isResolved()
					&& tables.stream().noneMatch(other.resolvedTable()::equalsIgnoreCase)) {
				tables.add(other.resolvedTable());
			}
		}
		return tables;
	}

	private static List<String> names(List<TableMatch> matches) {
		return matches.stream()
				.limit(MAX_REPORTED_CANDIDATES)
				.map(TableMatch::tableName)
				.toList();
	}

	record ColumnResolution(Outcome outcome, NameMatcher.Match<String> match, List<String> candidates) {

		enum Outcome {
			FOUND,
			AMBIGUOUS,
			NONE
		}

		static ColumnResolution found(NameMatcher.Match<String> match) {
			return new ColumnResolution(Outcome.FOUND, match, List.of(match.target()));
		}

		static ColumnResolution ambiguous(List<String> candidates) {
			return new ColumnResolution(Outcome.AMBIGUOUS, null, candidates);
		}

		static ColumnResolution none() {
			return new ColumnResolution(Outcome.NONE, null, List.of());
		}
	}

	static final class Context {
		private final Collection<String> schemas;
		private final List<Double> confidences = new ArrayList<>();
		private final List<ResolutionIssue> issues = new ArrayList<>();

		Context(Collection<String> schemas) {
			this.schemas = schemas != null ? List.copyOf(schemas) : List.of();
		}

		void issue(ReconciliationErrorType type, String mention, String message, List<String> candidates) {
			issues.add(new ResolutionIssue(type, mention, message, candidates));
			if (mention == null) {
				confidences.add(0.0);
			}
		}

		double confidence() {
			return confidences.stream().mapToDouble(Double::doubleValue).min().orElse(1.0);
		}
	}
}
