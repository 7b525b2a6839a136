package org.javai.nlrecon.join;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.nlrecon.ReconciliationConfig;
import org.javai.nlrecon.intent.Archetype;
import org.javai.nlrecon.kg.KnowledgeGraph;
import org.javai.nlrecon.kg.RelationshipEdge;
import org.javai.nlrecon.resolve.Resolution;
import org.javai.nlrecon.resolve.ResolvedFilter;
import org.javai.nlrecon.resolve.ResolvedProjection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects resolved tables into a {@link JoinPlan} using the knowledge graph's relationships.
 *
 * <p>The graph is read as undirected: two tables are adjacent when any edge links them.
 * Tables are added in request order. For each table a breadth-first search starts at the
 * previous table and may only pass through tables already in the plan, so a table joins
 * either directly or through a table that was requested earlier. With bridging enabled the
 * search may also pass through tables nobody asked for; those tables join the plan too.</p>
 *
 * <p>Where several edges link the same pair of tables, the one with the highest confidence
 * wins; among equals, the most recently added.</p>
 */
public final class JoinPathResolver {

	private static final Logger logger = LoggerFactory.getLogger(JoinPathResolver.class);

	private final KnowledgeGraph kg;
	private final boolean allowBridgeTables;
	private final int maxBridgeHops;

	public JoinPathResolver(KnowledgeGraph kg) {
		this(kg, ReconciliationConfig.defaults());
	}

	public JoinPathResolver(KnowledgeGraph kg, ReconciliationConfig config) {
		this.kg = Objects.requireNonNull(kg, "kg must not be null");
		ReconciliationConfig effective = config != null ? config : ReconciliationConfig.defaults();
		this.allowBridgeTables = effective.allowBridgeTables();
		this.maxBridgeHops = effective.maxBridgeHops();
	}

	/**
	 * Inner-joins the tables in the given order, selecting every column of the first.
	 *
	 * @throws JoinPathException when a table cannot be reached
	 */
	public JoinPlan buildJoinPlan(List<String> tables) {
		if (tables == null || tables.isEmpty()) {
			throw new IllegalArgumentException("at least one table is required");
		}
		PlanBuilder builder = new PlanBuilder(tables.get(0));
		for (int i = 1; i < tables.size(); i++) {
			builder.connect(tables.get(i - 1), tables.get(i), JoinType.INNER);
		}
		return builder.build(null);
	}

	/**
	 * Builds the full plan for an archetype: join order and types, projections and filters.
	 *
	 * <ul>
	 *   <li>anti-joins put the kept table first and left-join the excluded one</li>
	 *   <li>{@link Archetype#MATCHED} and {@link Archetype#FILTERED} inner-join further tables</li>
	 *   <li>{@link Archetype#INACTIVE_COUNT} counts the source table alone</li>
	 *   <li>projection tables are left-joined so they never remove rows</li>
	 * </ul>
	 *
	 * @throws org.javai.nlrecon.resolve.ResolutionException when the resolution is incomplete
	 * @throws JoinPathException when a table cannot be reached
	 */
	public JoinPlan plan(Archetype archetype, Resolution resolution) {
		Objects.requireNonNull(archetype, "archetype must not be null");
		resolution.requireComplete();

		String kept = archetype == Archetype.UNMATCHED_TARGET ? resolution.targetTable() : resolution.sourceTable();
		String other = archetype == Archetype.UNMATCHED_TARGET ? resolution.sourceTable() : resolution.targetTable();
		if (kept == null) {
			throw new IllegalArgumentException("resolution has no table to select from");
		}
		if (archetype.requiresJoin() && other == null) {
			throw new IllegalArgumentException(archetype + " requires a second table");
		}

		PlanBuilder builder = new PlanBuilder(kept);
		JoinType joinType = archetype.isAntiJoin() ? JoinType.LEFT : JoinType.INNER;
		if (archetype == Archetype.INACTIVE_COUNT) {
			if (other != null || !resolution.additionalTables().isEmpty()) {
				logger.debug("Counting {} only; further table mentions are ignored", kept);
			}
		}
		else {
			List<String> order = new ArrayList<>();
			order.add(kept);
			if (other != null) {
				order.add(other);
			}
			order.addAll(resolution.additionalTables());
			for (int i = 1; i < order.size(); i++) {
				builder.connect(order.get(i - 1), order.get(i), joinType);
			}
		}

		if (archetype != Archetype.INACTIVE_COUNT) {
			for (ResolvedProjection projection : resolution.projections()) {
				builder.connect(kept, projection.table(), JoinType.LEFT);
				builder.select(projection.table(), projection.column());
			}
		}

		for (ResolvedFilter filter : resolution.filters()) {
			builder.filter(new FilterClause(filter.table(), filter.column(), filter.operator(), filter.value()));
		}

		String excluded = archetype.isAntiJoin() ? other : null;
		JoinPlan plan = builder.build(excluded);
		if (logger.isDebugEnabled()) {
			logger.debug("Join plan for {}: tables={}, joins={}, confidence={}",
					archetype, plan.tables(), plan.joins().size(), plan.confidence());
		}
		return plan;
	}

	/**
	 * Picks the edge used to join two adjacent tables.
	 */
	RelationshipEdge selectEdge(String a, String b) {
		RelationshipEdge best = null;
		for (RelationshipEdge edge : kg.edgesBetween(a, b)) {
			if (best == null || edge.confidence() >= best.confidence()) {
				best = edge;
			}
		}
		if (best == null) {
			throw new JoinPathException(a, b);
		}
		return best;
	}

	private final class PlanBuilder {
		private final List<String> tables = new ArrayList<>();
		private final List<JoinCondition> joins = new ArrayList<>();
		private final Map<String, SelectColumns> selectColumns = new LinkedHashMap<>();
		private final List<FilterClause> filters = new ArrayList<>();
		private double confidence = 1.0;

		PlanBuilder(String first) {
			tables.add(canonical(first));
			selectColumns.put(tables.get(0), SelectColumns.ALL);
		}

		void connect(String from, String to, JoinType joinType) {
			String target = canonical(to);
			if (includes(target)) {
				return;
			}
			List<String> path = shortestPath(canonical(from), target);
			if (path == null) {
				throw new JoinPathException(from, to);
			}
			for (int i = 1; i < path.size(); i++) {
				String left = path.get(i - 1);
				String right = path.get(i);
				if (includes(right)) {
					continue;
				}
				RelationshipEdge edge = selectEdge(left, right);
				joins.add(new JoinCondition(left, edge.columnOf(left), right, edge.columnOf(right),
						joinType, edge.confidence()));
				tables.add(right);
				confidence = Math.min(confidence, edge.confidence());
				if (!right.equalsIgnoreCase(target)) {
					logger.debug("Bridging {} to {} through {}", from, to, right);
				}
			}
		}

		void select(String table, String column) {
			String key = canonical(table);
			selectColumns.merge(key, SelectColumns.of(column), (existing, added) -> existing.plus(column));
		}

		void filter(FilterClause clause) {
			filters.add(clause);
		}

		JoinPlan build(String excludedTable) {
			return new JoinPlan(tables, joins, selectColumns, filters,
					excludedTable != null ? canonical(excludedTable) : null, confidence);
		}

		/**
		 * Breadth-first search limited to included tables, the target, and (when enabled)
		 * bridge tables.
		 */
		private List<String> shortestPath(String from, String to) {
			Map<String, String> parent = new HashMap<>();
			Map<String, Integer> bridges = new HashMap<>();
			Deque<String> queue = new ArrayDeque<>();
			parent.put(key(from), null);
			bridges.put(key(from), 0);
			queue.add(from);
			Map<String, String> names = new HashMap<>();
			names.put(key(from), from);

			while (!queue.isEmpty()) {
				String current = queue.poll();
				if (current.equalsIgnoreCase(to)) {
					return unwind(parent, names, current);
				}
				for (String neighbour : kg.neighbours(current)) {
					String neighbourKey = key(neighbour);
					if (parent.containsKey(neighbourKey)) {
						continue;
					}
					int used = bridges.get(key(current));
					boolean bridge = !includes(neighbour) && !neighbour.equalsIgnoreCase(to);
					if (bridge && (!allowBridgeTables || used + 1 > maxBridgeHops)) {
						continue;
					}
					parent.put(neighbourKey, current);
					bridges.put(neighbourKey, bridge ? used + 1 : used);
					names.put(neighbourKey, neighbour);
					queue.add(neighbour);
				}
			}
			return null;
		}

		private List<String> unwind(Map<String, String> parent, Map<String, String> names, String end) {
			List<String> path = new ArrayList<>();
			String current = end;
			while (current != null) {
				path.add(0, names.getOrDefault(key(current), current));
				current = parent.get(key(current));
			}
			return path;
		}

		private boolean includes(String table) {
			return tables.stream().anyMatch(table::equalsIgnoreCase);
		}
	}

	private String canonical(String table) {
		return kg.table(table).map(node -> node.name()).orElse(table);
	}

	private static String key(String table) {
		return table.toLowerCase(Locale.ROOT);
	}
}
