package org.javai.nlrecon.kg;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tables, their aliases and columns, and the relationships that say how tables join.
 *
 * <p>The graph is filled by a single writer during ingestion and then {@linkplain #seal()
 * sealed}. After sealing every mutator throws {@link IllegalStateException} and the graph
 * may be read from any number of threads.</p>
 *
 * <pre>{@code
 * KnowledgeGraph kg = new KnowledgeGraph("recon_kg")
 *     .addTable("brz_lnd_RBP_GPU", List.of("RBP"), List.of("Material", "Status"))
 *     .addTable("brz_lnd_OPS_EXCEL_GPU", List.of("OPS Excel"), List.of("PLANNING_SKU"))
 *     .addRelationship(RelationshipEdge.matches(
 *         "brz_lnd_RBP_GPU", "Material", "brz_lnd_OPS_EXCEL_GPU", "PLANNING_SKU", 0.95));
 * }</pre>
 */
public final class KnowledgeGraph {

	private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraph.class);

	private final String name;
	private final NameMatcher matcher;
	private final Map<String, TableNode> tables = new LinkedHashMap<>();
	private final List<RelationshipEdge> relationships = new ArrayList<>();
	private volatile boolean sealed;

	public KnowledgeGraph(String name) {
		this(name, new NameMatcher());
	}

	public KnowledgeGraph(String name, NameMatcher matcher) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("knowledge graph name must not be blank");
		}
		if (matcher == null) {
			throw new IllegalArgumentException("matcher must not be null");
		}
		this.name = name;
		this.matcher = matcher;
	}

	public String name() {
		return name;
	}

	public NameMatcher matcher() {
		return matcher;
	}

	public KnowledgeGraph addTable(String tableName, Collection<String> aliases, List<String> columns) {
		return addTable(tableName, null, aliases, columns);
	}

	public synchronized KnowledgeGraph addTable(String tableName, String schema, Collection<String> aliases,
			List<String> columns) {
		requireOpen();
		TableNode node = new TableNode(tableName, schema, aliases, columns);
		String key = key(tableName);
		if (tables.containsKey(key)) {
			throw new IllegalArgumentException("Table already registered: " + tableName);
		}
		tables.put(key, node);
		logger.debug("Registered table {} in knowledge graph {}", node.qualifiedName(), name);
		return this;
	}

	/**
	 * Appends aliases to an existing table. Aliases equal to the name or to an existing alias
	 * (ignoring case) are skipped.
	 */
	public synchronized KnowledgeGraph addAliases(String tableName, String... aliases) {
		requireOpen();
		TableNode node = requireTable(tableName);
		for (String alias : aliases) {
			node.addAlias(alias);
		}
		return this;
	}

	/**
	 * Adds a relationship. Both endpoint tables must already exist, and when an endpoint
	 * declares columns the edge's column must be one of them.
	 */
	public synchronized KnowledgeGraph addRelationship(RelationshipEdge edge) {
		requireOpen();
		if (edge == null) {
			throw new IllegalArgumentException("edge must not be null");
		}
		TableNode source = requireTable(edge.sourceTable());
		TableNode target = requireTable(edge.targetTable());
		requireColumn(source, edge.sourceColumn());
		requireColumn(target, edge.targetColumn());
		relationships.add(new RelationshipEdge(source.name(), source.findColumn(edge.sourceColumn()).orElse(edge.sourceColumn()),
				target.name(), target.findColumn(edge.targetColumn()).orElse(edge.targetColumn()),
				edge.relationshipType(), edge.confidence(), edge.bidirectional()));
		return this;
	}

	/**
	 * Ends ingestion. The graph is read-only afterwards.
	 */
	public synchronized void seal() {
		if (!sealed) {
			sealed = true;
			logger.info("Knowledge graph {} sealed with {} tables and {} relationships",
					name, tables.size(), relationships.size());
		}
	}

	public boolean isSealed() {
		return sealed;
	}

	public Optional<TableNode> table(String tableName) {
		if (tableName == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(tables.get(key(tableName)));
	}

	public List<TableNode> tables() {
		return List.copyOf(tables.values());
	}

	public Optional<String> schemaOf(String tableName) {
		return table(tableName).flatMap(TableNode::schema);
	}

	/**
	 * Candidate tables for a mention, best first. Empty when nothing reaches the matcher's
	 * minimum confidence.
	 */
	public List<TableMatch> findTable(String mention) {
		return findTable(mention, List.of());
	}

	/**
	 * Candidate tables for a mention, restricted to tables in one of the given schemas.
	 * An empty schema list means no restriction.
	 */
	public List<TableMatch> findTable(String mention, Collection<String> schemas) {
		return matcher.match(mention, candidates(schemas)).stream()
				.map(m -> new TableMatch(m.target(), m.strategy(), m.confidence()))
				.toList();
	}

	/**
	 * Every in-scope table scored against the mention, best first, without applying the
	 * minimum confidence.
	 */
	public List<TableMatch> rankTables(String mention, Collection<String> schemas) {
		return matcher.rank(mention, candidates(schemas)).stream()
				.map(m -> new TableMatch(m.target(), m.strategy(), m.confidence()))
				.toList();
	}

	/**
	 * Relationships leading from {@code a} to {@code b}. Bidirectional edges stored from
	 * {@code b} to {@code a} are returned reversed so that every result reads from
	 * {@code a}. Insertion order is preserved.
	 */
	public List<RelationshipEdge> findRelationship(String a, String b) {
		List<RelationshipEdge> found = new ArrayList<>();
		for (RelationshipEdge edge : relationships) {
			if (edge.sourceTable().equalsIgnoreCase(a) && edge.targetTable().equalsIgnoreCase(b)) {
				found.add(edge);
			}
			else if (edge.bidirectional()
					&& edge.sourceTable().equalsIgnoreCase(b) && edge.targetTable().equalsIgnoreCase(a)) {
				found.add(edge.reversed());
			}
		}
		return found;
	}

	/**
	 * Every stored edge with {@code a} and {@code b} as endpoints, in either direction,
	 * in insertion order.
	 */
	public List<RelationshipEdge> edgesBetween(String a, String b) {
		return relationships.stream().filter(edge -> edge.connects(a, b)).toList();
	}

	/**
	 * Tables sharing at least one edge with the given table, in table registration order.
	 */
	public List<String> neighbours(String tableName) {
		Set<String> adjacent = new LinkedHashSet<>();
		for (RelationshipEdge edge : relationships) {
			if (edge.touches(tableName)) {
				adjacent.add(key(edge.otherEnd(tableName)));
			}
		}
		List<String> ordered = new ArrayList<>();
		for (TableNode node : tables.values()) {
			if (adjacent.contains(key(node.name())) && !node.name().equalsIgnoreCase(tableName)) {
				ordered.add(node.name());
			}
		}
		return ordered;
	}

	public List<RelationshipEdge> relationships() {
		return List.copyOf(relationships);
	}

	/**
	 * Table name to aliases, in registration order.
	 */
	public Map<String, List<String>> allAliases() {
		Map<String, List<String>> aliases = new LinkedHashMap<>();
		tables.values().forEach(node -> aliases.put(node.name(), node.aliases()));
		return aliases;
	}

	private List<NameMatcher.Candidate<TableNode>> candidates(Collection<String> schemas) {
		List<NameMatcher.Candidate<TableNode>> candidates = new ArrayList<>();
		for (TableNode node : tables.values()) {
			if (inScope(node, schemas)) {
				candidates.add(new NameMatcher.Candidate<>(node, node.name(), node.aliases()));
			}
		}
		return candidates;
	}

	private static boolean inScope(TableNode node, Collection<String> schemas) {
		if (schemas == null || schemas.isEmpty()) {
			return true;
		}
		return node.schema()
				.map(schema -> schemas.stream().anyMatch(schema::equalsIgnoreCase))
				.orElse(false);
	}

	private TableNode requireTable(String tableName) {
		return table(tableName).orElseThrow(() ->
				new IllegalArgumentException("Unknown table '" + tableName + "' in knowledge graph " + name));
	}

	private static void requireColumn(TableNode table, String column) {
		if (!table.columns().isEmpty() && !table.hasColumn(column)) {
			throw new IllegalArgumentException(
					"Column '" + column + "' is not declared on table " + table.name());
		}
	}

	private void requireOpen() {
		if (sealed) {
			throw new IllegalStateException("Knowledge graph " + name + " is sealed");
		}
	}

	private static String key(String tableName) {
		return tableName.toLowerCase(Locale.ROOT);
	}

	@Override
	public String toString() {
		return "KnowledgeGraph[" + name + ", tables=" + tables.size() + ", relationships=" + relationships.size() + "]";
	}
}
