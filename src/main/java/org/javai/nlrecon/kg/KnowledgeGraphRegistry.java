package org.javai.nlrecon.kg;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named knowledge graphs available to reconciliation requests.
 *
 * <p>Registering a graph seals it, so every graph handed out by the registry is
 * read-only. Names compare case-insensitively.</p>
 */
public final class KnowledgeGraphRegistry {

	private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraphRegistry.class);

	private final Map<String, KnowledgeGraph> graphs = new ConcurrentHashMap<>();

	public KnowledgeGraphRegistry register(KnowledgeGraph kg) {
		if (kg == null) {
			throw new IllegalArgumentException("knowledge graph must not be null");
		}
		kg.seal();
		KnowledgeGraph previous = graphs.put(kg.name().toLowerCase(Locale.ROOT), kg);
		if (previous != null) {
			logger.info("Replaced knowledge graph {}", kg.name());
		}
		return this;
	}

	public Optional<KnowledgeGraph> find(String name) {
		if (name == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(graphs.get(name.toLowerCase(Locale.ROOT)));
	}

	public List<String> names() {
		return graphs.values().stream().map(KnowledgeGraph::name).sorted().toList();
	}
}
