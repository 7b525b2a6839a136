package org.javai.nlrecon.kg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link KnowledgeGraph} from its JSON form (see {@link KnowledgeGraphDocument}).
 *
 * <p>The returned graph is still open; registering it seals it.</p>
 */
public final class KnowledgeGraphLoader {

	private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraphLoader.class);

	private static final double DEFAULT_EDGE_CONFIDENCE = 1.0;

	private final ObjectMapper mapper;
	private final NameMatcher matcher;
	private final AliasDeriver aliasDeriver;

	public KnowledgeGraphLoader() {
		this(new ObjectMapper(), new NameMatcher(), null);
	}

	/**
	 * @param mapper JSON mapper
	 * @param matcher matcher used by the loaded graph
	 * @param aliasDeriver when non-null, each table also gets its derived alias
	 */
	public KnowledgeGraphLoader(ObjectMapper mapper, NameMatcher matcher, AliasDeriver aliasDeriver) {
		this.mapper = mapper;
		this.matcher = matcher;
		this.aliasDeriver = aliasDeriver;
	}

	public KnowledgeGraph load(Path path) {
		try (InputStream in = Files.newInputStream(path)) {
			return load(in);
		}
		catch (IOException e) {
			throw new KnowledgeGraphLoadException("Failed to read knowledge graph from " + path, e);
		}
	}

	public KnowledgeGraph load(InputStream in) {
		try {
			return fromDocument(mapper.readValue(in, KnowledgeGraphDocument.class));
		}
		catch (IOException e) {
			throw new KnowledgeGraphLoadException("Failed to parse knowledge graph document: " + e.getMessage(), e);
		}
	}

	public KnowledgeGraph loadJson(String json) {
		try {
			return fromDocument(mapper.readValue(json, KnowledgeGraphDocument.class));
		}
		catch (JsonProcessingException e) {
			throw new KnowledgeGraphLoadException("Failed to parse knowledge graph document: " + e.getMessage(), e);
		}
	}

	public KnowledgeGraph fromDocument(KnowledgeGraphDocument document) {
		if (document == null || document.name() == null || document.name().isBlank()) {
			throw new KnowledgeGraphLoadException("Knowledge graph document must carry a name");
		}
		KnowledgeGraph kg = new KnowledgeGraph(document.name(), matcher);
		try {
			for (KnowledgeGraphDocument.TableEntry table : document.tables()) {
				List<String> aliases = new ArrayList<>(table.aliases());
				aliases.addAll(table.learnedAliases());
				if (aliasDeriver != null) {
					aliasDeriver.derive(table.name()).ifPresent(aliases::add);
				}
				kg.addTable(table.name(), table.schema(), aliases, table.columns());
			}
			for (KnowledgeGraphDocument.RelationshipEntry rel : document.relationships()) {
				kg.addRelationship(new RelationshipEdge(
						rel.sourceTable(),
						rel.sourceColumn(),
						rel.targetTable(),
						rel.targetColumn(),
						rel.relationshipType(),
						rel.confidence() != null ? rel.confidence() : DEFAULT_EDGE_CONFIDENCE,
						rel.bidirectional() == null || rel.bidirectional()));
			}
		}
		catch (IllegalArgumentException e) {
			throw new KnowledgeGraphLoadException(
					"Invalid knowledge graph '" + document.name() + "': " + e.getMessage(), e);
		}
		logger.info("Loaded knowledge graph {} ({} tables, {} relationships)",
				kg.name(), document.tables().size(), document.relationships().size());
		return kg;
	}
}
