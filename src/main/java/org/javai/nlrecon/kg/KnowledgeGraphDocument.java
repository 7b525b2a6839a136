package org.javai.nlrecon.kg;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * JSON shape of an ingested knowledge graph.
 *
 * <pre>{@code
 * {
 *   "name": "recon_kg",
 *   "tables": [
 *     {"name": "brz_lnd_RBP_GPU", "schema": "dbo", "aliases": ["RBP"], "columns": ["Material"]}
 *   ],
 *   "relationships": [
 *     {"source_table": "brz_lnd_RBP_GPU", "source_column": "Material",
 *      "target_table": "brz_lnd_OPS_EXCEL_GPU", "target_column": "PLANNING_SKU",
 *      "relationship_type": "MATCHES", "confidence": 0.95, "bidirectional": true}
 *   ]
 * }
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KnowledgeGraphDocument(
		@JsonProperty("name") String name,
		@JsonProperty("tables") List<TableEntry> tables,
		@JsonProperty("relationships") List<RelationshipEntry> relationships
) {

	public KnowledgeGraphDocument {
		tables = tables != null ? List.copyOf(tables) : List.of();
		relationships = relationships != null ? List.copyOf(relationships) : List.of();
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record TableEntry(
			@JsonProperty("name") String name,
			@JsonProperty("schema") String schema,
			@JsonProperty("aliases") List<String> aliases,
			@JsonProperty("learned_aliases") List<String> learnedAliases,
			@JsonProperty("columns") List<String> columns
	) {
		public TableEntry {
			aliases = aliases != null ? List.copyOf(aliases) : List.of();
			learnedAliases = learnedAliases != null ? List.copyOf(learnedAliases) : List.of();
			columns = columns != null ? List.copyOf(columns) : List.of();
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record RelationshipEntry(
			@JsonProperty("source_table") String sourceTable,
			@JsonProperty("source_column") String sourceColumn,
			@JsonProperty("target_table") String targetTable,
			@JsonProperty("target_column") String targetColumn,
			@JsonProperty("relationship_type") String relationshipType,
			@JsonProperty("confidence") Double confidence,
			@JsonProperty("bidirectional") Boolean bidirectional
	) {
	}
}
