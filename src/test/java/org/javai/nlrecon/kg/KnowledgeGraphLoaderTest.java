package org.javai.nlrecon.kg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("KnowledgeGraphLoader")
class KnowledgeGraphLoaderTest {

	private static final String FIXTURE = "/kg/gpu-planning.json";

	private KnowledgeGraph loadFixture(KnowledgeGraphLoader loader) throws IOException {
		try (InputStream in = getClass().getResourceAsStream(FIXTURE)) {
			assertThat(in).as("fixture %s", FIXTURE).isNotNull();
			return loader.load(in);
		}
	}

	@Nested
	@DisplayName("Loading")
	class Loading {

		@Test
		@DisplayName("tables, schemas, aliases and columns are loaded")
		void tables() throws IOException {
			KnowledgeGraph kg = loadFixture(new KnowledgeGraphLoader());

			assertThat(kg.name()).isEqualTo("gpu-planning");
			assertThat(kg.tables()).extracting(TableNode::name)
					.containsExactly("brz_lnd_RBP_GPU", "brz_lnd_OPS_EXCEL_GPU", "hana_material_master");
			TableNode rbp = kg.table("brz_lnd_RBP_GPU").orElseThrow();
			assertThat(rbp.schema()).contains("dbo");
			assertThat(rbp.aliases()).containsExactly("RBP", "RBP GPU");
			assertThat(rbp.columns()).containsExactly("Material", "Plant", "Status", "Description");
		}

		@Test
		@DisplayName("relationship defaults are applied")
		void relationshipDefaults() throws IOException {
			KnowledgeGraph kg = loadFixture(new KnowledgeGraphLoader());

			assertThat(kg.relationships()).hasSize(2);
			RelationshipEdge ops = kg.relationships().get(0);
			assertThat(ops.confidence()).isEqualTo(0.95);
			assertThat(ops.bidirectional()).isTrue();
			RelationshipEdge hana = kg.relationships().get(1);
			assertThat(hana.confidence()).isEqualTo(1.0);
			assertThat(hana.bidirectional()).isFalse();
			assertThat(hana.relationshipType()).isEqualTo(RelationshipEdge.DEFAULT_TYPE);
		}

		@Test
		@DisplayName("derived aliases are added when a deriver is configured")
		void derivedAliases() throws IOException {
			KnowledgeGraphLoader loader = new KnowledgeGraphLoader(new ObjectMapper(), new NameMatcher(),
					new AliasDeriver());

			KnowledgeGraph kg = loadFixture(loader);

			assertThat(kg.table("brz_lnd_OPS_EXCEL_GPU").orElseThrow().aliases()).contains("ops_excel_gpu");
			assertThat(kg.findTable("ops_excel_gpu"))
					.extracting(TableMatch::tableName)
					.containsExactly("brz_lnd_OPS_EXCEL_GPU");
		}

		@Test
		@DisplayName("a loaded graph is still open for ingestion")
		void open() throws IOException {
			KnowledgeGraph kg = loadFixture(new KnowledgeGraphLoader());

			assertThat(kg.isSealed()).isFalse();
		}

		@Test
		@DisplayName("loads from a file")
		void fromFile(@TempDir Path dir) throws IOException {
			Path file = dir.resolve("kg.json");
			Files.writeString(file, """
					{"name": "tiny", "tables": [{"name": "orders", "columns": ["id"]}]}
					""");

			KnowledgeGraph kg = new KnowledgeGraphLoader().load(file);

			assertThat(kg.name()).isEqualTo("tiny");
			assertThat(kg.table("ORDERS")).isPresent();
		}
	}

	@Nested
	@DisplayName("Errors")
	class Errors {

		@Test
		@DisplayName("malformed JSON is reported")
		void malformed() {
			assertThatThrownBy(() -> new KnowledgeGraphLoader().loadJson("{ not json"))
					.isInstanceOf(KnowledgeGraphLoadException.class)
					.hasMessageContaining("Failed to parse");
		}

		@Test
		@DisplayName("a document without a name is rejected")
		void missingName() {
			assertThatThrownBy(() -> new KnowledgeGraphLoader().loadJson("{\"tables\": []}"))
					.isInstanceOf(KnowledgeGraphLoadException.class)
					.hasMessageContaining("name");
		}

		@Test
		@DisplayName("relationships to unknown tables are rejected")
		void danglingRelationship() {
			String json = """
					{
					  "name": "broken",
					  "tables": [{"name": "orders", "columns": ["customer_id"]}],
					  "relationships": [{"source_table": "orders", "source_column": "customer_id",
					                     "target_table": "customers", "target_column": "id"}]
					}
					""";

			assertThatThrownBy(() -> new KnowledgeGraphLoader().loadJson(json))
					.isInstanceOf(KnowledgeGraphLoadException.class)
					.hasMessageContaining("broken")
					.hasMessageContaining("customers");
		}

		@Test
		@DisplayName("a missing file is reported with its path")
		void missingFile(@TempDir Path dir) {
			Path missing = dir.resolve("missing.json");

			assertThatThrownBy(() -> new KnowledgeGraphLoader().load(missing))
					.isInstanceOf(KnowledgeGraphLoadException.class)
					.hasMessageContaining("missing.json");
		}
	}
}
