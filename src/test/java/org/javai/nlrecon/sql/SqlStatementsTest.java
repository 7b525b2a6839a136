package org.javai.nlrecon.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SqlStatements")
class SqlStatementsTest {

	private static final String QUALIFIED = """
			SELECT TOP 1000 s.*
			FROM [dbo].[brz_lnd_RBP_GPU] s
			LEFT JOIN [dbo].[brz_lnd_OPS_EXCEL_GPU] t ON s.[Material] = t.[PLANNING_SKU]
			WHERE t.[PLANNING_SKU] IS NULL
			  AND s.[Description] = 'dbo.legacy'""";

	@Nested
	@DisplayName("parseSelect")
	class ParseSelect {

		@Test
		@DisplayName("accepts bracket-quoted SQL Server statements")
		void brackets() {
			assertThat(SqlStatements.parseSelect(QUALIFIED)).isNotNull();
		}

		@Test
		@DisplayName("rejects statements other than SELECT")
		void notSelect() {
			assertThatThrownBy(() -> SqlStatements.parseSelect("DELETE FROM t"))
					.isInstanceOf(SqlGenerationException.class)
					.hasMessageContaining("Only SELECT");
		}

		@Test
		@DisplayName("rejects malformed SQL")
		void malformed() {
			assertThatThrownBy(() -> SqlStatements.parseSelect("SELECT FROM WHERE"))
					.isInstanceOf(SqlGenerationException.class)
					.hasMessageContaining("Invalid SQL syntax");
		}

		@Test
		@DisplayName("rejects blank input")
		void blank() {
			assertThatThrownBy(() -> SqlStatements.parseSelect("  "))
					.isInstanceOf(SqlGenerationException.class);
		}
	}

	@Nested
	@DisplayName("Schema qualification")
	class SchemaQualification {

		@Test
		@DisplayName("detects schema-qualified tables")
		void detects() {
			assertThat(SqlStatements.isSchemaQualified(QUALIFIED)).isTrue();
			assertThat(SqlStatements.isSchemaQualified("SELECT s.* FROM [brz_lnd_RBP_GPU] s")).isFalse();
		}

		@Test
		@DisplayName("strips schemas from tables only")
		void strips() {
			String stripped = SqlStatements.stripSchema(QUALIFIED);

			assertThat(stripped).doesNotContain("[dbo].")
					.contains("[brz_lnd_RBP_GPU] s")
					.contains("[brz_lnd_OPS_EXCEL_GPU] t")
					.contains("'dbo.legacy'")
					.contains("TOP 1000");
			assertThat(SqlStatements.isSchemaQualified(stripped)).isFalse();
		}
	}
}
