package org.javai.nlrecon;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import org.javai.nlrecon.sql.Dialect;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ReconciliationRequest")
class ReconciliationRequestTest {

	private static ReconciliationRequest.Builder valid() {
		return ReconciliationRequest.builder()
				.definition("Show me all products in RBP which are not in OPS Excel")
				.kgName("gpu-planning");
	}

	@Test
	@DisplayName("defaults to SQL Server and the configured limits")
	void defaults() {
		ReconciliationRequest request = valid().build().validate();
		ReconciliationConfig config = ReconciliationConfig.builder().defaultLimitRecords(250).build();

		assertThat(request.dialect()).isEqualTo(Dialect.SQL_SERVER);
		assertThat(request.schemas()).isEmpty();
		assertThat(request.useLlm()).isFalse();
		assertThat(request.effectiveLimit(config)).isEqualTo(250);
		assertThat(request.effectiveTimeout(config)).isEqualTo(ReconciliationConfig.DEFAULT_TIMEOUT_SECONDS);
	}

	@Test
	@DisplayName("request values override the configured limits")
	void overrides() {
		ReconciliationRequest request = valid().limitRecords(10).timeoutSeconds(3).build();

		assertThat(request.effectiveLimit(ReconciliationConfig.defaults())).isEqualTo(10);
		assertThat(request.effectiveTimeout(ReconciliationConfig.defaults())).isEqualTo(3);
	}

	@ParameterizedTest
	@ValueSource(strings = {"default", "DEFAULT", " Default "})
	@DisplayName("the reserved knowledge graph name is rejected")
	void reservedName(String name) {
		assertThatThrownBy(() -> valid().kgName(name).build().validate())
				.isInstanceOf(InvalidRequestException.class)
				.hasMessageContaining("reserved");
	}

	@Test
	@DisplayName("a knowledge graph name is required")
	void missingName() {
		assertThatThrownBy(() -> valid().kgName(" ").build().validate())
				.isInstanceOf(InvalidRequestException.class);
	}

	@Test
	@DisplayName("at least one non-blank definition is required")
	void definitions() {
		assertThatThrownBy(() -> ReconciliationRequest.builder().kgName("gpu-planning").build().validate())
				.isInstanceOf(InvalidRequestException.class)
				.hasMessageContaining("At least one definition");
		assertThatThrownBy(() -> valid().definitions(Arrays.asList("ok", " ")).build().validate())
				.isInstanceOf(InvalidRequestException.class)
				.hasMessageContaining("Definition 3 is blank");
	}

	@Test
	@DisplayName("limits and confidence are range-checked")
	void ranges() {
		assertThatThrownBy(() -> valid().limitRecords(0).build().validate())
				.isInstanceOf(InvalidRequestException.class);
		assertThatThrownBy(() -> valid().timeoutSeconds(-1).build().validate())
				.isInstanceOf(InvalidRequestException.class);
		assertThatThrownBy(() -> valid().minConfidence(1.5).build().validate())
				.isInstanceOf(InvalidRequestException.class);
	}

	@Test
	@DisplayName("lists are copied")
	void immutable() {
		ReconciliationRequest request = valid().schemas(List.of("dbo")).build();

		assertThatThrownBy(() -> request.definitions().add("more"))
				.isInstanceOf(UnsupportedOperationException.class);
		assertThat(request.schemas()).containsExactly("dbo");
	}
}
