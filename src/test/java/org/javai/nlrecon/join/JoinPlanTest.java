package org.javai.nlrecon.join;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.javai.nlrecon.intent.FilterOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JoinPlan")
class JoinPlanTest {

	private static final JoinCondition A_TO_B = new JoinCondition("a", "id", "b", "a_id", JoinType.LEFT, 0.8);

	@Test
	@DisplayName("a single-table plan selects everything")
	void singleTable() {
		JoinPlan plan = JoinPlan.singleTable("a");

		assertThat(plan.drivingTable()).isEqualTo("a");
		assertThat(plan.selectColumns().get("a")).isEqualTo(SelectColumns.ALL);
		assertThat(plan.confidence()).isEqualTo(1.0);
		assertThat(plan.indexOf("A")).isZero();
	}

	@Test
	@DisplayName("rejects a table that no join introduces")
	void disconnected() {
		assertThatThrownBy(() -> new JoinPlan(List.of("a", "b"), List.of(), Map.of(), List.of(), null, 1.0))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("not connected");
	}

	@Test
	@DisplayName("rejects duplicate tables")
	void duplicates() {
		assertThatThrownBy(() -> new JoinPlan(List.of("a", "A"), List.of(), Map.of(), List.of(), null, 1.0))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("duplicate");
	}

	@Test
	@DisplayName("rejects a join that introduces an earlier table")
	void joinOrder() {
		JoinCondition backwards = new JoinCondition("b", "a_id", "a", "id", JoinType.INNER, 1.0);

		assertThatThrownBy(() -> new JoinPlan(List.of("a", "b"), List.of(A_TO_B, backwards), Map.of(), List.of(),
				null, 1.0))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("rejects filters on the excluded table")
	void filterOnExcluded() {
		FilterClause filter = new FilterClause("b", "status", FilterOperator.EQ, "x");

		assertThatThrownBy(() -> new JoinPlan(List.of("a", "b"), List.of(A_TO_B), Map.of(), List.of(filter), "b", 0.8))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("excluded");
	}

	@Test
	@DisplayName("the driving table cannot be excluded")
	void drivingExcluded() {
		assertThatThrownBy(() -> new JoinPlan(List.of("a", "b"), List.of(A_TO_B), Map.of(), List.of(), "a", 0.8))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("a table cannot be joined to itself")
	void selfJoin() {
		assertThatThrownBy(() -> new JoinCondition("a", "id", "A", "id", JoinType.INNER, 1.0))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("explicit selections accumulate distinct columns")
	void selectColumns() {
		SelectColumns columns = SelectColumns.of("x").plus("y").plus("X");

		assertThat(columns.all()).isFalse();
		assertThat(columns.columns()).containsExactly("x", "y");
		assertThat(SelectColumns.ALL.plus("x")).isSameAs(SelectColumns.ALL);
	}
}
