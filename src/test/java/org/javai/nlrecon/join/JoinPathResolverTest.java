package org.javai.nlrecon.join;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.nlrecon.testsupport.TestKnowledgeGraphs.HANA;
import static org.javai.nlrecon.testsupport.TestKnowledgeGraphs.OPS;
import static org.javai.nlrecon.testsupport.TestKnowledgeGraphs.RBP;
import static org.javai.nlrecon.testsupport.TestKnowledgeGraphs.STAGING;

import java.util.List;
import org.javai.nlrecon.ReconciliationConfig;
import org.javai.nlrecon.ReconciliationErrorType;
import org.javai.nlrecon.intent.Archetype;
import org.javai.nlrecon.intent.FilterMention;
import org.javai.nlrecon.intent.FilterOperator;
import org.javai.nlrecon.intent.ProjectionMention;
import org.javai.nlrecon.intent.QueryIntent;
import org.javai.nlrecon.kg.KnowledgeGraph;
import org.javai.nlrecon.kg.RelationshipEdge;
import org.javai.nlrecon.resolve.EntityResolver;
import org.javai.nlrecon.resolve.Resolution;
import org.javai.nlrecon.resolve.ResolutionException;
import org.javai.nlrecon.testsupport.TestKnowledgeGraphs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("JoinPathResolver")
class JoinPathResolverTest {

	private final KnowledgeGraph kg = TestKnowledgeGraphs.sealedGpuPlanning();
	private final JoinPathResolver resolver = new JoinPathResolver(kg);

	private Resolution resolve(Archetype archetype, String source, String target,
			List<FilterMention> filters, List<ProjectionMention> projections) {
		QueryIntent intent = new QueryIntent("test", archetype, source, target, List.of(), filters, projections,
				0.85, false);
		return new EntityResolver(kg).resolve(intent);
	}

	@Nested
	@DisplayName("Join paths")
	class JoinPaths {

		@Test
		@DisplayName("joins two directly related tables on the edge's columns")
		void directEdge() {
			JoinPlan plan = resolver.buildJoinPlan(List.of(RBP, OPS));

			assertThat(plan.tables()).containsExactly(RBP, OPS);
			assertThat(plan.joins()).singleElement()
					.satisfies(join -> {
						assertThat(join.leftTable()).isEqualTo(RBP);
						assertThat(join.leftColumn()).isEqualTo("Material");
						assertThat(join.rightTable()).isEqualTo(OPS);
						assertThat(join.rightColumn()).isEqualTo("PLANNING_SKU");
						assertThat(join.joinType()).isEqualTo(JoinType.INNER);
					});
			assertThat(plan.confidence()).isEqualTo(1.0);
		}

		@Test
		@DisplayName("reads edges in either direction")
		void reverseDirection() {
			JoinPlan plan = resolver.buildJoinPlan(List.of(OPS, RBP));

			JoinCondition join = plan.joinIntroducing(RBP).orElseThrow();
			assertThat(join.leftTable()).isEqualTo(OPS);
			assertThat(join.leftColumn()).isEqualTo("PLANNING_SKU");
			assertThat(join.rightColumn()).isEqualTo("Material");
		}

		@Test
		@DisplayName("a table without relationships has no join path")
		void noJoinPath() {
			assertThatThrownBy(() -> resolver.buildJoinPlan(List.of(RBP, STAGING, OPS)))
					.isInstanceOf(JoinPathException.class)
					.satisfies(e -> {
						JoinPathException failure = (JoinPathException) e;
						assertThat(failure.errorType()).isEqualTo(ReconciliationErrorType.NO_JOIN_PATH);
						assertThat(failure.details()).containsExactly(RBP, STAGING);
					});
		}

		@Test
		@DisplayName("later tables may join through earlier requested tables")
		void throughEarlierTable() {
			JoinPlan plan = resolver.buildJoinPlan(List.of(RBP, OPS, HANA));

			assertThat(plan.tables()).containsExactly(RBP, OPS, HANA);
			assertThat(plan.joinIntroducing(HANA).orElseThrow().leftTable()).isEqualTo(RBP);
			assertThat(plan.confidence()).isEqualTo(0.9);
		}

		@Test
		@DisplayName("unrequested tables are not bridged by default")
		void noBridgeByDefault() {
			assertThatThrownBy(() -> resolver.buildJoinPlan(List.of(OPS, HANA)))
					.isInstanceOf(JoinPathException.class);
		}

		@Test
		@DisplayName("bridging adds the intermediate table to the plan")
		void bridging() {
			JoinPathResolver bridging = new JoinPathResolver(kg,
					ReconciliationConfig.builder().allowBridgeTables(true).build());

			JoinPlan plan = bridging.buildJoinPlan(List.of(OPS, HANA));

			assertThat(plan.tables()).containsExactly(OPS, RBP, HANA);
			assertThat(plan.joins()).hasSize(2);
			assertThat(plan.confidence()).isEqualTo(0.9);
		}

		@Test
		@DisplayName("bridging respects the hop limit")
		void bridgeHopLimit() {
			JoinPathResolver noHops = new JoinPathResolver(kg,
					ReconciliationConfig.builder().allowBridgeTables(true).maxBridgeHops(0).build());

			assertThatThrownBy(() -> noHops.buildJoinPlan(List.of(OPS, HANA)))
					.isInstanceOf(JoinPathException.class);
		}

		@Test
		@DisplayName("the most confident edge wins; among equals the latest")
		void edgeSelection() {
			KnowledgeGraph multi = new KnowledgeGraph("multi")
					.addTable("a", List.of(), List.of("id", "code", "ref"))
					.addTable("b", List.of(), List.of("id", "code", "ref"))
					.addRelationship(RelationshipEdge.matches("a", "id", "b", "id", 0.7))
					.addRelationship(RelationshipEdge.matches("a", "code", "b", "code", 0.9))
					.addRelationship(RelationshipEdge.matches("a", "ref", "b", "ref", 0.9));

			RelationshipEdge edge = new JoinPathResolver(multi).selectEdge("a", "b");

			assertThat(edge.sourceColumn()).isEqualTo("ref");
			assertThat(edge.confidence()).isEqualTo(0.9);
		}
	}

	@Nested
	@DisplayName("Archetype plans")
	class ArchetypePlans {

		@Test
		@DisplayName("unmatched source keeps the source and left-joins the target")
		void unmatchedSource() {
			JoinPlan plan = resolver.plan(Archetype.UNMATCHED_SOURCE, resolve(Archetype.UNMATCHED_SOURCE,
					"RBP", "OPS Excel", List.of(), List.of()));

			assertThat(plan.drivingTable()).isEqualTo(RBP);
			assertThat(plan.excludedTable()).isEqualTo(OPS);
			assertThat(plan.joins()).singleElement()
					.satisfies(join -> assertThat(join.joinType()).isEqualTo(JoinType.LEFT));
			assertThat(plan.selectColumns()).containsOnlyKeys(RBP);
			assertThat(plan.selectColumns().get(RBP).all()).isTrue();
		}

		@Test
		@DisplayName("unmatched target swaps the sides")
		void unmatchedTarget() {
			JoinPlan plan = resolver.plan(Archetype.UNMATCHED_TARGET, resolve(Archetype.UNMATCHED_TARGET,
					"RBP", "OPS Excel", List.of(), List.of()));

			assertThat(plan.tables()).containsExactly(OPS, RBP);
			assertThat(plan.excludedTable()).isEqualTo(RBP);
			assertThat(plan.joins().get(0).leftColumn()).isEqualTo("PLANNING_SKU");
		}

		@Test
		@DisplayName("matched inner-joins and carries no excluded table")
		void matched() {
			JoinPlan plan = resolver.plan(Archetype.MATCHED, resolve(Archetype.MATCHED,
					"RBP", "OPS Excel", List.of(FilterMention.explicit("Planner", FilterOperator.EQ, "jdoe")),
					List.of()));

			assertThat(plan.excludedTable()).isNull();
			assertThat(plan.joins().get(0).joinType()).isEqualTo(JoinType.INNER);
			assertThat(plan.filters()).containsExactly(new FilterClause(OPS, "Planner", FilterOperator.EQ, "jdoe"));
		}

		@Test
		@DisplayName("projections left-join their table and select the column")
		void projection() {
			JoinPlan plan = resolver.plan(Archetype.UNMATCHED_SOURCE, resolve(Archetype.UNMATCHED_SOURCE,
					"RBP", "OPS Excel", List.of(), List.of(new ProjectionMention("ops planner", "hana master"))));

			assertThat(plan.tables()).containsExactly(RBP, OPS, HANA);
			assertThat(plan.joinIntroducing(HANA).orElseThrow().joinType()).isEqualTo(JoinType.LEFT);
			assertThat(plan.selectColumns().get(HANA).columns()).containsExactly("OPS_PLANNER");
			assertThat(plan.confidence()).isEqualTo(0.9);
		}

		@Test
		@DisplayName("inactive count plans the source table alone")
		void inactiveCount() {
			JoinPlan plan = resolver.plan(Archetype.INACTIVE_COUNT, resolve(Archetype.INACTIVE_COUNT,
					"RBP", null, List.of(FilterMention.status("inactive")), List.of()));

			assertThat(plan.tables()).containsExactly(RBP);
			assertThat(plan.joins()).isEmpty();
			assertThat(plan.filters()).containsExactly(new FilterClause(RBP, "Status", FilterOperator.EQ, "inactive"));
			assertThat(plan.confidence()).isEqualTo(1.0);
		}

		@Test
		@DisplayName("an incomplete resolution cannot be planned")
		void incomplete() {
			Resolution ambiguous = resolve(Archetype.MATCHED, "RBP", "GPU", List.of(), List.of());

			assertThatThrownBy(() -> resolver.plan(Archetype.MATCHED, ambiguous))
					.isInstanceOf(ResolutionException.class);
		}

		@Test
		@DisplayName("a staging table in a reconciliation has no join path")
		void stagingHasNoPath() {
			Resolution resolution = resolve(Archetype.UNMATCHED_SOURCE, "RBP", "Staging", List.of(), List.of());

			assertThatThrownBy(() -> resolver.plan(Archetype.UNMATCHED_SOURCE, resolution))
					.isInstanceOf(JoinPathException.class);
		}
	}
}
