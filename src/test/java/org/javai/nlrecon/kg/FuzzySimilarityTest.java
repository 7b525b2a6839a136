package org.javai.nlrecon.kg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FuzzySimilarity")
class FuzzySimilarityTest {

	@Test
	@DisplayName("normalize keeps lowercase letters and digits only")
	void normalize() {
		assertThat(FuzzySimilarity.normalize("brz_lnd_RBP-GPU 2")).isEqualTo("brzlndrbpgpu2");
		assertThat(FuzzySimilarity.normalize(null)).isEmpty();
	}

	@Test
	@DisplayName("tokens split on separators and ignore case")
	void tokens() {
		assertThat(FuzzySimilarity.tokens("OPS Excel_GPU")).containsExactly("excel", "gpu", "ops");
		assertThat(FuzzySimilarity.tokens("  ")).isEmpty();
	}

	@Test
	@DisplayName("a mention whose tokens all appear in the name scores 1.0")
	void subsetScoresFull() {
		assertThat(FuzzySimilarity.tokenSetRatio("RBP GPU", "brz_lnd_RBP_GPU")).isEqualTo(1.0);
		assertThat(FuzzySimilarity.tokenSetRatio("gpu rbp", "RBP GPU")).isEqualTo(1.0);
	}

	@Test
	@DisplayName("disjoint tokens fall back to edit-distance similarity")
	void disjointTokens() {
		double score = FuzzySimilarity.tokenSetRatio("planer", "planner");

		assertThat(score).isCloseTo(1.0 - 1.0 / 7.0, within(1e-9));
	}

	@Test
	@DisplayName("empty input scores zero")
	void emptyInput() {
		assertThat(FuzzySimilarity.tokenSetRatio("", "orders")).isZero();
		assertThat(FuzzySimilarity.tokenSetRatio("orders", null)).isZero();
	}

	@Test
	@DisplayName("levenshtein distance counts single-character edits")
	void levenshtein() {
		assertThat(FuzzySimilarity.levenshteinDistance("kitten", "sitting")).isEqualTo(3);
		assertThat(FuzzySimilarity.levenshteinDistance("", "abc")).isEqualTo(3);
		assertThat(FuzzySimilarity.ratio("abc", "abc")).isEqualTo(1.0);
	}
}
