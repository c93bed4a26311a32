package com.flamingo.ai.notesearch.service.query;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.notesearch.config.SearchConfig;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("QueryExpander Tests")
class QueryExpanderTest {

  private static final List<String> ML_SEEDS =
      List.of(
          "Machine learning with neural networks",
          "Neural networks power modern machine learning",
          "Machine learning models and neural networks",
          "Neural machine learning for text",
          "Machine learning basics explained");

  private QueryExpander expander;

  @BeforeEach
  void setUp() {
    expander = new QueryExpander(new SearchConfig.QueryExpansion());
  }

  @Test
  @DisplayName("Should expand only queries shorter than three tokens")
  void shouldExpandOnlyShortQueries() {
    assertThat(expander.shouldExpand("AI")).isTrue();
    assertThat(expander.shouldExpand("vector search")).isTrue();
    assertThat(expander.shouldExpand("how does vector search work")).isFalse();
    assertThat(expander.shouldExpand("   ")).isFalse();
  }

  @Test
  @DisplayName("Should keep the original query as prefix and append at most three seed terms")
  void shouldAppendTopTerms() {
    String expanded = expander.expand("AI", ML_SEEDS);

    assertThat(expanded).startsWith("AI ");
    List<String> added = Arrays.asList(expanded.substring(3).split(" "));
    assertThat(added).contains("machine", "learning");
    assertThat(added).allMatch(Set.of("machine", "learning", "neural")::contains);
    assertThat(expander.topTerms(ML_SEEDS, 3)).hasSize(3);
  }

  @Test
  @DisplayName("Should leave the query unchanged with fewer seeds than required")
  void shouldNotExpandWithTooFewSeeds() {
    assertThat(expander.expand("AI", ML_SEEDS.subList(0, 4))).isEqualTo("AI");
    assertThat(expander.expand("AI", null)).isEqualTo("AI");
  }

  @Test
  @DisplayName("Should leave long queries unchanged")
  void shouldNotExpandLongQueries() {
    String query = "neural network training tricks";

    assertThat(expander.expand(query, ML_SEEDS)).isEqualTo(query);
  }

  @Test
  @DisplayName("Should not append terms the query already contains")
  void shouldSkipTermsAlreadyInQuery() {
    String expanded = expander.expand("machine learning", ML_SEEDS);

    assertThat(expanded).startsWith("machine learning");
    assertThat(expanded.substring("machine learning".length())).doesNotContain("machine");
  }

  @Test
  @DisplayName("Should drop stop words from candidate terms")
  void shouldIgnoreStopWords() {
    List<String> terms =
        expander.topTerms(List.of("the and of the with", "the of and rust with"), 5);

    assertThat(terms).containsExactly("rust");
  }

  @Test
  @DisplayName("Should pair the remaining words into bigrams once stop words are gone")
  void shouldBuildBigramsAfterStopWordRemoval() {
    List<String> terms =
        expander.topTerms(List.of("Rust in production", "rust for production"), 10);

    assertThat(terms).containsExactlyInAnyOrder("rust", "production", "rust production");
  }
}
