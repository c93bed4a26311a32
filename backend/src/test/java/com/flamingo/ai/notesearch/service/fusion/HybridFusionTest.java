package com.flamingo.ai.notesearch.service.fusion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.notesearch.config.SearchConfig;
import com.flamingo.ai.notesearch.domain.enums.BoostType;
import com.flamingo.ai.notesearch.domain.enums.MetadataKey;
import com.flamingo.ai.notesearch.domain.model.IndexEntry;
import com.flamingo.ai.notesearch.domain.model.Item;
import com.flamingo.ai.notesearch.domain.model.ItemMetadata;
import com.flamingo.ai.notesearch.domain.model.RetrievalCandidate;
import com.flamingo.ai.notesearch.index.IndexSnapshot;
import com.flamingo.ai.notesearch.index.LexicalIndex;
import com.flamingo.ai.notesearch.index.LexicalIndex.LexicalHit;
import com.flamingo.ai.notesearch.index.VectorIndex;
import com.flamingo.ai.notesearch.index.VectorIndex.VectorHit;
import com.flamingo.ai.notesearch.service.profile.MetadataBoostRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HybridFusion Tests")
class HybridFusionTest {

  private HybridFusion fusion;

  @BeforeEach
  void setUp() {
    fusion = new HybridFusion(new SearchConfig());
  }

  @Nested
  @DisplayName("Reciprocal Rank Fusion")
  class Rrf {

    @Test
    @DisplayName("Should compute exact RRF scores with k=60 and 1-based ranks")
    void shouldComputeExactRrfScores() {
      IndexSnapshot snapshot = snapshot(plain("X"), plain("Y"), plain("Z"), plain("W"));
      List<LexicalHit> lexical = List.of(lex("X", 5.0), lex("Y", 4.0), lex("Z", 3.0));
      List<VectorHit> vector = List.of(vec("Y", 0.9), vec("X", 0.8), vec("W", 0.7));

      List<RetrievalCandidate> fused =
          fusion.fuse(lexical, vector, snapshot, FusionOptions.plainRrf("query"));

      Map<String, RetrievalCandidate> byId = byId(fused);
      assertThat(byId.get("X").getFusedScore()).isCloseTo(1.0 / 61 + 1.0 / 62, within(1e-12));
      assertThat(byId.get("Y").getFusedScore()).isCloseTo(1.0 / 62 + 1.0 / 61, within(1e-12));
      assertThat(byId.get("Z").getFusedScore()).isCloseTo(1.0 / 63, within(1e-12));
      assertThat(byId.get("W").getFusedScore()).isCloseTo(1.0 / 63, within(1e-12));
    }

    @Test
    @DisplayName("Should break fused-score ties by lexical raw score")
    void shouldBreakTiesByLexicalScore() {
      IndexSnapshot snapshot = snapshot(plain("X"), plain("Y"), plain("Z"), plain("W"));
      List<LexicalHit> lexical = List.of(lex("X", 5.0), lex("Y", 4.0), lex("Z", 3.0));
      List<VectorHit> vector = List.of(vec("Y", 0.9), vec("X", 0.8), vec("W", 0.7));

      List<RetrievalCandidate> fused =
          fusion.fuse(lexical, vector, snapshot, FusionOptions.plainRrf("query"));

      assertThat(fused)
          .extracting(RetrievalCandidate::getEntryId)
          .containsExactly("X", "Y", "Z", "W");
      assertThat(fused.get(0).getVectorRank()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should rank by the remaining list when one list is empty")
    void shouldFallBackToRemainingList() {
      IndexSnapshot snapshot = snapshot(plain("A"), plain("B"));

      List<RetrievalCandidate> fused =
          fusion.fuse(
              List.of(),
              List.of(vec("B", 0.9), vec("A", 0.5)),
              snapshot,
              FusionOptions.plainRrf("query"));

      assertThat(fused).extracting(RetrievalCandidate::getEntryId).containsExactly("B", "A");
      assertThat(fused.get(0).getLexicalScore()).isNull();
    }

    @Test
    @DisplayName("Should return nothing when both lists are empty")
    void shouldHandleBothListsEmpty() {
      assertThat(
              fusion.fuse(List.of(), List.of(), snapshot(), FusionOptions.plainRrf("query")))
          .isEmpty();
    }

    @Test
    @DisplayName("Should follow the lexical list alone at hybrid weight 0")
    void shouldBePureLexicalAtWeightZero() {
      IndexSnapshot snapshot = snapshot(plain("A"), plain("B"));
      FusionOptions lexicalOnly = new FusionOptions("query", 0.0, 1.0, false, List.of());

      List<RetrievalCandidate> fused =
          fusion.fuse(
              List.of(lex("A", 2.0), lex("B", 1.0)),
              List.of(vec("B", 0.9), vec("A", 0.1)),
              snapshot,
              lexicalOnly);

      assertThat(fused).extracting(RetrievalCandidate::getEntryId).containsExactly("A", "B");
      assertThat(fused.get(0).getFusedScore()).isCloseTo(2.0 / 61, within(1e-12));
    }

    @Test
    @DisplayName("Should ignore ranked entries missing from the snapshot")
    void shouldIgnoreUnknownEntries() {
      List<RetrievalCandidate> fused =
          fusion.fuse(
              List.of(lex("ghost", 3.0), lex("A", 1.0)),
              List.of(),
              snapshot(plain("A")),
              FusionOptions.plainRrf("query"));

      assertThat(fused).extracting(RetrievalCandidate::getEntryId).containsExactly("A");
    }
  }

  @Nested
  @DisplayName("Tag boost")
  class TagBoost {

    @Test
    @DisplayName("Should rank a tag-only match above every other candidate")
    void shouldRankTagOnlyMatchFirst() {
      IndexSnapshot snapshot = snapshot(plain("A"), plain("B"), plain("C"));
      List<LexicalHit> lexical =
          List.of(lex("A", 10.0), new LexicalHit("B", 2.0, Set.of("rust")));
      List<VectorHit> vector = List.of(vec("A", 0.95), vec("C", 0.9));

      List<RetrievalCandidate> fused =
          fusion.fuse(
              lexical, vector, snapshot, new FusionOptions("rust", 0.5, 1.0, true, List.of()));

      assertThat(fused.get(0).getEntryId()).isEqualTo("B");
      RetrievalCandidate b = fused.get(0);
      assertThat(b.getFusedScore()).isGreaterThan(fused.get(1).getFusedScore());
      assertThat(b.isTagBoosted()).isTrue();
      assertThat(b.getBoosts().get(0).type()).isEqualTo(BoostType.TAG_MATCH);
      assertThat(b.getBoosts().get(0).reason()).contains("rust");
      // strongest tag match gets the maximum margin over the best untagged score
      assertThat(b.getFusedScore()).isCloseTo(2.0 * (2.0 / 61), within(1e-12));
    }

    @Test
    @DisplayName("Should scale the margin by lexical strength relative to the strongest tag match")
    void shouldScaleMarginByLexicalStrength() {
      IndexSnapshot snapshot = snapshot(plain("A"), plain("T1"), plain("T2"));
      List<LexicalHit> lexical =
          List.of(
              lex("A", 1.0),
              new LexicalHit("T1", 4.0, Set.of("go")),
              new LexicalHit("T2", 2.0, Set.of("go")));

      List<RetrievalCandidate> fused =
          fusion.fuse(
              lexical, List.of(), snapshot, new FusionOptions("go", 0.5, 1.0, true, List.of()));

      Map<String, RetrievalCandidate> byId = byId(fused);
      double naturalMax = byId.get("A").getFusedScore();
      assertThat(byId.get("T1").getFusedScore()).isCloseTo(naturalMax * 2.0, within(1e-12));
      assertThat(byId.get("T2").getFusedScore()).isCloseTo(naturalMax * 1.75, within(1e-12));
      assertThat(fused)
          .extracting(RetrievalCandidate::getEntryId)
          .containsExactly("T1", "T2", "A");
    }

    @Test
    @DisplayName("Should rank a tagged note first even when its BM25 rank is past the limit")
    void shouldLiftTagMatchRankedPastLimit() {
      List<IndexEntry> entries = new ArrayList<>();
      for (int i = 0; i < 60; i++) {
        entries.add(
            IndexEntry.ofItem(
                Item.builder()
                    .id("kw-" + i)
                    .title("Snippets " + i)
                    .body("python python python notes")
                    .build()));
      }
      entries.add(
          IndexEntry.ofItem(
              Item.builder()
                  .id("tagged")
                  .title("Reading list")
                  .body("chapter ".repeat(400))
                  .tags(Set.of("python"))
                  .build()));
      IndexSnapshot snapshot =
          new IndexSnapshot(
              entries,
              LexicalIndex.build(entries, 1.5, 0.75, 2),
              VectorIndex.empty("test-model"),
              null);

      List<RetrievalCandidate> fused =
          fusion.fuse(
              snapshot.getLexicalIndex().query("python", 50),
              List.of(),
              snapshot,
              new FusionOptions("python", 0.5, 1.0, true, List.of()));

      assertThat(fused).hasSize(51);
      assertThat(fused.get(0).getEntryId()).isEqualTo("tagged");
      assertThat(fused.get(0).isTagBoosted()).isTrue();
    }

    @Test
    @DisplayName("Should leave tag matches unboosted when the boost is disabled")
    void shouldNotBoostWhenDisabled() {
      IndexSnapshot snapshot = snapshot(plain("A"), plain("B"));
      List<LexicalHit> lexical =
          List.of(lex("A", 10.0), new LexicalHit("B", 2.0, Set.of("rust")));

      List<RetrievalCandidate> fused =
          fusion.fuse(lexical, List.of(), snapshot, FusionOptions.plainRrf("rust"));

      assertThat(fused).extracting(RetrievalCandidate::getEntryId).containsExactly("A", "B");
      assertThat(fused.get(1).isTagBoosted()).isFalse();
    }
  }

  @Nested
  @DisplayName("Metadata boosts")
  class MetadataBoosts {

    @Test
    @DisplayName("Should boost popular items on a log scale")
    void shouldBoostPopularItems() {
      IndexEntry popular =
          entry("popular", ItemMetadata.empty().with(MetadataKey.POPULARITY, 10_000));
      IndexEntry obscure = entry("obscure", ItemMetadata.empty().with(MetadataKey.POPULARITY, 3));
      FusionOptions options =
          new FusionOptions(
              "query",
              0.5,
              1.0,
              false,
              List.of(MetadataBoostRule.logScale(MetadataKey.POPULARITY, 0.5, 10_000)));

      List<RetrievalCandidate> fused =
          fusion.fuse(
              List.of(lex("obscure", 2.0), lex("popular", 1.0)),
              List.of(),
              snapshot(popular, obscure),
              options);

      Map<String, RetrievalCandidate> byId = byId(fused);
      assertThat(byId.get("popular").getFusedScore())
          .isCloseTo(byId.get("popular").getRrfScore() * 1.5, within(1e-12));
      assertThat(fused.get(0).getEntryId()).isEqualTo("popular");
      assertThat(byId.get("popular").getBoosts())
          .extracting(b -> b.type())
          .containsExactly(BoostType.METADATA_LOG_SCALE);
    }

    @Test
    @DisplayName("Should apply a flat boost when a query token matches a topic")
    void shouldBoostTopicMatches() {
      ItemMetadata topics = ItemMetadata.empty().with(MetadataKey.TOPICS, List.of("cli", "rust"));
      IndexEntry topical = entry("topical", topics);
      FusionOptions options =
          new FusionOptions(
              "rust cli tools",
              0.5,
              1.0,
              false,
              List.of(MetadataBoostRule.match(MetadataKey.TOPICS, 3.0)));

      List<RetrievalCandidate> fused =
          fusion.fuse(List.of(lex("topical", 1.0)), List.of(), snapshot(topical), options);

      assertThat(fused.get(0).getFusedScore()).isCloseTo(3.0 / 61, within(1e-12));
    }
  }

  private static IndexEntry plain(String id) {
    return entry(id, ItemMetadata.empty());
  }

  private static IndexEntry entry(String id, ItemMetadata metadata) {
    return IndexEntry.ofItem(
        Item.builder().id(id).title(id).body("body of " + id).metadata(metadata).build());
  }

  private static IndexSnapshot snapshot(IndexEntry... entries) {
    return new IndexSnapshot(
        new ArrayList<>(List.of(entries)),
        LexicalIndex.empty(1.5, 0.75, 2),
        VectorIndex.empty("test-model"),
        null);
  }

  private static LexicalHit lex(String id, double score) {
    return new LexicalHit(id, score, Set.of());
  }

  private static VectorHit vec(String id, double similarity) {
    return new VectorHit(id, similarity);
  }

  private static Map<String, RetrievalCandidate> byId(List<RetrievalCandidate> candidates) {
    return candidates.stream()
        .collect(Collectors.toMap(RetrievalCandidate::getEntryId, Function.identity()));
  }
}
