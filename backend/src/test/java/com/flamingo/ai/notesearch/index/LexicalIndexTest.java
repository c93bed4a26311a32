package com.flamingo.ai.notesearch.index;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.notesearch.domain.enums.MetadataKey;
import com.flamingo.ai.notesearch.domain.model.IndexEntry;
import com.flamingo.ai.notesearch.domain.model.Item;
import com.flamingo.ai.notesearch.domain.model.ItemMetadata;
import com.flamingo.ai.notesearch.index.LexicalIndex.LexicalHit;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("LexicalIndex Tests")
class LexicalIndexTest {

  private LexicalIndex index;

  @BeforeEach
  void setUp() {
    index =
        LexicalIndex.build(
            List.of(
                entry("rust", "Rust notes", "Ownership and borrowing in Rust.", Set.of("rust")),
                entry("python", "Python tips", "List comprehensions are handy.", Set.of()),
                entry("mixed", "Languages", "Comparing Rust with Python and Go.", Set.of()),
                entry(
                    "obsidian",
                    "Vault setup",
                    "Plugins I use daily.",
                    Set.of("Obsidian", "tools"))),
            1.5,
            0.75,
            2);
  }

  @Test
  @DisplayName("Should rank documents matching the query by BM25 score")
  void shouldRankMatchingDocuments() {
    List<LexicalHit> hits = index.query("rust", 10);

    assertThat(hits).extracting(LexicalHit::entryId).containsExactly("rust", "mixed");
    assertThat(hits.get(0).score()).isGreaterThan(hits.get(1).score());
  }

  @Test
  @DisplayName("Should return nothing when no term matches")
  void shouldReturnNothingWithoutMatches() {
    assertThat(index.query("haskell", 10)).isEmpty();
    assertThat(index.query("   ", 10)).isEmpty();
  }

  @Test
  @DisplayName("Should report exact tag matches regardless of tag case and hash prefix")
  void shouldReportTagMatches() {
    List<LexicalHit> hits = index.query("#obsidian", 10);

    assertThat(hits).hasSize(1);
    assertThat(hits.get(0).matchedTags()).containsExactly("obsidian");
    assertThat(index.query("rust", 10).get(1).tagMatched()).isFalse();
  }

  @Test
  @DisplayName("Should index the metadata description")
  void shouldIndexDescription() {
    LexicalIndex withDescription =
        LexicalIndex.build(
            List.of(
                IndexEntry.ofItem(
                    Item.builder()
                        .id("repo")
                        .title("ripgrep")
                        .body("")
                        .metadata(
                            ItemMetadata.empty()
                                .with(MetadataKey.DESCRIPTION, "fast recursive search tool"))
                        .build())),
            1.5,
            0.75,
            2);

    assertThat(withDescription.query("recursive", 5)).hasSize(1);
  }

  @Test
  @DisplayName("Should respect the limit and break ties by entry id")
  void shouldRespectLimitAndTieBreak() {
    LexicalIndex twins =
        LexicalIndex.build(
            List.of(entry("b", "same", "text", Set.of()), entry("a", "same", "text", Set.of())),
            1.5,
            0.75,
            2);

    assertThat(twins.query("same", 10)).extracting(LexicalHit::entryId).containsExactly("a", "b");
    assertThat(twins.query("same", 1)).hasSize(1);
  }

  @Test
  @DisplayName("Should find tag matches that rank below the result limit")
  void shouldFindTagMatchesBelowLimit() {
    List<IndexEntry> entries = new ArrayList<>();
    for (int i = 0; i < 60; i++) {
      entries.add(entry("kw-" + i, "Snippets " + i, "python python python notes", Set.of()));
    }
    entries.add(entry("tagged", "Reading list", "chapter ".repeat(400), Set.of("python")));
    LexicalIndex crowded = LexicalIndex.build(entries, 1.5, 0.75, 2);

    List<LexicalHit> hits = crowded.query("python", 50);

    assertThat(hits).hasSize(51);
    LexicalHit tagged =
        hits.stream().filter(hit -> hit.entryId().equals("tagged")).findFirst().orElseThrow();
    assertThat(tagged.matchedTags()).containsExactly("python");
    assertThat(hits.stream().filter(LexicalHit::tagMatched)).hasSize(1);
  }

  @Test
  @DisplayName("Should report a multi-word tag named by the whole query")
  void shouldMatchMultiWordTag() {
    LexicalIndex withPhraseTag =
        LexicalIndex.build(
            List.of(entry("ml", "Reading", "papers", Set.of("machine learning"))), 1.5, 0.75, 2);

    assertThat(withPhraseTag.query("Machine Learning", 5).get(0).matchedTags())
        .containsExactly("machine learning");
  }

  @Test
  @DisplayName("Should answer identically after being written to disk and loaded back")
  void shouldRestoreFromDisk(@TempDir Path dir) throws IOException {
    Path target = dir.resolve("lexical");
    index.writeTo(target);

    LexicalIndex restored = LexicalIndex.load(target);

    assertThat(restored.size()).isEqualTo(4);
    assertThat(restored.getK1()).isEqualTo(1.5);
    assertThat(restored.getB()).isEqualTo(0.75);
    assertThat(restored.query("python", 10)).isEqualTo(index.query("python", 10));
    assertThat(restored.query("obsidian", 10)).isEqualTo(index.query("obsidian", 10));
  }

  private static IndexEntry entry(String id, String title, String body, Set<String> tags) {
    return IndexEntry.ofItem(Item.builder().id(id).title(title).body(body).tags(tags).build());
  }
}
