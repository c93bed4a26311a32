package com.flamingo.ai.notesearch.index;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.flamingo.ai.notesearch.domain.enums.ItemStatus;
import com.flamingo.ai.notesearch.domain.model.CorpusIndexMetadata;
import com.flamingo.ai.notesearch.domain.model.IndexEntry;
import com.flamingo.ai.notesearch.domain.model.Item;
import com.flamingo.ai.notesearch.domain.model.ItemMetadata;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CorpusIndexStore Tests")
class CorpusIndexStoreTest {

  private static final String MODEL = "text-embedding-3-small";

  @TempDir Path storage;

  private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
  private CorpusIndexStore store;

  @BeforeEach
  void setUp() {
    store = new CorpusIndexStore(objectMapper);
  }

  @Test
  @DisplayName("Should report nothing for an empty storage directory")
  void shouldReturnNullWhenEmpty() throws Exception {
    assertThat(store.hasMetadata(storage)).isFalse();
    assertThat(store.readMetadata(storage)).isNull();
    assertThat(store.load(storage)).isNull();
  }

  @Test
  @DisplayName("Should write a snapshot that loads back with the same entries and rankings")
  void shouldWriteAndLoadSnapshot() throws Exception {
    IndexSnapshot snapshot = sampleSnapshot();

    store.write(storage, snapshot);
    IndexSnapshot loaded = store.load(storage);

    assertThat(loaded.getEntries()).isEqualTo(snapshot.getEntries());
    assertThat(loaded.getMetadata().getCorpusRoot()).isEqualTo("/data/notes");
    assertThat(loaded.getMetadata().getIndexedAt())
        .isEqualTo(Instant.parse("2026-02-01T00:00:00Z"));
    assertThat(loaded.getLexicalIndex().query("kafka", 5))
        .extracting(LexicalIndex.LexicalHit::entryId)
        .containsExactly("kafka");
    assertThat(loaded.getVectorIndex().query(new float[] {0f, 1f}, 1))
        .extracting(VectorIndex.VectorHit::entryId)
        .containsExactly("rust");
    assertThat(loaded.getLexicalIndex().query("streaming", 5).get(0).matchedTags())
        .containsExactly("streaming");
    assertThat(loaded.entry("kafka").metadata().type()).contains("note");
  }

  @Test
  @DisplayName("Should leave no temporary files behind after a rewrite")
  void shouldNotLeaveTemporaryFiles() throws Exception {
    store.write(storage, sampleSnapshot());
    store.write(storage, sampleSnapshot());

    try (Stream<Path> files = Files.list(storage)) {
      assertThat(files.map(p -> p.getFileName().toString()))
          .containsExactlyInAnyOrder(
              CorpusIndexStore.METADATA_FILE,
              CorpusIndexStore.ENTRIES_FILE,
              CorpusIndexStore.LEXICAL_DIR,
              CorpusIndexStore.VECTORS_FILE);
    }
  }

  @Test
  @DisplayName("Should keep unknown metadata keys across a rewrite")
  void shouldPreserveUnknownMetadataKeys() throws Exception {
    Files.writeString(
        storage.resolve(CorpusIndexStore.METADATA_FILE),
        "{\"corpusRoot\":\"/data/notes\",\"writer\":\"v2\"}");

    CorpusIndexMetadata metadata = store.readMetadata(storage);
    metadata.setEmbeddingModel(MODEL);
    store.writeMetadata(storage, metadata);

    String rewritten = Files.readString(storage.resolve(CorpusIndexStore.METADATA_FILE));
    assertThat(rewritten).contains("\"writer\" : \"v2\"").contains(MODEL);
  }

  private static IndexSnapshot sampleSnapshot() {
    IndexEntry kafka =
        IndexEntry.ofItem(
            Item.builder()
                .id("kafka")
                .title("Kafka notes")
                .body("Kafka partitions and consumer groups")
                .tags(Set.of("streaming"))
                .metadata(ItemMetadata.fromMap(Map.of("type", "note")))
                .modifiedAt(Instant.parse("2026-01-10T08:00:00Z"))
                .build());
    IndexEntry rust =
        IndexEntry.ofItem(
            Item.builder()
                .id("rust")
                .title("Rust ownership")
                .body("Borrowing rules")
                .status(ItemStatus.HIDDEN)
                .build());
    List<IndexEntry> entries = List.of(kafka, rust);

    VectorIndex.Builder vectors = VectorIndex.builder(MODEL);
    vectors.add("kafka", new float[] {1f, 0f});
    vectors.add("rust", new float[] {0f, 2f});

    CorpusIndexMetadata metadata =
        CorpusIndexMetadata.builder()
            .corpusRoot("/data/notes")
            .corpusName("notes")
            .embeddingModel(MODEL)
            .indexedAt(Instant.parse("2026-02-01T00:00:00Z"))
            .itemCount(2)
            .entryCount(2)
            .embeddingDimension(2)
            .build();
    return new IndexSnapshot(
        entries, LexicalIndex.build(entries, 1.5, 0.75, 2), vectors.build(), metadata);
  }
}
