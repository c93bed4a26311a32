package com.flamingo.ai.notesearch.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.notesearch.domain.model.Chunk;
import com.flamingo.ai.notesearch.exception.ConfigurationException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Chunker Tests")
class ChunkerTest {

  private final Chunker chunker = new Chunker(4000, 2000, 400, 5000);

  @Nested
  @DisplayName("Short bodies")
  class ShortBodies {

    @Test
    @DisplayName("Should return one chunk spanning a body under the threshold")
    void shouldReturnSingleChunkUnderThreshold() {
      String body = "x".repeat(3999);

      List<Chunk> chunks = chunker.chunk("note-1", "Title", body);

      assertThat(chunks).hasSize(1);
      Chunk chunk = chunks.get(0);
      assertThat(chunk.startOffset()).isZero();
      assertThat(chunk.endOffset()).isEqualTo(body.length());
      assertThat(chunk.text()).isEqualTo(body);
      assertThat(chunk.total()).isEqualTo(1);
      assertThat(chunk.title()).isEqualTo("Title");
    }

    @Test
    @DisplayName("Should not chunk a body exactly at the threshold")
    void shouldNotChunkAtThreshold() {
      assertThat(chunker.chunk("n", "T", "y".repeat(4000))).hasSize(1);
    }

    @Test
    @DisplayName("Should return no chunks for an empty body")
    void shouldReturnNoChunksForEmptyBody() {
      assertThat(chunker.chunk("n", "T", "")).isEmpty();
      assertThat(chunker.chunk("n", "T", null)).isEmpty();
    }
  }

  @Nested
  @DisplayName("Long bodies")
  class LongBodies {

    @Test
    @DisplayName("Should reconstruct the body byte-exactly from the chunks")
    void shouldReconstructBodyExactly() {
      String body = sampleText(10_000);

      List<Chunk> chunks = chunker.chunk("note-2", "Long", body);

      assertThat(chunks.size()).isGreaterThan(1);
      assertThat(chunks.get(0).startOffset()).isZero();
      assertThat(chunks.get(chunks.size() - 1).endOffset()).isEqualTo(body.length());
      StringBuilder rebuilt = new StringBuilder(chunks.get(0).text());
      for (int i = 1; i < chunks.size(); i++) {
        Chunk previous = chunks.get(i - 1);
        Chunk current = chunks.get(i);
        assertThat(current.startOffset()).isLessThanOrEqualTo(previous.endOffset());
        rebuilt.append(current.text().substring(previous.endOffset() - current.startOffset()));
      }
      assertThat(rebuilt.toString()).isEqualTo(body);
      for (Chunk chunk : chunks) {
        assertThat(chunk.text()).isEqualTo(body.substring(chunk.startOffset(), chunk.endOffset()));
      }
    }

    @Test
    @DisplayName("Should overlap consecutive chunks by the configured overlap")
    void shouldOverlapConsecutiveChunks() {
      List<Chunk> chunks = chunker.chunk("note-3", "T", sampleText(10_000));

      Chunk first = chunks.get(0);
      Chunk second = chunks.get(1);
      assertThat(first.length()).isEqualTo(2000);
      assertThat(first.endOffset() - second.startOffset()).isEqualTo(400);
    }

    @Test
    @DisplayName("Should annotate chunk titles with part numbers")
    void shouldAnnotateTitles() {
      List<Chunk> chunks = chunker.chunk("note-4", "Essay", sampleText(5000));

      assertThat(chunks).hasSize(3);
      assertThat(chunks.get(0).title()).isEqualTo("Essay (part 1/3)");
      assertThat(chunks.get(2).title()).isEqualTo("Essay (part 3/3)");
      assertThat(chunks).allMatch(c -> c.parentId().equals("note-4"));
    }

    @Test
    @DisplayName("Should end the last chunk exactly at the end of the body")
    void shouldEndLastChunkAtBodyEnd() {
      Chunker small = new Chunker(1000, 1000, 400, 5000);

      List<Chunk> chunks = small.chunk("n", "T", sampleText(1700));

      assertThat(chunks).extracting(Chunk::startOffset).containsExactly(0, 600, 1200);
      assertThat(chunks.get(2).endOffset()).isEqualTo(1700);
    }

    @Test
    @DisplayName("Should keep bodies under the embedding budget when chunking is disabled")
    void shouldWindowOversizedBodiesWhenChunkingDisabled() {
      String body = sampleText(12_000);

      List<Chunk> chunks = chunker.chunkForIndexing("n", "T", body, false);

      assertThat(chunks.size()).isGreaterThan(1);
      assertThat(chunks).allMatch(c -> c.length() <= 5000);
    }

    @Test
    @DisplayName("Should keep a long body whole when chunking is disabled and it fits the budget")
    void shouldKeepBodyWholeWhenChunkingDisabled() {
      assertThat(chunker.chunkForIndexing("n", "T", sampleText(4500), false)).hasSize(1);
    }
  }

  @Nested
  @DisplayName("Configuration validation")
  class Validation {

    @Test
    @DisplayName("Should reject an overlap equal to the chunk size")
    void shouldRejectOverlapEqualToSize() {
      assertThatThrownBy(() -> new Chunker(4000, 2000, 2000, 5000))
          .isInstanceOf(ConfigurationException.class)
          .hasMessageContaining("overlap");
    }

    @Test
    @DisplayName("Should reject an overlap larger than the chunk size")
    void shouldRejectOverlapLargerThanSize() {
      assertThatThrownBy(() -> new Chunker(4000, 500, 800, 5000))
          .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Should reject a chunk size over the embedding input budget")
    void shouldRejectChunkSizeOverBudget() {
      assertThatThrownBy(() -> new Chunker(4000, 6000, 400, 5000))
          .isInstanceOf(ConfigurationException.class)
          .hasMessageContaining("budget");
    }

    @Test
    @DisplayName("Should reject non-positive sizes")
    void shouldRejectNonPositiveSizes() {
      assertThatThrownBy(() -> new Chunker(4000, 0, 0, 5000))
          .isInstanceOf(ConfigurationException.class);
      assertThatThrownBy(() -> new Chunker(0, 2000, 400, 5000))
          .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Should validate a new window")
    void shouldValidateNewWindow() {
      assertThatThrownBy(() -> chunker.withWindow(1000, 1000))
          .isInstanceOf(ConfigurationException.class);
      assertThat(chunker.withWindow(2000, 400)).isSameAs(chunker);
    }
  }

  @Test
  @DisplayName("Should compute chunk statistics")
  void shouldComputeStatistics() {
    List<Chunk> chunks = chunker.chunk("n", "T", sampleText(5000));

    Chunker.ChunkStatistics stats = Chunker.statistics(chunks);

    assertThat(stats.count()).isEqualTo(3);
    assertThat(stats.maxSize()).isEqualTo(2000);
    assertThat(stats.minSize()).isLessThanOrEqualTo(stats.maxSize());
    assertThat(Chunker.statistics(List.of()).count()).isZero();
  }

  private static String sampleText(int length) {
    StringBuilder sb = new StringBuilder(length);
    int i = 0;
    while (sb.length() < length) {
      sb.append("word").append(i++).append(i % 7 == 0 ? ".\n" : " ");
    }
    return sb.substring(0, length);
  }
}
