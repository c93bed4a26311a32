package com.flamingo.ai.notesearch.api.dto.response;

import com.flamingo.ai.notesearch.domain.model.Corpus;
import com.flamingo.ai.notesearch.domain.model.CorpusIndexMetadata;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for corpus data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorpusResponse {

  private String name;
  private String root;
  private String storagePath;
  private String embeddingModel;
  private Instant lastIndexedAt;
  private boolean indexed;
  private boolean cached;

  /** Index metadata as stored in index.json, {@code null} when never indexed. */
  private CorpusIndexMetadata index;

  /**
   * Creates a CorpusResponse from a corpus and its stored metadata. The last index time comes
   * from the metadata when present.
   */
  public static CorpusResponse fromCorpus(
      Corpus corpus, CorpusIndexMetadata metadata, boolean cached) {
    if (metadata != null && metadata.getIndexedAt() != null) {
      corpus = corpus.withLastIndexedAt(metadata.getIndexedAt());
    }
    return CorpusResponse.builder()
        .name(corpus.name())
        .root(corpus.root().toString())
        .storagePath(corpus.storagePath().toString())
        .embeddingModel(corpus.embeddingModel())
        .lastIndexedAt(corpus.lastIndexedAt())
        .indexed(metadata != null)
        .cached(cached)
        .index(metadata)
        .build();
  }
}
