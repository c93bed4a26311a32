package com.flamingo.ai.notesearch.domain.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A named collection of items and the location of its derived index.
 *
 * @param name corpus name used in requests and as cache key
 * @param root corpus root directory (absolute, normalized)
 * @param storagePath directory holding the corpus index files
 * @param embeddingModel identifier of the embedding model vectors are built with
 * @param lastIndexedAt time of the last completed index build, or {@code null} if never indexed
 */
public record Corpus(
    String name, Path root, Path storagePath, String embeddingModel, Instant lastIndexedAt) {

  public Corpus withLastIndexedAt(Instant indexedAt) {
    return new Corpus(name, root, storagePath, embeddingModel, indexedAt);
  }
}
