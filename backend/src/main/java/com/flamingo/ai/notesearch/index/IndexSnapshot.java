package com.flamingo.ai.notesearch.index;

import com.flamingo.ai.notesearch.domain.model.CorpusIndexMetadata;
import com.flamingo.ai.notesearch.domain.model.IndexEntry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One consistent, immutable generation of a corpus index. A query reads a single snapshot for both
 * lookups; a rebuild produces a new snapshot that replaces this one as a whole.
 */
public final class IndexSnapshot {

  private final List<IndexEntry> entries;
  private final Map<String, IndexEntry> entriesById;
  private final LexicalIndex lexicalIndex;
  private final VectorIndex vectorIndex;
  private final CorpusIndexMetadata metadata;

  public IndexSnapshot(
      List<IndexEntry> entries,
      LexicalIndex lexicalIndex,
      VectorIndex vectorIndex,
      CorpusIndexMetadata metadata) {
    this.entries = List.copyOf(entries);
    this.entriesById = new LinkedHashMap<>();
    for (IndexEntry entry : this.entries) {
      entriesById.put(entry.entryId(), entry);
    }
    this.lexicalIndex = lexicalIndex;
    this.vectorIndex = vectorIndex;
    this.metadata = metadata;
  }

  public static IndexSnapshot empty(String embeddingModel, double k1, double b, int tagRepeat) {
    return new IndexSnapshot(
        List.of(),
        LexicalIndex.empty(k1, b, tagRepeat),
        VectorIndex.empty(embeddingModel),
        null);
  }

  public List<IndexEntry> getEntries() {
    return entries;
  }

  public IndexEntry entry(String entryId) {
    return entriesById.get(entryId);
  }

  public LexicalIndex getLexicalIndex() {
    return lexicalIndex;
  }

  public VectorIndex getVectorIndex() {
    return vectorIndex;
  }

  /** Metadata the snapshot was written with, or {@code null} for a snapshot never persisted. */
  public CorpusIndexMetadata getMetadata() {
    return metadata;
  }

  public int size() {
    return entries.size();
  }

  public long itemCount() {
    return entries.stream().map(IndexEntry::parentId).distinct().count();
  }
}
