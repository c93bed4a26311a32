package com.flamingo.ai.notesearch.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flamingo.ai.notesearch.domain.enums.ItemStatus;
import java.time.Instant;
import java.util.List;

/**
 * The unit stored in both the lexical and the vector index: a whole item, or one chunk of an item
 * whose body was too long to embed in one piece.
 */
public record IndexEntry(
    String entryId,
    String parentId,
    String title,
    String text,
    List<String> tags,
    ItemMetadata metadata,
    ItemStatus status,
    Instant modifiedAt,
    int chunkOrdinal,
    int chunkTotal,
    int startOffset,
    int endOffset) {

  private static final String CHUNK_SEPARATOR = "#chunk-";

  public IndexEntry {
    tags = tags == null ? List.of() : List.copyOf(tags);
    metadata = metadata == null ? ItemMetadata.empty() : metadata;
    status = status == null ? ItemStatus.ACTIVE : status;
  }

  public static IndexEntry ofItem(Item item) {
    String body = item.getBody() == null ? "" : item.getBody();
    return new IndexEntry(
        item.getId(),
        item.getId(),
        item.getTitle(),
        body,
        sortedTags(item),
        item.getMetadata(),
        item.getStatus(),
        item.getModifiedAt(),
        0,
        1,
        0,
        body.length());
  }

  public static IndexEntry ofChunk(Item item, Chunk chunk) {
    return new IndexEntry(
        chunkEntryId(item.getId(), chunk.ordinal()),
        item.getId(),
        chunk.title(),
        chunk.text(),
        sortedTags(item),
        item.getMetadata(),
        item.getStatus(),
        item.getModifiedAt(),
        chunk.ordinal(),
        chunk.total(),
        chunk.startOffset(),
        chunk.endOffset());
  }

  public static String chunkEntryId(String itemId, int ordinal) {
    return itemId + CHUNK_SEPARATOR + ordinal;
  }

  @JsonIgnore
  public boolean isChunk() {
    return chunkTotal > 1;
  }

  public String description() {
    return metadata.description();
  }

  public String partLabel() {
    return isChunk() ? "part " + (chunkOrdinal + 1) + "/" + chunkTotal : null;
  }

  /** Text handed to the embedding and cross-encoder models. */
  public String embeddingText() {
    StringBuilder sb = new StringBuilder();
    if (title != null && !title.isBlank()) {
      sb.append(title).append("\n\n");
    }
    sb.append(text == null ? "" : text);
    return sb.toString();
  }

  private static List<String> sortedTags(Item item) {
    return item.getTags() == null ? List.of() : item.getTags().stream().sorted().toList();
  }
}
