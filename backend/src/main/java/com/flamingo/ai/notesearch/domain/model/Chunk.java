package com.flamingo.ai.notesearch.domain.model;

/**
 * A contiguous slice of an item's body.
 *
 * @param parentId identifier of the item this chunk was cut from
 * @param ordinal 0-based position of the chunk within its parent
 * @param total number of chunks the parent was split into
 * @param startOffset inclusive character offset into the parent body
 * @param endOffset exclusive character offset into the parent body
 * @param text the body text between the two offsets
 * @param title parent title annotated with the chunk position, e.g. {@code "Notes (part 2/5)"}
 */
public record Chunk(
    String parentId,
    int ordinal,
    int total,
    int startOffset,
    int endOffset,
    String text,
    String title) {

  public int length() {
    return endOffset - startOffset;
  }

  public String partLabel() {
    return "part " + (ordinal + 1) + "/" + total;
  }

  @Override
  public String toString() {
    return "Chunk(" + (ordinal + 1) + "/" + total + ", " + length() + " chars, " + parentId + ")";
  }
}
