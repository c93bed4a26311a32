package com.flamingo.ai.notesearch.service.chunking;

import com.flamingo.ai.notesearch.config.SearchConfig;
import com.flamingo.ai.notesearch.domain.model.Chunk;
import com.flamingo.ai.notesearch.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits long item bodies into overlapping character windows so no body exceeds the embedding
 * model's input budget.
 *
 * <p>Windows are {@code chunkSize} characters long and advance by {@code chunkSize - overlap}. A
 * final window shorter than {@code overlap} is folded into the previous chunk instead of being
 * emitted as a fragment. Any substring of at most {@code overlap} characters lies wholly inside at
 * least one chunk.
 */
@Component
@Slf4j
public class Chunker {

  private static final int CHARS_PER_TOKEN = 4;

  private final int threshold;
  private final int chunkSize;
  private final int overlap;
  private final int maxInputChars;

  @Autowired
  public Chunker(SearchConfig searchConfig) {
    this(
        searchConfig.getChunking().getThreshold(),
        searchConfig.getChunking().getSize(),
        searchConfig.getChunking().getOverlap(),
        searchConfig.getEmbedding().getMaxInputChars());
  }

  public Chunker(int threshold, int chunkSize, int overlap, int maxInputChars) {
    validate(threshold, chunkSize, overlap, maxInputChars);
    this.threshold = threshold;
    this.chunkSize = chunkSize;
    this.overlap = overlap;
    this.maxInputChars = maxInputChars;
  }

  private static void validate(int threshold, int chunkSize, int overlap, int maxInputChars) {
    if (chunkSize <= 0) {
      throw new ConfigurationException("Chunk size must be positive, got " + chunkSize);
    }
    if (overlap < 0) {
      throw new ConfigurationException("Chunk overlap must not be negative, got " + overlap);
    }
    if (overlap >= chunkSize) {
      throw new ConfigurationException(
          "Chunk overlap (" + overlap + ") must be smaller than chunk size (" + chunkSize + ")");
    }
    if (threshold <= 0) {
      throw new ConfigurationException("Chunking threshold must be positive, got " + threshold);
    }
    if (chunkSize > maxInputChars) {
      throw new ConfigurationException(
          "Chunk size ("
              + chunkSize
              + ") exceeds the embedding input budget ("
              + maxInputChars
              + " chars)");
    }
    if (threshold > maxInputChars) {
      throw new ConfigurationException(
          "Chunking threshold ("
              + threshold
              + ") exceeds the embedding input budget ("
              + maxInputChars
              + " chars); longer bodies would be truncated");
    }
  }

  /** Returns a chunker with the same threshold and budget but a different window. */
  public Chunker withWindow(int newChunkSize, int newOverlap) {
    if (newChunkSize == chunkSize && newOverlap == overlap) {
      return this;
    }
    return new Chunker(Math.max(threshold, newChunkSize), newChunkSize, newOverlap, maxInputChars);
  }

  public boolean shouldChunk(String body) {
    return body != null && body.length() > threshold;
  }

  /**
   * Chunks a body for indexing. With chunking disabled a body is still split when it exceeds the
   * embedding input budget.
   */
  public List<Chunk> chunkForIndexing(
      String parentId, String title, String body, boolean chunkingEnabled) {
    if (chunkingEnabled || body == null || body.length() <= maxInputChars) {
      return chunkingEnabled ? chunk(parentId, title, body) : single(parentId, title, body);
    }
    log.debug(
        "Chunking disabled but {} has {} chars, over the {} char embedding budget",
        parentId,
        body.length(),
        maxInputChars);
    return window(parentId, title, body);
  }

  /**
   * Splits {@code body}. An empty body yields no chunks, a body at or under the threshold one
   * chunk spanning all of it.
   */
  public List<Chunk> chunk(String parentId, String title, String body) {
    if (!shouldChunk(body)) {
      return single(parentId, title, body);
    }
    return window(parentId, title, body);
  }

  private List<Chunk> single(String parentId, String title, String body) {
    if (body == null || body.isEmpty()) {
      return List.of();
    }
    return List.of(new Chunk(parentId, 0, 1, 0, body.length(), body, title));
  }

  private List<Chunk> window(String parentId, String title, String body) {
    int length = body.length();
    int step = chunkSize - overlap;
    List<int[]> windows = new ArrayList<>();
    int start = 0;
    while (start < length) {
      int end = Math.min(start + chunkSize, length);
      windows.add(new int[] {start, end});
      if (end == length) {
        break;
      }
      start += step;
    }

    int total = windows.size();
    List<Chunk> chunks = new ArrayList<>(total);
    for (int i = 0; i < total; i++) {
      int[] range = windows.get(i);
      String partTitle = (title == null ? "" : title) + " (part " + (i + 1) + "/" + total + ")";
      String text = body.substring(range[0], range[1]);
      chunks.add(new Chunk(parentId, i, total, range[0], range[1], text, partTitle));
    }
    log.debug("Chunked {}: {} chars -> {} chunks", parentId, length, total);
    return chunks;
  }

  /** Size statistics over a set of chunks, logged after each index build. */
  public static ChunkStatistics statistics(List<Chunk> chunks) {
    if (chunks.isEmpty()) {
      return new ChunkStatistics(0, 0, 0, 0, 0);
    }
    int min = Integer.MAX_VALUE;
    int max = 0;
    long total = 0;
    for (Chunk chunk : chunks) {
      int size = chunk.length();
      min = Math.min(min, size);
      max = Math.max(max, size);
      total += size;
    }
    double avg = (double) total / chunks.size();
    return new ChunkStatistics(chunks.size(), min, avg, max, (int) (avg / CHARS_PER_TOKEN));
  }

  public static int estimateTokenCount(String text) {
    return text == null ? 0 : text.length() / CHARS_PER_TOKEN;
  }

  public int getThreshold() {
    return threshold;
  }

  public int getChunkSize() {
    return chunkSize;
  }

  public int getOverlap() {
    return overlap;
  }

  public int getMaxInputChars() {
    return maxInputChars;
  }

  /** Chunk count and size spread; token estimate uses four characters per token. */
  public record ChunkStatistics(
      int count, int minSize, double avgSize, int maxSize, int avgEstimatedTokens) {}
}
