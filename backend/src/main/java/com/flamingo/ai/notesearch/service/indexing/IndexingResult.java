package com.flamingo.ai.notesearch.service.indexing;

import com.flamingo.ai.notesearch.service.chunking.Chunker.ChunkStatistics;
import java.time.Instant;

/**
 * Summary of one completed rebuild.
 *
 * @param corpus corpus name
 * @param profile profile whose chunking settings were used
 * @param itemCount items read from the item source
 * @param entryCount entries written (whole items plus chunks)
 * @param chunkedItems items split into more than one chunk
 * @param embedded entries sent to the embedding model
 * @param reused entries whose stored vectors were kept
 * @param chunkStatistics size spread of the chunks of split items
 * @param indexedAt build timestamp written to the index metadata
 * @param durationMs wall time of the rebuild
 */
public record IndexingResult(
    String corpus,
    String profile,
    int itemCount,
    int entryCount,
    int chunkedItems,
    int embedded,
    int reused,
    ChunkStatistics chunkStatistics,
    Instant indexedAt,
    long durationMs) {}
