package com.flamingo.ai.notesearch.service.search;

import com.flamingo.ai.notesearch.domain.enums.PipelineStage;
import com.flamingo.ai.notesearch.domain.model.RetrievalCandidate;
import java.util.List;

/**
 * Outcome of one query.
 *
 * @param query the query as received
 * @param expandedQuery the query actually retrieved with, equal to {@code query} when unexpanded
 * @param corpus corpus name
 * @param profile profile name
 * @param candidates final ranking, best first
 * @param skippedStages enabled stages that failed or timed out and contributed nothing
 * @param showChunkContext whether the profile asks for the matched chunk text
 * @param tookMs wall time
 */
public record SearchResult(
    String query,
    String expandedQuery,
    String corpus,
    String profile,
    List<RetrievalCandidate> candidates,
    List<PipelineStage> skippedStages,
    boolean showChunkContext,
    long tookMs) {}
