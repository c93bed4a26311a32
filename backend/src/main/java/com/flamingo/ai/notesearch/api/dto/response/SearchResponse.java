package com.flamingo.ai.notesearch.api.dto.response;

import com.flamingo.ai.notesearch.domain.enums.PipelineStage;
import com.flamingo.ai.notesearch.service.search.SearchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

  private String query;
  private String expandedQuery;
  private String corpus;
  private String profile;
  private List<SearchResultItem> results;
  private int total;
  private List<PipelineStage> skippedStages;
  private long tookMs;

  /** Creates a SearchResponse from a pipeline result. */
  public static SearchResponse fromResult(SearchResult result) {
    List<SearchResultItem> items =
        result.candidates().stream()
            .map(c -> SearchResultItem.fromCandidate(c, result.showChunkContext()))
            .toList();
    return SearchResponse.builder()
        .query(result.query())
        .expandedQuery(result.expandedQuery())
        .corpus(result.corpus())
        .profile(result.profile())
        .results(items)
        .total(items.size())
        .skippedStages(result.skippedStages())
        .tookMs(result.tookMs())
        .build();
  }
}
