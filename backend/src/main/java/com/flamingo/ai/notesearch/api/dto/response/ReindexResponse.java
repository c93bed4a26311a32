package com.flamingo.ai.notesearch.api.dto.response;

import com.flamingo.ai.notesearch.service.indexing.IndexingResult;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a reindex request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReindexResponse {

  /** "success" for a finished rebuild, "accepted" for a queued one. */
  private String status;

  private String corpus;
  private String profile;
  private Integer itemCount;
  private Integer entryCount;
  private Integer chunkedItems;
  private Integer embedded;
  private Integer reused;
  private Instant indexedAt;
  private Long durationMs;

  /** Creates a ReindexResponse from a finished rebuild. */
  public static ReindexResponse fromResult(IndexingResult result) {
    return ReindexResponse.builder()
        .status("success")
        .corpus(result.corpus())
        .profile(result.profile())
        .itemCount(result.itemCount())
        .entryCount(result.entryCount())
        .chunkedItems(result.chunkedItems())
        .embedded(result.embedded())
        .reused(result.reused())
        .indexedAt(result.indexedAt())
        .durationMs(result.durationMs())
        .build();
  }

  /** A response for a rebuild that was queued. */
  public static ReindexResponse accepted(String corpus, String profile) {
    return ReindexResponse.builder().status("accepted").corpus(corpus).profile(profile).build();
  }
}
