package com.flamingo.ai.notesearch.api.dto.response;

import com.flamingo.ai.notesearch.service.corpus.RetrievalClientCache.CacheStats;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for service-wide statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStats {
  private CacheStats clientCache;
  private List<CorpusResponse> corpora;
  private int profileCount;
  private String embeddingModel;
  private Instant timestamp;
}
