package com.flamingo.ai.notesearch.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.notesearch.domain.enums.ItemStatus;
import com.flamingo.ai.notesearch.domain.model.BoostAnnotation;
import com.flamingo.ai.notesearch.domain.model.IndexEntry;
import com.flamingo.ai.notesearch.domain.model.RetrievalCandidate;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one ranked item. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResultItem {

  private String id;
  private String title;
  private String description;
  private List<String> tags;
  private String type;
  private ItemStatus status;
  private Instant modifiedAt;

  /** "part i/n" when the best match was a chunk. */
  private String chunk;

  /** Matched chunk text, only when the profile asks for chunk context. */
  private String chunkText;

  /** Number of chunks of this item that matched. */
  private Integer matchedChunks;

  private double score;
  private ScoreBreakdown scores;

  /** Creates a result item from a ranked candidate. */
  public static SearchResultItem fromCandidate(RetrievalCandidate candidate, boolean withChunk) {
    IndexEntry entry = candidate.getEntry();
    return SearchResultItem.builder()
        .id(entry.parentId())
        .title(entry.title())
        .description(entry.description().isEmpty() ? null : entry.description())
        .tags(entry.tags())
        .type(entry.metadata().type().orElse(null))
        .status(entry.status())
        .modifiedAt(entry.modifiedAt())
        .chunk(entry.isChunk() ? entry.partLabel() : null)
        .chunkText(withChunk && entry.isChunk() ? entry.text() : null)
        .matchedChunks(entry.isChunk() ? candidate.getSiblingCount() + 1 : null)
        .score(candidate.getScore())
        .scores(ScoreBreakdown.fromCandidate(candidate))
        .build();
  }

  /** Per-stage scores behind the final ranking. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class ScoreBreakdown {
    private Integer lexicalRank;
    private Double lexicalScore;
    private Integer vectorRank;
    private Double vectorScore;
    private double rrf;
    private double fused;
    private Double timeDecay;
    private Double crossEncoder;
    private Set<String> matchedTags;
    private List<BoostAnnotation> boosts;

    static ScoreBreakdown fromCandidate(RetrievalCandidate candidate) {
      return ScoreBreakdown.builder()
          .lexicalRank(candidate.getLexicalRank())
          .lexicalScore(candidate.getLexicalScore())
          .vectorRank(candidate.getVectorRank())
          .vectorScore(candidate.getVectorScore())
          .rrf(candidate.getRrfScore())
          .fused(candidate.getFusedScore())
          .timeDecay(candidate.getTimeDecayFactor())
          .crossEncoder(candidate.getCrossEncoderScore())
          .matchedTags(candidate.getMatchedTags().isEmpty() ? null : candidate.getMatchedTags())
          .boosts(candidate.getBoosts().isEmpty() ? null : candidate.getBoosts())
          .build();
    }
  }
}
