package com.flamingo.ai.notesearch.api.dto.response;

import com.flamingo.ai.notesearch.service.profile.SearchProfile;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a search profile. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResponse {

  private String name;
  private String displayName;
  private String description;
  private boolean builtIn;
  private double hybridWeight;
  private double bm25Boost;
  private boolean tagBoostEnabled;
  private List<String> metadataBoosts;
  private Double timeDecayHalfLifeDays;
  private Double timeDecayMaxBoost;
  private Integer maxAgeDays;
  private boolean crossEncoderEnabled;
  private boolean queryExpansionEnabled;
  private List<String> includeTypes;
  private List<String> excludeTypes;
  private boolean chunkingEnabled;
  private int chunkSize;
  private int chunkOverlap;

  /** Creates a ProfileResponse from a profile. */
  public static ProfileResponse fromProfile(SearchProfile profile, boolean builtIn) {
    return ProfileResponse.builder()
        .name(profile.getName())
        .displayName(profile.getDisplayName())
        .description(profile.getDescription())
        .builtIn(builtIn)
        .hybridWeight(profile.getHybridWeight())
        .bm25Boost(profile.getBm25Boost())
        .tagBoostEnabled(profile.isTagBoostEnabled())
        .metadataBoosts(
            profile.getMetadataBoosts().stream()
                .map(rule -> rule.key().getJsonName() + ":" + rule.type())
                .toList())
        .timeDecayHalfLifeDays(
            profile.getTimeDecay() == null ? null : profile.getTimeDecay().halfLifeDays())
        .timeDecayMaxBoost(
            profile.getTimeDecay() == null ? null : profile.getTimeDecay().maxBoost())
        .maxAgeDays(profile.getMaxAgeDays())
        .crossEncoderEnabled(profile.isCrossEncoderEnabled())
        .queryExpansionEnabled(profile.isQueryExpansionEnabled())
        .includeTypes(profile.getIncludeTypes())
        .excludeTypes(profile.getExcludeTypes())
        .chunkingEnabled(profile.isChunkingEnabled())
        .chunkSize(profile.getChunkSize())
        .chunkOverlap(profile.getChunkOverlap())
        .build();
  }
}
