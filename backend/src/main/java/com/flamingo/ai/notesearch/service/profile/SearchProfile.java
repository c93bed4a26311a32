package com.flamingo.ai.notesearch.service.profile;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A named bundle of pipeline defaults. Request parameters always take precedence over the values
 * here.
 */
@Value
@Builder(toBuilder = true)
public class SearchProfile {

  String name;
  String displayName;
  String description;

  /** 0 is pure lexical, 1 pure vector, 0.5 plain RRF. */
  double hybridWeight;

  /** Extra multiplier on the lexical list's RRF weight. */
  @Builder.Default double bm25Boost = 1.0;

  @Builder.Default boolean tagBoostEnabled = true;
  @Builder.Default List<MetadataBoostRule> metadataBoosts = List.of();

  /** {@code null} disables the recency boost. */
  TimeDecaySettings timeDecay;

  /** Hard cutoff; items modified longer ago are dropped. {@code null} means no cutoff. */
  Integer maxAgeDays;

  @Builder.Default boolean crossEncoderEnabled = true;
  @Builder.Default boolean queryExpansionEnabled = false;
  @Builder.Default List<String> includeTypes = List.of();
  @Builder.Default List<String> excludeTypes = List.of();
  @Builder.Default boolean chunkingEnabled = true;
  @Builder.Default int chunkSize = 2000;
  @Builder.Default int chunkOverlap = 400;

  /** Include the matching chunk text in results. */
  @Builder.Default boolean showChunkContext = false;
}
