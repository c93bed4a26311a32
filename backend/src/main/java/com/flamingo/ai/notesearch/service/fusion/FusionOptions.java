package com.flamingo.ai.notesearch.service.fusion;

import com.flamingo.ai.notesearch.service.profile.MetadataBoostRule;
import java.util.List;

/**
 * Per-query fusion settings.
 *
 * @param query the (possibly expanded) query text, tokenized for categorical metadata matches
 * @param hybridWeight 0 is pure lexical, 1 pure vector
 * @param bm25Boost extra multiplier on the lexical list weight
 * @param tagBoostEnabled whether exact tag matches are boosted
 * @param metadataBoosts metadata rules to apply, empty to skip the stage
 */
public record FusionOptions(
    String query,
    double hybridWeight,
    double bm25Boost,
    boolean tagBoostEnabled,
    List<MetadataBoostRule> metadataBoosts) {

  public static FusionOptions plainRrf(String query) {
    return new FusionOptions(query, 0.5, 1.0, false, List.of());
  }
}
