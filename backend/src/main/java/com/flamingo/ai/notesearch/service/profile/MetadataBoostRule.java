package com.flamingo.ai.notesearch.service.profile;

import com.flamingo.ai.notesearch.domain.enums.BoostType;
import com.flamingo.ai.notesearch.domain.enums.MetadataKey;

/**
 * A boost driven by one well-known metadata key.
 *
 * <ul>
 *   <li>{@link BoostType#METADATA_LOG_SCALE}: {@code 1 + maxBoost * min(1, log10(1 + count) /
 *       log10(1 + saturation))}, so a counter of 10,000 is not worth 100 times a counter of 100
 *   <li>{@link BoostType#METADATA_MATCH}: flat {@code matchFactor} when a query token equals one of
 *       the key's values
 * </ul>
 */
public record MetadataBoostRule(
    MetadataKey key, BoostType type, double maxBoost, double saturation, double matchFactor) {

  public static MetadataBoostRule logScale(MetadataKey key, double maxBoost, double saturation) {
    return new MetadataBoostRule(key, BoostType.METADATA_LOG_SCALE, maxBoost, saturation, 1.0);
  }

  public static MetadataBoostRule match(MetadataKey key, double matchFactor) {
    return new MetadataBoostRule(key, BoostType.METADATA_MATCH, 0.0, 0.0, matchFactor);
  }

  /** Multiplier for an unbounded counter value; counts at or below zero give 1. */
  public double logScaleFactor(long count) {
    if (count <= 0 || saturation <= 0) {
      return 1.0;
    }
    double ratio = Math.log10(1 + (double) count) / Math.log10(1 + saturation);
    return 1.0 + maxBoost * Math.min(1.0, ratio);
  }
}
