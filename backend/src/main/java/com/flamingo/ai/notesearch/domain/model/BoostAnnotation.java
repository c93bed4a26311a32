package com.flamingo.ai.notesearch.domain.model;

import com.flamingo.ai.notesearch.domain.enums.BoostType;

/**
 * Records one boost applied to a candidate.
 *
 * @param type which rule fired
 * @param factor multiplier applied to the fused score
 * @param reason human-readable trigger, e.g. {@code "tag 'python' matched query"}
 */
public record BoostAnnotation(BoostType type, double factor, String reason) {}
