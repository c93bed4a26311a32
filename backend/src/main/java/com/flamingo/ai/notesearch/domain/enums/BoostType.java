package com.flamingo.ai.notesearch.domain.enums;

/** Kinds of score adjustment recorded on a retrieval candidate. */
public enum BoostType {
  TAG_MATCH,
  METADATA_LOG_SCALE,
  METADATA_MATCH,
  TIME_DECAY
}
