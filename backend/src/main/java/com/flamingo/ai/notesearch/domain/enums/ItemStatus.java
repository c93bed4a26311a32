package com.flamingo.ai.notesearch.domain.enums;

/** Lifecycle status of an indexed item. Items are never deleted, only deactivated or hidden. */
public enum ItemStatus {
  /** Visible in search results. */
  ACTIVE,

  /** Superseded or dead content; excluded by default. */
  INACTIVE,

  /** Deliberately hidden by the user; excluded by default. */
  HIDDEN
}
