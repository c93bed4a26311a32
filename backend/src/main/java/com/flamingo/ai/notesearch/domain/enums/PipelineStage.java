package com.flamingo.ai.notesearch.domain.enums;

/** Query pipeline stages that can fail or degrade; reported in a response's skipped stages. */
public enum PipelineStage {
  LEXICAL,
  VECTOR,
  RERANK
}
