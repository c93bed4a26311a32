package com.flamingo.ai.notesearch.domain.model;

import com.flamingo.ai.notesearch.domain.enums.BoostType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;

/**
 * Per-query scoring state of one index entry. Lives for one query only and is never persisted.
 *
 * <p>{@code score} is the working score each stage reads and rewrites; the other fields keep the
 * intermediate values for the response's score breakdown.
 */
@Getter
@Setter
public class RetrievalCandidate {

  /** Orders by working score, then lexical raw score, then entry id. */
  public static final Comparator<RetrievalCandidate> BY_SCORE =
      Comparator.comparingDouble(RetrievalCandidate::getScore)
          .reversed()
          .thenComparing(
              Comparator.comparingDouble(RetrievalCandidate::getLexicalScoreOrZero).reversed())
          .thenComparing(RetrievalCandidate::getEntryId);

  private final IndexEntry entry;

  private Integer lexicalRank;
  private Double lexicalScore;
  private Integer vectorRank;
  private Double vectorScore;
  private Set<String> matchedTags = Set.of();

  /** Weighted RRF score before any boost. */
  private double rrfScore;

  /** Score after fusion boosts. */
  private double fusedScore;

  private Double timeDecayFactor;
  private Double crossEncoderScore;
  private int siblingCount;
  private double score;

  private final List<BoostAnnotation> boosts = new ArrayList<>();

  public RetrievalCandidate(IndexEntry entry) {
    this.entry = entry;
  }

  public String getEntryId() {
    return entry.entryId();
  }

  public String getParentId() {
    return entry.parentId();
  }

  public double getLexicalScoreOrZero() {
    return lexicalScore == null ? 0.0 : lexicalScore;
  }

  public void addBoost(BoostAnnotation boost) {
    boosts.add(boost);
  }

  /** Adds a boost ahead of the others so the response lists it first. */
  public void prependBoost(BoostAnnotation boost) {
    boosts.add(0, boost);
  }

  public List<BoostAnnotation> getBoosts() {
    return Collections.unmodifiableList(boosts);
  }

  /** True when an exact tag match lifted this candidate; such candidates skip the refiner. */
  public boolean isTagBoosted() {
    for (BoostAnnotation boost : boosts) {
      if (boost.type() == BoostType.TAG_MATCH) {
        return true;
      }
    }
    return false;
  }
}
