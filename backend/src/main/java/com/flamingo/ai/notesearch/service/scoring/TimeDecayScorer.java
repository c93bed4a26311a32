package com.flamingo.ai.notesearch.service.scoring;

import com.flamingo.ai.notesearch.domain.enums.BoostType;
import com.flamingo.ai.notesearch.domain.model.BoostAnnotation;
import com.flamingo.ai.notesearch.domain.model.RetrievalCandidate;
import com.flamingo.ai.notesearch.service.profile.TimeDecaySettings;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Boosts recently modified candidates: {@code boost = maxBoost * 0.5^(ageDays / halfLifeDays)},
 * {@code score = score * (1 + boost)}. Runs before refinement so the cross-encoder can still
 * override recency.
 */
@Component
@Slf4j
public class TimeDecayScorer {

  private static final double MILLIS_PER_DAY = 86_400_000.0;

  /**
   * Applies the boost and returns the candidates re-sorted by adjusted score. Candidates without a
   * modification time are left unchanged.
   */
  public List<RetrievalCandidate> apply(
      List<RetrievalCandidate> candidates, Instant now, TimeDecaySettings settings) {
    for (RetrievalCandidate candidate : candidates) {
      Instant modifiedAt = candidate.getEntry().modifiedAt();
      if (modifiedAt == null) {
        continue;
      }
      double ageDays = ageInDays(modifiedAt, now);
      double factor = factor(ageDays, settings);
      candidate.setTimeDecayFactor(factor);
      candidate.setScore(candidate.getScore() * factor);
      candidate.addBoost(
          new BoostAnnotation(
              BoostType.TIME_DECAY, factor, String.format("modified %.1f days ago", ageDays)));
    }
    List<RetrievalCandidate> sorted = new ArrayList<>(candidates);
    sorted.sort(RetrievalCandidate.BY_SCORE);
    log.debug(
        "Time decay applied to {} candidates (half-life {} days, max boost {})",
        sorted.size(),
        settings.halfLifeDays(),
        settings.maxBoost());
    return sorted;
  }

  /** Multiplier {@code 1 + maxBoost * 0.5^(ageDays / halfLifeDays)}. */
  public static double factor(double ageDays, TimeDecaySettings settings) {
    if (settings.halfLifeDays() <= 0) {
      return 1.0;
    }
    return 1.0 + settings.maxBoost() * Math.pow(0.5, ageDays / settings.halfLifeDays());
  }

  /** Fractional days between the two instants; a modification time in the future counts as 0. */
  public static double ageInDays(Instant modifiedAt, Instant now) {
    double days = Duration.between(modifiedAt, now).toMillis() / MILLIS_PER_DAY;
    return Math.max(0.0, days);
  }
}
