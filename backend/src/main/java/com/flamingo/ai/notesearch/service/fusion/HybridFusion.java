package com.flamingo.ai.notesearch.service.fusion;

import com.flamingo.ai.notesearch.config.SearchConfig;
import com.flamingo.ai.notesearch.domain.enums.BoostType;
import com.flamingo.ai.notesearch.domain.model.BoostAnnotation;
import com.flamingo.ai.notesearch.domain.model.IndexEntry;
import com.flamingo.ai.notesearch.domain.model.RetrievalCandidate;
import com.flamingo.ai.notesearch.index.IndexSnapshot;
import com.flamingo.ai.notesearch.index.LexicalIndex.LexicalHit;
import com.flamingo.ai.notesearch.index.NoteAnalyzer;
import com.flamingo.ai.notesearch.index.VectorIndex.VectorHit;
import com.flamingo.ai.notesearch.service.profile.MetadataBoostRule;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Merges the lexical and vector rankings with weighted Reciprocal Rank Fusion, then applies the
 * boost rules.
 *
 * <p>RRF score = Σ weight / (k + rank) over the lists a candidate appears in, with 1-based ranks.
 * The lexical weight is {@code 2(1 - w) * bm25Boost} and the vector weight {@code 2w}, so a hybrid
 * weight of 0.5 without extra BM25 boost is plain RRF.
 *
 * <p>Exact tag matches deliberately break RRF: their lexical score is multiplied before ranking
 * and, after fusion, they are lifted above the best untagged candidate by a configurable margin.
 * Metadata rules multiply the fused score.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HybridFusion {

  /** Orders by fused score, then lexical raw score, then entry id. */
  public static final Comparator<RetrievalCandidate> FUSED_ORDER =
      Comparator.comparingDouble(RetrievalCandidate::getFusedScore)
          .reversed()
          .thenComparing(
              Comparator.comparingDouble(RetrievalCandidate::getLexicalScoreOrZero).reversed())
          .thenComparing(RetrievalCandidate::getEntryId);

  private final SearchConfig searchConfig;

  /**
   * Fuses the two rankings. Either list may be empty; the result then follows the other list.
   *
   * @param lexicalHits lexical ranking, best first
   * @param vectorHits vector ranking, best first
   * @param snapshot the snapshot both rankings were read from
   * @param options per-query fusion settings
   * @return candidates ordered by fused score
   */
  public List<RetrievalCandidate> fuse(
      List<LexicalHit> lexicalHits,
      List<VectorHit> vectorHits,
      IndexSnapshot snapshot,
      FusionOptions options) {

    SearchConfig.TagBoost tagConfig = searchConfig.getTagBoost();
    int rrfK = searchConfig.getRetrieval().getRrfK();
    double lexicalWeight = 2.0 * (1.0 - options.hybridWeight()) * options.bm25Boost();
    double vectorWeight = 2.0 * options.hybridWeight();

    List<LexicalHit> lexicalRanking = lexicalHits;
    if (options.tagBoostEnabled() && lexicalHits.stream().anyMatch(LexicalHit::tagMatched)) {
      lexicalRanking = rerankTagMatches(lexicalHits, tagConfig.getLexicalMultiplier());
    }

    log.debug(
        "[RRF] input: lexical={} vector={} rrfK={} weights=({}, {})",
        lexicalRanking.size(),
        vectorHits.size(),
        rrfK,
        lexicalWeight,
        vectorWeight);

    Map<String, RetrievalCandidate> candidates = new LinkedHashMap<>();
    for (int i = 0; i < lexicalRanking.size(); i++) {
      LexicalHit hit = lexicalRanking.get(i);
      RetrievalCandidate candidate = candidate(candidates, snapshot, hit.entryId());
      if (candidate == null) {
        continue;
      }
      candidate.setLexicalRank(i + 1);
      candidate.setLexicalScore(hit.score());
      candidate.setMatchedTags(hit.matchedTags());
      candidate.setRrfScore(candidate.getRrfScore() + lexicalWeight / (rrfK + i + 1));
    }
    for (int i = 0; i < vectorHits.size(); i++) {
      VectorHit hit = vectorHits.get(i);
      RetrievalCandidate candidate = candidate(candidates, snapshot, hit.entryId());
      if (candidate == null) {
        continue;
      }
      candidate.setVectorRank(i + 1);
      candidate.setVectorScore(hit.similarity());
      candidate.setRrfScore(candidate.getRrfScore() + vectorWeight / (rrfK + i + 1));
    }

    Set<String> queryTokens = new HashSet<>(NoteAnalyzer.tokenize(options.query()));
    Map<RetrievalCandidate, Double> metadataFactors = new HashMap<>();
    List<RetrievalCandidate> tagged = new ArrayList<>();
    for (RetrievalCandidate candidate : candidates.values()) {
      double factor = metadataFactor(candidate, options.metadataBoosts(), queryTokens);
      metadataFactors.put(candidate, factor);
      candidate.setFusedScore(candidate.getRrfScore() * factor);
      if (options.tagBoostEnabled() && !candidate.getMatchedTags().isEmpty()) {
        tagged.add(candidate);
      }
    }

    if (!tagged.isEmpty()) {
      liftTagMatches(candidates.values(), tagged, metadataFactors, tagConfig);
    }

    List<RetrievalCandidate> fused = new ArrayList<>(candidates.values());
    for (RetrievalCandidate candidate : fused) {
      candidate.setScore(candidate.getFusedScore());
    }
    fused.sort(FUSED_ORDER);
    log.debug("[RRF] fused {} candidates ({} tag-boosted)", fused.size(), tagged.size());
    return fused;
  }

  private static RetrievalCandidate candidate(
      Map<String, RetrievalCandidate> candidates, IndexSnapshot snapshot, String entryId) {
    RetrievalCandidate existing = candidates.get(entryId);
    if (existing != null) {
      return existing;
    }
    IndexEntry entry = snapshot.entry(entryId);
    if (entry == null) {
      log.warn("Ranked entry {} missing from snapshot, ignoring", entryId);
      return null;
    }
    RetrievalCandidate created = new RetrievalCandidate(entry);
    candidates.put(entryId, created);
    return created;
  }

  /** Multiplies tag-matched lexical scores and re-ranks the lexical list. */
  private static List<LexicalHit> rerankTagMatches(List<LexicalHit> hits, double multiplier) {
    Map<LexicalHit, Double> boosted = new HashMap<>();
    for (LexicalHit hit : hits) {
      boosted.put(hit, hit.tagMatched() ? hit.score() * multiplier : hit.score());
    }
    List<LexicalHit> reranked = new ArrayList<>(hits);
    reranked.sort(
        Comparator.comparingDouble((LexicalHit hit) -> boosted.get(hit))
            .reversed()
            .thenComparing(LexicalHit::entryId));
    return reranked;
  }

  /**
   * Lifts each tag-matched candidate to {@code naturalMax * (minMargin + (maxMargin - minMargin) *
   * r)}, where naturalMax is the best untagged fused score and r the candidate's lexical score
   * relative to the strongest tag match.
   */
  private void liftTagMatches(
      Iterable<RetrievalCandidate> all,
      List<RetrievalCandidate> tagged,
      Map<RetrievalCandidate, Double> metadataFactors,
      SearchConfig.TagBoost config) {

    Set<RetrievalCandidate> taggedSet = new HashSet<>(tagged);
    double naturalMax = 0.0;
    for (RetrievalCandidate candidate : all) {
      if (!taggedSet.contains(candidate)) {
        naturalMax = Math.max(naturalMax, candidate.getFusedScore());
      }
    }
    if (naturalMax <= 0.0) {
      for (RetrievalCandidate candidate : tagged) {
        naturalMax = Math.max(naturalMax, candidate.getRrfScore());
      }
    }
    double strongestLexical = 0.0;
    for (RetrievalCandidate candidate : tagged) {
      strongestLexical = Math.max(strongestLexical, candidate.getLexicalScoreOrZero());
    }

    for (RetrievalCandidate candidate : tagged) {
      double ratio =
          strongestLexical > 0.0 ? candidate.getLexicalScoreOrZero() / strongestLexical : 1.0;
      double margin =
          config.getMinMargin() + (config.getMaxMargin() - config.getMinMargin()) * ratio;
      double lifted = naturalMax * margin * metadataFactors.get(candidate);
      double before = candidate.getFusedScore();
      candidate.setFusedScore(Math.max(before, lifted));

      String reason =
          String.format(
              "tag %s matched query; %.2fx over natural max %.5f",
              candidate.getMatchedTags(), margin, naturalMax);
      candidate.prependBoost(new BoostAnnotation(BoostType.TAG_MATCH, margin, reason));
      log.debug(
          "Tag boost {}: {} -> {} ({})",
          candidate.getEntryId(),
          String.format("%.5f", before),
          String.format("%.5f", candidate.getFusedScore()),
          reason);
    }
  }

  private double metadataFactor(
      RetrievalCandidate candidate, List<MetadataBoostRule> rules, Set<String> queryTokens) {
    double total = 1.0;
    for (MetadataBoostRule rule : rules) {
      double factor = 1.0;
      String reason = null;
      if (rule.type() == BoostType.METADATA_LOG_SCALE) {
        OptionalLong count = candidate.getEntry().metadata().getLong(rule.key());
        if (count.isPresent()) {
          factor = rule.logScaleFactor(count.getAsLong());
          reason = rule.key().getJsonName() + "=" + count.getAsLong();
        }
      } else if (rule.type() == BoostType.METADATA_MATCH) {
        for (String value : candidate.getEntry().metadata().getStringList(rule.key())) {
          String normalized = NoteAnalyzer.normalizeTag(value);
          if (queryTokens.contains(normalized)) {
            factor = rule.matchFactor();
            reason = rule.key().getJsonName() + " '" + value + "' matched query";
            break;
          }
        }
      }
      if (factor != 1.0) {
        total *= factor;
        candidate.addBoost(new BoostAnnotation(rule.type(), factor, reason));
      }
    }
    return total;
  }
}
