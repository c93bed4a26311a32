package com.flamingo.ai.notesearch.service.rerank;

import com.flamingo.ai.notesearch.config.SearchConfig;
import io.netty.channel.ChannelOption;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * HTTP client for the Hugging Face TEI (Text Embeddings Inference) {@code /rerank} endpoint.
 * Encapsulates all WebClient communication with the TEI container.
 */
@Component
@ConditionalOnProperty(
    name = "search.reranking.strategy",
    havingValue = "tei",
    matchIfMissing = true)
@Slf4j
public class TeiRerankerClient {

  private final WebClient webClient;
  private final int readTimeoutMs;
  private final boolean rawScores;
  private final boolean truncate;

  public TeiRerankerClient(SearchConfig searchConfig) {
    SearchConfig.Reranking.Tei tei = searchConfig.getReranking().getTei();
    this.readTimeoutMs = tei.getReadTimeoutMs();
    this.rawScores = tei.isRawScores();
    this.truncate = tei.isTruncate();
    HttpClient httpClient =
        HttpClient.create().option(ChannelOption.CONNECT_TIMEOUT_MILLIS, tei.getConnectTimeoutMs());
    this.webClient =
        WebClient.builder()
            .baseUrl(tei.getBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    log.info(
        "TEI reranker client initialized: baseUrl={}, model={}",
        tei.getBaseUrl(),
        tei.getModelId());
  }

  /**
   * Calls TEI /rerank to score texts against a query.
   *
   * @param query the search query
   * @param texts the candidate texts to score
   * @return list of results with index and score, sorted by score descending by TEI
   */
  public List<RerankScore> rerank(String query, List<String> texts) {
    var request = new TeiRerankRequest(query, texts, rawScores, truncate);
    return webClient
        .post()
        .uri("/rerank")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(request)
        .retrieve()
        .bodyToFlux(RerankScore.class)
        .collectList()
        .timeout(Duration.ofMillis(readTimeoutMs))
        .block();
  }

  record TeiRerankRequest(String query, List<String> texts, boolean raw_scores, boolean truncate) {}

  /** TEI rerank response element. */
  public record RerankScore(int index, double score) {}
}
