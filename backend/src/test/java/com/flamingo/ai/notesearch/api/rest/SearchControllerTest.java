package com.flamingo.ai.notesearch.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.notesearch.api.dto.request.SearchRequest;
import com.flamingo.ai.notesearch.domain.enums.ItemStatus;
import com.flamingo.ai.notesearch.domain.enums.PipelineStage;
import com.flamingo.ai.notesearch.domain.model.Chunk;
import com.flamingo.ai.notesearch.domain.model.IndexEntry;
import com.flamingo.ai.notesearch.domain.model.Item;
import com.flamingo.ai.notesearch.domain.model.ItemMetadata;
import com.flamingo.ai.notesearch.domain.model.RetrievalCandidate;
import com.flamingo.ai.notesearch.exception.ApiError;
import com.flamingo.ai.notesearch.exception.GlobalExceptionHandler;
import com.flamingo.ai.notesearch.exception.SearchException;
import com.flamingo.ai.notesearch.exception.UnknownProfileException;
import com.flamingo.ai.notesearch.service.search.HybridSearchService;
import com.flamingo.ai.notesearch.service.search.SearchResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("SearchController Tests")
class SearchControllerTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @Mock private HybridSearchService searchService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new SearchController(searchService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper();
  }

  @Test
  @DisplayName("Should return ranked items with their score breakdown")
  void shouldReturnRankedItems() throws Exception {
    when(searchService.search(any(SearchRequest.class))).thenReturn(sampleResult());

    mockMvc
        .perform(get("/api/search").param("query", "kafka").param("limit", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.query").value("kafka"))
        .andExpect(jsonPath("$.total").value(2))
        .andExpect(jsonPath("$.results[0].id").value("essay"))
        .andExpect(jsonPath("$.results[0].chunk").value("part 2/3"))
        .andExpect(jsonPath("$.results[0].matchedChunks").value(2))
        .andExpect(jsonPath("$.results[0].scores.lexicalRank").value(1))
        .andExpect(jsonPath("$.results[1].id").value("kafka-notes"))
        .andExpect(jsonPath("$.results[1].type").value("note"))
        .andExpect(jsonPath("$.results[1].chunk").doesNotExist())
        .andExpect(jsonPath("$.skippedStages[0]").value("RERANK"));
  }

  @Test
  @DisplayName("Should bind query parameters into the request")
  void shouldBindQueryParameters() throws Exception {
    when(searchService.search(any(SearchRequest.class))).thenReturn(sampleResult());

    mockMvc
        .perform(
            get("/api/search")
                .param("query", "kafka")
                .param("profile", "recent")
                .param("includeStatuses", "ACTIVE", "HIDDEN")
                .param("rerank", "false"))
        .andExpect(status().isOk());

    ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
    verify(searchService).search(captor.capture());
    SearchRequest bound = captor.getValue();
    assertThat(bound.getProfile()).isEqualTo("recent");
    assertThat(bound.getIncludeStatuses())
        .containsExactlyInAnyOrder(ItemStatus.ACTIVE, ItemStatus.HIDDEN);
    assertThat(bound.getRerank()).isFalse();
  }

  @Test
  @DisplayName("Should accept a JSON body")
  void shouldAcceptJsonBody() throws Exception {
    when(searchService.search(any(SearchRequest.class))).thenReturn(sampleResult());
    SearchRequest request = SearchRequest.builder().query("kafka").limit(10).build();

    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.corpus").value("notes"));
  }

  @Test
  @DisplayName("Should reject a blank query")
  void shouldRejectBlankQuery() throws Exception {
    mockMvc
        .perform(get("/api/search").param("query", " "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verify(searchService, never()).search(any(SearchRequest.class));
  }

  @Test
  @DisplayName("Should reject a limit above 100")
  void shouldRejectLargeLimit() throws Exception {
    mockMvc
        .perform(get("/api/search").param("query", "kafka").param("limit", "101"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value(containsString("limit")));
  }

  @Test
  @DisplayName("Should answer 400 for an unknown profile")
  void shouldRejectUnknownProfile() throws Exception {
    when(searchService.search(any(SearchRequest.class)))
        .thenThrow(new UnknownProfileException("nope", List.of("default", "repos")));

    mockMvc
        .perform(get("/api/search").param("query", "kafka").param("profile", "nope"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("PROFILE_001"))
        .andExpect(jsonPath("$.message").value(containsString("default, repos")));
  }

  @Test
  @DisplayName("Should answer 503 naming the corpus when its index is unavailable")
  void shouldReturnUnavailableWithoutIndex() throws Exception {
    when(searchService.search(any(SearchRequest.class)))
        .thenThrow(new SearchException("notes", "Index of corpus notes is not available"));

    mockMvc
        .perform(get("/api/search").param("query", "kafka"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value(ApiError.SEARCH_FAILED))
        .andExpect(jsonPath("$.message").value(containsString("corpus 'notes'")))
        .andExpect(jsonPath("$.message").value(containsString("Reindex")));
  }

  private static SearchResult sampleResult() {
    Item essay = Item.builder().id("essay").title("Essay").body("x".repeat(30)).build();
    RetrievalCandidate chunk =
        new RetrievalCandidate(
            IndexEntry.ofChunk(essay, new Chunk("essay", 1, 3, 8, 20, "x".repeat(12), "Essay")));
    chunk.setLexicalRank(1);
    chunk.setLexicalScore(3.2);
    chunk.setSiblingCount(1);
    chunk.setScore(0.04);

    Item notes =
        Item.builder()
            .id("kafka-notes")
            .title("Kafka notes")
            .body("Consumer groups")
            .tags(Set.of("streaming"))
            .metadata(ItemMetadata.fromMap(Map.of("type", "note")))
            .build();
    RetrievalCandidate whole = new RetrievalCandidate(IndexEntry.ofItem(notes));
    whole.setVectorRank(1);
    whole.setVectorScore(0.91);
    whole.setScore(0.02);

    return new SearchResult(
        "kafka",
        "kafka",
        "notes",
        "default",
        List.of(chunk, whole),
        List.of(PipelineStage.RERANK),
        false,
        12);
  }
}
