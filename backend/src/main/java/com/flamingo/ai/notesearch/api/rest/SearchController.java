package com.flamingo.ai.notesearch.api.rest;

import com.flamingo.ai.notesearch.api.dto.request.SearchRequest;
import com.flamingo.ai.notesearch.api.dto.response.SearchResponse;
import com.flamingo.ai.notesearch.service.search.HybridSearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for search queries. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

  private final HybridSearchService searchService;

  /** Searches with query parameters. */
  @GetMapping
  public ResponseEntity<SearchResponse> search(@Valid @ModelAttribute SearchRequest request) {
    return ResponseEntity.ok(SearchResponse.fromResult(searchService.search(request)));
  }

  /** Searches with a JSON body. */
  @PostMapping
  public ResponseEntity<SearchResponse> searchWithBody(
      @Valid @RequestBody SearchRequest request) {
    return ResponseEntity.ok(SearchResponse.fromResult(searchService.search(request)));
  }
}
