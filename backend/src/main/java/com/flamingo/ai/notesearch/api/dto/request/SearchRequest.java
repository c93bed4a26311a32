package com.flamingo.ai.notesearch.api.dto.request;

import com.flamingo.ai.notesearch.domain.enums.ItemStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a search. Bound from query parameters on GET and from the JSON body on POST.
 * Unset toggles fall back to the profile.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 1000, message = "Query must not exceed 1000 characters")
  private String query;

  /** Corpus name. If null, uses the default corpus. */
  private String corpus;

  /** Profile name. If null, uses the default profile. */
  private String profile;

  @Min(value = 1, message = "Limit must be at least 1")
  @Max(value = 100, message = "Limit must not exceed 100")
  private Integer limit;

  @DecimalMin(value = "0.0", message = "Minimum score must not be negative")
  private Double minScore;

  /** If set, only these statuses are returned. Otherwise only active items are. */
  private Set<ItemStatus> includeStatuses;

  private Set<ItemStatus> excludeStatuses;
  private List<String> includeTypes;
  private List<String> excludeTypes;

  private Boolean expansion;
  private Boolean tagBoost;
  private Boolean metadataBoost;
  private Boolean timeDecay;
  private Boolean rerank;
}
