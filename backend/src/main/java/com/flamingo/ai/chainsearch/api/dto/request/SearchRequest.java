package com.flamingo.ai.chainsearch.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for semantic message search. Unset tuning fields use the configured defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 2000, message = "Query must not exceed 2000 characters")
  private String query;

  @DecimalMin(value = "0.0", message = "Threshold must be between 0 and 1")
  @DecimalMax(value = "1.0", message = "Threshold must be between 0 and 1")
  private Double similarityThreshold;

  @Min(value = 1, message = "At least one result must be requested")
  @Max(value = 50, message = "At most 50 results can be requested")
  private Integer maxResults;

  private Boolean includeChain;
}
