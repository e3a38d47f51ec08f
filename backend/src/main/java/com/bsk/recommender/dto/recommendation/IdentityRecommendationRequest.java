package com.bsk.recommender.dto.recommendation;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdentityRecommendationRequest {

  @NotBlank
  @JsonProperty("citizen_id")
  private String citizenId;

  @JsonProperty("selected_service_id")
  private Integer selectedServiceId;
}
