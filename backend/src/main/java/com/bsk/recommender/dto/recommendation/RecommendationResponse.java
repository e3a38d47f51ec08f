package com.bsk.recommender.dto.recommendation;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResponse {

  @JsonProperty("district_recommendations")
  private List<String> districtRecommendations;

  @JsonProperty("demographic_recommendations")
  private List<String> demographicRecommendations;

  @JsonProperty("content_recommendations")
  private Map<String, List<String>> contentRecommendations;
}
