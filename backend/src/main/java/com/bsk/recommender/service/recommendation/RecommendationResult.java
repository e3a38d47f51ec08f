package com.bsk.recommender.service.recommendation;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecommendationResult {

  List<String> districtRecommendations;
  List<String> demographicRecommendations;

  /** Similar services keyed by the anchor service name, in anchor order. */
  Map<String, List<String>> contentRecommendations;
}
