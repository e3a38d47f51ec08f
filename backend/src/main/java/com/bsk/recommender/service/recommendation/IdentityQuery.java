package com.bsk.recommender.service.recommendation;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IdentityQuery implements RecommendationQuery {

  String citizenId;
  Integer selectedServiceId;
}
