package com.bsk.recommender.service.recommendation;

import lombok.Builder;
import lombok.Value;

/** Demographic attributes entered by the operator for a citizen who is not registered. */
@Value
@Builder
public class ManualQuery implements RecommendationQuery {

  Integer districtId;
  String gender;
  String caste;
  Integer age;
  String religion;
  Integer selectedServiceId;
}
