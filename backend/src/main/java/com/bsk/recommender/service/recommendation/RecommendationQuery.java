package com.bsk.recommender.service.recommendation;

/**
 * A request for the recommendation triple. Either an {@link IdentityQuery} naming a registered
 * citizen or a {@link ManualQuery} carrying the demographic attributes directly.
 */
public interface RecommendationQuery {

  /** The service the citizen picked, null when nothing was selected. */
  Integer getSelectedServiceId();
}
