package com.bsk.recommender.service.policy;

import java.util.Set;

import com.bsk.recommender.service.catalog.ServiceFilter;
import com.bsk.recommender.service.demographic.AgeBand;
import com.google.common.collect.ImmutableSet;

import lombok.extern.slf4j.Slf4j;

/**
 * The filter every recommendation list passes through, whichever ranker produced it.
 *
 * <ul>
 *   <li>birth and death services are never recommended;
 *   <li>general-caste citizens are not steered towards caste-targeted benefits;
 *   <li>children only see services on the under-18 eligibility list, when one is deployed.
 * </ul>
 */
@Slf4j
public class RecommendationFilterPolicy {

  private static final ServiceFilter NOT_EXCLUDED = service -> !service.isExcludedCategory();

  private final String generalCaste;
  private final ImmutableSet<Integer> minorEligibleServiceIds;
  private final boolean restrictMinors;

  /**
   * @param generalCaste caste label that triggers the caste-targeted rule
   * @param minorEligibleServiceIds services open to under-18 citizens, empty when not deployed
   * @param restrictMinors whether the eligibility list is enforced
   */
  public RecommendationFilterPolicy(
      String generalCaste, Set<Integer> minorEligibleServiceIds, boolean restrictMinors) {
    this.generalCaste = generalCaste;
    this.minorEligibleServiceIds = ImmutableSet.copyOf(minorEligibleServiceIds);
    this.restrictMinors = restrictMinors;
    if (restrictMinors && this.minorEligibleServiceIds.isEmpty()) {
      log.info("No under-18 eligibility list loaded, minors see unrestricted recommendations");
    }
  }

  public ServiceFilter baseline() {
    return NOT_EXCLUDED;
  }

  public ServiceFilter forProfile(String caste, AgeBand ageBand) {
    ServiceFilter filter = NOT_EXCLUDED;
    if (isGeneralCaste(caste)) {
      filter = filter.and(service -> !service.isCasteTargeted());
    }
    if (restrictsMinor(ageBand)) {
      filter = filter.and(service -> minorEligibleServiceIds.contains(service.getId()));
    }
    return filter;
  }

  public boolean isGeneralCaste(String caste) {
    return caste != null && generalCaste != null && generalCaste.equalsIgnoreCase(caste.trim());
  }

  boolean restrictsMinor(AgeBand ageBand) {
    return restrictMinors && ageBand == AgeBand.CHILD && !minorEligibleServiceIds.isEmpty();
  }
}
