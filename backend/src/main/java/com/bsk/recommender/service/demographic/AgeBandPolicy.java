package com.bsk.recommender.service.demographic;

/**
 * Maps an age to its {@link AgeBand}. The bounds must match the ones the cluster map was built
 * with, so they come from configuration rather than from this class.
 */
public class AgeBandPolicy {

  private final int adultFrom;
  private final int elderlyFrom;
  private final AgeBand unknownAgeBand;

  public AgeBandPolicy(int adultFrom, int elderlyFrom, AgeBand unknownAgeBand) {
    if (adultFrom <= 0 || elderlyFrom <= adultFrom) {
      throw new IllegalArgumentException(
          "Age band bounds must satisfy 0 < adultFrom < elderlyFrom, got "
              + adultFrom
              + " and "
              + elderlyFrom);
    }
    this.adultFrom = adultFrom;
    this.elderlyFrom = elderlyFrom;
    this.unknownAgeBand = unknownAgeBand;
  }

  /**
   * @param age age in years, null when unknown
   * @throws IllegalArgumentException for a negative age
   */
  public AgeBand bandFor(Integer age) {
    if (age == null) {
      return unknownAgeBand;
    }
    if (age < 0) {
      throw new IllegalArgumentException("Age must not be negative: " + age);
    }
    if (age < adultFrom) {
      return AgeBand.CHILD;
    }
    return age < elderlyFrom ? AgeBand.YOUTH : AgeBand.ELDERLY;
  }
}
