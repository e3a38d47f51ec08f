package com.bsk.recommender.service.demographic;

/** Turns raw demographic attributes into the signature the cluster map is keyed by. */
public class ClusterSignatureFactory {

  private final AgeBandPolicy ageBandPolicy;
  private final String majorityReligion;
  private final String minorityReligionGroup;

  public ClusterSignatureFactory(
      AgeBandPolicy ageBandPolicy, String majorityReligion, String minorityReligionGroup) {
    this.ageBandPolicy = ageBandPolicy;
    this.majorityReligion = majorityReligion;
    this.minorityReligionGroup = minorityReligionGroup;
  }

  public ClusterSignature signatureFor(
      int districtId, String gender, String caste, Integer age, String religion) {
    return ClusterSignature.of(
        districtId, gender, caste, ageBandFor(age), religionGroupOf(religion));
  }

  public AgeBand ageBandFor(Integer age) {
    return ageBandPolicy.bandFor(age);
  }

  /** The majority religion keeps its own group, everything else (blank included) is grouped. */
  public String religionGroupOf(String religion) {
    if (religion != null && religion.trim().equalsIgnoreCase(majorityReligion)) {
      return majorityReligion;
    }
    return minorityReligionGroup;
  }
}
