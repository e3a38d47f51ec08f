package com.bsk.recommender.service.demographic;

import java.util.Locale;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Lookup key of a demographic cluster. Text parts are trimmed and lower-cased on construction so
 * that "General" and "general " address the same cluster.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClusterSignature {

  int districtId;
  String gender;
  String caste;
  AgeBand ageBand;
  String religionGroup;

  public static ClusterSignature of(
      int districtId, String gender, String caste, AgeBand ageBand, String religionGroup) {
    return new ClusterSignature(
        districtId, normalize(gender), normalize(caste), ageBand, normalize(religionGroup));
  }

  private static String normalize(String value) {
    return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
  }
}
