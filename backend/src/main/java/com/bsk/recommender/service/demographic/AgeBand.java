package com.bsk.recommender.service.demographic;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Age groups the demographic clusters were built on. */
@Getter
@RequiredArgsConstructor
public enum AgeBand {
  CHILD("child"),
  YOUTH("youth"),
  ELDERLY("elderly");

  /** Label used in the cluster map artifact. */
  private final String label;

  public static Optional<AgeBand> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String normalized = label.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(band -> band.label.equals(normalized) || band.name().equalsIgnoreCase(normalized))
        .findFirst();
  }
}
