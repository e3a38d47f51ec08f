package com.bsk.recommender.service.catalog;

import lombok.Builder;
import lombok.Value;

/** A government service a citizen can apply for at a Sahayata Kendra. */
@Value
@Builder(toBuilder = true)
public class ServiceOffering {

  int id;
  String name;

  /** Department or category the service belongs to, empty when unknown. */
  String domain;

  /** Birth and death registrations never appear in any recommendation. */
  boolean excludedCategory;

  /** Benefits targeted at reserved castes. */
  boolean casteTargeted;
}
