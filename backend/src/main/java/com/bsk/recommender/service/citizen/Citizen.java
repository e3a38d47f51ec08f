package com.bsk.recommender.service.citizen;

import lombok.Builder;
import lombok.Value;

/**
 * A registered citizen as exposed by {@link CitizenDirectory}. Only the masked form of the name
 * exists here; the real name never leaves the directory.
 */
@Value
@Builder
public class Citizen {

  String citizenId;
  String phone;
  String maskedName;
  String gender;
  String caste;
  String religion;

  /** Null when the source has no usable age. */
  Integer age;

  Integer districtId;
}
