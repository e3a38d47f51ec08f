package com.bsk.recommender.service.citizen;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/** One row of the citizen master file, before it is admitted into the directory. */
@Value
@Builder
public class CitizenRow {

  String citizenId;
  String phone;

  @ToString.Exclude String name;

  String gender;
  String caste;
  String religion;
  Integer age;
  Integer districtId;
}
