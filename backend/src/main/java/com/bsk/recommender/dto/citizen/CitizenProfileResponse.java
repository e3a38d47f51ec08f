package com.bsk.recommender.dto.citizen;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CitizenProfileResponse {

  @JsonProperty("citizen_id")
  private String citizenId;

  /** Always the masking token, never the registered name. */
  @JsonProperty("name")
  private String name;

  @JsonProperty("gender")
  private String gender;

  /** Null when the registry has no usable age. */
  @JsonProperty("age")
  private Integer age;

  @JsonProperty("caste")
  private String caste;

  @JsonProperty("religion")
  private String religion;

  @JsonProperty("district_id")
  private Integer districtId;
}
