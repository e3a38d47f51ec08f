package com.bsk.recommender.dto.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistrictSummary {

  @JsonProperty("district_id")
  private Integer districtId;

  @JsonProperty("district_name")
  private String districtName;
}
