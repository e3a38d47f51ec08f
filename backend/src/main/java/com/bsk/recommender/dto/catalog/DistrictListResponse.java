package com.bsk.recommender.dto.catalog;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistrictListResponse {

  @JsonProperty("districts")
  private List<DistrictSummary> districts;
}
