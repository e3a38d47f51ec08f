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
public class ServiceUsageResponse {

  @JsonProperty("service_id")
  private Integer serviceId;

  @JsonProperty("service_name")
  private String serviceName;

  @JsonProperty("count")
  private Integer count;
}
