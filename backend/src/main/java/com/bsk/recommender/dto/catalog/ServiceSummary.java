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
public class ServiceSummary {

  @JsonProperty("service_id")
  private Integer serviceId;

  @JsonProperty("service_name")
  private String serviceName;
}
