package com.bsk.recommender.dto.catalog;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

  @JsonProperty("status")
  private String status;

  @JsonProperty("message")
  private String message;

  @JsonProperty("version")
  private String version;

  /** Row counts of the loaded reference tables. */
  @JsonProperty("tables")
  private Map<String, Integer> tables;
}
