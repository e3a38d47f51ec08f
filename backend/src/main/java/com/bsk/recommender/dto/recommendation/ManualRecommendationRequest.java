package com.bsk.recommender.dto.recommendation;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualRecommendationRequest {

  @NotNull
  @JsonProperty("district_id")
  private Integer districtId;

  @NotBlank
  @JsonProperty("gender")
  private String gender;

  @NotBlank
  @JsonProperty("caste")
  private String caste;

  @NotNull
  @Min(0)
  @JsonProperty("age")
  private Integer age;

  @NotBlank
  @JsonProperty("religion")
  private String religion;

  @NotNull
  @JsonProperty("selected_service_id")
  private Integer selectedServiceId;
}
