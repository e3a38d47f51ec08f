package com.bsk.recommender.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.bsk.recommender.dto.recommendation.IdentityRecommendationRequest;
import com.bsk.recommender.dto.recommendation.ManualRecommendationRequest;
import com.bsk.recommender.dto.recommendation.RecommendationResponse;
import com.bsk.recommender.service.RecommendationEngine;
import com.bsk.recommender.service.recommendation.IdentityQuery;
import com.bsk.recommender.service.recommendation.ManualQuery;
import com.bsk.recommender.service.recommendation.RecommendationResult;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/recommend")
@RequiredArgsConstructor
@Tag(name = "Recommendations", description = "District, demographic and content recommendations")
public class RecommendationController {

  private final RecommendationEngine recommendationEngine;

  @PostMapping(
      value = "/phone",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Recommend for a registered citizen",
      description = "Uses the demographic attributes stored for the citizen")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Recommendations computed",
            content = @Content(schema = @Schema(implementation = RecommendationResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content),
        @ApiResponse(responseCode = "404", description = "Unknown citizen", content = @Content)
      })
  public ResponseEntity<RecommendationResponse> recommendForCitizen(
      @Valid @RequestBody IdentityRecommendationRequest request) {
    log.info(
        "Recommendation request for citizen {} (selected service {})",
        request.getCitizenId(),
        request.getSelectedServiceId());
    RecommendationResult result =
        recommendationEngine.recommend(
            IdentityQuery.builder()
                .citizenId(request.getCitizenId())
                .selectedServiceId(request.getSelectedServiceId())
                .build());
    return ResponseEntity.ok(toResponse(result));
  }

  @PostMapping(
      value = "/manual",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Recommend for manually entered attributes",
      description = "For citizens who are not registered or when lookup is unavailable")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Recommendations computed",
            content = @Content(schema = @Schema(implementation = RecommendationResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content)
      })
  public ResponseEntity<RecommendationResponse> recommendForManualEntry(
      @Valid @RequestBody ManualRecommendationRequest request) {
    log.info(
        "Manual recommendation request for district {} (selected service {})",
        request.getDistrictId(),
        request.getSelectedServiceId());
    RecommendationResult result =
        recommendationEngine.recommend(
            ManualQuery.builder()
                .districtId(request.getDistrictId())
                .gender(request.getGender())
                .caste(request.getCaste())
                .age(request.getAge())
                .religion(request.getReligion())
                .selectedServiceId(request.getSelectedServiceId())
                .build());
    return ResponseEntity.ok(toResponse(result));
  }

  private static RecommendationResponse toResponse(RecommendationResult result) {
    return RecommendationResponse.builder()
        .districtRecommendations(result.getDistrictRecommendations())
        .demographicRecommendations(result.getDemographicRecommendations())
        .contentRecommendations(result.getContentRecommendations())
        .build();
  }
}
