package com.bsk.recommender.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.bsk.recommender.dto.citizen.CitizenListResponse;
import com.bsk.recommender.dto.citizen.CitizenProfileResponse;
import com.bsk.recommender.dto.citizen.ServiceUsageResponse;
import com.bsk.recommender.dto.citizen.UsageHistoryResponse;
import com.bsk.recommender.service.RecommendationEngine;
import com.bsk.recommender.service.citizen.Citizen;
import com.bsk.recommender.service.recommendation.UsageHistory;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/citizen")
@RequiredArgsConstructor
@Tag(name = "Citizens", description = "Registered citizen lookup")
public class CitizenController {

  private final RecommendationEngine recommendationEngine;

  @GetMapping("/phone/{phone}")
  @Operation(
      summary = "Find citizens by phone number",
      description =
          "Returns every citizen registered under the number with the name masked. An unknown"
              + " number yields an empty list.")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Lookup completed"),
        @ApiResponse(
            responseCode = "503",
            description = "Citizen data is not part of this deployment",
            content = @Content)
      })
  public ResponseEntity<CitizenListResponse> getCitizensByPhone(@PathVariable String phone) {
    List<CitizenProfileResponse> citizens =
        recommendationEngine.lookupCitizenByPhone(phone).stream()
            .map(CitizenController::toProfile)
            .toList();
    return ResponseEntity.ok(CitizenListResponse.builder().citizens(citizens).build());
  }

  @GetMapping("/{citizenId}/services")
  @Operation(
      summary = "Service usage history",
      description = "Services the citizen has used, most used first")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "History retrieved")})
  public ResponseEntity<UsageHistoryResponse> getCitizenServices(@PathVariable String citizenId) {
    UsageHistory history = recommendationEngine.citizenUsageHistory(citizenId);
    List<ServiceUsageResponse> services =
        history.getServices().stream()
            .map(
                record ->
                    ServiceUsageResponse.builder()
                        .serviceId(record.getServiceId())
                        .serviceName(record.getServiceName())
                        .count(record.getCount())
                        .build())
            .toList();
    return ResponseEntity.ok(
        UsageHistoryResponse.builder()
            .services(services)
            .totalCount(history.getTotalUniqueServices())
            .build());
  }

  private static CitizenProfileResponse toProfile(Citizen citizen) {
    return CitizenProfileResponse.builder()
        .citizenId(citizen.getCitizenId())
        .name(citizen.getMaskedName())
        .gender(citizen.getGender())
        .age(citizen.getAge())
        .caste(citizen.getCaste())
        .religion(citizen.getReligion())
        .districtId(citizen.getDistrictId())
        .build();
  }
}
