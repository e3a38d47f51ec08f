package com.bsk.recommender.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.bsk.recommender.config.ApplicationProperties;
import com.bsk.recommender.dto.catalog.DistrictListResponse;
import com.bsk.recommender.dto.catalog.DistrictSummary;
import com.bsk.recommender.dto.catalog.HealthResponse;
import com.bsk.recommender.dto.catalog.ServiceListResponse;
import com.bsk.recommender.dto.catalog.ServiceSummary;
import com.bsk.recommender.service.RecommendationEngine;
import com.bsk.recommender.service.catalog.ServiceOffering;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Catalog", description = "Reference lists used to build a request")
public class CatalogController {

  private final RecommendationEngine recommendationEngine;
  private final ApplicationProperties applicationProperties;

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Reports service status and loaded tables")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(
        HealthResponse.builder()
            .status("healthy")
            .message("Bangla Sahayata Kendra API is running")
            .version(applicationProperties.getVersion())
            .tables(recommendationEngine.loadedTableCounts())
            .build());
  }

  @GetMapping("/districts")
  @Operation(summary = "List districts", description = "All districts ordered by id")
  @ApiResponses(
      value = {@ApiResponse(responseCode = "200", description = "Districts retrieved")})
  public ResponseEntity<DistrictListResponse> getDistricts() {
    List<DistrictSummary> districts =
        recommendationEngine.listDistricts().stream()
            .map(
                district ->
                    DistrictSummary.builder()
                        .districtId(district.getDistrictId())
                        .districtName(district.getDistrictName())
                        .build())
            .toList();
    return ResponseEntity.ok(DistrictListResponse.builder().districts(districts).build());
  }

  @GetMapping("/services")
  @Operation(
      summary = "List services",
      description =
          "All catalog services ordered by id. With selectable_only, services in excluded"
              + " categories are left out.")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Services retrieved")})
  public ResponseEntity<ServiceListResponse> getServices(
      @Parameter(description = "Only services that can be selected as the anchor")
          @RequestParam(name = "selectable_only", defaultValue = "false")
          boolean selectableOnly) {
    List<ServiceOffering> offerings =
        selectableOnly
            ? recommendationEngine.listSelectableServices()
            : recommendationEngine.listServices();
    List<ServiceSummary> services =
        offerings.stream()
            .map(
                service ->
                    ServiceSummary.builder()
                        .serviceId(service.getId())
                        .serviceName(service.getName())
                        .build())
            .toList();
    log.debug("Listing {} services (selectable only: {})", services.size(), selectableOnly);
    return ResponseEntity.ok(ServiceListResponse.builder().services(services).build());
  }
}
