package com.bsk.recommender.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.bsk.recommender.config.ApplicationProperties;
import com.bsk.recommender.exception.CitizenDataUnavailableException;
import com.bsk.recommender.exception.CitizenNotFoundException;
import com.bsk.recommender.exception.InvalidQueryException;
import com.bsk.recommender.service.catalog.ServiceCatalog;
import com.bsk.recommender.service.catalog.ServiceFilter;
import com.bsk.recommender.service.catalog.ServiceOffering;
import com.bsk.recommender.service.citizen.Citizen;
import com.bsk.recommender.service.citizen.CitizenDirectory;
import com.bsk.recommender.service.citizen.ServiceUsageRecord;
import com.bsk.recommender.service.demographic.AgeBand;
import com.bsk.recommender.service.demographic.ClusterSignature;
import com.bsk.recommender.service.demographic.ClusterSignatureFactory;
import com.bsk.recommender.service.demographic.DemographicClusterMap;
import com.bsk.recommender.service.district.District;
import com.bsk.recommender.service.district.DistrictRanker;
import com.bsk.recommender.service.policy.RecommendationFilterPolicy;
import com.bsk.recommender.service.recommendation.AnchorBudget;
import com.bsk.recommender.service.recommendation.IdentityQuery;
import com.bsk.recommender.service.recommendation.ManualQuery;
import com.bsk.recommender.service.recommendation.RecommendationQuery;
import com.bsk.recommender.service.recommendation.RecommendationResult;
import com.bsk.recommender.service.recommendation.UsageHistory;
import com.bsk.recommender.service.similarity.ContentSimilarityIndex;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers recommendation queries from the loaded reference tables. Both query modes are reduced to
 * one demographic profile and then run through the same pipeline: district list, demographic list
 * and content suggestions, each filtered by the same {@link ServiceFilter} before truncation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationEngine {

  private final ServiceCatalog catalog;
  private final CitizenDirectory citizenDirectory;
  private final DistrictRanker districtRanker;
  private final ClusterSignatureFactory signatureFactory;
  private final DemographicClusterMap clusterMap;
  private final ContentSimilarityIndex similarityIndex;
  private final RecommendationFilterPolicy filterPolicy;
  private final ApplicationProperties properties;

  /**
   * Citizens registered under a phone number, names masked.
   *
   * @throws CitizenDataUnavailableException when the deployment has no citizen data
   */
  public List<Citizen> lookupCitizenByPhone(String phone) {
    if (!citizenDirectory.isAvailable()) {
      throw new CitizenDataUnavailableException();
    }
    List<Citizen> citizens = citizenDirectory.findByPhone(phone);
    log.debug("Phone lookup matched {} citizens", citizens.size());
    return citizens;
  }

  public UsageHistory citizenUsageHistory(String citizenId) {
    List<ServiceUsageRecord> services = citizenDirectory.usageHistory(citizenId);
    return new UsageHistory(services.size(), services);
  }

  public RecommendationResult recommend(RecommendationQuery query) {
    if (query instanceof IdentityQuery) {
      return recommendForCitizen((IdentityQuery) query);
    }
    if (query instanceof ManualQuery) {
      return recommendForManualEntry((ManualQuery) query);
    }
    throw new InvalidQueryException(
        "Unsupported query type: " + (query == null ? "null" : query.getClass().getSimpleName()));
  }

  public List<ServiceOffering> listServices() {
    return catalog.listAll();
  }

  /** Services that can be picked as the anchor of a request. */
  public List<ServiceOffering> listSelectableServices() {
    return catalog.listRecommendable();
  }

  public List<District> listDistricts() {
    return districtRanker.listDistricts();
  }

  /** Sizes of the loaded tables, for the health endpoint. */
  public Map<String, Integer> loadedTableCounts() {
    Map<String, Integer> counts = new LinkedHashMap<>();
    counts.put("services", catalog.size());
    counts.put("districts", districtRanker.size());
    counts.put("cluster_signatures", clusterMap.signatureCount());
    counts.put("clusters", clusterMap.clusterCount());
    counts.put("similarity_anchors", similarityIndex.size());
    counts.put("citizens", citizenDirectory.size());
    return counts;
  }

  private RecommendationResult recommendForCitizen(IdentityQuery query) {
    if (query.getCitizenId() == null || query.getCitizenId().isBlank()) {
      throw new InvalidQueryException("citizen_id is required");
    }
    Citizen citizen =
        citizenDirectory
            .findById(query.getCitizenId())
            .orElseThrow(() -> new CitizenNotFoundException(query.getCitizenId()));
    log.debug("Identity query for citizen {}", citizen.getCitizenId());

    List<Integer> anchors = new ArrayList<>();
    if (properties.getContent().isIncludeUsageHistory()) {
      citizenDirectory
          .usageHistory(citizen.getCitizenId())
          .forEach(record -> anchors.add(record.getServiceId()));
    }
    Integer selected = query.getSelectedServiceId();
    if (selected != null && !anchors.contains(selected)) {
      anchors.add(selected);
    }

    return run(
        citizen.getDistrictId(),
        citizen.getGender(),
        citizen.getCaste(),
        citizen.getAge(),
        citizen.getReligion(),
        anchors,
        selected);
  }

  private RecommendationResult recommendForManualEntry(ManualQuery query) {
    validate(query);
    Integer selected = query.getSelectedServiceId();
    return run(
        query.getDistrictId(),
        query.getGender(),
        query.getCaste(),
        query.getAge(),
        query.getReligion(),
        selected == null ? List.of() : List.of(selected),
        selected);
  }

  private static void validate(ManualQuery query) {
    if (query.getDistrictId() == null) {
      throw new InvalidQueryException("district_id is required");
    }
    requireText(query.getGender(), "gender");
    requireText(query.getCaste(), "caste");
    requireText(query.getReligion(), "religion");
    if (query.getAge() == null) {
      throw new InvalidQueryException("age is required");
    }
    if (query.getAge() < 0) {
      throw new InvalidQueryException("age must not be negative");
    }
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new InvalidQueryException(field + " is required");
    }
  }

  private RecommendationResult run(
      Integer districtId,
      String gender,
      String caste,
      Integer age,
      String religion,
      List<Integer> anchors,
      Integer selectedServiceId) {
    AgeBand ageBand = signatureFactory.ageBandFor(age);
    ServiceFilter filter = filterPolicy.forProfile(caste, ageBand);

    List<String> district = List.of();
    List<String> demographic = List.of();
    if (districtId != null) {
      district = districtRanker.recommend(districtId, filter);
      ClusterSignature signature =
          signatureFactory.signatureFor(districtId, gender, caste, age, religion);
      demographic = clusterMap.recommend(signature, filter);
    } else {
      log.debug("Profile has no district, skipping district and demographic lists");
    }

    Map<String, List<String>> content = contentRecommendations(anchors, selectedServiceId, filter);
    log.debug(
        "Recommendations ready: {} district, {} demographic, {} content anchors",
        district.size(),
        demographic.size(),
        content.size());

    return RecommendationResult.builder()
        .districtRecommendations(district)
        .demographicRecommendations(demographic)
        .contentRecommendations(content)
        .build();
  }

  private Map<String, List<String>> contentRecommendations(
      List<Integer> anchors, Integer selectedServiceId, ServiceFilter filter) {
    Map<String, List<String>> content = new LinkedHashMap<>();
    if (anchors.isEmpty()) {
      return content;
    }

    if (!properties.getContent().isIncludeUsageHistory()) {
      catalog
          .resolveName(selectedServiceId)
          .ifPresentOrElse(
              name -> content.put(name, similarityIndex.recommend(selectedServiceId, filter)),
              () -> log.debug("Selected service {} does not resolve", selectedServiceId));
      return content;
    }

    ApplicationProperties.Content settings = properties.getContent();
    Map<Integer, Integer> budget =
        AnchorBudget.allocate(
            anchors,
            selectedServiceId,
            settings.getTotalRecommendations(),
            settings.getSelectedServiceShare());
    budget.forEach(
        (anchor, limit) -> {
          boolean isSelected = anchor.equals(selectedServiceId);
          Optional<String> name = catalog.resolveName(anchor);
          if (name.isEmpty() || (limit <= 0 && !isSelected)) {
            return;
          }
          List<String> similar = similarityIndex.recommend(anchor, filter, limit);
          if (isSelected || !similar.isEmpty()) {
            content.put(name.get(), similar);
          }
        });
    return content;
  }
}
