package com.bsk.recommender.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.bsk.recommender.service.catalog.ServiceCatalog;
import com.bsk.recommender.service.citizen.CitizenDirectory;
import com.bsk.recommender.service.data_processing.ReferenceDataLoader;
import com.bsk.recommender.service.demographic.AgeBand;
import com.bsk.recommender.service.demographic.AgeBandPolicy;
import com.bsk.recommender.service.demographic.ClusterSignatureFactory;
import com.bsk.recommender.service.demographic.DemographicClusterMap;
import com.bsk.recommender.service.district.DistrictRanker;
import com.bsk.recommender.service.policy.RecommendationFilterPolicy;
import com.bsk.recommender.service.similarity.ContentSimilarityIndex;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds the read-only lookup structures from the reference tables. The catalog bean comes first,
 * every other table is validated against it.
 */
@Slf4j
@Configuration
public class ReferenceDataConfig {

  @Bean
  public ServiceCatalog serviceCatalog(ReferenceDataLoader loader) {
    return loader.loadServiceCatalog();
  }

  @Bean
  public DistrictRanker districtRanker(ReferenceDataLoader loader, ServiceCatalog catalog) {
    return loader.loadDistrictRanker(catalog);
  }

  @Bean
  public AgeBandPolicy ageBandPolicy(ApplicationProperties properties) {
    ApplicationProperties.AgeBands bands = properties.getAgeBands();
    AgeBand unknown =
        AgeBand.fromLabel(bands.getUnknownAgeBand())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Unknown age band '" + bands.getUnknownAgeBand() + "'"));
    return new AgeBandPolicy(bands.getAdultFrom(), bands.getElderlyFrom(), unknown);
  }

  @Bean
  public ClusterSignatureFactory clusterSignatureFactory(
      AgeBandPolicy ageBandPolicy, ApplicationProperties properties) {
    ApplicationProperties.Policy policy = properties.getPolicy();
    return new ClusterSignatureFactory(
        ageBandPolicy, policy.getMajorityReligion(), policy.getMinorityReligionGroup());
  }

  @Bean
  public DemographicClusterMap demographicClusterMap(
      ReferenceDataLoader loader, ServiceCatalog catalog) {
    return loader.loadDemographicClusterMap(catalog);
  }

  @Bean
  public ContentSimilarityIndex contentSimilarityIndex(
      ReferenceDataLoader loader, ServiceCatalog catalog) {
    return loader.loadContentSimilarityIndex(catalog);
  }

  @Bean
  public CitizenDirectory citizenDirectory(ReferenceDataLoader loader, ServiceCatalog catalog) {
    return loader.loadCitizenDirectory(catalog);
  }

  @Bean
  public RecommendationFilterPolicy recommendationFilterPolicy(
      ReferenceDataLoader loader, ServiceCatalog catalog, ApplicationProperties properties) {
    ApplicationProperties.Policy policy = properties.getPolicy();
    RecommendationFilterPolicy filterPolicy =
        new RecommendationFilterPolicy(
            policy.getGeneralCaste(),
            loader.loadMinorEligibleServices(catalog),
            policy.isRestrictMinorsToEligibleServices());
    if (loader.getIntegrityLog().getDroppedReferences() > 0) {
      log.warn(
          "Reference data loaded with {} dropped references to {} unknown services",
          loader.getIntegrityLog().getDroppedReferences(),
          loader.getIntegrityLog().getOffendingServiceCount());
    }
    return filterPolicy;
  }
}
