package com.bsk.recommender.service;

import static com.bsk.recommender.fixtures.TestFixtures.KANYASHREE;
import static com.bsk.recommender.fixtures.TestFixtures.REGISTERED_CITIZEN;
import static com.bsk.recommender.fixtures.TestFixtures.REGISTERED_PHONE;
import static com.bsk.recommender.fixtures.TestFixtures.STUDENT_CREDIT_CARD;
import static com.bsk.recommender.fixtures.TestFixtures.SWASTHYA_SATHI;
import static com.bsk.recommender.fixtures.TestFixtures.UNKNOWN_SERVICE;
import static com.bsk.recommender.fixtures.TestFixtures.UNREGISTERED_PHONE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.bsk.recommender.config.ApplicationProperties;
import com.bsk.recommender.exception.CitizenDataUnavailableException;
import com.bsk.recommender.exception.CitizenNotFoundException;
import com.bsk.recommender.exception.InvalidQueryException;
import com.bsk.recommender.fixtures.TestFixtures;
import com.bsk.recommender.service.catalog.ServiceCatalog;
import com.bsk.recommender.service.catalog.ServiceOffering;
import com.bsk.recommender.service.citizen.Citizen;
import com.bsk.recommender.service.citizen.CitizenDirectory;
import com.bsk.recommender.service.data_processing.ReferenceDataLoader;
import com.bsk.recommender.service.demographic.AgeBand;
import com.bsk.recommender.service.demographic.AgeBandPolicy;
import com.bsk.recommender.service.demographic.ClusterSignatureFactory;
import com.bsk.recommender.service.demographic.DemographicClusterMap;
import com.bsk.recommender.service.district.DistrictRanker;
import com.bsk.recommender.service.policy.RecommendationFilterPolicy;
import com.bsk.recommender.service.recommendation.IdentityQuery;
import com.bsk.recommender.service.recommendation.ManualQuery;
import com.bsk.recommender.service.recommendation.RecommendationQuery;
import com.bsk.recommender.service.recommendation.RecommendationResult;
import com.bsk.recommender.service.recommendation.UsageHistory;
import com.bsk.recommender.service.similarity.ContentSimilarityIndex;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecommendationEngine Tests")
class RecommendationEngineTest {

  private static final List<String> KOLKATA_GENERAL =
      List.of(
          "Swasthya Sathi",
          "Ration Card",
          "Lakshmir Bhandar",
          "Student Credit Card",
          "Trade License");

  private static RecommendationEngine fixtureEngine(ApplicationProperties properties) {
    ReferenceDataLoader loader = TestFixtures.fixtureLoader(properties);
    ServiceCatalog catalog = loader.loadServiceCatalog();
    ClusterSignatureFactory signatureFactory =
        new ClusterSignatureFactory(
            new AgeBandPolicy(18, 60, AgeBand.YOUTH), "Hindu", "Minority");
    return new RecommendationEngine(
        catalog,
        loader.loadCitizenDirectory(catalog),
        loader.loadDistrictRanker(catalog),
        signatureFactory,
        loader.loadDemographicClusterMap(catalog),
        loader.loadContentSimilarityIndex(catalog),
        new RecommendationFilterPolicy("General", loader.loadMinorEligibleServices(catalog), true),
        properties);
  }

  @Nested
  @DisplayName("Query validation")
  class QueryValidation {

    @Mock private ServiceCatalog catalog;
    @Mock private CitizenDirectory citizenDirectory;
    @Mock private DistrictRanker districtRanker;
    @Mock private ClusterSignatureFactory signatureFactory;
    @Mock private DemographicClusterMap clusterMap;
    @Mock private ContentSimilarityIndex similarityIndex;
    @Mock private RecommendationFilterPolicy filterPolicy;

    private RecommendationEngine engine;

    @BeforeEach
    void setUp() {
      engine =
          new RecommendationEngine(
              catalog,
              citizenDirectory,
              districtRanker,
              signatureFactory,
              clusterMap,
              similarityIndex,
              filterPolicy,
              new ApplicationProperties());
    }

    @Test
    void unknownCitizenShouldFailBeforeAnyRankerIsTouched() {
      when(citizenDirectory.findById("GRPA_00000000")).thenReturn(Optional.empty());

      assertThatThrownBy(
              () ->
                  engine.recommend(
                      IdentityQuery.builder()
                          .citizenId("GRPA_00000000")
                          .selectedServiceId(STUDENT_CREDIT_CARD)
                          .build()))
          .isInstanceOf(CitizenNotFoundException.class)
          .hasMessageContaining("GRPA_00000000");

      verifyNoInteractions(districtRanker, clusterMap, similarityIndex, filterPolicy, catalog);
    }

    @Test
    void blankCitizenIdShouldBeRejected() {
      assertThatThrownBy(() -> engine.recommend(IdentityQuery.builder().citizenId(" ").build()))
          .isInstanceOf(InvalidQueryException.class);

      verifyNoInteractions(citizenDirectory, districtRanker, clusterMap, similarityIndex);
    }

    @Test
    void negativeManualAgeShouldBeRejectedWithoutLookups() {
      ManualQuery query =
          ManualQuery.builder()
              .districtId(1)
              .gender("Male")
              .caste("General")
              .age(-4)
              .religion("Hindu")
              .selectedServiceId(STUDENT_CREDIT_CARD)
              .build();

      assertThatThrownBy(() -> engine.recommend(query))
          .isInstanceOf(InvalidQueryException.class)
          .hasMessageContaining("age");

      verifyNoInteractions(
          citizenDirectory, districtRanker, clusterMap, similarityIndex, signatureFactory);
    }

    @Test
    void missingManualFieldShouldBeRejected() {
      ManualQuery query =
          ManualQuery.builder().districtId(1).gender("Male").age(30).religion("Hindu").build();

      assertThatThrownBy(() -> engine.recommend(query))
          .isInstanceOf(InvalidQueryException.class)
          .hasMessageContaining("caste");
    }

    @Test
    void unsupportedQueryTypeShouldBeRejected() {
      RecommendationQuery other = () -> STUDENT_CREDIT_CARD;

      assertThatThrownBy(() -> engine.recommend(other)).isInstanceOf(InvalidQueryException.class);
      assertThatThrownBy(() -> engine.recommend(null)).isInstanceOf(InvalidQueryException.class);
    }

    @Test
    void phoneLookupWithoutCitizenDataShouldFail() {
      when(citizenDirectory.isAvailable()).thenReturn(false);

      assertThatThrownBy(() -> engine.lookupCitizenByPhone(REGISTERED_PHONE))
          .isInstanceOf(CitizenDataUnavailableException.class);
    }
  }

  @Nested
  @DisplayName("Recommendations over fixture data")
  class FixtureRecommendations {

    private RecommendationEngine engine;

    @BeforeEach
    void setUp() {
      engine = fixtureEngine(TestFixtures.fixtureProperties());
    }

    @Test
    void registeredCitizenShouldReceiveAllThreeLists() {
      RecommendationResult result =
          engine.recommend(
              IdentityQuery.builder()
                  .citizenId(REGISTERED_CITIZEN)
                  .selectedServiceId(STUDENT_CREDIT_CARD)
                  .build());

      assertThat(result.getDistrictRecommendations()).containsExactlyElementsOf(KOLKATA_GENERAL);
      assertThat(result.getDemographicRecommendations())
          .containsExactly(
              "Old Age Pension",
              "Student Credit Card",
              "Krishak Bandhu",
              "Swasthya Sathi",
              "Ration Card");
      assertThat(result.getContentRecommendations()).containsOnlyKeys("Student Credit Card");
      assertThat(result.getContentRecommendations().get("Student Credit Card"))
          .containsExactly(
              "Kanyashree",
              "Aikyashree Scholarship",
              "Trade License",
              "Swasthya Sathi",
              "Lakshmir Bhandar");
    }

    @Test
    void generalCasteListsShouldNeverContainCasteTargetedServices() {
      RecommendationResult result =
          engine.recommend(
              IdentityQuery.builder()
                  .citizenId(REGISTERED_CITIZEN)
                  .selectedServiceId(STUDENT_CREDIT_CARD)
                  .build());

      assertThat(result.getDistrictRecommendations()).doesNotContain("Caste Certificate");
      assertThat(result.getDemographicRecommendations())
          .doesNotContain("Caste Certificate", "Scholarship for SC/ST Caste Students");
      assertThat(result.getContentRecommendations().get("Student Credit Card"))
          .doesNotContain("Caste Certificate", "Scholarship for SC/ST Caste Students");
    }

    @Test
    void sameSignatureWithOtherCasteMayReceiveCasteTargetedServices() {
      RecommendationResult result =
          engine.recommend(
              ManualQuery.builder()
                  .districtId(1)
                  .gender("Male")
                  .caste("SC")
                  .age(30)
                  .religion("Hindu")
                  .selectedServiceId(STUDENT_CREDIT_CARD)
                  .build());

      assertThat(result.getDemographicRecommendations())
          .startsWith("Scholarship for SC/ST Caste Students", "Caste Certificate");
      assertThat(result.getDistrictRecommendations()).startsWith("Caste Certificate");
    }

    @Test
    void manualQueryWithoutSelectionShouldReturnEmptyContent() {
      RecommendationResult result =
          engine.recommend(
              ManualQuery.builder()
                  .districtId(1)
                  .gender("Male")
                  .caste("General")
                  .age(30)
                  .religion("Hindu")
                  .build());

      assertThat(result.getDistrictRecommendations()).containsExactlyElementsOf(KOLKATA_GENERAL);
      assertThat(result.getDemographicRecommendations()).hasSize(5);
      assertThat(result.getContentRecommendations()).isEmpty();
    }

    @Test
    void unresolvedSelectionShouldYieldEmptyContent() {
      RecommendationResult result =
          engine.recommend(
              IdentityQuery.builder()
                  .citizenId(REGISTERED_CITIZEN)
                  .selectedServiceId(UNKNOWN_SERVICE)
                  .build());

      assertThat(result.getContentRecommendations()).isEmpty();
      assertThat(result.getDistrictRecommendations()).isNotEmpty();
    }

    @Test
    void minorsShouldOnlySeeEligibleServices() {
      RecommendationResult result =
          engine.recommend(
              IdentityQuery.builder()
                  .citizenId("GRPA_20000001")
                  .selectedServiceId(STUDENT_CREDIT_CARD)
                  .build());

      assertThat(result.getDistrictRecommendations())
          .containsExactly("Swasthya Sathi", "Student Credit Card");
      assertThat(result.getDemographicRecommendations())
          .containsExactly("Kanyashree", "Aikyashree Scholarship", "Swasthya Sathi");
      assertThat(result.getContentRecommendations().get("Student Credit Card"))
          .containsExactly("Kanyashree", "Aikyashree Scholarship", "Swasthya Sathi");
    }

    @Test
    void unknownAgeAndMinorityReligionShouldStillFindACluster() {
      RecommendationResult result =
          engine.recommend(IdentityQuery.builder().citizenId("GRPA_20000002").build());

      assertThat(result.getDemographicRecommendations())
          .containsExactly(
              "Kanyashree", "Lakshmir Bhandar", "Aikyashree Scholarship", "Swasthya Sathi");
      assertThat(result.getDistrictRecommendations())
          .containsExactly("Krishak Bandhu", "Old Age Pension", "Kanyashree");
      assertThat(result.getContentRecommendations()).isEmpty();
    }

    @Test
    void everyRecommendedServiceShouldResolveThroughTheCatalog() {
      List<String> names = engine.listServices().stream().map(ServiceOffering::getName).toList();
      RecommendationResult result =
          engine.recommend(
              IdentityQuery.builder()
                  .citizenId(REGISTERED_CITIZEN)
                  .selectedServiceId(KANYASHREE)
                  .build());

      assertThat(names).containsAll(result.getDistrictRecommendations());
      assertThat(names).containsAll(result.getDemographicRecommendations());
      result
          .getContentRecommendations()
          .values()
          .forEach(list -> assertThat(names).containsAll(list));
    }

    @Test
    void phoneLookupShouldReturnMaskedCitizens() {
      List<Citizen> citizens = engine.lookupCitizenByPhone(REGISTERED_PHONE);

      assertThat(citizens).hasSize(2);
      assertThat(citizens)
          .allSatisfy(citizen -> assertThat(citizen.getMaskedName()).isEqualTo("####"));
      assertThat(engine.lookupCitizenByPhone(UNREGISTERED_PHONE)).isEmpty();
    }

    @Test
    void usageHistoryShouldCountUniqueServices() {
      UsageHistory history = engine.citizenUsageHistory(REGISTERED_CITIZEN);

      assertThat(history.getTotalUniqueServices()).isEqualTo(3);
      assertThat(history.getServices().get(0).getServiceId()).isEqualTo(SWASTHYA_SATHI);
      assertThat(engine.citizenUsageHistory("NOBODY").getTotalUniqueServices()).isZero();
    }

    @Test
    void shouldListSelectableServicesAndDistricts() {
      assertThat(engine.listServices()).hasSize(13);
      assertThat(engine.listSelectableServices()).hasSize(11);
      assertThat(engine.listDistricts()).hasSize(2);
      assertThat(engine.loadedTableCounts())
          .containsEntry("services", 13)
          .containsEntry("citizens", 4)
          .containsEntry("cluster_signatures", 5);
    }
  }

  @Nested
  @DisplayName("Usage history anchors")
  class UsageHistoryAnchors {

    private RecommendationEngine engine;

    @BeforeEach
    void setUp() {
      ApplicationProperties properties = TestFixtures.fixtureProperties();
      properties.getContent().setIncludeUsageHistory(true);
      engine = fixtureEngine(properties);
    }

    @Test
    void shouldSplitBudgetBetweenSelectionAndHistory() {
      RecommendationResult result =
          engine.recommend(
              IdentityQuery.builder()
                  .citizenId(REGISTERED_CITIZEN)
                  .selectedServiceId(STUDENT_CREDIT_CARD)
                  .build());

      assertThat(result.getContentRecommendations())
          .containsOnlyKeys("Swasthya Sathi", "Lakshmir Bhandar", "Student Credit Card");
      assertThat(result.getContentRecommendations().get("Student Credit Card"))
          .containsExactly("Kanyashree", "Aikyashree Scholarship", "Trade License");
      assertThat(result.getContentRecommendations().get("Swasthya Sathi")).hasSize(1);
      assertThat(result.getContentRecommendations().get("Lakshmir Bhandar")).hasSize(1);
    }

    @Test
    void selectionThatIsAlreadyInHistoryShouldNotBeDuplicated() {
      RecommendationResult result =
          engine.recommend(
              IdentityQuery.builder()
                  .citizenId(REGISTERED_CITIZEN)
                  .selectedServiceId(SWASTHYA_SATHI)
                  .build());

      assertThat(result.getContentRecommendations().get("Swasthya Sathi")).hasSize(3);
      assertThat(result.getContentRecommendations().values().stream().mapToInt(List::size).sum())
          .isLessThanOrEqualTo(5);
    }
  }
}
