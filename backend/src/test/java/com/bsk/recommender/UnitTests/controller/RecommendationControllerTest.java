package com.bsk.recommender.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.bsk.recommender.exception.CitizenNotFoundException;
import com.bsk.recommender.exception.GlobalExceptionHandler;
import com.bsk.recommender.exception.InvalidQueryException;
import com.bsk.recommender.service.RecommendationEngine;
import com.bsk.recommender.service.recommendation.IdentityQuery;
import com.bsk.recommender.service.recommendation.ManualQuery;
import com.bsk.recommender.service.recommendation.RecommendationQuery;
import com.bsk.recommender.service.recommendation.RecommendationResult;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecommendationController Tests")
class RecommendationControllerTest {

  @Mock private RecommendationEngine recommendationEngine;

  @InjectMocks private RecommendationController controller;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  private static RecommendationResult sampleResult() {
    Map<String, List<String>> content = new LinkedHashMap<>();
    content.put("Student Credit Card", List.of("Kanyashree", "Aikyashree Scholarship"));
    return RecommendationResult.builder()
        .districtRecommendations(List.of("Swasthya Sathi", "Ration Card"))
        .demographicRecommendations(List.of("Old Age Pension"))
        .contentRecommendations(content)
        .build();
  }

  @Nested
  @DisplayName("POST /api/recommend/phone")
  class IdentityRecommendations {

    @Test
    @DisplayName("Should return all three recommendation lists")
    void shouldReturnRecommendations() throws Exception {
      when(recommendationEngine.recommend(any())).thenReturn(sampleResult());

      mockMvc
          .perform(
              post("/api/recommend/phone")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"citizen_id\":\"GRPA_12369567\",\"selected_service_id\":124}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.district_recommendations[0]").value("Swasthya Sathi"))
          .andExpect(jsonPath("$.demographic_recommendations[0]").value("Old Age Pension"))
          .andExpect(
              jsonPath("$.content_recommendations['Student Credit Card'][1]")
                  .value("Aikyashree Scholarship"));

      ArgumentCaptor<RecommendationQuery> captor =
          ArgumentCaptor.forClass(RecommendationQuery.class);
      verify(recommendationEngine).recommend(captor.capture());
      IdentityQuery query = (IdentityQuery) captor.getValue();
      assertThat(query.getCitizenId()).isEqualTo("GRPA_12369567");
      assertThat(query.getSelectedServiceId()).isEqualTo(124);
    }

    @Test
    @DisplayName("Should accept a request without a selected service")
    void shouldAcceptMissingSelection() throws Exception {
      when(recommendationEngine.recommend(any())).thenReturn(sampleResult());

      mockMvc
          .perform(
              post("/api/recommend/phone")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"citizen_id\":\"GRPA_12369567\"}"))
          .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Should return 404 for an unknown citizen")
    void shouldReturnNotFoundForUnknownCitizen() throws Exception {
      when(recommendationEngine.recommend(any()))
          .thenThrow(new CitizenNotFoundException("GRPA_00000000"));

      mockMvc
          .perform(
              post("/api/recommend/phone")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"citizen_id\":\"GRPA_00000000\"}"))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.message").value("Citizen GRPA_00000000 not found"));
    }

    @Test
    @DisplayName("Should reject a blank citizen id")
    void shouldRejectBlankCitizenId() throws Exception {
      mockMvc
          .perform(
              post("/api/recommend/phone")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"citizen_id\":\"\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.validationErrors.citizenId").exists());

      verifyNoInteractions(recommendationEngine);
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void shouldRejectMalformedJson() throws Exception {
      mockMvc
          .perform(
              post("/api/recommend/phone")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"citizen_id\":"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("Malformed JSON request"));
    }

    @Test
    @DisplayName("Should reject GET with 405")
    void shouldRejectGet() throws Exception {
      mockMvc.perform(get("/api/recommend/phone")).andExpect(status().isMethodNotAllowed());
    }
  }

  @Nested
  @DisplayName("POST /api/recommend/manual")
  class ManualRecommendations {

    private static final String VALID_BODY =
        "{\"district_id\":1,\"gender\":\"Male\",\"caste\":\"General\",\"age\":30,"
            + "\"religion\":\"Hindu\",\"selected_service_id\":124}";

    @Test
    @DisplayName("Should map the body onto a manual query")
    void shouldMapManualQuery() throws Exception {
      when(recommendationEngine.recommend(any())).thenReturn(sampleResult());

      mockMvc
          .perform(
              post("/api/recommend/manual")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(VALID_BODY))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.district_recommendations.length()").value(2));

      ArgumentCaptor<RecommendationQuery> captor =
          ArgumentCaptor.forClass(RecommendationQuery.class);
      verify(recommendationEngine).recommend(captor.capture());
      ManualQuery query = (ManualQuery) captor.getValue();
      assertThat(query.getDistrictId()).isEqualTo(1);
      assertThat(query.getCaste()).isEqualTo("General");
      assertThat(query.getAge()).isEqualTo(30);
    }

    @Test
    @DisplayName("Should reject a missing selected service")
    void shouldRejectMissingSelection() throws Exception {
      mockMvc
          .perform(
              post("/api/recommend/manual")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      "{\"district_id\":1,\"gender\":\"Male\",\"caste\":\"General\",\"age\":30,"
                          + "\"religion\":\"Hindu\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.validationErrors.selectedServiceId").exists());

      verifyNoInteractions(recommendationEngine);
    }

    @Test
    @DisplayName("Should reject a negative age")
    void shouldRejectNegativeAge() throws Exception {
      mockMvc
          .perform(
              post("/api/recommend/manual")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(VALID_BODY.replace("\"age\":30", "\"age\":-1")))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.validationErrors.age").exists());
    }

    @Test
    @DisplayName("Should turn an invalid query into 400")
    void shouldMapInvalidQueryToBadRequest() throws Exception {
      when(recommendationEngine.recommend(any()))
          .thenThrow(new InvalidQueryException("age must not be negative"));

      mockMvc
          .perform(
              post("/api/recommend/manual")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(VALID_BODY))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("age must not be negative"));
    }
  }
}
