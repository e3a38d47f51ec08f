package com.bsk.recommender.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.bsk.recommender.exception.CitizenDataUnavailableException;
import com.bsk.recommender.exception.GlobalExceptionHandler;
import com.bsk.recommender.service.RecommendationEngine;
import com.bsk.recommender.service.citizen.Citizen;
import com.bsk.recommender.service.citizen.ServiceUsageRecord;
import com.bsk.recommender.service.recommendation.UsageHistory;

@ExtendWith(MockitoExtension.class)
@DisplayName("CitizenController Tests")
class CitizenControllerTest {

  @Mock private RecommendationEngine recommendationEngine;

  @InjectMocks private CitizenController controller;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Nested
  @DisplayName("GET /api/citizen/phone/{phone}")
  class PhoneLookup {

    @Test
    @DisplayName("Should return masked profiles")
    void shouldReturnMaskedProfiles() throws Exception {
      when(recommendationEngine.lookupCitizenByPhone("9830012345"))
          .thenReturn(
              List.of(
                  Citizen.builder()
                      .citizenId("GRPA_12369567")
                      .phone("9830012345")
                      .maskedName("####")
                      .gender("Male")
                      .caste("General")
                      .religion("Hindu")
                      .age(30)
                      .districtId(1)
                      .build(),
                  Citizen.builder()
                      .citizenId("GRPA_20000002")
                      .phone("9830012345")
                      .maskedName("--")
                      .gender("Female")
                      .districtId(2)
                      .build()));

      mockMvc
          .perform(get("/api/citizen/phone/9830012345"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.citizens.length()").value(2))
          .andExpect(jsonPath("$.citizens[0].citizen_id").value("GRPA_12369567"))
          .andExpect(jsonPath("$.citizens[0].name").value("####"))
          .andExpect(jsonPath("$.citizens[0].age").value(30))
          .andExpect(jsonPath("$.citizens[0].district_id").value(1))
          .andExpect(jsonPath("$.citizens[1].name").value("--"))
          .andExpect(jsonPath("$.citizens[1].age").doesNotExist());
    }

    @Test
    @DisplayName("Should return an empty list for an unknown phone")
    void shouldReturnEmptyListForUnknownPhone() throws Exception {
      when(recommendationEngine.lookupCitizenByPhone("9800361474")).thenReturn(List.of());

      mockMvc
          .perform(get("/api/citizen/phone/9800361474"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.citizens").isEmpty());
    }

    @Test
    @DisplayName("Should return 503 when citizen data is not deployed")
    void shouldReturnServiceUnavailable() throws Exception {
      when(recommendationEngine.lookupCitizenByPhone("9830012345"))
          .thenThrow(new CitizenDataUnavailableException());

      mockMvc
          .perform(get("/api/citizen/phone/9830012345"))
          .andExpect(status().isServiceUnavailable())
          .andExpect(
              jsonPath("$.message")
                  .value(
                      "Citizen database not available in this deployment."
                          + " Please use manual entry mode."));
    }
  }

  @Nested
  @DisplayName("GET /api/citizen/{citizenId}/services")
  class ServiceHistory {

    @Test
    @DisplayName("Should return the usage history with a total count")
    void shouldReturnHistory() throws Exception {
      when(recommendationEngine.citizenUsageHistory("GRPA_12369567"))
          .thenReturn(
              new UsageHistory(
                  2,
                  List.of(
                      new ServiceUsageRecord(114, "Swasthya Sathi", 3),
                      new ServiceUsageRecord(117, "Ration Card", 1))));

      mockMvc
          .perform(get("/api/citizen/GRPA_12369567/services"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.total_count").value(2))
          .andExpect(jsonPath("$.services[0].service_id").value(114))
          .andExpect(jsonPath("$.services[0].service_name").value("Swasthya Sathi"))
          .andExpect(jsonPath("$.services[0].count").value(3));
    }

    @Test
    @DisplayName("Should return an empty history for an unknown citizen")
    void shouldReturnEmptyHistory() throws Exception {
      when(recommendationEngine.citizenUsageHistory("NOBODY"))
          .thenReturn(new UsageHistory(0, List.of()));

      mockMvc
          .perform(get("/api/citizen/NOBODY/services"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.total_count").value(0))
          .andExpect(jsonPath("$.services").isEmpty());
    }
  }
}
