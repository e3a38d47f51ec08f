package com.bsk.recommender.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "recommender")
public class ApplicationProperties {

  private String version;

  private DataFiles data = new DataFiles();
  private Ranking ranking = new Ranking();
  private AgeBands ageBands = new AgeBands();
  private Policy policy = new Policy();
  private Content content = new Content();

  /**
   * Reference table locations, resolved through the Spring resource loader. The kiosk exports
   * write the service, citizen and provision tables in ISO-8859-1; every other table is read with
   * {@code encoding}.
   */
  @Data
  public static class DataFiles {
    private String location = "file:data/";
    private String encoding = "UTF-8";
    private String servicesEncoding = "ISO-8859-1";
    private String citizensEncoding = "ISO-8859-1";
    private String provisionEncoding = "ISO-8859-1";
    private String servicesFile = "services.csv";
    private String districtRankingFile = "district_top_services.csv";
    private String clusterMapFile = "cluster_service_map.json";
    private String similarityMatrixFile = "openai_similarity_matrix.csv";
    private String citizensFile = "ml_citizen_master.csv";
    private String provisionFile = "ml_provision.csv";
    private String minorEligibleServicesFile = "under18_top_services.csv";
  }

  @Data
  public static class Ranking {
    private int districtTopN = 5;
    private int demographicTopN = 5;
    private int contentTopK = 5;
    /** Neighbours kept per similarity row; zero or less keeps the whole row. */
    private int storedNeighbours = 0;
  }

  @Data
  public static class AgeBands {
    /** First age that is no longer a child. */
    private int adultFrom = 18;
    /** First age that counts as elderly. */
    private int elderlyFrom = 60;
    private String unknownAgeBand = "YOUTH";
  }

  @Data
  public static class Policy {
    private List<String> excludedKeywords = new ArrayList<>(List.of("birth", "death"));
    private List<String> casteTargetedKeywords = new ArrayList<>(List.of("caste"));
    private String generalCaste = "General";
    private String majorityReligion = "Hindu";
    private String minorityReligionGroup = "Minority";
    private boolean restrictMinorsToEligibleServices = true;
    private String maskToken = "####";
    private String blankNameToken = "--";
  }

  @Data
  public static class Content {
    private boolean includeUsageHistory = false;
    private int totalRecommendations = 5;
    private int selectedServiceShare = 3;
  }
}
