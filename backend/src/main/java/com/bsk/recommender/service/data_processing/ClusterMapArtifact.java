package com.bsk.recommender.service.data_processing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON form of the precomputed demographic clustering: which cluster each observed signature fell
 * into, and the ranked services of every cluster.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterMapArtifact {

  @JsonProperty("version")
  private String version;

  @Builder.Default
  @JsonProperty("signatures")
  private List<SignatureEntry> signatures = new ArrayList<>();

  /** Cluster id (as JSON object key) to service ids, most used first. */
  @Builder.Default
  @JsonProperty("clusters")
  private Map<String, List<Integer>> clusters = new LinkedHashMap<>();

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class SignatureEntry {

    @JsonProperty("district_id")
    private Integer districtId;

    @JsonProperty("gender")
    private String gender;

    @JsonProperty("caste")
    private String caste;

    @JsonProperty("age_group")
    private String ageGroup;

    @JsonProperty("religion_group")
    private String religionGroup;

    @JsonProperty("cluster_id")
    private Integer clusterId;
  }
}
