package com.bsk.recommender.service.demographic;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.bsk.recommender.service.catalog.ServiceCatalog;
import com.bsk.recommender.service.catalog.ServiceFilter;
import com.bsk.recommender.service.catalog.ServiceOffering;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import lombok.extern.slf4j.Slf4j;

/**
 * Precomputed demographic clusters: a signature resolves to one cluster and each cluster carries
 * the services most used by its members.
 *
 * <p>Combinations that never occurred in the training data have no cluster. They are treated as a
 * cold start and produce an empty list rather than an error.
 */
@Slf4j
public class DemographicClusterMap {

  private final ServiceCatalog catalog;
  private final ImmutableMap<ClusterSignature, Integer> clustersBySignature;
  private final ImmutableMap<Integer, ImmutableList<Integer>> rankingsByCluster;
  private final String generalCaste;
  private final int topN;

  public DemographicClusterMap(
      ServiceCatalog catalog,
      Map<ClusterSignature, Integer> clustersBySignature,
      Map<Integer, List<Integer>> rankingsByCluster,
      String generalCaste,
      int topN) {
    this.catalog = catalog;
    this.clustersBySignature = ImmutableMap.copyOf(clustersBySignature);
    ImmutableMap.Builder<Integer, ImmutableList<Integer>> rankings = ImmutableMap.builder();
    rankingsByCluster.forEach(
        (clusterId, ranking) -> rankings.put(clusterId, ImmutableList.copyOf(ranking)));
    this.rankingsByCluster = rankings.build();
    this.generalCaste = generalCaste;
    this.topN = topN;
    log.info(
        "Demographic cluster map ready: {} signatures over {} clusters",
        this.clustersBySignature.size(),
        this.rankingsByCluster.size());
  }

  public Optional<Integer> clusterFor(ClusterSignature signature) {
    return Optional.ofNullable(clustersBySignature.get(signature));
  }

  public List<String> recommend(ClusterSignature signature) {
    return recommend(signature, ServiceFilter.ADMIT_ALL);
  }

  /**
   * Services popular in the signature's cluster, capped at the configured top N after filtering.
   * General-caste signatures never receive caste-targeted services.
   */
  public List<String> recommend(ClusterSignature signature, ServiceFilter filter) {
    Optional<Integer> clusterId = clusterFor(signature);
    if (clusterId.isEmpty()) {
      log.debug("No cluster for signature {}", signature);
      return List.of();
    }
    List<Integer> ranking = rankingsByCluster.get(clusterId.get());
    if (ranking == null) {
      log.debug("Cluster {} has no service ranking", clusterId.get());
      return List.of();
    }

    boolean generalCategory =
        generalCaste != null && generalCaste.equalsIgnoreCase(signature.getCaste());
    return ranking.stream()
        .map(catalog::find)
        .flatMap(Optional::stream)
        .filter(service -> !service.isExcludedCategory())
        .filter(service -> !(generalCategory && service.isCasteTargeted()))
        .filter(filter::admits)
        .limit(topN)
        .map(ServiceOffering::getName)
        .collect(ImmutableList.toImmutableList());
  }

  public int signatureCount() {
    return clustersBySignature.size();
  }

  public int clusterCount() {
    return rankingsByCluster.size();
  }
}
