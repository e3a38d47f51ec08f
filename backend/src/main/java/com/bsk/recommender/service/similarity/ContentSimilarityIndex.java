package com.bsk.recommender.service.similarity;

import java.util.Comparator;
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
 * Nearest-neighbour lookup over the service similarity matrix. The matrix holds cosine similarities
 * of embeddings computed offline from enriched service descriptions.
 *
 * <p>Each anchor keeps its whole sorted row unless a depth is configured. Filters run while the
 * row is walked, so the caller receives up to K usable services whenever the matrix has them.
 */
@Slf4j
public class ContentSimilarityIndex {

  /** Score descending, ties broken by service id ascending. */
  static final Comparator<SimilarNeighbour> NEIGHBOUR_ORDER =
      Comparator.comparingDouble(SimilarNeighbour::getScore)
          .reversed()
          .thenComparingInt(SimilarNeighbour::getServiceId);

  private final ServiceCatalog catalog;
  private final ImmutableMap<Integer, ImmutableList<SimilarNeighbour>> rows;
  private final int topK;

  /**
   * @param rows neighbours per anchor in any order
   * @param storedNeighbours row depth kept per anchor after sorting, zero or less keeps all
   * @param topK suggestions returned per anchor
   */
  public ContentSimilarityIndex(
      ServiceCatalog catalog,
      Map<Integer, List<SimilarNeighbour>> rows,
      int storedNeighbours,
      int topK) {
    this.catalog = catalog;
    this.topK = topK;

    long depth = storedNeighbours > 0 ? Math.max(storedNeighbours, topK) : Long.MAX_VALUE;
    ImmutableMap.Builder<Integer, ImmutableList<SimilarNeighbour>> builder = ImmutableMap.builder();
    rows.forEach(
        (anchorId, neighbours) ->
            builder.put(
                anchorId,
                neighbours.stream()
                    .filter(neighbour -> neighbour.getServiceId() != anchorId)
                    .filter(neighbour -> !Double.isNaN(neighbour.getScore()))
                    .sorted(NEIGHBOUR_ORDER)
                    .limit(depth)
                    .collect(ImmutableList.toImmutableList())));
    this.rows = builder.build();
    log.info(
        "Content similarity index ready for {} anchor services (top {})", this.rows.size(), topK);
  }

  public List<String> recommend(int serviceId) {
    return recommend(serviceId, ServiceFilter.ADMIT_ALL, topK);
  }

  public List<String> recommend(int serviceId, ServiceFilter filter) {
    return recommend(serviceId, filter, topK);
  }

  /**
   * The most similar services to the anchor. Self matches, excluded categories and services the
   * filter rejects are skipped while walking the row, so the limit counts usable suggestions only.
   * An anchor missing from the matrix yields an empty list.
   */
  public List<String> recommend(int serviceId, ServiceFilter filter, int limit) {
    List<SimilarNeighbour> row = rows.get(serviceId);
    if (row == null) {
      log.debug("Service {} is not in the similarity matrix", serviceId);
      return List.of();
    }
    if (limit <= 0) {
      return List.of();
    }
    return row.stream()
        .filter(neighbour -> neighbour.getServiceId() != serviceId)
        .map(neighbour -> catalog.find(neighbour.getServiceId()))
        .flatMap(Optional::stream)
        .filter(service -> !service.isExcludedCategory())
        .filter(filter::admits)
        .limit(limit)
        .map(ServiceOffering::getName)
        .collect(ImmutableList.toImmutableList());
  }

  /** The stored, scored row of an anchor. */
  public List<SimilarNeighbour> neighbours(int serviceId) {
    return rows.getOrDefault(serviceId, ImmutableList.of());
  }

  public boolean contains(int serviceId) {
    return rows.containsKey(serviceId);
  }

  public int size() {
    return rows.size();
  }
}
