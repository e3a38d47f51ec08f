package com.bsk.recommender.service.district;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.bsk.recommender.service.catalog.ServiceCatalog;
import com.bsk.recommender.service.catalog.ServiceFilter;
import com.bsk.recommender.service.catalog.ServiceOffering;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import lombok.extern.slf4j.Slf4j;

/** Most popular services per district, ranked offline from historical provisions. */
@Slf4j
public class DistrictRanker {

  private final ServiceCatalog catalog;
  private final ImmutableSortedMap<Integer, District> districts;
  private final int topN;

  public DistrictRanker(ServiceCatalog catalog, Collection<District> districts, int topN) {
    this.catalog = catalog;
    this.topN = topN;
    Map<Integer, District> byId = new TreeMap<>();
    districts.forEach(
        district ->
            byId.put(
                district.getDistrictId(),
                new District(
                    district.getDistrictId(),
                    district.getDistrictName(),
                    ImmutableList.copyOf(district.getRanking()))));
    this.districts = ImmutableSortedMap.copyOf(byId);
    log.info("District rankings ready for {} districts (top {})", this.districts.size(), topN);
  }

  public List<String> recommend(int districtId) {
    return recommend(districtId, ServiceFilter.ADMIT_ALL);
  }

  /**
   * Top services of the district in stored rank order. Excluded categories and services the filter
   * rejects are removed before the list is capped; an unknown district yields an empty list.
   */
  public List<String> recommend(int districtId, ServiceFilter filter) {
    District district = districts.get(districtId);
    if (district == null) {
      log.debug("No ranking stored for district {}", districtId);
      return List.of();
    }
    return district.getRanking().stream()
        .map(catalog::find)
        .flatMap(Optional::stream)
        .filter(service -> !service.isExcludedCategory())
        .filter(filter::admits)
        .limit(topN)
        .map(ServiceOffering::getName)
        .collect(ImmutableList.toImmutableList());
  }

  public Optional<District> find(int districtId) {
    return Optional.ofNullable(districts.get(districtId));
  }

  /** Districts ordered by id, for populating selection inputs. */
  public List<District> listDistricts() {
    return districts.values().asList();
  }

  public int size() {
    return districts.size();
  }
}
