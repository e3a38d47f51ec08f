package com.bsk.recommender.service.catalog;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

import lombok.extern.slf4j.Slf4j;

/**
 * Canonical list of services. Every other reference table resolves its service ids through the
 * catalog, so it is built first and is immutable afterwards.
 */
@Slf4j
public class ServiceCatalog {

  private final ImmutableSortedMap<Integer, ServiceOffering> servicesById;
  private final ImmutableMap<String, ServiceOffering> servicesByNormalizedName;

  /**
   * Builds the catalog and derives the category flags from the configured keywords.
   *
   * @param services services as read from the catalog source; duplicate ids keep the first row
   * @param excludedKeywords name or domain fragments marking birth/death records
   * @param casteTargetedKeywords name fragments marking caste-reservation benefits
   */
  public ServiceCatalog(
      Collection<ServiceOffering> services,
      List<String> excludedKeywords,
      List<String> casteTargetedKeywords) {
    ImmutableSortedMap.Builder<Integer, ServiceOffering> byId = ImmutableSortedMap.naturalOrder();
    Map<Integer, ServiceOffering> seen = new HashMap<>();
    Map<String, ServiceOffering> byName = new LinkedHashMap<>();

    for (ServiceOffering service : services) {
      if (seen.containsKey(service.getId())) {
        log.warn("Duplicate service id {} in catalog, keeping the first entry", service.getId());
        continue;
      }
      ServiceOffering classified =
          service.toBuilder()
              .domain(service.getDomain() == null ? "" : service.getDomain())
              .excludedCategory(
                  matchesAny(service.getName(), excludedKeywords)
                      || matchesAny(service.getDomain(), excludedKeywords))
              .casteTargeted(matchesAny(service.getName(), casteTargetedKeywords))
              .build();
      seen.put(classified.getId(), classified);
      byId.put(classified.getId(), classified);
      byName.putIfAbsent(normalizeName(classified.getName()), classified);
    }

    this.servicesById = byId.build();
    this.servicesByNormalizedName = ImmutableMap.copyOf(byName);

    log.info(
        "Service catalog ready: {} services, {} in excluded categories, {} caste-targeted",
        servicesById.size(),
        servicesById.values().stream().filter(ServiceOffering::isExcludedCategory).count(),
        servicesById.values().stream().filter(ServiceOffering::isCasteTargeted).count());
  }

  public Optional<ServiceOffering> find(int serviceId) {
    return Optional.ofNullable(servicesById.get(serviceId));
  }

  public Optional<String> resolveName(int serviceId) {
    return find(serviceId).map(ServiceOffering::getName);
  }

  public boolean isResolvable(int serviceId) {
    return servicesById.containsKey(serviceId);
  }

  /** Unknown ids count as excluded so they can never leak into output. */
  public boolean isExcludedCategory(int serviceId) {
    return find(serviceId).map(ServiceOffering::isExcludedCategory).orElse(true);
  }

  public boolean isCasteTargeted(int serviceId) {
    return find(serviceId).map(ServiceOffering::isCasteTargeted).orElse(false);
  }

  /** All services ordered by id, without ranking semantics. */
  public List<ServiceOffering> listAll() {
    return servicesById.values().asList();
  }

  /** Services a citizen may pick as the anchor, i.e. everything outside excluded categories. */
  public List<ServiceOffering> listRecommendable() {
    return servicesById.values().stream()
        .filter(service -> !service.isExcludedCategory())
        .collect(ImmutableList.toImmutableList());
  }

  public Optional<ServiceOffering> findByNormalizedName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(servicesByNormalizedName.get(normalizeName(name)));
  }

  public int size() {
    return servicesById.size();
  }

  /** Lower-cases, treats dashes and underscores as spaces and collapses whitespace. */
  public static String normalizeName(String name) {
    if (name == null) {
      return "";
    }
    return name.toLowerCase(Locale.ROOT)
        .replace('-', ' ')
        .replace('_', ' ')
        .trim()
        .replaceAll("\\s+", " ");
  }

  private static boolean matchesAny(String text, List<String> keywords) {
    if (text == null || text.isBlank() || keywords == null) {
      return false;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    return keywords.stream()
        .filter(keyword -> keyword != null && !keyword.isBlank())
        .map(keyword -> keyword.toLowerCase(Locale.ROOT))
        .anyMatch(lower::contains);
  }
}
