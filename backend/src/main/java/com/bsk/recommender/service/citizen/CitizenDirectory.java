package com.bsk.recommender.service.citizen;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import com.bsk.recommender.service.catalog.ServiceCatalog;
import com.bsk.recommender.service.catalog.ServiceOffering;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

import lombok.extern.slf4j.Slf4j;

/**
 * Citizens by phone and by id, plus their aggregated service usage.
 *
 * <p>Names are masked while the directory is built: rows come in with the real name, citizens go
 * out with a fixed token, and the real name is not retained.
 */
@Slf4j
public class CitizenDirectory {

  private static final Comparator<ServiceUsageRecord> USAGE_ORDER =
      Comparator.comparingInt(ServiceUsageRecord::getCount)
          .reversed()
          .thenComparingInt(ServiceUsageRecord::getServiceId);

  private final boolean available;
  private final ImmutableMap<String, Citizen> citizensById;
  private final ImmutableListMultimap<String, Citizen> citizensByPhone;
  private final ImmutableMap<String, ImmutableList<ServiceUsageRecord>> usageByCitizen;

  /**
   * @param catalog resolves service names for the usage history
   * @param rows citizen master rows; a repeated citizen id keeps the first row
   * @param usageCounts times each service was provided, per citizen id and service id
   * @param maskToken replaces a non-blank name
   * @param blankNameToken replaces a missing name
   */
  public CitizenDirectory(
      ServiceCatalog catalog,
      List<CitizenRow> rows,
      Map<String, Map<Integer, Integer>> usageCounts,
      String maskToken,
      String blankNameToken) {
    this(catalog, rows, usageCounts, maskToken, blankNameToken, true);
  }

  private CitizenDirectory(
      ServiceCatalog catalog,
      List<CitizenRow> rows,
      Map<String, Map<Integer, Integer>> usageCounts,
      String maskToken,
      String blankNameToken,
      boolean available) {
    this.available = available;

    Map<String, Citizen> byId = new LinkedHashMap<>();
    ImmutableListMultimap.Builder<String, Citizen> byPhone = ImmutableListMultimap.builder();
    for (CitizenRow row : rows) {
      if (row.getCitizenId() == null || row.getCitizenId().isBlank()) {
        continue;
      }
      String citizenId = row.getCitizenId().trim();
      if (byId.containsKey(citizenId)) {
        log.debug("Citizen {} listed more than once, keeping the first row", citizenId);
        continue;
      }
      Citizen citizen =
          Citizen.builder()
              .citizenId(citizenId)
              .phone(normalizePhone(row.getPhone()))
              .maskedName(
                  row.getName() != null && !row.getName().isBlank() ? maskToken : blankNameToken)
              .gender(row.getGender())
              .caste(row.getCaste())
              .religion(row.getReligion())
              .age(row.getAge() != null && row.getAge() > 0 ? row.getAge() : null)
              .districtId(row.getDistrictId())
              .build();
      byId.put(citizenId, citizen);
      if (!citizen.getPhone().isEmpty()) {
        byPhone.put(citizen.getPhone(), citizen);
      }
    }
    this.citizensById = ImmutableMap.copyOf(byId);
    this.citizensByPhone = byPhone.build();
    this.usageByCitizen = summarizeUsage(catalog, usageCounts);

    log.info(
        "Citizen directory ready: {} citizens, usage history for {} citizens",
        citizensById.size(),
        usageByCitizen.size());
  }

  /** A directory for deployments that ship without the citizen master file. */
  public static CitizenDirectory unavailable(ServiceCatalog catalog) {
    return new CitizenDirectory(catalog, List.of(), Map.of(), "", "", false);
  }

  public boolean isAvailable() {
    return available;
  }

  /**
   * Every citizen registered under the phone number. Phone numbers are shared within families, so
   * this may return several citizens. The query is only trimmed and then matched exactly.
   */
  public List<Citizen> findByPhone(String phone) {
    String key = phone == null ? "" : phone.trim();
    if (key.isEmpty()) {
      return List.of();
    }
    return citizensByPhone.get(key);
  }

  public Optional<Citizen> findById(String citizenId) {
    if (citizenId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(citizensById.get(citizenId.trim()));
  }

  /** Services the citizen used, most used first, ties by service id. */
  public List<ServiceUsageRecord> usageHistory(String citizenId) {
    if (citizenId == null) {
      return List.of();
    }
    return usageByCitizen.getOrDefault(citizenId.trim(), ImmutableList.of());
  }

  public int size() {
    return citizensById.size();
  }

  /**
   * Cleans a stored number: trims it and drops the {@code .0} suffix left behind when the source
   * exported phone numbers as floating point.
   */
  static String normalizePhone(String phone) {
    if (phone == null) {
      return "";
    }
    String trimmed = phone.trim();
    if (trimmed.endsWith(".0")) {
      trimmed = trimmed.substring(0, trimmed.length() - 2);
    }
    return trimmed;
  }

  private static ImmutableMap<String, ImmutableList<ServiceUsageRecord>> summarizeUsage(
      ServiceCatalog catalog, Map<String, Map<Integer, Integer>> usageCounts) {
    Map<String, ImmutableList<ServiceUsageRecord>> summary = new HashMap<>();
    usageCounts.forEach(
        (citizenId, counts) -> {
          ImmutableList<ServiceUsageRecord> records =
              new TreeMap<>(counts)
                  .entrySet().stream()
                      .filter(entry -> entry.getValue() != null && entry.getValue() > 0)
                      .map(
                          entry -> {
                            Optional<ServiceOffering> service = catalog.find(entry.getKey());
                            if (service.isEmpty() || service.get().isExcludedCategory()) {
                              return null;
                            }
                            return new ServiceUsageRecord(
                                entry.getKey(), service.get().getName(), entry.getValue());
                          })
                      .filter(Objects::nonNull)
                      .sorted(USAGE_ORDER)
                      .collect(ImmutableList.toImmutableList());
          if (!records.isEmpty()) {
            summary.put(citizenId, records);
          }
        });
    return ImmutableMap.copyOf(summary);
  }
}
