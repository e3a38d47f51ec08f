package com.bsk.recommender.service.data_processing;

import java.util.HashSet;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

/**
 * Collects references that do not resolve against the service catalog while the tables load.
 * Each offending id or name is reported once, however many tables or rows mention it.
 */
@Slf4j
public class ReferenceIntegrityLog {

  private final Set<Integer> reportedServiceIds = new HashSet<>();
  private final Set<String> reportedServiceNames = new HashSet<>();
  private int droppedReferences;

  public void unresolvedServiceId(String table, int serviceId) {
    droppedReferences++;
    if (reportedServiceIds.add(serviceId)) {
      log.warn(
          "LoadIntegrityWarning: service id {} referenced by {} is not in the catalog, dropping it",
          serviceId,
          table);
    }
  }

  public void unresolvedServiceName(String table, String serviceName) {
    droppedReferences++;
    if (reportedServiceNames.add(serviceName)) {
      log.warn(
          "LoadIntegrityWarning: service '{}' referenced by {} is not in the catalog, dropping it",
          serviceName,
          table);
    }
  }

  public int getDroppedReferences() {
    return droppedReferences;
  }

  public int getOffendingServiceCount() {
    return reportedServiceIds.size() + reportedServiceNames.size();
  }
}
