package com.bsk.recommender.service.catalog;

/** Decides whether a resolved service may appear in a recommendation list. */
@FunctionalInterface
public interface ServiceFilter {

  ServiceFilter ADMIT_ALL = service -> true;

  boolean admits(ServiceOffering service);

  default ServiceFilter and(ServiceFilter other) {
    return service -> admits(service) && other.admits(service);
  }
}
