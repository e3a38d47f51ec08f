package com.bsk.recommender.service.recommendation;

import java.util.List;

import com.bsk.recommender.service.citizen.ServiceUsageRecord;

import lombok.Value;

@Value
public class UsageHistory {

  int totalUniqueServices;
  List<ServiceUsageRecord> services;
}
