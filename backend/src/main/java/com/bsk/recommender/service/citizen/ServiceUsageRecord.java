package com.bsk.recommender.service.citizen;

import lombok.Value;

@Value
public class ServiceUsageRecord {
  int serviceId;
  String serviceName;
  int count;
}
