package com.bsk.recommender.service.district;

import java.util.List;

import lombok.Value;

@Value
public class District {

  int districtId;
  String districtName;

  /** Service ids, most popular first. */
  List<Integer> ranking;
}
