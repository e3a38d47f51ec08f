package com.bsk.recommender.service.data_processing;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Value;

/** A parsed CSV file: header names and one map per data row, keyed by header. */
@Value
public class CsvTable {

  String name;
  List<String> columns;
  List<Map<String, String>> rows;

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  /** The first of the candidate columns the file actually has. */
  public Optional<String> firstPresentColumn(String... candidates) {
    return Arrays.stream(candidates).filter(this::hasColumn).findFirst();
  }
}
