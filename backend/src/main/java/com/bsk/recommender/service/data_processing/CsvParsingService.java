package com.bsk.recommender.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class CsvParsingService {

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  /**
   * Reads a whole CSV file. Header names and cell values are trimmed. Rows whose column count
   * differs from the header are skipped.
   *
   * @param csvStream file content, closed by this method
   * @param tableName name used in log messages
   * @param charset file encoding
   */
  public CsvTable parse(InputStream csvStream, String tableName, Charset charset)
      throws IOException {
    List<Map<String, String>> rows = new ArrayList<>();
    List<String> columns = new ArrayList<>();
    int skipped = 0;

    try (CSVReader reader = new CSVReader(new InputStreamReader(csvStream, charset))) {
      String[] headers = reader.readNext();
      if (headers == null || headers.length == 0) {
        throw new IllegalArgumentException("CSV file " + tableName + " has no headers");
      }
      for (int i = 0; i < headers.length; i++) {
        String header = headers[i] == null ? "" : headers[i];
        if (i == 0 && !header.isEmpty() && header.charAt(0) == BYTE_ORDER_MARK) {
          header = header.substring(1);
        }
        columns.add(header.trim());
      }

      String[] row;
      while ((row = reader.readNext()) != null) {
        if (row.length == 1 && row[0].isBlank()) {
          continue;
        }
        if (row.length != columns.size()) {
          log.debug(
              "Skipping row of {} with incorrect column count: {} vs {}",
              tableName,
              row.length,
              columns.size());
          skipped++;
          continue;
        }

        Map<String, String> rowData = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
          rowData.put(columns.get(i), row[i] == null ? "" : row[i].trim());
        }
        rows.add(rowData);
      }
    } catch (CsvValidationException e) {
      throw new IOException("Malformed CSV in " + tableName + ": " + e.getMessage(), e);
    }

    if (skipped > 0) {
      log.warn("Skipped {} malformed rows in {}", skipped, tableName);
    }
    log.debug("Parsed {} rows with columns {} from {}", rows.size(), columns, tableName);
    return new CsvTable(tableName, List.copyOf(columns), rows);
  }

  /**
   * Parses an integer cell. Accepts the {@code 12.0} form left behind by exports that stored ids
   * as floating point; anything else that is not a whole number is treated as absent.
   */
  public static Optional<Integer> parseInteger(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    try {
      return Optional.of(Integer.parseInt(trimmed));
    } catch (NumberFormatException e) {
      try {
        double asDouble = Double.parseDouble(trimmed);
        if (asDouble == Math.rint(asDouble) && !Double.isInfinite(asDouble)) {
          return Optional.of((int) asDouble);
        }
      } catch (NumberFormatException ignored) {
        log.trace("Not a number: {}", trimmed);
      }
      return Optional.empty();
    }
  }

  public static Optional<Double> parseDouble(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      double parsed = Double.parseDouble(value.trim());
      return Double.isNaN(parsed) ? Optional.empty() : Optional.of(parsed);
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
