package org.timeseries.access.influxdb;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.apache.commons.lang3.StringUtils;
import org.timeseries.access.api.data.DataPoint;
import org.timeseries.access.api.data.TimeSeries;
import org.timeseries.access.driver.ResponseParseException;

/**
 * Reads the annotated CSV returned by the Flux query endpoint. Each {@code (result, table)} pair
 * becomes one series; annotation rows ({@code #datatype}, {@code #group}, {@code #default}) are
 * skipped except for the default result name.
 */
public class InfluxResponseParser {
  private static final CsvMapper CSV_MAPPER = new CsvMapper();

  static {
    CSV_MAPPER.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    CSV_MAPPER.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
  }

  private static final String COLUMN_RESULT = "result";
  private static final String COLUMN_TABLE = "table";
  private static final String COLUMN_TIME = "_time";
  private static final String COLUMN_STOP = "_stop";
  private static final String COLUMN_VALUE = "_value";
  private static final String COLUMN_MEASUREMENT = "_measurement";
  private static final String COLUMN_FIELD = "_field";
  private static final String COLUMN_ERROR = "error";
  private static final String DEFAULT_RESULT = "_result";

  private final FieldStrategy fieldStrategy;

  public InfluxResponseParser(FieldStrategy fieldStrategy) {
    this.fieldStrategy = fieldStrategy;
  }

  public List<TimeSeries> parseSeries(String csv, Map<String, String> aliases) {
    Map<String, TimeSeries.TimeSeriesBuilder> series = new LinkedHashMap<>();
    for (Map<String, String> row : rows(csv)) {
      String result = row.getOrDefault(COLUMN_RESULT, DEFAULT_RESULT);
      String key = result + "/" + row.getOrDefault(COLUMN_TABLE, "0");
      TimeSeries.TimeSeriesBuilder builder =
          series.computeIfAbsent(key, ignored -> newSeries(row, result, aliases));
      builder.point(new DataPoint(timestamp(row), value(row.get(COLUMN_VALUE))));
    }
    List<TimeSeries> parsed = new ArrayList<>();
    series.values().forEach(builder -> parsed.add(builder.build()));
    return parsed;
  }

  /** Distinct {@code _value} entries, optionally dropping internal names starting with '_'. */
  public List<String> parseValues(String csv, boolean skipInternal) {
    TreeSet<String> values = new TreeSet<>();
    for (Map<String, String> row : rows(csv)) {
      String value = row.get(COLUMN_VALUE);
      if (StringUtils.isEmpty(value) || (skipInternal && value.startsWith("_"))) {
        continue;
      }
      values.add(value);
    }
    return new ArrayList<>(values);
  }

  private TimeSeries.TimeSeriesBuilder newSeries(
      Map<String, String> row, String result, Map<String, String> aliases) {
    TimeSeries.TimeSeriesBuilder builder =
        TimeSeries.builder()
            .metric(
                fieldStrategy.metricName(
                    row.getOrDefault(COLUMN_MEASUREMENT, result), row.get(COLUMN_FIELD)))
            .alias(aliases.get(result));
    row.forEach(
        (column, value) -> {
          if (isLabelColumn(column) && StringUtils.isNotEmpty(value)) {
            builder.label(column, value);
          }
        });
    return builder;
  }

  private static boolean isLabelColumn(String column) {
    return !column.isEmpty()
        && !column.startsWith("_")
        && !COLUMN_RESULT.equals(column)
        && !COLUMN_TABLE.equals(column);
  }

  private static Instant timestamp(Map<String, String> row) {
    String value = row.containsKey(COLUMN_TIME) ? row.get(COLUMN_TIME) : row.get(COLUMN_STOP);
    if (StringUtils.isEmpty(value)) {
      throw new ResponseParseException("Row without _time or _stop column: " + row);
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      throw new ResponseParseException("Invalid timestamp '" + value + "'", e);
    }
  }

  private static Double value(String value) {
    if (StringUtils.isEmpty(value)) {
      return null;
    }
    try {
      return Double.valueOf(value);
    } catch (NumberFormatException e) {
      throw new ResponseParseException("Non-numeric value '" + value + "'", e);
    }
  }

  /** Data rows keyed by their header, across every table in the response. */
  private static List<Map<String, String>> rows(String csv) {
    List<Map<String, String>> rows = new ArrayList<>();
    if (StringUtils.isBlank(csv)) {
      return rows;
    }
    String[] header = null;
    String defaultResult = DEFAULT_RESULT;
    try (MappingIterator<String[]> iterator =
        CSV_MAPPER.readerFor(String[].class).readValues(csv)) {
      while (iterator.hasNext()) {
        String[] row = iterator.next();
        if (row.length == 0 || (row.length == 1 && row[0].isEmpty())) {
          continue;
        }
        if (row[0].startsWith("#")) {
          if ("#default".equals(row[0]) && row.length > 1 && !row[1].isEmpty()) {
            defaultResult = row[1];
          }
          continue;
        }
        if (isHeader(row)) {
          header = row;
          continue;
        }
        if (header == null) {
          throw new ResponseParseException("Data row before header in query response");
        }
        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < header.length && i < row.length; i++) {
          values.put(header[i], row[i]);
        }
        if (values.containsKey(COLUMN_ERROR) && !values.containsKey(COLUMN_TABLE)) {
          throw new ResponseParseException("Query error: " + values.get(COLUMN_ERROR));
        }
        if (StringUtils.isEmpty(values.get(COLUMN_RESULT))) {
          values.put(COLUMN_RESULT, defaultResult);
        }
        rows.add(values);
      }
    } catch (IOException | RuntimeJsonMappingException e) {
      throw new ResponseParseException("Malformed CSV response: " + e.getMessage(), e);
    }
    return rows;
  }

  private static boolean isHeader(String[] row) {
    if (row.length > 2 && COLUMN_RESULT.equals(row[1]) && COLUMN_TABLE.equals(row[2])) {
      return true;
    }
    // in-band error tables carry ",error,reference"
    return row.length > 1 && COLUMN_ERROR.equals(row[1]);
  }
}
