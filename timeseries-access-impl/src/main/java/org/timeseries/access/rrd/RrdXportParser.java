package org.timeseries.access.rrd;

import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import java.io.IOException;
import java.io.StringReader;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;
import org.timeseries.access.api.data.DataPoint;
import org.timeseries.access.driver.ResponseParseException;

/**
 * Reads {@code rrdtool xport --json} output. Older rrdtool releases emit unquoted keys, single
 * quotes and trailing commas, so the reader runs in lenient mode.
 */
public class RrdXportParser {

  public Xport parse(String json) {
    try (JsonReader reader = new JsonReader(new StringReader(json))) {
      reader.setLenient(true);
      long start = 0;
      long step = 0;
      List<String> legends = new ArrayList<>();
      List<List<Double>> rows = new ArrayList<>();

      reader.beginObject();
      while (reader.hasNext()) {
        String name = reader.nextName();
        if ("meta".equals(name)) {
          reader.beginObject();
          while (reader.hasNext()) {
            String key = reader.nextName();
            switch (key) {
              case "start":
                start = reader.nextLong();
                break;
              case "step":
                step = reader.nextLong();
                break;
              case "legend":
                readLegends(reader, legends);
                break;
              default:
                reader.skipValue();
            }
          }
          reader.endObject();
        } else if ("data".equals(name)) {
          reader.beginArray();
          while (reader.hasNext()) {
            if (reader.peek() == JsonToken.NULL) {
              reader.nextNull();
              continue;
            }
            rows.add(readRow(reader));
          }
          reader.endArray();
        } else {
          reader.skipValue();
        }
      }
      reader.endObject();
      return toXport(start, step, legends, rows);
    } catch (IOException | IllegalStateException | JsonParseException | NumberFormatException e) {
      throw new ResponseParseException("Invalid xport output: " + e.getMessage(), e);
    }
  }

  private static void readLegends(JsonReader reader, List<String> legends) throws IOException {
    reader.beginArray();
    while (reader.hasNext()) {
      if (reader.peek() == JsonToken.NULL) {
        reader.nextNull();
      } else {
        legends.add(reader.nextString());
      }
    }
    reader.endArray();
  }

  private static List<Double> readRow(JsonReader reader) throws IOException {
    List<Double> row = new ArrayList<>();
    reader.beginArray();
    while (reader.hasNext()) {
      JsonToken token = reader.peek();
      if (token == JsonToken.NULL) {
        reader.nextNull();
        row.add(null);
      } else if (token == JsonToken.STRING) {
        row.add(value(reader.nextString()));
      } else {
        row.add(value(reader.nextDouble()));
      }
    }
    reader.endArray();
    return row;
  }

  private static Double value(String raw) {
    String trimmed = raw.trim();
    if (trimmed.isEmpty() || "nan".equalsIgnoreCase(trimmed) || "null".equals(trimmed)) {
      return null;
    }
    return value(Double.parseDouble(trimmed));
  }

  private static Double value(double raw) {
    return Double.isNaN(raw) ? null : raw;
  }

  private static Xport toXport(
      long start, long step, List<String> legends, List<List<Double>> rows) {
    List<List<DataPoint>> columns = new ArrayList<>();
    for (int column = 0; column < legends.size(); column++) {
      List<DataPoint> points = new ArrayList<>();
      for (int row = 0; row < rows.size(); row++) {
        List<Double> values = rows.get(row);
        Instant timestamp = Instant.ofEpochSecond(start + row * step);
        points.add(new DataPoint(timestamp, column < values.size() ? values.get(column) : null));
      }
      columns.add(points);
    }
    return new Xport(start, step, legends, columns);
  }

  @Value
  public static class Xport {
    long start;
    long step;
    List<String> legends;
    /** Points per legend, in legend order. */
    List<List<DataPoint>> columns;
  }
}
