package org.timeseries.access.graphite;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Singular;
import lombok.Value;
import org.timeseries.access.api.data.DataPoint;

/** One entry of the render API's JSON array. */
@Value
@Builder
@NoArgsConstructor(force = true)
@AllArgsConstructor
class GraphiteRenderResponse {
  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  private static final TypeReference<List<GraphiteRenderResponse>> RESPONSE_TYPE =
      new TypeReference<>() {};
  private static final TypeReference<List<String>> INDEX_TYPE = new TypeReference<>() {};
  private static final String NAME_TAG = "name";

  @JsonProperty("target")
  String target;

  @JsonProperty("tags")
  @Singular
  Map<String, String> tags;

  @JsonProperty("datapoints")
  @JsonDeserialize(using = DataPointsDeserializer.class)
  @Singular
  List<DataPoint> datapoints;

  /** The series path Graphite tagged the result with, falling back to the target name. */
  String seriesName() {
    if (tags != null && tags.containsKey(NAME_TAG)) {
      return tags.get(NAME_TAG);
    }
    return target;
  }

  List<DataPoint> points() {
    return datapoints == null ? List.of() : datapoints;
  }

  /** Graphite emits {@code [value, epochSeconds]} pairs with {@code null} for gaps. */
  static class DataPointsDeserializer extends JsonDeserializer<List<DataPoint>> {

    @Override
    public List<DataPoint> deserialize(JsonParser parser, DeserializationContext context)
        throws IOException {
      List<DataPoint> points = new ArrayList<>();
      JsonNode node = parser.getCodec().readTree(parser);
      for (JsonNode pair : node) {
        if (!pair.isArray() || pair.size() < 2) {
          continue;
        }
        JsonNode value = pair.get(0);
        Instant timestamp = Instant.ofEpochSecond(pair.get(1).asLong());
        points.add(new DataPoint(timestamp, value.isNumber() ? value.asDouble() : null));
      }
      return points;
    }
  }

  static List<GraphiteRenderResponse> fromJson(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, RESPONSE_TYPE);
  }

  /** Parses {@code /metrics/index.json}, a flat array of every known path. */
  static List<String> indexFromJson(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, INDEX_TYPE);
  }
}
