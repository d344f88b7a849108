package org.timeseries.access.api.capability;

import java.util.ArrayList;
import java.util.List;
import lombok.Value;
import org.timeseries.access.api.UnsupportedFeatureException;
import org.timeseries.access.api.query.DataQuery;
import org.timeseries.access.api.query.LabelQuery;
import org.timeseries.access.api.query.Operation;
import org.timeseries.access.api.query.Query;
import org.timeseries.access.api.query.Stream;

/**
 * Checks a query against a driver's capabilities before it is compiled. Either every feature the
 * query needs is declared, or compilation fails as a whole.
 */
public final class CapabilityGate {

  private CapabilityGate() {}

  /** Features needed by {@code query}, in the order they appear in it. */
  public static List<Requirement> requiredCapabilities(Query query) {
    List<Requirement> requirements = new ArrayList<>();
    switch (query.getQueryType()) {
      case DATA:
        for (Stream stream : ((DataQuery) query).getStreams()) {
          String metric = stream.getMetric().key();
          if (stream.getFilter().requiresRegex()) {
            requirements.add(new Requirement(Capability.REGEX, metric));
          }
          for (Operation operation : stream.getPipeline()) {
            requirements.add(
                new Requirement(Capability.forOperation(operation.getType()), metric));
          }
          if (!stream.getAggregations().isEmpty()) {
            requirements.add(new Requirement(Capability.AGGREGATION, metric));
          }
        }
        break;
      case LABEL:
        LabelQuery labelQuery = (LabelQuery) query;
        requirements.add(new Requirement(Capability.LABEL_DISCOVERY, labelQuery.getKind().name()));
        if (labelQuery.getFilter().requiresRegex()) {
          requirements.add(new Requirement(Capability.REGEX, labelQuery.getKind().name()));
        }
        break;
      default:
        throw new IllegalArgumentException("Unhandled query type " + query.getQueryType());
    }
    return requirements;
  }

  /**
   * @throws UnsupportedFeatureException for the first requirement {@code capabilities} lacks
   */
  public static void check(Query query, Capabilities capabilities) {
    for (Requirement requirement : requiredCapabilities(query)) {
      if (!capabilities.supports(requirement.getCapability())) {
        throw new UnsupportedFeatureException(
            requirement.getCapability().getFeature(),
            query,
            String.format(
                "Driver does not support %s (required by %s)",
                requirement.getCapability().getFeature(), requirement.getSource()));
      }
    }
  }

  @Value
  public static class Requirement {
    Capability capability;
    String source;
  }
}
