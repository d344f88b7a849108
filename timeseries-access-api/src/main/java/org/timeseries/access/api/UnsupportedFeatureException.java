package org.timeseries.access.api;

import org.timeseries.access.api.query.Query;

/**
 * The query needs a feature the target driver does not declare. Always raised while compiling,
 * before any command reaches the backend.
 */
public class UnsupportedFeatureException extends QueryException {
  private final String feature;

  public UnsupportedFeatureException(String feature, Query query, String message) {
    super(query, message);
    this.feature = feature;
  }

  public String getFeature() {
    return feature;
  }
}
