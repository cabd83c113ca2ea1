package io.github.themoah.klimat.api;

import io.github.themoah.klimat.model.AnomalyRecord;
import io.github.themoah.klimat.model.DayOfYearProfile;
import io.github.themoah.klimat.model.Observation;
import io.github.themoah.klimat.model.SeasonalStat;
import io.github.themoah.klimat.weather.LiveComparison;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Converts analysis records to JSON. Undefined values (NaN) are written as null.
 */
final class JsonMapper {

  private JsonMapper() {}

  static JsonObject stat(SeasonalStat stat) {
    return new JsonObject()
      .put("season", stat.season().label())
      .put("meanTemp", number(stat.meanTemp()))
      .put("stdDev", number(stat.stdDev()))
      .put("count", stat.count());
  }

  static JsonObject observation(Observation observation) {
    return new JsonObject()
      .put("timestamp", observation.timestamp().toString())
      .put("season", observation.season().label())
      .put("temperature", observation.temperature())
      .put("rollingAverage", number(observation.rollingAverage()));
  }

  static JsonObject anomaly(AnomalyRecord anomaly) {
    return observation(anomaly.observation())
      .put("meanTemp", number(anomaly.stat().meanTemp()))
      .put("stdDev", number(anomaly.stat().stdDev()))
      .put("deviation", anomaly.deviation())
      .put("zScore", number(anomaly.zScore()));
  }

  static JsonObject profile(DayOfYearProfile profile) {
    JsonArray points = new JsonArray();
    for (DayOfYearProfile.Point point : profile.points()) {
      points.add(new JsonObject()
        .put("dayOfYear", point.dayOfYear())
        .put("mean", number(point.mean()))
        .put("stdDev", number(point.stdDev()))
        .put("lower", number(point.lower()))
        .put("upper", number(point.upper()))
        .put("count", point.count()));
    }
    return new JsonObject()
      .put("city", profile.city())
      .put("points", points);
  }

  static JsonObject comparison(LiveComparison comparison) {
    return new JsonObject()
      .put("city", comparison.stat().city())
      .put("resolvedName", comparison.weather().city())
      .put("season", comparison.stat().season().label())
      .put("currentTemp", comparison.weather().temperature())
      .put("windSpeed", number(comparison.weather().windSpeed()))
      .put("description", comparison.weather().description())
      .put("meanTemp", number(comparison.stat().meanTemp()))
      .put("stdDev", number(comparison.stat().stdDev()))
      .put("deviation", number(comparison.deviation()))
      .put("deviationStd", number(comparison.deviationStd()))
      .put("anomalous", comparison.anomalous())
      .put("direction", comparison.direction().name());
  }

  private static Double number(double value) {
    return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
  }
}
