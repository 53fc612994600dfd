package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.domain.Feature;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts feature and metric lists to the name-to-value maps used in exchange records.
 *
 * @since 0.1.0
 */
public final class Features {
  private Features() {}

  /**
   * Converts features to an insertion-ordered map.
   *
   * @param features domain features
   * @return map keyed by feature name; empty when there are no features
   */
  public static Map<String, Double> toMap(List<Feature> features) {
    Map<String, Double> map = new LinkedHashMap<>();
    for (Feature feature : features) {
      map.put(feature.name(), feature.value());
    }
    return map;
  }

  /**
   * Converts a name-to-value map back to features, keeping the map's iteration order.
   *
   * @param values map keyed by feature name; may be {@code null}
   * @return features
   */
  public static List<Feature> fromMap(Map<String, Double> values) {
    if (values == null) {
      return List.of();
    }
    List<Feature> features = new ArrayList<>(values.size());
    values.forEach((name, value) -> features.add(new Feature(name, value)));
    return features;
  }
}
