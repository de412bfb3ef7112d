package dev.propertymatch.search;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A named search mode: the weight each facet's ranking carries in fusion. Weights lie in [0, 1]
 * and are used as given; they need not sum to 1. A facet without an entry weighs 0.
 *
 * @param name the search mode name callers select the profile by
 * @param weights weight per facet
 */
public record FacetWeightProfile(String name, Map<Facet, Double> weights) {

  public static final FacetWeightProfile BALANCED = of("balanced", 0.4, 0.4, 0.2);
  public static final FacetWeightProfile VISUAL_FOCUS = of("visual_focus", 0.1, 0.1, 0.8);
  public static final FacetWeightProfile FEATURES_FOCUS = of("features_focus", 0.1, 0.8, 0.1);
  public static final FacetWeightProfile LOCATION_FOCUS = of("location_focus", 0.8, 0.1, 0.1);

  /** Name of the profile used when a caller does not choose one. */
  public static final String DEFAULT_MODE = "balanced";

  public FacetWeightProfile {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Weight profile name must not be blank");
    }
    EnumMap<Facet, Double> copy = new EnumMap<>(Facet.class);
    for (Map.Entry<Facet, Double> entry : weights.entrySet()) {
      double weight = entry.getValue();
      if (!Double.isFinite(weight) || weight < 0.0 || weight > 1.0) {
        throw new InvalidWeightException(name, entry.getKey(), weight);
      }
      copy.put(entry.getKey(), weight);
    }
    weights = Collections.unmodifiableMap(copy);
  }

  /** Returns the weight of {@code facet}, 0 if the profile does not mention it. */
  public double weight(Facet facet) {
    return weights.getOrDefault(facet, 0.0);
  }

  /** The profiles every deployment provides. */
  public static List<FacetWeightProfile> builtIns() {
    return List.of(BALANCED, VISUAL_FOCUS, FEATURES_FOCUS, LOCATION_FOCUS);
  }

  private static FacetWeightProfile of(
      String name, double location, double features, double visual) {
    return new FacetWeightProfile(
        name, Map.of(Facet.LOCATION, location, Facet.FEATURES, features, Facet.VISUAL, visual));
  }
}
