package dev.propertymatch.api.dto;

import dev.propertymatch.search.Facet;
import dev.propertymatch.search.FacetWeightProfile;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON view of a registered search mode.
 *
 * @param name the mode name to pass as {@code mode}
 * @param weights weight per facet name
 */
public record SearchModeResponse(String name, Map<String, Double> weights) {

  public static SearchModeResponse from(FacetWeightProfile profile) {
    Map<String, Double> weights = new LinkedHashMap<>();
    for (Facet facet : Facet.values()) {
      weights.put(facet.value(), profile.weight(facet));
    }
    return new SearchModeResponse(profile.name(), weights);
  }
}
