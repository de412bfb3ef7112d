package dev.propertymatch.search;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Registry of the search modes a caller can choose from: the built-in profiles plus any declared
 * under {@code propertymatch.search.profiles}. Built once at startup and immutable afterwards, so
 * an invalid configured weight fails application startup rather than a request.
 */
@Component
public class FacetWeightProfiles {

  private static final Logger log = LoggerFactory.getLogger(FacetWeightProfiles.class);

  private final Map<String, FacetWeightProfile> profilesByName;

  public FacetWeightProfiles(SearchProperties properties) {
    Map<String, FacetWeightProfile> profiles = new LinkedHashMap<>();
    for (FacetWeightProfile builtIn : FacetWeightProfile.builtIns()) {
      profiles.put(builtIn.name(), builtIn);
    }
    for (Map.Entry<String, Map<String, Double>> entry : properties.getProfiles().entrySet()) {
      String name = normalise(entry.getKey());
      if (profiles.containsKey(name)) {
        throw new InvalidWeightException(
            "Weight profile '" + name + "' is already defined and cannot be redeclared");
      }
      profiles.put(name, new FacetWeightProfile(name, toFacetWeights(entry.getValue())));
    }
    this.profilesByName = Collections.unmodifiableMap(profiles);
    log.info("Registered search modes: {}", profilesByName.keySet());
  }

  /**
   * Resolves a search mode by name, case-insensitively.
   *
   * @param mode the search mode name, e.g. {@code "visual_focus"}
   * @return the matching profile
   * @throws UnknownSearchModeException if no profile has that name
   */
  public FacetWeightProfile resolve(String mode) {
    FacetWeightProfile profile = profilesByName.get(normalise(mode));
    if (profile == null) {
      throw new UnknownSearchModeException(mode, profilesByName.keySet());
    }
    return profile;
  }

  /** All registered profiles, built-ins first. */
  public Collection<FacetWeightProfile> all() {
    return profilesByName.values();
  }

  private static Map<Facet, Double> toFacetWeights(Map<String, Double> configured) {
    Map<Facet, Double> weights = new EnumMap<>(Facet.class);
    configured.forEach((facet, weight) -> weights.put(Facet.fromValue(facet), weight));
    return weights;
  }

  private static String normalise(String mode) {
    return mode.trim().toLowerCase(Locale.ROOT);
  }
}
