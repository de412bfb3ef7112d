package dev.propertymatch.search;

import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the similar-listing search pipeline.
 *
 * <p>Properties are bound from {@code propertymatch.search.*} in application.yml /
 * application.properties.
 *
 * <ul>
 *   <li>{@code rrf-k} - RRF smoothing constant; larger values flatten the gap between ranks
 *       (default 60, at least 0)
 *   <li>{@code over-fetch-factor} - neighbours requested per facet, as a multiple of the requested
 *       result count (default 2, bounded [1, 20])
 *   <li>{@code hydration-factor} - fused candidates hydrated before filtering, as a multiple of the
 *       requested result count (default 5, bounded [1, 50])
 *   <li>{@code collaborator-timeout-ms} - time budget for each vector-store or record-store stage
 *       (default 2000, bounded [1, 60000])
 *   <li>{@code max-top-k} - largest result count a caller may request (default 50, bounded [1,
 *       1000])
 *   <li>{@code profiles} - additional search modes, {@code profiles.<name>.<facet>=<weight>}
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range. Profile weights are validated when {@link FacetWeightProfiles} is built.
 */
@Configuration
@ConfigurationProperties(prefix = "propertymatch.search")
public class SearchProperties {

  private int rrfK = WeightedRrfFusion.DEFAULT_K;
  private int overFetchFactor = 2;
  private int hydrationFactor = 5;
  private long collaboratorTimeoutMs = 2000;
  private int maxTopK = 50;
  private Map<String, Map<String, Double>> profiles = new LinkedHashMap<>();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (rrfK < 0) {
      throw new IllegalStateException("propertymatch.search.rrf-k must be >= 0, got: " + rrfK);
    }
    if (overFetchFactor < 1 || overFetchFactor > 20) {
      throw new IllegalStateException(
          "propertymatch.search.over-fetch-factor must be in [1, 20], got: " + overFetchFactor);
    }
    if (hydrationFactor < 1 || hydrationFactor > 50) {
      throw new IllegalStateException(
          "propertymatch.search.hydration-factor must be in [1, 50], got: " + hydrationFactor);
    }
    if (collaboratorTimeoutMs < 1 || collaboratorTimeoutMs > 60_000) {
      throw new IllegalStateException(
          "propertymatch.search.collaborator-timeout-ms must be in [1, 60000], got: "
              + collaboratorTimeoutMs);
    }
    if (maxTopK < 1 || maxTopK > 1000) {
      throw new IllegalStateException(
          "propertymatch.search.max-top-k must be in [1, 1000], got: " + maxTopK);
    }
  }

  public int getRrfK() {
    return rrfK;
  }

  public void setRrfK(int rrfK) {
    this.rrfK = rrfK;
  }

  public int getOverFetchFactor() {
    return overFetchFactor;
  }

  public void setOverFetchFactor(int overFetchFactor) {
    this.overFetchFactor = overFetchFactor;
  }

  public int getHydrationFactor() {
    return hydrationFactor;
  }

  public void setHydrationFactor(int hydrationFactor) {
    this.hydrationFactor = hydrationFactor;
  }

  public long getCollaboratorTimeoutMs() {
    return collaboratorTimeoutMs;
  }

  public void setCollaboratorTimeoutMs(long collaboratorTimeoutMs) {
    this.collaboratorTimeoutMs = collaboratorTimeoutMs;
  }

  public int getMaxTopK() {
    return maxTopK;
  }

  public void setMaxTopK(int maxTopK) {
    this.maxTopK = maxTopK;
  }

  public Map<String, Map<String, Double>> getProfiles() {
    return profiles;
  }

  public void setProfiles(Map<String, Map<String, Double>> profiles) {
    this.profiles = profiles;
  }
}
