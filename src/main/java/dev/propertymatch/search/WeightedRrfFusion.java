package dev.propertymatch.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pure static utility fusing per-facet neighbour rankings with weighted Reciprocal Rank Fusion.
 *
 * <p>Each facet ranks candidates with its own embedding model, so raw similarity scores of two
 * facets live on unrelated scales. Fusion therefore only looks at positions: the hit at 0-based
 * position {@code rank} of facet {@code f} adds {@code w_f / (k + rank + 1)} to its listing's
 * total.
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions.
 */
public final class WeightedRrfFusion {

  private static final Logger log = LoggerFactory.getLogger(WeightedRrfFusion.class);

  /** Standard RRF smoothing constant from the original RRF paper. */
  public static final int DEFAULT_K = 60;

  private WeightedRrfFusion() {}

  /**
   * Fuses facet rankings using the weights of a search mode.
   *
   * @see #fuse(Map, Map, int)
   */
  public static List<FusedCandidate> fuse(
      Map<Facet, List<FacetHit>> rankedLists, FacetWeightProfile profile, int k) {
    return fuse(rankedLists, profile.weights(), k);
  }

  /**
   * Fuses facet rankings into one ranking.
   *
   * <p>Algorithm:
   *
   * <ol>
   *   <li>Reject negative or non-finite weights
   *   <li>Visit facets in {@link Facet} declaration order, skipping facets that are absent from
   *       {@code rankedLists} or weigh 0 (absent from {@code weights} means 0)
   *   <li>For each hit at position {@code rank}, add {@code weight / (k + rank + 1)} to the hit's
   *       listing, recording the position per facet
   *   <li>Sort by total score descending; equal totals keep the order in which listings first
   *       appeared
   * </ol>
   *
   * <p>A listing listed twice by the same facet only counts at its first position.
   *
   * @param rankedLists neighbour list per facet, each ordered by descending similarity
   * @param weights weight per facet
   * @param k RRF smoothing constant, at least 0
   * @return fused candidates ordered by fused score descending
   * @throws InvalidWeightException if a weight is negative, NaN or infinite
   * @throws IllegalArgumentException if {@code k} is negative
   */
  public static List<FusedCandidate> fuse(
      Map<Facet, List<FacetHit>> rankedLists, Map<Facet, Double> weights, int k) {
    if (k < 0) {
      throw new IllegalArgumentException("RRF k must be >= 0, got: " + k);
    }
    for (Map.Entry<Facet, Double> entry : weights.entrySet()) {
      double weight = entry.getValue();
      if (!Double.isFinite(weight) || weight < 0.0) {
        throw new InvalidWeightException(
            "Facet '" + entry.getKey().value() + "' has invalid weight " + weight);
      }
    }

    // Insertion order doubles as the tie-break order
    Map<String, MutableCandidate> candidates = new LinkedHashMap<>();

    for (Facet facet : Facet.values()) {
      List<FacetHit> hits = rankedLists.get(facet);
      double weight = weights.getOrDefault(facet, 0.0);
      if (hits == null || hits.isEmpty() || weight == 0.0) {
        continue;
      }
      for (int rank = 0; rank < hits.size(); rank++) {
        String listingId = hits.get(rank).listingId();
        MutableCandidate candidate =
            candidates.computeIfAbsent(listingId, MutableCandidate::new);
        if (candidate.facetRanks.containsKey(facet)) {
          log.warn(
              "Listing {} appears more than once in facet {}; keeping rank {}",
              listingId,
              facet.value(),
              candidate.facetRanks.get(facet));
          continue;
        }
        candidate.facetRanks.put(facet, rank);
        candidate.score += weight * (1.0 / (k + rank + 1));
      }
    }

    // List.sort is stable
    List<MutableCandidate> ordered = new ArrayList<>(candidates.values());
    ordered.sort(Comparator.comparingDouble(MutableCandidate::getScore).reversed());

    List<FusedCandidate> fused = new ArrayList<>(ordered.size());
    for (MutableCandidate candidate : ordered) {
      fused.add(new FusedCandidate(candidate.listingId, candidate.score, candidate.facetRanks));
    }
    return fused;
  }

  private static final class MutableCandidate {
    private final String listingId;
    private final Map<Facet, Integer> facetRanks = new EnumMap<>(Facet.class);
    private double score;

    private MutableCandidate(String listingId) {
      this.listingId = listingId;
    }

    private double getScore() {
      return score;
    }
  }
}
