package dev.propertymatch.search;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A listing in the fused ranking produced by {@link WeightedRrfFusion}.
 *
 * @param listingId the listing
 * @param score cumulative weighted RRF score over the facets the listing appeared in
 * @param facetRanks 0-based position the listing held in each contributing facet's list
 */
public record FusedCandidate(String listingId, double score, Map<Facet, Integer> facetRanks) {

  public FusedCandidate {
    EnumMap<Facet, Integer> ranks = new EnumMap<>(Facet.class);
    ranks.putAll(facetRanks);
    facetRanks = Collections.unmodifiableMap(ranks);
  }
}
