package dev.propertymatch.api.dto;

import dev.propertymatch.listing.ListingRecord;
import dev.propertymatch.search.Facet;
import dev.propertymatch.search.SimilarListing;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON view of one similar listing.
 *
 * @param rank 1-based position in the result list
 * @param listing the listing record
 * @param fusedScore weighted RRF score
 * @param facetRanks 0-based position per facet name, for the facets that returned the listing
 */
public record SimilarListingResponse(
    int rank, ListingRecord listing, double fusedScore, Map<String, Integer> facetRanks) {

  public static SimilarListingResponse from(int rank, SimilarListing result) {
    Map<String, Integer> ranks = new LinkedHashMap<>();
    for (Map.Entry<Facet, Integer> entry : result.facetRanks().entrySet()) {
      ranks.put(entry.getKey().value(), entry.getValue());
    }
    return new SimilarListingResponse(rank, result.listing(), result.fusedScore(), ranks);
  }
}
