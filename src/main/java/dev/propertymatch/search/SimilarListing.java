package dev.propertymatch.search;

import dev.propertymatch.listing.ListingRecord;
import java.util.Map;

/**
 * Domain DTO for one similar listing.
 *
 * @param listing the hydrated listing
 * @param fusedScore weighted RRF score the listing was ranked by
 * @param facetRanks 0-based position the listing held in each facet that returned it
 */
public record SimilarListing(
    ListingRecord listing, double fusedScore, Map<Facet, Integer> facetRanks) {}
