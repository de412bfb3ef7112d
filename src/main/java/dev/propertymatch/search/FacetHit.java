package dev.propertymatch.search;

/**
 * One entry of a facet's ranked neighbour list. Only the position of a hit in its list matters to
 * fusion; the score is kept for diagnostics because scores of different facets are not comparable.
 *
 * @param listingId the neighbouring listing
 * @param score the similarity reported by the facet's vector index
 */
public record FacetHit(String listingId, double score) {}
