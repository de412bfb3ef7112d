package dev.propertymatch.search;

/**
 * Thrown when the query listing has no stored vector in one of the facet indexes. All facets are
 * required; a listing missing from any of them was never fully indexed.
 */
public class QueryListingNotFoundException extends SimilaritySearchException {

  private final String listingId;
  private final Facet facet;

  public QueryListingNotFoundException(String listingId, Facet facet) {
    super("Listing '" + listingId + "' has no vector in facet '" + facet.value() + "'");
    this.listingId = listingId;
    this.facet = facet;
  }

  public String getListingId() {
    return listingId;
  }

  public Facet getFacet() {
    return facet;
  }
}
