package dev.propertymatch.search;

import dev.propertymatch.search.filter.ListingFilter;
import org.jspecify.annotations.Nullable;

/**
 * Domain request for listings similar to a query listing.
 *
 * @param listingId the query listing (must not be null or blank)
 * @param mode name of the search mode (weight profile) to fuse with
 * @param filter optional post-fusion constraints; null means no filtering
 * @param topK the maximum number of results to return (must be >= 1)
 */
public record SimilarListingsRequest(
    String listingId, String mode, @Nullable ListingFilter filter, int topK) {

  /** Default number of results when not specified. */
  private static final int DEFAULT_TOP_K = 10;

  /** Compact constructor validating input. */
  public SimilarListingsRequest {
    if (listingId == null || listingId.isBlank()) {
      throw new IllegalArgumentException("Listing id must not be blank");
    }
    if (mode == null || mode.isBlank()) {
      throw new IllegalArgumentException("Search mode must not be blank");
    }
    if (topK < 1) {
      throw new IllegalArgumentException("topK must be at least 1");
    }
  }

  /** Convenience constructor using the balanced mode, 10 results and no filter. */
  public SimilarListingsRequest(String listingId) {
    this(listingId, FacetWeightProfile.DEFAULT_MODE, null, DEFAULT_TOP_K);
  }

  /** Convenience constructor without a filter. */
  public SimilarListingsRequest(String listingId, String mode, int topK) {
    this(listingId, mode, null, topK);
  }
}
