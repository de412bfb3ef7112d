package dev.propertymatch.api;

import dev.propertymatch.api.dto.SearchModeResponse;
import dev.propertymatch.api.dto.SimilarListingResponse;
import dev.propertymatch.search.FacetWeightProfile;
import dev.propertymatch.search.FacetWeightProfiles;
import dev.propertymatch.search.SearchProperties;
import dev.propertymatch.search.SimilarListing;
import dev.propertymatch.search.SimilarListingSearchService;
import dev.propertymatch.search.SimilarListingsRequest;
import dev.propertymatch.search.filter.ListingFilter;
import jakarta.validation.constraints.Min;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter over {@link SimilarListingSearchService}.
 *
 * <p>Filter parameters are optional; when none is given the results are not filtered at all. Any
 * filter parameter switches filtering on, which also drops listings without a price, bedroom count
 * or bathroom count. Errors are rendered by {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
public class SimilarListingsController {

  private final SimilarListingSearchService searchService;
  private final FacetWeightProfiles profiles;
  private final SearchProperties properties;

  public SimilarListingsController(
      SimilarListingSearchService searchService,
      FacetWeightProfiles profiles,
      SearchProperties properties) {
    this.searchService = searchService;
    this.profiles = profiles;
    this.properties = properties;
  }

  @GetMapping("/listings/{listingId}/similar")
  public List<SimilarListingResponse> similarListings(
      @PathVariable String listingId,
      @RequestParam(defaultValue = FacetWeightProfile.DEFAULT_MODE) String mode,
      @RequestParam(defaultValue = "10") @Min(1) int topK,
      @RequestParam(required = false) @Nullable Double minPrice,
      @RequestParam(required = false) @Nullable Double maxPrice,
      @RequestParam(required = false) @Nullable Integer minBedrooms,
      @RequestParam(required = false) @Nullable Integer maxBedrooms,
      @RequestParam(required = false) @Nullable Double minBathrooms,
      @RequestParam(required = false) @Nullable Double maxBathrooms,
      @RequestParam(required = false) @Nullable String propertyType,
      @RequestParam(required = false) @Nullable List<String> amenities) {
    if (topK > properties.getMaxTopK()) {
      throw new IllegalArgumentException(
          "topK must be at most " + properties.getMaxTopK() + ", got: " + topK);
    }
    ListingFilter filter = null;
    if (minPrice != null
        || maxPrice != null
        || minBedrooms != null
        || maxBedrooms != null
        || minBathrooms != null
        || maxBathrooms != null
        || propertyType != null
        || (amenities != null && !amenities.isEmpty())) {
      filter =
          new ListingFilter(
              minPrice,
              maxPrice,
              minBedrooms,
              maxBedrooms,
              minBathrooms,
              maxBathrooms,
              propertyType,
              amenities);
    }

    List<SimilarListing> results =
        searchService.search(new SimilarListingsRequest(listingId, mode, filter, topK));

    List<SimilarListingResponse> response = new ArrayList<>(results.size());
    for (int i = 0; i < results.size(); i++) {
      response.add(SimilarListingResponse.from(i + 1, results.get(i)));
    }
    return response;
  }

  @GetMapping("/search-modes")
  public List<SearchModeResponse> searchModes() {
    return profiles.all().stream().map(SearchModeResponse::from).toList();
  }
}
