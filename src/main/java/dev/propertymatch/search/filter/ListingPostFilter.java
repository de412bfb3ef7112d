package dev.propertymatch.search.filter;

import dev.propertymatch.listing.ListingDataException;
import dev.propertymatch.listing.ListingRecord;
import dev.propertymatch.listing.PriceRange;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pure static utility applying a {@link ListingFilter} to hydrated listings.
 *
 * <p>Filtering runs in application code after fusion rather than inside the vector store: the
 * candidate set is small, and price, room and amenity constraints have nothing to do with vector
 * similarity.
 *
 * <p>A listing whose filter-relevant data is malformed is excluded and logged; it never fails the
 * batch. Input records are never modified and survivors keep their relative order.
 */
public final class ListingPostFilter {

  private static final Logger log = LoggerFactory.getLogger(ListingPostFilter.class);

  private ListingPostFilter() {}

  /**
   * Selects the listings satisfying every constraint of {@code filter}.
   *
   * @param listings candidate listings in ranked order
   * @param filter the constraints, or null for no filtering
   * @return the surviving listings, in their original relative order
   */
  public static List<ListingRecord> apply(
      List<ListingRecord> listings, @Nullable ListingFilter filter) {
    if (filter == null) {
      return listings;
    }
    return listings.stream().filter(listing -> matches(listing, filter)).toList();
  }

  /**
   * Evaluates one listing against a filter, checking in order: price, bedrooms, bathrooms,
   * property type, amenities. Stops at the first failed check.
   *
   * @param listing the listing to check
   * @param filter the constraints
   * @return true if the listing satisfies every constraint; false otherwise, including when its
   *     data is malformed
   */
  public static boolean matches(ListingRecord listing, ListingFilter filter) {
    try {
      return matchesPrice(listing, filter)
          && matchesBedrooms(listing, filter)
          && matchesBathrooms(listing, filter)
          && matchesPropertyType(listing, filter)
          && matchesAmenities(listing, filter);
    } catch (ListingDataException e) {
      log.warn("Excluding listing {} from filtered results: {}", listing.id(), e.getMessage());
      return false;
    }
  }

  private static boolean matchesPrice(ListingRecord listing, ListingFilter filter) {
    PriceRange price = listing.effectivePrice();
    if (price == null) {
      return false;
    }
    if (filter.minPrice() != null && price.isBelow(filter.minPrice())) {
      return false;
    }
    return filter.maxPrice() == null || !price.isAbove(filter.maxPrice());
  }

  private static boolean matchesBedrooms(ListingRecord listing, ListingFilter filter) {
    Integer bedrooms = listing.bedrooms();
    if (bedrooms == null) {
      return false;
    }
    if (filter.minBedrooms() != null && bedrooms < filter.minBedrooms()) {
      return false;
    }
    return filter.maxBedrooms() == null || bedrooms <= filter.maxBedrooms();
  }

  private static boolean matchesBathrooms(ListingRecord listing, ListingFilter filter) {
    Double bathrooms = listing.bathrooms();
    if (bathrooms == null) {
      return false;
    }
    if (bathrooms.isNaN()) {
      throw new ListingDataException("Bathroom count is not a number");
    }
    if (filter.minBathrooms() != null && bathrooms < filter.minBathrooms()) {
      return false;
    }
    return filter.maxBathrooms() == null || bathrooms <= filter.maxBathrooms();
  }

  private static boolean matchesPropertyType(ListingRecord listing, ListingFilter filter) {
    return filter.propertyType() == null || filter.propertyType().equals(listing.propertyType());
  }

  private static boolean matchesAmenities(ListingRecord listing, ListingFilter filter) {
    return listing.amenities().containsAll(filter.amenities());
  }
}
