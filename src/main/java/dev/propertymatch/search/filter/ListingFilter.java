package dev.propertymatch.search.filter;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Structured constraints applied to similar listings after fusion.
 *
 * <p>Every bound is optional. Supplying a filter at all still requires each listing to carry a
 * price, a bedroom count and a bathroom count; listings lacking one are excluded even when the
 * matching bound is unset. To skip filtering entirely, pass no filter.
 *
 * @param minPrice exclude listings whose highest price is below this
 * @param maxPrice exclude listings whose lowest price is above this
 * @param minBedrooms minimum bedroom count, inclusive
 * @param maxBedrooms maximum bedroom count, inclusive
 * @param minBathrooms minimum bathroom count, inclusive
 * @param maxBathrooms maximum bathroom count, inclusive
 * @param propertyType required property type, exact match
 * @param amenities amenities that must all be present
 */
public record ListingFilter(
    @Nullable Double minPrice,
    @Nullable Double maxPrice,
    @Nullable Integer minBedrooms,
    @Nullable Integer maxBedrooms,
    @Nullable Double minBathrooms,
    @Nullable Double maxBathrooms,
    @Nullable String propertyType,
    List<String> amenities) {

  /** Compact constructor rejecting non-finite and inverted bounds. */
  public ListingFilter {
    requireFinite("minPrice", minPrice);
    requireFinite("maxPrice", maxPrice);
    requireFinite("minBathrooms", minBathrooms);
    requireFinite("maxBathrooms", maxBathrooms);
    requireOrdered("price", minPrice, maxPrice);
    requireOrdered("bedrooms", minBedrooms, maxBedrooms);
    requireOrdered("bathrooms", minBathrooms, maxBathrooms);
    amenities =
        amenities == null ? List.of() : amenities.stream().filter(Objects::nonNull).toList();
  }

  /** A filter with no bounds; only the presence requirements apply. */
  public static ListingFilter presenceOnly() {
    return new ListingFilter(null, null, null, null, null, null, null, List.of());
  }

  /** A filter bounding the bedroom count only. */
  public static ListingFilter bedrooms(@Nullable Integer min, @Nullable Integer max) {
    return new ListingFilter(null, null, min, max, null, null, null, List.of());
  }

  /** A filter bounding the price only. */
  public static ListingFilter price(@Nullable Double min, @Nullable Double max) {
    return new ListingFilter(min, max, null, null, null, null, null, List.of());
  }

  private static void requireFinite(String field, @Nullable Double bound) {
    if (bound != null && !Double.isFinite(bound)) {
      throw new IllegalArgumentException(field + " must be a finite number, got: " + bound);
    }
  }

  private static <T extends Comparable<T>> void requireOrdered(
      String field, @Nullable T min, @Nullable T max) {
    if (min != null && max != null && min.compareTo(max) > 0) {
      throw new IllegalArgumentException(
          "min " + field + " (" + min + ") must not exceed max " + field + " (" + max + ")");
    }
  }
}
