package dev.propertymatch.listing;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Hydrated attribute payload of a real-estate listing, as returned by the record store.
 *
 * <p>Only the price, room counts, property type and amenities are read by the post-filter; the
 * descriptive fields are carried through to callers untouched. Records arrive from heterogeneous
 * sources, so every filter-relevant field is optional and {@code priceRange} is kept as the raw
 * {@code "low-high"} text it was delivered as (see {@link PriceRange#parse(String)}).
 *
 * @param id unique listing identifier, identical across all facet indexes
 * @param locationDescription free-text description of the location
 * @param listPrice single asking price, if the listing has one
 * @param priceRange asking price range as raw text, e.g. {@code "2000-2500"}
 * @param bedrooms total bedroom count
 * @param bathrooms total bathroom count (half baths allowed, e.g. 1.5)
 * @param propertyType property type label, e.g. {@code "apartment"}
 * @param amenities amenity labels, e.g. {@code "parking"}, {@code "pool"}
 * @param interiorFeatures interior feature labels
 * @param appliances appliance labels
 * @param exteriorFeatures exterior feature labels
 * @param lotFeatures lot feature labels
 * @param architecturalStyle architectural style label
 * @param neighborhood neighborhood name
 * @param city city name
 * @param municipality municipality name
 * @param county county name
 * @param photoUrls listing photo URLs
 */
public record ListingRecord(
    String id,
    @Nullable String locationDescription,
    @Nullable Double listPrice,
    @Nullable String priceRange,
    @Nullable Integer bedrooms,
    @Nullable Double bathrooms,
    @Nullable String propertyType,
    List<String> amenities,
    List<String> interiorFeatures,
    List<String> appliances,
    List<String> exteriorFeatures,
    List<String> lotFeatures,
    @Nullable String architecturalStyle,
    @Nullable String neighborhood,
    @Nullable String city,
    @Nullable String municipality,
    @Nullable String county,
    List<String> photoUrls) {

  /** Compact constructor: requires an ID and replaces absent collections with empty lists. */
  public ListingRecord {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Listing id must not be blank");
    }
    amenities = copyOrEmpty(amenities);
    interiorFeatures = copyOrEmpty(interiorFeatures);
    appliances = copyOrEmpty(appliances);
    exteriorFeatures = copyOrEmpty(exteriorFeatures);
    lotFeatures = copyOrEmpty(lotFeatures);
    photoUrls = copyOrEmpty(photoUrls);
  }

  /**
   * Resolves the effective asking price interval of this listing. A price range takes precedence
   * over a single list price.
   *
   * @return the price interval, or {@code null} if the listing carries no price at all
   * @throws ListingDataException if the price range text is present but malformed
   */
  public @Nullable PriceRange effectivePrice() {
    if (priceRange != null && !priceRange.isBlank()) {
      return PriceRange.parse(priceRange);
    }
    if (listPrice != null) {
      return PriceRange.of(listPrice);
    }
    return null;
  }

  private static List<String> copyOrEmpty(@Nullable List<String> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream().filter(Objects::nonNull).toList();
  }
}
