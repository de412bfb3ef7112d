package dev.propertymatch.search.filter;

import static org.assertj.core.api.Assertions.assertThat;

import dev.propertymatch.fixture.ListingRecordBuilder;
import dev.propertymatch.listing.ListingRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class ListingPostFilterTest {

  private static ListingRecord withBedrooms(String id, Integer bedrooms) {
    return new ListingRecordBuilder().id(id).bedrooms(bedrooms).build();
  }

  private static List<String> ids(List<ListingRecord> listings) {
    return listings.stream().map(ListingRecord::id).toList();
  }

  @Test
  void bedroom_bounds_are_inclusive_and_require_a_count() {
    List<ListingRecord> listings =
        List.of(
            withBedrooms("1", 1),
            withBedrooms("2", 2),
            withBedrooms("3", 3),
            withBedrooms("4", 4),
            withBedrooms("5", null));

    List<ListingRecord> kept = ListingPostFilter.apply(listings, ListingFilter.bedrooms(2, 3));

    assertThat(ids(kept)).containsExactly("2", "3");
  }

  @Test
  void null_filter_returns_input_unchanged() {
    List<ListingRecord> listings =
        List.of(withBedrooms("1", null), new ListingRecordBuilder().id("2").noPrice().build());

    assertThat(ListingPostFilter.apply(listings, null)).isSameAs(listings);
  }

  @Test
  void presence_only_filter_excludes_listings_missing_core_attributes() {
    List<ListingRecord> listings =
        List.of(
            new ListingRecordBuilder().id("complete").build(),
            new ListingRecordBuilder().id("no-price").noPrice().build(),
            new ListingRecordBuilder().id("no-bedrooms").bedrooms(null).build(),
            new ListingRecordBuilder().id("no-bathrooms").bathrooms(null).build());

    List<ListingRecord> kept = ListingPostFilter.apply(listings, ListingFilter.presenceOnly());

    assertThat(ids(kept)).containsExactly("complete");
  }

  @Test
  void price_range_is_kept_when_it_overlaps_bounds() {
    ListingRecord range = new ListingRecordBuilder().priceRange("2000-2500").build();

    assertThat(ListingPostFilter.matches(range, ListingFilter.price(2400.0, null))).isTrue();
    assertThat(ListingPostFilter.matches(range, ListingFilter.price(2600.0, null))).isFalse();
    assertThat(ListingPostFilter.matches(range, ListingFilter.price(null, 2100.0))).isTrue();
    assertThat(ListingPostFilter.matches(range, ListingFilter.price(null, 1900.0))).isFalse();
  }

  @Test
  void list_price_is_used_without_range() {
    ListingRecord listing = new ListingRecordBuilder().listPrice(1800.0).build();

    assertThat(ListingPostFilter.matches(listing, ListingFilter.price(1500.0, 2000.0))).isTrue();
    assertThat(ListingPostFilter.matches(listing, ListingFilter.price(1900.0, null))).isFalse();
  }

  @Test
  void malformed_price_range_excludes_only_that_listing() {
    List<ListingRecord> listings =
        List.of(
            new ListingRecordBuilder().id("bad").priceRange("ask agent").build(),
            new ListingRecordBuilder().id("good").build());

    List<ListingRecord> kept = ListingPostFilter.apply(listings, ListingFilter.price(0.0, null));

    assertThat(ids(kept)).containsExactly("good");
  }

  @Test
  void unparseable_bathroom_count_is_excluded() {
    ListingRecord listing = new ListingRecordBuilder().bathrooms(Double.NaN).build();

    assertThat(ListingPostFilter.matches(listing, ListingFilter.presenceOnly())).isFalse();
  }

  @Test
  void bathroom_bounds_are_inclusive() {
    ListingFilter filter = new ListingFilter(null, null, null, null, 1.5, 2.0, null, List.of());

    assertThat(ListingPostFilter.matches(new ListingRecordBuilder().bathrooms(1.5).build(), filter))
        .isTrue();
    assertThat(ListingPostFilter.matches(new ListingRecordBuilder().bathrooms(2.5).build(), filter))
        .isFalse();
    assertThat(ListingPostFilter.matches(new ListingRecordBuilder().bathrooms(1.0).build(), filter))
        .isFalse();
  }

  @Test
  void property_type_must_match_exactly() {
    ListingFilter filter =
        new ListingFilter(null, null, null, null, null, null, "apartment", List.of());

    assertThat(ListingPostFilter.matches(new ListingRecordBuilder().build(), filter)).isTrue();
    assertThat(
            ListingPostFilter.matches(
                new ListingRecordBuilder().propertyType("house").build(), filter))
        .isFalse();
    ListingRecord untyped = new ListingRecordBuilder().propertyType(null).build();
    assertThat(ListingPostFilter.matches(untyped, filter)).isFalse();
  }

  @Test
  void every_requested_amenity_must_be_present() {
    ListingFilter filter =
        new ListingFilter(null, null, null, null, null, null, null, List.of("pool", "gym"));

    assertThat(
            ListingPostFilter.matches(
                new ListingRecordBuilder().amenities("gym", "pool", "sauna").build(), filter))
        .isTrue();
    assertThat(
            ListingPostFilter.matches(new ListingRecordBuilder().amenities("pool").build(), filter))
        .isFalse();
  }

  @Test
  void survivors_keep_their_relative_order() {
    List<ListingRecord> listings =
        List.of(
            withBedrooms("c", 2),
            withBedrooms("a", 5),
            withBedrooms("b", 3),
            withBedrooms("d", 2));

    List<ListingRecord> kept = ListingPostFilter.apply(listings, ListingFilter.bedrooms(null, 3));

    assertThat(ids(kept)).containsExactly("c", "b", "d");
  }
}
