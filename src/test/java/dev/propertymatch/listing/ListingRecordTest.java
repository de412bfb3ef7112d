package dev.propertymatch.listing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.propertymatch.fixture.ListingRecordBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

class ListingRecordTest {

  @Test
  void blankIdIsRejected() {
    assertThatThrownBy(() -> new ListingRecordBuilder().id(" ").build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Listing id must not be blank");
  }

  @Test
  void absentCollectionsBecomeEmptyLists() {
    ListingRecord listing =
        new ListingRecord(
            "7", null, 1500.0, null, 1, 1.0, "studio", null, null, null, null, null, null, null,
            null, null, null, null);

    assertThat(listing.amenities()).isEmpty();
    assertThat(listing.photoUrls()).isEmpty();
    assertThat(listing.interiorFeatures()).isEmpty();
  }

  @Test
  void collectionsAreCopiedDefensively() {
    ListingRecord listing = new ListingRecordBuilder().amenities("parking").build();

    assertThatThrownBy(() -> listing.amenities().add("pool"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void effectivePricePrefersPriceRangeOverListPrice() {
    ListingRecord listing =
        new ListingRecord(
            "7", null, 1500.0, "2000-2500", 1, 1.0, null, List.of(), List.of(), List.of(),
            List.of(), List.of(), null, null, null, null, null, List.of());

    assertThat(listing.effectivePrice()).isEqualTo(new PriceRange(2000.0, 2500.0));
  }

  @Test
  void effectivePriceFallsBackToListPrice() {
    ListingRecord listing = new ListingRecordBuilder().listPrice(1750.0).build();

    assertThat(listing.effectivePrice()).isEqualTo(PriceRange.of(1750.0));
  }

  @Test
  void effectivePriceIsNullWithoutAnyPrice() {
    ListingRecord listing = new ListingRecordBuilder().noPrice().build();

    assertThat(listing.effectivePrice()).isNull();
  }

  @Test
  void effectivePriceSurfacesMalformedRange() {
    ListingRecord listing = new ListingRecordBuilder().priceRange("call us").build();

    assertThatThrownBy(listing::effectivePrice).isInstanceOf(ListingDataException.class);
  }
}
