package dev.propertymatch.search.filter;

import static org.assertj.core.api.Assertions.assertThat;

import dev.propertymatch.fixture.ListingRecordBuilder;
import dev.propertymatch.listing.ListingRecord;
import java.util.ArrayList;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/** Property-based tests for {@link ListingPostFilter} using jqwik. */
class ListingPostFilterPropertyTest {

  @Provide
  Arbitrary<List<ListingRecord>> listings() {
    Arbitrary<Integer> bedrooms = Arbitraries.integers().between(0, 6).injectNull(0.15);
    Arbitrary<Double> bathrooms =
        Arbitraries.of(1.0, 1.5, 2.0, 2.5, 3.0).injectNull(0.1);
    Arbitrary<String> price =
        Arbitraries.of("900-1200", "2000-2500", "3100-4000", "call agent").injectNull(0.1);
    Arbitrary<String> type = Arbitraries.of("apartment", "house", "condo");
    return Combinators.combine(bedrooms, bathrooms, price, type)
        .as(
            (beds, baths, range, propertyType) ->
                new ListingRecordBuilder()
                    .bedrooms(beds)
                    .bathrooms(baths)
                    .priceRange(range)
                    .propertyType(propertyType))
        .list()
        .ofMaxSize(12)
        .map(
            builders -> {
              List<ListingRecord> built = new ArrayList<>();
              for (int i = 0; i < builders.size(); i++) {
                built.add(builders.get(i).id("L" + i).build());
              }
              return built;
            });
  }

  @Provide
  Arbitrary<ListingFilter> filters() {
    Arbitrary<Integer> minBedrooms = Arbitraries.integers().between(0, 3).injectNull(0.5);
    Arbitrary<Integer> extraBedrooms = Arbitraries.integers().between(0, 3).injectNull(0.5);
    Arbitrary<Double> minPrice = Arbitraries.of(1000.0, 2200.0, 3500.0).injectNull(0.5);
    Arbitrary<String> type = Arbitraries.of("apartment", "house").injectNull(0.5);
    return Combinators.combine(minBedrooms, extraBedrooms, minPrice, type)
        .as(
            (min, extra, price, propertyType) ->
                new ListingFilter(
                    price,
                    null,
                    min,
                    min == null || extra == null ? null : min + extra,
                    null,
                    null,
                    propertyType,
                    List.of()));
  }

  @Property(tries = 200)
  void filteringIsIdempotent(
      @ForAll("listings") List<ListingRecord> listings,
      @ForAll("filters") ListingFilter filter) {
    List<ListingRecord> once = ListingPostFilter.apply(listings, filter);

    assertThat(ListingPostFilter.apply(once, filter)).isEqualTo(once);
  }

  @Property(tries = 200)
  void survivorsAreOrderedSubsequenceOfInput(
      @ForAll("listings") List<ListingRecord> listings,
      @ForAll("filters") ListingFilter filter) {
    List<ListingRecord> kept = ListingPostFilter.apply(listings, filter);

    int cursor = 0;
    for (ListingRecord survivor : kept) {
      while (cursor < listings.size() && listings.get(cursor) != survivor) {
        cursor++;
      }
      assertThat(cursor).as("survivor %s out of order", survivor.id()).isLessThan(listings.size());
      cursor++;
    }
  }

  @Property(tries = 200)
  void everySurvivorMatchesAndEveryRejectDoesNot(
      @ForAll("listings") List<ListingRecord> listings,
      @ForAll("filters") ListingFilter filter) {
    List<ListingRecord> kept = ListingPostFilter.apply(listings, filter);

    for (ListingRecord listing : listings) {
      assertThat(kept.contains(listing)).isEqualTo(ListingPostFilter.matches(listing, filter));
    }
  }
}
