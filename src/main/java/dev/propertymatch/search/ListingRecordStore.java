package dev.propertymatch.search;

import dev.propertymatch.listing.ListingRecord;
import java.util.Collection;
import java.util.Map;

/** Port to the store holding the full attribute payload of every listing. */
public interface ListingRecordStore {

  /**
   * Fetches the records of several listings in one call.
   *
   * @param listingIds the listings to fetch
   * @return records keyed by listing ID; IDs without a record are simply absent
   */
  Map<String, ListingRecord> findAllById(Collection<String> listingIds);
}
