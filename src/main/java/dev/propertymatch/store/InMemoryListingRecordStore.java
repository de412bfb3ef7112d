package dev.propertymatch.store;

import dev.propertymatch.listing.ListingRecord;
import dev.propertymatch.search.ListingRecordStore;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ListingRecordStore} backed by a concurrent map. Used when no other record
 * store bean is configured and in tests.
 */
public class InMemoryListingRecordStore implements ListingRecordStore {

  private final Map<String, ListingRecord> records = new ConcurrentHashMap<>();

  /** Stores or replaces a listing record under its ID. */
  public void save(ListingRecord listing) {
    records.put(listing.id(), listing);
  }

  /** Removes a listing record; unknown IDs are ignored. */
  public void remove(String listingId) {
    records.remove(listingId);
  }

  @Override
  public Map<String, ListingRecord> findAllById(Collection<String> listingIds) {
    Map<String, ListingRecord> found = new LinkedHashMap<>();
    for (String id : listingIds) {
      ListingRecord listing = records.get(id);
      if (listing != null) {
        found.put(id, listing);
      }
    }
    return found;
  }
}
