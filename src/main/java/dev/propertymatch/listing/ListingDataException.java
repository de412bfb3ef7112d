package dev.propertymatch.listing;

/**
 * Thrown when a filter-relevant field of a single listing record is malformed. Callers filtering a
 * batch of records treat it as a per-record problem, not a failure of the batch.
 */
public class ListingDataException extends RuntimeException {

  public ListingDataException(String message) {
    super(message);
  }

  public ListingDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
