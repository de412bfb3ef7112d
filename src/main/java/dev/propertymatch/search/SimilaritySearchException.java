package dev.propertymatch.search;

/**
 * Base type of every failure that aborts a similar-listing search. A search either returns a
 * complete filtered ranking or throws one of the subclasses; it never returns a partial result.
 */
public abstract class SimilaritySearchException extends RuntimeException {

  protected SimilaritySearchException(String message) {
    super(message);
  }

  protected SimilaritySearchException(String message, Throwable cause) {
    super(message, cause);
  }
}
