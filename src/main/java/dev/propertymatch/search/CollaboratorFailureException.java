package dev.propertymatch.search;

/**
 * Thrown when the vector store or the record store fails, times out, or is interrupted while a
 * search waits on it. In-flight sibling calls of the same stage are cancelled before this is
 * thrown.
 */
public class CollaboratorFailureException extends SimilaritySearchException {

  private final String stage;

  public CollaboratorFailureException(String stage, String message) {
    super(stage + ": " + message);
    this.stage = stage;
  }

  public CollaboratorFailureException(String stage, String message, Throwable cause) {
    super(stage + ": " + message, cause);
    this.stage = stage;
  }

  /** Name of the search stage that failed, e.g. {@code "vector-lookup"}. */
  public String getStage() {
    return stage;
  }
}
