package dev.propertymatch.search;

/** Thrown when a weight profile carries a negative or non-finite facet weight. */
public class InvalidWeightException extends SimilaritySearchException {

  public InvalidWeightException(String profileName, Facet facet, double weight) {
    super(
        "Weight profile '"
            + profileName
            + "' has invalid weight "
            + weight
            + " for facet '"
            + facet.value()
            + "'");
  }

  public InvalidWeightException(String message) {
    super(message);
  }
}
