package dev.propertymatch.search;

import java.util.Collection;

/** Thrown when a search names a weight profile that is not registered. */
public class UnknownSearchModeException extends SimilaritySearchException {

  private final String mode;

  public UnknownSearchModeException(String mode, Collection<String> knownModes) {
    super("Unknown search mode '" + mode + "'; expected one of " + knownModes);
    this.mode = mode;
  }

  public String getMode() {
    return mode;
  }
}
