package dev.propertymatch.listing;

/**
 * Closed asking-price interval of a listing. A single list price is the degenerate interval
 * {@code [price, price]}.
 *
 * @param min lowest asking price
 * @param max highest asking price
 */
public record PriceRange(double min, double max) {

  public PriceRange {
    if (Double.isNaN(min) || Double.isNaN(max)) {
      throw new ListingDataException("Price must be a number");
    }
    if (min > max) {
      throw new ListingDataException("Price range is inverted: " + min + " > " + max);
    }
  }

  /** Interval for a listing with a single asking price. */
  public static PriceRange of(double price) {
    return new PriceRange(price, price);
  }

  /**
   * Parses a {@code "low-high"} price range such as {@code "2000-2500"}. Whitespace around either
   * bound is ignored.
   *
   * @param text the raw range text
   * @return the parsed interval
   * @throws ListingDataException if the text is not two numbers separated by a hyphen, or the
   *     bounds are inverted
   */
  public static PriceRange parse(String text) {
    // Split on the first hyphen after the first character so a leading sign is not a separator
    int separator = text.indexOf('-', 1);
    if (separator < 0) {
      throw new ListingDataException("Price range '" + text + "' is not of the form low-high");
    }
    double low = parseBound(text, text.substring(0, separator));
    double high = parseBound(text, text.substring(separator + 1));
    return new PriceRange(low, high);
  }

  /** Returns true if this interval lies entirely below {@code bound}. */
  public boolean isBelow(double bound) {
    return max < bound;
  }

  /** Returns true if this interval lies entirely above {@code bound}. */
  public boolean isAbove(double bound) {
    return min > bound;
  }

  private static double parseBound(String text, String bound) {
    try {
      return Double.parseDouble(bound.trim());
    } catch (NumberFormatException e) {
      throw new ListingDataException("Price range '" + text + "' has a non-numeric bound", e);
    }
  }
}
