package dev.propertymatch.search;

import dev.langchain4j.data.embedding.Embedding;
import java.util.List;
import java.util.Optional;

/**
 * Port to the per-facet vector indexes. Vectors are produced and stored elsewhere, already
 * L2-normalized; this core only reads them.
 *
 * <p>Implementations may block and may throw any runtime exception on failure; callers bound each
 * call with a timeout and may interrupt it.
 */
public interface FacetVectorStore {

  /**
   * Looks up the stored vector of a listing in one facet index.
   *
   * @param listingId the listing
   * @param facet the facet index to read
   * @return the vector, or empty if the listing is not indexed in that facet
   */
  Optional<Embedding> findVector(String listingId, Facet facet);

  /**
   * Queries one facet index for the listings nearest to a vector.
   *
   * @param facet the facet index to query
   * @param vector the query vector
   * @param limit maximum number of hits
   * @return hits ordered by descending similarity, without duplicate listing IDs
   */
  List<FacetHit> findNearest(Facet facet, Embedding vector, int limit);
}
