package dev.propertymatch.store;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import dev.propertymatch.search.Facet;
import dev.propertymatch.search.FacetHit;
import dev.propertymatch.search.FacetVectorStore;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link FacetVectorStore} keeping one LangChain4j {@link InMemoryEmbeddingStore}
 * per facet, with embedding IDs equal to listing IDs.
 *
 * <p>Nearest-neighbour queries use the embedding store's cosine relevance score. Because {@link
 * dev.langchain4j.store.embedding.EmbeddingStore} has no lookup by ID, each facet also keeps an ID
 * to vector table for {@link #findVector}. Used when no other vector store bean is configured and
 * in tests.
 */
public class InMemoryFacetVectorStore implements FacetVectorStore {

  private final Map<Facet, InMemoryEmbeddingStore<TextSegment>> indexes =
      new EnumMap<>(Facet.class);
  private final Map<Facet, Map<String, Embedding>> vectors = new EnumMap<>(Facet.class);

  public InMemoryFacetVectorStore() {
    for (Facet facet : Facet.values()) {
      indexes.put(facet, new InMemoryEmbeddingStore<>());
      vectors.put(facet, new ConcurrentHashMap<>());
    }
  }

  /**
   * Stores or replaces the vector of a listing in one facet.
   *
   * @param listingId the listing
   * @param facet the facet the vector belongs to
   * @param vector the L2-normalized vector
   */
  public synchronized void put(String listingId, Facet facet, Embedding vector) {
    InMemoryEmbeddingStore<TextSegment> index = indexes.get(facet);
    if (vectors.get(facet).put(listingId, vector) != null) {
      index.remove(listingId);
    }
    index.add(listingId, vector);
  }

  /** Removes a listing from every facet. */
  public synchronized void remove(String listingId) {
    for (Facet facet : Facet.values()) {
      if (vectors.get(facet).remove(listingId) != null) {
        indexes.get(facet).remove(listingId);
      }
    }
  }

  @Override
  public Optional<Embedding> findVector(String listingId, Facet facet) {
    return Optional.ofNullable(vectors.get(facet).get(listingId));
  }

  @Override
  public List<FacetHit> findNearest(Facet facet, Embedding vector, int limit) {
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder().queryEmbedding(vector).maxResults(limit).build();
    return indexes.get(facet).search(request).matches().stream()
        .map(InMemoryFacetVectorStore::toHit)
        .toList();
  }

  private static FacetHit toHit(EmbeddingMatch<TextSegment> match) {
    return new FacetHit(match.embeddingId(), match.score());
  }
}
