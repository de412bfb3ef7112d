package dev.propertymatch.store;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.embedding.Embedding;
import dev.propertymatch.search.Facet;
import dev.propertymatch.search.FacetHit;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryFacetVectorStoreTest {

  private static final Embedding NORTH = Embedding.from(new float[] {0.0f, 1.0f});
  private static final Embedding NORTH_EAST = Embedding.from(new float[] {0.7071f, 0.7071f});
  private static final Embedding EAST = Embedding.from(new float[] {1.0f, 0.0f});

  InMemoryFacetVectorStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryFacetVectorStore();
  }

  private static List<String> ids(List<FacetHit> hits) {
    return hits.stream().map(FacetHit::listingId).toList();
  }

  @Test
  void find_vector_is_scoped_to_facet() {
    store.put("1", Facet.LOCATION, NORTH);

    assertThat(store.findVector("1", Facet.LOCATION)).contains(NORTH);
    assertThat(store.findVector("1", Facet.VISUAL)).isEmpty();
    assertThat(store.findVector("2", Facet.LOCATION)).isEmpty();
  }

  @Test
  void find_nearest_orders_by_similarity_and_honours_limit() {
    store.put("north", Facet.VISUAL, NORTH);
    store.put("north-east", Facet.VISUAL, NORTH_EAST);
    store.put("east", Facet.VISUAL, EAST);

    List<FacetHit> hits = store.findNearest(Facet.VISUAL, NORTH, 2);

    assertThat(ids(hits)).containsExactly("north", "north-east");
    assertThat(hits.get(0).score()).isGreaterThan(hits.get(1).score());
  }

  @Test
  void facets_are_indexed_independently() {
    store.put("1", Facet.LOCATION, NORTH);
    store.put("2", Facet.FEATURES, NORTH);

    assertThat(ids(store.findNearest(Facet.LOCATION, NORTH, 10))).containsExactly("1");
    assertThat(store.findNearest(Facet.VISUAL, NORTH, 10)).isEmpty();
  }

  @Test
  void put_replaces_existing_vector_without_duplicating_hit() {
    store.put("1", Facet.LOCATION, EAST);
    store.put("1", Facet.LOCATION, NORTH);
    store.put("2", Facet.LOCATION, NORTH_EAST);

    List<FacetHit> hits = store.findNearest(Facet.LOCATION, NORTH, 10);

    assertThat(ids(hits)).containsExactly("1", "2");
    assertThat(store.findVector("1", Facet.LOCATION)).contains(NORTH);
  }

  @Test
  void remove_drops_listing_from_every_facet() {
    for (Facet facet : Facet.values()) {
      store.put("1", facet, NORTH);
    }

    store.remove("1");

    for (Facet facet : Facet.values()) {
      assertThat(store.findVector("1", facet)).isEmpty();
      assertThat(store.findNearest(facet, NORTH, 10)).isEmpty();
    }
  }
}
