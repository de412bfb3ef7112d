package dev.propertymatch.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.propertymatch.listing.ListingRecord;
import dev.propertymatch.search.filter.ListingPostFilter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Search orchestration layer finding listings similar to a query listing across all facets.
 *
 * <p>Pipeline: resolve the search mode -> fetch the query listing's vector in every facet
 * (concurrently) -> over-fetch {@code topK * overFetchFactor} neighbours per facet (concurrently)
 * -> fuse the facet rankings with weighted RRF -> drop the query listing and hydrate the first
 * {@code topK * hydrationFactor} candidates in one batch -> apply the post-filter -> return the top
 * {@code topK} in fused order.
 *
 * <p>Every facet is required. A missing query vector or a failed, slow or interrupted collaborator
 * call aborts the whole search instead of fusing fewer facets, since a silently dropped facet would
 * bias the ranking with no signal to the caller.
 */
@Service
public class SimilarListingSearchService {

  private static final Logger log = LoggerFactory.getLogger(SimilarListingSearchService.class);

  static final String VECTOR_LOOKUP = "vector-lookup";
  static final String NEIGHBOUR_QUERY = "neighbour-query";
  static final String HYDRATION = "hydration";

  private final FacetVectorStore vectorStore;
  private final ListingRecordStore recordStore;
  private final FacetWeightProfiles profiles;
  private final SearchProperties properties;
  private final FacetFanOut fanOut;

  public SimilarListingSearchService(
      FacetVectorStore vectorStore,
      ListingRecordStore recordStore,
      FacetWeightProfiles profiles,
      SearchProperties properties,
      @Qualifier("facetSearchExecutor") ExecutorService facetSearchExecutor) {
    this.vectorStore = vectorStore;
    this.recordStore = recordStore;
    this.profiles = profiles;
    this.properties = properties;
    this.fanOut = new FacetFanOut(facetSearchExecutor);
  }

  /**
   * Finds the listings most similar to the request's query listing.
   *
   * @param request the query listing, search mode, optional filter and result count
   * @return at most {@code topK} listings ordered by fused score descending, never including the
   *     query listing
   * @throws IllegalArgumentException if {@code topK} exceeds the configured maximum
   * @throws UnknownSearchModeException if the search mode is not registered
   * @throws QueryListingNotFoundException if the query listing lacks a vector in any facet
   * @throws CollaboratorFailureException if a store call fails, times out or is interrupted
   */
  public List<SimilarListing> search(SimilarListingsRequest request) {
    // Keeps the neighbour and hydration limits within int range
    if (request.topK() > properties.getMaxTopK()) {
      throw new IllegalArgumentException(
          "topK must be at most " + properties.getMaxTopK() + ", got: " + request.topK());
    }
    FacetWeightProfile profile = profiles.resolve(request.mode());
    Duration timeout = Duration.ofMillis(properties.getCollaboratorTimeoutMs());
    String queryId = request.listingId();

    Map<Facet, Callable<Embedding>> vectorLookups =
        perFacet(
            facet ->
                () ->
                    vectorStore
                        .findVector(queryId, facet)
                        .orElseThrow(() -> new QueryListingNotFoundException(queryId, facet)));
    Map<Facet, Embedding> queryVectors = fanOut.invokeAll(VECTOR_LOOKUP, vectorLookups, timeout);

    int neighbourLimit = request.topK() * properties.getOverFetchFactor();
    Map<Facet, Callable<List<FacetHit>>> neighbourQueries =
        perFacet(
            facet -> () -> vectorStore.findNearest(facet, queryVectors.get(facet), neighbourLimit));
    Map<Facet, List<FacetHit>> rankedLists =
        fanOut.invokeAll(NEIGHBOUR_QUERY, neighbourQueries, timeout);

    List<FusedCandidate> fused = WeightedRrfFusion.fuse(rankedLists, profile, properties.getRrfK());

    int hydrationLimit = request.topK() * properties.getHydrationFactor();
    Map<String, FusedCandidate> shortlist = new LinkedHashMap<>();
    for (FusedCandidate candidate : fused) {
      if (shortlist.size() == hydrationLimit) {
        break;
      }
      if (!candidate.listingId().equals(queryId)) {
        shortlist.put(candidate.listingId(), candidate);
      }
    }

    List<ListingRecord> hydrated = hydrate(shortlist, timeout);
    List<ListingRecord> filtered = ListingPostFilter.apply(hydrated, request.filter());

    List<SimilarListing> results =
        filtered.stream()
            .limit(request.topK())
            .map(listing -> toSimilarListing(listing, shortlist.get(listing.id())))
            .toList();

    log.info(
        "Similar listings for {} (mode={}): {} fused, {} hydrated, {} after filter, {} returned",
        queryId,
        profile.name(),
        fused.size(),
        hydrated.size(),
        filtered.size(),
        results.size());
    return results;
  }

  /**
   * Fetches the records of the shortlisted candidates in one call and returns them in fused order.
   * Candidates without a record are dropped, as are records filed under a different ID than the
   * one requested.
   */
  private List<ListingRecord> hydrate(Map<String, FusedCandidate> shortlist, Duration timeout) {
    if (shortlist.isEmpty()) {
      return List.of();
    }
    List<String> ids = List.copyOf(shortlist.keySet());
    Map<String, ListingRecord> records =
        fanOut.invoke(HYDRATION, () -> recordStore.findAllById(ids), timeout);

    List<ListingRecord> hydrated = new ArrayList<>(ids.size());
    for (String id : ids) {
      ListingRecord listing = records.get(id);
      if (listing == null) {
        log.debug("No record for candidate listing {}; dropping it", id);
      } else if (!listing.id().equals(id)) {
        log.warn(
            "Record store returned listing {} for requested id {}; dropping it", listing.id(), id);
      } else {
        hydrated.add(listing);
      }
    }
    return hydrated;
  }

  private static <T> Map<Facet, Callable<T>> perFacet(Function<Facet, Callable<T>> call) {
    Map<Facet, Callable<T>> tasks = new EnumMap<>(Facet.class);
    for (Facet facet : Facet.values()) {
      tasks.put(facet, call.apply(facet));
    }
    return tasks;
  }

  private static SimilarListing toSimilarListing(ListingRecord listing, FusedCandidate candidate) {
    return new SimilarListing(listing, candidate.score(), candidate.facetRanks());
  }
}
