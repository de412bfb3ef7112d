package dev.propertymatch.config;

import dev.propertymatch.search.FacetVectorStore;
import dev.propertymatch.search.ListingRecordStore;
import dev.propertymatch.store.InMemoryFacetVectorStore;
import dev.propertymatch.store.InMemoryListingRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Falls back to the in-memory collaborators when the deployment does not provide its own {@link
 * FacetVectorStore} or {@link ListingRecordStore} bean.
 */
@Configuration
public class StoreConfig {

  private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

  @Bean
  @ConditionalOnMissingBean(FacetVectorStore.class)
  public InMemoryFacetVectorStore facetVectorStore() {
    log.info("No FacetVectorStore configured; using the in-memory facet vector store");
    return new InMemoryFacetVectorStore();
  }

  @Bean
  @ConditionalOnMissingBean(ListingRecordStore.class)
  public InMemoryListingRecordStore listingRecordStore() {
    log.info("No ListingRecordStore configured; using the in-memory listing record store");
    return new InMemoryListingRecordStore();
  }
}
