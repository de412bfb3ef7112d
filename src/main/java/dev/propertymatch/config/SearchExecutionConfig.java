package dev.propertymatch.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Provides the thread pool the per-facet vector lookups, neighbour queries and record hydration of
 * a search fan out on.
 *
 * <p>Sized by {@code propertymatch.search.executor.pool-size} (default 6, at least 2), i.e. two
 * concurrent searches' worth of facet calls.
 */
@Configuration
public class SearchExecutionConfig {

  static final String THREAD_NAME_PREFIX = "facet-search-";

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService facetSearchExecutor(
      @Value("${propertymatch.search.executor.pool-size:6}") int poolSize) {
    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(THREAD_NAME_PREFIX);
    threadFactory.setDaemon(true);
    return Executors.newFixedThreadPool(Math.max(2, poolSize), threadFactory);
  }
}
