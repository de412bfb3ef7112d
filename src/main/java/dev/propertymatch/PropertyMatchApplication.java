package dev.propertymatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Property Match similar-listing search service.
 *
 * <p>Serves {@code GET /api/listings/{listingId}/similar} on port 8080.
 */
@SpringBootApplication
public class PropertyMatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(PropertyMatchApplication.class, args);
    }
}
