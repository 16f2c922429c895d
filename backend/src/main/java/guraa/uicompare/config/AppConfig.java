package guraa.uicompare.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import guraa.uicompare.service.BoundedComparisonCache;
import guraa.uicompare.service.ComparisonCache;
import guraa.uicompare.service.InMemoryComparisonCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application configuration.
 */
@Slf4j
@Configuration
public class AppConfig {

    /**
     * Configure the ObjectMapper used for the REST payloads and for reading reference node documents.
     *
     * @return The configured ObjectMapper
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();

        objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        return objectMapper;
    }

    /**
     * The verdict cache. Unbounded unless {@code app.comparison.cache.max-entries} is positive.
     *
     * @param appProperties Application properties
     * @return The cache
     */
    @Bean
    public ComparisonCache comparisonCache(AppProperties appProperties) {
        int maxEntries = appProperties.getComparison().getCache().getMaxEntries();
        if (maxEntries > 0) {
            log.info("Using bounded comparison cache with {} entries", maxEntries);
            return new BoundedComparisonCache(maxEntries);
        }
        log.info("Using unbounded comparison cache");
        return new InMemoryComparisonCache();
    }
}
