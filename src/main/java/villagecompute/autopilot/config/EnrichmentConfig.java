/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Tunables for bulk enrichment, undo and autopilot.
 *
 * <p>
 * Values are validated at startup; an invalid combination prevents the application from starting.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code autopilot.generation.batch-size-options} - allowed bulk batch sizes (default: 5,10,20)</li>
 * <li>{@code autopilot.generation.default-batch-size} - batch size when the caller passes none (default: 20)</li>
 * <li>{@code autopilot.generation.concurrency-width} - provider calls in flight per chunk (default: 3)</li>
 * <li>{@code autopilot.generation.chunk-delay-ms} - pause between chunks (default: 500)</li>
 * <li>{@code autopilot.generation.max-image-urls} - image URLs sent per request (default: 9)</li>
 * <li>{@code autopilot.generation.max-url-length} - longest accepted image URL (default: 2048)</li>
 * <li>{@code autopilot.generation.endpoint} - provider URL</li>
 * <li>{@code autopilot.generation.api-key} - provider bearer key (optional)</li>
 * <li>{@code autopilot.undo.ttl-seconds} - undo window (default: 300)</li>
 * <li>{@code autopilot.run.batch-size} - products claimed per worker tick (default: 30)</li>
 * <li>{@code autopilot.tags.defaults} - tags added to every generated listing (default: none)</li>
 * </ul>
 */
@ApplicationScoped
@Startup
public class EnrichmentConfig {

    private static final Logger LOG = Logger.getLogger(EnrichmentConfig.class);

    @ConfigProperty(
            name = "autopilot.generation.batch-size-options",
            defaultValue = "5,10,20")
    List<Integer> batchSizeOptions;

    @ConfigProperty(
            name = "autopilot.generation.default-batch-size",
            defaultValue = "20")
    int defaultBatchSize;

    @ConfigProperty(
            name = "autopilot.generation.concurrency-width",
            defaultValue = "3")
    int concurrencyWidth;

    @ConfigProperty(
            name = "autopilot.generation.chunk-delay-ms",
            defaultValue = "500")
    long chunkDelayMs;

    @ConfigProperty(
            name = "autopilot.generation.max-image-urls",
            defaultValue = "9")
    int maxImageUrls;

    @ConfigProperty(
            name = "autopilot.generation.max-url-length",
            defaultValue = "2048")
    int maxUrlLength;

    @ConfigProperty(
            name = "autopilot.generation.endpoint")
    String generationEndpoint;

    @ConfigProperty(
            name = "autopilot.generation.api-key")
    Optional<String> generationApiKey;

    @ConfigProperty(
            name = "autopilot.undo.ttl-seconds",
            defaultValue = "300")
    long undoTtlSeconds;

    @ConfigProperty(
            name = "autopilot.run.batch-size",
            defaultValue = "30")
    int runBatchSize;

    @ConfigProperty(
            name = "autopilot.tags.defaults")
    Optional<List<String>> defaultTags;

    /**
     * Validates tunables at startup.
     *
     * @throws EnrichmentConfigurationException
     *             if any value is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        if (batchSizeOptions == null || batchSizeOptions.isEmpty()) {
            throw fail("autopilot.generation.batch-size-options must list at least one batch size");
        }
        if (batchSizeOptions.stream().anyMatch(size -> size == null || size <= 0)) {
            throw fail("autopilot.generation.batch-size-options must only contain positive sizes");
        }
        if (!batchSizeOptions.contains(defaultBatchSize)) {
            throw fail("autopilot.generation.default-batch-size " + defaultBatchSize + " is not one of "
                    + batchSizeOptions);
        }
        if (concurrencyWidth <= 0) {
            throw fail("autopilot.generation.concurrency-width must be positive");
        }
        if (chunkDelayMs < 0) {
            throw fail("autopilot.generation.chunk-delay-ms must not be negative");
        }
        if (maxImageUrls <= 0) {
            throw fail("autopilot.generation.max-image-urls must be positive");
        }
        if (undoTtlSeconds <= 0) {
            throw fail("autopilot.undo.ttl-seconds must be positive");
        }
        if (runBatchSize <= 0) {
            throw fail("autopilot.run.batch-size must be positive");
        }
        if (generationEndpoint == null || !generationEndpoint.matches("(?i)^https?://.+")) {
            throw fail("autopilot.generation.endpoint must be an http(s) URL");
        }
        LOG.infof("Enrichment configured: batchSizes=%s default=%d width=%d chunkDelay=%dms undoTtl=%ds runBatch=%d",
                batchSizeOptions, defaultBatchSize, concurrencyWidth, chunkDelayMs, undoTtlSeconds, runBatchSize);
    }

    private EnrichmentConfigurationException fail(String message) {
        LOG.fatal(message);
        return new EnrichmentConfigurationException(message);
    }

    public List<Integer> getBatchSizeOptions() {
        return batchSizeOptions;
    }

    public int getDefaultBatchSize() {
        return defaultBatchSize;
    }

    public int getConcurrencyWidth() {
        return concurrencyWidth;
    }

    public Duration getChunkDelay() {
        return Duration.ofMillis(chunkDelayMs);
    }

    public int getMaxImageUrls() {
        return maxImageUrls;
    }

    public int getMaxUrlLength() {
        return maxUrlLength;
    }

    public String getGenerationEndpoint() {
        return generationEndpoint;
    }

    public Optional<String> getGenerationApiKey() {
        return generationApiKey == null ? Optional.empty() : generationApiKey;
    }

    public Duration getUndoTtl() {
        return Duration.ofSeconds(undoTtlSeconds);
    }

    public int getRunBatchSize() {
        return runBatchSize;
    }

    public List<String> getDefaultTags() {
        return defaultTags == null ? List.of() : defaultTags.orElse(List.of());
    }

    /**
     * Exception thrown when enrichment configuration is invalid.
     */
    public static class EnrichmentConfigurationException extends RuntimeException {

        public EnrichmentConfigurationException(String message) {
            super(message);
        }
    }
}
