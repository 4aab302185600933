/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.integration.generation;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.autopilot.api.types.GeneratedListingType;
import villagecompute.autopilot.api.types.GenerationRequestType;
import villagecompute.autopilot.config.EnrichmentConfig;
import villagecompute.autopilot.exceptions.FatalProviderException;
import villagecompute.autopilot.exceptions.TransientProviderException;
import villagecompute.autopilot.exceptions.ValidationException;

/**
 * HTTP client for the listing generation provider.
 *
 * <p>
 * POSTs a JSON {@link GenerationRequestType} to {@code autopilot.generation.endpoint}. A successful response carries
 * {@code {"generated": {...}}}; failures carry {@code {"error": "..."}}.
 *
 * <p>
 * <b>Status classification:</b>
 * <ul>
 * <li>402, 401, 403 - {@link FatalProviderException} (credits exhausted or credentials rejected)</li>
 * <li>429, 5xx, I/O failure, unparsable body - {@link TransientProviderException}</li>
 * <li>other 4xx - {@link ValidationException} (the provider rejected this request)</li>
 * </ul>
 *
 * <p>
 * Transient failures are retried once after a fixed delay (two attempts in total). No request timeout is applied; the
 * connect timeout only guards against unreachable hosts.
 */
@ApplicationScoped
public class HttpGenerationClient implements GenerationService {

    private static final Logger LOG = Logger.getLogger(HttpGenerationClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Pattern URL_PATTERN = Pattern.compile("^https?://.+", Pattern.CASE_INSENSITIVE);
    private static final int MAX_ERROR_BODY = 300;

    @Inject
    EnrichmentConfig config;

    @Inject
    ObjectMapper objectMapper;

    private final HttpClient httpClient;

    public HttpGenerationClient() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build();
    }

    /**
     * Keeps only http(s) URLs within the length limit, in order, capped at {@code maxUrls}.
     *
     * @param urls
     *            candidate image references (storage paths, data URIs and nulls are dropped)
     * @param maxUrls
     *            maximum URLs kept
     * @param maxLength
     *            longest URL accepted
     * @return filtered URLs
     */
    public static List<String> filterImageUrls(List<String> urls, int maxUrls, int maxLength) {
        if (urls == null) {
            return List.of();
        }
        return urls.stream().filter(Objects::nonNull).map(String::trim)
                .filter(url -> url.length() <= maxLength && URL_PATTERN.matcher(url).matches()).limit(maxUrls)
                .toList();
    }

    @Override
    @Retry(
            maxRetries = 1,
            delay = 1000,
            jitter = 0,
            retryOn = TransientProviderException.class,
            abortOn = {
                    FatalProviderException.class, ValidationException.class })
    public GeneratedListingType generate(GenerationRequestType request) {
        if (request.imageUrls() == null || request.imageUrls().isEmpty()) {
            throw new ValidationException("No valid image URLs for item " + request.itemId());
        }

        LOG.debugf("Requesting generation for item %s with %d images", request.itemId(), request.imageUrls().size());

        HttpResponse<String> response = send(request);
        int status = response.statusCode();

        if (status == 200) {
            return parseGenerated(request, response.body());
        }

        String message = extractError(response.body());
        if (status == 402) {
            LOG.warnf("Generation provider credits exhausted: %s", message);
            throw new FatalProviderException("AI credits exhausted: " + message, status);
        }
        if (status == 401 || status == 403) {
            throw new FatalProviderException("Generation provider rejected credentials: " + message, status);
        }
        if (status == 429) {
            LOG.warnf("Generation provider rate limit exceeded for item %s", request.itemId());
            throw new TransientProviderException("Rate limit exceeded: " + message, status);
        }
        if (status >= 500) {
            throw new TransientProviderException("Generation provider returned status " + status + ": " + message,
                    status);
        }
        throw new ValidationException("Generation provider rejected request (status " + status + "): " + message);
    }

    private HttpResponse<String> send(GenerationRequestType request) {
        try {
            String body = objectMapper.writeValueAsString(request);
            HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(config.getGenerationEndpoint()))
                    .header("Content-Type", "application/json").POST(HttpRequest.BodyPublishers.ofString(body));
            config.getGenerationApiKey().filter(key -> !key.isBlank())
                    .ifPresent(key -> builder.header("Authorization", "Bearer " + key));
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (JsonProcessingException e) {
            throw new ValidationException("Could not serialize generation request for item " + request.itemId(), e);
        } catch (IOException e) {
            LOG.warnf(e, "Generation request failed for item %s", request.itemId());
            throw new TransientProviderException("Generation request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientProviderException("Generation request interrupted", e);
        }
    }

    private GeneratedListingType parseGenerated(GenerationRequestType request, String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode generated = root == null ? null : root.get("generated");
            if (generated == null || !generated.isObject()) {
                String error = root != null && root.hasNonNull("error") ? root.get("error").asText()
                        : "missing generated payload";
                throw new TransientProviderException("Invalid response from generation provider: " + error);
            }
            return objectMapper.treeToValue(generated, GeneratedListingType.class);
        } catch (JsonProcessingException e) {
            LOG.warnf("Could not parse generation response for item %s", request.itemId());
            throw new TransientProviderException("Could not parse generation response", e);
        }
    }

    private String extractError(String body) {
        if (body == null || body.isBlank()) {
            return "(empty body)";
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root != null && root.hasNonNull("error")) {
                return root.get("error").asText();
            }
        } catch (JsonProcessingException e) {
            LOG.debugf("Error body is not JSON: %s", e.getOriginalMessage());
        }
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) : body;
    }
}
