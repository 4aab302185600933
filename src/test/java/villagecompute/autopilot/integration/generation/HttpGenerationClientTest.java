/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.integration.generation;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;

import org.eclipse.microprofile.faulttolerance.Retry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;

import villagecompute.autopilot.api.types.GeneratedListingType;
import villagecompute.autopilot.api.types.GenerationRequestType;
import villagecompute.autopilot.config.EnrichmentConfig;
import villagecompute.autopilot.exceptions.FatalProviderException;
import villagecompute.autopilot.exceptions.TransientProviderException;
import villagecompute.autopilot.exceptions.ValidationException;

/**
 * Unit tests for {@link HttpGenerationClient} against a WireMock provider.
 */
class HttpGenerationClientTest {

    private static final String PATH = "/functions/v1/generate-listing";

    private WireMockServer wireMockServer;
    private HttpGenerationClient client;
    private EnrichmentConfig config;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        config = mock(EnrichmentConfig.class);
        when(config.getGenerationEndpoint()).thenReturn("http://localhost:" + wireMockServer.port() + PATH);
        when(config.getGenerationApiKey()).thenReturn(Optional.of("test-key"));

        client = new HttpGenerationClient();
        client.config = config;
        client.objectMapper = new ObjectMapper();
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null && wireMockServer.isRunning()) {
            wireMockServer.stop();
        }
    }

    private static GenerationRequestType request() {
        return new GenerationRequestType(UUID.randomUUID(), Map.of("raw_input_text", "Levi's jacket, M"),
                List.of("https://cdn.example.com/front.jpg", "https://cdn.example.com/label.jpg"));
    }

    private void stubStatus(int status, String body) {
        wireMockServer.stubFor(post(urlEqualTo(PATH)).willReturn(
                aResponse().withStatus(status).withHeader("Content-Type", "application/json").withBody(body)));
    }

    @Test
    void testGenerate_success() {
        stubStatus(200, "{\"generated\": {\"title\": \"Vintage Levi's Denim Jacket\", \"garment_type\": \"Jacket\", "
                + "\"shopify_tags\": \"denim, 90s\", \"unknown_field\": 1}}");

        GeneratedListingType generated = client.generate(request());

        assertEquals("Vintage Levi's Denim Jacket", generated.title());
        assertEquals("Jacket", generated.garmentType());
        assertEquals("denim, 90s", generated.shopifyTags());
        wireMockServer.verify(postRequestedFor(urlEqualTo(PATH)).withHeader("Authorization", equalTo("Bearer test-key"))
                .withRequestBody(matchingJsonPath("$.image_urls[1]", equalTo("https://cdn.example.com/label.jpg")))
                .withRequestBody(matchingJsonPath("$.product.raw_input_text", equalTo("Levi's jacket, M"))));
    }

    @Test
    void testGenerate_creditsExhaustedIsFatal() {
        stubStatus(402, "{\"error\": \"Payment required\"}");

        FatalProviderException e = assertThrows(FatalProviderException.class, () -> client.generate(request()));

        assertEquals(402, e.getHttpStatus());
        assertTrue(e.getMessage().startsWith("AI credits exhausted"));
    }

    @Test
    void testGenerate_rejectedCredentialsIsFatal() {
        stubStatus(401, "{\"error\": \"Invalid API key\"}");

        assertThrows(FatalProviderException.class, () -> client.generate(request()));
    }

    @Test
    void testGenerate_rateLimitIsTransient() {
        stubStatus(429, "{\"error\": \"Too many requests\"}");

        TransientProviderException e = assertThrows(TransientProviderException.class,
                () -> client.generate(request()));

        assertEquals(429, e.getHttpStatus());
        assertTrue(e.getMessage().contains("Rate limit exceeded"));
    }

    @Test
    void testGenerate_serverErrorIsTransient() {
        stubStatus(503, "upstream unavailable");

        TransientProviderException e = assertThrows(TransientProviderException.class,
                () -> client.generate(request()));

        assertTrue(e.getMessage().contains("upstream unavailable"));
    }

    @Test
    void testGenerate_badRequestIsValidationFailure() {
        stubStatus(400, "{\"error\": \"image too large\"}");

        ValidationException e = assertThrows(ValidationException.class, () -> client.generate(request()));

        assertTrue(e.getMessage().contains("image too large"));
    }

    @Test
    void testGenerate_missingPayloadIsTransient() {
        stubStatus(200, "{\"error\": \"model returned no JSON\"}");

        assertThrows(TransientProviderException.class, () -> client.generate(request()));
    }

    @Test
    void testGenerate_noImagesNeverCallsProvider() {
        GenerationRequestType request = new GenerationRequestType(UUID.randomUUID(), Map.of(), List.of());

        assertThrows(ValidationException.class, () -> client.generate(request));
        assertTrue(wireMockServer.getAllServeEvents().isEmpty());
    }

    @Test
    void testFilterImageUrls() {
        List<String> urls = Arrays.asList("https://a.example.com/1.jpg", null, "products/raw/2.jpg",
                "data:image/png;base64,AAAA", " HTTP://b.example.com/3.jpg ", "https://c.example.com/" + "x".repeat(60));

        assertEquals(List.of("https://a.example.com/1.jpg", "HTTP://b.example.com/3.jpg"),
                HttpGenerationClient.filterImageUrls(urls, 9, 40));
        assertEquals(List.of("https://a.example.com/1.jpg"), HttpGenerationClient.filterImageUrls(urls, 1, 40));
    }

    /**
     * The retry interceptor is not active outside the container, so the policy it will apply is asserted as declared:
     * one extra attempt after a second for transient failures, none for fatal or per-item errors.
     */
    @Test
    void testGenerate_retryPolicyOnlyRetriesTransientFailures() throws NoSuchMethodException {
        Method generate = HttpGenerationClient.class.getMethod("generate", GenerationRequestType.class);
        Retry retry = generate.getAnnotation(Retry.class);

        assertEquals(1, retry.maxRetries());
        assertEquals(1000, retry.delay());
        assertEquals(0, retry.jitter());
        assertArrayEquals(new Class<?>[]{TransientProviderException.class}, retry.retryOn());
        assertArrayEquals(new Class<?>[]{FatalProviderException.class, ValidationException.class}, retry.abortOn());
    }

    @Test
    void testGenerate_retryOverridesTargetGenerate() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = HttpGenerationClient.class.getResourceAsStream("/application.properties")) {
            properties.load(in);
        }
        String prefix = HttpGenerationClient.class.getName() + "/generate/Retry/";

        assertEquals("1", properties.getProperty(prefix + "maxRetries"));
        assertEquals("1000", properties.getProperty(prefix + "delay"));
    }
}
