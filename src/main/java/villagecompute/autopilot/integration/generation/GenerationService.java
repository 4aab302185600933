/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.integration.generation;

import villagecompute.autopilot.api.types.GeneratedListingType;
import villagecompute.autopilot.api.types.GenerationRequestType;

/**
 * Network boundary to the listing enrichment provider.
 *
 * <p>
 * Failures are classified, never returned as values:
 * <ul>
 * <li>{@link villagecompute.autopilot.exceptions.TransientProviderException} - retried by the implementation up to its
 * attempt cap, then propagated</li>
 * <li>{@link villagecompute.autopilot.exceptions.FatalProviderException} - propagated immediately so callers can stop
 * scheduling work</li>
 * <li>{@link villagecompute.autopilot.exceptions.ValidationException} - the request could not be sent as given</li>
 * </ul>
 */
public interface GenerationService {

    /**
     * Generates listing fields for one product.
     *
     * @param request
     *            product attributes and pre-filtered image URLs
     * @return generated fields, untrusted
     */
    GeneratedListingType generate(GenerationRequestType request);
}
