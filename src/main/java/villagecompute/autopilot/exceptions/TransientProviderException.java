/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.exceptions;

/**
 * Exception thrown when the generation provider fails in a way that may succeed on a later attempt.
 *
 * <p>
 * Covers HTTP 429 rate limiting, 5xx responses, network I/O failures and unparsable response bodies. The generation
 * client retries these a fixed number of times before the failure is recorded against the item.
 */
public class TransientProviderException extends GenerationException {

    public TransientProviderException(String message) {
        super(message, null);
    }

    public TransientProviderException(String message, Integer httpStatus) {
        super(message, httpStatus);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
