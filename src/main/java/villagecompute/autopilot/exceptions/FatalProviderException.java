/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.exceptions;

/**
 * Exception thrown when the generation provider refuses work for account-level reasons (credits exhausted, payment
 * required, invalid credentials).
 *
 * <p>
 * Never retried. Bulk runs stop scheduling further chunks once one of these is observed.
 */
public class FatalProviderException extends GenerationException {

    public FatalProviderException(String message, Integer httpStatus) {
        super(message, httpStatus);
    }
}
