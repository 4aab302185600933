/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopilot.exceptions;

/**
 * Base class for failures reported by the listing generation provider.
 *
 * <p>
 * Callers distinguish {@link TransientProviderException} (worth retrying) from {@link FatalProviderException} (stop
 * scheduling further work). All exceptions in this project extend RuntimeException per project standards.
 */
public abstract class GenerationException extends RuntimeException {

    private final Integer httpStatus;

    protected GenerationException(String message, Integer httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    protected GenerationException(String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    /**
     * Returns the provider HTTP status that triggered this failure, or null when no response was received.
     */
    public Integer getHttpStatus() {
        return httpStatus;
    }
}
