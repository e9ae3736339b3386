package com.largomodo.photosheet.core;

/**
 * A page canvas could not be allocated.
 * <p>
 * Fatal: aborts the remaining run and discards pages already appended. Follows the
 * ConfigurationException pattern for unchecked, fail-fast conditions.
 */
public class CanvasAllocationException extends RuntimeException {

    public CanvasAllocationException(String message) {
        super(message);
    }

    public CanvasAllocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
