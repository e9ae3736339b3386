package com.largomodo.photosheet.core;

/**
 * Thrown when an export configuration cannot produce a valid page layout.
 * <p>
 * Covers unsupported grid densities, size factors outside (0, 1], negative margins or
 * gaps, and derived cell or canvas sizes that are not positive. Raised before any page
 * is produced. Unchecked so validation can fail fast without catch blocks at every call site.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
