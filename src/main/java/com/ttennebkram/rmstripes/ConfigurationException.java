package com.ttennebkram.rmstripes;

/**
 * Thrown when a parameter or parameter combination is invalid before any
 * computation starts: unknown wavelet, non-positive sigma, a decomposition level
 * the image cannot support, a kernel radius that does not reach past the grow
 * frontier, and similar.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
