package com.kmg.tagger.service.capability;

/**
 * A required external capability cannot be used at all. Raised before a batch starts.
 */
public class CapabilityUnavailableException extends RuntimeException {
    public CapabilityUnavailableException(String message) {
        super(message);
    }

    public CapabilityUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
