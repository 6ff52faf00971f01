package com.kmg.tagger.service.capability;

import com.kmg.tagger.model.PreparedImage;

/**
 * A vision model behind an inference server.
 */
public interface VisionInference {

    boolean checkConnection();

    /**
     * Makes sure a model is available to serve requests, pulling it if the backend can.
     *
     * @throws InferenceUnavailableException when no model can be provided
     */
    default void ensureReady() {
    }

    /**
     * Loads the model ahead of the first image. Failures are logged, not thrown.
     */
    void warmUp();

    String analyze(PreparedImage image, String prompt);

    String describe();

    /**
     * A client for the same server using another model. Backends that serve a single
     * preloaded model return themselves.
     */
    default VisionInference withModel(String model) {
        return this;
    }

    class InferenceFailedException extends RuntimeException {
        public InferenceFailedException(String message) {
            super(message);
        }

        public InferenceFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    class InferenceUnavailableException extends CapabilityUnavailableException {
        public InferenceUnavailableException(String message) {
            super(message);
        }
    }
}
