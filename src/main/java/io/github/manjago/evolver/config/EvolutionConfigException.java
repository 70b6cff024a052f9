package io.github.manjago.evolver.config;

/**
 * Invalid engine configuration.
 *
 * Raised before evolution starts (also in non-blocking mode, where it is
 * thrown on the caller's thread before the background run is launched).
 * Never retried.
 */
public class EvolutionConfigException extends IllegalArgumentException {

    public EvolutionConfigException(String message) {
        super(message);
    }

    public EvolutionConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
