package eu.virtualparadox.hybridrag.exception;

/**
 * Thrown when size, overlap, threshold or weighting parameters are out of range.
 * Raised at construction time; values are never clamped silently.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(final String message) {
        super(message);
    }
}
