package eu.virtualparadox.hybridrag.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * No index has ever been persisted at the given location.
 * <p>Distinct from {@link IndexCorruptionException}: callers may react by bootstrapping
 * a fresh index from the raw documents.</p>
 */
@Getter
public class PersistedIndexNotFoundException extends RuntimeException {

    private final Path location;

    public PersistedIndexNotFoundException(final Path location) {
        super("No persisted index found at " + location);
        this.location = location;
    }
}
