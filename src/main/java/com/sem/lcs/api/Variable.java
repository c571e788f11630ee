package com.sem.lcs.api;

/**
 * An endpoint of a {@link Path}: a latent factor, an observed measurement, or
 * the constant mean source.
 *
 * Names are derived from the typed fields and are unique within one
 * specification; they are what both external forms print.
 */
public interface Variable {

    /** Rendered name of this variable. */
    String name();

    /** Owning process id, or {@code null} for the mean source. */
    String process();

    /** Whether this variable is observed in the data. */
    default boolean isManifest() {
        return false;
    }
}
