package org.janelia.focusstack;

/**
 * Base class for exceptions thrown when an image stack cannot be fused.
 */
public class FusionException
        extends IllegalArgumentException {

    public FusionException(final String message) {
        super(message);
    }

    public FusionException(final String message,
                           final Throwable cause) {
        super(message, cause);
    }
}
