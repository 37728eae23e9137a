package org.janelia.focusstack;

/**
 * Thrown when the images in a stack do not all share the same dimensions.
 */
public class DimensionMismatchException
        extends FusionException {

    public DimensionMismatchException(final String message) {
        super(message);
    }
}
