package org.janelia.focusstack;

/**
 * Thrown when the smallest side of the stack images is below the minimum pyramid level size.
 */
public class ImageTooSmallException
        extends FusionException {

    public ImageTooSmallException(final String message) {
        super(message);
    }
}
