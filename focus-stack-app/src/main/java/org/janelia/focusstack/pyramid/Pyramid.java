package org.janelia.focusstack.pyramid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.focusstack.image.MultiChannelImage;

/**
 * Pyramid of image stacks indexed by [level][stackIndex].
 * Level 0 is the finest level; level {@link #getDepth()} is the coarsest (base band).
 * Every level holds the same number of images and all images within a level share dimensions.
 */
public class Pyramid {

    private final MultiChannelImage[][] levels;

    Pyramid(final MultiChannelImage[][] levels) {
        this.levels = levels;
    }

    public int getDepth() {
        return levels.length - 1;
    }

    public int getLevelCount() {
        return levels.length;
    }

    public int getStackSize() {
        return levels[0].length;
    }

    public MultiChannelImage getImage(final int level,
                                      final int stackIndex) {
        return levels[level][stackIndex];
    }

    /**
     * @return unmodifiable view of the images for the specified level.
     */
    public List<MultiChannelImage> getLevel(final int level) {
        final List<MultiChannelImage> images = new ArrayList<>(levels[level].length);
        Collections.addAll(images, levels[level]);
        return Collections.unmodifiableList(images);
    }

    public List<MultiChannelImage> getBaseBand() {
        return getLevel(getDepth());
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("Pyramid{stackSize=").append(getStackSize()).append(", levels=[");
        for (int level = 0; level < levels.length; level++) {
            if (level > 0) {
                sb.append(", ");
            }
            sb.append(levels[level][0]);
        }
        return sb.append("]}").toString();
    }
}
