package org.janelia.medslice.image.algorithms;

/**
 * Which samples the automatic window is estimated from.
 */
public enum WindowEstimation {
    /**
     * All finite samples.
     */
    ALL_FINITE,
    /**
     * Positive samples from the central 60% of every axis; if there are none, all positive samples,
     * and if there are still none, all finite samples.
     */
    CENTRAL_FOREGROUND
}
