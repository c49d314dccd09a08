package org.janelia.medslice.image.algorithms;

public class ContrastEnhancer {

    /**
     * Power law adjustment of a value already rescaled to the display range.
     * Values at or below the display minimum are returned unchanged.
     */
    public static double gammaBoost(double value, DisplayRange displayRange, double gamma) {
        if (value <= displayRange.getMin()) return value;
        double range = displayRange.getRange();
        double normalized = Math.min((value - displayRange.getMin()) / range, 1.);
        return displayRange.getMin() + range * Math.pow(normalized, gamma);
    }
}
