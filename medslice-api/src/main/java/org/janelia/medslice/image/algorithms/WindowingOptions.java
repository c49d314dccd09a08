package org.janelia.medslice.image.algorithms;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.medslice.config.Config;

public class WindowingOptions {

    public static final double DEFAULT_CONTRAST_BOOST_GAMMA = 0.9;

    public static final WindowingOptions DEFAULT = new WindowingOptions(
            WindowEstimation.ALL_FINITE, false, DEFAULT_CONTRAST_BOOST_GAMMA, DisplayRange.DEFAULT);

    public static WindowingOptions fromConfig(Config config) {
        String estimation = config.getStringPropertyValue("Windowing.Estimation", WindowEstimation.ALL_FINITE.name());
        return new WindowingOptions(
                WindowEstimation.valueOf(StringUtils.upperCase(estimation)),
                config.getBooleanPropertyValue("Windowing.ContrastBoost", false),
                config.getDoublePropertyValue("Windowing.ContrastBoostGamma", DEFAULT_CONTRAST_BOOST_GAMMA),
                DisplayRange.DEFAULT);
    }

    private final WindowEstimation estimation;
    private final boolean contrastBoost;
    private final double contrastBoostGamma;
    private final DisplayRange displayRange;

    public WindowingOptions(WindowEstimation estimation, boolean contrastBoost, double contrastBoostGamma, DisplayRange displayRange) {
        if (contrastBoost && (!Double.isFinite(contrastBoostGamma) || contrastBoostGamma <= 0)) {
            throw new IllegalArgumentException("Invalid contrast boost gamma: " + contrastBoostGamma);
        }
        this.estimation = estimation;
        this.contrastBoost = contrastBoost;
        this.contrastBoostGamma = contrastBoostGamma;
        this.displayRange = displayRange;
    }

    public WindowEstimation getEstimation() {
        return estimation;
    }

    public boolean isContrastBoost() {
        return contrastBoost;
    }

    public double getContrastBoostGamma() {
        return contrastBoostGamma;
    }

    public DisplayRange getDisplayRange() {
        return displayRange;
    }

    public WindowingOptions withContrastBoost(boolean contrastBoost) {
        return new WindowingOptions(estimation, contrastBoost, contrastBoostGamma, displayRange);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("estimation", estimation)
                .append("contrastBoost", contrastBoost)
                .append("contrastBoostGamma", contrastBoostGamma)
                .append("displayRange", displayRange)
                .toString();
    }
}
