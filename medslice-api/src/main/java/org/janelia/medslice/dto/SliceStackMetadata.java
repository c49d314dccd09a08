package org.janelia.medslice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Out-of-band description of a raw slice stream: the stream itself carries only the samples.
 */
public class SliceStackMetadata {
    private int rows;
    private int cols;
    private int slices;
    private double minValue;
    private double maxValue;
    private double[] voxelSpacing;

    @JsonProperty
    public int getRows() {
        return rows;
    }

    public SliceStackMetadata setRows(int rows) {
        this.rows = rows;
        return this;
    }

    @JsonProperty
    public int getCols() {
        return cols;
    }

    public SliceStackMetadata setCols(int cols) {
        this.cols = cols;
        return this;
    }

    @JsonProperty
    public int getSlices() {
        return slices;
    }

    public SliceStackMetadata setSlices(int slices) {
        this.slices = slices;
        return this;
    }

    @JsonProperty
    public double getMinValue() {
        return minValue;
    }

    public SliceStackMetadata setMinValue(double minValue) {
        this.minValue = minValue;
        return this;
    }

    @JsonProperty
    public double getMaxValue() {
        return maxValue;
    }

    public SliceStackMetadata setMaxValue(double maxValue) {
        this.maxValue = maxValue;
        return this;
    }

    @JsonProperty
    public double[] getVoxelSpacing() {
        return voxelSpacing;
    }

    public SliceStackMetadata setVoxelSpacing(double[] voxelSpacing) {
        this.voxelSpacing = voxelSpacing;
        return this;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("rows", rows)
                .append("cols", cols)
                .append("slices", slices)
                .append("minValue", minValue)
                .append("maxValue", maxValue)
                .toString();
    }
}
