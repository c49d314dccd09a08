package org.janelia.medslice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * What a viewer needs to know about a stored image besides its slices.
 */
public class ImageInfo {
    private String imageId;
    private int totalSlices;
    private int rows;
    private int cols;
    private double windowCenter;
    private double windowWidth;
    private double dataMin;
    private double dataMax;
    private double[] voxelSpacing;
    private String sourceFormat;

    @JsonProperty
    public String getImageId() {
        return imageId;
    }

    public ImageInfo setImageId(String imageId) {
        this.imageId = imageId;
        return this;
    }

    @JsonProperty
    public int getTotalSlices() {
        return totalSlices;
    }

    public ImageInfo setTotalSlices(int totalSlices) {
        this.totalSlices = totalSlices;
        return this;
    }

    @JsonProperty
    public int getRows() {
        return rows;
    }

    public ImageInfo setRows(int rows) {
        this.rows = rows;
        return this;
    }

    @JsonProperty
    public int getCols() {
        return cols;
    }

    public ImageInfo setCols(int cols) {
        this.cols = cols;
        return this;
    }

    @JsonProperty
    public double getWindowCenter() {
        return windowCenter;
    }

    public ImageInfo setWindowCenter(double windowCenter) {
        this.windowCenter = windowCenter;
        return this;
    }

    @JsonProperty
    public double getWindowWidth() {
        return windowWidth;
    }

    public ImageInfo setWindowWidth(double windowWidth) {
        this.windowWidth = windowWidth;
        return this;
    }

    @JsonProperty
    public double getDataMin() {
        return dataMin;
    }

    public ImageInfo setDataMin(double dataMin) {
        this.dataMin = dataMin;
        return this;
    }

    @JsonProperty
    public double getDataMax() {
        return dataMax;
    }

    public ImageInfo setDataMax(double dataMax) {
        this.dataMax = dataMax;
        return this;
    }

    /**
     * Width, height and depth.
     */
    @JsonProperty
    public double[] getVoxelSpacing() {
        return voxelSpacing;
    }

    public ImageInfo setVoxelSpacing(double[] voxelSpacing) {
        this.voxelSpacing = voxelSpacing;
        return this;
    }

    @JsonProperty
    public String getSourceFormat() {
        return sourceFormat;
    }

    public ImageInfo setSourceFormat(String sourceFormat) {
        this.sourceFormat = sourceFormat;
        return this;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("imageId", imageId)
                .append("totalSlices", totalSlices)
                .append("rows", rows)
                .append("cols", cols)
                .append("windowCenter", windowCenter)
                .append("windowWidth", windowWidth)
                .toString();
    }
}
