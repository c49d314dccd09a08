package org.janelia.medslice.codec;

public enum TransferFormat {
    /**
     * Row-major little-endian 32-bit floats.
     */
    RAW_FLOAT32,
    /**
     * 8-bit grayscale PNG.
     */
    PNG
}
