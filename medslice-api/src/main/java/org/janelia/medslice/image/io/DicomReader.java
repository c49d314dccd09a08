package org.janelia.medslice.image.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import ij.ImageStack;
import ij.measure.Calibration;
import ij.plugin.DICOM;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import ij.util.DicomTools;
import org.apache.commons.lang3.StringUtils;
import org.janelia.medslice.image.SourceFormat;
import org.janelia.medslice.image.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads DICOM content with ImageJ. A single frame gives a 2D slice, a multi-frame object a 3D stack.
 * The samples are the calibrated values, i.e. with the rescale slope and intercept applied.
 */
class DicomReader {

    private static final Logger LOG = LoggerFactory.getLogger(DicomReader.class);

    private static final String PIXEL_SPACING_TAG = "0028,0030";
    private static final String SLICE_THICKNESS_TAG = "0018,0050";

    static Volume read(byte[] content) {
        Path dicomFile;
        try {
            dicomFile = Files.createTempFile("medslice-", ".dcm");
        } catch (IOException e) {
            throw new IllegalStateException("Error creating a temporary DICOM file", e);
        }
        try {
            Files.write(dicomFile, content);
            DICOM dicom = new DICOM();
            try {
                dicom.open(dicomFile.toString());
            } catch (RuntimeException e) {
                throw new ImageFormatException("Error decoding DICOM content", e);
            }
            if (dicom.getWidth() == 0 || dicom.getStackSize() == 0) {
                throw new ImageFormatException("Content is not a readable DICOM object");
            }
            return createVolume(dicom);
        } catch (IOException e) {
            throw new ImageFormatException("Error writing DICOM content", e);
        } finally {
            try {
                Files.deleteIfExists(dicomFile);
            } catch (IOException e) {
                LOG.warn("Could not delete temporary DICOM file {}", dicomFile, e);
            }
        }
    }

    private static Volume createVolume(DICOM dicom) {
        int width = dicom.getWidth();
        int height = dicom.getHeight();
        int nframes = dicom.getStackSize();
        Calibration calibration = dicom.getCalibration();
        ImageStack stack = dicom.getStack();
        int frameSize = width * height;
        double[] samples = new double[(int) VolumeShapes.sampleCount(new long[] {width, height, nframes})];
        for (int f = 0; f < nframes; f++) {
            ImageProcessor ip = stack.getProcessor(f + 1);
            for (int i = 0; i < frameSize; i++) {
                double v;
                if (ip instanceof ColorProcessor) {
                    int rgb = ip.get(i);
                    v = (((rgb >> 16) & 0xff) + ((rgb >> 8) & 0xff) + (rgb & 0xff)) / 3.;
                } else {
                    v = calibration.getCValue(ip.getf(i));
                }
                samples[f * frameSize + i] = v;
            }
        }
        double[] pixelSpacing = parseSpacing(DicomTools.getTag(dicom, PIXEL_SPACING_TAG));
        double sliceThickness = parseSpacing(DicomTools.getTag(dicom, SLICE_THICKNESS_TAG))[0];
        // Pixel Spacing holds the row spacing (height) first and the column spacing (width) second
        double[] axesSpacing = new double[] {
                pixelSpacing.length > 1 ? pixelSpacing[1] : pixelSpacing[0],
                pixelSpacing[0],
                sliceThickness
        };
        LOG.debug("Read {}x{}x{} DICOM with spacing {}x{}x{}", width, height, nframes, axesSpacing[0], axesSpacing[1], axesSpacing[2]);
        long[] dims = nframes > 1 ? new long[] {width, height, nframes} : new long[] {width, height};
        return VolumeShapes.createVolume(samples, dims, axesSpacing, SourceFormat.DICOM);
    }

    /**
     * Parse a backslash separated multi-valued decimal string. Missing or invalid values give 1.
     */
    static double[] parseSpacing(String tagValue) {
        if (StringUtils.isBlank(tagValue)) {
            return new double[] {1.0};
        }
        String[] parts = StringUtils.split(tagValue.trim(), '\\');
        double[] values = new double[Math.max(parts.length, 1)];
        for (int i = 0; i < values.length; i++) {
            values[i] = i < parts.length ? parseSpacingValue(parts[i]) : 1.0;
        }
        return values;
    }

    private static double parseSpacingValue(String s) {
        try {
            double v = Double.parseDouble(s.trim());
            return Double.isFinite(v) && v > 0 ? v : 1.0;
        } catch (NumberFormatException e) {
            LOG.debug("Invalid spacing value '{}'", s);
            return 1.0;
        }
    }
}
