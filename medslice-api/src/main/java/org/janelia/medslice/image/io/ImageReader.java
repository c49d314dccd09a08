package org.janelia.medslice.image.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.janelia.medslice.image.SourceFormat;
import org.janelia.medslice.image.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes uploaded image content into a {@link Volume}. The content is not retained.
 */
public class ImageReader {

    private static final Logger LOG = LoggerFactory.getLogger(ImageReader.class);

    public static Volume decode(byte[] content, String fileName) {
        return decode(content, SourceFormat.fromFileName(fileName));
    }

    public static Volume decode(byte[] content, SourceFormat sourceFormat) {
        if (content == null || content.length == 0) {
            throw new ImageFormatException("Empty " + sourceFormat + " content");
        }
        long startTime = System.currentTimeMillis();
        Volume volume;
        switch (sourceFormat) {
            case DICOM:
                volume = DicomReader.read(content);
                break;
            case NIFTI:
                volume = NiftiReader.read(content);
                break;
            case BITMAP:
                volume = BitmapReader.read(content);
                break;
            default:
                throw new ImageFormatException("Unsupported source format: " + sourceFormat);
        }
        LOG.debug("Decoded {} bytes of {} content into {} in {}ms",
                content.length, sourceFormat, volume, System.currentTimeMillis() - startTime);
        return volume;
    }

    public static Volume readImage(String fileName) {
        try {
            return decode(Files.readAllBytes(Paths.get(fileName)), fileName);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + fileName, e);
        }
    }
}
