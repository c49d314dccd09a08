package org.janelia.medslice.image.io;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import javax.imageio.ImageIO;

import org.janelia.medslice.image.SourceFormat;
import org.janelia.medslice.image.Volume;

/**
 * Reads JPEG, PNG and BMP content as a single 2D slice. Color images are converted to gray
 * by averaging all their channels, alpha included when present.
 */
class BitmapReader {

    static Volume read(byte[] content) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(content));
        } catch (IOException e) {
            throw new ImageFormatException("Error decoding bitmap content", e);
        } catch (RuntimeException e) {
            throw new ImageFormatException("Invalid bitmap content: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ImageFormatException("Content is not a supported bitmap");
        }
        int width = image.getWidth();
        int height = image.getHeight();
        double[] samples = new double[(int) VolumeShapes.sampleCount(new long[] {width, height})];
        Raster raster = image.getRaster();
        int nbands = raster.getNumBands();
        boolean indexed = image.getColorModel() instanceof IndexColorModel;
        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (indexed) {
                    int rgb = image.getRGB(x, y);
                    samples[i++] = (((rgb >> 16) & 0xff) + ((rgb >> 8) & 0xff) + (rgb & 0xff)) / 3.;
                } else if (nbands == 3 || nbands == 4) {
                    double sum = 0;
                    for (int b = 0; b < nbands; b++) {
                        sum += raster.getSampleDouble(x, y, b);
                    }
                    samples[i++] = sum / nbands;
                } else {
                    samples[i++] = raster.getSampleDouble(x, y, 0);
                }
            }
        }
        return VolumeShapes.createVolume(samples, new long[] {width, height}, new double[] {1., 1.}, SourceFormat.BITMAP);
    }

}
