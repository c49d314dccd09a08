package org.janelia.medslice.image;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;
import org.janelia.medslice.image.io.ImageFormatException;

/**
 * Supported image sources. The format is resolved once when the image is ingested
 * and it travels with the volume afterwards.
 */
public enum SourceFormat {
    DICOM(".dcm"),
    NIFTI(".nii.gz", ".nii"),
    BITMAP(".jpg", ".jpeg", ".png", ".bmp");

    private final List<String> extensions;

    SourceFormat(String... extensions) {
        this.extensions = Arrays.asList(extensions);
    }

    public boolean matches(String fileName) {
        return extensions.stream().anyMatch(ext -> StringUtils.endsWithIgnoreCase(fileName, ext));
    }

    public static SourceFormat fromFileName(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            throw new ImageFormatException("No file name provided to determine the image type");
        }
        for (SourceFormat format : values()) {
            if (format.matches(fileName.trim())) {
                return format;
            }
        }
        throw new ImageFormatException("Unsupported file type: " + fileName +
                ". Supported formats are: " + supportedExtensions());
    }

    public static String supportedExtensions() {
        return Stream.of(values())
                .flatMap(f -> f.extensions.stream())
                .collect(Collectors.joining(", "));
    }
}
