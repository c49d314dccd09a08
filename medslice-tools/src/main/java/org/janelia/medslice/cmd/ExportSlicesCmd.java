package org.janelia.medslice.cmd;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.io.FileUtils;
import org.janelia.medslice.codec.SliceCodec;
import org.janelia.medslice.codec.TransferFormat;
import org.janelia.medslice.service.ImageViewerService;
import org.janelia.medslice.service.LoadedImage;
import org.janelia.medslice.store.ImageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to export the slices of an image after optional rotation and window changes.
 */
class ExportSlicesCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(ExportSlicesCmd.class);

    @Parameters(commandDescription = "Export the display or raw slices of an image")
    static class ExportSlicesArgs extends AbstractCmdArgs {
        ExportSlicesArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        @Parameter(names = {"--input", "-i"}, description = "Input image", required = true)
        String input;

        @Parameter(names = {"--output-dir", "-od"}, description = "Output directory", required = true)
        String outputDir;

        @Parameter(names = {"--format"}, description = "Transfer format")
        TransferFormat format = TransferFormat.PNG;

        @Parameter(names = {"--rotation"}, description = "Counter-clockwise rotation in degrees, a multiple of 90")
        int rotation = 0;

        @Parameter(names = {"--window-center"}, description = "Window center; if not set the automatic window is used")
        Double windowCenter;

        @Parameter(names = {"--window-width"}, description = "Window width; if not set the automatic window is used")
        Double windowWidth;

        @Parameter(names = {"--slices"}, description = "Slices to export; if not set all slices are exported", variableArity = true)
        List<Integer> slices = new ArrayList<>();

        @Override
        List<String> validate() {
            List<String> errors = new ArrayList<>();
            if (!new File(input).isFile()) {
                errors.add("Input " + input + " is not a file");
            }
            if (rotation % 90 != 0) {
                errors.add("Rotation must be a multiple of 90 degrees");
            }
            if ((windowCenter == null) != (windowWidth == null)) {
                errors.add("Window center and width must be set together");
            }
            return errors;
        }
    }

    private final ExportSlicesArgs args;

    ExportSlicesCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new ExportSlicesArgs(commonArgs);
    }

    @Override
    ExportSlicesArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        try (ImageViewerService imageViewerService = createImageViewerService()) {
            exportSlices(imageViewerService);
        }
    }

    private void exportSlices(ImageViewerService imageViewerService) {
        long startTime = System.currentTimeMillis();
        ImageStore imageStore = imageViewerService.getImageStore();
        LoadedImage loadedImage;
        try {
            loadedImage = imageViewerService.load(Files.readAllBytes(Paths.get(args.input)), args.input);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        String imageId = loadedImage.getImageId();
        if (args.rotation != 0) {
            imageStore.rotate(imageId, args.rotation);
        }
        if (args.windowCenter != null && args.windowWidth != null) {
            imageStore.updateWindowLevel(imageId, args.windowCenter, args.windowWidth);
        }
        List<Integer> slices = CollectionUtils.isEmpty(args.slices)
                ? IntStream.range(0, loadedImage.getTotalSlices()).boxed().collect(Collectors.toList())
                : args.slices;
        String extension = args.format == TransferFormat.PNG ? ".png" : ".raw";
        try {
            for (Integer sliceIndex : slices) {
                File sliceFile = new File(args.outputDir, String.format("slice_%04d%s", sliceIndex, extension));
                FileUtils.writeByteArrayToFile(sliceFile, imageViewerService.encodeSlice(imageId, sliceIndex, args.format));
                LOG.debug("Wrote slice {} to {}", sliceIndex, sliceFile);
            }
            if (args.format == TransferFormat.RAW_FLOAT32) {
                FileUtils.writeStringToFile(
                        new File(args.outputDir, "metadata.json"),
                        SliceCodec.writeMetadata(SliceCodec.describe(imageStore.getVolume(imageId))),
                        StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        LOG.info("Exported {} slices of {} to {} in {}ms",
                slices.size(), args.input, args.outputDir, System.currentTimeMillis() - startTime);
    }
}
