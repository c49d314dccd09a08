package org.janelia.medslice.cmd;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import org.apache.commons.io.FileUtils;
import org.janelia.medslice.codec.SliceCodec;
import org.janelia.medslice.image.Volume;
import org.janelia.medslice.image.io.ImageReader;
import org.janelia.medslice.registration.RegistrationClient;
import org.janelia.medslice.registration.SpacingResampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to align a moving volume to a fixed one and write the result as raw float32 slices.
 */
class RegisterVolumesCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(RegisterVolumesCmd.class);

    @Parameters(commandDescription = "Resample a moving volume onto the grid of a fixed volume")
    static class RegisterVolumesArgs extends AbstractCmdArgs {
        RegisterVolumesArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        @Parameter(names = {"--fixed"}, description = "Fixed image", required = true)
        String fixed;

        @Parameter(names = {"--moving"}, description = "Moving image", required = true)
        String moving;

        @Parameter(names = {"--output-dir", "-od"}, description = "Output directory", required = true)
        String outputDir;

        @Override
        List<String> validate() {
            List<String> errors = new ArrayList<>();
            if (!new File(fixed).isFile()) {
                errors.add("Fixed image " + fixed + " is not a file");
            }
            if (!new File(moving).isFile()) {
                errors.add("Moving image " + moving + " is not a file");
            }
            return errors;
        }
    }

    private final RegisterVolumesArgs args;

    RegisterVolumesCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new RegisterVolumesArgs(commonArgs);
    }

    @Override
    RegisterVolumesArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        Volume fixed = ImageReader.readImage(args.fixed);
        Volume moving = ImageReader.readImage(args.moving);
        Volume registered = new RegistrationClient(new SpacingResampler()).register(fixed, moving);
        try {
            FileUtils.writeByteArrayToFile(new File(args.outputDir, "registered.raw"), SliceCodec.encodeVolume(registered));
            FileUtils.writeStringToFile(
                    new File(args.outputDir, "metadata.json"),
                    SliceCodec.writeMetadata(SliceCodec.describe(registered)),
                    StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        LOG.info("Registered {} to {} into {}", args.moving, args.fixed, args.outputDir);
    }
}
