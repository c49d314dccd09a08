package org.janelia.medslice.cmd;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.commons.lang3.StringUtils;
import org.janelia.medslice.image.Volume;
import org.janelia.medslice.image.algorithms.ImageStatistics;
import org.janelia.medslice.image.algorithms.WindowEstimation;
import org.janelia.medslice.image.algorithms.WindowSettings;
import org.janelia.medslice.image.algorithms.WindowingAlgorithms;
import org.janelia.medslice.image.algorithms.WindowingOptions;
import org.janelia.medslice.image.io.ImageReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to report the automatic window and the intensity statistics of an image.
 */
class WindowInfoCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(WindowInfoCmd.class);

    @Parameters(commandDescription = "Report the automatic window settings and intensity statistics of an image")
    static class WindowInfoArgs extends AbstractCmdArgs {
        WindowInfoArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        @Parameter(names = {"--input", "-i"}, description = "Input image (.dcm, .nii, .nii.gz, .jpg, .jpeg, .png, .bmp)", required = true)
        String input;

        @Parameter(names = {"--estimation"}, description = "Which samples the window is estimated from; if not set the configured one is used")
        WindowEstimation estimation;

        @Parameter(names = {"--output", "-o"}, description = "Output JSON file; if not set the result is written to stdout")
        String output;

        @Override
        List<String> validate() {
            List<String> errors = new ArrayList<>();
            if (!new File(input).isFile()) {
                errors.add("Input " + input + " is not a file");
            }
            return errors;
        }
    }

    private final WindowInfoArgs args;
    private final ObjectMapper mapper;

    WindowInfoCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new WindowInfoArgs(commonArgs);
        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    WindowInfoArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        long startTime = System.currentTimeMillis();
        Volume volume = ImageReader.readImage(args.input);
        WindowEstimation estimation = args.estimation != null
                ? args.estimation
                : WindowingOptions.fromConfig(getConfig()).getEstimation();
        WindowSettings windowSettings = WindowingAlgorithms.calculateOptimalWindowSettings(volume, estimation);
        Map<String, Object> windowInfo = new LinkedHashMap<>();
        windowInfo.put("input", args.input);
        windowInfo.put("sourceFormat", volume.getSourceFormat());
        windowInfo.put("shape", volume.getShape());
        windowInfo.put("voxelSpacing", volume.getVoxelSpacing().toArray());
        windowInfo.put("estimation", estimation);
        windowInfo.put("windowCenter", windowSettings.getCenter());
        windowInfo.put("windowWidth", windowSettings.getWidth());
        windowInfo.put("statistics", ImageStatistics.compute(volume.getData()));
        try {
            if (StringUtils.isBlank(args.output)) {
                mapper.writeValue(System.out, windowInfo);
            } else {
                mapper.writeValue(new File(args.output), windowInfo);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        LOG.info("Computed window {} for {} in {}ms", windowSettings, args.input, System.currentTimeMillis() - startTime);
    }
}
