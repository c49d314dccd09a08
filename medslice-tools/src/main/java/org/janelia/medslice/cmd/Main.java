package org.janelia.medslice.cmd;

import java.util.Arrays;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static void main(String[] argv) {
        System.exit(run(argv));
    }

    static int run(String[] argv) {
        CommonArgs commonArgs = new CommonArgs();
        List<AbstractCmd> cmds = Arrays.asList(
                new WindowInfoCmd("window", commonArgs),
                new ExportSlicesCmd("export-slices", commonArgs),
                new RegisterVolumesCmd("register", commonArgs)
        );
        JCommander.Builder cmdlineBuilder = JCommander.newBuilder()
                .programName("medslice")
                .addObject(commonArgs);
        cmds.forEach(cmd -> cmdlineBuilder.addCommand(cmd.getCommandName(), cmd.getArgs()));
        JCommander cmdline = cmdlineBuilder.build();

        try {
            cmdline.parse(argv);
        } catch (ParameterException e) {
            LOG.error("Invalid arguments: {}", e.getMessage());
            cmdline.usage();
            return 1;
        }
        if (commonArgs.displayHelpMessage || StringUtils.isBlank(cmdline.getParsedCommand())) {
            cmdline.usage();
            return commonArgs.displayHelpMessage ? 0 : 1;
        }
        AbstractCmd cmd = cmds.stream()
                .filter(c -> c.matches(cmdline.getParsedCommand()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unknown command " + cmdline.getParsedCommand()));
        List<String> errors = cmd.getArgs().validate();
        if (!errors.isEmpty()) {
            errors.forEach(err -> LOG.error("{}: {}", cmd.getCommandName(), err));
            cmdline.getUsageFormatter().usage(cmd.getCommandName());
            return 1;
        }
        try {
            cmd.execute();
            return 0;
        } catch (Exception e) {
            LOG.error("Error running {}", cmd.getCommandName(), e);
            return 2;
        }
    }
}
