package org.janelia.medslice.cmd;

import com.beust.jcommander.Parameter;

class CommonArgs {
    @Parameter(names = "--config", description = "Config file")
    String configFileName;

    @Parameter(names = "--task-concurrency", description = "Number of worker threads; 0 uses one less than the available processors")
    int taskConcurrency = 0;

    @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
    boolean displayHelpMessage = false;
}
