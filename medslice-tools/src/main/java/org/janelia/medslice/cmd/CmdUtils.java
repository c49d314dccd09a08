package org.janelia.medslice.cmd;

import java.util.Collections;
import java.util.Map;

class CmdUtils {

    /**
     * Config values set on the command line; they override the config file.
     */
    static Map<String, String> getConfigOverrides(CommonArgs args) {
        if (args.taskConcurrency > 0) {
            return Collections.singletonMap("Workers.Count", String.valueOf(args.taskConcurrency));
        } else {
            return Collections.emptyMap();
        }
    }
}
