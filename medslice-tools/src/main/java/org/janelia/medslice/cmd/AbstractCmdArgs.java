package org.janelia.medslice.cmd;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

class AbstractCmdArgs implements Serializable {

    final transient CommonArgs commonArgs;

    AbstractCmdArgs(CommonArgs commonArgs) {
        this.commonArgs = commonArgs;
    }

    String getConfigFileName() {
        return commonArgs.configFileName;
    }

    List<String> validate() {
        return Collections.emptyList();
    }
}
