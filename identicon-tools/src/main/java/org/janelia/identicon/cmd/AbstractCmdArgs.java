package org.janelia.identicon.cmd;

import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

import com.beust.jcommander.ParametersDelegate;

class AbstractCmdArgs {
    @ParametersDelegate
    final CommonArgs commonArgs;

    AbstractCmdArgs(CommonArgs commonArgs) {
        this.commonArgs = commonArgs;
    }

    @Nullable
    String getConfigFileName() {
        return commonArgs.configFileName;
    }

    /**
     * @return argument errors; empty if the arguments are valid
     */
    List<String> validate() {
        return Collections.emptyList();
    }
}
