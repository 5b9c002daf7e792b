package org.janelia.identicon.cmd;

import org.apache.commons.lang3.StringUtils;
import org.janelia.identicon.config.Config;
import org.janelia.identicon.config.ConfigProvider;

abstract class AbstractCmd {

    private final String commandName;
    private Config config;

    AbstractCmd(String commandName) {
        this.commandName = commandName;
        this.config = null;
    }

    public String getCommandName() {
        return commandName;
    }

    abstract AbstractCmdArgs getArgs();

    boolean matches(String commandName) {
        return StringUtils.isNotBlank(commandName) && StringUtils.equals(this.commandName, commandName);
    }

    abstract void execute();

    Config getConfig() {
        if (config == null) {
            config = ConfigProvider.getInstance()
                    .fromDefaultResources()
                    .fromFile(getArgs().getConfigFileName())
                    .fromSystemProperties()
                    .get();
        }
        return config;
    }
}
