package org.janelia.identicon.cmd;

import com.beust.jcommander.Parameter;

class CommonArgs {
    @Parameter(names = {"--config", "-config"}, description = "Configuration file")
    String configFileName;

    @Parameter(names = {"--task-concurrency", "-tc"}, description = "Number of worker threads; 0 uses the configured value")
    int taskConcurrency = 0;

    @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
    boolean displayHelpMessage = false;
}
