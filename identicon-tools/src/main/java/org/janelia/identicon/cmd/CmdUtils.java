package org.janelia.identicon.cmd;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.janelia.identicon.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class CmdUtils {
    private static final Logger LOG = LoggerFactory.getLogger(CmdUtils.class);

    static ExecutorService createCmdExecutor(int taskConcurrency) {
        LOG.debug("Create a thread pool with {} worker threads ({} available processors)",
                taskConcurrency, Runtime.getRuntime().availableProcessors());
        return Executors.newFixedThreadPool(
                taskConcurrency,
                new ThreadFactoryBuilder()
                        .setNameFormat("IDENTICON-%d")
                        .setDaemon(true)
                        .build());
    }

    /**
     * The command line value wins, then the configured value; 0 from both means one thread
     * less than the available processors.
     */
    static int getTaskConcurrency(CommonArgs args, Config config) {
        if (args.taskConcurrency > 0) {
            return args.taskConcurrency;
        }
        int configuredConcurrency = config.getIntegerPropertyValue("Generator.TaskConcurrency", 0);
        if (configuredConcurrency > 0) {
            return configuredConcurrency;
        } else {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        }
    }
}
