package org.janelia.identicon.cmd;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.janelia.identicon.config.Config;
import org.janelia.identicon.config.ConfigProvider;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CmdUtilsTest {

    @Test
    public void taskConcurrencyFromArgsOrDefaults() {
        Config config = ConfigProvider.getInstance().fromDefaultResources().get();
        CommonArgs args = new CommonArgs();

        args.taskConcurrency = 3;
        assertEquals(3, CmdUtils.getTaskConcurrency(args, config));

        args.taskConcurrency = 0;
        assertEquals(Math.max(1, Runtime.getRuntime().availableProcessors() - 1), CmdUtils.getTaskConcurrency(args, config));
    }

    @Test
    public void executorUsesNamedDaemonThreads() throws Exception {
        ExecutorService executorService = CmdUtils.createCmdExecutor(1);
        try {
            Future<Thread> workerThread = executorService.submit(Thread::currentThread);
            assertTrue(workerThread.get().getName().startsWith("IDENTICON-"));
            assertTrue(workerThread.get().isDaemon());
        } finally {
            executorService.shutdown();
        }
    }
}
