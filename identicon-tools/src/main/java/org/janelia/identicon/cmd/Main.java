package org.janelia.identicon.cmd;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import javax.annotation.Nullable;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identicon command line entry point.
 */
public class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static class MainArgs {
        @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
        boolean displayHelpMessage = false;
    }

    public static void main(String[] argv) {
        int status = run(System.out, argv);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(PrintStream out, String... argv) {
        MainArgs mainArgs = new MainArgs();
        List<AbstractCmd> cmds = Arrays.asList(
                new GenerateIdenticonsCmd("generate"),
                new ShowIdenticonsCmd("show", out)
        );
        JCommander.Builder cmdlineBuilder = JCommander.newBuilder()
                .programName("identicon")
                .addObject(mainArgs);
        cmds.forEach(cmd -> cmdlineBuilder.addCommand(cmd.getCommandName(), cmd.getArgs()));
        JCommander cmdline = cmdlineBuilder.build();

        try {
            cmdline.parse(argv);
        } catch (ParameterException e) {
            LOG.error("Invalid arguments: {}", e.getMessage());
            printUsage(out, cmdline, null);
            return 1;
        }

        String parsedCommand = cmdline.getParsedCommand();
        if (mainArgs.displayHelpMessage) {
            printUsage(out, cmdline, null);
            return 0;
        } else if (parsedCommand == null) {
            LOG.error("No command specified");
            printUsage(out, cmdline, null);
            return 1;
        }

        Optional<AbstractCmd> selectedCmd = cmds.stream().filter(cmd -> cmd.matches(parsedCommand)).findFirst();
        if (!selectedCmd.isPresent()) {
            LOG.error("Unsupported command: {}", parsedCommand);
            printUsage(out, cmdline, null);
            return 1;
        }
        AbstractCmd cmd = selectedCmd.get();
        if (cmd.getArgs().commonArgs.displayHelpMessage) {
            printUsage(out, cmdline, parsedCommand);
            return 0;
        }
        List<String> validationErrors = cmd.getArgs().validate();
        if (!validationErrors.isEmpty()) {
            validationErrors.forEach(err -> LOG.error("Invalid argument: {}", err));
            printUsage(out, cmdline, parsedCommand);
            return 1;
        }
        try {
            cmd.execute();
            return 0;
        } catch (Exception e) {
            LOG.error("Error running {}", parsedCommand, e);
            return 1;
        }
    }

    private static void printUsage(PrintStream out, JCommander cmdline, @Nullable String commandName) {
        StringBuilder usageBuilder = new StringBuilder();
        if (commandName == null) {
            cmdline.getUsageFormatter().usage(usageBuilder);
        } else {
            cmdline.getUsageFormatter().usage(commandName, usageBuilder);
        }
        out.print(usageBuilder);
        out.flush();
    }
}
