package org.janelia.identicon.cmd;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import org.apache.commons.lang3.StringUtils;
import org.janelia.identicon.config.Config;
import org.janelia.identicon.image.io.IdenticonImageWriter;
import org.janelia.identicon.model.Identicon;
import org.janelia.identicon.pipeline.IdenticonGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to generate identicon PNG files.
 */
class GenerateIdenticonsCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(GenerateIdenticonsCmd.class);

    @Parameters(commandDescription = "Generate an identicon image for every input string")
    static class GenerateIdenticonsArgs extends AbstractCmdArgs {
        GenerateIdenticonsArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        @Parameter(names = {"--input", "-i"}, description = "Input strings", required = true, variableArity = true)
        List<String> inputs = new ArrayList<>();

        @Parameter(names = {"--output-dir", "-od"}, description = "Output directory; defaults to the configured Output.Dir")
        String outputDir;

        @Parameter(names = {"--overwrite"}, description = "Overwrite existing images", arity = 0)
        boolean overwrite = false;

        @Override
        List<String> validate() {
            List<String> errors = new ArrayList<>();
            if (inputs == null || inputs.isEmpty()) {
                errors.add("At least one input is required");
            }
            if (commonArgs.taskConcurrency < 0) {
                errors.add("Task concurrency cannot be negative");
            }
            return errors;
        }
    }

    private final GenerateIdenticonsArgs args;
    private final IdenticonGenerator identiconGenerator;

    GenerateIdenticonsCmd(String commandName) {
        super(commandName);
        this.args = new GenerateIdenticonsArgs(new CommonArgs());
        this.identiconGenerator = new IdenticonGenerator();
    }

    @Override
    GenerateIdenticonsArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        Config config = getConfig();
        Path outputDir = Paths.get(StringUtils.defaultIfBlank(args.outputDir, config.getStringPropertyValue("Output.Dir", ".")));
        boolean overwrite = args.overwrite || config.getBooleanPropertyValue("Output.Overwrite", false);
        int taskConcurrency = CmdUtils.getTaskConcurrency(args.commonArgs, config);

        AtomicLong written = new AtomicLong();
        AtomicLong skipped = new AtomicLong();
        AtomicLong failed = new AtomicLong();
        // distinct inputs can map to the same file name; only the first one of each group is generated
        Map<String, List<String>> inputsByFileName = args.inputs.stream()
                .distinct()
                .collect(Collectors.groupingBy(IdenticonImageWriter::defaultFileName, LinkedHashMap::new, Collectors.toList()));
        inputsByFileName.forEach((fileName, inputs) -> {
            if (inputs.size() > 1) {
                LOG.error("Inputs {} all map to {} - only '{}' will be generated", inputs, fileName, inputs.get(0));
                failed.addAndGet(inputs.size() - 1);
            }
        });
        long startTime = System.currentTimeMillis();
        ExecutorService executorService = CmdUtils.createCmdExecutor(taskConcurrency);
        try {
            List<CompletableFuture<Void>> generateTasks = inputsByFileName.values().stream()
                    .map(inputs -> inputs.get(0))
                    .map(input -> CompletableFuture
                            .runAsync(() -> {
                                if (generateIdenticon(input, outputDir, overwrite)) {
                                    written.incrementAndGet();
                                } else {
                                    skipped.incrementAndGet();
                                }
                            }, executorService)
                            .exceptionally(e -> {
                                LOG.error("Error generating identicon for '{}'", input, e);
                                failed.incrementAndGet();
                                return null;
                            }))
                    .collect(Collectors.toList());
            CompletableFuture.allOf(generateTasks.toArray(new CompletableFuture<?>[0])).join();
        } finally {
            executorService.shutdown();
        }
        LOG.info("Finished generating {} identicons in {} in {}s: {} written, {} skipped, {} failed",
                args.inputs.size(), outputDir, (System.currentTimeMillis() - startTime) / 1000.,
                written.get(), skipped.get(), failed.get());
        if (failed.get() > 0) {
            throw new IllegalStateException("Failed to generate " + failed.get() + " out of " + args.inputs.size() + " identicons");
        }
    }

    /**
     * @return true if the image was written, false if it was skipped because it already exists
     */
    private boolean generateIdenticon(String input, Path outputDir, boolean overwrite) {
        Path imagePath = outputDir.resolve(IdenticonImageWriter.defaultFileName(input));
        if (!overwrite && Files.exists(imagePath)) {
            LOG.warn("{} already exists - skip generating it for '{}'", imagePath, input);
            return false;
        }
        Identicon identicon = identiconGenerator.generate(input);
        IdenticonImageWriter.writePNGFile(identicon.getImage(), imagePath);
        LOG.info("Wrote identicon for '{}' to {}", input, imagePath);
        return true;
    }
}
