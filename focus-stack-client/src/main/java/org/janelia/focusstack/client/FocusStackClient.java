package org.janelia.focusstack.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import ij.process.ImageProcessor;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.focusstack.PyramidFusion;
import org.janelia.focusstack.client.parameter.CommandLineParameters;
import org.janelia.focusstack.client.parameter.PyramidFusionParameters;
import org.janelia.focusstack.image.MultiChannelImage;
import org.janelia.focusstack.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for fusing focus stacks.
 * Each stack is a directory of images of one scene taken at different focus distances.
 * Every stack is fused into one image named after its directory.
 */
public class FocusStackClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public PyramidFusionParameters fusion = new PyramidFusionParameters();

        @Parameter(
                names = "--stackDirectory",
                description = "Directory containing the images of one focus stack",
                variableArity = true)
        public List<String> stackDirectories = new ArrayList<>();

        @Parameter(
                names = "--stackDirectoryPattern",
                description = "Glob pattern for stack directory names (e.g. /data/run_*), " +
                              "matched against the entries of the pattern's parent directory")
        public String stackDirectoryPattern;

        @Parameter(
                names = "--outputDirectory",
                description = "Directory for fused images (default is to write <stackDirectory>.<format>)")
        public String outputDirectory;

        @Parameter(
                names = "--format",
                description = "Format for fused images (jpg, png, tif)")
        public String format = StackImageIO.JPEG_FORMAT;

        @Parameter(
                names = "--quality",
                description = "JPEG quality float [0, 1]")
        public float quality = 0.85f;

        @Parameter(
                names = "--overwrite",
                description = "Overwrite existing fused images (default is to skip stacks that were already fused)",
                arity = 0)
        public boolean overwrite = false;

        @Parameter(
                names = "--threads",
                description = "Number of stacks to fuse concurrently")
        public int threads = 4;

        @Parameter(
                names = "--focusThreshold",
                description = "If specified, drop stack images with a focus value below this threshold before fusing")
        public Double focusThreshold;

        public void validate()
                throws IllegalArgumentException {
            if (stackDirectories.isEmpty() && (stackDirectoryPattern == null)) {
                throw new IllegalArgumentException("must specify --stackDirectory and/or --stackDirectoryPattern");
            }
            if (threads < 1) {
                throw new IllegalArgumentException("threads must be positive");
            }
            if ((quality < 0) || (quality > 1)) {
                throw new IllegalArgumentException("quality must be between 0 and 1");
            }
        }
    }

    /**
     * @param  args  see {@link Parameters} for command line argument details.
     */
    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public List<File> fuseStacks(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("fuseStacks: entry, parameters={}", parameters);

                return new FocusStackClient(parameters).fuseStacks();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final PyramidFusion pyramidFusion;
    private final StackFilter stackFilter;

    public FocusStackClient(final Parameters parameters)
            throws IllegalArgumentException {
        parameters.validate();
        this.parameters = parameters;
        this.pyramidFusion = new PyramidFusion(parameters.fusion.buildFusionParameters());
        this.stackFilter = parameters.focusThreshold == null ? null : new StackFilter(parameters.focusThreshold);
    }

    /**
     * Fuses every requested stack, running up to --threads stacks concurrently.
     *
     * @return list of stack directories that could not be fused (empty if all succeeded).
     *
     * @throws IOException
     *   if the stack directories cannot be resolved.
     * @throws InterruptedException
     *   if interrupted while waiting for stacks to be fused.
     */
    public List<File> fuseStacks()
            throws IOException, InterruptedException {

        final List<File> stackDirectoryList = resolveStackDirectories();

        LOG.info("fuseStacks: entry, fusing {} stacks with {} threads", stackDirectoryList.size(), parameters.threads);

        final List<File> failedStacks = new ArrayList<>();
        final ExecutorService executorService = Executors.newFixedThreadPool(parameters.threads);
        try {
            final List<Future<File>> futures = new ArrayList<>(stackDirectoryList.size());
            for (final File stackDirectory : stackDirectoryList) {
                futures.add(executorService.submit(() -> fuseStack(stackDirectory)));
            }

            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (final ExecutionException e) {
                    final File stackDirectory = stackDirectoryList.get(i);
                    LOG.error("fuseStacks: failed to fuse " + stackDirectory, e.getCause());
                    failedStacks.add(stackDirectory);
                }
            }
        } finally {
            executorService.shutdownNow();
        }

        LOG.info("fuseStacks: exit, fused {} out of {} stacks",
                 stackDirectoryList.size() - failedStacks.size(), stackDirectoryList.size());

        return failedStacks;
    }

    /**
     * Fuses the images in one stack directory and saves the result.
     *
     * @return the fused image file.
     *
     * @throws IOException
     *   if the stack cannot be read or the result cannot be written.
     */
    public File fuseStack(final File stackDirectory)
            throws IOException {

        final File fusedFile = getFusedFile(stackDirectory);
        if ((! parameters.overwrite) && fusedFile.exists()) {
            LOG.info("fuseStack: skipping {} because {} already exists", stackDirectory, fusedFile);
            return fusedFile;
        }

        final ProcessTimer timer = new ProcessTimer();

        LOG.info("fuseStack: reading {}", stackDirectory);

        List<ImageProcessor> processors = StackImageIO.openProcessors(StackImageIO.listImageFiles(stackDirectory));
        if (stackFilter != null) {
            processors = stackFilter.filter(processors);
        }

        LOG.info("fuseStack: stacking {} images in {}", processors.size(), stackDirectory);

        final MultiChannelImage fused = pyramidFusion.fuseProcessors(processors);

        LOG.info("fuseStack: writing {}", fusedFile);

        StackImageIO.saveImage(fused.toColorProcessor(), fusedFile, parameters.quality);

        LOG.info("fuseStack: exit, fused {} in {}", stackDirectory, timer);

        return fusedFile;
    }

    /**
     * @return output file for the specified stack directory.
     */
    public File getFusedFile(final File stackDirectory) {
        final String fileName = stackDirectory.getName() + "." + parameters.format;
        final File fusedFile;
        if (parameters.outputDirectory == null) {
            fusedFile = new File(stackDirectory.getAbsoluteFile().getParentFile(), fileName);
        } else {
            fusedFile = new File(parameters.outputDirectory, fileName);
        }
        return fusedFile;
    }

    /**
     * @return explicitly listed stack directories followed by directories matching the pattern
     *         (sorted by name, without duplicates).
     *
     * @throws IOException
     *   if a listed directory does not exist or the pattern's parent directory cannot be read.
     */
    List<File> resolveStackDirectories()
            throws IOException {

        final Set<File> directories = new LinkedHashSet<>();

        for (final String stackDirectory : parameters.stackDirectories) {
            final File directory = new File(stackDirectory).getAbsoluteFile();
            if (! directory.isDirectory()) {
                throw new IOException("stack directory " + directory + " does not exist");
            }
            directories.add(directory);
        }

        if (parameters.stackDirectoryPattern != null) {
            final Path patternPath = Paths.get(parameters.stackDirectoryPattern).toAbsolutePath();
            final Path parentPath = patternPath.getParent();
            final List<File> matches = new ArrayList<>();
            try (final DirectoryStream<Path> stream =
                         Files.newDirectoryStream(parentPath, patternPath.getFileName().toString())) {
                for (final Path path : stream) {
                    if (Files.isDirectory(path)) {
                        matches.add(path.toFile());
                    }
                }
            }
            matches.sort(null);
            LOG.info("resolveStackDirectories: found {} directories matching {}",
                     matches.size(), parameters.stackDirectoryPattern);
            directories.addAll(matches);
        }

        return new ArrayList<>(directories);
    }

    private static final Logger LOG = LoggerFactory.getLogger(FocusStackClient.class);
}
