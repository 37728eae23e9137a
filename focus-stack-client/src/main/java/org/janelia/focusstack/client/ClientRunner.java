package org.janelia.focusstack.client;

import java.io.File;
import java.util.List;

import org.janelia.focusstack.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a batch of stack fusions from the command line and converts the batch outcome
 * into a process exit status:
 * <ul>
 *     <li>{@link #SUCCESS_STATUS} when every stack was fused,</li>
 *     <li>{@link #FAILED_STACKS_STATUS} when the batch ran but some stacks could not be fused,</li>
 *     <li>{@link #ERROR_STATUS} when the batch itself could not run (bad arguments, unreadable directories).</li>
 * </ul>
 *
 * Absence of the exit log message indicates that the client was terminated abnormally.
 */
public abstract class ClientRunner {

    public static final int SUCCESS_STATUS = 0;
    public static final int ERROR_STATUS = 1;
    public static final int FAILED_STACKS_STATUS = 2;

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Runs the batch and exits the JVM with the status derived from its outcome.
     */
    public void run() {
        System.exit(execute());
    }

    /**
     * Runs the batch with consistent log statements.
     *
     * @return exit status for the batch outcome.
     */
    public int execute() {

        LOG.info("execute: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int status;
        try {
            final List<File> failedStacks = fuseStacks(args);
            if (failedStacks.isEmpty()) {
                LOG.info("execute: exit, all stacks fused in {}", processTimer);
                status = SUCCESS_STATUS;
            } else {
                LOG.error("execute: exit, failed to fuse {} stacks after {}: {}",
                          failedStacks.size(), processTimer, failedStacks);
                status = FAILED_STACKS_STATUS;
            }
        } catch (final Throwable t) {
            LOG.error("execute: caught exception", t);
            LOG.info("execute: exit, batch failed after {}", processTimer);
            status = ERROR_STATUS;
        }

        return status;
    }

    /**
     * Parses the arguments and fuses the requested stacks.
     *
     * @param  args  command line arguments for client.
     *
     * @return stack directories that could not be fused (empty if all succeeded).
     *
     * @throws Exception
     *   if the batch cannot be run at all.
     */
    public abstract List<File> fuseStacks(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
