package org.janelia.keypoints.client;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.janelia.keypoints.util.CancellationToken;
import org.janelia.keypoints.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line client wrapper that logs unexpected exceptions and overall process completion events.
 *
 * <p>
 * Absence of the standard exit log message indicates that the client was terminated abnormally.
 * Interrupt and termination signals do not kill a running client immediately:
 * a shutdown hook requests cancellation through the client's token and waits (up to
 * {@link #SHUTDOWN_WAIT_SECONDS} seconds) for the client to finish the pair it is working on.
 * </p>
 */
public abstract class ClientRunner {

    public static final long SHUTDOWN_WAIT_SECONDS = 60;

    private final String[] args;
    private final CancellationToken cancellationToken;
    private final CountDownLatch clientDone;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
        this.cancellationToken = new CancellationToken();
        this.clientDone = new CountDownLatch(1);
    }

    /**
     * Wraps a run with consistent log statements and exits the JVM with the client's status.
     */
    public void run() {

        LOG.info("run: entry");

        final ProcessTimer processTimer = new ProcessTimer();
        Runtime.getRuntime().addShutdownHook(new Thread(this::cancelAndWait, "client-shutdown"));

        int status;
        try {
            runClient(args, cancellationToken);
            LOG.info("run: exit, processing completed in {}", processTimer);
            status = 0;
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            LOG.info("run: exit, processing failed after {}", processTimer);
            status = 1;
        } finally {
            clientDone.countDown();
        }

        System.exit(status);
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args               command line arguments for client.
     * @param  cancellationToken  cancelled when the process is asked to shut down.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args,
                                   final CancellationToken cancellationToken) throws Exception;

    private void cancelAndWait() {
        if (clientDone.getCount() > 0) {
            LOG.warn("cancelAndWait: shutdown requested, waiting for client to stop");
            cancellationToken.cancel();
            try {
                if (! clientDone.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    LOG.warn("cancelAndWait: client did not stop within {} seconds", SHUTDOWN_WAIT_SECONDS);
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("cancelAndWait: interrupted while waiting for client to stop");
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
