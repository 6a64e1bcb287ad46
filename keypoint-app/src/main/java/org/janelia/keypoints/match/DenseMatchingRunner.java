package org.janelia.keypoints.match;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.janelia.keypoints.store.KeyedStore;
import org.janelia.keypoints.store.PairCorrespondenceLookup;
import org.janelia.keypoints.util.CancellationToken;
import org.janelia.keypoints.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link DenseMatcher} for pairs that have no stored correspondences yet.
 *
 * <p>
 * Matcher workers run on a fixed thread pool and hand their results to the calling thread
 * through a bounded queue. The calling thread is the only writer of the correspondence store.
 * </p>
 */
public class DenseMatchingRunner {

    private final DenseMatcher matcher;
    private final KeyedStore<PairCorrespondences> correspondenceStore;
    private final int numberOfWorkers;
    private final int queueCapacity;

    public DenseMatchingRunner(final DenseMatcher matcher,
                               final KeyedStore<PairCorrespondences> correspondenceStore,
                               final int numberOfWorkers,
                               final int queueCapacity)
            throws IllegalArgumentException {

        if (numberOfWorkers < 1) {
            throw new IllegalArgumentException("numberOfWorkers must be positive but was " + numberOfWorkers);
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive but was " + queueCapacity);
        }

        this.matcher = matcher;
        this.correspondenceStore = correspondenceStore;
        this.numberOfWorkers = numberOfWorkers;
        this.queueCapacity = queueCapacity;
    }

    /**
     * @return distinct pairs whose correspondences are not stored under either direction
     *         (or all distinct pairs when overwrite is requested).
     */
    public List<ImagePair> findNewPairs(final Collection<ImagePair> pairs,
                                        final boolean overwrite)
            throws IOException {

        final List<ImagePair> newPairs = new ArrayList<>();
        final PairCorrespondenceLookup lookup = new PairCorrespondenceLookup(correspondenceStore);
        for (final ImagePair pair : new LinkedHashSet<>(pairs)) {
            if (overwrite || (! lookup.contains(pair))) {
                newPairs.add(pair);
            }
        }
        return newPairs;
    }

    /**
     * Matches every new pair and stores the results under the pairs' normalized keys.
     *
     * @throws IOException
     *   if results cannot be stored or the calling thread is interrupted.
     */
    public DenseMatchingStats run(final Collection<ImagePair> pairs,
                                  final boolean overwrite,
                                  final CancellationToken cancellationToken)
            throws IOException {

        final List<ImagePair> newPairs = findNewPairs(pairs, overwrite);

        final DenseMatchingStats stats = new DenseMatchingStats();
        stats.setExistingPairCount(new LinkedHashSet<>(pairs).size() - newPairs.size());

        LOG.info("run: entry, matching {} new pairs with {} workers, {} pairs already have correspondences",
                 newPairs.size(), numberOfWorkers, stats.getExistingPairCount());

        if (newPairs.isEmpty()) {
            return stats;
        }

        final BlockingQueue<MatchOutcome> outcomeQueue = new ArrayBlockingQueue<>(queueCapacity);
        final ExecutorService workerExecutor = Executors.newFixedThreadPool(numberOfWorkers);
        for (final ImagePair pair : newPairs) {
            workerExecutor.submit(() -> matchPair(pair, cancellationToken, outcomeQueue));
        }
        workerExecutor.shutdown();

        final ProcessTimer timer = new ProcessTimer();
        boolean completed = false;
        try {
            for (int i = 0; i < newPairs.size(); i++) {
                final MatchOutcome outcome = outcomeQueue.take();
                if (outcome.correspondences != null) {
                    correspondenceStore.save(outcome.pair.toKey(), outcome.correspondences);
                    stats.incrementMatchedPairCount();
                } else if (outcome.cancelled) {
                    stats.incrementCancelledPairCount();
                } else {
                    stats.addFailedPair(outcome.pair);
                }
                if (timer.incrementAndCheckInterval()) {
                    LOG.info("run: stored {} of {} pairs", timer.getItemCount(), newPairs.size());
                }
            }
            completed = true;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while waiting for matcher results", e);
        } finally {
            if (! completed) {
                workerExecutor.shutdownNow();
            }
        }

        try {
            if (! workerExecutor.awaitTermination(1, TimeUnit.MINUTES)) {
                LOG.warn("run: matcher workers did not terminate");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while waiting for matcher workers", e);
        }

        if (stats.getFailedPairs().size() > 0) {
            LOG.warn("run: matcher failed for {} pairs, first is {}",
                     stats.getFailedPairs().size(), stats.getFailedPairs().get(0));
        }

        LOG.info("run: exit, {}, matching took {}", stats, timer);

        return stats;
    }

    private void matchPair(final ImagePair pair,
                           final CancellationToken cancellationToken,
                           final BlockingQueue<MatchOutcome> outcomeQueue) {

        MatchOutcome outcome;
        if (cancellationToken.isCancelled()) {
            outcome = new MatchOutcome(pair, null, true);
        } else {
            try {
                final PairCorrespondences correspondences = matcher.match(pair);
                if (correspondences == null) {
                    LOG.warn("matchPair: matcher returned no correspondences for {}", pair);
                }
                outcome = new MatchOutcome(pair, correspondences, false);
            } catch (final Exception e) {
                LOG.warn("matchPair: failed to match " + pair, e);
                outcome = new MatchOutcome(pair, null, false);
            }
        }

        try {
            outcomeQueue.put(outcome);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("matchPair: interrupted before result for {} could be queued", pair);
        }
    }

    private static class MatchOutcome {

        private final ImagePair pair;
        private final PairCorrespondences correspondences;
        private final boolean cancelled;

        private MatchOutcome(final ImagePair pair,
                             final PairCorrespondences correspondences,
                             final boolean cancelled) {
            this.pair = pair;
            this.correspondences = correspondences;
            this.cancelled = cancelled;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(DenseMatchingRunner.class);
}
