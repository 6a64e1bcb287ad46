package org.janelia.keypoints.aggregate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.match.ImagePair;
import org.janelia.keypoints.match.MatchArray;
import org.janelia.keypoints.match.MutualMatchFilter;
import org.janelia.keypoints.match.PairCorrespondences;
import org.janelia.keypoints.quantize.KeypointQuantizer;
import org.janelia.keypoints.store.KeyedStore;
import org.janelia.keypoints.store.PairCorrespondenceLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites pair match arrays against the final keypoint sets of both images.
 *
 * <p>
 * Match arrays written during aggregation refer to indexes of sets that were still growing.
 * Once truncation has discarded entries, those indexes may point past the end of the
 * final sets, so every pair is looked up again (nearest neighbor within maxError,
 * no quantization) and filtered to mutual best matches.
 * </p>
 */
public class MatchReassigner {

    private final KeypointQuantizer quantizer;
    private final PairCorrespondenceLookup correspondenceLookup;
    private final KeyedStore<MatchArray> matchStore;
    private final int numberOfThreads;

    public MatchReassigner(final double maxError,
                           final PairCorrespondenceLookup correspondenceLookup,
                           final KeyedStore<MatchArray> matchStore,
                           final int numberOfThreads)
            throws IllegalArgumentException {

        if (numberOfThreads < 1) {
            throw new IllegalArgumentException("numberOfThreads must be positive but was " + numberOfThreads);
        }

        this.quantizer = new KeypointQuantizer(maxError);
        this.correspondenceLookup = correspondenceLookup;
        this.matchStore = matchStore;
        this.numberOfThreads = numberOfThreads;
    }

    /**
     * @param  pairs                pairs to rewrite (each output key is written by exactly one task).
     * @param  finalKeypointSets    frozen keypoints by image name (images without an entry have none).
     *
     * @return summary of the pass.
     *
     * @throws IOException
     *   if any pair cannot be read or written.
     */
    public ReassignmentResult reassign(final List<ImagePair> pairs,
                                       final Map<String, CanonicalKeypointSet> finalKeypointSets)
            throws IOException {

        LOG.info("reassign: entry, rewriting matches for {} pairs with {} threads", pairs.size(), numberOfThreads);

        final List<Callable<MatchArray>> tasks = new ArrayList<>(pairs.size());
        for (final ImagePair pair : pairs) {
            tasks.add(() -> reassignPair(pair,
                                         getFinalSet(finalKeypointSets, pair.getA()),
                                         getFinalSet(finalKeypointSets, pair.getB())));
        }

        final ReassignmentResult result = new ReassignmentResult();

        final ExecutorService taskExecutor = Executors.newFixedThreadPool(numberOfThreads);
        try {
            // invokeAll() returns when all tasks are complete
            final List<Future<MatchArray>> futures = taskExecutor.invokeAll(tasks);
            for (int i = 0; i < pairs.size(); i++) {
                final MatchArray matchArray = futures.get(i).get();
                if (matchArray == null) {
                    result.addMissingPair(pairs.get(i));
                } else {
                    result.addReassignedPair(pairs.get(i), matchArray.getMatchCount());
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while reassigning matches", e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("failed to reassign matches", cause);
        } finally {
            taskExecutor.shutdown();
        }

        if (result.getEmptyPairs().size() > 0) {
            LOG.warn("reassign: {} pairs have no matches left, first is {}",
                     result.getEmptyPairs().size(), result.getEmptyPairs().get(0));
        }

        LOG.info("reassign: exit, {}", result);

        return result;
    }

    /**
     * @return the rewritten match array or null if the pair's correspondences are missing.
     */
    MatchArray reassignPair(final ImagePair pair,
                            final CanonicalKeypointSet keypointSetA,
                            final CanonicalKeypointSet keypointSetB)
            throws IOException {

        final PairCorrespondences correspondences = correspondenceLookup.find(pair);
        if (correspondences == null) {
            LOG.warn("reassignPair: no correspondences stored for {} in either direction, skipping pair", pair);
            return null;
        }

        final int[] indexesA = quantizer.lookup(correspondences.getKeypointsA(), keypointSetA);
        final int[] indexesB = quantizer.lookup(correspondences.getKeypointsB(), keypointSetB);

        final MatchArray matchArray = MutualMatchFilter.filterToMatchArray(indexesA,
                                                                           indexesB,
                                                                           correspondences.getScores(),
                                                                           false);
        matchStore.save(pair.toKey(), matchArray);

        return matchArray;
    }

    private static CanonicalKeypointSet getFinalSet(final Map<String, CanonicalKeypointSet> finalKeypointSets,
                                                    final String imageName) {
        final CanonicalKeypointSet keypointSet = finalKeypointSets.get(imageName);
        return keypointSet == null ? CanonicalKeypointSet.EMPTY : keypointSet;
    }

    private static final Logger LOG = LoggerFactory.getLogger(MatchReassigner.class);
}
