package org.janelia.keypoints.aggregate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.match.ImagePair;
import org.janelia.keypoints.match.MatchArray;
import org.janelia.keypoints.match.MutualMatchFilter;
import org.janelia.keypoints.match.PairCorrespondences;
import org.janelia.keypoints.parameters.KeypointAggregationParameters;
import org.janelia.keypoints.quantize.GrowingKeypointSet;
import org.janelia.keypoints.quantize.KeypointQuantizer;
import org.janelia.keypoints.store.KeyedStore;
import org.janelia.keypoints.store.PairCorrespondenceLookup;
import org.janelia.keypoints.util.CancellationToken;
import org.janelia.keypoints.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams stored pair correspondences through the quantizer and mutual match filter to build
 * canonical keypoints for every image that requires consolidation.
 *
 * <p>
 * Pairs are processed one at a time on the calling thread, least remaining demand first
 * (see {@link PairSchedule}). Each image that requires consolidation is finalized as soon as
 * its last pair has been processed: its keypoints are resolved by vote, optionally truncated
 * to the configured budget, persisted, and its votes are released.
 * </p>
 *
 * <p>
 * Match arrays written for pairs whose images were later truncated may reference discarded
 * keypoints. They are flagged as provisional and must be rewritten by {@link MatchReassigner}.
 * </p>
 */
public class KeypointAggregator {

    private final KeypointAggregationParameters parameters;
    private final KeypointQuantizer quantizer;
    private final PairCorrespondenceLookup correspondenceLookup;
    private final KeyedStore<MatchArray> matchStore;
    private final KeyedStore<CanonicalKeypointSet> keypointStore;

    /**
     * @param  parameters            validated aggregation parameters.
     * @param  correspondenceLookup  source of raw pair correspondences.
     * @param  matchStore            destination for pair match arrays (keyed by normalized pair key).
     * @param  keypointStore         destination for finalized keypoint sets (keyed by image name).
     */
    public KeypointAggregator(final KeypointAggregationParameters parameters,
                              final PairCorrespondenceLookup correspondenceLookup,
                              final KeyedStore<MatchArray> matchStore,
                              final KeyedStore<CanonicalKeypointSet> keypointStore) {
        this.parameters = parameters;
        this.quantizer = parameters.buildQuantizer();
        this.correspondenceLookup = correspondenceLookup;
        this.matchStore = matchStore;
        this.keypointStore = keypointStore;
    }

    /**
     * Consolidates keypoints for the specified pairs.
     *
     * @param  pairs               pairs to process (duplicates are processed once).
     * @param  requiredImageNames  images to consolidate (null for every image in the pairs
     *                             that is not a fixed reference).
     * @param  references          pre-existing keypoints.
     * @param  cancellationToken   checked before each pair.
     *
     * @return summary of the run.
     *
     * @throws IOException
     *   if stored data cannot be read or written.
     *
     * @throws IllegalStateException
     *   if a completed run leaves an image unfinalized.
     */
    public AggregationResult aggregate(final Collection<ImagePair> pairs,
                                       final Set<String> requiredImageNames,
                                       final ReferenceKeypoints references,
                                       final CancellationToken cancellationToken)
            throws IOException, IllegalStateException {

        final List<ImagePair> distinctPairs = new ArrayList<>(new LinkedHashSet<>(pairs));
        if (distinctPairs.size() < pairs.size()) {
            LOG.warn("aggregate: ignoring {} duplicate pairs", pairs.size() - distinctPairs.size());
        }

        final Set<String> pairImageNames = new TreeSet<>();
        for (final ImagePair pair : distinctPairs) {
            pairImageNames.add(pair.getA());
            pairImageNames.add(pair.getB());
        }

        final Set<String> required = resolveRequiredImageNames(requiredImageNames, pairImageNames, references);

        final ImageRecordArena arena = new ImageRecordArena();
        for (final String imageName : pairImageNames) {
            if (required.contains(imageName)) {
                arena.registerConsolidating(imageName, references.getRebinned(imageName));
            } else {
                arena.registerFixed(imageName, references.getFixed(imageName));
            }
        }

        final AggregationResult result = new AggregationResult();
        final List<ImagePair> scheduledPairs = findPairsToSchedule(distinctPairs, required, result);

        final int[][] pairImageIds = new int[scheduledPairs.size()][];
        for (int pairIndex = 0; pairIndex < scheduledPairs.size(); pairIndex++) {
            final ImagePair pair = scheduledPairs.get(pairIndex);
            final ImageRecord recordA = arena.get(pair.getA());
            final ImageRecord recordB = arena.get(pair.getB());
            recordA.incrementRemainingPairCount();
            recordB.incrementRemainingPairCount();
            pairImageIds[pairIndex] = new int[] { recordA.getId(), recordB.getId() };
        }

        LOG.info("aggregate: entry, consolidating keypoints for {} of {} images in {} pairs with quantizer {}",
                 required.size(), pairImageNames.size(), scheduledPairs.size(), quantizer);

        final PairSchedule schedule = new PairSchedule(pairImageIds, arena);
        final ProcessTimer timer = new ProcessTimer();

        while (! schedule.isEmpty()) {

            if (cancellationToken.isCancelled()) {
                LOG.warn("aggregate: cancellation requested, stopping with {} pairs left", schedule.size());
                result.setCancelled(true);
                break;
            }

            final ImagePair pair = scheduledPairs.get(schedule.poll());
            final ImageRecord recordA = arena.get(pair.getA());
            final ImageRecord recordB = arena.get(pair.getB());

            processPair(pair, recordA, recordB, result);

            for (final ImageRecord record : new ImageRecord[] { recordA, recordB }) {
                final boolean lastPair = record.decrementRemainingPairCount();
                if (lastPair && record.requiresConsolidation()) {
                    finalizeImage(record, result);
                }
                schedule.onRemainingPairCountChanged(record.getId());
            }

            if (timer.incrementAndCheckInterval()) {
                LOG.info("aggregate: processed {} of {} pairs ({} pairs/second), {} images finalized",
                         timer.getItemCount(), scheduledPairs.size(),
                         String.format("%.1f", timer.getItemsPerSecond()),
                         result.getFinalizedImageNames().size());
            }
        }

        for (final ImageRecord record : arena.getRecords()) {
            if ((record.getState() == ImageState.FINALIZED) || (record.getState() == ImageState.FIXED)) {
                result.addFinalKeypointSet(record.getName(), record.getKeypointSet());
            } else if (! result.isCancelled()) {
                throw new IllegalStateException("image " + record + " was not finalized after all pairs were processed");
            }
        }

        if (result.getMissingPairCount() > 0) {
            LOG.warn("aggregate: skipped {} pairs without stored correspondences", result.getMissingPairCount());
        }

        LOG.info("aggregate: exit, found {} keypoints/image (avg.), total {}, truncated {} images, processing took {}",
                 String.format("%.1f", result.getAverageKeypointsPerImage()), result.getFinalizedKeypointCount(),
                 result.getTruncatedImageNames().size(), timer);

        return result;
    }

    private Set<String> resolveRequiredImageNames(final Set<String> requestedImageNames,
                                                  final Set<String> pairImageNames,
                                                  final ReferenceKeypoints references) {

        final Set<String> required = new TreeSet<>(requestedImageNames == null ? pairImageNames : requestedImageNames);

        if (requestedImageNames != null) {
            for (final String imageName : requestedImageNames) {
                if (! pairImageNames.contains(imageName)) {
                    LOG.warn("resolveRequiredImageNames: ignoring {} because it is not part of any pair", imageName);
                    required.remove(imageName);
                }
            }
        }

        for (final String imageName : references.getFixedNames()) {
            if (required.remove(imageName) && (requestedImageNames != null)) {
                LOG.warn("resolveRequiredImageNames: {} has fixed reference keypoints, it will only be looked up against",
                         imageName);
            }
        }

        return required;
    }

    /**
     * @return pairs that need processing; pairs between two images that are not consolidated
     *         and already have a final match array are counted as resumed instead.
     */
    private List<ImagePair> findPairsToSchedule(final List<ImagePair> distinctPairs,
                                                final Set<String> required,
                                                final AggregationResult result)
            throws IOException {

        final List<ImagePair> scheduledPairs = new ArrayList<>(distinctPairs.size());
        int resumedPairCount = 0;
        for (final ImagePair pair : distinctPairs) {
            if (required.contains(pair.getA()) || required.contains(pair.getB())) {
                scheduledPairs.add(pair);
            } else {
                final MatchArray existingMatches = matchStore.load(pair.toKey());
                if ((existingMatches != null) && (! existingMatches.isProvisional())) {
                    resumedPairCount++;
                } else {
                    scheduledPairs.add(pair);
                }
            }
        }

        if (resumedPairCount > 0) {
            LOG.info("findPairsToSchedule: keeping stored matches for {} pairs", resumedPairCount);
        }
        result.setResumedPairCount(resumedPairCount);

        return scheduledPairs;
    }

    private void processPair(final ImagePair pair,
                             final ImageRecord recordA,
                             final ImageRecord recordB,
                             final AggregationResult result)
            throws IOException {

        final PairCorrespondences correspondences = correspondenceLookup.find(pair);
        if (correspondences == null) {
            LOG.warn("processPair: no correspondences stored for {} in either direction, skipping pair", pair);
            result.addMissingPair(pair);
            return;
        }

        // a query consolidated only against fixed references keeps its raw keypoints
        // unless a budget forces truncation and reassignment
        final boolean oneSided = (! parameters.hasKeypointBudget()) &&
                                 (recordA.requiresConsolidation() != recordB.requiresConsolidation());

        final int[] indexesA = assign(recordA, correspondences.getKeypointsA(), correspondences.getScores(), oneSided);
        final int[] indexesB = assign(recordB, correspondences.getKeypointsB(), correspondences.getScores(), oneSided);

        final boolean provisional = parameters.hasKeypointBudget() &&
                                    (recordA.requiresConsolidation() || recordB.requiresConsolidation());

        final MatchArray matchArray = MutualMatchFilter.filterToMatchArray(indexesA,
                                                                           indexesB,
                                                                           correspondences.getScores(),
                                                                           provisional);
        matchStore.save(pair.toKey(), matchArray);
        result.addProcessedPair(pair);

        LOG.debug("processPair: {} has {} mutual matches from {} correspondences",
                  pair, matchArray.getMatchCount(), correspondences.size());
    }

    private int[] assign(final ImageRecord record,
                         final double[][] keypoints,
                         final double[] scores,
                         final boolean oneSided) {
        final int[] canonicalIndexes;
        if (record.requiresConsolidation()) {
            final KeypointQuantizer insertQuantizer = oneSided ? KeypointQuantizer.unquantized() : quantizer;
            canonicalIndexes = insertQuantizer.insert(keypoints, record.activate(), scores);
        } else {
            canonicalIndexes = quantizer.lookup(keypoints, record.getKeypointSet());
        }
        return canonicalIndexes;
    }

    private void finalizeImage(final ImageRecord record,
                               final AggregationResult result)
            throws IOException {

        // an image whose pairs were all missing still gets an (empty) keypoint set
        final GrowingKeypointSet growingSet = record.activate();

        final GrowingKeypointSet.FinalizedKeypoints finalized =
                growingSet.finalizeKeypoints(parameters.maxKeypointsPerImage);
        final CanonicalKeypointSet keypointSet = finalized.getKeypointSet();

        keypointStore.save(record.getName(), keypointSet);
        record.finalizeWith(keypointSet);
        result.addFinalizedImage(record.getName(), keypointSet, finalized.wasTruncated());

        LOG.debug("finalizeImage: {} has {} keypoints, discarded {}",
                  record.getName(), keypointSet.size(), finalized.getDiscardedCount());
    }

    private static final Logger LOG = LoggerFactory.getLogger(KeypointAggregator.class);
}
