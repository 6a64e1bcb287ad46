package org.janelia.keypoints.aggregate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.match.DenseMatchingRunner;
import org.janelia.keypoints.match.ImagePair;
import org.janelia.keypoints.match.MatchArray;
import org.janelia.keypoints.match.PairCorrespondences;
import org.janelia.keypoints.parameters.KeypointAggregationParameters;
import org.janelia.keypoints.parameters.KeypointAggregationParameters.ReassignmentPolicy;
import org.janelia.keypoints.store.KeyedStore;
import org.janelia.keypoints.store.PairCorrespondenceLookup;
import org.janelia.keypoints.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs all steps needed to turn a list of image pairs into consolidated keypoints and match arrays:
 * <ol>
 *     <li>optionally compute missing pair correspondences with a dense matcher,</li>
 *     <li>decide which images need consolidation and load stored keypoints for the others,</li>
 *     <li>aggregate,</li>
 *     <li>reassign matches if the keypoint budget discarded anything,</li>
 *     <li>validate the stored match arrays.</li>
 * </ol>
 */
public class KeypointAggregationPipeline {

    private final KeypointAggregationParameters parameters;
    private final KeyedStore<PairCorrespondences> correspondenceStore;
    private final KeyedStore<MatchArray> matchStore;
    private final KeyedStore<CanonicalKeypointSet> keypointStore;
    private final List<KeyedStore<CanonicalKeypointSet>> referenceKeypointStores;

    /**
     * @param  parameters               aggregation parameters (validated here).
     * @param  correspondenceStore      raw pair correspondences.
     * @param  matchStore               output match arrays.
     * @param  keypointStore            output keypoint sets.
     * @param  referenceKeypointStores  stores with keypoints of reference images (may be empty).
     *
     * @throws IllegalArgumentException
     *   if the parameters are invalid.
     */
    public KeypointAggregationPipeline(final KeypointAggregationParameters parameters,
                                       final KeyedStore<PairCorrespondences> correspondenceStore,
                                       final KeyedStore<MatchArray> matchStore,
                                       final KeyedStore<CanonicalKeypointSet> keypointStore,
                                       final List<KeyedStore<CanonicalKeypointSet>> referenceKeypointStores)
            throws IllegalArgumentException {

        parameters.validateAndSetDefaults();

        this.parameters = parameters;
        this.correspondenceStore = correspondenceStore;
        this.matchStore = matchStore;
        this.keypointStore = keypointStore;
        this.referenceKeypointStores = new ArrayList<>(referenceKeypointStores);
    }

    /**
     * @param  pairs              pairs to consolidate.
     * @param  matchingRunner     runner for missing correspondences (null if they are all stored already).
     * @param  cancellationToken  cooperative cancellation.
     *
     * @return aggregation summary (with reassignment summary when the pass ran).
     */
    public AggregationResult run(final Collection<ImagePair> pairs,
                                 final DenseMatchingRunner matchingRunner,
                                 final CancellationToken cancellationToken)
            throws IOException, IllegalStateException {

        if (matchingRunner != null) {
            matchingRunner.run(pairs, parameters.overwrite, cancellationToken);
        }

        final Set<String> pairImageNames = new TreeSet<>();
        for (final ImagePair pair : pairs) {
            pairImageNames.add(pair.getA());
            pairImageNames.add(pair.getB());
        }

        final Set<String> requiredImageNames = findRequiredImageNames(pairImageNames);

        final List<KeyedStore<CanonicalKeypointSet>> stores = new ArrayList<>(referenceKeypointStores);
        stores.add(keypointStore);

        final ReferenceKeypoints references =
                new ReferenceKeypointLoader(parameters).load(stores, pairImageNames, requiredImageNames);

        final PairCorrespondenceLookup correspondenceLookup = new PairCorrespondenceLookup(correspondenceStore);

        final KeypointAggregator aggregator =
                new KeypointAggregator(parameters, correspondenceLookup, matchStore, keypointStore);
        final AggregationResult result =
                aggregator.aggregate(pairs, requiredImageNames, references, cancellationToken);

        if (result.isCancelled()) {
            LOG.warn("run: aggregation was cancelled, skipping reassignment and validation");
            return result;
        }

        final boolean reassign = requiresReassignment(result);
        if (reassign) {
            final MatchReassigner reassigner = new MatchReassigner(parameters.maxError,
                                                                   correspondenceLookup,
                                                                   matchStore,
                                                                   parameters.reassignmentThreads);
            result.setReassignmentResult(reassigner.reassign(result.getProcessedPairs(),
                                                             result.getFinalKeypointSets()));
        }

        new MatchArrayValidator(matchStore).validate(result.getProcessedPairs(), result.getFinalKeypointSets());

        if (! reassign) {
            confirmProvisionalMatches(result.getProcessedPairs());
        }

        return result;
    }

    /**
     * @return images in the pairs that have no reference keypoints and,
     *         unless overwrite is requested, no previously consolidated keypoints.
     */
    Set<String> findRequiredImageNames(final Set<String> pairImageNames)
            throws IOException {

        final Set<String> requiredImageNames = new TreeSet<>();
        int referenceCount = 0;
        int existingCount = 0;
        for (final String imageName : pairImageNames) {
            if (isReference(imageName)) {
                referenceCount++;
            } else if ((! parameters.overwrite) && keypointStore.contains(imageName)) {
                existingCount++;
            } else {
                requiredImageNames.add(imageName);
            }
        }

        LOG.info("findRequiredImageNames: {} of {} images need consolidation, {} are references, {} already done",
                 requiredImageNames.size(), pairImageNames.size(), referenceCount, existingCount);

        return requiredImageNames;
    }

    boolean requiresReassignment(final AggregationResult result) {
        final boolean reassign;
        if (parameters.reassignmentPolicy == ReassignmentPolicy.WHEN_BUDGET_CONFIGURED) {
            reassign = parameters.hasKeypointBudget() && (! result.getFinalizedImageNames().isEmpty());
        } else {
            reassign = result.isTruncationOccurred();
        }
        return reassign;
    }

    /**
     * Clears the provisional flag of match arrays written during a run that ended without reassignment.
     * Nothing was truncated in that case, so the arrays already reference final keypoints.
     *
     * @return number of rewritten match arrays.
     */
    int confirmProvisionalMatches(final List<ImagePair> processedPairs)
            throws IOException {

        int confirmedCount = 0;
        for (final ImagePair pair : processedPairs) {
            final String key = pair.toKey();
            final MatchArray matchArray = matchStore.load(key);
            if ((matchArray != null) && matchArray.isProvisional()) {
                matchStore.save(key, new MatchArray(matchArray.getMatches(), matchArray.getScores(), false));
                confirmedCount++;
            }
        }

        if (confirmedCount > 0) {
            LOG.info("confirmProvisionalMatches: marked {} match arrays as final", confirmedCount);
        }

        return confirmedCount;
    }

    private boolean isReference(final String imageName)
            throws IOException {
        for (final KeyedStore<CanonicalKeypointSet> store : referenceKeypointStores) {
            if (store.contains(imageName)) {
                return true;
            }
        }
        return false;
    }

    private static final Logger LOG = LoggerFactory.getLogger(KeypointAggregationPipeline.class);
}
