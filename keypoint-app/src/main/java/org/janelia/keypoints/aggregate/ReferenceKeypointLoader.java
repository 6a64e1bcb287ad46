package org.janelia.keypoints.aggregate;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.parameters.KeypointAggregationParameters;
import org.janelia.keypoints.quantize.GrowingKeypointSet;
import org.janelia.keypoints.quantize.KeypointQuantizer;
import org.janelia.keypoints.store.KeyedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads pre-existing keypoints for the images of an aggregation run.
 */
public class ReferenceKeypointLoader {

    private final KeypointQuantizer quantizer;
    private final double referenceVoteWeight;

    public ReferenceKeypointLoader(final KeypointAggregationParameters parameters) {
        this(parameters.buildQuantizer(), parameters.referenceVoteWeight);
    }

    public ReferenceKeypointLoader(final KeypointQuantizer quantizer,
                                   final double referenceVoteWeight) {
        this.quantizer = quantizer;
        this.referenceVoteWeight = referenceVoteWeight;
    }

    /**
     * Loads stored keypoints for the specified images.
     * When several stores hold keypoints for an image, the store listed last wins.
     * Images in rebinImageNames have their keypoints quantized into a fresh growing set
     * (each keypoint voting with its stored score scaled by the reference weight)
     * so that they anchor a new consolidation;
     * all other loaded images become fixed references.
     *
     * @param  stores           keypoint stores to search.
     * @param  imageNames       images to load.
     * @param  rebinImageNames  images that will be consolidated again.
     */
    public ReferenceKeypoints load(final List<KeyedStore<CanonicalKeypointSet>> stores,
                                   final Collection<String> imageNames,
                                   final Set<String> rebinImageNames)
            throws IOException {

        final ReferenceKeypoints references = new ReferenceKeypoints();

        for (final String imageName : imageNames) {
            CanonicalKeypointSet storedSet = null;
            for (int i = stores.size() - 1; (storedSet == null) && (i >= 0); i--) {
                storedSet = stores.get(i).load(imageName);
            }
            if (storedSet == null) {
                continue;
            }

            if (rebinImageNames.contains(imageName)) {
                references.addRebinned(imageName, rebin(storedSet));
            } else {
                references.addFixed(imageName, storedSet);
            }
        }

        final int loadedCount = references.getFixedNames().size() + references.getRebinnedNames().size();
        if (loadedCount > 0) {
            LOG.info("load: loaded keypoints for {} images, {} fixed and {} re-binned",
                     loadedCount, references.getFixedNames().size(), references.getRebinnedNames().size());
        }

        return references;
    }

    GrowingKeypointSet rebin(final CanonicalKeypointSet storedSet) {
        final GrowingKeypointSet growingSet = new GrowingKeypointSet();
        final double[] weights = new double[storedSet.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = storedSet.getScore(i) * referenceVoteWeight;
        }
        quantizer.insert(storedSet.getLocations(), growingSet, weights);
        return growingSet;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceKeypointLoader.class);
}
