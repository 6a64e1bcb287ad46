package org.janelia.keypoints.store;

import java.io.IOException;

import org.janelia.keypoints.match.ImagePair;
import org.janelia.keypoints.match.PairCorrespondences;

/**
 * Direction independent access to stored pair correspondences.
 * Matchers may store a pair under either direction, so lookups try the normalized key first
 * and fall back to the reversed key, swapping the keypoint lists of a reversed hit.
 */
public class PairCorrespondenceLookup {

    private final KeyedStore<PairCorrespondences> store;

    public PairCorrespondenceLookup(final KeyedStore<PairCorrespondences> store) {
        this.store = store;
    }

    public PairCorrespondences find(final ImagePair pair)
            throws IOException {

        PairCorrespondences correspondences = store.load(pair.toKey());
        if (correspondences == null) {
            correspondences = store.load(pair.toReversedKey());
            if (correspondences != null) {
                correspondences = correspondences.withSwappedSides();
            }
        }
        return correspondences;
    }

    public boolean contains(final ImagePair pair)
            throws IOException {
        return store.contains(pair.toKey()) || store.contains(pair.toReversedKey());
    }

}
