package org.janelia.keypoints.aggregate;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.match.ImagePair;
import org.janelia.keypoints.match.MatchArray;
import org.janelia.keypoints.store.KeyedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies that persisted match arrays only reference keypoints that exist in the final sets.
 */
public class MatchArrayValidator {

    private final KeyedStore<MatchArray> matchStore;

    public MatchArrayValidator(final KeyedStore<MatchArray> matchStore) {
        this.matchStore = matchStore;
    }

    /**
     * @return number of match arrays checked (pairs without a stored array are skipped).
     *
     * @throws IllegalStateException
     *   if any stored match array references a keypoint that does not exist.
     */
    public int validate(final Collection<ImagePair> pairs,
                        final Map<String, CanonicalKeypointSet> finalKeypointSets)
            throws IOException, IllegalStateException {

        int validatedCount = 0;
        for (final ImagePair pair : pairs) {
            final MatchArray matchArray = matchStore.load(pair.toKey());
            if (matchArray != null) {
                validate(pair,
                         matchArray,
                         sizeOf(finalKeypointSets.get(pair.getA())),
                         sizeOf(finalKeypointSets.get(pair.getB())));
                validatedCount++;
            }
        }

        LOG.info("validate: checked {} match arrays", validatedCount);

        return validatedCount;
    }

    /**
     * @throws IllegalStateException
     *   if the array is longer than A's keypoint set or matches an index outside B's keypoint set.
     */
    public static void validate(final ImagePair pair,
                                final MatchArray matchArray,
                                final int keypointCountA,
                                final int keypointCountB)
            throws IllegalStateException {

        if (matchArray.length() > keypointCountA) {
            throw new IllegalStateException("match array for " + pair + " has " + matchArray.length() +
                                            " entries but " + pair.getA() + " only has " + keypointCountA +
                                            " keypoints");
        }

        for (int indexA = 0; indexA < matchArray.length(); indexA++) {
            final int indexB = matchArray.getMatch(indexA);
            if ((indexB != MatchArray.UNMATCHED) && ((indexB < 0) || (indexB >= keypointCountB))) {
                throw new IllegalStateException("match array for " + pair + " maps keypoint " + indexA +
                                                " to " + indexB + " but " + pair.getB() + " only has " +
                                                keypointCountB + " keypoints");
            }
        }
    }

    private static int sizeOf(final CanonicalKeypointSet keypointSet) {
        return keypointSet == null ? 0 : keypointSet.size();
    }

    private static final Logger LOG = LoggerFactory.getLogger(MatchArrayValidator.class);
}
