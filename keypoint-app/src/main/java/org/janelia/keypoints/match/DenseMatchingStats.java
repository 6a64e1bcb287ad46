package org.janelia.keypoints.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome counts for a {@link DenseMatchingRunner} run.
 */
public class DenseMatchingStats {

    private int existingPairCount;
    private int matchedPairCount;
    private int cancelledPairCount;
    private final List<ImagePair> failedPairs;

    public DenseMatchingStats() {
        this.existingPairCount = 0;
        this.matchedPairCount = 0;
        this.cancelledPairCount = 0;
        this.failedPairs = new ArrayList<>();
    }

    void setExistingPairCount(final int existingPairCount) {
        this.existingPairCount = existingPairCount;
    }

    void incrementMatchedPairCount() {
        matchedPairCount++;
    }

    void incrementCancelledPairCount() {
        cancelledPairCount++;
    }

    void addFailedPair(final ImagePair pair) {
        failedPairs.add(pair);
    }

    /**
     * @return number of pairs skipped because correspondences were already stored.
     */
    public int getExistingPairCount() {
        return existingPairCount;
    }

    public int getMatchedPairCount() {
        return matchedPairCount;
    }

    public int getCancelledPairCount() {
        return cancelledPairCount;
    }

    public List<ImagePair> getFailedPairs() {
        return Collections.unmodifiableList(failedPairs);
    }

    @Override
    public String toString() {
        return "{\"existingPairCount\": " + existingPairCount +
               ", \"matchedPairCount\": " + matchedPairCount +
               ", \"cancelledPairCount\": " + cancelledPairCount +
               ", \"failedPairCount\": " + failedPairs.size() + "}";
    }
}
