package org.janelia.keypoints.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.keypoints.match.ImagePair;

/**
 * Summary of a {@link MatchReassigner} pass.
 */
public class ReassignmentResult {

    private int reassignedPairCount;
    private long matchCount;
    private final List<ImagePair> emptyPairs;
    private final List<ImagePair> missingPairs;

    public ReassignmentResult() {
        this.reassignedPairCount = 0;
        this.matchCount = 0;
        this.emptyPairs = new ArrayList<>();
        this.missingPairs = new ArrayList<>();
    }

    void addReassignedPair(final ImagePair pair,
                           final int pairMatchCount) {
        reassignedPairCount++;
        matchCount += pairMatchCount;
        if (pairMatchCount == 0) {
            emptyPairs.add(pair);
        }
    }

    void addMissingPair(final ImagePair pair) {
        missingPairs.add(pair);
    }

    public int getReassignedPairCount() {
        return reassignedPairCount;
    }

    public long getMatchCount() {
        return matchCount;
    }

    /**
     * @return reassigned pairs left without a single match.
     */
    public List<ImagePair> getEmptyPairs() {
        return Collections.unmodifiableList(emptyPairs);
    }

    public List<ImagePair> getMissingPairs() {
        return Collections.unmodifiableList(missingPairs);
    }

    @Override
    public String toString() {
        return "{\"reassignedPairCount\": " + reassignedPairCount +
               ", \"matchCount\": " + matchCount +
               ", \"emptyPairCount\": " + emptyPairs.size() +
               ", \"missingPairCount\": " + missingPairs.size() + "}";
    }
}
