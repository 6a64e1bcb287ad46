package org.janelia.keypoints.match;

import java.util.Arrays;

/**
 * Correspondences expressed as canonical keypoint index pairs with their scores.
 */
public class IndexedCorrespondences {

    private final int[] indexesA;
    private final int[] indexesB;
    private final double[] scores;

    public IndexedCorrespondences(final int[] indexesA,
                                  final int[] indexesB,
                                  final double[] scores) {
        if ((indexesA.length != indexesB.length) || (indexesA.length != scores.length)) {
            throw new IllegalArgumentException("index and score lists must have the same length");
        }
        this.indexesA = indexesA;
        this.indexesB = indexesB;
        this.scores = scores;
    }

    public int size() {
        return scores.length;
    }

    public int getIndexA(final int i) {
        return indexesA[i];
    }

    public int getIndexB(final int i) {
        return indexesB[i];
    }

    public double getScore(final int i) {
        return scores[i];
    }

    /**
     * Converts these correspondences into a dense array indexed by A index.
     * The array is just long enough to hold the largest A index, so an empty
     * correspondence list produces an empty array.
     *
     * @throws IllegalStateException
     *   if two correspondences share an A index.
     */
    public MatchArray toMatchArray(final boolean provisional)
            throws IllegalStateException {

        if (indexesA.length == 0) {
            return new MatchArray(new int[0], new double[0], provisional);
        }

        final int length = Arrays.stream(indexesA).max().getAsInt() + 1;
        final int[] matches = new int[length];
        final double[] matchScores = new double[length];
        Arrays.fill(matches, MatchArray.UNMATCHED);

        for (int i = 0; i < indexesA.length; i++) {
            if (matches[indexesA[i]] != MatchArray.UNMATCHED) {
                throw new IllegalStateException("A index " + indexesA[i] + " is matched more than once");
            }
            matches[indexesA[i]] = indexesB[i];
            matchScores[indexesA[i]] = scores[i];
        }

        return new MatchArray(matches, matchScores, provisional);
    }

}
