package org.janelia.keypoints.match;

import java.util.HashMap;
import java.util.Map;

/**
 * Reduces quantized correspondences to a one-to-one mapping by keeping only correspondences
 * that are the best scoring match for both of their endpoints.
 *
 * Several raw detections commonly quantize to the same canonical keypoint on one side,
 * so without this reduction a single canonical keypoint could be matched to many others.
 */
public class MutualMatchFilter {

    /**
     * @param  indexesA  canonical A index for each raw correspondence (or {@link MatchArray#UNMATCHED}).
     * @param  indexesB  canonical B index for each raw correspondence (or {@link MatchArray#UNMATCHED}).
     * @param  scores    score for each raw correspondence.
     *
     * @return correspondences that are the best for both endpoints, in original order.
     *         Score ties within a group go to the earliest correspondence.
     *
     * @throws IllegalArgumentException
     *   if the lists differ in length.
     */
    public static IndexedCorrespondences filter(final int[] indexesA,
                                                final int[] indexesB,
                                                final double[] scores)
            throws IllegalArgumentException {

        if ((indexesA.length != indexesB.length) || (indexesA.length != scores.length)) {
            throw new IllegalArgumentException("cannot filter " + indexesA.length + " A indexes, " +
                                               indexesB.length + " B indexes, and " + scores.length + " scores");
        }

        final Map<Integer, Integer> bestPositionForA = new HashMap<>();
        final Map<Integer, Integer> bestPositionForB = new HashMap<>();

        for (int i = 0; i < scores.length; i++) {
            if ((indexesA[i] != MatchArray.UNMATCHED) && (indexesB[i] != MatchArray.UNMATCHED)) {
                keepBest(bestPositionForA, indexesA[i], i, scores);
                keepBest(bestPositionForB, indexesB[i], i, scores);
            }
        }

        int keptCount = 0;
        final boolean[] keep = new boolean[scores.length];
        for (final Integer position : bestPositionForA.values()) {
            if (position.equals(bestPositionForB.get(indexesB[position]))) {
                keep[position] = true;
                keptCount++;
            }
        }

        final int[] keptA = new int[keptCount];
        final int[] keptB = new int[keptCount];
        final double[] keptScores = new double[keptCount];
        int k = 0;
        for (int i = 0; i < keep.length; i++) {
            if (keep[i]) {
                keptA[k] = indexesA[i];
                keptB[k] = indexesB[i];
                keptScores[k] = scores[i];
                k++;
            }
        }

        return new IndexedCorrespondences(keptA, keptB, keptScores);
    }

    /**
     * Convenience wrapper that filters and converts to a dense match array in one step.
     */
    public static MatchArray filterToMatchArray(final int[] indexesA,
                                                final int[] indexesB,
                                                final double[] scores,
                                                final boolean provisional) {
        return filter(indexesA, indexesB, scores).toMatchArray(provisional);
    }

    private static void keepBest(final Map<Integer, Integer> bestPositionForIndex,
                                 final int canonicalIndex,
                                 final int position,
                                 final double[] scores) {
        final Integer bestPosition = bestPositionForIndex.get(canonicalIndex);
        if ((bestPosition == null) || (scores[position] > scores[bestPosition])) {
            bestPositionForIndex.put(canonicalIndex, position);
        }
    }

}
