package org.janelia.keypoints.match;

import java.io.Serializable;

/**
 * Raw dense correspondences between two images as produced by a matcher.
 * Both keypoint lists are stored per dimension as double[2][n] (x row, y row)
 * and share their index with the score list.
 */
public class PairCorrespondences
        implements Serializable {

    /** Keypoint locations in image A. */
    private final double[][] keypointsA;

    /** Keypoint locations in image B. */
    private final double[][] keypointsB;

    /** Matcher confidence for each correspondence. */
    private final double[] scores;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private PairCorrespondences() {
        this.keypointsA = null;
        this.keypointsB = null;
        this.scores = null;
    }

    /**
     * @throws IllegalArgumentException
     *   if the keypoint and score lists differ in size or the keypoints are not two dimensional.
     */
    public PairCorrespondences(final double[][] keypointsA,
                               final double[][] keypointsB,
                               final double[] scores)
            throws IllegalArgumentException {

        checkDimensions("keypointsA", keypointsA, scores.length);
        checkDimensions("keypointsB", keypointsB, scores.length);

        this.keypointsA = keypointsA;
        this.keypointsB = keypointsB;
        this.scores = scores;
    }

    /**
     * Convenience factory for point-major data (one {x, y} array per keypoint).
     */
    public static PairCorrespondences fromPoints(final double[][] pointsA,
                                                 final double[][] pointsB,
                                                 final double[] scores) {
        return new PairCorrespondences(toDimensionMajor(pointsA), toDimensionMajor(pointsB), scores);
    }

    public double[][] getKeypointsA() {
        return keypointsA;
    }

    public double[][] getKeypointsB() {
        return keypointsB;
    }

    public double[] getScores() {
        return scores;
    }

    public int size() {
        return scores == null ? 0 : scores.length;
    }

    /**
     * @return view of these correspondences with the A and B sides exchanged.
     */
    public PairCorrespondences withSwappedSides() {
        return new PairCorrespondences(keypointsB, keypointsA, scores);
    }

    static double[][] toDimensionMajor(final double[][] points) {
        final double[][] locations = new double[2][points.length];
        for (int i = 0; i < points.length; i++) {
            locations[0][i] = points[i][0];
            locations[1][i] = points[i][1];
        }
        return locations;
    }

    private static void checkDimensions(final String context,
                                        final double[][] locations,
                                        final int expectedSize)
            throws IllegalArgumentException {

        if ((locations == null) || (locations.length != 2)) {
            throw new IllegalArgumentException(context + " must contain exactly two dimensions");
        }
        for (final double[] dimension : locations) {
            if (dimension.length != expectedSize) {
                throw new IllegalArgumentException(context + " has " + dimension.length +
                                                   " values but there are " + expectedSize + " scores");
            }
        }
    }

}
