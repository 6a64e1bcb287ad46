package org.janelia.keypoints.match;

import java.io.Serializable;

/**
 * Frozen, consensus resolved keypoints of one image.
 * The position of each keypoint within this set is the keypoint index referenced by match arrays.
 */
public class CanonicalKeypointSet
        implements Serializable {

    public static final CanonicalKeypointSet EMPTY = new CanonicalKeypointSet(new double[2][0], new double[0]);

    /** Keypoint locations stored as double[2][n]. */
    private final double[][] locations;

    /** Accumulated vote weight (or imported score) of each keypoint. */
    private final double[] scores;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private CanonicalKeypointSet() {
        this.locations = null;
        this.scores = null;
    }

    public CanonicalKeypointSet(final double[][] locations,
                                final double[] scores)
            throws IllegalArgumentException {

        if ((locations == null) || (locations.length != 2) ||
            (locations[0].length != scores.length) || (locations[1].length != scores.length)) {
            throw new IllegalArgumentException("keypoint locations must be double[2][" + scores.length + "]");
        }

        this.locations = locations;
        this.scores = scores;
    }

    /**
     * Convenience factory for point-major data (one {x, y} array per keypoint).
     */
    public static CanonicalKeypointSet fromPoints(final double[][] points,
                                                  final double[] scores) {
        return new CanonicalKeypointSet(PairCorrespondences.toDimensionMajor(points), scores);
    }

    public int size() {
        return scores.length;
    }

    public double[][] getLocations() {
        return locations;
    }

    public double getX(final int index) {
        return locations[0][index];
    }

    public double getY(final int index) {
        return locations[1][index];
    }

    public double getScore(final int index) {
        return scores[index];
    }

    public double[] getScores() {
        return scores;
    }

    @Override
    public String toString() {
        return "{\"keypointCount\": " + size() + "}";
    }
}
