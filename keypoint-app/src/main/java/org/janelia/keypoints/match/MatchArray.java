package org.janelia.keypoints.match;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Consolidated matches for one image pair, indexed by canonical keypoint index in image A.
 * Each entry holds the matched canonical keypoint index in image B or {@link #UNMATCHED}.
 * Indexes beyond the end of the array are unmatched.
 */
public class MatchArray
        implements Serializable {

    public static final int UNMATCHED = -1;

    public static final MatchArray EMPTY = new MatchArray(new int[0], new double[0], false);

    /** Matched B index (or {@link #UNMATCHED}) for each A index. */
    private final int[] matches;

    /** Match score for each A index (zero when unmatched). */
    private final double[] scores;

    /**
     * True when the array was derived while one of its images could still lose keypoints
     * through truncation, meaning it must be reassigned before it can be trusted.
     */
    private final boolean provisional;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private MatchArray() {
        this.matches = null;
        this.scores = null;
        this.provisional = false;
    }

    public MatchArray(final int[] matches,
                      final double[] scores,
                      final boolean provisional)
            throws IllegalArgumentException {

        if (matches.length != scores.length) {
            throw new IllegalArgumentException("match array has " + matches.length + " entries but " +
                                               scores.length + " scores");
        }

        this.matches = matches;
        this.scores = scores;
        this.provisional = provisional;
    }

    public int length() {
        return matches.length;
    }

    public int getMatch(final int indexA) {
        return indexA < matches.length ? matches[indexA] : UNMATCHED;
    }

    public double getScore(final int indexA) {
        return indexA < scores.length ? scores[indexA] : 0.0;
    }

    public int[] getMatches() {
        return matches;
    }

    public double[] getScores() {
        return scores;
    }

    public boolean isProvisional() {
        return provisional;
    }

    public int getMatchCount() {
        return (int) Arrays.stream(matches).filter(m -> m != UNMATCHED).count();
    }

    @Override
    public String toString() {
        return "{\"length\": " + length() + ", \"matchCount\": " + getMatchCount() +
               ", \"provisional\": " + provisional + "}";
    }
}
