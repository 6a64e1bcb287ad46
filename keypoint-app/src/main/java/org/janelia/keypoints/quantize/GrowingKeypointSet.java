package org.janelia.keypoints.quantize;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.janelia.keypoints.match.CanonicalKeypointSet;

/**
 * Append-only canonical keypoints of an image that is still being consolidated.
 *
 * Each entry is identified by its coarse identity cell and carries a vote accumulator
 * indexed parallel to the entries. Entries are never removed or reordered,
 * so indexes handed out remain valid until the set is finalized.
 */
public class GrowingKeypointSet {

    private final List<GridCell> identityCells;
    private final Map<GridCell, Integer> identityCellToIndex;
    private final List<VoteAccumulator> votes;

    public GrowingKeypointSet() {
        this.identityCells = new ArrayList<>();
        this.identityCellToIndex = new HashMap<>();
        this.votes = new ArrayList<>();
    }

    public int size() {
        return identityCells.size();
    }

    public GridCell getIdentityCell(final int index) {
        return identityCells.get(index);
    }

    public VoteAccumulator getVotes(final int index) {
        return votes.get(index);
    }

    /**
     * @return index of the entry for the specified identity cell, appending a new entry if the cell is new.
     */
    public int indexOf(final GridCell identityCell) {
        Integer index = identityCellToIndex.get(identityCell);
        if (index == null) {
            index = identityCells.size();
            identityCells.add(identityCell);
            identityCellToIndex.put(identityCell, index);
            votes.add(new VoteAccumulator());
        }
        return index;
    }

    public void vote(final int index,
                     final GridCell votingCell,
                     final double weight) {
        votes.get(index).vote(votingCell, weight);
    }

    /**
     * Resolves every entry to its consensus position and optionally keeps only the best scoring entries.
     *
     * @param  maxKeypoints  keypoint budget (or null to keep all entries).
     *
     * @return the finalized keypoints; when truncated they are ordered by descending score,
     *         otherwise they keep their growing order so that existing indexes remain valid.
     *
     * @throws IllegalStateException
     *   if an entry never received a vote.
     */
    public FinalizedKeypoints finalizeKeypoints(final Integer maxKeypoints)
            throws IllegalStateException {

        final int entryCount = identityCells.size();
        final double[] x = new double[entryCount];
        final double[] y = new double[entryCount];
        final double[] scores = new double[entryCount];

        for (int i = 0; i < entryCount; i++) {
            final Map.Entry<GridCell, Double> consensus = votes.get(i).getConsensus();
            if (consensus == null) {
                throw new IllegalStateException("canonical keypoint " + i + " at " + identityCells.get(i) +
                                                " has no votes");
            }
            x[i] = consensus.getKey().getX();
            y[i] = consensus.getKey().getY();
            scores[i] = consensus.getValue();
        }

        if ((maxKeypoints == null) || (entryCount <= maxKeypoints)) {
            return new FinalizedKeypoints(new CanonicalKeypointSet(new double[][] { x, y }, scores), 0);
        }

        // Arrays.sort on objects is stable, so equal scores keep their growing order
        final Integer[] order = new Integer[entryCount];
        for (int i = 0; i < entryCount; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

        final double[] keptX = new double[maxKeypoints];
        final double[] keptY = new double[maxKeypoints];
        final double[] keptScores = new double[maxKeypoints];
        for (int k = 0; k < maxKeypoints; k++) {
            keptX[k] = x[order[k]];
            keptY[k] = y[order[k]];
            keptScores[k] = scores[order[k]];
        }

        return new FinalizedKeypoints(new CanonicalKeypointSet(new double[][] { keptX, keptY }, keptScores),
                                      entryCount - maxKeypoints);
    }

    /**
     * Result of finalizing a growing set.
     */
    public static class FinalizedKeypoints {

        private final CanonicalKeypointSet keypointSet;
        private final int discardedCount;

        public FinalizedKeypoints(final CanonicalKeypointSet keypointSet,
                                  final int discardedCount) {
            this.keypointSet = keypointSet;
            this.discardedCount = discardedCount;
        }

        public CanonicalKeypointSet getKeypointSet() {
            return keypointSet;
        }

        public int getDiscardedCount() {
            return discardedCount;
        }

        public boolean wasTruncated() {
            return discardedCount > 0;
        }
    }

}
