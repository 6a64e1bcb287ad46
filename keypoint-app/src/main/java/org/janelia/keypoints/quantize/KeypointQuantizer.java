package org.janelia.keypoints.quantize;

import java.util.Arrays;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.match.MatchArray;

import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.RealPointSampleList;
import net.imglib2.neighborsearch.NearestNeighborSearchOnKDTree;
import net.imglib2.type.numeric.integer.IntType;

/**
 * Maps raw keypoint locations to canonical keypoint indexes.
 *
 * <p>
 * Lookup mode is a plain nearest neighbor search against a frozen keypoint set.
 * Insert mode snaps each keypoint to two grids: a coarse identity grid with spacing
 * cellSize decides which canonical entry the keypoint belongs to (appending a new one on a miss),
 * and a fine voting grid with spacing (int) maxError receives the keypoint's score
 * so that the entry's final position can be resolved by majority vote.
 * </p>
 */
public class KeypointQuantizer {

    private final double maxError;
    private final QuantizationGrid identityGrid;
    private final QuantizationGrid votingGrid;

    /**
     * Constructs a quantizer whose identity cells are as large as the maximum error.
     */
    public KeypointQuantizer(final double maxError)
            throws IllegalArgumentException {
        this(maxError, null);
    }

    /**
     * @param  maxError  maximum pixel distance between a keypoint and its canonical keypoint.
     * @param  cellSize  identity cell size in pixels (null for maxError).
     *                   Sizes smaller than maxError are raised to maxError.
     *
     * @throws IllegalArgumentException
     *   if maxError or cellSize is not positive.
     */
    public KeypointQuantizer(final double maxError,
                             final Double cellSize)
            throws IllegalArgumentException {

        if (! (maxError > 0.0)) {
            throw new IllegalArgumentException("maxError must be positive but was " + maxError);
        }
        if ((cellSize != null) && (! (cellSize > 0.0))) {
            throw new IllegalArgumentException("cellSize must be positive but was " + cellSize);
        }

        this.maxError = maxError;
        this.identityGrid = new QuantizationGrid(cellSize == null ? maxError : Math.max(cellSize, maxError));
        this.votingGrid = new QuantizationGrid((int) maxError);
    }

    private KeypointQuantizer(final double maxError,
                              final QuantizationGrid identityGrid,
                              final QuantizationGrid votingGrid) {
        this.maxError = maxError;
        this.identityGrid = identityGrid;
        this.votingGrid = votingGrid;
    }

    /**
     * @return quantizer that inserts every distinct raw location as its own canonical keypoint
     *         and only finds exact matches in lookup mode.
     *         Used for localization queries whose keypoints must not be binned.
     */
    public static KeypointQuantizer unquantized() {
        return new KeypointQuantizer(0.0, QuantizationGrid.UNQUANTIZED, QuantizationGrid.UNQUANTIZED);
    }

    public double getMaxError() {
        return maxError;
    }

    public QuantizationGrid getIdentityGrid() {
        return identityGrid;
    }

    public QuantizationGrid getVotingGrid() {
        return votingGrid;
    }

    /**
     * Finds the nearest canonical keypoint for each raw keypoint without modifying the canonical set.
     *
     * @param  keypoints     raw keypoint locations as double[2][n].
     * @param  canonicalSet  frozen canonical keypoints.
     *
     * @return nearest canonical index for each keypoint, or {@link MatchArray#UNMATCHED}
     *         if the nearest one is further away than maxError or the canonical set is empty.
     */
    public int[] lookup(final double[][] keypoints,
                        final CanonicalKeypointSet canonicalSet) {

        final int keypointCount = keypointCount(keypoints);
        final int[] canonicalIndexes = new int[keypointCount];
        Arrays.fill(canonicalIndexes, MatchArray.UNMATCHED);

        if ((keypointCount == 0) || (canonicalSet.size() == 0)) {
            return canonicalIndexes;
        }

        final RealPointSampleList<IntType> canonicalSampleList = new RealPointSampleList<>(2);
        for (int i = 0; i < canonicalSet.size(); i++) {
            canonicalSampleList.add(new RealPoint(canonicalSet.getX(i), canonicalSet.getY(i)), new IntType(i));
        }
        final KDTree<IntType> kdTree = new KDTree<>(canonicalSampleList);
        final NearestNeighborSearchOnKDTree<IntType> search = new NearestNeighborSearchOnKDTree<>(kdTree);

        final RealPoint query = new RealPoint(2);
        for (int i = 0; i < keypointCount; i++) {
            query.setPosition(keypoints[0][i], 0);
            query.setPosition(keypoints[1][i], 1);
            search.search(query);
            if (search.getDistance() <= maxError) {
                canonicalIndexes[i] = search.getSampler().get().get();
            }
        }

        return canonicalIndexes;
    }

    /**
     * Resolves each raw keypoint to a canonical entry of the growing set, appending entries for
     * unseen identity cells, and votes the keypoint's score into its fine grid cell.
     *
     * @param  keypoints    raw keypoint locations as double[2][n].
     * @param  growingSet   canonical keypoints being consolidated (modified).
     * @param  scores       vote weight for each keypoint (or null to give every keypoint a weight of 1).
     *
     * @return canonical index for each keypoint.
     *
     * @throws IllegalArgumentException
     *   if the number of scores differs from the number of keypoints.
     */
    public int[] insert(final double[][] keypoints,
                        final GrowingKeypointSet growingSet,
                        final double[] scores)
            throws IllegalArgumentException {

        final int keypointCount = keypointCount(keypoints);
        if ((scores != null) && (scores.length != keypointCount)) {
            throw new IllegalArgumentException("have " + scores.length + " scores for " +
                                               keypointCount + " keypoints");
        }

        final int[] canonicalIndexes = new int[keypointCount];
        for (int i = 0; i < keypointCount; i++) {
            final double x = keypoints[0][i];
            final double y = keypoints[1][i];
            final int index = growingSet.indexOf(identityGrid.snap(x, y));
            growingSet.vote(index, votingGrid.snap(x, y), scores == null ? 1.0 : scores[i]);
            canonicalIndexes[i] = index;
        }

        return canonicalIndexes;
    }

    private static int keypointCount(final double[][] keypoints) {
        return ((keypoints == null) || (keypoints.length == 0)) ? 0 : keypoints[0].length;
    }

    @Override
    public String toString() {
        return "{\"maxError\": " + maxError +
               ", \"cellSize\": " + identityGrid.getSpacing() +
               ", \"votingCellSize\": " + votingGrid.getSpacing() + "}";
    }
}
