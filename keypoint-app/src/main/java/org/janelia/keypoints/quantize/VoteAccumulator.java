package org.janelia.keypoints.quantize;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weighted votes for the fine grid position of one canonical keypoint.
 * Iteration follows first vote order, which makes consensus ties deterministic.
 */
public class VoteAccumulator {

    private final Map<GridCell, Double> cellToWeight;

    public VoteAccumulator() {
        this.cellToWeight = new LinkedHashMap<>();
    }

    public void vote(final GridCell cell,
                     final double weight) {
        cellToWeight.merge(cell, weight, Double::sum);
    }

    public int getCellCount() {
        return cellToWeight.size();
    }

    public boolean isEmpty() {
        return cellToWeight.isEmpty();
    }

    public double getWeight(final GridCell cell) {
        final Double weight = cellToWeight.get(cell);
        return weight == null ? 0.0 : weight;
    }

    /**
     * @return the heaviest cell (the first one voted for if several share the largest weight)
     *         or null if no votes have been cast.
     */
    public Map.Entry<GridCell, Double> getConsensus() {
        Map.Entry<GridCell, Double> consensus = null;
        for (final Map.Entry<GridCell, Double> entry : cellToWeight.entrySet()) {
            if ((consensus == null) || (entry.getValue() > consensus.getValue())) {
                consensus = entry;
            }
        }
        return consensus;
    }

}
