package org.janelia.keypoints.parameters;

/**
 * Quantization settings known to work well for specific dense matchers.
 */
public enum QuantizationPreset {

    /** Best quality but many keypoints, only suitable for small scenes. */
    LOFTR(1.0, 1.0),

    /** Limits the number of detected keypoints for larger scenes. */
    LOFTR_AACHEN(2.0, 8.0),

    /** For anchoring dense matches on SuperPoint keypoints. */
    LOFTR_SUPERPOINT(4.0, 4.0),

    MAST3R(1.0, 1.0),

    MAST3R_DISK(4.0, 4.0);

    private final double maxError;
    private final double cellSize;

    QuantizationPreset(final double maxError,
                       final double cellSize) {
        this.maxError = maxError;
        this.cellSize = cellSize;
    }

    public double getMaxError() {
        return maxError;
    }

    public double getCellSize() {
        return cellSize;
    }
}
