package org.janelia.keypoints.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.keypoints.quantize.KeypointQuantizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parameters for consolidating pairwise correspondences into canonical keypoints.
 */
public class KeypointAggregationParameters
        implements Serializable {

    public enum ReassignmentPolicy {
        /** Reassign matches only when truncation discarded keypoints. */
        IF_TRUNCATED,
        /** Reassign matches whenever a keypoint budget is configured, even if nothing was discarded. */
        WHEN_BUDGET_CONFIGURED
    }

    @Parameter(
            names = "--preset",
            description = "Named maxError/cellSize combination (explicit --maxError and --cellSize values take precedence)")
    public QuantizationPreset preset;

    @Parameter(
            names = "--maxError",
            description = "Maximum pixel distance between a raw keypoint and its canonical keypoint")
    public Double maxError;

    @Parameter(
            names = "--cellSize",
            description = "Pixel size of the quantization cell that identifies a canonical keypoint " +
                          "(default is maxError, smaller values are raised to maxError)")
    public Double cellSize;

    @Parameter(
            names = "--maxKeypointsPerImage",
            description = "Keep only this many best scoring keypoints per image (omit to keep all)")
    public Integer maxKeypointsPerImage;

    @Parameter(
            names = "--referenceVoteWeight",
            description = "Factor applied to the stored score of each pre-existing keypoint when it votes for an image that is being re-consolidated")
    public double referenceVoteWeight = 1.0;

    @Parameter(
            names = "--reassignment",
            description = "Identifies when matches are reassigned against the final keypoints")
    public ReassignmentPolicy reassignmentPolicy = ReassignmentPolicy.IF_TRUNCATED;

    @Parameter(
            names = "--reassignmentThreads",
            description = "Number of threads for the match reassignment pass")
    public int reassignmentThreads = 1;

    @Parameter(
            names = "--overwrite",
            description = "Re-consolidate images that already have stored keypoints",
            arity = 0)
    public boolean overwrite = false;

    public KeypointAggregationParameters() {
    }

    public KeypointAggregationParameters(final double maxError,
                                         final Double cellSize,
                                         final Integer maxKeypointsPerImage) {
        this.maxError = maxError;
        this.cellSize = cellSize;
        this.maxKeypointsPerImage = maxKeypointsPerImage;
    }

    /**
     * Applies preset values and verifies that the configuration can be used.
     *
     * @throws IllegalArgumentException
     *   if any value is missing or out of range.
     */
    public void validateAndSetDefaults()
            throws IllegalArgumentException {

        if (preset != null) {
            if (maxError == null) {
                maxError = preset.getMaxError();
            }
            if (cellSize == null) {
                cellSize = preset.getCellSize();
            }
        }

        if (maxError == null) {
            throw new IllegalArgumentException("--maxError or --preset must be specified");
        } else if (! (maxError > 0.0)) {
            throw new IllegalArgumentException("--maxError must be positive but was " + maxError);
        }

        if (cellSize == null) {
            cellSize = maxError;
        } else if (! (cellSize > 0.0)) {
            throw new IllegalArgumentException("--cellSize must be positive but was " + cellSize);
        } else if (cellSize < maxError) {
            LOG.warn("validateAndSetDefaults: raising cellSize {} to maxError {}", cellSize, maxError);
            cellSize = maxError;
        }

        if ((maxKeypointsPerImage != null) && (maxKeypointsPerImage < 1)) {
            throw new IllegalArgumentException("--maxKeypointsPerImage must be positive but was " +
                                               maxKeypointsPerImage);
        }

        if (! (referenceVoteWeight > 0.0)) {
            throw new IllegalArgumentException("--referenceVoteWeight must be positive but was " +
                                               referenceVoteWeight);
        }

        if (reassignmentThreads < 1) {
            throw new IllegalArgumentException("--reassignmentThreads must be positive but was " +
                                               reassignmentThreads);
        }
    }

    public boolean hasKeypointBudget() {
        return maxKeypointsPerImage != null;
    }

    /**
     * @return quantizer built from the validated maxError and cellSize.
     */
    public KeypointQuantizer buildQuantizer() {
        return new KeypointQuantizer(maxError, cellSize);
    }

    private static final Logger LOG = LoggerFactory.getLogger(KeypointAggregationParameters.class);
}
