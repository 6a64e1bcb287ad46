package org.janelia.keypoints.aggregate;

/**
 * Lifecycle of an image during one aggregation run.
 */
public enum ImageState {

    /** Requires consolidation but has not been referenced by a processed pair yet. */
    PENDING,

    /** Canonical keypoints are growing and collecting votes. */
    ACTIVE,

    /** Canonical keypoints were resolved and persisted, votes were released. */
    FINALIZED,

    /** Keypoints are an immutable reference (or unknown) and are only looked up against. */
    FIXED
}
