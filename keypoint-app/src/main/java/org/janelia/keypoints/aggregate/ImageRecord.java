package org.janelia.keypoints.aggregate;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.quantize.GrowingKeypointSet;

/**
 * Per image state owned by the aggregation loop.
 */
public class ImageRecord {

    private final int id;
    private final String name;
    private final boolean requiresConsolidation;

    private ImageState state;
    private int remainingPairCount;
    private GrowingKeypointSet growingSet;
    private CanonicalKeypointSet keypointSet;

    /**
     * Creates a record for an image that is only looked up against.
     *
     * @param  keypointSet  reference keypoints (or null if the image has none).
     */
    static ImageRecord fixed(final int id,
                             final String name,
                             final CanonicalKeypointSet keypointSet) {
        final ImageRecord record = new ImageRecord(id, name, false, ImageState.FIXED);
        record.keypointSet = keypointSet == null ? CanonicalKeypointSet.EMPTY : keypointSet;
        return record;
    }

    /**
     * Creates a record for an image that requires consolidation.
     *
     * @param  seededSet  growing set already populated with re-binned reference keypoints
     *                    (or null to start from nothing).
     */
    static ImageRecord consolidating(final int id,
                                     final String name,
                                     final GrowingKeypointSet seededSet) {
        final ImageRecord record = new ImageRecord(id, name, true,
                                                   seededSet == null ? ImageState.PENDING : ImageState.ACTIVE);
        record.growingSet = seededSet;
        return record;
    }

    private ImageRecord(final int id,
                        final String name,
                        final boolean requiresConsolidation,
                        final ImageState state) {
        this.id = id;
        this.name = name;
        this.requiresConsolidation = requiresConsolidation;
        this.state = state;
        this.remainingPairCount = 0;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean requiresConsolidation() {
        return requiresConsolidation;
    }

    public ImageState getState() {
        return state;
    }

    public int getRemainingPairCount() {
        return remainingPairCount;
    }

    void incrementRemainingPairCount() {
        remainingPairCount++;
    }

    /**
     * @return true if this decrement consumed the image's last pair.
     *
     * @throws IllegalStateException
     *   if no pairs remain.
     */
    boolean decrementRemainingPairCount()
            throws IllegalStateException {
        if (remainingPairCount == 0) {
            throw new IllegalStateException("remaining pair count for " + name + " is already zero");
        }
        remainingPairCount--;
        return remainingPairCount == 0;
    }

    /**
     * @return the growing set for insertion, activating a pending image.
     *
     * @throws IllegalStateException
     *   if the image does not accept insertions.
     */
    GrowingKeypointSet activate()
            throws IllegalStateException {
        if (state == ImageState.PENDING) {
            growingSet = new GrowingKeypointSet();
            state = ImageState.ACTIVE;
        } else if (state != ImageState.ACTIVE) {
            throw new IllegalStateException("cannot insert keypoints into " + state + " image " + name);
        }
        return growingSet;
    }

    /**
     * Replaces the growing set with its finalized version and releases the votes.
     */
    void finalizeWith(final CanonicalKeypointSet finalizedSet)
            throws IllegalStateException {
        if (state == ImageState.FINALIZED || state == ImageState.FIXED) {
            throw new IllegalStateException("image " + name + " is already " + state);
        }
        keypointSet = finalizedSet;
        growingSet = null;
        state = ImageState.FINALIZED;
    }

    /**
     * @return frozen keypoints for lookups.
     *
     * @throws IllegalStateException
     *   if the image is still being consolidated.
     */
    public CanonicalKeypointSet getKeypointSet()
            throws IllegalStateException {
        if (keypointSet == null) {
            throw new IllegalStateException("keypoints for " + state + " image " + name + " are not frozen");
        }
        return keypointSet;
    }

    @Override
    public String toString() {
        return "{\"name\": \"" + name + "\", \"state\": \"" + state +
               "\", \"remainingPairCount\": " + remainingPairCount + "}";
    }
}
