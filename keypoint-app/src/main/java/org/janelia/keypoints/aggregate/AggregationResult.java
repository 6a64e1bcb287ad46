package org.janelia.keypoints.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.match.ImagePair;

/**
 * Summary of one aggregation run.
 */
public class AggregationResult {

    private final List<ImagePair> processedPairs;
    private final List<ImagePair> missingPairs;
    private int resumedPairCount;
    private final List<String> finalizedImageNames;
    private final Set<String> truncatedImageNames;
    private long finalizedKeypointCount;
    private final Map<String, CanonicalKeypointSet> finalKeypointSets;
    private boolean cancelled;
    private ReassignmentResult reassignmentResult;

    public AggregationResult() {
        this.processedPairs = new ArrayList<>();
        this.missingPairs = new ArrayList<>();
        this.resumedPairCount = 0;
        this.finalizedImageNames = new ArrayList<>();
        this.truncatedImageNames = new TreeSet<>();
        this.finalizedKeypointCount = 0;
        this.finalKeypointSets = new LinkedHashMap<>();
        this.cancelled = false;
        this.reassignmentResult = null;
    }

    void addProcessedPair(final ImagePair pair) {
        processedPairs.add(pair);
    }

    void addMissingPair(final ImagePair pair) {
        missingPairs.add(pair);
    }

    void setResumedPairCount(final int resumedPairCount) {
        this.resumedPairCount = resumedPairCount;
    }

    void addFinalizedImage(final String imageName,
                           final CanonicalKeypointSet keypointSet,
                           final boolean truncated) {
        finalizedImageNames.add(imageName);
        finalizedKeypointCount += keypointSet.size();
        if (truncated) {
            truncatedImageNames.add(imageName);
        }
    }

    void addFinalKeypointSet(final String imageName,
                             final CanonicalKeypointSet keypointSet) {
        finalKeypointSets.put(imageName, keypointSet);
    }

    void setCancelled(final boolean cancelled) {
        this.cancelled = cancelled;
    }

    public void setReassignmentResult(final ReassignmentResult reassignmentResult) {
        this.reassignmentResult = reassignmentResult;
    }

    /**
     * @return pairs whose correspondences were found and whose match arrays were written by this run.
     */
    public List<ImagePair> getProcessedPairs() {
        return Collections.unmodifiableList(processedPairs);
    }

    /**
     * @return pairs skipped because their correspondences are not stored in either direction.
     */
    public List<ImagePair> getMissingPairs() {
        return Collections.unmodifiableList(missingPairs);
    }

    public int getMissingPairCount() {
        return missingPairs.size();
    }

    /**
     * @return number of pairs skipped because a final match array was already stored for them.
     */
    public int getResumedPairCount() {
        return resumedPairCount;
    }

    public List<String> getFinalizedImageNames() {
        return Collections.unmodifiableList(finalizedImageNames);
    }

    public Set<String> getTruncatedImageNames() {
        return Collections.unmodifiableSet(truncatedImageNames);
    }

    public boolean isTruncationOccurred() {
        return ! truncatedImageNames.isEmpty();
    }

    public long getFinalizedKeypointCount() {
        return finalizedKeypointCount;
    }

    public double getAverageKeypointsPerImage() {
        return finalizedImageNames.isEmpty() ? 0.0 : (double) finalizedKeypointCount / finalizedImageNames.size();
    }

    /**
     * @return frozen keypoints of every finalized or fixed image referenced by the run's pairs.
     */
    public Map<String, CanonicalKeypointSet> getFinalKeypointSets() {
        return Collections.unmodifiableMap(finalKeypointSets);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @return result of the reassignment pass or null if it did not run.
     */
    public ReassignmentResult getReassignmentResult() {
        return reassignmentResult;
    }

    @Override
    public String toString() {
        return "{\"processedPairCount\": " + processedPairs.size() +
               ", \"missingPairCount\": " + missingPairs.size() +
               ", \"resumedPairCount\": " + resumedPairCount +
               ", \"finalizedImageCount\": " + finalizedImageNames.size() +
               ", \"truncatedImageCount\": " + truncatedImageNames.size() +
               ", \"finalizedKeypointCount\": " + finalizedKeypointCount +
               ", \"cancelled\": " + cancelled + "}";
    }
}
