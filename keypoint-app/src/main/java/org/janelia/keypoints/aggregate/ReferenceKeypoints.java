package org.janelia.keypoints.aggregate;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.quantize.GrowingKeypointSet;

/**
 * Keypoints that exist before an aggregation run starts.
 * Fixed sets are only looked up against; re-binned sets seed the growing set of an image
 * that is being consolidated again.
 */
public class ReferenceKeypoints {

    private final Map<String, CanonicalKeypointSet> fixedSets;
    private final Map<String, GrowingKeypointSet> rebinnedSets;

    public ReferenceKeypoints() {
        this.fixedSets = new HashMap<>();
        this.rebinnedSets = new HashMap<>();
    }

    public ReferenceKeypoints addFixed(final String imageName,
                                       final CanonicalKeypointSet keypointSet) {
        rebinnedSets.remove(imageName);
        fixedSets.put(imageName, keypointSet);
        return this;
    }

    public ReferenceKeypoints addRebinned(final String imageName,
                                          final GrowingKeypointSet growingSet) {
        fixedSets.remove(imageName);
        rebinnedSets.put(imageName, growingSet);
        return this;
    }

    public boolean isFixed(final String imageName) {
        return fixedSets.containsKey(imageName);
    }

    public CanonicalKeypointSet getFixed(final String imageName) {
        return fixedSets.get(imageName);
    }

    public GrowingKeypointSet getRebinned(final String imageName) {
        return rebinnedSets.get(imageName);
    }

    public Set<String> getFixedNames() {
        return Collections.unmodifiableSet(fixedSets.keySet());
    }

    public Set<String> getRebinnedNames() {
        return Collections.unmodifiableSet(rebinnedSets.keySet());
    }
}
