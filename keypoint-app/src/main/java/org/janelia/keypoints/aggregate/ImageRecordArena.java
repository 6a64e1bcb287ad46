package org.janelia.keypoints.aggregate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.quantize.GrowingKeypointSet;

/**
 * Image records of one aggregation run indexed by a stable integer id.
 */
public class ImageRecordArena {

    private final List<ImageRecord> records;
    private final Map<String, Integer> nameToId;

    public ImageRecordArena() {
        this.records = new ArrayList<>();
        this.nameToId = new HashMap<>();
    }

    public int registerFixed(final String name,
                             final CanonicalKeypointSet keypointSet) {
        return register(name, ImageRecord.fixed(records.size(), name, keypointSet));
    }

    public int registerConsolidating(final String name,
                                     final GrowingKeypointSet seededSet) {
        return register(name, ImageRecord.consolidating(records.size(), name, seededSet));
    }

    private int register(final String name,
                         final ImageRecord record)
            throws IllegalArgumentException {
        if (nameToId.containsKey(name)) {
            throw new IllegalArgumentException("image " + name + " is already registered");
        }
        records.add(record);
        nameToId.put(name, record.getId());
        return record.getId();
    }

    public int getId(final String name)
            throws IllegalArgumentException {
        final Integer id = nameToId.get(name);
        if (id == null) {
            throw new IllegalArgumentException("image " + name + " is not registered");
        }
        return id;
    }

    public ImageRecord get(final int id) {
        return records.get(id);
    }

    public ImageRecord get(final String name) {
        return records.get(getId(name));
    }

    public int size() {
        return records.size();
    }

    public List<ImageRecord> getRecords() {
        return records;
    }
}
