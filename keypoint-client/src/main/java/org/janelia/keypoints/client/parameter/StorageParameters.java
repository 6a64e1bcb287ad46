package org.janelia.keypoints.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.File;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.match.MatchArray;
import org.janelia.keypoints.match.PairCorrespondences;
import org.janelia.keypoints.store.JsonDirectoryStore;
import org.janelia.keypoints.store.KeyedStore;

/**
 * Locations of pair lists and the directory stores read and written by aggregation.
 */
public class StorageParameters
        implements Serializable {

    @Parameter(
            names = "--pairs",
            description = "Text file with one pair of image names per line (.gz supported)",
            required = true)
    public String pairsPath;

    @Parameter(
            names = "--correspondenceDir",
            description = "Directory with stored dense pair correspondences",
            required = true)
    public String correspondenceDirectory;

    @Parameter(
            names = "--matchDir",
            description = "Directory for pair match arrays",
            required = true)
    public String matchDirectory;

    @Parameter(
            names = "--keypointDir",
            description = "Directory for consolidated image keypoints",
            required = true)
    public String keypointDirectory;

    @Parameter(
            names = "--referenceKeypointDir",
            description = "Directory with keypoints of reference images that are only looked up against " +
                          "(specify multiple times for several directories, later directories take precedence)")
    public List<String> referenceKeypointDirectories = new ArrayList<>();

    @Parameter(
            names = "--compress",
            description = "Gzip stored match arrays and keypoints",
            arity = 0)
    public boolean compress = false;

    /**
     * @throws IllegalArgumentException
     *   if the pair file or any input directory does not exist.
     */
    public void validate()
            throws IllegalArgumentException {

        if (! new File(pairsPath).isFile()) {
            throw new IllegalArgumentException("--pairs file " + pairsPath + " does not exist");
        }
        validateExistingDirectory("--correspondenceDir", correspondenceDirectory);
        for (final String referenceDirectory : referenceKeypointDirectories) {
            validateExistingDirectory("--referenceKeypointDir", referenceDirectory);
        }
    }

    public KeyedStore<PairCorrespondences> buildCorrespondenceStore() {
        return new JsonDirectoryStore<>(new File(correspondenceDirectory), PairCorrespondences.class, compress);
    }

    public KeyedStore<MatchArray> buildMatchStore() {
        return new JsonDirectoryStore<>(new File(matchDirectory), MatchArray.class, compress);
    }

    public KeyedStore<CanonicalKeypointSet> buildKeypointStore() {
        return new JsonDirectoryStore<>(new File(keypointDirectory), CanonicalKeypointSet.class, compress);
    }

    public List<KeyedStore<CanonicalKeypointSet>> buildReferenceKeypointStores() {
        final List<KeyedStore<CanonicalKeypointSet>> stores = new ArrayList<>();
        for (final String referenceDirectory : referenceKeypointDirectories) {
            stores.add(new JsonDirectoryStore<>(new File(referenceDirectory), CanonicalKeypointSet.class, compress));
        }
        return stores;
    }

    private static void validateExistingDirectory(final String parameterName,
                                                  final String path)
            throws IllegalArgumentException {
        if (! new File(path).isDirectory()) {
            throw new IllegalArgumentException(parameterName + " " + path + " is not a directory");
        }
    }
}
