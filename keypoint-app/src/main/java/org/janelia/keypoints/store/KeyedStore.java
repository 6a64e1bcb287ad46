package org.janelia.keypoints.store;

import java.io.IOException;
import java.util.Set;

/**
 * Persistent storage for values addressed by a string key
 * (pair keys for correspondences and match arrays, image names for keypoint sets).
 *
 * Implementations must tolerate concurrent saves to distinct keys.
 *
 * @param  <T>  stored value type.
 */
public interface KeyedStore<T> {

    /**
     * @return the value stored for the key or null if nothing has been stored for it.
     */
    T load(String key) throws IOException;

    /**
     * Stores the value, replacing any previously stored value for the key.
     */
    void save(String key, T value) throws IOException;

    boolean contains(String key) throws IOException;

    Set<String> keys() throws IOException;

}
