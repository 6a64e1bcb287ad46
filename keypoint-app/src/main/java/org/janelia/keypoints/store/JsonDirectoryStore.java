package org.janelia.keypoints.store;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;
import java.util.TreeSet;

import org.janelia.keypoints.json.JsonUtils;
import org.janelia.keypoints.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link KeyedStore} that keeps one JSON file per key in a directory.
 * Keys are URL encoded to form file names, so pair keys containing '/' map to a single file.
 * Each save is written to a temporary file and then moved into place,
 * so readers never observe a partially written value.
 */
public class JsonDirectoryStore<T>
        implements KeyedStore<T> {

    private static final String JSON_EXTENSION = ".json";
    private static final String GZIP_EXTENSION = ".gz";
    private static final String TEMP_PREFIX = "tmp.";

    private final File directory;
    private final JsonUtils.Helper<T> jsonHelper;
    private final boolean compress;

    /**
     * @param  directory  directory for stored files (created if it does not exist).
     * @param  valueType  stored value type.
     * @param  compress   indicates whether saved files should be gzipped.
     */
    public JsonDirectoryStore(final File directory,
                              final Class<T> valueType,
                              final boolean compress) {
        FileUtil.ensureWritableDirectory(directory);
        this.directory = directory;
        this.jsonHelper = new JsonUtils.Helper<>(JsonUtils.FAST_MAPPER, valueType);
        this.compress = compress;
    }

    @Override
    public T load(final String key)
            throws IOException {

        final File file = findExistingFile(key);
        if (file == null) {
            return null;
        }

        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(file.getAbsolutePath())) {
            return jsonHelper.fromJson(reader);
        } catch (final IllegalArgumentException e) {
            throw new IOException("failed to load " + file, e);
        }
    }

    @Override
    public void save(final String key,
                     final T value)
            throws IOException {

        final String fileName = toFileName(key);
        final Path targetPath = new File(directory, fileName).toPath();
        // temporary name keeps the extension so that the writer picks the right encoding
        final Path tempPath = new File(directory, "." + TEMP_PREFIX + fileName).toPath();

        try (final Writer writer = FileUtil.DEFAULT_INSTANCE.getExtensionBasedWriter(tempPath.toString())) {
            jsonHelper.writeJson(value, writer);
        }

        Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        // only one representation of a key may exist
        final File otherRepresentation = new File(directory, toFileName(key, ! compress));
        if (otherRepresentation.exists() && (! otherRepresentation.delete())) {
            LOG.warn("save: failed to remove stale file {}", otherRepresentation);
        }

        LOG.debug("save: wrote {}", targetPath);
    }

    @Override
    public boolean contains(final String key) {
        return findExistingFile(key) != null;
    }

    @Override
    public Set<String> keys()
            throws IOException {

        final Set<String> keys = new TreeSet<>();
        final String[] fileNames = directory.list();
        if (fileNames == null) {
            throw new IOException("failed to list " + directory);
        }

        for (final String fileName : fileNames) {
            String encodedKey = null;
            if (fileName.endsWith(JSON_EXTENSION)) {
                encodedKey = fileName.substring(0, fileName.length() - JSON_EXTENSION.length());
            } else if (fileName.endsWith(JSON_EXTENSION + GZIP_EXTENSION)) {
                encodedKey = fileName.substring(0, fileName.length() - JSON_EXTENSION.length() - GZIP_EXTENSION.length());
            }
            if ((encodedKey != null) && (! fileName.startsWith("."))) {
                keys.add(URLDecoder.decode(encodedKey, StandardCharsets.UTF_8));
            }
        }

        return keys;
    }

    private File findExistingFile(final String key) {
        File file = new File(directory, toFileName(key, compress));
        if (! file.exists()) {
            file = new File(directory, toFileName(key, ! compress));
        }
        return file.exists() ? file : null;
    }

    private String toFileName(final String key) {
        return toFileName(key, compress);
    }

    private static String toFileName(final String key,
                                     final boolean compressed) {
        final String baseName = URLEncoder.encode(key, StandardCharsets.UTF_8) + JSON_EXTENSION;
        return compressed ? baseName + GZIP_EXTENSION : baseName;
    }

    private static final Logger LOG = LoggerFactory.getLogger(JsonDirectoryStore.class);
}
