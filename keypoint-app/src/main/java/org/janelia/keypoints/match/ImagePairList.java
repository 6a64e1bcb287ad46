package org.janelia.keypoints.match;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.janelia.keypoints.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered list of image pairs, typically loaded from a text file with one
 * whitespace separated pair of image names per line.
 * Blank lines and lines starting with # are ignored.
 */
public class ImagePairList {

    private final List<ImagePair> pairs;

    public ImagePairList(final List<ImagePair> pairs) {
        this.pairs = new ArrayList<>(pairs);
    }

    public List<ImagePair> getPairs() {
        return Collections.unmodifiableList(pairs);
    }

    public int size() {
        return pairs.size();
    }

    /**
     * @return sorted names of all images referenced by the pairs.
     */
    public Set<String> getImageNames() {
        final Set<String> imageNames = new TreeSet<>();
        for (final ImagePair pair : pairs) {
            imageNames.add(pair.getA());
            imageNames.add(pair.getB());
        }
        return imageNames;
    }

    /**
     * @param  path  pair file path (a .gz suffix indicates compressed content).
     *
     * @throws IOException
     *   if the file cannot be read.
     *
     * @throws IllegalArgumentException
     *   if any line does not hold exactly two distinct image names.
     */
    public static ImagePairList load(final String path)
            throws IOException, IllegalArgumentException {

        LOG.info("load: entry, path={}", path);

        final ImagePairList pairList;
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(path)) {
            pairList = parse(reader, path);
        }

        LOG.info("load: exit, loaded {} pairs", pairList.size());

        return pairList;
    }

    static ImagePairList parse(final Reader reader,
                               final String source)
            throws IOException, IllegalArgumentException {

        final List<ImagePair> pairs = new ArrayList<>();
        final BufferedReader bufferedReader = new BufferedReader(reader);

        int lineNumber = 0;
        String line;
        while ((line = bufferedReader.readLine()) != null) {
            lineNumber++;
            final String trimmedLine = line.trim();
            if (trimmedLine.isEmpty() || trimmedLine.startsWith("#")) {
                continue;
            }
            final String[] names = WHITESPACE.split(trimmedLine);
            if (names.length != 2) {
                throw new IllegalArgumentException("line " + lineNumber + " of " + source +
                                                   " must contain two image names but was '" + line + "'");
            }
            try {
                pairs.add(new ImagePair(names[0], names[1]));
            } catch (final IllegalArgumentException e) {
                throw new IllegalArgumentException("line " + lineNumber + " of " + source + " is invalid", e);
            }
        }

        return new ImagePairList(pairs);
    }

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Logger LOG = LoggerFactory.getLogger(ImagePairList.class);
}
