package org.janelia.keypoints.match;

import java.io.Serializable;
import java.util.Objects;

/**
 * An unordered pair of image names with {@linkplain Comparable natural ordering}.
 * The lexicographically lesser name is always image A.
 */
public class ImagePair
        implements Comparable<ImagePair>, Serializable {

    /** Separator between the two names of a pair key. */
    public static final String KEY_SEPARATOR = "/";

    /** Lesser image name. */
    private final String a;

    /** Greater image name. */
    private final String b;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private ImagePair() {
        this.a = null;
        this.b = null;
    }

    /**
     * Constructs a normalized pair.
     *
     * @param  oneName      one image name.
     * @param  anotherName  another image name.
     *
     * @throws IllegalArgumentException
     *   if either name is missing or both names are the same.
     */
    public ImagePair(final String oneName,
                     final String anotherName)
            throws IllegalArgumentException {

        if ((oneName == null) || (anotherName == null)) {
            throw new IllegalArgumentException("pair is missing an image name: " + oneName + ", " + anotherName);
        }

        final int comparisonResult = oneName.compareTo(anotherName);
        if (comparisonResult < 0) {
            this.a = oneName;
            this.b = anotherName;
        } else if (comparisonResult > 0) {
            this.a = anotherName;
            this.b = oneName;
        } else {
            throw new IllegalArgumentException("both names are the same: '" + oneName + "'");
        }
    }

    public String getA() {
        return a;
    }

    public String getB() {
        return b;
    }

    public boolean contains(final String imageName) {
        return a.equals(imageName) || b.equals(imageName);
    }

    /**
     * @return storage key for this pair in its normalized (A, B) direction.
     */
    public String toKey() {
        return toKey(a, b);
    }

    /**
     * @return storage key for this pair in the reversed (B, A) direction.
     */
    public String toReversedKey() {
        return toKey(b, a);
    }

    /**
     * @return directional storage key for the specified names.
     *         Separator characters within the names are replaced so that the key splits unambiguously.
     */
    public static String toKey(final String firstName,
                               final String secondName) {
        return escape(firstName) + KEY_SEPARATOR + escape(secondName);
    }

    private static String escape(final String name) {
        return name.replace(KEY_SEPARATOR, "-");
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ImagePair that = (ImagePair) o;
        return Objects.equals(a, that.a) &&
               Objects.equals(b, that.b);
    }

    @Override
    public int hashCode() {
        return Objects.hash(a, b);
    }

    @Override
    public int compareTo(final ImagePair that) {
        int result = this.a.compareTo(that.a);
        if (result == 0) {
            result = this.b.compareTo(that.b);
        }
        return result;
    }

    @Override
    public String toString() {
        return "{\"a\": \"" + a + "\", \"b\": \"" + b + "\"}";
    }
}
