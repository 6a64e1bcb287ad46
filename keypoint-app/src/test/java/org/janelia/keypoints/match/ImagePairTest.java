package org.janelia.keypoints.match;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ImagePair} class.
 */
public class ImagePairTest {

    @Test
    public void testNormalization() {
        final ImagePair pair = new ImagePair("query/b.jpg", "db/a.jpg");
        Assert.assertEquals("db/a.jpg", pair.getA());
        Assert.assertEquals("query/b.jpg", pair.getB());
        Assert.assertEquals(new ImagePair("db/a.jpg", "query/b.jpg"), pair);
        Assert.assertEquals(new ImagePair("db/a.jpg", "query/b.jpg").hashCode(), pair.hashCode());
        Assert.assertTrue(pair.contains("db/a.jpg"));
        Assert.assertFalse(pair.contains("db/c.jpg"));
    }

    @Test
    public void testKeys() {
        final ImagePair pair = new ImagePair("query/b.jpg", "db/a.jpg");
        Assert.assertEquals("db-a.jpg/query-b.jpg", pair.toKey());
        Assert.assertEquals("query-b.jpg/db-a.jpg", pair.toReversedKey());
        Assert.assertEquals(pair.toReversedKey(), ImagePair.toKey("query/b.jpg", "db/a.jpg"));
    }

    @Test
    public void testSorting() {
        final List<ImagePair> pairs = new ArrayList<>(Arrays.asList(new ImagePair("c", "b"),
                                                                    new ImagePair("a", "c"),
                                                                    new ImagePair("b", "a")));
        Collections.sort(pairs);
        Assert.assertEquals(Arrays.asList(new ImagePair("a", "b"),
                                          new ImagePair("a", "c"),
                                          new ImagePair("b", "c")),
                            pairs);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSameNames() {
        new ImagePair("a.jpg", "a.jpg");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingName() {
        new ImagePair("a.jpg", null);
    }

}
