package org.janelia.keypoints.quantize;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link GrowingKeypointSet} class.
 */
public class GrowingKeypointSetTest {

    @Test
    public void testConsensusTieKeepsFirstCell() {

        final GrowingKeypointSet growingSet = new GrowingKeypointSet();
        final int index = growingSet.indexOf(new GridCell(10.5, 10.5));
        growingSet.vote(index, new GridCell(10.5, 10.5), 2.0);
        growingSet.vote(index, new GridCell(11.5, 10.5), 1.0);
        growingSet.vote(index, new GridCell(11.5, 10.5), 1.0);

        final CanonicalKeypointSet finalSet = growingSet.finalizeKeypoints(null).getKeypointSet();
        Assert.assertEquals(10.5, finalSet.getX(0), 0.0);
        Assert.assertEquals(2.0, finalSet.getScore(0), 0.0);
    }

    @Test
    public void testFinalizeWithoutBudgetKeepsOrder() {

        final GrowingKeypointSet growingSet = buildSet(1.0, 3.0, 2.0);

        final GrowingKeypointSet.FinalizedKeypoints finalized = growingSet.finalizeKeypoints(null);
        Assert.assertFalse(finalized.wasTruncated());

        final CanonicalKeypointSet finalSet = finalized.getKeypointSet();
        Assert.assertEquals(3, finalSet.size());
        Assert.assertArrayEquals(new double[] { 1.0, 3.0, 2.0 }, finalSet.getScores(), 0.0);

        Assert.assertFalse("budget larger than set should not truncate",
                           buildSet(1.0, 3.0, 2.0).finalizeKeypoints(3).wasTruncated());
    }

    @Test
    public void testFinalizeWithBudget() {

        final GrowingKeypointSet growingSet = buildSet(1.0, 3.0, 2.0, 3.0);

        final GrowingKeypointSet.FinalizedKeypoints finalized = growingSet.finalizeKeypoints(2);
        Assert.assertTrue(finalized.wasTruncated());
        Assert.assertEquals(2, finalized.getDiscardedCount());

        final CanonicalKeypointSet finalSet = finalized.getKeypointSet();
        Assert.assertEquals(2, finalSet.size());
        Assert.assertArrayEquals(new double[] { 3.0, 3.0 }, finalSet.getScores(), 0.0);
        Assert.assertEquals("equal scores should keep growing order", 1.0, finalSet.getX(0), 0.0);
        Assert.assertEquals("equal scores should keep growing order", 3.0, finalSet.getX(1), 0.0);
    }

    @Test(expected = IllegalStateException.class)
    public void testFinalizeEntryWithoutVotes() {
        final GrowingKeypointSet growingSet = new GrowingKeypointSet();
        growingSet.indexOf(new GridCell(0.5, 0.5));
        growingSet.finalizeKeypoints(null);
    }

    @Test
    public void testFinalizeEmptySet() {
        final GrowingKeypointSet.FinalizedKeypoints finalized = new GrowingKeypointSet().finalizeKeypoints(5);
        Assert.assertEquals(0, finalized.getKeypointSet().size());
        Assert.assertFalse(finalized.wasTruncated());
    }

    /**
     * @return set with one entry per weight, entry i located at (i, i).
     */
    private static GrowingKeypointSet buildSet(final double... weights) {
        final GrowingKeypointSet growingSet = new GrowingKeypointSet();
        for (int i = 0; i < weights.length; i++) {
            final GridCell cell = new GridCell(i, i);
            growingSet.vote(growingSet.indexOf(cell), cell, weights[i]);
        }
        return growingSet;
    }

}
