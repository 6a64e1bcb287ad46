package org.janelia.keypoints.quantize;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.match.MatchArray;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link KeypointQuantizer} class.
 */
public class KeypointQuantizerTest {

    @Test
    public void testLookup() {

        final CanonicalKeypointSet canonicalSet = CanonicalKeypointSet.fromPoints(
                new double[][] { {10.0, 10.0}, {20.0, 20.0} },
                new double[] { 1.0, 1.0 });

        final double[][] keypoints = {
                { 10.5, 19.8, 50.0 },
                { 10.2, 20.6, 50.0 }
        };

        final KeypointQuantizer quantizer = new KeypointQuantizer(1.0);

        final int[] firstIndexes = quantizer.lookup(keypoints, canonicalSet);
        Assert.assertArrayEquals(new int[] { 0, 1, MatchArray.UNMATCHED }, firstIndexes);

        final int[] secondIndexes = quantizer.lookup(keypoints, canonicalSet);
        Assert.assertArrayEquals("repeated lookup should give the same result", firstIndexes, secondIndexes);
        Assert.assertEquals("lookup should not change the canonical set", 2, canonicalSet.size());
    }

    @Test
    public void testLookupWithEmptyInputs() {

        final KeypointQuantizer quantizer = new KeypointQuantizer(2.0);

        final int[] indexes = quantizer.lookup(new double[][] { {1.0, 2.0}, {3.0, 4.0} },
                                               CanonicalKeypointSet.EMPTY);
        Assert.assertArrayEquals(new int[] { MatchArray.UNMATCHED, MatchArray.UNMATCHED }, indexes);

        final CanonicalKeypointSet canonicalSet = CanonicalKeypointSet.fromPoints(new double[][] { {1.0, 3.0} },
                                                                                  new double[] { 1.0 });
        Assert.assertEquals(0, quantizer.lookup(new double[2][0], canonicalSet).length);
    }

    @Test
    public void testInsertConsolidatesCoarseCell() {

        // cellSize 2, maxError 1: all three keypoints share the coarse cell (5.5, 5.5)
        final KeypointQuantizer quantizer = new KeypointQuantizer(1.0, 2.0);
        final GrowingKeypointSet growingSet = new GrowingKeypointSet();

        Assert.assertArrayEquals(new int[] { 0 },
                                 quantizer.insert(new double[][] { {5.0}, {5.0} }, growingSet, null));
        Assert.assertArrayEquals(new int[] { 0 },
                                 quantizer.insert(new double[][] { {5.4}, {5.4} }, growingSet, null));
        Assert.assertArrayEquals(new int[] { 0 },
                                 quantizer.insert(new double[][] { {6.2}, {6.2} }, growingSet, new double[] { 3.0 }));

        Assert.assertEquals(1, growingSet.size());

        final VoteAccumulator votes = growingSet.getVotes(0);
        Assert.assertEquals(2, votes.getCellCount());
        Assert.assertEquals(2.0, votes.getWeight(new GridCell(5.5, 5.5)), 0.0);
        Assert.assertEquals(3.0, votes.getWeight(new GridCell(6.5, 6.5)), 0.0);

        final CanonicalKeypointSet finalSet = growingSet.finalizeKeypoints(null).getKeypointSet();
        Assert.assertEquals(1, finalSet.size());
        Assert.assertEquals(6.5, finalSet.getX(0), 0.0);
        Assert.assertEquals(6.5, finalSet.getY(0), 0.0);
        Assert.assertEquals(3.0, finalSet.getScore(0), 0.0);
    }

    @Test
    public void testInsertOnlyAppends() {

        final KeypointQuantizer quantizer = new KeypointQuantizer(1.0);
        final GrowingKeypointSet growingSet = new GrowingKeypointSet();

        final int[] firstIndexes = quantizer.insert(new double[][] { {10.2, 30.2}, {10.2, 30.2} },
                                                    growingSet,
                                                    new double[] { 1.0, 1.0 });
        Assert.assertArrayEquals(new int[] { 0, 1 }, firstIndexes);

        final GridCell firstCell = growingSet.getIdentityCell(0);
        final GridCell secondCell = growingSet.getIdentityCell(1);

        final int[] secondIndexes = quantizer.insert(new double[][] { {50.0, 30.4, 10.3}, {50.0, 30.1, 10.4} },
                                                     growingSet,
                                                     null);
        Assert.assertArrayEquals(new int[] { 2, 1, 0 }, secondIndexes);
        Assert.assertEquals(3, growingSet.size());
        Assert.assertEquals("existing entries should not move", firstCell, growingSet.getIdentityCell(0));
        Assert.assertEquals("existing entries should not move", secondCell, growingSet.getIdentityCell(1));
    }

    @Test
    public void testUnquantizedInsert() {

        final KeypointQuantizer quantizer = KeypointQuantizer.unquantized();
        final GrowingKeypointSet growingSet = new GrowingKeypointSet();

        final int[] indexes = quantizer.insert(new double[][] { {10.2, 10.2, 10.4}, {10.3, 10.3, 10.3} },
                                               growingSet,
                                               null);

        Assert.assertArrayEquals(new int[] { 0, 0, 1 }, indexes);

        final CanonicalKeypointSet finalSet = growingSet.finalizeKeypoints(null).getKeypointSet();
        Assert.assertEquals(10.2, finalSet.getX(0), 0.0);
        Assert.assertEquals(10.4, finalSet.getX(1), 0.0);
    }

    @Test
    public void testGridSpacing() {

        final KeypointQuantizer clamped = new KeypointQuantizer(4.0, 2.0);
        Assert.assertEquals("cell size should be raised to max error",
                            4.0, clamped.getIdentityGrid().getSpacing(), 0.0);
        Assert.assertEquals(4.0, clamped.getVotingGrid().getSpacing(), 0.0);

        final KeypointQuantizer fractional = new KeypointQuantizer(2.5, 8.0);
        Assert.assertEquals(8.0, fractional.getIdentityGrid().getSpacing(), 0.0);
        Assert.assertEquals("voting grid spacing should be truncated",
                            2.0, fractional.getVotingGrid().getSpacing(), 0.0);

        final KeypointQuantizer subPixel = new KeypointQuantizer(0.5);
        Assert.assertTrue(subPixel.getVotingGrid().isUnquantized());
    }

    @Test
    public void testInvalidConfiguration() {
        for (final double maxError : new double[] { 0.0, -1.0, Double.NaN }) {
            try {
                new KeypointQuantizer(maxError);
                Assert.fail("maxError " + maxError + " should have been rejected");
            } catch (final IllegalArgumentException e) {
                Assert.assertTrue(e.getMessage().contains("maxError"));
            }
        }

        try {
            new KeypointQuantizer(1.0, 0.0);
            Assert.fail("cellSize 0 should have been rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("cellSize"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInsertWithMismatchedScores() {
        new KeypointQuantizer(1.0).insert(new double[][] { {1.0, 2.0}, {1.0, 2.0} },
                                          new GrowingKeypointSet(),
                                          new double[] { 1.0 });
    }

}
