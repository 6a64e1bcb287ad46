package org.janelia.keypoints.aggregate;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.match.ImagePair;
import org.janelia.keypoints.match.MatchArray;
import org.janelia.keypoints.match.PairCorrespondences;
import org.janelia.keypoints.parameters.KeypointAggregationParameters;
import org.janelia.keypoints.store.InMemoryKeyedStore;
import org.janelia.keypoints.store.PairCorrespondenceLookup;
import org.janelia.keypoints.util.CancellationToken;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link MatchReassigner} class.
 */
public class MatchReassignerTest {

    private static final ImagePair AB = new ImagePair("a", "b");

    private InMemoryKeyedStore<PairCorrespondences> correspondenceStore;
    private InMemoryKeyedStore<MatchArray> matchStore;
    private PairCorrespondenceLookup lookup;

    @Before
    public void setup() {
        correspondenceStore = new InMemoryKeyedStore<>();
        matchStore = new InMemoryKeyedStore<>();
        lookup = new PairCorrespondenceLookup(correspondenceStore);

        // the weaker a keypoint is inserted first and is later dropped by the budget
        correspondenceStore.save(AB.toKey(),
                                 PairCorrespondences.fromPoints(new double[][] { {30.2, 30.2}, {10.2, 10.2} },
                                                                new double[][] { {200.0, 200.0}, {100.0, 100.0} },
                                                                new double[] { 3.0, 5.0 }));
    }

    @Test
    public void testReassignAfterTruncation() throws Exception {

        final KeypointAggregationParameters parameters = new KeypointAggregationParameters(1.0, 1.0, 1);
        parameters.validateAndSetDefaults();

        final ReferenceKeypoints references = new ReferenceKeypoints().addFixed(
                "b",
                CanonicalKeypointSet.fromPoints(new double[][] { {100.0, 100.0}, {200.0, 200.0} },
                                                new double[] { 1.0, 1.0 }));

        final InMemoryKeyedStore<CanonicalKeypointSet> keypointStore = new InMemoryKeyedStore<>();
        final AggregationResult result = new KeypointAggregator(parameters, lookup, matchStore, keypointStore)
                .aggregate(Collections.singletonList(AB), null, references, new CancellationToken());

        Assert.assertEquals(Collections.singleton("a"), result.getTruncatedImageNames());

        final CanonicalKeypointSet a = keypointStore.load("a");
        Assert.assertEquals(1, a.size());
        Assert.assertEquals(10.5, a.getX(0), 0.0);
        Assert.assertEquals(5.0, a.getScore(0), 0.0);

        final MatchArray provisionalMatches = matchStore.load(AB.toKey());
        Assert.assertTrue(provisionalMatches.isProvisional());
        Assert.assertArrayEquals(new int[] { 1, 0 }, provisionalMatches.getMatches());

        final MatchArrayValidator validator = new MatchArrayValidator(matchStore);
        try {
            validator.validate(result.getProcessedPairs(), result.getFinalKeypointSets());
            Assert.fail("matches referencing the dropped keypoint should fail validation");
        } catch (final IllegalStateException e) {
            Assert.assertTrue(e.getMessage().contains("only has 1 keypoints"));
        }

        final ReassignmentResult reassignmentResult =
                new MatchReassigner(parameters.maxError, lookup, matchStore, 2)
                        .reassign(result.getProcessedPairs(), result.getFinalKeypointSets());

        Assert.assertEquals(1, reassignmentResult.getReassignedPairCount());
        Assert.assertEquals(1, reassignmentResult.getMatchCount());
        Assert.assertEquals(0, reassignmentResult.getEmptyPairs().size());

        final MatchArray finalMatches = matchStore.load(AB.toKey());
        Assert.assertFalse(finalMatches.isProvisional());
        Assert.assertArrayEquals(new int[] { 0 }, finalMatches.getMatches());
        Assert.assertEquals(5.0, finalMatches.getScore(0), 0.0);

        Assert.assertEquals(1, validator.validate(result.getProcessedPairs(), result.getFinalKeypointSets()));
    }

    @Test
    public void testEmptyAndMissingPairs() throws Exception {

        final ImagePair ac = new ImagePair("a", "c");

        final Map<String, CanonicalKeypointSet> finalKeypointSets = new HashMap<>();
        finalKeypointSets.put("a", CanonicalKeypointSet.fromPoints(new double[][] { {10.5, 10.5} },
                                                                   new double[] { 5.0 }));

        final ReassignmentResult result = new MatchReassigner(1.0, lookup, matchStore, 1)
                .reassign(Arrays.asList(AB, ac), finalKeypointSets);

        Assert.assertEquals(1, result.getReassignedPairCount());
        Assert.assertEquals("b has no keypoints, so nothing can match",
                            Collections.singletonList(AB), result.getEmptyPairs());
        Assert.assertEquals(Collections.singletonList(ac), result.getMissingPairs());
        Assert.assertEquals(0, matchStore.load(AB.toKey()).length());
        Assert.assertFalse(matchStore.contains(ac.toKey()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidThreadCount() {
        new MatchReassigner(1.0, lookup, matchStore, 0);
    }

}
