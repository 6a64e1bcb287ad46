package org.janelia.keypoints.aggregate;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.janelia.keypoints.match.CanonicalKeypointSet;
import org.janelia.keypoints.match.ImagePair;
import org.janelia.keypoints.match.MatchArray;
import org.janelia.keypoints.match.PairCorrespondences;
import org.janelia.keypoints.parameters.KeypointAggregationParameters;
import org.janelia.keypoints.store.InMemoryKeyedStore;
import org.janelia.keypoints.store.KeyedStore;
import org.janelia.keypoints.store.PairCorrespondenceLookup;
import org.janelia.keypoints.util.CancellationToken;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link KeypointAggregator} class.
 */
public class KeypointAggregatorTest {

    private static final ImagePair AB = new ImagePair("a", "b");
    private static final ImagePair AC = new ImagePair("a", "c");
    private static final ImagePair BC = new ImagePair("b", "c");

    private InMemoryKeyedStore<PairCorrespondences> correspondenceStore;
    private InMemoryKeyedStore<MatchArray> matchStore;
    private InMemoryKeyedStore<CanonicalKeypointSet> keypointStore;

    @Before
    public void setup() {
        correspondenceStore = new InMemoryKeyedStore<>();
        matchStore = new InMemoryKeyedStore<>();
        keypointStore = new InMemoryKeyedStore<>();
    }

    @Test
    public void testAggregate() throws Exception {

        saveTrianglePairs(true);

        final AggregationResult result = buildAggregator(1.0, null, correspondenceStore)
                .aggregate(Arrays.asList(AB, AC, BC), null, new ReferenceKeypoints(), new CancellationToken());

        Assert.assertFalse(result.isCancelled());
        Assert.assertEquals(Arrays.asList(AB, AC, BC), result.getProcessedPairs());
        Assert.assertEquals(0, result.getMissingPairCount());
        Assert.assertEquals(Arrays.asList("a", "b", "c"), result.getFinalizedImageNames());
        Assert.assertFalse(result.isTruncationOccurred());
        Assert.assertEquals(5, result.getFinalizedKeypointCount());

        final CanonicalKeypointSet a = keypointStore.load("a");
        Assert.assertEquals(3, a.size());
        Assert.assertEquals(9.5, a.getX(0), 0.0);
        Assert.assertEquals(49.5, a.getX(1), 0.0);
        Assert.assertEquals(50.5, a.getX(2), 0.0);

        final CanonicalKeypointSet b = keypointStore.load("b");
        Assert.assertEquals(1, b.size());
        Assert.assertEquals(10.5, b.getY(0), 0.0);
        Assert.assertEquals("votes from all pairs of b should be summed", 1.5, b.getScore(0), 1e-9);

        final MatchArray abMatches = matchStore.load(AB.toKey());
        Assert.assertArrayEquals(new int[] { 0 }, abMatches.getMatches());
        Assert.assertEquals(0.9, abMatches.getScore(0), 0.0);
        Assert.assertEquals(MatchArray.UNMATCHED, abMatches.getMatch(1));
        Assert.assertFalse(abMatches.isProvisional());

        Assert.assertArrayEquals(new int[] { MatchArray.UNMATCHED, MatchArray.UNMATCHED, 0 },
                                 matchStore.load(AC.toKey()).getMatches());
        Assert.assertArrayEquals(new int[] { 0 }, matchStore.load(BC.toKey()).getMatches());

        Assert.assertEquals(3, result.getFinalKeypointSets().size());
        Assert.assertEquals(3, new MatchArrayValidator(matchStore).validate(result.getProcessedPairs(),
                                                                            result.getFinalKeypointSets()));
    }

    @Test
    public void testMissingCorrespondences() throws Exception {

        saveTrianglePairs(false);

        final ImagePair cd = new ImagePair("c", "d");
        final AggregationResult result = buildAggregator(1.0, null, correspondenceStore)
                .aggregate(Arrays.asList(AB, AC, BC, cd), null, new ReferenceKeypoints(), new CancellationToken());

        // c-d has the least remaining demand, so it is scheduled first
        Assert.assertEquals(Arrays.asList(cd, AC), result.getMissingPairs());
        Assert.assertEquals(2, result.getProcessedPairs().size());
        Assert.assertEquals("every image should be finalized", 4, result.getFinalizedImageNames().size());
        Assert.assertFalse(matchStore.contains(AC.toKey()));
        Assert.assertEquals(2, keypointStore.load("a").size());
        Assert.assertEquals("image without any stored pair should get an empty set",
                            0, keypointStore.load("d").size());
    }

    @Test
    public void testDuplicatePairs() throws Exception {

        saveTrianglePairs(true);

        final AggregationResult result = buildAggregator(1.0, null, correspondenceStore)
                .aggregate(Arrays.asList(AB, new ImagePair("b", "a"), AC, BC),
                           null, new ReferenceKeypoints(), new CancellationToken());

        Assert.assertEquals(3, result.getProcessedPairs().size());
        Assert.assertEquals(1.5, keypointStore.load("b").getScore(0), 1e-9);
    }

    @Test
    public void testCancellation() throws Exception {

        saveTrianglePairs(true);

        final CancellationToken cancellationToken = new CancellationToken();
        cancellationToken.cancel();

        final AggregationResult result = buildAggregator(1.0, null, correspondenceStore)
                .aggregate(Arrays.asList(AB, AC, BC), null, new ReferenceKeypoints(), cancellationToken);

        Assert.assertTrue(result.isCancelled());
        Assert.assertEquals(0, result.getProcessedPairs().size());
        Assert.assertEquals(0, keypointStore.size());
        Assert.assertEquals(0, matchStore.size());
    }

    @Test
    public void testCancellationBetweenPairs() throws Exception {

        saveTrianglePairs(true);

        final CancellationToken cancellationToken = new CancellationToken();
        final KeyedStore<PairCorrespondences> cancellingStore = new InMemoryKeyedStore<PairCorrespondences>() {
            @Override
            public PairCorrespondences load(final String key) {
                cancellationToken.cancel();
                return correspondenceStore.load(key);
            }
        };

        final AggregationResult result = buildAggregator(1.0, null, cancellingStore)
                .aggregate(Arrays.asList(AB, AC, BC), null, new ReferenceKeypoints(), cancellationToken);

        Assert.assertTrue(result.isCancelled());
        Assert.assertEquals(Collections.singletonList(AB), result.getProcessedPairs());
        Assert.assertEquals("no image should be finalized", 0, keypointStore.size());
        Assert.assertTrue(matchStore.contains(AB.toKey()));
    }

    @Test
    public void testLocalizationKeepsRawQueryKeypoints() throws Exception {

        final ImagePair bq = saveQueryPair();

        final ReferenceKeypoints references = new ReferenceKeypoints().addFixed("b", buildReferenceSet());

        final AggregationResult result = buildAggregator(2.0, null, correspondenceStore)
                .aggregate(Collections.singletonList(bq), null, references, new CancellationToken());

        Assert.assertEquals(Collections.singletonList("q"), result.getFinalizedImageNames());

        final CanonicalKeypointSet q = keypointStore.load("q");
        Assert.assertEquals(2, q.size());
        Assert.assertEquals(10.23, q.getX(0), 0.0);
        Assert.assertEquals(20.71, q.getY(0), 0.0);
        Assert.assertEquals(9.61, q.getX(1), 0.0);
        Assert.assertEquals(20.95, q.getY(1), 0.0);

        final MatchArray matchArray = matchStore.load(bq.toKey());
        Assert.assertArrayEquals(new int[] { 0, 1 }, matchArray.getMatches());
        Assert.assertFalse(matchArray.isProvisional());

        Assert.assertFalse("fixed reference should not be written", keypointStore.contains("b"));
        Assert.assertEquals(2, result.getFinalKeypointSets().get("b").size());
    }

    @Test
    public void testBudgetQuantizesQueryKeypoints() throws Exception {

        final ImagePair bq = saveQueryPair();

        final ReferenceKeypoints references = new ReferenceKeypoints().addFixed("b", buildReferenceSet());

        buildAggregator(2.0, 10, correspondenceStore)
                .aggregate(Collections.singletonList(bq), null, references, new CancellationToken());

        final CanonicalKeypointSet q = keypointStore.load("q");
        Assert.assertEquals(1, q.size());
        Assert.assertEquals(9.5, q.getX(0), 0.0);
        Assert.assertEquals(21.5, q.getY(0), 0.0);
        Assert.assertEquals(1.3, q.getScore(0), 1e-9);

        final MatchArray matchArray = matchStore.load(bq.toKey());
        Assert.assertArrayEquals(new int[] { MatchArray.UNMATCHED, 0 }, matchArray.getMatches());
        Assert.assertTrue("matches written with a budget must be reassigned", matchArray.isProvisional());
    }

    @Test
    public void testResume() throws Exception {

        matchStore.save(AB.toKey(), new MatchArray(new int[] { 0 }, new double[] { 1.0 }, false));
        matchStore.save(AC.toKey(), new MatchArray(new int[] { 0 }, new double[] { 1.0 }, true));
        correspondenceStore.save(AC.toKey(),
                                 PairCorrespondences.fromPoints(new double[][] { {10.3, 10.1} },
                                                                new double[][] { {20.2, 19.9} },
                                                                new double[] { 0.4 }));

        final ReferenceKeypoints references = new ReferenceKeypoints()
                .addFixed("a", CanonicalKeypointSet.fromPoints(new double[][] { {10.0, 10.0} }, new double[] { 1.0 }))
                .addFixed("b", CanonicalKeypointSet.fromPoints(new double[][] { {15.0, 15.0} }, new double[] { 1.0 }))
                .addFixed("c", CanonicalKeypointSet.fromPoints(new double[][] { {20.0, 20.0} }, new double[] { 1.0 }));

        final Set<String> requiredImageNames = new HashSet<>(Arrays.asList("a", "z"));

        final AggregationResult result = buildAggregator(1.0, null, correspondenceStore)
                .aggregate(Arrays.asList(AB, AC), requiredImageNames, references, new CancellationToken());

        Assert.assertEquals(1, result.getResumedPairCount());
        Assert.assertEquals(Collections.singletonList(AC), result.getProcessedPairs());
        Assert.assertEquals(0, result.getFinalizedImageNames().size());

        final MatchArray recomputed = matchStore.load(AC.toKey());
        Assert.assertFalse(recomputed.isProvisional());
        Assert.assertEquals(0.4, recomputed.getScore(0), 0.0);
    }

    private KeypointAggregator buildAggregator(final double maxError,
                                               final Integer maxKeypointsPerImage,
                                               final KeyedStore<PairCorrespondences> sourceStore) {
        final KeypointAggregationParameters parameters =
                new KeypointAggregationParameters(maxError, null, maxKeypointsPerImage);
        parameters.validateAndSetDefaults();
        return new KeypointAggregator(parameters,
                                      new PairCorrespondenceLookup(sourceStore),
                                      matchStore,
                                      keypointStore);
    }

    private void saveTrianglePairs(final boolean includeAC) throws IOException {

        // two raw b keypoints land in the same canonical cell, only the better match survives
        correspondenceStore.save(AB.toKey(),
                                 PairCorrespondences.fromPoints(new double[][] { {10.0, 10.0}, {50.0, 50.0} },
                                                                new double[][] { {10.2, 10.1}, {10.4, 10.3} },
                                                                new double[] { 0.9, 0.1 }));
        if (includeAC) {
            correspondenceStore.save(AC.toKey(),
                                     PairCorrespondences.fromPoints(new double[][] { {50.1, 50.3} },
                                                                    new double[][] { {70.4, 70.1} },
                                                                    new double[] { 0.8 }));
        }

        // stored in reverse direction
        correspondenceStore.save(BC.toReversedKey(),
                                 PairCorrespondences.fromPoints(new double[][] { {70.2, 70.2} },
                                                                new double[][] { {10.3, 10.2} },
                                                                new double[] { 0.5 }));
    }

    private ImagePair saveQueryPair() throws IOException {
        final ImagePair bq = new ImagePair("q", "b");
        correspondenceStore.save(bq.toReversedKey(),
                                 PairCorrespondences.fromPoints(new double[][] { {10.23, 20.71}, {9.61, 20.95} },
                                                                new double[][] { {100.4, 99.8}, {200.1, 200.3} },
                                                                new double[] { 0.6, 0.7 }));
        return bq;
    }

    private static CanonicalKeypointSet buildReferenceSet() {
        return CanonicalKeypointSet.fromPoints(new double[][] { {100.0, 100.0}, {200.0, 200.0} },
                                               new double[] { 1.0, 1.0 });
    }
}
