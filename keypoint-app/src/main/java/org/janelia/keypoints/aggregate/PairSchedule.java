package org.janelia.keypoints.aggregate;

import java.util.Arrays;

/**
 * Orders pending pairs by remaining demand: the smaller remaining pair count of a pair's two images.
 * Pairs touching images that are close to finalization come first, so their votes can be released early.
 *
 * <p>
 * Implemented as an indexed binary min-heap over pair indexes. Remaining pair counts live in the
 * {@link ImageRecordArena}; callers report count changes through {@link #onRemainingPairCountChanged}
 * and the affected pairs are re-keyed in place. Ties go to the pair with the smaller index.
 * </p>
 */
public class PairSchedule {

    private final int[][] pairImageIds;
    private final ImageRecordArena arena;
    private final int[][] pairIndexesForImage;

    private final int[] heap;
    private final int[] heapPosition;
    private int heapSize;

    /**
     * @param  pairImageIds  arena ids of the two images of each pair.
     * @param  arena         records holding the current remaining pair counts.
     */
    public PairSchedule(final int[][] pairImageIds,
                        final ImageRecordArena arena) {

        this.pairImageIds = pairImageIds;
        this.arena = arena;

        final int[] pairCountForImage = new int[arena.size()];
        for (final int[] imageIds : pairImageIds) {
            pairCountForImage[imageIds[0]]++;
            pairCountForImage[imageIds[1]]++;
        }
        this.pairIndexesForImage = new int[arena.size()][];
        for (int imageId = 0; imageId < pairCountForImage.length; imageId++) {
            this.pairIndexesForImage[imageId] = new int[pairCountForImage[imageId]];
        }
        final int[] fillCount = new int[arena.size()];
        for (int pairIndex = 0; pairIndex < pairImageIds.length; pairIndex++) {
            for (final int imageId : pairImageIds[pairIndex]) {
                pairIndexesForImage[imageId][fillCount[imageId]++] = pairIndex;
            }
        }

        this.heap = new int[pairImageIds.length];
        this.heapPosition = new int[pairImageIds.length];
        Arrays.fill(heapPosition, -1);
        this.heapSize = 0;

        for (int pairIndex = 0; pairIndex < pairImageIds.length; pairIndex++) {
            heap[heapSize] = pairIndex;
            heapPosition[pairIndex] = heapSize;
            heapSize++;
        }
        for (int i = (heapSize / 2) - 1; i >= 0; i--) {
            siftDown(i);
        }
    }

    public boolean isEmpty() {
        return heapSize == 0;
    }

    public int size() {
        return heapSize;
    }

    /**
     * @return index of the pending pair with the least remaining demand (removed from the schedule).
     *
     * @throws IllegalStateException
     *   if no pairs are pending.
     */
    public int poll()
            throws IllegalStateException {
        if (heapSize == 0) {
            throw new IllegalStateException("no pairs remain in schedule");
        }
        final int pairIndex = heap[0];
        heapSize--;
        heapPosition[pairIndex] = -1;
        if (heapSize > 0) {
            heap[0] = heap[heapSize];
            heapPosition[heap[0]] = 0;
            siftDown(0);
        }
        return pairIndex;
    }

    /**
     * Re-keys every pending pair of the specified image after its remaining pair count changed.
     */
    public void onRemainingPairCountChanged(final int imageId) {
        for (final int pairIndex : pairIndexesForImage[imageId]) {
            final int position = heapPosition[pairIndex];
            if (position >= 0) {
                siftDown(siftUp(position));
            }
        }
    }

    int getRemainingDemand(final int pairIndex) {
        final int[] imageIds = pairImageIds[pairIndex];
        return Math.min(arena.get(imageIds[0]).getRemainingPairCount(),
                        arena.get(imageIds[1]).getRemainingPairCount());
    }

    private boolean precedes(final int pairIndex,
                             final int otherPairIndex) {
        final int demand = getRemainingDemand(pairIndex);
        final int otherDemand = getRemainingDemand(otherPairIndex);
        return demand < otherDemand || ((demand == otherDemand) && (pairIndex < otherPairIndex));
    }

    private int siftUp(int position) {
        final int pairIndex = heap[position];
        while (position > 0) {
            final int parent = (position - 1) / 2;
            if (! precedes(pairIndex, heap[parent])) {
                break;
            }
            heap[position] = heap[parent];
            heapPosition[heap[position]] = position;
            position = parent;
        }
        heap[position] = pairIndex;
        heapPosition[pairIndex] = position;
        return position;
    }

    private void siftDown(int position) {
        final int pairIndex = heap[position];
        while (true) {
            final int left = (2 * position) + 1;
            if (left >= heapSize) {
                break;
            }
            final int right = left + 1;
            final int child = ((right < heapSize) && precedes(heap[right], heap[left])) ? right : left;
            if (! precedes(heap[child], pairIndex)) {
                break;
            }
            heap[position] = heap[child];
            heapPosition[heap[position]] = position;
            position = child;
        }
        heap[position] = pairIndex;
        heapPosition[pairIndex] = position;
    }
}
