package org.janelia.keypoints.util;

/**
 * Tracks elapsed time and item throughput for long running loops
 * so that progress can be logged at a fixed interval instead of per item.
 */
public class ProcessTimer {

    public static final long DEFAULT_INTERVAL = 5000;

    private final long interval;
    private final long start;
    private long lastIntervalStart;
    private long itemCount;

    public ProcessTimer() {
        this(DEFAULT_INTERVAL);
    }

    public ProcessTimer(final long interval) {
        this.interval = interval;
        this.start = System.currentTimeMillis();
        this.lastIntervalStart = this.start;
        this.itemCount = 0;
    }

    /**
     * Records one more processed item.
     *
     * @return true if the logging interval has passed since the last time true was returned.
     */
    public boolean incrementAndCheckInterval() {
        itemCount++;
        final long now = System.currentTimeMillis();
        final boolean hasPassed = (now - lastIntervalStart) > interval;
        if (hasPassed) {
            lastIntervalStart = now;
        }
        return hasPassed;
    }

    public long getItemCount() {
        return itemCount;
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    public double getItemsPerSecond() {
        final long elapsed = getElapsedMilliseconds();
        return elapsed > 0 ? (itemCount * 1000.0) / elapsed : 0.0;
    }

    @Override
    public String toString() {
        final long totalSeconds = getElapsedMilliseconds() / 1000;
        final long hours = totalSeconds / 3600;
        final long minutes = (totalSeconds / 60) % 60;
        final long seconds = totalSeconds % 60;
        return hours + " hours, " + minutes + " minutes, " + seconds + " seconds";
    }
}
