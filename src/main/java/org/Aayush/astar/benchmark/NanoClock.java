package org.Aayush.astar.benchmark;

/**
 * Monotonic nanosecond time source used to time benchmark runs.
 *
 * <p>Readings are only meaningful as differences between two calls on the same clock.</p>
 */
@FunctionalInterface
public interface NanoClock {

    /**
     * Clock backed by {@link System#nanoTime()}, immune to wall-clock adjustments.
     */
    NanoClock SYSTEM = System::nanoTime;

    long nanoTime();
}
