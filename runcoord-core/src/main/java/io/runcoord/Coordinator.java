package io.runcoord;

import java.time.Instant;

/**
 * Background coordinator that executes due schedule occurrences.
 *
 * <p>Any number of instances may run against the same store; they share no memory and coordinate
 * only through the store's compare-and-swap claims.
 */
public interface Coordinator {

    void start();

    void stop();

    boolean isRunning();

    /**
     * Runs one poll tick synchronously; claimed occurrences still execute on the worker pool.
     *
     * @return number of occurrences claimed
     */
    int pollNow(Instant now);

    /**
     * Runs one stuck-claim scan synchronously.
     *
     * @return number of schedules released
     */
    int recoverNow(Instant now);
}
