// FILE: ScriptJobQueue.java
package org.foxesworld.scriptbridge.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Bridge "any thread -> engine owner thread". Fetch completions and other asynchronous module
 * continuations are posted here and run when the owner drains the queue.
 *
 * <p>Design:</p>
 * <ul>
 *   <li>{@link #post(Runnable)}: fire-and-forget, any thread; also usable as an {@link Executor}</li>
 *   <li>{@link #drain(int)} / {@link #drainBudgeted(int, long)}: strictly on the owner thread</li>
 * </ul>
 *
 * Author: Calista Verner
 */
public final class ScriptJobQueue implements Executor {

    private static final Logger log = LogManager.getLogger(ScriptJobQueue.class);

    private final Queue<Runnable> q = new ConcurrentLinkedQueue<>();
    private volatile Consumer<Throwable> onError = t -> log.error("[modules] job failed", t);

    /** Post a fire-and-forget job from any thread. */
    public void post(Runnable run) {
        q.add(Objects.requireNonNull(run, "run"));
    }

    @Override
    public void execute(Runnable command) {
        post(command);
    }

    /**
     * Error hook for jobs; runs on the owner thread. Defaults to logging.
     */
    public ScriptJobQueue setOnError(Consumer<Throwable> onError) {
        this.onError = Objects.requireNonNull(onError, "onError");
        return this;
    }

    /**
     * Drain queued jobs without time budget. Must be called on owner thread.
     * @return executed jobs count
     */
    public int drain(int maxJobs) {
        return drainBudgeted(maxJobs, 0L);
    }

    /**
     * Drain queued jobs with an optional time budget. Jobs posted while draining are picked up
     * in the same call.
     *
     * @param maxJobs         maximum jobs to execute (safety cap)
     * @param timeBudgetNanos 0 to disable time budget; otherwise stop when budget exceeded
     * @return executed jobs count
     */
    public int drainBudgeted(int maxJobs, long timeBudgetNanos) {
        int limit = Math.max(0, maxJobs);
        long deadline = (timeBudgetNanos > 0L) ? (System.nanoTime() + timeBudgetNanos) : Long.MAX_VALUE;

        int n = 0;
        while (n < limit) {
            Runnable j = q.poll();
            if (j == null) break;

            try {
                j.run();
            } catch (RuntimeException | Error t) {
                onError.accept(t);
            }
            n++;

            if ((n & 0x3F) == 0 && System.nanoTime() >= deadline) break;
        }
        return n;
    }

    public void clear() {
        int dropped = q.size();
        q.clear();
        if (dropped > 0) log.debug("[modules] jobs: dropped {} queued job(s)", dropped);
    }

    public boolean isEmpty() {
        return q.isEmpty();
    }

    public int size() {
        return q.size();
    }
}
