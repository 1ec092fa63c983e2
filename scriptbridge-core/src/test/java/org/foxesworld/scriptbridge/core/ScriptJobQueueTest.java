package org.foxesworld.scriptbridge.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScriptJobQueueTest {

    @Test
    void jobsPostedElsewhereRunOnTheDrainingThread() throws InterruptedException {
        ScriptJobQueue jobs = new ScriptJobQueue();
        AtomicReference<Thread> ranOn = new AtomicReference<>();

        Thread poster = new Thread(() -> jobs.post(() -> ranOn.set(Thread.currentThread())));
        poster.start();
        poster.join();

        assertEquals(1, jobs.size());
        assertEquals(1, jobs.drain(16));
        assertSame(Thread.currentThread(), ranOn.get());
        assertTrue(jobs.isEmpty());
    }

    @Test
    void drainIsCapped() {
        ScriptJobQueue jobs = new ScriptJobQueue();
        AtomicInteger ran = new AtomicInteger();
        for (int i = 0; i < 5; i++) jobs.execute(ran::incrementAndGet);

        assertEquals(2, jobs.drain(2));
        assertEquals(2, ran.get());
        assertEquals(3, jobs.size());
    }

    @Test
    void failingJobGoesToErrorHookAndDrainContinues() {
        List<Throwable> errors = new ArrayList<>();
        ScriptJobQueue jobs = new ScriptJobQueue().setOnError(errors::add);
        AtomicInteger ran = new AtomicInteger();

        jobs.post(() -> {
            throw new IllegalStateException("boom");
        });
        jobs.post(ran::incrementAndGet);

        assertEquals(2, jobs.drain(16));
        assertEquals(1, ran.get());
        assertEquals(1, errors.size());
        assertEquals("boom", errors.get(0).getMessage());
    }

    @Test
    void jobsPostedWhileDrainingRunInSameCall() {
        ScriptJobQueue jobs = new ScriptJobQueue();
        AtomicInteger ran = new AtomicInteger();
        jobs.post(() -> {
            ran.incrementAndGet();
            jobs.post(ran::incrementAndGet);
        });

        assertEquals(2, jobs.drain(16));
        assertEquals(2, ran.get());
    }

    @Test
    void timeBudgetStopsDrainingEarly() {
        ScriptJobQueue jobs = new ScriptJobQueue();
        AtomicInteger ran = new AtomicInteger();
        jobs.post(() -> {
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ran.incrementAndGet();
        });
        for (int i = 0; i < 199; i++) jobs.post(ran::incrementAndGet);

        // the budget is checked every 64 jobs
        assertEquals(64, jobs.drainBudgeted(1_000, 1_000L));
        assertEquals(136, jobs.size());

        assertEquals(136, jobs.drainBudgeted(1_000, 0L));
        assertEquals(200, ran.get());
    }

    @Test
    void clearDropsQueuedJobs() {
        ScriptJobQueue jobs = new ScriptJobQueue();
        AtomicInteger ran = new AtomicInteger();
        jobs.post(ran::incrementAndGet);
        jobs.clear();

        assertEquals(0, jobs.drain(16));
        assertEquals(0, ran.get());
    }
}
