package com.feedreader.ingest.feed.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single consumer thread that owns all view state. Workers post closures here instead of touching views.
 */
public class UiEventLoop {
    private static final Logger log = LoggerFactory.getLogger(UiEventLoop.class);

    private final ScheduledExecutorService executor;
    private volatile Thread loopThread;

    public UiEventLoop(String name) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        };
        this.executor = Executors.newSingleThreadScheduledExecutor(factory);
    }

    public void post(Runnable task) {
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("UI loop is shut down, dropping task");
        }
    }

    public ScheduledFuture<?> schedule(Runnable task, long delayMs) {
        try {
            return executor.schedule(guarded(task), Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("UI loop is shut down, dropping scheduled task");
            return null;
        }
    }

    public boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * Waits until every task posted before this call has run. Delayed tasks are not waited for.
     */
    public boolean awaitIdle(long timeoutMs) throws InterruptedException {
        if (isLoopThread()) {
            return true;
        }
        CountDownLatch latch = new CountDownLatch(1);
        try {
            executor.execute(latch::countDown);
        } catch (RejectedExecutionException e) {
            return true;
        }
        return latch.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("UI task failed", e);
            }
        };
    }
}
