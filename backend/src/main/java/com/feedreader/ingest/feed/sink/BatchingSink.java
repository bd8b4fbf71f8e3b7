package com.feedreader.ingest.feed.sink;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Spreads a burst of adds over several UI ticks so a large aggregation does not stall the loop.
 * Adds are queued from any thread and drained a fixed number per tick; once the queue runs dry the view
 * is told the category has drained.
 */
public class BatchingSink implements ResultSink {
    private final EpochGuardedSink delegate;
    private final UiEventLoop loop;
    private final int batchSize;
    private final long tickMs;
    private final String categoryId;
    private final Queue<PendingItem> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean drainScheduled = new AtomicBoolean();
    private final List<Runnable> afterDrain = new ArrayList<>();

    public BatchingSink(EpochGuardedSink delegate, UiEventLoop loop, int batchSize, long tickMs, String categoryId) {
        this.delegate = delegate;
        this.loop = loop;
        this.batchSize = Math.max(1, batchSize);
        this.tickMs = Math.max(1, tickMs);
        this.categoryId = categoryId;
    }

    @Override
    public void setLabel(String text) {
        delegate.setLabel(text);
    }

    @Override
    public void clearItems() {
        delegate.clearItems();
    }

    @Override
    public void addItem(String title, String url, String thumbnail, String categoryId, String sourceName) {
        pending.add(new PendingItem(title, url, thumbnail, categoryId, sourceName));
        scheduleDrain();
    }

    /**
     * Runs the task on the UI loop once nothing is queued, immediately if the queue is already empty.
     */
    public void whenDrained(Runnable task) {
        loop.post(() -> {
            if (pending.isEmpty() && !drainScheduled.get()) {
                task.run();
            } else {
                afterDrain.add(task);
            }
        });
    }

    public int pendingCount() {
        return pending.size();
    }

    private void scheduleDrain() {
        if (drainScheduled.compareAndSet(false, true)) {
            loop.schedule(this::drainTick, tickMs);
        }
    }

    private void drainTick() {
        for (int i = 0; i < batchSize; i++) {
            PendingItem item = pending.poll();
            if (item == null) {
                break;
            }
            delegate.addItemNow(item.title(), item.url(), item.thumbnail(), item.categoryId(), item.sourceName());
        }
        if (!pending.isEmpty()) {
            loop.schedule(this::drainTick, tickMs);
            return;
        }
        drainScheduled.set(false);
        // an add may have slipped in between the emptiness check and the flag reset
        if (!pending.isEmpty()) {
            scheduleDrain();
            return;
        }
        delegate.notifyDrainedNow(categoryId);
        List<Runnable> waiting = new ArrayList<>(afterDrain);
        afterDrain.clear();
        waiting.forEach(Runnable::run);
    }

    private record PendingItem(
        String title,
        String url,
        String thumbnail,
        String categoryId,
        String sourceName
    ) {
    }
}
