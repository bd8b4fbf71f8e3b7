package com.feedreader.ingest.feed.sink;

import com.feedreader.ingest.feed.epoch.FetchEpochGuard;
import com.feedreader.ingest.feed.model.FetchEpoch;
import com.feedreader.ingest.feed.model.ViewSnapshot;
import com.feedreader.ingest.feed.view.InMemoryFeedView;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class EpochGuardedSinkTest {
    private UiEventLoop loop;
    private FetchEpochGuard guard;
    private InMemoryFeedView view;

    @BeforeEach
    void setUp() {
        loop = new UiEventLoop("test-ui");
        guard = new FetchEpochGuard();
        view = new InMemoryFeedView("main");
    }

    @AfterEach
    void tearDown() {
        loop.shutdown();
    }

    @Test
    void staleEpochCannotTouchTheView() throws Exception {
        FetchEpoch first = guard.beginNewEpoch("main");
        EpochGuardedSink stale = new EpochGuardedSink(view, first.id(), guard, loop, null);
        FetchEpoch second = guard.beginNewEpoch("main");
        EpochGuardedSink current = new EpochGuardedSink(view, second.id(), guard, loop, null);

        current.setLabel("World - Current");
        current.addItem("Fresh", "https://example.com/fresh", null, "world", "Current");
        stale.setLabel("World - Stale");
        stale.clearItems();
        stale.addItem("Old", "https://example.com/old", null, "world", "Stale");
        assertThat(loop.awaitIdle(2000)).isTrue();

        ViewSnapshot snapshot = view.snapshot();
        assertThat(snapshot.label()).isEqualTo("World - Current");
        assertThat(snapshot.items()).extracting(ViewSnapshot.ViewItem::url).containsExactly("https://example.com/fresh");
    }

    @Test
    void callsIssuedBeforeSupersessionAreDroppedOnTheLoop() throws Exception {
        FetchEpoch first = guard.beginNewEpoch("main");
        EpochGuardedSink sink = new EpochGuardedSink(view, first.id(), guard, loop, null);

        loop.post(() -> guard.beginNewEpoch("main"));
        sink.addItem("Late", "https://example.com/late", null, "world", "Source");
        assertThat(loop.awaitIdle(2000)).isTrue();

        assertThat(view.itemCount()).isZero();
    }

    @Test
    void clearRunsAtMostOncePerEpoch() throws Exception {
        FetchEpoch epoch = guard.beginNewEpoch("main");
        EpochGuardedSink sink = new EpochGuardedSink(view, epoch.id(), guard, loop, null);

        sink.clearItems();
        sink.addItem("One", "https://example.com/1", null, "world", "A");
        sink.clearItems();
        sink.addItem("Two", "https://example.com/2", null, "world", "B");
        assertThat(loop.awaitIdle(2000)).isTrue();

        assertThat(view.itemCount()).isEqualTo(2);
    }

    @Test
    void listenerSeesOnlyAppliedCalls() throws Exception {
        AtomicInteger labels = new AtomicInteger();
        AtomicInteger items = new AtomicInteger();
        EpochGuardedSink.Listener listener = new EpochGuardedSink.Listener() {
            @Override
            public void onLabel(String text) {
                labels.incrementAndGet();
            }

            @Override
            public void onItemAdded() {
                items.incrementAndGet();
            }
        };
        FetchEpoch epoch = guard.beginNewEpoch("main");
        EpochGuardedSink sink = new EpochGuardedSink(view, epoch.id(), guard, loop, listener);

        sink.setLabel("World - A");
        sink.addItem("One", "https://example.com/1", null, "world", "A");
        guard.beginNewEpoch("main");
        sink.addItem("Two", "https://example.com/2", null, "world", "A");
        assertThat(loop.awaitIdle(2000)).isTrue();

        assertThat(labels.get()).isLessThanOrEqualTo(1);
        assertThat(items.get()).isLessThanOrEqualTo(1);
        assertThat(view.itemCount()).isEqualTo(items.get());
    }
}
