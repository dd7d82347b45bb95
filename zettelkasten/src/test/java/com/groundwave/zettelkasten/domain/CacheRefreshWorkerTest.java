package com.groundwave.zettelkasten.domain;

import com.groundwave.zettelkasten.support.InMemoryNoteSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.groundwave.zettelkasten.domain.ZettelkastenCacheTest.*;
import static com.groundwave.zettelkasten.support.OrgNotes.*;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class CacheRefreshWorkerTest {

    private final InMemoryNoteSource source = new InMemoryNoteSource()
        .main("a.org", note(ID_2, "A", link(ID_3) + "\n"))
        .main("b.org", note(ID_3, "B", ""));
    private final ZettelkastenCache cache = newCache(source);

    private CacheRefreshWorker worker;

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.stop();
        }
    }

    @Test
    void testRefreshesAfterStartupDelay() {
        worker = new CacheRefreshWorker(cache, true, Duration.ofMillis(50), Duration.ofHours(1), Duration.ofMinutes(1));
        worker.init();

        await().atMost(Duration.ofSeconds(5)).until(() -> worker.getCompletedRefreshes() == 1);
        assertEquals(List.of(ID_2), cache.getBacklinks(ID_3));
        assertTrue(worker.isRunning());
    }

    @Test
    void testRefreshesEveryInterval() {
        worker = new CacheRefreshWorker(cache, true, Duration.ZERO, Duration.ofMillis(50), Duration.ofMinutes(1));
        worker.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> worker.getCompletedRefreshes() >= 3);
    }

    @Test
    void testRefreshNowSkipsRemainingDelay() {
        worker = new CacheRefreshWorker(cache, true, Duration.ofHours(1), Duration.ofHours(1), Duration.ofMinutes(1));
        worker.start();
        assertEquals(0, worker.getCompletedRefreshes());

        worker.refreshNow();

        await().atMost(Duration.ofSeconds(5)).until(() -> worker.getCompletedRefreshes() == 1);
        assertTrue(cache.getLastLinkBuildAt().isPresent());
    }

    @Test
    void testStopEndsLoopWithoutRefreshing() {
        worker = new CacheRefreshWorker(cache, true, Duration.ofHours(1), Duration.ofHours(1), Duration.ofMinutes(1));
        worker.start();

        worker.stop();

        assertFalse(worker.isRunning());
        assertEquals(0, worker.getCompletedRefreshes());
        assertTrue(cache.getLastLinkBuildAt().isEmpty());
    }

    @Test
    void testDisabledWorkerDoesNotStart() {
        worker = new CacheRefreshWorker(cache, false, Duration.ZERO, Duration.ofMillis(10), Duration.ofMinutes(1));
        worker.init();

        assertFalse(worker.isRunning());
        assertEquals(0, source.getListCalls());
    }

    @Test
    void testFailedRefreshKeepsLoopRunning() {
        source.failMainListing(503);
        worker = new CacheRefreshWorker(cache, true, Duration.ZERO, Duration.ofMillis(20), Duration.ofMinutes(1));
        worker.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> source.getListCalls() >= 3);
        assertEquals(0, worker.getCompletedRefreshes());
        assertTrue(worker.isRunning());
    }
}
