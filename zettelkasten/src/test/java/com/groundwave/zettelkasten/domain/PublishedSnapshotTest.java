package com.groundwave.zettelkasten.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

class PublishedSnapshotTest {

    @Test
    void testEmptyUntilPublished() {
        PublishedSnapshot<List<Integer>> snapshot = new PublishedSnapshot<>();

        assertTrue(snapshot.current().isEmpty());
        assertTrue(snapshot.read(List::size).isEmpty());

        snapshot.publish(List.of(1, 2, 3));

        assertEquals(List.of(1, 2, 3), snapshot.current().orElseThrow());
        assertEquals(3, snapshot.read(List::size).orElseThrow());
    }

    @Test
    void testReadersNeverSeeMixedSnapshots() throws Exception {
        PublishedSnapshot<List<Integer>> snapshot = new PublishedSnapshot<>();
        snapshot.publish(List.of(0, 0, 0, 0));

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            Future<?> writer = executor.submit(() -> {
                for (int i = 1; i <= 2000; i++) {
                    snapshot.publish(List.of(i, i, i, i));
                }
            });

            List<Future<Boolean>> readers = new ArrayList<>();
            for (int r = 0; r < 3; r++) {
                readers.add(executor.submit(() -> {
                    for (int i = 0; i < 2000; i++) {
                        boolean uniform = snapshot.read(values -> values.stream().distinct().count() == 1)
                            .orElse(false);
                        if (!uniform) {
                            return false;
                        }
                    }
                    return true;
                }));
            }

            writer.get(10, TimeUnit.SECONDS);
            for (Future<Boolean> reader : readers) {
                assertTrue(reader.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
