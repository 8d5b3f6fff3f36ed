package com.cityhunt;

import com.cityhunt.progress.ProgressModels.ProgressRecord;
import com.cityhunt.progress.ProgressStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ProgressStoreTest {
    @Autowired
    private ProgressStore progressStore;

    @Test
    void readsZeroRecordForUnknownGroup() {
        ProgressRecord progress = progressStore.read("ps-never-seen");
        assertEquals(0, progress.highestReachedStage());
        assertTrue(progress.completedStages().isEmpty());
        assertNull(progress.lastUpdated());
    }

    @Test
    void appliesCompletionAsUnionAndMax() {
        progressStore.applyCompletion("ps-union", 2);
        progressStore.applyCompletion("ps-union", 1);
        ProgressRecord updated = progressStore.applyCompletion("ps-union", 3);

        assertEquals(3, updated.highestReachedStage());
        assertEquals(List.of(1, 2, 3), updated.completedStages());
        assertNotNull(updated.lastUpdated());
        assertEquals(updated.completedStages(), progressStore.read("ps-union").completedStages());

        ProgressRecord lower = progressStore.applyCompletion("ps-union", 1);
        assertEquals(3, lower.highestReachedStage());
    }

    @Test
    void repeatedCompletionIsIdempotent() {
        ProgressRecord first = progressStore.applyCompletion("ps-idem", 1);
        ProgressRecord second = progressStore.applyCompletion("ps-idem", 1);
        assertEquals(first.highestReachedStage(), second.highestReachedStage());
        assertEquals(first.completedStages(), second.completedStages());
        assertFalse(second.lastUpdated().isBefore(first.lastUpdated()));
    }

    @Test
    void concurrentCompletionsForDistinctStagesAreAllKept() throws Exception {
        int stages = 8;
        List<ProgressRecord> results = runConcurrently(stages, i -> progressStore.applyCompletion("ps-race", i + 1));

        ProgressRecord finalState = progressStore.read("ps-race");
        assertEquals(IntStream.rangeClosed(1, stages).boxed().toList(), finalState.completedStages());
        assertEquals(stages, finalState.highestReachedStage());
        assertEquals(stages, results.size());
    }

    @Test
    void concurrentCompletionsForSameStageCollapse() throws Exception {
        runConcurrently(6, i -> progressStore.applyCompletion("ps-same", 1));

        ProgressRecord finalState = progressStore.read("ps-same");
        assertEquals(List.of(1), finalState.completedStages());
        assertEquals(1, finalState.highestReachedStage());
    }

    private List<ProgressRecord> runConcurrently(int workers, IntFunctionTask task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ProgressRecord>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                int index = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.apply(index);
                }));
            }
            start.countDown();
            List<ProgressRecord> results = new ArrayList<>();
            for (Future<ProgressRecord> f : futures) {
                results.add(f.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface IntFunctionTask {
        ProgressRecord apply(int index);
    }
}
