package com.tripbooking.trip.domain.reference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RandomReferenceGeneratorTest {

    private final RandomReferenceGenerator generator = new RandomReferenceGenerator();

    @Test
    @DisplayName("next returns 22 alphanumeric characters")
    void next_shape() {
        String ref = generator.next();

        assertThat(ref).hasSize(RandomReferenceGenerator.LENGTH);
        assertThat(ref).matches("[0-9A-Za-z]+");
    }

    @Test
    @DisplayName("next never repeats across concurrent callers")
    void next_concurrentCallers_unique() throws Exception {
        int threads = 8;
        int perThread = 5_000;
        Set<String> refs = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                tasks.add(() -> {
                    for (int i = 0; i < perThread; i++) {
                        refs.add(generator.next());
                    }
                    return null;
                });
            }
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }

        assertThat(refs).hasSize(threads * perThread);
    }
}
