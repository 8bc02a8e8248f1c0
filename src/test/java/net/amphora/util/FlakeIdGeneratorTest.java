package net.amphora.util;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlakeIdGeneratorTest {

    @Test
    void next_isFixedWidthAndUrlSafe() {
        String id = new FlakeIdGenerator().next();

        assertThat(id).hasSize(11).matches("[-0-9A-Z_a-z]+");
    }

    @Test
    void next_sortsInGenerationOrder() {
        FlakeIdGenerator generator = new FlakeIdGenerator();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) {
            ids.add(generator.next());
        }

        assertThat(ids).isSorted();
        assertThat(new HashSet<>(ids)).hasSize(ids.size());
    }

    @Test
    void nextId_survivesFrozenClockAndSequenceOverflow() {
        Clock frozen = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        FlakeIdGenerator generator = new FlakeIdGenerator(frozen, 1);
        Set<Long> ids = new HashSet<>();
        long previous = -1;
        for (int i = 0; i < 10_000; i++) {
            long id = generator.nextId();
            assertThat(id).isGreaterThan(previous);
            previous = id;
            ids.add(id);
        }

        assertThat(ids).hasSize(10_000);
    }

    @Test
    void next_isUniqueAcrossThreads() throws InterruptedException {
        FlakeIdGenerator generator = new FlakeIdGenerator();
        Set<String> ids = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int t = 0; t < 4; t++) {
            executor.submit(() -> {
                for (int i = 0; i < 2_000; i++) {
                    ids.add(generator.next());
                }
            });
        }
        executor.shutdown();

        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(ids).hasSize(8_000);
    }

    @Test
    void encode_preservesNumericOrder() {
        assertThat(FlakeIdGenerator.encode(0L)).isEqualTo("-----------");
        assertThat(FlakeIdGenerator.encode(63L)).isEqualTo("----------z");
        assertThat(FlakeIdGenerator.encode(64L)).isGreaterThan(FlakeIdGenerator.encode(63L));
    }

    @Test
    void rejectsOutOfRangeWorker() {
        assertThatThrownBy(() -> new FlakeIdGenerator(Clock.systemUTC(), 1024))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
