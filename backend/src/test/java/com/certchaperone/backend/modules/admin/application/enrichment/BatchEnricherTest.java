package com.certchaperone.backend.modules.admin.application.enrichment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.certchaperone.backend.global.error.ErrorCode;
import com.certchaperone.backend.global.error.ProblemException;
import com.certchaperone.backend.modules.admin.application.AdminQueryRunner;
import com.certchaperone.backend.modules.admin.application.AdminRequestContext;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class BatchEnricherTest {

    private final Clock clock = Clock.system(ZoneOffset.UTC);
    private ThreadPoolTaskExecutor executor;
    private AdminQueryRunner queryRunner;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(8);
        executor.setThreadNamePrefix("enricher-test-");
        executor.initialize();
        queryRunner = new AdminQueryRunner(executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void resolvesEachDistinctKeyOnce() {
        BatchEnricher enricher = new BatchEnricher(queryRunner, 10);
        Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        Map<String, String> result = enricher.resolve(List.of("a", "b", "a", "c"),
                key -> {
                    calls.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
                    return Optional.of(key.toUpperCase());
                },
                context(Duration.ofSeconds(5)));

        assertThat(result).containsExactlyInAnyOrderEntriesOf(Map.of("a", "A", "b", "B", "c", "C"));
        assertThat(calls.values()).allSatisfy(count -> assertThat(count.get()).isEqualTo(1));
    }

    @Test
    void failedOrEmptyLookupsAreLeftOut() {
        BatchEnricher enricher = new BatchEnricher(queryRunner, 10);

        Map<String, String> result = enricher.resolve(List.of("ok", "missing", "boom"),
                key -> switch (key) {
                    case "ok" -> Optional.of("found");
                    case "missing" -> Optional.empty();
                    default -> throw new IllegalStateException("identity backend down");
                },
                context(Duration.ofSeconds(5)));

        assertThat(result).containsOnlyKeys("ok");
    }

    @Test
    void concurrencyNeverExceedsBatchSize() {
        BatchEnricher enricher = new BatchEnricher(queryRunner, 2);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();

        Map<Integer, Integer> result = enricher.resolve(List.of(1, 2, 3, 4, 5),
                key -> {
                    int current = inFlight.incrementAndGet();
                    maxInFlight.accumulateAndGet(current, Math::max);
                    sleep(30);
                    inFlight.decrementAndGet();
                    return Optional.of(key * 10);
                },
                context(Duration.ofSeconds(5)));

        assertThat(result).hasSize(5);
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void deadlineAbortsEnrichment() {
        BatchEnricher enricher = new BatchEnricher(queryRunner, 10);

        assertThatThrownBy(() -> enricher.resolve(List.of(UUID.randomUUID()),
                key -> {
                    sleep(2_000);
                    return Optional.of("late");
                },
                context(Duration.ofMillis(100))))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getErrorCode())
                .isEqualTo(ErrorCode.DEADLINE_EXCEEDED);
    }

    @Test
    void lookupsStillQueuedAtTheDeadlineNeverStart() throws InterruptedException {
        ThreadPoolTaskExecutor singleThread = new ThreadPoolTaskExecutor();
        singleThread.setCorePoolSize(1);
        singleThread.setMaxPoolSize(1);
        singleThread.setThreadNamePrefix("enricher-single-");
        singleThread.initialize();
        try {
            BatchEnricher enricher = new BatchEnricher(new AdminQueryRunner(singleThread, clock), 5);
            AtomicInteger started = new AtomicInteger();
            AtomicInteger interrupted = new AtomicInteger();

            assertThatThrownBy(() -> enricher.resolve(List.of(1, 2, 3, 4, 5),
                    key -> {
                        started.incrementAndGet();
                        try {
                            Thread.sleep(200);
                        } catch (InterruptedException ex) {
                            interrupted.incrementAndGet();
                            Thread.currentThread().interrupt();
                        }
                        return Optional.of(key);
                    },
                    context(Duration.ofMillis(100))))
                    .isInstanceOf(ProblemException.class)
                    .extracting(ex -> ((ProblemException) ex).getErrorCode())
                    .isEqualTo(ErrorCode.DEADLINE_EXCEEDED);

            Thread.sleep(600);
            assertThat(started.get()).isEqualTo(1);
            assertThat(interrupted.get()).isEqualTo(1);
        } finally {
            singleThread.shutdown();
        }
    }

    @Test
    void nullKeysAreIgnored() {
        BatchEnricher enricher = new BatchEnricher(queryRunner, 10);

        Map<String, String> result = enricher.resolve(Arrays.asList("x", null),
                key -> Optional.of("v"), context(Duration.ofSeconds(5)));

        assertThat(result).containsOnlyKeys("x");
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        assertThatThrownBy(() -> new BatchEnricher(queryRunner, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private AdminRequestContext context(Duration timeout) {
        return AdminRequestContext.start(UUID.randomUUID(), UUID.randomUUID(), "admin@example.com", clock, timeout);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
