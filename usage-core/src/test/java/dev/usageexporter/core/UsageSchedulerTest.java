package dev.usageexporter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("UsageScheduler")
@ExtendWith(MockitoExtension.class)
class UsageSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Project PROJECT = new Project("p1", "genomics", "d1", "alpha");

    @Mock
    private UsageSource usageSource;

    @Mock
    private WeightSource weightSource;

    @Mock
    private StartDateSource startDateSource;

    private final List<Snapshot> published = new ArrayList<>();
    private UsageScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        lenient().when(startDateSource.current()).thenReturn(START);
        lenient().when(weightSource.current()).thenReturn(WeightTable.NEUTRAL);
        lenient().when(usageSource.collect(any(), any(), any()))
                .thenReturn(List.of(new UsageSample(PROJECT, 1000, 10)));
        scheduler = scheduler(3);
    }

    private UsageScheduler scheduler(int weightUpdateFrequency) {
        return new UsageScheduler(usageSource, weightSource, startDateSource, DomainFilter.acceptAll(),
                new Aggregator(), published::add, weightUpdateFrequency, Duration.ofSeconds(10),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Snapshot last() {
        return published.get(published.size() - 1);
    }

    @Nested
    @DisplayName("Weight and start date cadence")
    class Cadence {

        @Test
        @DisplayName("should refresh on tick 0 and then every N ticks")
        void shouldRefreshEveryNTicks() {
            when(weightSource.current()).thenReturn(
                    new WeightTable(1.0, 1.0), new WeightTable(2.0, 2.0), new WeightTable(3.0, 3.0));

            for (int i = 0; i < 7; i++) {
                scheduler.tick();
            }

            verify(weightSource, times(3)).current();
            verify(startDateSource, times(3)).current();
            assertEquals(new WeightTable(1.0, 1.0), published.get(0).weights());
            assertEquals(new WeightTable(1.0, 1.0), published.get(1).weights());
            assertEquals(new WeightTable(1.0, 1.0), published.get(2).weights());
            assertEquals(new WeightTable(2.0, 2.0), published.get(3).weights());
            assertEquals(new WeightTable(2.0, 2.0), published.get(5).weights());
            assertEquals(new WeightTable(3.0, 3.0), published.get(6).weights());
        }

        @Test
        @DisplayName("should use freshly fetched weights on the refreshing tick itself")
        void refreshingTickUsesNewWeights() {
            when(weightSource.current()).thenReturn(new WeightTable(0.5, 2.0));

            scheduler.tick();

            assertEquals(500.0, last().find("genomics", UsageMetric.TOTAL_MEMORY_MB_USAGE).orElseThrow().value);
            assertEquals(20.0, last().find("genomics", UsageMetric.TOTAL_VCPUS_USAGE).orElseThrow().value);
        }

        @Test
        @DisplayName("should refresh before collecting usage")
        void refreshPrecedesCollection() throws Exception {
            scheduler.tick();

            InOrder order = inOrder(weightSource, startDateSource, usageSource);
            order.verify(weightSource).current();
            order.verify(startDateSource).current();
            order.verify(usageSource).collect(any(), eq(START), eq(NOW));
        }

        @Test
        @DisplayName("should refresh on every tick when the frequency is 1")
        void frequencyOne() {
            UsageScheduler everyTick = scheduler(1);
            everyTick.tick();
            everyTick.tick();
            verify(weightSource, times(2)).current();
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class Failures {

        @Test
        @DisplayName("should keep the previous snapshot when collection fails")
        void shouldKeepPreviousSnapshot() throws Exception {
            when(usageSource.collect(any(), any(), any()))
                    .thenReturn(List.of(new UsageSample(PROJECT, 1000, 10)))
                    .thenThrow(new SourceUnavailableException("compute API timed out"))
                    .thenReturn(List.of(new UsageSample(PROJECT, 2000, 20)));

            scheduler.tick();
            Snapshot before = last();
            scheduler.tick();

            assertEquals(1, published.size());
            assertSame(before, last());
            assertEquals(1, scheduler.status().failedTicks);

            scheduler.tick();
            assertEquals(2, published.size());
            assertEquals(2000.0, last().find("genomics", UsageMetric.TOTAL_MEMORY_MB_USAGE).orElseThrow().value);
        }

        @Test
        @DisplayName("should survive unexpected runtime errors")
        void shouldSurviveRuntimeErrors() throws Exception {
            when(usageSource.collect(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

            scheduler.tick();
            scheduler.tick();

            assertTrue(published.isEmpty());
            assertEquals(2, scheduler.status().ticks);
            assertEquals(2, scheduler.status().failedTicks);
        }

        @Test
        @DisplayName("should still count the tick towards the refresh cadence")
        void failedTicksCountTowardsCadence() throws Exception {
            when(usageSource.collect(any(), any(), any()))
                    .thenThrow(new SourceUnavailableException("down"))
                    .thenReturn(List.of());

            for (int i = 0; i < 4; i++) {
                scheduler.tick();
            }

            verify(weightSource, times(2)).current();
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should not start a tick after shutdown was requested")
        void noTickAfterStop() throws Exception {
            scheduler.stop();
            scheduler.tick();

            verify(usageSource, never()).collect(any(), any(), any());
            assertTrue(published.isEmpty());
        }

        @Test
        @DisplayName("should record the last successful tick")
        void recordsLastSuccess() {
            scheduler.tick();
            UsageScheduler.Status status = scheduler.status();
            assertEquals(NOW, status.lastSuccess);
            assertEquals(START, status.windowStart);
            assertEquals(1, status.ticks);
        }

        @Test
        @DisplayName("should reject a non-positive refresh frequency")
        void rejectsInvalidFrequency() {
            assertThrows(IllegalArgumentException.class, () -> scheduler(0));
        }
    }
}
