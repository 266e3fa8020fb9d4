package dev.usageexporter.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polling loop that ties the sources, the aggregator and the sink together.
 *
 * Runs on a single thread with a fixed delay between ticks. Every
 * {@code weightUpdateFrequency} ticks (tick 0 included) the weight table and the start date are
 * refreshed before usage is collected, so a refreshing tick always exports with the new values.
 * A tick that fails leaves the previously published snapshot in place.
 */
public class UsageScheduler {
    private static final Logger logger = LoggerFactory.getLogger(UsageScheduler.class);

    private final UsageSource usageSource;
    private final WeightSource weightSource;
    private final StartDateSource startDateSource;
    private final DomainFilter filter;
    private final Aggregator aggregator;
    private final MetricsSink sink;
    private final int weightUpdateFrequency;
    private final Duration updateInterval;
    private final Clock clock;

    private final AtomicLong tickCount = new AtomicLong(0);
    private final AtomicLong failedTicks = new AtomicLong(0);
    private final AtomicReference<WeightTable> weights = new AtomicReference<>(WeightTable.NEUTRAL);
    private final AtomicReference<Instant> startDate;
    private final AtomicReference<Instant> lastSuccess = new AtomicReference<>();
    private volatile boolean shutdownRequested = false;

    private ScheduledExecutorService controller;

    public UsageScheduler(UsageSource usageSource,
                          WeightSource weightSource,
                          StartDateSource startDateSource,
                          DomainFilter filter,
                          Aggregator aggregator,
                          MetricsSink sink,
                          int weightUpdateFrequency,
                          Duration updateInterval,
                          Clock clock) {
        if (weightUpdateFrequency < 1) {
            throw new IllegalArgumentException("weightUpdateFrequency must be >= 1, got " + weightUpdateFrequency);
        }
        if (updateInterval.isNegative() || updateInterval.isZero()) {
            throw new IllegalArgumentException("updateInterval must be positive, got " + updateInterval);
        }
        this.usageSource = Objects.requireNonNull(usageSource, "usageSource");
        this.weightSource = Objects.requireNonNull(weightSource, "weightSource");
        this.startDateSource = Objects.requireNonNull(startDateSource, "startDateSource");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.weightUpdateFrequency = weightUpdateFrequency;
        this.updateInterval = updateInterval;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startDate = new AtomicReference<>(clock.instant());
    }

    /**
     * Start the polling loop. The first tick runs immediately.
     */
    public void start() {
        controller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "usage-scheduler");
            t.setDaemon(false);
            return t;
        });
        controller.scheduleWithFixedDelay(this::tick, 0, updateInterval.toMillis(), TimeUnit.MILLISECONDS);

        logger.info("UsageScheduler started: interval={}s, weight refresh every {} ticks, source={}, filter={}",
                updateInterval.toSeconds(), weightUpdateFrequency, usageSource.describe(), filter);
    }

    /**
     * Request shutdown. A tick already in progress finishes; no further tick starts.
     */
    public void stop() {
        shutdownRequested = true;
        if (controller != null) {
            controller.shutdown();
            try {
                if (!controller.awaitTermination(5, TimeUnit.SECONDS)) {
                    controller.shutdownNow();
                }
            } catch (InterruptedException e) {
                controller.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        logger.info("UsageScheduler stopped after {} ticks ({} failed)", tickCount.get(), failedTicks.get());
    }

    public void awaitTermination() throws InterruptedException {
        if (controller != null) {
            controller.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Run one collect/aggregate/publish cycle. Never throws for source failures.
     * Called by the polling loop; exposed for embedding and tests.
     */
    public void tick() {
        if (shutdownRequested) {
            return;
        }
        long tick = tickCount.getAndIncrement();
        try {
            if (tick % weightUpdateFrequency == 0) {
                refresh(tick);
            }
            WeightTable currentWeights = weights.get();
            Instant windowStart = startDate.get();
            Instant now = clock.instant();

            List<UsageSample> samples = usageSource.collect(filter, windowStart, now);
            Snapshot snapshot = aggregator.aggregate(samples, currentWeights, now);
            sink.publish(snapshot);
            lastSuccess.set(now);

            if (snapshot.isEmpty()) {
                logger.warn("Tick {}: no project matched {}, exporting nothing", tick, filter);
            } else {
                logger.info("Tick {}: exported {} projects ({} metrics) for window [{}, {})",
                        tick, samples.size(), snapshot.metrics().size(), windowStart, now);
            }
        } catch (SourceUnavailableException e) {
            failedTicks.incrementAndGet();
            logger.error("Tick {} aborted, keeping previous snapshot: {}", tick, e.getMessage());
            logger.debug("Source failure detail", e);
        } catch (RuntimeException e) {
            failedTicks.incrementAndGet();
            logger.error("Tick {} aborted by unexpected error, keeping previous snapshot", tick, e);
        }
    }

    private void refresh(long tick) {
        WeightTable nextWeights = weightSource.current();
        Instant nextStart = startDateSource.current();
        WeightTable previous = weights.getAndSet(nextWeights);
        Instant previousStart = startDate.getAndSet(nextStart);

        if (!nextWeights.equals(previous) || !nextStart.equals(previousStart)) {
            logger.info("Tick {}: weights now {}, usage window starts {}", tick, nextWeights, nextStart);
        } else {
            logger.debug("Tick {}: weights and start date unchanged", tick);
        }
    }

    public Status status() {
        return new Status(tickCount.get(), failedTicks.get(), weights.get(), startDate.get(), lastSuccess.get());
    }

    /**
     * Point-in-time view of the loop's counters, for self-monitoring.
     */
    public static final class Status {
        public final long ticks;
        public final long failedTicks;
        public final WeightTable weights;
        public final Instant windowStart;
        public final Instant lastSuccess;

        public Status(long ticks, long failedTicks, WeightTable weights, Instant windowStart, Instant lastSuccess) {
            this.ticks = ticks;
            this.failedTicks = failedTicks;
            this.weights = weights;
            this.windowStart = windowStart;
            this.lastSuccess = lastSuccess;
        }

        @Override
        public String toString() {
            return String.format("ticks=%d, failed=%d, %s, windowStart=%s, lastSuccess=%s",
                    ticks, failedTicks, weights, windowStart, lastSuccess);
        }
    }
}
