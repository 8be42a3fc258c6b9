package io.continuum.core.memory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Purges expired short-term memories on a fixed interval. Purge failures are logged and the next run goes
 * ahead as scheduled.
 */
public final class MemoryJanitor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryJanitor.class);

    private final MemoryStore memoryStore;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private boolean started;

    public MemoryJanitor(MemoryStore memoryStore, Duration interval) {
        if (memoryStore == null) {
            throw new IllegalArgumentException("memoryStore must not be null");
        }
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.memoryStore = memoryStore;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "continuum-memory-janitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        long periodMs = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::runOnce, periodMs, periodMs, TimeUnit.MILLISECONDS);
        LOG.info("Memory janitor started, interval={}", interval);
    }

    /**
     * @return rows purged, or -1 when the purge failed
     */
    public int runOnce() {
        try {
            int removed = memoryStore.purgeExpiredShortTermMemories();
            LOG.debug("Janitor pass removed {} short-term memories", removed);
            return removed;
        } catch (Exception e) {
            LOG.warn("Short-term memory purge failed", e);
            return -1;
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        LOG.debug("Memory janitor stopped");
    }
}
