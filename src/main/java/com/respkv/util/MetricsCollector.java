package com.respkv.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Metrics collector for RespKV.
 * Tracks commands, latency, errors, connections and store size.
 */
public class MetricsCollector {

    private final MeterRegistry registry;

    private final Map<String, Counter> commandCounters = new ConcurrentHashMap<>();
    private final Map<String, Timer> commandTimers = new ConcurrentHashMap<>();

    private final Counter getHits;
    private final Counter getMisses;
    private final Counter protocolErrors;
    private final Counter commandErrors;
    private final Counter internalErrors;

    private final LongAdder activeConnections;
    private final LongAdder totalConnections;

    /**
     * Create a metrics collector with a simple registry.
     */
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create a metrics collector with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;

        this.getHits = Counter.builder("respkv.cache")
            .tag("result", "hit")
            .description("GET requests that found a value")
            .register(registry);

        this.getMisses = Counter.builder("respkv.cache")
            .tag("result", "miss")
            .description("GET requests that found nothing")
            .register(registry);

        this.protocolErrors = errorCounter("protocol");
        this.commandErrors = errorCounter("command");
        this.internalErrors = errorCounter("internal");

        this.activeConnections = new LongAdder();
        this.totalConnections = new LongAdder();

        Gauge.builder("respkv.connections", activeConnections, LongAdder::sum)
            .description("Active connections")
            .register(registry);
    }

    private Counter errorCounter(String kind) {
        return Counter.builder("respkv.errors")
            .tag("kind", kind)
            .description("Errors by kind")
            .register(registry);
    }

    /**
     * Publish store gauges backed by the given suppliers.
     *
     * @param size    live entry count
     * @param expired entries removed by expiration so far
     */
    public void bindStore(Supplier<Number> size, Supplier<Number> expired) {
        Gauge.builder("respkv.store.size", size)
            .description("Number of entries in store")
            .register(registry);
        Gauge.builder("respkv.store.expired", expired)
            .description("Entries removed because their TTL passed")
            .register(registry);
    }

    // Command recording

    public void recordCommand(String command, long durationNanos) {
        commandCounters.computeIfAbsent(command, name -> Counter.builder("respkv.commands")
            .tag("command", name)
            .description("Commands processed")
            .register(registry)).increment();
        commandTimers.computeIfAbsent(command, name -> Timer.builder("respkv.latency")
            .tag("command", name)
            .description("Command latency")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry)).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordGetResult(boolean hit) {
        if (hit) {
            getHits.increment();
        } else {
            getMisses.increment();
        }
    }

    public void recordProtocolError() {
        protocolErrors.increment();
    }

    public void recordCommandError() {
        commandErrors.increment();
    }

    public void recordInternalError() {
        internalErrors.increment();
    }

    // Connection tracking

    public void connectionOpened() {
        activeConnections.increment();
        totalConnections.increment();
    }

    public void connectionClosed() {
        activeConnections.decrement();
    }

    // Getters for metrics values

    public long getCommandCount(String command) {
        Counter counter = commandCounters.get(command);
        return counter != null ? (long) counter.count() : 0;
    }

    public long getProtocolErrors() {
        return (long) protocolErrors.count();
    }

    public long getCommandErrors() {
        return (long) commandErrors.count();
    }

    public long getInternalErrors() {
        return (long) internalErrors.count();
    }

    public long getActiveConnections() {
        return activeConnections.sum();
    }

    public long getTotalConnections() {
        return totalConnections.sum();
    }

    public double getHitRate() {
        double hits = getHits.count();
        double misses = getMisses.count();
        double total = hits + misses;
        return total > 0 ? hits / total : 0.0;
    }

    public double getMeanLatencyMs(String command) {
        Timer timer = commandTimers.get(command);
        return timer != null ? timer.mean(TimeUnit.MILLISECONDS) : 0.0;
    }

    /**
     * Get the underlying registry.
     *
     * @return the MeterRegistry
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Print a summary of current metrics.
     *
     * @return formatted metrics string
     */
    public String summary() {
        return String.format(
            "RespKV Metrics Summary%n" +
            "======================%n" +
            "Commands: GET=%d, SET=%d, PING=%d, unknown=%d%n" +
            "Cache: hitRate=%.2f%%%n" +
            "Errors: protocol=%d, command=%d, internal=%d%n" +
            "Connections: %d active, %d total%n" +
            "Latency (mean): GET=%.3fms, SET=%.3fms",
            getCommandCount("get"), getCommandCount("set"), getCommandCount("ping"),
            getCommandCount("unknown"),
            getHitRate() * 100,
            getProtocolErrors(), getCommandErrors(), getInternalErrors(),
            getActiveConnections(), getTotalConnections(),
            getMeanLatencyMs("get"), getMeanLatencyMs("set")
        );
    }
}
