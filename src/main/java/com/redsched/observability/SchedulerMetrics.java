package com.redsched.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for the tick loop.
 */
@Component
public class SchedulerMetrics {

    private final MeterRegistry registry;
    private final AtomicLong scheduleSize = new AtomicLong(0);

    public SchedulerMetrics(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge("redsched.schedule.size", scheduleSize);
    }

    // --- Dispatch metrics ---

    public void recordDispatched(String task) {
        Counter.builder("redsched.entries.dispatched")
                .tag("task", task)
                .register(registry).increment();
    }

    public void recordDispatchFailure(String task) {
        Counter.builder("redsched.dispatch.failures")
                .tag("task", task)
                .register(registry).increment();
    }

    // --- Tick metrics ---

    public void recordTickFailure() {
        Counter.builder("redsched.tick.failures")
                .description("Ticks aborted because the store was unavailable")
                .register(registry).increment();
    }

    public void recordCorruptEntry() {
        Counter.builder("redsched.entries.corrupt")
                .description("Indexed entries whose stored record could not be decoded")
                .register(registry).increment();
    }

    public Timer.Sample startTickTimer() {
        return Timer.start(registry);
    }

    public void stopTickTimer(Timer.Sample sample) {
        sample.stop(Timer.builder("redsched.tick.latency").register(registry));
    }

    public void scheduleSize(int size) {
        scheduleSize.set(size);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
