package io.validator.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.validator.core.withdraw.ScheduleStatus;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

public final class SchedulerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();

    private SchedulerMetrics() {}

    public static void recordResult(String scheduler, ScheduleStatus status) {
        Counter.builder("withdraw.schedule.results")
                .description("Balance withdraw scheduling outcomes")
                .tag("scheduler", scheduler)
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public static void recordAdmission(String scheduler, Runnable admission) {
        Timer.builder("withdraw.admission.time")
                .description("Time spent admitting one batch of withdraws")
                .tag("scheduler", scheduler)
                .register(registry)
                .record(admission);
    }

    public static void settlementApplied(String scheduler) {
        registry.counter("withdraw.settlements.applied", "scheduler", scheduler).increment();
    }

    public static void settlementIgnored(String scheduler) {
        registry.counter("withdraw.settlements.ignored", "scheduler", scheduler).increment();
    }

    public static void recordEvictions(String scheduler, int count) {
        registry.counter("withdraw.cache.evictions", "scheduler", scheduler).increment(count);
    }

    public static double resultCount(String scheduler, ScheduleStatus status) {
        Counter counter = registry.find("withdraw.schedule.results")
                .tag("scheduler", scheduler)
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .counter();
        return counter == null ? 0.0 : counter.count();
    }

    /** Time one {@code /metrics} request; {@code target} is the scheduler asked for, or "all". */
    public static void recordScrape(String target, int status, long nanos) {
        Timer.builder("withdraw.metrics.scrapes")
                .description("Metrics scrape requests")
                .tag("target", target)
                .tag("status", Integer.toString(status))
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    public static boolean hasScheduler(String scheduler) {
        return !registry.find("withdraw.schedule.results").tag("scheduler", scheduler).meters().isEmpty()
                || !registry.find("withdraw.settlements.applied").tag("scheduler", scheduler).meters().isEmpty()
                || !registry.find("withdraw.settlements.ignored").tag("scheduler", scheduler).meters().isEmpty();
    }

    public static String scrapeMetrics() {
        return scrapeMetrics(null);
    }

    /** Text scrape of the meters tagged with {@code scheduler}, or of every meter when it is null. */
    public static String scrapeMetrics(String scheduler) {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            if (scheduler != null && !scheduler.equals(m.getId().getTag("scheduler"))) {
                continue;
            }
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                for (Tag tag : m.getId().getTags()) {
                    sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
                }
                sb.append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
