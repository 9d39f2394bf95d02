package io.validator.core.rpc;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.validator.core.metrics.SchedulerMetrics;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * {@code GET /metrics} returns every scheduler meter; {@code GET /metrics?scheduler=eager}
 * narrows the scrape to one scheduler and answers 404 for a scheduler that never recorded anything.
 */
public final class MetricsHandler implements HttpHandler {
    @Override
    public void handle(HttpExchange exchange) throws IOException {
        long started = System.nanoTime();
        String target = "all";
        int status = 500;
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                status = sendPlain(exchange, 405, "Method Not Allowed");
                return;
            }
            String scheduler;
            try {
                scheduler = schedulerParam(exchange.getRequestURI().getRawQuery());
            } catch (IllegalArgumentException e) {
                status = sendPlain(exchange, 400, e.getMessage());
                return;
            }
            if (scheduler != null) {
                target = scheduler;
                if (!SchedulerMetrics.hasScheduler(scheduler)) {
                    status = sendPlain(exchange, 404, "Unknown scheduler " + scheduler);
                    return;
                }
            }
            byte[] out = SchedulerMetrics.scrapeMetrics(scheduler).getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
            status = 200;
        } finally {
            // tag values stay bounded
            SchedulerMetrics.recordScrape(status == 404 ? "unknown" : target, status, System.nanoTime() - started);
            exchange.close();
        }
    }

    /** The {@code scheduler} query value, or null when absent. Any other parameter is rejected. */
    static String schedulerParam(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return null;
        }
        String scheduler = null;
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            if (!"scheduler".equals(key)) {
                throw new IllegalArgumentException("Unknown query parameter " + key);
            }
            if (value.isBlank() || scheduler != null) {
                throw new IllegalArgumentException("scheduler must be given once and not empty");
            }
            scheduler = value;
        }
        return scheduler;
    }

    private int sendPlain(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
        return status;
    }
}
