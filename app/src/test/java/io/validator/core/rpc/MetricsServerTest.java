package io.validator.core.rpc;

import io.validator.core.metrics.SchedulerMetrics;
import io.validator.core.withdraw.ScheduleStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServerTest {

    private final HttpClient http = HttpClient.newHttpClient();
    private MetricsServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void servesSchedulerMetrics() throws Exception {
        SchedulerMetrics.recordResult("naive", ScheduleStatus.SUFFICIENT_BALANCE);
        server = new MetricsServer("127.0.0.1", 0);
        server.start();

        HttpResponse<String> response = http.send(HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + server.boundPort() + "/metrics"))
                .GET()
                .build(), HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("withdraw.schedule.results"));
        assertTrue(response.body().contains("status=sufficient_balance"));
    }

    @Test
    void rejectsNonGet() throws Exception {
        server = new MetricsServer(null, 0);
        server.start();

        HttpResponse<String> response = http.send(HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + server.boundPort() + "/metrics"))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build(), HttpResponse.BodyHandlers.ofString());

        assertEquals(405, response.statusCode());
    }

    @Test
    void narrowsScrapeToOneScheduler() throws Exception {
        SchedulerMetrics.recordResult("naive", ScheduleStatus.INSUFFICIENT_BALANCE);
        SchedulerMetrics.recordResult("eager", ScheduleStatus.SUFFICIENT_BALANCE);
        server = new MetricsServer("127.0.0.1", 0);
        server.start();

        HttpResponse<String> response = get("/metrics?scheduler=eager");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("scheduler=eager"));
        assertFalse(response.body().contains("scheduler=naive"));
        assertNotNull(SchedulerMetrics.registry().find("withdraw.metrics.scrapes")
                .tag("target", "eager").tag("status", "200").timer());
    }

    @Test
    void rejectsUnknownQueryAndScheduler() throws Exception {
        server = new MetricsServer("127.0.0.1", 0);
        server.start();

        assertEquals(400, get("/metrics?verbose=1").statusCode());
        assertEquals(400, get("/metrics?scheduler=").statusCode());
        assertEquals(404, get("/metrics?scheduler=no-such-scheduler").statusCode());
        assertNotNull(SchedulerMetrics.registry().find("withdraw.metrics.scrapes")
                .tag("target", "unknown").tag("status", "404").timer());
    }

    @Test
    void parsesSchedulerParameter() {
        assertNull(MetricsHandler.schedulerParam(null));
        assertNull(MetricsHandler.schedulerParam(""));
        assertEquals("eager", MetricsHandler.schedulerParam("scheduler=eager"));
        assertThrows(IllegalArgumentException.class,
                () -> MetricsHandler.schedulerParam("scheduler=eager&scheduler=naive"));
        assertThrows(IllegalArgumentException.class, () -> MetricsHandler.schedulerParam("scheduler"));
    }

    private HttpResponse<String> get(String pathAndQuery) throws Exception {
        return http.send(HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + server.boundPort() + pathAndQuery))
                .GET()
                .build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void refusesSecondStart() throws Exception {
        server = new MetricsServer("127.0.0.1", 0);
        server.start();
        assertThrows(IllegalStateException.class, server::start);
    }
}
