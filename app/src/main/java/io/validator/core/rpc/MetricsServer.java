package io.validator.core.rpc;

import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/** Serves scheduler metrics at {@code GET /metrics}. */
public final class MetricsServer {
    private static final Logger LOG = Logger.getLogger(MetricsServer.class.getName());

    private final String bindAddress;
    private final int port;
    private HttpServer server;
    private ExecutorService executor;

    public MetricsServer(String bindAddress, int port) {
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
    }

    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Metrics server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/metrics", new MetricsHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "Metrics server listening on http://" + bindAddress + ':' + boundPort() + "/metrics");
    }

    /** Actual port; differs from the configured one when 0 was requested. */
    public synchronized int boundPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        server.stop(0);
        executor.shutdownNow();
        server = null;
        executor = null;
    }
}
