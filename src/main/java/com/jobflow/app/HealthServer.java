package com.jobflow.app;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.jobflow.broker.BrokerQueue;
import com.jobflow.broker.JobState;
import com.jobflow.engine.QueueWorker;
import com.jobflow.engine.WorkerRuntime;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

// HTTP server exposing worker health and per-queue job counts
public class HealthServer {
    private static final Logger logger = Logger.getLogger(HealthServer.class.getName());

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    private final WorkerRuntime runtime;
    private final int port;
    private final long startTime;
    private HttpServer server;
    private ExecutorService executor;

    public HealthServer(WorkerRuntime runtime, int port) {
        this.runtime = runtime;
        this.port = port;
        this.startTime = System.currentTimeMillis();
    }

    // Start HTTP server and register endpoints
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());

        executor = Executors.newFixedThreadPool(2);
        server.setExecutor(executor);
        server.start();

        logger.info("Health server started on port " + getPort());
    }

    // Stop HTTP server gracefully
    public void stop() {
        if (server != null) {
            server.stop(1);
            executor.shutdownNow();
            logger.info("Health server stopped");
        }
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    // GET /health: 200 while the runtime is running, 503 otherwise
    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            boolean running = runtime.isRunning();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", running ? "ok" : "unavailable");
            body.put("queues", new ArrayList<>(runtime.getWorkers().keySet()));
            body.put("uptime_seconds", uptimeSeconds());

            sendJson(exchange, running ? 200 : 503, body);
        }
    }

    // GET /metrics: job counts and worker state per queue
    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            try {
                Map<String, Object> queues = new LinkedHashMap<>();
                Map<String, QueueWorker> workers = runtime.getWorkers();
                for (Map.Entry<String, BrokerQueue> entry : runtime.getQueues().entrySet()) {
                    Map<String, Object> queue = new LinkedHashMap<>();
                    Map<String, Long> counts = new LinkedHashMap<>();
                    for (Map.Entry<JobState, Long> count : entry.getValue().getJobCounts().entrySet()) {
                        counts.put(count.getKey().name().toLowerCase(), count.getValue());
                    }
                    queue.put("jobs", counts);
                    QueueWorker worker = workers.get(entry.getKey());
                    if (worker != null) {
                        queue.put("worker", worker.getStatus());
                    }
                    queues.put(entry.getKey(), queue);
                }

                Map<String, Object> body = new LinkedHashMap<>();
                body.put("queues", queues);
                body.put("uptime_seconds", uptimeSeconds());
                sendJson(exchange, 200, body);

                logger.fine("Served metrics request");
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to collect metrics", e);
                sendError(exchange, 500, "Internal Server Error: " + e.getMessage());
            }
        }
    }

    private long uptimeSeconds() {
        return (System.currentTimeMillis() - startTime) / 1000;
    }

    private static void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] response = gson.toJson(body).getBytes(StandardCharsets.UTF_8);

        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, response.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }

    private static void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Map.of("error", message));
    }
}
