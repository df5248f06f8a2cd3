package com.reminders.app;

import com.reminders.core.ServiceUnavailableException;
import com.reminders.db.ReminderRepository;
import com.reminders.engine.ReminderScheduler;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.json.JSONObject;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

// HTTP server exposing reminder scheduler counters at GET /metrics
public class MetricsServer {
    private static final Logger logger = Logger.getLogger(MetricsServer.class.getName());

    private final ReminderScheduler scheduler;
    private final ReminderRepository repository;
    private final int port;
    private final long startTime;
    private HttpServer server;
    private ExecutorService executor;

    // Port 0 binds an ephemeral port, see getPort()
    public MetricsServer(ReminderScheduler scheduler, ReminderRepository repository, int port) {
        this.scheduler = scheduler;
        this.repository = repository;
        this.port = port;
        this.startTime = System.currentTimeMillis();
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/metrics", new MetricsHandler());

        executor = Executors.newFixedThreadPool(2);
        server.setExecutor(executor);
        server.start();

        logger.info("Metrics endpoint: http://localhost:" + getPort() + "/metrics");
    }

    public void stop() {
        if (server != null) {
            server.stop(1);
            executor.shutdown();
            logger.info("Metrics server stopped");
        }
    }

    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                send(exchange, 405, new JSONObject().put("error", "Method Not Allowed"));
                return;
            }

            try {
                send(exchange, 200, buildMetrics());
                logger.fine("Served metrics request");
            } catch (ServiceUnavailableException e) {
                logger.log(Level.SEVERE, "Failed to fetch metrics", e);
                send(exchange, 500, new JSONObject().put("error", "Reminder store unavailable"));
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Unexpected error handling metrics request", e);
                send(exchange, 500, new JSONObject().put("error", "Internal Server Error"));
            }
        }

        private JSONObject buildMetrics() throws ServiceUnavailableException {
            Map<String, Object> status = scheduler.getStatus();

            JSONObject json = new JSONObject();
            json.put("pending_reminders", repository.count());
            json.put("queued", status.get("queued"));
            json.put("in_flight", status.get("inFlight"));
            json.put("fired", status.get("fired"));
            json.put("cancelled", status.get("cancelled"));
            json.put("delivery_failures", status.get("deliveryFailures"));
            json.put("running", status.get("running"));
            json.put("uptime_seconds", (System.currentTimeMillis() - startTime) / 1000);
            return json;
        }

        private void send(HttpExchange exchange, int statusCode, JSONObject body) throws IOException {
            byte[] response = body.toString().getBytes(StandardCharsets.UTF_8);

            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(statusCode, response.length);

            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        }
    }
}
