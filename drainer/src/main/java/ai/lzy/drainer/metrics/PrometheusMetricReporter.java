package ai.lzy.drainer.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.HTTPServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Serves the drainer registry on {@code http://0.0.0.0:<port>/metrics}.
 */
public final class PrometheusMetricReporter implements MetricReporter {
    private static final Logger LOG = LogManager.getLogger(PrometheusMetricReporter.class);

    private final int port;
    private final CollectorRegistry registry;
    private HTTPServer metricsHttpServer;

    public PrometheusMetricReporter(int port, CollectorRegistry registry) {
        this.port = port;
        this.registry = registry;
    }

    @Override
    public synchronized void start() {
        if (metricsHttpServer != null) {
            throw new IllegalStateException("Prometheus metric reporter already started");
        }
        try {
            metricsHttpServer = new HTTPServer.Builder()
                .withPort(port)
                .withRegistry(registry)
                .withDaemonThreads(true)
                .build();
        } catch (IOException e) {
            throw new RuntimeException("Cannot start metrics server on port " + port, e);
        }
        LOG.info("Metrics are exported on port {}", metricsHttpServer.getPort());
    }

    @Override
    public synchronized void stop() {
        if (metricsHttpServer == null) {
            return;
        }

        metricsHttpServer.close();
        metricsHttpServer = null;
    }
}
