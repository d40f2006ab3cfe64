package ai.lzy.drainer.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class DummyMetricReporter implements MetricReporter {
    private static final Logger LOG = LogManager.getLogger(DummyMetricReporter.class);

    @Override
    public void start() {
        LOG.info("Metrics export is disabled");
    }

    @Override
    public void stop() {
    }
}
