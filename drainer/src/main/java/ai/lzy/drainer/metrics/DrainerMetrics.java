package ai.lzy.drainer.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import jakarta.inject.Singleton;

@Singleton
public class DrainerMetrics {

    private static final String DRAINER = "drainer";

    public final Counter drainStarted;
    public final Counter drainFinished;
    public final Counter drainCancelled;
    public final Counter drainFailed;
    public final Counter promoted;
    public final Counter volumeErrors;
    public final Counter passErrors;
    public final Histogram passDuration;

    public DrainerMetrics(CollectorRegistry registry) {
        drainStarted = Counter
            .build("drain_started", "Drain jobs started")
            .subsystem(DRAINER)
            .register(registry);

        drainFinished = Counter
            .build("drain_finished", "Volumes drained and labeled")
            .subsystem(DRAINER)
            .register(registry);

        drainCancelled = Counter
            .build("drain_cancelled", "Drain jobs cancelled because the volume came back in use")
            .subsystem(DRAINER)
            .register(registry);

        drainFailed = Counter
            .build("drain_failed", "Failed drain jobs seen by a pass")
            .subsystem(DRAINER)
            .register(registry);

        promoted = Counter
            .build("promoted", "Drained volumes taken back into use")
            .subsystem(DRAINER)
            .register(registry);

        volumeErrors = Counter
            .build("volume_errors", "Per-volume errors")
            .subsystem(DRAINER)
            .labelNames("kind")
            .register(registry);

        passErrors = Counter
            .build("pass_errors", "Passes aborted before acting")
            .subsystem(DRAINER)
            .register(registry);

        passDuration = Histogram
            .build("pass_duration", "Reconciliation pass duration (sec)")
            .subsystem(DRAINER)
            .buckets(0.05, 0.1, 0.5, 1.0, 5.0, 10.0)
            .register(registry);
    }
}
