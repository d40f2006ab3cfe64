package ai.lzy.drainer.drain;

import ai.lzy.drainer.configs.DrainerConfig;
import ai.lzy.drainer.exceptions.ObservationException;
import ai.lzy.drainer.exceptions.SpecAssemblyException;
import ai.lzy.drainer.kuber.DesiredState;
import ai.lzy.drainer.kuber.DrainLabels;
import ai.lzy.drainer.kuber.DrainStore;
import ai.lzy.drainer.kuber.KuberUtils;
import ai.lzy.drainer.kuber.ObjectReconciler;
import ai.lzy.drainer.kuber.ReconcileResult;
import ai.lzy.drainer.metrics.DrainerMetrics;
import ai.lzy.drainer.model.DrainAction;
import ai.lzy.drainer.model.DrainStatus;
import ai.lzy.drainer.model.Observation;
import ai.lzy.drainer.model.PassResult;
import ai.lzy.drainer.model.VolumeError;
import ai.lzy.drainer.model.VolumeOutcome;
import ai.lzy.drainer.model.VolumeView;
import ai.lzy.drainer.observe.ObservationGatherer;
import ai.lzy.drainer.spec.DrainJobSpecBuilder;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.client.KubernetesClientException;
import jakarta.annotation.Nullable;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Objects;

/**
 * One reconciliation pass over the buffer volumes of the workload: observes the cluster once, decides an action
 * per volume and applies it. Volumes are processed independently, an error on one does not stop the others.
 */
@Singleton
public class DrainCoordinator {
    private static final Logger LOG = LogManager.getLogger(DrainCoordinator.class);

    private final String workloadName;
    private final boolean enabled;
    private final Duration requeueDelay;
    private final ObservationGatherer gatherer;
    private final DrainStore store;
    private final ObjectReconciler reconciler;
    private final DrainJobSpecBuilder specBuilder;
    private final DrainerMetrics metrics;

    public DrainCoordinator(DrainerConfig config, DrainerConfig.BufferConfig bufferConfig,
                            DrainerConfig.DrainConfig drainConfig, ObservationGatherer gatherer, DrainStore store,
                            ObjectReconciler reconciler, DrainJobSpecBuilder specBuilder, DrainerMetrics metrics)
    {
        this.workloadName = config.getWorkloadName();
        this.enabled = drainConfig.isEnabled() && !bufferConfig.isDisablePvc();
        this.requeueDelay = config.getRequeueDelay();
        this.gatherer = gatherer;
        this.store = store;
        this.reconciler = reconciler;
        this.specBuilder = specBuilder;
        this.metrics = metrics;
    }

    public boolean enabled() {
        return enabled;
    }

    public PassResult reconcile() throws ObservationException {
        if (!enabled) {
            LOG.debug("Draining of {} is disabled, skip pass", workloadName);
            return PassResult.empty();
        }

        var timer = metrics.passDuration.startTimer();
        try {
            final var observation = observe();

            var outcomes = new ArrayList<VolumeOutcome>(observation.volumes().size());
            for (var volume : observation.volumes()) {
                var outcome = process(observation.view(volume));
                if (outcome.error() != null) {
                    metrics.volumeErrors.labels(outcome.error().kind().name()).inc();
                }
                outcomes.add(outcome);
            }
            return PassResult.of(outcomes);
        } finally {
            timer.observeDuration();
        }
    }

    private Observation observe() throws ObservationException {
        try {
            return gatherer.observe();
        } catch (ObservationException e) {
            metrics.passErrors.inc();
            throw e;
        }
    }

    VolumeOutcome process(VolumeView view) {
        var action = DrainDecisions.decide(view);
        var volumeName = view.volume().name();
        try {
            return switch (action) {
                case NONE -> VolumeOutcome.done(view, action);
                case PROMOTE -> promote(view);
                case FINISH_DRAIN -> finishDrain(view);
                case CANCEL_DRAIN -> cancelDrain(view);
                case REPORT_FAILURE -> reportFailure(view);
                case START_DRAIN -> startDrain(view);
            };
        } catch (SpecAssemblyException e) {
            LOG.error("Cannot build drain objects for volume {}: {}", volumeName, e.getMessage());
            return VolumeOutcome.failed(view, action,
                VolumeError.build(volumeName, "building drain objects failed", e));
        } catch (KubernetesClientException e) {
            var conflict = KuberUtils.isConflict(e);
            LOG.error("Cannot {} volume {}: {}", describe(action), volumeName, e.getMessage());
            return VolumeOutcome.failed(view, action,
                VolumeError.apply(volumeName, conflict ? "volume changed concurrently" : describe(action) + " failed",
                    e, conflict));
        }
    }

    private VolumeOutcome promote(VolumeView view) {
        var volume = view.volume();
        LOG.info("Volume {} is in use again, remove drained label", volume.name());
        store.updateVolumeLabels(volume.namespace(), volume.name(), volume.resourceVersion(),
            DrainLabels.delta(DrainStatus.NONE));
        metrics.promoted.inc();
        return VolumeOutcome.requeue(view, DrainAction.PROMOTE, requeueDelay);
    }

    private VolumeOutcome finishDrain(VolumeView view) throws SpecAssemblyException {
        var volume = view.volume();
        var job = Objects.requireNonNull(view.job());

        LOG.info("Volume {} is drained by job {}", volume.name(), job.name());
        var placeholder = specBuilder.buildPlaceholder(volume);

        store.updateVolumeLabels(volume.namespace(), volume.name(), volume.resourceVersion(),
            DrainLabels.delta(DrainStatus.DRAINED));
        store.deleteJob(job.namespace(), job.name(), DeletionPropagation.BACKGROUND);
        var result = reconciler.reconcile(placeholder, DesiredState.ABSENT);
        metrics.drainFinished.inc();

        return VolumeOutcome.requeue(view, DrainAction.FINISH_DRAIN, requeueAfter(result, requeueDelay));
    }

    private VolumeOutcome cancelDrain(VolumeView view) throws SpecAssemblyException {
        var volume = view.volume();
        var job = Objects.requireNonNull(view.job());

        var placeholder = specBuilder.buildPlaceholder(volume);

        // the job pods must be gone before a worker may mount the volume, placeholder goes in the same pass
        if (job.terminating()) {
            LOG.debug("Drain job {} of volume {} is already being deleted", job.name(), volume.name());
        } else {
            LOG.info("Volume {} is in use, cancel drain job {}", volume.name(), job.name());
            store.deleteJob(job.namespace(), job.name(), DeletionPropagation.FOREGROUND);
            metrics.drainCancelled.inc();
        }
        var result = reconciler.reconcile(placeholder, DesiredState.ABSENT);

        return result == null
            ? VolumeOutcome.done(view, DrainAction.CANCEL_DRAIN)
            : VolumeOutcome.requeue(view, DrainAction.CANCEL_DRAIN, result.requeueAfter());
    }

    private VolumeOutcome reportFailure(VolumeView view) {
        var job = Objects.requireNonNull(view.job());

        LOG.warn("Drain job {} of volume {} failed after {} attempts",
            job.name(), view.volume().name(), job.failedAttempts());
        metrics.drainFailed.inc();
        return VolumeOutcome.failed(view, DrainAction.REPORT_FAILURE,
            VolumeError.drainFailed(view.volume().name(), job.failedAttempts()));
    }

    private VolumeOutcome startDrain(VolumeView view) throws SpecAssemblyException {
        var volume = view.volume();

        var placeholder = specBuilder.buildPlaceholder(volume);
        var result = reconciler.reconcile(placeholder, DesiredState.PRESENT);
        if (result != null) {
            LOG.info("Placeholder {} of volume {} is not ready, retry in {}",
                placeholder.getMetadata().getName(), volume.name(), result.requeueAfter());
            return VolumeOutcome.requeue(view, DrainAction.START_DRAIN, result.requeueAfter());
        }

        var job = specBuilder.buildDrainJob(volume);
        LOG.info("Start drain job {} for volume {}", job.getMetadata().getName(), volume.name());
        result = reconciler.reconcile(job, DesiredState.PRESENT);
        metrics.drainStarted.inc();

        return result == null
            ? VolumeOutcome.done(view, DrainAction.START_DRAIN)
            : VolumeOutcome.requeue(view, DrainAction.START_DRAIN, result.requeueAfter());
    }

    private static Duration requeueAfter(@Nullable ReconcileResult result, Duration fallback) {
        if (result == null || result.requeueAfter().compareTo(fallback) > 0) {
            return fallback;
        }
        return result.requeueAfter();
    }

    private static String describe(DrainAction action) {
        return switch (action) {
            case NONE -> "observe";
            case PROMOTE -> "promote";
            case FINISH_DRAIN -> "finish draining";
            case CANCEL_DRAIN -> "cancel draining";
            case REPORT_FAILURE -> "report failure of";
            case START_DRAIN -> "start draining";
        };
    }
}
