package ai.lzy.drainer.kuber;

import ai.lzy.drainer.configs.DrainerConfig;
import io.fabric8.kubernetes.client.KubernetesClient;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Takes the desired replica count from the workload StatefulSet, which is what autoscalers write to.
 */
@Singleton
public class StatefulSetReplicaCountProvider implements ReplicaCountProvider {
    private static final Logger LOG = LogManager.getLogger(StatefulSetReplicaCountProvider.class);

    private final KubernetesClient client;
    private final String namespace;
    private final String workloadName;

    public StatefulSetReplicaCountProvider(KubernetesClient client, DrainerConfig config) {
        this.client = client;
        this.namespace = config.getNamespace();
        this.workloadName = config.getWorkloadName();
    }

    @Override
    public int getReplicaCount() {
        var statefulSet = client.apps().statefulSets().inNamespace(namespace).withName(workloadName).get();
        if (statefulSet == null) {
            LOG.warn("StatefulSet {}/{} not found, assume no replicas", namespace, workloadName);
            return 0;
        }
        if (statefulSet.getSpec() == null) {
            LOG.warn("StatefulSet {}/{} has no spec, assume no replicas", namespace, workloadName);
            return 0;
        }
        var replicas = statefulSet.getSpec().getReplicas();
        return replicas == null ? 0 : replicas;
    }
}
