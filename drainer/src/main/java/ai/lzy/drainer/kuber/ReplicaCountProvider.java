package ai.lzy.drainer.kuber;

public interface ReplicaCountProvider {

    /**
     * Number of worker ordinals which should exist right now.
     */
    int getReplicaCount();
}
