package ai.lzy.drainer.kuber;

import java.util.Map;

public class KuberLabels {
    public static final String APP_LABEL = "lzy.ai/app";
    public static final String COMPONENT_LABEL = "lzy.ai/component";
    public static final String DRAIN_LABEL = "lzy.ai/drain";
    public static final String DRAIN_OPT_OUT_VALUE = "no";
    public static final String DRAIN_STATUS_LABEL = "lzy.ai/drain-status";
    public static final String DRAIN_STATUS_DRAINED_VALUE = "drained";
    public static final String PLACEHOLDER_NODE_LABEL = "lzy.ai/drain-placeholder";

    public static final String COMPONENT_WORKER = "buffer-worker";
    public static final String COMPONENT_DRAINER = "drainer";
    public static final String COMPONENT_PLACEHOLDER = "placeholder";

    public static Map<String, String> workloadLabels(String workloadName, String component) {
        return Map.of(
            APP_LABEL, workloadName,
            COMPONENT_LABEL, component
        );
    }
}
