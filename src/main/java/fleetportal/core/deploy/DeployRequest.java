package fleetportal.core.deploy;

import java.util.Map;

/**
 * Everything needed to launch one workload.
 *
 * @param workloadName name given to the workload on the node, unique per instance
 * @param volumeHint   host directory to mount as the persistent workspace, may be null
 */
public record DeployRequest(
        String address,
        String workloadName,
        String image,
        int port,
        int cpu,
        int memoryGb,
        String volumeHint,
        Map<String, String> env) {

    public DeployRequest {
        env = env != null ? Map.copyOf(env) : Map.of();
    }
}
