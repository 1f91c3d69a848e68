package fleetportal.core.deploy;

import fleetportal.core.error.DeploymentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Runs containers on fleet nodes by issuing {@code docker} commands over SSH.
 */
public class SshDockerDeploymentClient implements DeploymentClient {

    private static final Logger log = LoggerFactory.getLogger(SshDockerDeploymentClient.class);

    private static final int HANDLE_LENGTH = 12;
    private static final Pattern CONTAINER_ID = Pattern.compile("[0-9a-f]{12,64}");

    private final RemoteExec remote;

    public SshDockerDeploymentClient(RemoteExec remote) {
        this.remote = remote;
    }

    @Override
    public DeployResult deploy(DeployRequest request) throws DeploymentException {
        if (request.volumeHint() != null) {
            ExecResult mkdir = remote.exec(request.address(), RemoteCommand.of("mkdir", "-p", request.volumeHint()));
            if (!mkdir.ok()) {
                log.warn("Could not create workspace {} on {}: {}",
                        request.volumeHint(), request.address(), mkdir.diagnostic());
            }
        }

        RemoteCommand run = RemoteCommand.of("docker", "run", "-d")
                .args("--name", request.workloadName())
                .args("--network", "host")
                .option("cpus", request.cpu())
                .option("memory", request.memoryGb() + "g");
        if (request.volumeHint() != null) {
            run.args("-v", request.volumeHint() + ":/workspace");
        }
        for (Map.Entry<String, String> e : request.env().entrySet()) {
            run.args("-e", e.getKey() + "=" + e.getValue());
        }
        // "--" keeps an image name starting with '-' from being read as an option
        run.args("--init", "-t", "--", request.image(), "sleep", "infinity");

        ExecResult result = remote.exec(request.address(), run);
        if (!result.ok()) {
            throw new DeploymentException("docker run failed on " + request.address() + ": " + result.diagnostic());
        }

        String containerId = containerId(result.stdout());
        if (containerId == null) {
            throw new DeploymentException("docker run on " + request.address() + " returned no container id");
        }
        String handle = containerId.substring(0, HANDLE_LENGTH);
        log.info("Deployed {} ({}) on {} as {}", request.workloadName(), request.image(), request.address(), handle);
        return new DeployResult(handle);
    }

    @Override
    public void stop(String address, String handle) throws DeploymentException {
        expectOk(address, RemoteCommand.of("docker", "stop", handle));
    }

    @Override
    public void start(String address, String handle) throws DeploymentException {
        expectOk(address, RemoteCommand.of("docker", "start", handle));
    }

    @Override
    public void remove(String address, String handle) throws DeploymentException {
        expectOk(address, RemoteCommand.of("docker", "rm", "-f", handle));
    }

    private void expectOk(String address, RemoteCommand command) throws DeploymentException {
        ExecResult result = remote.exec(address, command);
        if (!result.ok()) {
            throw new DeploymentException(command.summary() + " failed on " + address + ": " + result.diagnostic());
        }
    }

    /** {@code docker run -d} prints the full id as its last stdout line. */
    static String containerId(String stdout) {
        if (stdout == null) {
            return null;
        }
        String[] lines = stdout.strip().split("\\R");
        String last = lines[lines.length - 1].trim();
        return CONTAINER_ID.matcher(last).matches() ? last : null;
    }
}
