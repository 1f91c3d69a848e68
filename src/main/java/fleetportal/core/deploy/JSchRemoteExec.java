package fleetportal.core.deploy;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import fleetportal.core.error.DeploymentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * {@link RemoteExec} over an SSH exec channel with key-based authentication.
 * One session per command; stdout and stderr are collected separately by JSch's
 * session thread, so a chatty command never stalls on a full pipe.
 */
public class JSchRemoteExec implements RemoteExec {

    private static final Logger log = LoggerFactory.getLogger(JSchRemoteExec.class);

    private static final long POLL_INTERVAL_MILLIS = 100;

    static {
        JSch.setLogger(new JSchSlf4jLogger());
    }

    private final String user;
    private final int port;
    private final Path identityFile;
    private final Path knownHostsFile;
    private final boolean strictHostKeys;
    private final Duration connectTimeout;
    private final Duration commandTimeout;

    public JSchRemoteExec(String user, int port, Path identityFile, Path knownHostsFile, boolean strictHostKeys,
            Duration connectTimeout, Duration commandTimeout) {
        this.user = user;
        this.port = port;
        this.identityFile = identityFile;
        this.knownHostsFile = knownHostsFile;
        this.strictHostKeys = strictHostKeys;
        this.connectTimeout = connectTimeout;
        this.commandTimeout = commandTimeout;
    }

    @Override
    public ExecResult exec(String address, RemoteCommand command) throws DeploymentException {
        String line = command.toString();
        log.debug("Running on {}: {}", address, line);

        Session session = null;
        ChannelExec channel = null;
        try {
            session = openSession(address);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ByteArrayOutputStream err = new ByteArrayOutputStream();
            channel = (ChannelExec) session.openChannel("exec");
            channel.setCommand(line);
            channel.setInputStream(new ByteArrayInputStream(new byte[0]));
            channel.setOutputStream(out);
            channel.setErrStream(err);
            channel.connect((int) connectTimeout.toMillis());

            long deadline = System.nanoTime() + commandTimeout.toNanos();
            while (!channel.isClosed()) {
                if (System.nanoTime() > deadline) {
                    throw new DeploymentException("command timed out on " + address + ": " + command.summary());
                }
                Thread.sleep(POLL_INTERVAL_MILLIS);
            }

            return new ExecResult(channel.getExitStatus(),
                    out.toString(StandardCharsets.UTF_8),
                    err.toString(StandardCharsets.UTF_8));
        } catch (JSchException e) {
            throw new DeploymentException("ssh to " + user + "@" + address + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeploymentException("interrupted while running command on " + address, e);
        } finally {
            if (channel != null) {
                channel.disconnect();
            }
            if (session != null) {
                session.disconnect();
            }
        }
    }

    private Session openSession(String address) throws JSchException {
        JSch jsch = new JSch();
        if (identityFile != null) {
            jsch.addIdentity(identityFile.toString());
        }
        if (knownHostsFile != null && Files.exists(knownHostsFile)) {
            jsch.setKnownHosts(knownHostsFile.toString());
        }

        Session session = jsch.getSession(user, address, port);
        session.setConfig("StrictHostKeyChecking", strictHostKeys ? "yes" : "no");
        session.connect((int) connectTimeout.toMillis());
        return session;
    }
}
