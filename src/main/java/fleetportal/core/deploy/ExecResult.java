package fleetportal.core.deploy;

/**
 * Outcome of one remote command. The two streams are kept apart.
 */
public record ExecResult(int exitStatus, String stdout, String stderr) {

    public boolean ok() {
        return exitStatus == 0;
    }

    /** The stream worth showing in an error message. */
    public String diagnostic() {
        String text = stderr != null && !stderr.isBlank() ? stderr : stdout;
        return text == null ? "" : text.trim();
    }
}
