package fleetportal.core.deploy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes JSch's internal logging to SLF4J. JSch INFO is chatty, so it is logged at DEBUG.
 */
final class JSchSlf4jLogger implements com.jcraft.jsch.Logger {

    private static final Logger delegate = LoggerFactory.getLogger("com.jcraft.jsch");

    @Override
    public boolean isEnabled(int level) {
        return switch (level) {
            case DEBUG -> delegate.isTraceEnabled();
            case INFO -> delegate.isDebugEnabled();
            case WARN -> delegate.isWarnEnabled();
            default -> delegate.isErrorEnabled();
        };
    }

    @Override
    public void log(int level, String message) {
        switch (level) {
            case DEBUG -> delegate.trace(message);
            case INFO -> delegate.debug(message);
            case WARN -> delegate.warn(message);
            default -> delegate.error(message);
        }
    }
}
