package fleetportal.core.deploy;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Command line for a remote POSIX shell. Every argument is quoted as one word,
 * so values never split or expand on the far side.
 */
public final class RemoteCommand {

    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9_@%+=:,./-]+");

    private final List<String> words = new ArrayList<>();

    private RemoteCommand(String command) {
        words.add(command);
    }

    public static RemoteCommand of(String command, String... args) {
        RemoteCommand c = new RemoteCommand(command);
        return c.args(args);
    }

    public RemoteCommand args(String... args) {
        for (String arg : args) {
            words.add(arg);
        }
        return this;
    }

    /** Adds {@code --name=value} as a single word. */
    public RemoteCommand option(String name, Object value) {
        words.add("--" + name + "=" + value);
        return this;
    }

    public List<String> words() {
        return List.copyOf(words);
    }

    /** Program and subcommand, for messages that must not echo argument values. */
    public String summary() {
        return String.join(" ", words.subList(0, Math.min(2, words.size())));
    }

    /**
     * Single-quote a word unless it is made only of characters no shell treats specially.
     * An embedded single quote closes the quoting, is emitted as {@code "'"} and reopens it.
     */
    public static String quote(String word) {
        if (!word.isEmpty() && SAFE.matcher(word).matches()) {
            return word;
        }
        return "'" + word.replace("'", "'\"'\"'") + "'";
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(quote(word));
        }
        return sb.toString();
    }
}
