package fleetportal.core.model;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * What a user asks for when launching an instance.
 */
public record InstanceSpec(String name, String image, int cpu, int memoryGb, Map<String, String> env) {

    public static final int MIN_CPU = 1;
    public static final int MAX_CPU = 8;
    public static final int MIN_MEMORY_GB = 1;
    public static final int MAX_MEMORY_GB = 32;
    public static final String DEFAULT_IMAGE = "ubuntu:22.04";

    // registry/name:tag or name@sha256:digest
    private static final Pattern IMAGE = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._/:@-]{0,254}");
    private static final Pattern ENV_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,127}");

    public InstanceSpec {
        env = env != null ? Map.copyOf(env) : Map.of();
        if (image == null || image.isBlank()) {
            image = DEFAULT_IMAGE;
        }
    }

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (name.length() > 64) {
            throw new IllegalArgumentException("name must be at most 64 characters");
        }
        if (cpu < MIN_CPU || cpu > MAX_CPU) {
            throw new IllegalArgumentException("cpu must be between " + MIN_CPU + " and " + MAX_CPU);
        }
        if (memoryGb < MIN_MEMORY_GB || memoryGb > MAX_MEMORY_GB) {
            throw new IllegalArgumentException(
                    "memory must be between " + MIN_MEMORY_GB + " and " + MAX_MEMORY_GB + " GB");
        }
        if (!IMAGE.matcher(image).matches()) {
            throw new IllegalArgumentException("image is not a valid image reference: " + image);
        }
        for (Map.Entry<String, String> e : env.entrySet()) {
            if (!ENV_KEY.matcher(e.getKey()).matches()) {
                throw new IllegalArgumentException("invalid environment variable name: " + e.getKey());
            }
            if (e.getValue().indexOf('\0') >= 0) {
                throw new IllegalArgumentException("environment variable " + e.getKey() + " contains a NUL byte");
            }
        }
    }
}
