package fleetportal.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a user workload placed on a worker node.
 * Records are never deleted; termination is a status transition.
 */
public final class Instance {
    private final String id;
    private final String name;
    private final String image;
    private final String ownerId;
    private final String nodeId;
    private final String nodeAddress;
    private final Integer port;
    private final int cpu;
    private final int memoryGb;
    private final InstanceStatus status;
    private final String deploymentHandle;
    private final String errorMessage;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant stoppedAt;

    private Instance(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.image = Objects.requireNonNull(builder.image, "image is required");
        this.ownerId = Objects.requireNonNull(builder.ownerId, "ownerId is required");
        this.nodeId = builder.nodeId;
        this.nodeAddress = builder.nodeAddress;
        this.port = builder.port;
        this.cpu = builder.cpu;
        this.memoryGb = builder.memoryGb;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.deploymentHandle = builder.deploymentHandle;
        this.errorMessage = builder.errorMessage;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.stoppedAt = builder.stoppedAt;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String image() {
        return image;
    }

    public String ownerId() {
        return ownerId;
    }

    public String nodeId() {
        return nodeId;
    }

    public String nodeAddress() {
        return nodeAddress;
    }

    public Integer port() {
        return port;
    }

    public int cpu() {
        return cpu;
    }

    public int memoryGb() {
        return memoryGb;
    }

    public InstanceStatus status() {
        return status;
    }

    public String deploymentHandle() {
        return deploymentHandle;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant stoppedAt() {
        return stoppedAt;
    }

    public boolean isOwnedBy(String userId) {
        return ownerId.equals(userId);
    }

    /** address:port, or null while no port is held */
    public String accessUrl() {
        if (nodeAddress == null || port == null) {
            return null;
        }
        return nodeAddress + ":" + port;
    }

    /** Seconds since the last start, only while RUNNING */
    public Long uptimeSeconds(Instant now) {
        if (status != InstanceStatus.RUNNING || startedAt == null) {
            return null;
        }
        return Math.max(0, Duration.between(startedAt, now).getSeconds());
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .image(image)
                .ownerId(ownerId)
                .nodeId(nodeId)
                .nodeAddress(nodeAddress)
                .port(port)
                .cpu(cpu)
                .memoryGb(memoryGb)
                .status(status)
                .deploymentHandle(deploymentHandle)
                .errorMessage(errorMessage)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .stoppedAt(stoppedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String image;
        private String ownerId;
        private String nodeId;
        private String nodeAddress;
        private Integer port;
        private int cpu = 1;
        private int memoryGb = 2;
        private InstanceStatus status = InstanceStatus.PENDING;
        private String deploymentHandle;
        private String errorMessage;
        private Instant createdAt;
        private Instant startedAt;
        private Instant stoppedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder nodeAddress(String nodeAddress) {
            this.nodeAddress = nodeAddress;
            return this;
        }

        public Builder port(Integer port) {
            this.port = port;
            return this;
        }

        public Builder cpu(int cpu) {
            this.cpu = cpu;
            return this;
        }

        public Builder memoryGb(int memoryGb) {
            this.memoryGb = memoryGb;
            return this;
        }

        public Builder status(InstanceStatus status) {
            this.status = status;
            return this;
        }

        public Builder deploymentHandle(String deploymentHandle) {
            this.deploymentHandle = deploymentHandle;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder stoppedAt(Instant stoppedAt) {
            this.stoppedAt = stoppedAt;
            return this;
        }

        public Instance build() {
            return new Instance(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Instance instance))
            return false;
        return Objects.equals(id, instance.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Instance{id='" + id + "', owner=" + ownerId + ", node=" + nodeId + ", port=" + port
                + ", status=" + status + "}";
    }
}
