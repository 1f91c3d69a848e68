package fleetportal.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a fleet machine reachable over the overlay network.
 */
public final class Node {
    private final String id;
    private final String hostname;
    private final String address;
    private final NodeRole role;
    private final Integer cpuCores;
    private final Double memoryGb;
    private final String description;
    private final Instant createdAt;

    private Node(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.hostname = builder.hostname != null ? builder.hostname : builder.id;
        this.address = Objects.requireNonNull(builder.address, "address is required");
        this.role = Objects.requireNonNull(builder.role, "role is required");
        this.cpuCores = builder.cpuCores;
        this.memoryGb = builder.memoryGb;
        this.description = builder.description;
        this.createdAt = builder.createdAt;
    }

    public String id() {
        return id;
    }

    public String hostname() {
        return hostname;
    }

    public String address() {
        return address;
    }

    public NodeRole role() {
        return role;
    }

    /** Declared core count, null when not declared */
    public Integer cpuCores() {
        return cpuCores;
    }

    /** Declared memory in GB, null when not declared */
    public Double memoryGb() {
        return memoryGb;
    }

    public String description() {
        return description;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isWorker() {
        return role == NodeRole.WORKER;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .hostname(hostname)
                .address(address)
                .role(role)
                .cpuCores(cpuCores)
                .memoryGb(memoryGb)
                .description(description)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String hostname;
        private String address;
        private NodeRole role = NodeRole.WORKER;
        private Integer cpuCores;
        private Double memoryGb;
        private String description;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder role(NodeRole role) {
            this.role = role;
            return this;
        }

        public Builder cpuCores(Integer cpuCores) {
            this.cpuCores = cpuCores;
            return this;
        }

        public Builder memoryGb(Double memoryGb) {
            this.memoryGb = memoryGb;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Node node))
            return false;
        return Objects.equals(id, node.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Node{id='" + id + "', address=" + address + ", role=" + role + "}";
    }
}
