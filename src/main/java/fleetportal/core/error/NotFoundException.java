package fleetportal.core.error;

/**
 * A node, instance or user does not exist, or is not visible to the caller.
 * The two cases are deliberately indistinguishable.
 */
public class NotFoundException extends PortalException {

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public static NotFoundException node(String id) {
        return new NotFoundException("node", id);
    }

    public static NotFoundException instance(String id) {
        return new NotFoundException("instance", id);
    }

    public static NotFoundException user(String id) {
        return new NotFoundException("user", id);
    }

    public String kind() {
        return kind;
    }

    public String id() {
        return id;
    }
}
