package fleetportal.core.model;

/**
 * How the scheduler arrived at a placement.
 */
public enum PlacementMode {
    /** Node was chosen against live capacity figures */
    CAPACITY_VALIDATED,
    /** Capacity feed unavailable; node was picked at random among workers */
    RANDOM_FALLBACK
}
