package fleetportal.core.placement;

/**
 * Largest cpu and memory any single worker can currently offer.
 * The two maxima may come from different workers.
 *
 * @param live false when the feed could not be read and the figures are zero
 */
public record CapacityHeadroom(double maxCpu, double maxMemory, int workerCount, boolean live) {
}
