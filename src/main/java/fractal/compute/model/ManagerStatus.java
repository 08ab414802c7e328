package fractal.compute.model;

/**
 * Compute manager status.
 */
public enum ManagerStatus {
    /** Manager is registered and sending heartbeats */
    ACTIVE,
    /** Manager missed heartbeats or was deactivated */
    INACTIVE
}
