package fractal.compute.model;

/**
 * Permanent link between a service record and a sub-record it spawned.
 */
public record RecordChild(
        long parentId,
        long childId,
        String childKey,
        int position) {
}
