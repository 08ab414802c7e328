package fractal.compute.model;

import java.util.List;

/**
 * Result of adding records.
 *
 * @param ids         record ids, in input order
 * @param insertedIdx input positions for which a new record was created
 * @param existingIdx input positions for which an existing record was returned
 */
public record InsertResult(
        List<Long> ids,
        List<Integer> insertedIdx,
        List<Integer> existingIdx) {

    public InsertResult {
        ids = List.copyOf(ids);
        insertedIdx = List.copyOf(insertedIdx);
        existingIdx = List.copyOf(existingIdx);
    }

    public long singleId() {
        if (ids.size() != 1) {
            throw new IllegalStateException("Expected exactly one id, got " + ids.size());
        }
        return ids.get(0);
    }
}
