package fractal.compute.workflow.torsiondrive;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persisted progress of a torsion drive, stored as the service state.
 */
public final class TorsionDriveState {

    /** Initial optimizations have been submitted */
    @JsonProperty("started")
    boolean started;

    @JsonProperty("iteration")
    int iteration;

    /** Grid points that have a result or a pending optimization, by grid key */
    @JsonProperty("points")
    Map<String, GridPoint> points = new TreeMap<>();

    public static final class GridPoint {

        /** Lowest energy found at this grid point */
        @JsonProperty("energy")
        Double energy;

        /** Final molecule of the lowest-energy optimization */
        @JsonProperty("molecule")
        JsonNode molecule;

        /** Energy this point had when it last seeded its neighbours */
        @JsonProperty("propagated_energy")
        Double propagatedEnergy;

        /** Hashes of the starting geometries already optimized at this point */
        @JsonProperty("seeds")
        List<String> seeds = new ArrayList<>();
    }

    GridPoint point(String key) {
        return points.computeIfAbsent(key, k -> new GridPoint());
    }

    public Map<String, Double> lowestEnergies() {
        Map<String, Double> energies = new TreeMap<>();
        points.forEach((key, point) -> {
            if (point.energy != null) {
                energies.put(key, point.energy);
            }
        });
        return energies;
    }
}
