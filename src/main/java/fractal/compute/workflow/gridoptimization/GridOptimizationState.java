package fractal.compute.workflow.gridoptimization;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persisted progress of a grid optimization, stored as the service state.
 */
public final class GridOptimizationState {

    public enum Stage {
        /** Nothing submitted yet */
        NEW,
        /** Waiting for the pre-optimization */
        PREOPTIMIZING,
        /** Grid points are being optimized */
        SCANNING
    }

    @JsonProperty("stage")
    Stage stage = Stage.NEW;

    @JsonProperty("iteration")
    int iteration;

    /** Molecule the scan starts from (the pre-optimized one, if requested) */
    @JsonProperty("starting_molecule")
    JsonNode startingMolecule;

    /** Coordinates measured on the starting molecule, one per scan */
    @JsonProperty("starting_values")
    List<Double> startingValues = new ArrayList<>();

    @JsonProperty("preoptimization_energy")
    Double preoptimizationEnergy;

    /** Grid points submitted so far, by grid key */
    @JsonProperty("points")
    Map<String, GridPoint> points = new TreeMap<>();

    public static final class GridPoint {

        @JsonProperty("complete")
        boolean complete;

        @JsonProperty("energy")
        Double energy;

        @JsonProperty("molecule")
        JsonNode molecule;
    }
}
