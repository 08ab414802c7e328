package fractal.compute.workflow.gridoptimization;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.workflow.MolecularGeometry;

/**
 * One scanned internal coordinate of a grid optimization.
 *
 * <p>
 * Steps are in angstrom for distances and in degrees for angles and dihedrals. Absolute
 * steps are the constrained values themselves; relative steps are offsets from the value
 * measured on the starting molecule.
 */
public record ScanDimension(String type, int[] indices, double[] steps, boolean relative) {

    public static ScanDimension fromJson(JsonNode scan) {
        String type = scan.path("type").asText();
        int expectedAtoms = switch (type) {
            case "distance" -> 2;
            case "angle" -> 3;
            case "dihedral" -> 4;
            default -> throw new IllegalArgumentException("Unknown scan type: " + type);
        };

        JsonNode indicesNode = scan.path("indices");
        if (!indicesNode.isArray() || indicesNode.size() != expectedAtoms) {
            throw new IllegalArgumentException("A " + type + " scan needs " + expectedAtoms + " atom indices");
        }
        int[] indices = new int[expectedAtoms];
        for (int i = 0; i < expectedAtoms; i++) {
            indices[i] = indicesNode.get(i).asInt();
        }

        JsonNode stepsNode = scan.path("steps");
        if (!stepsNode.isArray() || stepsNode.isEmpty()) {
            throw new IllegalArgumentException("A scan needs at least one step");
        }
        double[] steps = new double[stepsNode.size()];
        for (int i = 0; i < steps.length; i++) {
            steps[i] = stepsNode.get(i).asDouble();
        }

        String stepType = scan.path("step_type").asText("absolute");
        if (!stepType.equals("absolute") && !stepType.equals("relative")) {
            throw new IllegalArgumentException("Unknown step type: " + stepType);
        }
        return new ScanDimension(type, indices, steps, stepType.equals("relative"));
    }

    public double measure(double[] coords) {
        return MolecularGeometry.measure(coords, indices);
    }

    /**
     * Index of the step a scan starts from: the step closest to the measured value for
     * absolute scans, the step closest to zero for relative ones.
     */
    public int startingIndex(double measured) {
        double target = relative ? 0.0 : measured;
        int best = 0;
        double bestDistance = Double.MAX_VALUE;
        for (int i = 0; i < steps.length; i++) {
            double distance = type.equals("dihedral") && !relative
                    ? Math.abs(MolecularGeometry.angleDifference(steps[i], target))
                    : Math.abs(steps[i] - target);
            if (distance < bestDistance - 1e-9) {
                best = i;
                bestDistance = distance;
            }
        }
        return best;
    }

    /**
     * Value the coordinate is constrained to at a step.
     */
    public double constraintValue(int index, double startingValue) {
        return relative ? startingValue + steps[index] : steps[index];
    }
}
