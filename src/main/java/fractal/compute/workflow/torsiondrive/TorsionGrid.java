package fractal.compute.workflow.torsiondrive;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.workflow.MolecularGeometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

/**
 * The dihedral grid scanned by a torsion drive.
 *
 * <p>
 * Each dimension holds the values {@code -180 + s, -180 + 2s, ..., 180} for a grid spacing
 * {@code s}, optionally restricted to a dihedral range. A full dimension wraps around
 * (180 is next to -180 + s); a restricted one does not.
 * Grid points are keyed by their values, e.g. {@code "-90,120"}.
 */
public final class TorsionGrid {

    private final List<int[]> dihedrals;
    private final List<int[]> values;
    private final boolean[] periodic;

    private TorsionGrid(List<int[]> dihedrals, List<int[]> values, boolean[] periodic) {
        this.dihedrals = dihedrals;
        this.values = values;
        this.periodic = periodic;
    }

    /**
     * Build the grid from torsion drive keywords
     * ({@code dihedrals, grid_spacing, dihedral_ranges}).
     */
    public static TorsionGrid fromKeywords(JsonNode keywords) {
        JsonNode dihedralsNode = keywords.path("dihedrals");
        JsonNode spacingNode = keywords.path("grid_spacing");
        JsonNode rangesNode = keywords.path("dihedral_ranges");

        if (!dihedralsNode.isArray() || dihedralsNode.isEmpty()) {
            throw new IllegalArgumentException("Torsion drive needs at least one dihedral");
        }
        if (!spacingNode.isArray() || spacingNode.size() != dihedralsNode.size()) {
            throw new IllegalArgumentException("grid_spacing must have one entry per dihedral");
        }
        boolean hasRanges = rangesNode.isArray();
        if (hasRanges && rangesNode.size() != dihedralsNode.size()) {
            throw new IllegalArgumentException("dihedral_ranges must have one entry per dihedral");
        }

        List<int[]> dihedrals = new ArrayList<>();
        List<int[]> values = new ArrayList<>();
        boolean[] periodic = new boolean[dihedralsNode.size()];

        for (int dim = 0; dim < dihedralsNode.size(); dim++) {
            JsonNode indices = dihedralsNode.get(dim);
            if (!indices.isArray() || indices.size() != 4) {
                throw new IllegalArgumentException("A dihedral is given by exactly four atom indices");
            }
            dihedrals.add(new int[] { indices.get(0).asInt(), indices.get(1).asInt(), indices.get(2).asInt(),
                    indices.get(3).asInt() });

            int spacing = spacingNode.get(dim).asInt();
            if (spacing <= 0 || 360 % spacing != 0) {
                throw new IllegalArgumentException("Grid spacing must divide 360: " + spacing);
            }

            int low = -180;
            int high = 180;
            JsonNode range = hasRanges ? rangesNode.get(dim) : null;
            boolean restricted = range != null && range.isArray();
            if (restricted) {
                low = range.get(0).asInt();
                high = range.get(1).asInt();
                if (low >= high || low < -180 || high > 180) {
                    throw new IllegalArgumentException("Invalid dihedral range [" + low + ", " + high + "]");
                }
            }

            List<Integer> dimValues = new ArrayList<>();
            for (int v = -180 + spacing; v <= 180; v += spacing) {
                if (v >= low && v <= high) {
                    dimValues.add(v);
                }
            }
            if (dimValues.isEmpty()) {
                throw new IllegalArgumentException("Dihedral range [" + low + ", " + high + "] contains no grid points");
            }
            values.add(dimValues.stream().mapToInt(Integer::intValue).toArray());
            periodic[dim] = !restricted;
        }

        return new TorsionGrid(dihedrals, values, periodic);
    }

    public int dimensions() {
        return values.size();
    }

    public int[] dihedral(int dim) {
        return dihedrals.get(dim).clone();
    }

    public int value(int dim, int index) {
        return values.get(dim)[index];
    }

    public int size() {
        int size = 1;
        for (int[] dim : values) {
            size *= dim.length;
        }
        return size;
    }

    public String key(int[] indices) {
        StringJoiner joiner = new StringJoiner(",");
        for (int dim = 0; dim < indices.length; dim++) {
            joiner.add(Integer.toString(value(dim, indices[dim])));
        }
        return joiner.toString();
    }

    public int[] parse(String key) {
        String[] parts = key.split(",");
        if (parts.length != dimensions()) {
            throw new IllegalArgumentException("Grid key " + key + " does not have " + dimensions() + " values");
        }
        int[] indices = new int[parts.length];
        for (int dim = 0; dim < parts.length; dim++) {
            int v = Integer.parseInt(parts[dim].trim());
            indices[dim] = indexOf(values.get(dim), v);
            if (indices[dim] < 0) {
                throw new IllegalArgumentException("Grid key " + key + " is not on the grid");
            }
        }
        return indices;
    }

    /**
     * Grid points one step away along a single dimension.
     */
    public List<int[]> neighbours(int[] indices) {
        List<int[]> result = new ArrayList<>();
        for (int dim = 0; dim < indices.length; dim++) {
            int n = values.get(dim).length;
            for (int step : new int[] { -1, 1 }) {
                int next = indices[dim] + step;
                if (periodic[dim]) {
                    next = Math.floorMod(next, n);
                } else if (next < 0 || next >= n) {
                    continue;
                }
                if (next == indices[dim]) {
                    continue;
                }
                int[] neighbour = indices.clone();
                neighbour[dim] = next;
                if (result.stream().noneMatch(r -> Arrays.equals(r, neighbour))) {
                    result.add(neighbour);
                }
            }
        }
        return result;
    }

    /**
     * The grid point closest to the dihedrals of a geometry.
     */
    public int[] nearest(double[] coords) {
        int[] indices = new int[dimensions()];
        for (int dim = 0; dim < dimensions(); dim++) {
            int[] d = dihedrals.get(dim);
            double measured = MolecularGeometry.dihedral(coords, d[0], d[1], d[2], d[3]);
            int best = 0;
            double bestDistance = Double.MAX_VALUE;
            int[] dimValues = values.get(dim);
            for (int i = 0; i < dimValues.length; i++) {
                double distance = Math.abs(MolecularGeometry.angleDifference(measured, dimValues[i]));
                if (distance < bestDistance - 1e-9) {
                    best = i;
                    bestDistance = distance;
                }
            }
            indices[dim] = best;
        }
        return indices;
    }

    private static int indexOf(int[] array, int value) {
        for (int i = 0; i < array.length; i++) {
            if (array[i] == value) {
                return i;
            }
        }
        return -1;
    }
}
