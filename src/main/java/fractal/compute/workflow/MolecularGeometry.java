package fractal.compute.workflow;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Internal coordinates measured from a molecule's flat Cartesian geometry
 * ({@code geometry: [x0, y0, z0, x1, ...]}, in bohr).
 */
public final class MolecularGeometry {

    public static final double BOHR_TO_ANGSTROM = 0.52917721067;

    private MolecularGeometry() {
    }

    public static double[] coordinates(JsonNode molecule) {
        JsonNode geometry = molecule == null ? null : molecule.get("geometry");
        if (geometry == null || !geometry.isArray() || geometry.size() % 3 != 0 || geometry.isEmpty()) {
            throw new IllegalArgumentException("Molecule has no valid geometry");
        }
        double[] coords = new double[geometry.size()];
        for (int i = 0; i < coords.length; i++) {
            coords[i] = geometry.get(i).asDouble();
        }
        return coords;
    }

    /**
     * Distance between two atoms, in bohr.
     */
    public static double distance(double[] coords, int a, int b) {
        double[] ab = sub(atom(coords, b), atom(coords, a));
        return norm(ab);
    }

    /**
     * Angle a-b-c in degrees.
     */
    public static double angle(double[] coords, int a, int b, int c) {
        double[] ba = sub(atom(coords, a), atom(coords, b));
        double[] bc = sub(atom(coords, c), atom(coords, b));
        double cos = dot(ba, bc) / (norm(ba) * norm(bc));
        return Math.toDegrees(Math.acos(Math.max(-1.0, Math.min(1.0, cos))));
    }

    /**
     * Dihedral a-b-c-d in degrees, in (-180, 180].
     */
    public static double dihedral(double[] coords, int a, int b, int c, int d) {
        double[] b1 = sub(atom(coords, b), atom(coords, a));
        double[] b2 = sub(atom(coords, c), atom(coords, b));
        double[] b3 = sub(atom(coords, d), atom(coords, c));

        double[] n1 = cross(b1, b2);
        double[] n2 = cross(b2, b3);
        double[] m1 = cross(n1, scale(b2, 1.0 / norm(b2)));

        double x = dot(n1, n2);
        double y = dot(m1, n2);
        double degrees = -Math.toDegrees(Math.atan2(y, x));
        return degrees <= -180.0 ? 180.0 : degrees;
    }

    /**
     * Measure an internal coordinate given by 2, 3 or 4 atom indices.
     * Distances are returned in angstrom, angles in degrees.
     */
    public static double measure(double[] coords, int[] indices) {
        return switch (indices.length) {
            case 2 -> distance(coords, indices[0], indices[1]) * BOHR_TO_ANGSTROM;
            case 3 -> angle(coords, indices[0], indices[1], indices[2]);
            case 4 -> dihedral(coords, indices[0], indices[1], indices[2], indices[3]);
            default -> throw new IllegalArgumentException("Expected 2, 3 or 4 atom indices, got " + indices.length);
        };
    }

    /**
     * Signed difference {@code a - b} between two angles, folded into [-180, 180).
     */
    public static double angleDifference(double a, double b) {
        double d = (a - b) % 360.0;
        if (d >= 180.0) {
            d -= 360.0;
        } else if (d < -180.0) {
            d += 360.0;
        }
        return d;
    }

    private static double[] atom(double[] coords, int index) {
        if (index < 0 || 3 * index + 2 >= coords.length) {
            throw new IllegalArgumentException("Atom index out of range: " + index);
        }
        return new double[] { coords[3 * index], coords[3 * index + 1], coords[3 * index + 2] };
    }

    private static double[] sub(double[] u, double[] v) {
        return new double[] { u[0] - v[0], u[1] - v[1], u[2] - v[2] };
    }

    private static double[] scale(double[] u, double s) {
        return new double[] { u[0] * s, u[1] * s, u[2] * s };
    }

    private static double dot(double[] u, double[] v) {
        return u[0] * v[0] + u[1] * v[1] + u[2] * v[2];
    }

    private static double[] cross(double[] u, double[] v) {
        return new double[] {
                u[1] * v[2] - u[2] * v[1],
                u[2] * v[0] - u[0] * v[2],
                u[0] * v[1] - u[1] * v[0] };
    }

    private static double norm(double[] u) {
        return Math.sqrt(dot(u, u));
    }
}
