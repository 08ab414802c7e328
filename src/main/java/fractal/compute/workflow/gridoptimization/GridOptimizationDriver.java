package fractal.compute.workflow.gridoptimization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fractal.compute.exception.ServiceIterationException;
import fractal.compute.record.OptimizationHandler;
import fractal.compute.util.Jsons;
import fractal.compute.workflow.DependencyResult;
import fractal.compute.workflow.MolecularGeometry;
import fractal.compute.workflow.ServiceContext;
import fractal.compute.workflow.ServiceDriver;
import fractal.compute.workflow.ServiceIteration;
import fractal.compute.workflow.SubTaskRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Grid optimization: constrained optimizations over a grid of distances, angles and
 * dihedrals.
 *
 * <p>
 * The molecule is optionally pre-optimized first. The scan starts at the grid point
 * nearest to the starting molecule and grows outwards: every finished grid point seeds
 * its not yet visited neighbours with its final geometry.
 *
 * <p>
 * Specification: {@code {keywords: {preoptimization, scans: [{type, indices, steps,
 * step_type}]}, optimization_specification, initial_molecule}}.
 */
public class GridOptimizationDriver implements ServiceDriver {

    public static final String SERVICE_TYPE = "gridoptimization";

    static final String PREOPTIMIZATION_KEY = "preoptimization";

    @Override
    public String serviceType() {
        return SERVICE_TYPE;
    }

    @Override
    public boolean available() {
        return true;
    }

    @Override
    public ServiceIteration initialize(ServiceContext context) {
        List<ScanDimension> scans = scans(context.specification());
        MolecularGeometry.coordinates(context.specification().get("initial_molecule"));
        if (!context.specification().path("optimization_specification").isObject()) {
            throw new ServiceIterationException("Grid optimization has no optimization specification");
        }

        int size = 1;
        for (ScanDimension scan : scans) {
            size *= scan.steps().length;
        }
        return ServiceIteration.initialized(Jsons.toTree(new GridOptimizationState()),
                "Grid optimization over " + size + " grid points in " + scans.size() + " dimension(s)");
    }

    @Override
    public ServiceIteration iterate(ServiceContext context) {
        context.requireCompleteDependencies();

        JsonNode spec = context.specification();
        List<ScanDimension> scans = scans(spec);
        GridOptimizationState state = Jsons.convert(context.state(), GridOptimizationState.class);
        state.iteration++;

        List<SubTaskRequest> next = new ArrayList<>();

        switch (state.stage) {
            case NEW -> {
                if (spec.path("keywords").path("preoptimization").asBoolean(true)) {
                    next.add(new SubTaskRequest(OptimizationHandler.RECORD_TYPE,
                            optimization(spec, spec.get("initial_molecule"), null, null, state),
                            extras(PREOPTIMIZATION_KEY), PREOPTIMIZATION_KEY));
                    state.stage = GridOptimizationState.Stage.PREOPTIMIZING;
                    return ServiceIteration.submit(Jsons.toTree(state), next, "Submitted pre-optimization");
                }
                state.startingMolecule = spec.get("initial_molecule");
                return startScan(spec, scans, state);
            }
            case PREOPTIMIZING -> {
                DependencyResult preopt = context.dependencies().stream()
                        .filter(d -> PREOPTIMIZATION_KEY.equals(d.extras().path("grid_key").asText()))
                        .findFirst()
                        .orElseThrow(() -> new ServiceIterationException("Pre-optimization result is missing"));
                state.startingMolecule = preopt.properties().get("final_molecule");
                state.preoptimizationEnergy = preopt.properties().path("final_energy").asDouble();
                return startScan(spec, scans, state);
            }
            default -> {
                // scanning
            }
        }

        for (DependencyResult dep : context.dependencies()) {
            GridOptimizationState.GridPoint point = state.points.get(dep.extras().path("grid_key").asText());
            if (point == null) {
                throw new ServiceIterationException("Result for unknown grid point "
                        + dep.extras().path("grid_key").asText());
            }
            point.complete = true;
            point.energy = dep.properties().path("final_energy").asDouble();
            point.molecule = dep.properties().get("final_molecule");
        }

        for (String key : new ArrayList<>(state.points.keySet())) {
            GridOptimizationState.GridPoint point = state.points.get(key);
            if (!point.complete) {
                continue;
            }
            for (int[] neighbour : neighbours(parse(key), scans)) {
                String neighbourKey = key(neighbour);
                if (!state.points.containsKey(neighbourKey)) {
                    submitPoint(spec, scans, state, neighbour, point.molecule, next);
                }
            }
        }

        if (!next.isEmpty()) {
            return ServiceIteration.submit(Jsons.toTree(state), next,
                    "Iteration " + state.iteration + ": submitted " + next.size() + " grid points");
        }

        Map<String, Double> energies = new TreeMap<>();
        state.points.forEach((key, point) -> {
            if (!point.complete) {
                throw new ServiceIterationException("Grid point " + key + " has no result");
            }
            energies.put(key, point.energy);
        });

        ObjectNode properties = Jsons.object();
        properties.set("final_energies", Jsons.toTree(energies));
        if (state.preoptimizationEnergy != null) {
            properties.put("preoptimization_energy", state.preoptimizationEnergy);
        }
        properties.set("starting_molecule", state.startingMolecule);
        return ServiceIteration.done(Jsons.toTree(state), properties,
                "Grid optimization complete: " + energies.size() + " grid points");
    }

    private ServiceIteration startScan(JsonNode spec, List<ScanDimension> scans, GridOptimizationState state) {
        double[] coords = MolecularGeometry.coordinates(state.startingMolecule);
        int[] start = new int[scans.size()];
        state.startingValues = new ArrayList<>();
        for (int dim = 0; dim < scans.size(); dim++) {
            double measured = scans.get(dim).measure(coords);
            state.startingValues.add(measured);
            start[dim] = scans.get(dim).startingIndex(measured);
        }
        state.stage = GridOptimizationState.Stage.SCANNING;

        List<SubTaskRequest> next = new ArrayList<>();
        submitPoint(spec, scans, state, start, state.startingMolecule, next);
        return ServiceIteration.submit(Jsons.toTree(state), next, "Starting scan at grid point " + key(start));
    }

    private void submitPoint(JsonNode spec, List<ScanDimension> scans, GridOptimizationState state, int[] indices,
            JsonNode molecule, List<SubTaskRequest> next) {
        String key = key(indices);
        state.points.put(key, new GridOptimizationState.GridPoint());
        next.add(new SubTaskRequest(OptimizationHandler.RECORD_TYPE,
                optimization(spec, molecule, scans, indices, state), extras(key), key));
    }

    private static ObjectNode optimization(JsonNode spec, JsonNode molecule, List<ScanDimension> scans,
            int[] indices, GridOptimizationState state) {
        ObjectNode optSpec = spec.get("optimization_specification").deepCopy();
        if (scans != null) {
            ObjectNode keywords = optSpec.path("keywords").isObject()
                    ? (ObjectNode) optSpec.get("keywords")
                    : optSpec.putObject("keywords");
            ObjectNode constraints = keywords.path("constraints").isObject()
                    ? (ObjectNode) keywords.get("constraints")
                    : keywords.putObject("constraints");
            ArrayNode set = constraints.path("set").isArray()
                    ? (ArrayNode) constraints.get("set")
                    : constraints.putArray("set");
            for (int dim = 0; dim < scans.size(); dim++) {
                ScanDimension scan = scans.get(dim);
                ObjectNode constraint = set.addObject();
                constraint.put("type", scan.type());
                ArrayNode atoms = constraint.putArray("indices");
                for (int atom : scan.indices()) {
                    atoms.add(atom);
                }
                constraint.put("value", scan.constraintValue(indices[dim], state.startingValues.get(dim)));
            }
        }
        optSpec.set("initial_molecule", molecule);
        return optSpec;
    }

    private static ObjectNode extras(String key) {
        ObjectNode extras = Jsons.object();
        extras.put("grid_key", key);
        return extras;
    }

    static List<ScanDimension> scans(JsonNode spec) {
        JsonNode scansNode = spec.path("keywords").path("scans");
        if (!scansNode.isArray() || scansNode.isEmpty()) {
            throw new ServiceIterationException("Grid optimization needs at least one scan");
        }
        List<ScanDimension> scans = new ArrayList<>();
        for (JsonNode scan : scansNode) {
            scans.add(ScanDimension.fromJson(scan));
        }
        return scans;
    }

    static String key(int[] indices) {
        StringJoiner joiner = new StringJoiner(",");
        for (int index : indices) {
            joiner.add(Integer.toString(index));
        }
        return joiner.toString();
    }

    static int[] parse(String key) {
        String[] parts = key.split(",");
        int[] indices = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            indices[i] = Integer.parseInt(parts[i].trim());
        }
        return indices;
    }

    static List<int[]> neighbours(int[] indices, List<ScanDimension> scans) {
        List<int[]> result = new ArrayList<>();
        for (int dim = 0; dim < indices.length; dim++) {
            for (int step : new int[] { -1, 1 }) {
                int next = indices[dim] + step;
                if (next < 0 || next >= scans.get(dim).steps().length) {
                    continue;
                }
                int[] neighbour = indices.clone();
                neighbour[dim] = next;
                result.add(neighbour);
            }
        }
        return result;
    }
}
