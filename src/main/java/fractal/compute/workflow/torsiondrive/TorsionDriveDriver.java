package fractal.compute.workflow.torsiondrive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fractal.compute.exception.ServiceIterationException;
import fractal.compute.model.RecordChild;
import fractal.compute.record.OptimizationHandler;
import fractal.compute.util.Jsons;
import fractal.compute.workflow.DependencyResult;
import fractal.compute.workflow.MolecularGeometry;
import fractal.compute.workflow.ServiceContext;
import fractal.compute.workflow.ServiceDriver;
import fractal.compute.workflow.ServiceIteration;
import fractal.compute.workflow.SubTaskRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Torsion drive: a scan over one or more dihedral angles by constrained optimizations.
 *
 * <p>
 * The initial molecules are optimized at their nearest grid points. Whenever the lowest
 * energy at a grid point drops by more than {@code energy_decrease_thresh}, its best
 * geometry is sent to the neighbouring grid points as a new starting geometry. Points
 * above {@code energy_upper_limit} (relative to the global minimum) do not propagate.
 * The drive is finished when no new optimization is needed.
 *
 * <p>
 * Specification: {@code {keywords: {dihedrals, grid_spacing, dihedral_ranges,
 * energy_decrease_thresh, energy_upper_limit}, optimization_specification,
 * initial_molecules}}.
 */
public class TorsionDriveDriver implements ServiceDriver {

    private static final Logger log = LoggerFactory.getLogger(TorsionDriveDriver.class);

    public static final String SERVICE_TYPE = "torsiondrive";

    static final double DEFAULT_ENERGY_DECREASE_THRESH = 1.0e-5;
    private static final double ENERGY_MATCH_TOLERANCE = 1.0e-8;

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
        JsonNode spec = context.specification();
        TorsionGrid grid = TorsionGrid.fromKeywords(spec.path("keywords"));
        JsonNode molecules = spec.path("initial_molecules");
        if (!molecules.isArray() || molecules.isEmpty()) {
            throw new ServiceIterationException("Torsion drive has no initial molecules");
        }
        if (!spec.path("optimization_specification").isObject()) {
            throw new ServiceIterationException("Torsion drive has no optimization specification");
        }

        TorsionDriveState state = new TorsionDriveState();
        String stdout = "Torsion drive over " + grid.size() + " grid points from " + molecules.size()
                + " initial molecule(s)";
        return ServiceIteration.initialized(Jsons.toTree(state), stdout);
    }

    @Override
    public ServiceIteration iterate(ServiceContext context) {
        context.requireCompleteDependencies();

        JsonNode spec = context.specification();
        JsonNode keywords = spec.path("keywords");
        TorsionGrid grid = TorsionGrid.fromKeywords(keywords);
        TorsionDriveState state = Jsons.convert(context.state(), TorsionDriveState.class);
        state.iteration++;

        List<SubTaskRequest> next = new ArrayList<>();

        if (!state.started) {
            for (JsonNode molecule : spec.get("initial_molecules")) {
                int[] start = grid.nearest(MolecularGeometry.coordinates(molecule));
                submit(grid, spec, state, grid.key(start), start, molecule, next);
            }
            state.started = true;
            return ServiceIteration.submit(Jsons.toTree(state), next,
                    "Iteration " + state.iteration + ": submitted " + next.size() + " initial optimizations");
        }

        for (DependencyResult dep : context.dependencies()) {
            String key = dep.extras().path("grid_key").asText();
            double energy = dep.properties().path("final_energy").asDouble();
            TorsionDriveState.GridPoint point = state.point(key);
            if (point.energy == null || energy < point.energy) {
                point.energy = energy;
                point.molecule = dep.properties().get("final_molecule");
            }
        }

        double thresh = keywords.hasNonNull("energy_decrease_thresh")
                ? keywords.get("energy_decrease_thresh").asDouble()
                : DEFAULT_ENERGY_DECREASE_THRESH;
        Double upperLimit = keywords.hasNonNull("energy_upper_limit")
                ? keywords.get("energy_upper_limit").asDouble()
                : null;
        double globalMin = state.lowestEnergies().values().stream()
                .mapToDouble(Double::doubleValue).min().orElse(Double.NaN);

        // copy the keys: submitting adds new points
        for (String key : new ArrayList<>(state.points.keySet())) {
            TorsionDriveState.GridPoint point = state.points.get(key);
            if (point.energy == null) {
                continue;
            }
            if (point.propagatedEnergy != null && point.propagatedEnergy - point.energy <= thresh) {
                continue;
            }
            if (upperLimit != null && point.energy - globalMin > upperLimit) {
                continue;
            }
            point.propagatedEnergy = point.energy;
            for (int[] neighbour : grid.neighbours(grid.parse(key))) {
                submit(grid, spec, state, grid.key(neighbour), neighbour, point.molecule, next);
            }
        }

        if (!next.isEmpty()) {
            return ServiceIteration.submit(Jsons.toTree(state), next,
                    "Iteration " + state.iteration + ": submitted " + next.size() + " optimizations");
        }

        Map<String, Double> energies = state.lowestEnergies();
        verifyLowestEnergies(context, energies);

        ObjectNode properties = Jsons.object();
        properties.set("final_energies", Jsons.toTree(energies));
        properties.put("grid_points", energies.size());
        properties.put("optimizations", context.children().size());
        log.debug("Torsion drive {} finished after {} iterations", context.record().id(), state.iteration);
        return ServiceIteration.done(Jsons.toTree(state), properties,
                "Torsion drive complete: " + energies.size() + " grid points after " + state.iteration
                        + " iterations");
    }

    /**
     * Queue an optimization at a grid point, unless this geometry was already used there.
     */
    private void submit(TorsionGrid grid, JsonNode spec, TorsionDriveState state, String key, int[] indices,
            JsonNode molecule, List<SubTaskRequest> next) {
        String seed = Jsons.hash(molecule);
        TorsionDriveState.GridPoint point = state.point(key);
        if (point.seeds.contains(seed)) {
            return;
        }
        point.seeds.add(seed);

        ObjectNode optSpec = spec.get("optimization_specification").deepCopy();
        ObjectNode optKeywords = optSpec.path("keywords").isObject()
                ? (ObjectNode) optSpec.get("keywords")
                : optSpec.putObject("keywords");
        ObjectNode constraints = optKeywords.path("constraints").isObject()
                ? (ObjectNode) optKeywords.get("constraints")
                : optKeywords.putObject("constraints");
        ArrayNode set = constraints.path("set").isArray()
                ? (ArrayNode) constraints.get("set")
                : constraints.putArray("set");
        for (int dim = 0; dim < grid.dimensions(); dim++) {
            ObjectNode constraint = set.addObject();
            constraint.put("type", "dihedral");
            ArrayNode atoms = constraint.putArray("indices");
            for (int atom : grid.dihedral(dim)) {
                atoms.add(atom);
            }
            constraint.put("value", grid.value(dim, indices[dim]));
        }
        optSpec.set("initial_molecule", molecule);

        ObjectNode extras = Jsons.object();
        extras.put("grid_key", key);
        extras.put("seed", seed);
        next.add(new SubTaskRequest(OptimizationHandler.RECORD_TYPE, optSpec, extras, key));
    }

    /**
     * The lowest energy kept for each grid point must be the lowest final energy among
     * the optimizations run at that point.
     */
    private void verifyLowestEnergies(ServiceContext context, Map<String, Double> energies) {
        Map<Long, JsonNode> childProperties = context.childProperties();
        Map<String, Double> fromChildren = new TreeMap<>();
        for (RecordChild child : context.children()) {
            JsonNode properties = childProperties.get(child.childId());
            if (properties == null || !properties.hasNonNull("final_energy")) {
                continue;
            }
            double energy = properties.get("final_energy").asDouble();
            fromChildren.merge(child.childKey(), energy, Math::min);
        }

        if (!fromChildren.keySet().equals(energies.keySet())) {
            throw new ServiceIterationException("Grid points with results " + fromChildren.keySet()
                    + " do not match the torsion drive state " + energies.keySet());
        }
        for (Map.Entry<String, Double> entry : energies.entrySet()) {
            double expected = fromChildren.get(entry.getKey());
            if (Math.abs(expected - entry.getValue()) > ENERGY_MATCH_TOLERANCE) {
                throw new ServiceIterationException("Lowest energy at grid point " + entry.getKey() + " is "
                        + entry.getValue() + " but the optimizations give " + expected);
            }
        }
    }
}
