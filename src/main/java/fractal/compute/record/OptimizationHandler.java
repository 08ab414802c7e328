package fractal.compute.record;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.TaskResult;
import fractal.compute.util.Jsons;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Geometry optimizations: an optimizer program driving a quantum chemistry program.
 *
 * <p>
 * Specification: {@code {program, keywords, protocols, qc_specification: {program, method,
 * basis, keywords}, initial_molecule}}. Constraints for constrained optimizations live in
 * {@code keywords.constraints}.
 * <p>
 * A successful result carries {@code energies} (one per optimization step) and
 * {@code final_molecule}.
 */
public class OptimizationHandler implements RecordTypeHandler {

    public static final String RECORD_TYPE = "optimization";

    @Override
    public String recordType() {
        return RECORD_TYPE;
    }

    @Override
    public Set<String> requiredPrograms(ComputeRecord record) {
        JsonNode spec = record.specification();
        Set<String> programs = new TreeSet<>();
        programs.add(RecordSpecs.requiredText(spec, "program").toLowerCase(Locale.ROOT));
        programs.add(RecordSpecs.requiredText(spec.path("qc_specification"), "program").toLowerCase(Locale.ROOT));
        return programs;
    }

    @Override
    public JsonNode generateTaskFunction(ComputeRecord record) {
        JsonNode spec = record.specification();
        JsonNode qcSpec = spec.path("qc_specification");

        ObjectNode input = Jsons.object();
        ObjectNode inputSpec = input.putObject("input_specification");
        ObjectNode model = inputSpec.putObject("model");
        model.put("method", qcSpec.path("method").asText());
        if (qcSpec.hasNonNull("basis")) {
            model.put("basis", qcSpec.get("basis").asText());
        }
        inputSpec.set("keywords", qcSpec.path("keywords").isMissingNode() ? Jsons.object() : qcSpec.get("keywords"));

        ObjectNode keywords = Jsons.object();
        if (spec.path("keywords").isObject()) {
            keywords.setAll((ObjectNode) spec.get("keywords"));
        }
        keywords.put("program", qcSpec.get("program").asText().toLowerCase(Locale.ROOT));
        input.set("keywords", keywords);
        input.set("protocols", spec.path("protocols").isMissingNode() ? Jsons.object() : spec.get("protocols"));
        input.set("initial_molecule", spec.get("initial_molecule"));

        ObjectNode function = Jsons.object();
        function.put("function", "compute_procedure");
        ObjectNode kwargs = function.putObject("kwargs");
        kwargs.set("input_data", input);
        kwargs.put("procedure", spec.get("program").asText().toLowerCase(Locale.ROOT));
        return function;
    }

    @Override
    public JsonNode extractProperties(ComputeRecord record, TaskResult result) {
        JsonNode payload = result.payload();
        JsonNode energies = payload.get("energies");
        if (energies == null || !energies.isArray() || energies.isEmpty()) {
            throw new IllegalArgumentException("Optimization result has no energies");
        }
        JsonNode finalMolecule = payload.get("final_molecule");
        if (finalMolecule == null || finalMolecule.isNull()) {
            throw new IllegalArgumentException("Optimization result has no final molecule");
        }

        ObjectNode properties = Jsons.object();
        properties.set("energies", energies.deepCopy());
        properties.put("final_energy", energies.get(energies.size() - 1).asDouble());
        properties.set("initial_molecule", record.specification().get("initial_molecule"));
        properties.set("final_molecule", finalMolecule);
        JsonNode trajectory = payload.get("trajectory");
        if (trajectory instanceof ArrayNode) {
            properties.put("trajectory_length", trajectory.size());
        }
        return properties;
    }
}
