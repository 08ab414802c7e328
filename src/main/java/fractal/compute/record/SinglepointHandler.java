package fractal.compute.record;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.TaskResult;
import fractal.compute.util.Jsons;

import java.util.Locale;
import java.util.Set;

/**
 * Single-point calculations: one program evaluates one molecule.
 *
 * <p>
 * Specification: {@code {program, driver, method, basis, keywords, molecule}}.
 */
public class SinglepointHandler implements RecordTypeHandler {

    public static final String RECORD_TYPE = "singlepoint";

    @Override
    public String recordType() {
        return RECORD_TYPE;
    }

    @Override
    public Set<String> requiredPrograms(ComputeRecord record) {
        return Set.of(RecordSpecs.requiredText(record.specification(), "program").toLowerCase(Locale.ROOT));
    }

    @Override
    public JsonNode generateTaskFunction(ComputeRecord record) {
        JsonNode spec = record.specification();
        ObjectNode input = Jsons.object();
        input.put("driver", spec.path("driver").asText("energy"));
        ObjectNode model = input.putObject("model");
        model.put("method", spec.path("method").asText());
        if (spec.hasNonNull("basis")) {
            model.put("basis", spec.get("basis").asText());
        }
        input.set("keywords", spec.path("keywords").isMissingNode() ? Jsons.object() : spec.get("keywords"));
        input.set("molecule", spec.get("molecule"));

        ObjectNode function = Jsons.object();
        function.put("function", "compute");
        ObjectNode kwargs = function.putObject("kwargs");
        kwargs.set("input_data", input);
        kwargs.put("program", spec.get("program").asText().toLowerCase(Locale.ROOT));
        return function;
    }

    @Override
    public JsonNode extractProperties(ComputeRecord record, TaskResult result) {
        JsonNode payload = result.payload();
        ObjectNode properties = Jsons.object();
        if (payload.has("properties") && payload.get("properties").isObject()) {
            properties.setAll((ObjectNode) payload.get("properties"));
        }
        if (payload.has("return_result")) {
            properties.set("return_result", payload.get("return_result"));
        }
        return properties;
    }
}
