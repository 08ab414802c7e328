package fractal.compute.record;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Accessors for required fields of record specifications.
 */
public final class RecordSpecs {

    private RecordSpecs() {
    }

    public static String requiredText(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Specification is missing '" + field + "'");
        }
        return value.asText();
    }
}
