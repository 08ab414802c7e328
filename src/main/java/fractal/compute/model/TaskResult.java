package fractal.compute.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Result payload returned by a compute manager for a single task.
 *
 * <p>
 * The payload is opaque apart from a few well-known fields:
 * {@code success} (boolean), {@code error} ({@code {error_type, error_message}})
 * on failure, and the optional {@code stdout} and {@code provenance} outputs.
 * Everything else is interpreted by the record type handler.
 */
public final class TaskResult {

    private final JsonNode payload;

    private TaskResult(JsonNode payload) {
        this.payload = Objects.requireNonNull(payload, "payload is required");
    }

    public static TaskResult of(JsonNode payload) {
        return new TaskResult(payload == null ? NullNode.getInstance() : payload);
    }

    public JsonNode payload() {
        return payload;
    }

    public boolean isSuccess() {
        JsonNode success = payload.get("success");
        return success != null && success.isBoolean() && success.booleanValue();
    }

    /**
     * The failure described by an explicit {@code success=false} payload.
     * Empty for successful results and for payloads that are not a recognised failure.
     */
    public Optional<ComputeError> failure() {
        if (isSuccess()) {
            return Optional.empty();
        }
        JsonNode success = payload.get("success");
        JsonNode error = payload.get("error");
        if (success == null || !success.isBoolean() || error == null || !error.isObject()) {
            return Optional.empty();
        }
        JsonNode type = error.get("error_type");
        JsonNode message = error.get("error_message");
        if (type == null || !type.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(new ComputeError(type.asText(), message == null ? "" : message.asText()));
    }

    public String stdout() {
        JsonNode stdout = payload.get("stdout");
        return stdout == null || stdout.isNull() ? null : stdout.asText();
    }

    public JsonNode provenance() {
        JsonNode provenance = payload.get("provenance");
        return provenance == null || provenance.isNull() ? null : provenance;
    }

    @Override
    public String toString() {
        return "TaskResult{success=" + isSuccess() + "}";
    }
}
