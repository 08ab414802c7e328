package fractal.compute.record;

import fractal.compute.exception.FractalException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lookup of record type handlers by record type tag.
 */
public class RecordHandlerRegistry {

    private final Map<String, RecordTypeHandler> handlers = new LinkedHashMap<>();

    public RecordHandlerRegistry register(RecordTypeHandler handler) {
        if (handlers.putIfAbsent(handler.recordType(), handler) != null) {
            throw new IllegalArgumentException("Handler already registered for " + handler.recordType());
        }
        return this;
    }

    /**
     * Registry with the built-in task-backed record types.
     */
    public static RecordHandlerRegistry defaults() {
        return new RecordHandlerRegistry()
                .register(new SinglepointHandler())
                .register(new OptimizationHandler());
    }

    public boolean supports(String recordType) {
        return handlers.containsKey(recordType);
    }

    public RecordTypeHandler get(String recordType) {
        RecordTypeHandler handler = handlers.get(recordType);
        if (handler == null) {
            throw new FractalException("UNKNOWN_RECORD_TYPE", "No handler for record type: " + recordType);
        }
        return handler;
    }

    public Collection<RecordTypeHandler> all() {
        return handlers.values();
    }
}
