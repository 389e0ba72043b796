package com.jobflow.core;

import com.google.gson.JsonElement;

/**
 * Validates an untyped payload into the typed value a job handler receives.
 *
 * <p>Implementations must be stateless: the same schema instance validates every trigger of a job
 * and every dequeued payload, from any thread.</p>
 *
 * @param <T> type of the validated payload
 * @see BeanSchema
 */
@FunctionalInterface
public interface JobSchema<T> {

    /**
     * @param payload payload as a JSON tree
     * @return the validated, typed payload
     * @throws SchemaViolationException if the payload does not match
     */
    T parse(JsonElement payload);

    /**
     * Schema of a record or bean type: the JSON payload is bound to {@code type} and then checked
     * against its Bean Validation constraints.
     */
    static <T> JobSchema<T> of(Class<T> type) {
        return new BeanSchema<>(type);
    }
}
