package com.jobflow.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

/**
 * {@link JobSchema} backed by a record or bean type annotated with Jakarta Bean Validation
 * constraints.
 *
 * <pre>{@code
 * public record InvitePayload(@NotBlank @Email String email, @NotBlank String teamId) {
 * }
 *
 * JobSchema<InvitePayload> schema = JobSchema.of(InvitePayload.class);
 * }</pre>
 *
 * <p>Binding uses the shared Gson instance of {@link Payloads}; constraint checking uses one
 * process-wide Hibernate Validator with parameter interpolation (no expression language).</p>
 */
public final class BeanSchema<T> implements JobSchema<T> {

    private static final ValidatorFactory factory = Validation.byDefaultProvider()
            .configure()
            .messageInterpolator(new ParameterMessageInterpolator())
            .buildValidatorFactory();

    private static final Validator validator = factory.getValidator();

    private final Class<T> type;

    public BeanSchema(Class<T> type) {
        this.type = type;
    }

    public Class<T> getType() {
        return type;
    }

    @Override
    public T parse(JsonElement payload) {
        if (payload == null || payload.isJsonNull()) {
            throw new SchemaViolationException(List.of("payload: must not be null"));
        }
        if (!payload.isJsonObject()) {
            throw new SchemaViolationException(List.of("payload: expected an object for " + type.getSimpleName()));
        }

        T value;
        try {
            value = Payloads.fromTree(payload, type);
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new SchemaViolationException("payload: " + e.getMessage(), e);
        }

        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            List<String> messages = new ArrayList<>();
            violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .forEach(v -> messages.add(v.getPropertyPath() + ": " + v.getMessage()));
            throw new SchemaViolationException(messages);
        }
        return value;
    }

    @Override
    public String toString() {
        return "BeanSchema{" + type.getSimpleName() + "}";
    }
}
