package com.jobsched.variable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Default implementation of VariableResolver.
 */
public class DefaultVariableResolver implements VariableResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultVariableResolver.class);

    @Override
    public Optional<Object> resolve(String reference, EvaluationContext context) {
        if (reference == null || reference.isEmpty() || context == null) {
            return Optional.empty();
        }
        try {
            VariableSource source = VariableSource.fromReference(reference);
            return context.get(source, VariableSource.extractName(reference));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid variable reference: {}", reference);
            return Optional.empty();
        }
    }

    @Override
    public Optional<Double> resolveAsDouble(String reference, EvaluationContext context) {
        return resolve(reference, context).flatMap(DefaultVariableResolver::toDouble);
    }

    static Optional<Double> toDouble(Object value) {
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
