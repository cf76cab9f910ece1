package info.mouts.foodorders.service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import info.mouts.foodorders.exception.InvalidRequestException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates order payloads before any mutation and reports every offending
 * field at once.
 */
@Component
@Slf4j
public class OrderRequestValidator {
    private final Validator validator;

    public OrderRequestValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * Validates the given payload against its bean constraints.
     *
     * @param request the payload to check
     * @throws InvalidRequestException if the payload is null or any constraint
     *                                 is violated; its field errors are keyed by
     *                                 property path, e.g. {@code items[0].price}
     */
    public void validate(Object request) {
        if (request == null) {
            throw new InvalidRequestException("Request body is required");
        }

        Set<ConstraintViolation<Object>> violations = validator.validate(request);
        if (violations.isEmpty()) {
            return;
        }

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        violations.stream()
                .sorted(Comparator.comparing((ConstraintViolation<Object> v) -> v.getPropertyPath().toString())
                        .thenComparing(ConstraintViolation::getMessage))
                .forEach(v -> fieldErrors.putIfAbsent(v.getPropertyPath().toString(), v.getMessage()));

        log.warn("Rejected {}: {}", request.getClass().getSimpleName(), fieldErrors);
        throw new InvalidRequestException(fieldErrors.values().iterator().next(), fieldErrors);
    }
}
