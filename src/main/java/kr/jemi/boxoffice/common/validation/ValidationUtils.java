package kr.jemi.boxoffice.common.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

public final class ValidationUtils {

    private static final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private ValidationUtils() {}

    /**
     * Bean Validation 제약을 검사하고 위반 시 {@link IllegalArgumentException}을 던진다.
     * 메시지에는 위반된 모든 속성이 경로 순으로 포함된다.
     */
    public static void validate(Object target) {
        Set<ConstraintViolation<Object>> violations = validator.validate(target);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException(
                    target.getClass().getSimpleName() + " 검증 실패: " + message);
        }
    }
}
