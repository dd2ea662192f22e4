package kr.jemi.boxoffice.common.validation;

public interface SelfValidating {

    default void validateSelf() {
        ValidationUtils.validate(this);
    }
}
