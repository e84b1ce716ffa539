package com.chainwatch.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Jakarta Bean Validation bridge to AddressValidator.
 */
public class SolanaAddressValidator implements ConstraintValidator<SolanaAddress, String> {

    private final AddressValidator addressValidator;

    public SolanaAddressValidator(AddressValidator addressValidator) {
        this.addressValidator = addressValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || addressValidator.isValidAddress(value);
    }
}
