package com.walletcustody.custody.validation;

import com.walletcustody.common.EvmAddresses;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class EvmAddressValidator implements ConstraintValidator<EvmAddress, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || EvmAddresses.isValid(value);
    }
}
