package com.walletcustody.custody.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * 0x followed by 40 hex digits. Null passes; combine with {@code @NotBlank} for required fields.
 * Error code for API: INVALID_ADDRESS.
 */
@Target({FIELD, PARAMETER, RECORD_COMPONENT})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = EvmAddressValidator.class)
public @interface EvmAddress {

    String message() default "INVALID_ADDRESS";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
