package com.walletcustody.custody;

import com.walletcustody.custody.validation.EvmAddress;
import jakarta.validation.constraints.NotBlank;

/**
 * Withdrawal from a custodied wallet. {@code value} is a decimal amount of {@code asset};
 * {@code contractAddress} is required for non-native assets.
 */
public record OriginationRequest(
        @NotBlank @EvmAddress String from,
        @NotBlank @EvmAddress String to,
        @NotBlank String asset,
        @NotBlank String value,
        @EvmAddress String contractAddress
) {
}
