package com.walletcustody.common;

import java.util.regex.Pattern;

public final class EvmAddresses {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private EvmAddresses() {
    }

    public static boolean isValid(String address) {
        if (address == null || address.isBlank()) return false;
        return EVM_ADDRESS.matcher(address.trim()).matches();
    }
}
