package com.walletcustody.ingestion.wallet;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Custodied-address lookup. Addresses are compared case-insensitively; soft-deleted wallets are not custodied.
 */
@Service
@RequiredArgsConstructor
public class WalletDirectory {

    private static final String EXISTS_SQL =
            "SELECT EXISTS (SELECT 1 FROM wallets WHERE LOWER(address) = LOWER(?) AND deleted_at IS NULL)";

    private final JdbcTemplate jdbcTemplate;

    public boolean isCustodied(String address) {
        if (address == null || address.isBlank()) {
            return false;
        }
        Boolean exists = jdbcTemplate.queryForObject(EXISTS_SQL, Boolean.class, address.trim());
        return Boolean.TRUE.equals(exists);
    }
}
