package com.walletcustody.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Persisted custodied transaction, one row per hash (table {@code transactions}).
 * After insert only {@link #status} and {@link #updatedAt} change.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Transaction {

    @EqualsAndHashCode.Include
    private String hash;
    /** Upper-cased native symbol, token symbol, or UNKNOWN. */
    private String asset;
    private String addressFrom;
    private String addressTo;
    /** Smallest unit. For token calls this is the decoded Transfer value, not the tx value field. */
    private BigInteger value;
    private boolean token;
    private TransactionType type;
    private TransactionStatus status;
    /** gasLimit * maxFeePerGas; set only for transactions originated here. */
    private BigInteger effectiveFee;
    private String contractAddress;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant deletedAt;
}
