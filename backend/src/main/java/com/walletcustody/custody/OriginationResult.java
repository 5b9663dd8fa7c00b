package com.walletcustody.custody;

import com.walletcustody.domain.TransactionStatus;

import java.math.BigInteger;
import java.time.Instant;

public record OriginationResult(String hash, TransactionStatus status, BigInteger effectiveFee, Instant createdAt) {
}
