package com.walletcustody.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Exact conversion between a decimal display amount (e.g. "1.5" ETH) and the ledger's integer smallest unit
 * (wei). All arithmetic is BigDecimal; sub-unit remainders are truncated toward zero.
 */
public final class AmountConverter {

    public static final int DEFAULT_DECIMALS = 18;
    public static final BigDecimal DEFAULT_MAX_SUPPLY = new BigDecimal("120000000");

    private final int decimals;
    private final BigDecimal maxSupply;

    public AmountConverter() {
        this(DEFAULT_DECIMALS, DEFAULT_MAX_SUPPLY);
    }

    public AmountConverter(int decimals, BigDecimal maxSupply) {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must be non-negative, got: " + decimals);
        }
        this.decimals = decimals;
        this.maxSupply = maxSupply;
    }

    /**
     * Parses and converts a decimal amount to the smallest unit.
     *
     * @throws InvalidAmountException when the value is not a number, is not positive, exceeds max supply
     *                                or is smaller than one smallest unit
     */
    public BigInteger toSmallestUnit(String decimalValue) {
        if (decimalValue == null || decimalValue.isBlank()) {
            throw new InvalidAmountException("Amount is required");
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(decimalValue.trim());
        } catch (NumberFormatException e) {
            throw new InvalidAmountException("Amount is not a number: " + decimalValue, e);
        }
        return toSmallestUnit(parsed);
    }

    public BigInteger toSmallestUnit(BigDecimal decimalValue) {
        if (decimalValue == null) {
            throw new InvalidAmountException("Amount is required");
        }
        if (decimalValue.signum() <= 0) {
            throw new InvalidAmountException("Amount must be greater than zero, got: " + decimalValue);
        }
        if (maxSupply != null && decimalValue.compareTo(maxSupply) > 0) {
            throw new InvalidAmountException("Amount exceeds maximum supply " + maxSupply.toPlainString()
                    + ": " + decimalValue);
        }
        BigDecimal stripped = decimalValue.stripTrailingZeros();
        // adjusted exponent: floor(log10(value))
        if (stripped.precision() - stripped.scale() - 1 < -decimals) {
            throw new InvalidAmountException("Amount is below the smallest unit: " + decimalValue);
        }
        try {
            return stripped.setScale(decimals, RoundingMode.DOWN).unscaledValue();
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("Amount is out of range: " + decimalValue, e);
        }
    }

    /**
     * Converts a smallest-unit integer back to a decimal amount with exactly {@code decimals} scale.
     *
     * @throws InvalidAmountException when the value is null or negative
     */
    public BigDecimal toDecimalUnit(BigInteger integerValue) {
        if (integerValue == null) {
            throw new InvalidAmountException("Amount is required");
        }
        if (integerValue.signum() < 0) {
            throw new InvalidAmountException("Amount must not be negative, got: " + integerValue);
        }
        return new BigDecimal(integerValue, decimals);
    }

    /** Plain (no exponent) decimal rendering, trailing zeros stripped. Used for log lines. */
    public String formatDecimalUnit(BigInteger integerValue) {
        BigDecimal value = toDecimalUnit(integerValue).stripTrailingZeros();
        return value.signum() == 0 ? "0" : value.toPlainString();
    }

    public boolean isValidDecimalAmount(String value) {
        if (value == null || value.isBlank()) return false;
        try {
            return new BigDecimal(value.trim()).signum() > 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public int getDecimals() {
        return decimals;
    }
}
