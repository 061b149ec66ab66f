package com.fintech.supply.util;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Conversions between smallest-unit (wei) integer strings and human-scale
 * token amounts. All supply arithmetic goes through {@link BigDecimal};
 * no value is ever converted to a floating point type.
 */
public final class SupplyUnits {

    /**
     * Number of decimal places of the token (10^18 smallest units per token).
     */
    public static final int DECIMALS = 18;

    private SupplyUnits() {
    }

    /**
     * Parses an integer-valued smallest-unit string.
     *
     * @throws NumberFormatException if the value is not a base-10 integer
     */
    public static BigDecimal parseWei(String wei) {
        if (wei == null || wei.isBlank()) {
            throw new NumberFormatException("Empty amount");
        }
        return new BigDecimal(new BigInteger(wei.trim()));
    }

    /**
     * Converts a smallest-unit string to whole tokens. Exact: shifting the
     * decimal point never rounds.
     */
    public static BigDecimal fromWei(String wei) {
        return parseWei(wei).movePointLeft(DECIMALS);
    }

    public static boolean isNegative(BigDecimal value) {
        return value.signum() < 0;
    }

    /**
     * True when {@code actual} differs from {@code expected} by more than
     * {@code relativeTolerance} of {@code reference}.
     */
    public static boolean exceedsTolerance(BigDecimal expected, BigDecimal actual,
                                           BigDecimal reference, BigDecimal relativeTolerance) {
        BigDecimal difference = expected.subtract(actual).abs();
        BigDecimal tolerance = reference.abs().multiply(relativeTolerance);
        return difference.compareTo(tolerance) > 0;
    }
}
