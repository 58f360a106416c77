package com.allowance.domain.model;

import com.allowance.domain.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money helpers. Amounts are dollars with at most two decimal places.
 */
public final class Amounts {

    public static final int SCALE = 2;

    private Amounts() {
    }

    /**
     * Validates a purchase amount and returns it at scale 2.
     */
    public static BigDecimal requirePositive(BigDecimal amount, String field) {
        if (amount == null) {
            throw new ValidationException(field + " is required");
        }
        if (amount.signum() <= 0) {
            throw new ValidationException(field + " must be greater than zero");
        }
        return requireCents(amount, field);
    }

    public static BigDecimal requireNonNegative(BigDecimal amount, String field) {
        if (amount == null) {
            throw new ValidationException(field + " is required");
        }
        if (amount.signum() < 0) {
            throw new ValidationException(field + " cannot be negative");
        }
        return requireCents(amount, field);
    }

    public static BigDecimal zeroIfNull(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO : amount;
    }

    public static String format(BigDecimal amount) {
        return "$" + amount.setScale(SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    private static BigDecimal requireCents(BigDecimal amount, String field) {
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw new ValidationException(field + " cannot have more than 2 decimal places");
        }
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }
}
