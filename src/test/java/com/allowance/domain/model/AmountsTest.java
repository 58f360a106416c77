package com.allowance.domain.model;

import com.allowance.domain.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AmountsTest {

    @Test
    void requirePositive_normalizesToCents() {
        assertEquals(new BigDecimal("5.00"), Amounts.requirePositive(new BigDecimal("5"), "amount"));
        assertEquals(new BigDecimal("5.10"), Amounts.requirePositive(new BigDecimal("5.100"), "amount"));
    }

    @Test
    void requirePositive_rejectsZeroNegativeAndFractionsOfCents() {
        assertThrows(ValidationException.class, () -> Amounts.requirePositive(BigDecimal.ZERO, "amount"));
        assertThrows(ValidationException.class, () -> Amounts.requirePositive(new BigDecimal("-1.00"), "amount"));
        assertThrows(ValidationException.class, () -> Amounts.requirePositive(new BigDecimal("1.001"), "amount"));
        assertThrows(ValidationException.class, () -> Amounts.requirePositive(null, "amount"));
    }

    @Test
    void requireNonNegative_acceptsZero() {
        assertEquals(0, Amounts.requireNonNegative(BigDecimal.ZERO, "limitAmount").signum());
        assertThrows(ValidationException.class, () -> Amounts.requireNonNegative(new BigDecimal("-0.01"), "limitAmount"));
    }

    @Test
    void format_usesDollarsAndCents() {
        assertEquals("$20.00", Amounts.format(new BigDecimal("20")));
        assertEquals("$5.50", Amounts.format(new BigDecimal("5.5000")));
    }
}
