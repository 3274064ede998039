package com.harvestlink.provenance.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class CurrencyConverterTest {

    private static final BigInteger ONE_NATIVE = BigInteger.TEN.pow(18);

    private final CurrencyConverter converter = new CurrencyConverter(new BigDecimal("200000"), "INR");

    @Test
    @DisplayName("One native unit converts at the configured rate")
    void toDisplay() {
        assertEquals(new BigDecimal("200000.00"), converter.toDisplay(ONE_NATIVE));
        assertEquals(new BigDecimal("0.00"), converter.toDisplay(null));
    }

    @Test
    @DisplayName("Display amounts round half up to two decimals")
    void rounding() {
        // 0.025 INR worth of wei
        BigInteger wei = new BigInteger("125000000000");
        assertEquals(new BigDecimal("0.03"), converter.toDisplay(wei));
    }

    @Test
    @DisplayName("Display to wei truncates fractions of a wei")
    void toWei() {
        assertEquals(ONE_NATIVE, converter.toWei(new BigDecimal("200000")));
        assertEquals(new BigInteger("5000000000000"), converter.toWei(new BigDecimal("1")));
        assertEquals(BigInteger.ZERO, converter.toWei(BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Negative amounts and non-positive rates are rejected")
    void invalidInput() {
        assertThrows(IllegalArgumentException.class, () -> converter.toWei(new BigDecimal("-1")));
        assertThrows(IllegalArgumentException.class, () -> converter.toWei(null));
        assertThrows(IllegalArgumentException.class, () -> new CurrencyConverter(BigDecimal.ZERO, "INR"));
    }
}
