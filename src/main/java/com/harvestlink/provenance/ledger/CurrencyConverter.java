package com.harvestlink.provenance.ledger;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Converts between the ledger's native unit and the display currency at a
 * fixed configured rate. There is no live market feed.
 */
@Component
public class CurrencyConverter {

    private static final BigDecimal WEI_PER_NATIVE = BigDecimal.TEN.pow(18);
    private static final int DISPLAY_SCALE = 2;

    private final BigDecimal displayPerNative;
    private final String displayCurrency;

    public CurrencyConverter(@Value("${provenance.currency.display-per-native:200000}") BigDecimal displayPerNative,
                             @Value("${provenance.currency.display-code:INR}") String displayCurrency) {
        if (displayPerNative == null || displayPerNative.signum() <= 0) {
            throw new IllegalArgumentException("Display conversion rate must be positive");
        }
        this.displayPerNative = displayPerNative;
        this.displayCurrency = displayCurrency;
    }

    /**
     * Ledger amount (wei) to display currency, rounded to two decimals.
     */
    public BigDecimal toDisplay(BigInteger wei) {
        if (wei == null) {
            return BigDecimal.ZERO.setScale(DISPLAY_SCALE);
        }
        return new BigDecimal(wei)
                .multiply(displayPerNative)
                .divide(WEI_PER_NATIVE, DISPLAY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Display amount to ledger amount (wei), truncating sub-wei fractions.
     */
    public BigInteger toWei(BigDecimal displayAmount) {
        if (displayAmount == null || displayAmount.signum() < 0) {
            throw new IllegalArgumentException("Display amount must be non-negative");
        }
        return displayAmount
                .multiply(WEI_PER_NATIVE)
                .divide(displayPerNative, 0, RoundingMode.DOWN)
                .toBigIntegerExact();
    }

    public String getDisplayCurrency() {
        return displayCurrency;
    }
}
