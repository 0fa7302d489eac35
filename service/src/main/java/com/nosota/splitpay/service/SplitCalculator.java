package com.nosota.splitpay.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currency arithmetic for group splits. All amounts use 2 decimal places, HALF_UP.
 */
public final class SplitCalculator {

    public static final int CURRENCY_SCALE = 2;

    private SplitCalculator() {
    }

    /**
     * Share of each member. The divisor is floored at 1, so a group without members
     * carries the whole budget as its split until someone joins.
     *
     * @param budget      Group budget
     * @param memberCount Current number of members
     * @return budget / max(1, memberCount), rounded to 2 decimals
     */
    public static BigDecimal split(BigDecimal budget, long memberCount) {
        long divisor = Math.max(1L, memberCount);
        return budget.divide(BigDecimal.valueOf(divisor), CURRENCY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal normalize(BigDecimal amount) {
        return amount.setScale(CURRENCY_SCALE, RoundingMode.HALF_UP);
    }
}
