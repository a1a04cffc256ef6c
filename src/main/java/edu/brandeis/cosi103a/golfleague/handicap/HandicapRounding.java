package edu.brandeis.cosi103a.golfleague.handicap;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal rounding shared by the handicap calculators.
 * Values go through their shortest decimal representation first, so 9.5 stays 9.5.
 */
public final class HandicapRounding {

    private HandicapRounding() {}

    /**
     * Round to one decimal place, halves away from zero.
     */
    public static double toTenth(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Round to a whole number, halves away from zero.
     */
    public static int toWhole(double value) {
        return BigDecimal.valueOf(value).setScale(0, RoundingMode.HALF_UP).intValueExact();
    }
}
