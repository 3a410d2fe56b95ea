package com.costsentinel.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding and cost-delta arithmetic shared by candidates and records.
 *
 * @since 1.0.0
 */
public final class Amounts {

    private Amounts() {
        // utility class
    }

    /**
     * Round half-up to two decimals. Non-finite values are returned as-is.
     */
    public static double round2(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * @return {@code cost - baseline}, rounded
     */
    public static double costDifference(double cost, double baseline) {
        return round2(cost - baseline);
    }

    /**
     * Percentage increase of {@code cost} over {@code baseline}. A baseline of
     * zero or less yields {@code 0} rather than an infinite ratio.
     */
    public static double percentageIncrease(double cost, double baseline) {
        if (baseline <= 0) {
            return 0.0;
        }
        return round2((cost - baseline) / baseline * 100.0);
    }
}
