package com.di.insightengine.stats;

import lombok.Value;

/**
 * Ordinary least squares fit {@code y = slope * x + intercept}.
 */
@Value
public class RegressionResult {
    double slope;
    double intercept;
    /** 1 - SSres/SStotal; defined as 1 for a constant dependent series. */
    double rSquared;

    public double predict(double x) {
        return slope * x + intercept;
    }
}
