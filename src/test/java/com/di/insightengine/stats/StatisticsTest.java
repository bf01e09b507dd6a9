package com.di.insightengine.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Statistics Tests")
class StatisticsTest {

    private static final double EPS = 1e-9;

    @Test
    @DisplayName("Mean and population variance of a small sample")
    void testMeanAndVariance() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};
        assertEquals(5.0, Statistics.mean(values), EPS);
        assertEquals(4.0, Statistics.variance(values), EPS);
        assertEquals(2.0, Statistics.stddev(values), EPS);
    }

    @Test
    @DisplayName("Empty and single-value input yield zero instead of NaN")
    void testShortInput() {
        assertEquals(0.0, Statistics.mean(new double[0]));
        assertEquals(0.0, Statistics.variance(new double[]{42}));
        assertEquals(0.0, Statistics.percentile(new double[0], 50));
    }

    @Test
    @DisplayName("Regression recovers an exact line with rSquared 1")
    void testLinearRegressionExact() {
        double[] y = new double[20];
        for (int i = 0; i < y.length; i++) y[i] = 3.0 + 2.5 * i;
        RegressionResult r = Statistics.linearRegression(y);
        assertEquals(2.5, r.getSlope(), EPS);
        assertEquals(3.0, r.getIntercept(), EPS);
        assertEquals(1.0, r.getRSquared(), EPS);
    }

    @Test
    @DisplayName("Constant series regresses to slope 0 and rSquared 1")
    void testLinearRegressionConstant() {
        RegressionResult r = Statistics.linearRegression(new double[]{7, 7, 7, 7});
        assertEquals(0.0, r.getSlope(), EPS);
        assertEquals(7.0, r.getIntercept(), EPS);
        assertEquals(1.0, r.getRSquared(), EPS);
    }

    @Test
    @DisplayName("Pearson of x against x and -x")
    void testPearsonSigns() {
        double[] x = Statistics.indices(30);
        double[] neg = new double[x.length];
        for (int i = 0; i < x.length; i++) neg[i] = -x[i];
        assertEquals(1.0, Statistics.pearson(x, x), EPS);
        assertEquals(-1.0, Statistics.pearson(x, neg), EPS);
    }

    @Test
    @DisplayName("Pearson is 0 when one side has no variance")
    void testPearsonZeroVariance() {
        assertEquals(0.0, Statistics.pearson(new double[]{1, 2, 3}, new double[]{5, 5, 5}));
        assertEquals(0.0, Statistics.pearson(new double[]{1}, new double[]{1}));
    }

    @Test
    @DisplayName("Percentile interpolates between ranks")
    void testPercentile() {
        double[] values = {10, 20, 30, 40};
        assertEquals(10.0, Statistics.percentile(values, 0), EPS);
        assertEquals(40.0, Statistics.percentile(values, 100), EPS);
        assertEquals(25.0, Statistics.median(values), EPS);
        assertEquals(20.0, Statistics.median(new double[]{30, 10, 20}), EPS);
    }

    @Test
    @DisplayName("Clamp bounds a value on both sides")
    void testClamp() {
        assertEquals(0.0, Statistics.clamp(-1, 0, 1));
        assertEquals(1.0, Statistics.clamp(3, 0, 1));
        assertEquals(0.4, Statistics.clamp(0.4, 0, 1));
    }
}
