package com.z254.sentinel.guardian.correlation;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.commons.math3.util.Precision;

/**
 * Pearson correlation and least-squares fits over paired samples.
 * <p>
 * Degenerate inputs (fewer than two samples, zero variance) yield 0 instead of NaN.
 */
public final class Statistics {

    private Statistics() {
    }

    /**
     * Pearson correlation coefficient; 0 when either side has zero variance.
     */
    public static double pearson(double[] x, double[] y) {
        requireSameLength(x, y);
        if (x.length < 2) {
            return 0.0;
        }
        double r = new PearsonsCorrelation().correlation(x, y);
        return Double.isNaN(r) ? 0.0 : r;
    }

    /**
     * Least-squares fit of y on x. R-squared is clamped to [0, 1] and is 0 for constant y.
     */
    public static Regression regression(double[] x, double[] y) {
        requireSameLength(x, y);
        if (x.length == 0) {
            return new Regression(0.0, 0.0, 0.0);
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < x.length; i++) {
            regression.addData(x[i], y[i]);
        }

        double slope = regression.getSlope();
        if (Double.isNaN(slope)) {
            return new Regression(0.0, StatUtils.mean(y), 0.0);
        }
        double rSquared = regression.getRSquare();
        rSquared = Double.isNaN(rSquared) ? 0.0 : Math.max(0.0, Math.min(1.0, rSquared));
        return new Regression(slope, regression.getIntercept(), rSquared);
    }

    public static double mean(double[] values) {
        return values.length == 0 ? 0.0 : StatUtils.mean(values);
    }

    public static double round(double value, int decimals) {
        return Precision.round(value, decimals);
    }

    private static void requireSameLength(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Series lengths differ: " + x.length + " vs " + y.length);
        }
    }

    public record Regression(double slope, double intercept, double rSquared) {
    }
}
