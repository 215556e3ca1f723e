package com.z254.sentinel.guardian.correlation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StatisticsTest {

    @Test
    void pearsonIsSymmetricAndBounded() {
        double[] x = {1, 2, 3, 4, 5};
        double[] y = {2, 4, 5, 4, 5};

        double r = Statistics.pearson(x, y);

        assertThat(r).isEqualTo(Statistics.pearson(y, x), within(1e-12));
        assertThat(r).isBetween(-1.0, 1.0);
        assertThat(Statistics.pearson(x, new double[]{10, 8, 6, 4, 2})).isCloseTo(-1.0, within(1e-9));
    }

    @Test
    void pearsonOfConstantSeriesIsZero() {
        assertThat(Statistics.pearson(new double[]{1, 2, 3}, new double[]{7, 7, 7})).isZero();
        assertThat(Statistics.pearson(new double[0], new double[0])).isZero();
    }

    @Test
    void regressionFitsLine() {
        Statistics.Regression regression = Statistics.regression(
                new double[]{0, 1, 2, 3}, new double[]{10, 20, 30, 40});

        assertThat(regression.slope()).isCloseTo(10.0, within(1e-9));
        assertThat(regression.intercept()).isCloseTo(10.0, within(1e-9));
        assertThat(regression.rSquared()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void regressionOfConstantHasZeroRSquared() {
        Statistics.Regression regression = Statistics.regression(new double[]{0, 1, 2}, new double[]{5, 5, 5});

        assertThat(regression.slope()).isZero();
        assertThat(regression.rSquared()).isZero();
    }

    @Test
    void regressionWithoutSpreadInXIsFlatAtMean() {
        Statistics.Regression regression = Statistics.regression(new double[]{2, 2, 2}, new double[]{1, 2, 6});

        assertThat(regression.slope()).isZero();
        assertThat(regression.intercept()).isCloseTo(3.0, within(1e-9));
        assertThat(regression.rSquared()).isZero();
    }

    @Test
    void meanOfEmptySeriesIsZero() {
        assertThat(Statistics.mean(new double[0])).isZero();
        assertThat(Statistics.mean(new double[]{1, 2, 6})).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void mismatchedLengthsAreRejected() {
        assertThatThrownBy(() -> Statistics.pearson(new double[]{1}, new double[]{1, 2}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
