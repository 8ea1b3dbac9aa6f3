/* (C)2026 */
package com.ammann.randomness.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.randomness.service.UniformityStatisticsService.KolmogorovSmirnovResult;
import com.ammann.randomness.support.TestEntropyPools;
import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for {@link UniformityStatisticsService}.
 *
 * <p>Checks the chi-square, Kolmogorov-Smirnov and correlation helpers against closed-form
 * values and textbook critical points.
 */
class UniformityStatisticsServiceTest
{

    private final UniformityStatisticsService service = new UniformityStatisticsService();

    @Test
    void chiSquareIsZeroForPerfectlyEvenBins()
    {
        double[] values = TestEntropyPools.evenlySpaced(100);

        assertThat(service.chiSquareUniformity(values, 10)).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void chiSquareForAllValuesInOneBin()
    {
        double[] values = new double[100];
        Arrays.fill(values, 0.05);

        // (100 - 10)^2 / 10 + 9 * (0 - 10)^2 / 10
        assertThat(service.chiSquareUniformity(values, 10)).isCloseTo(900.0, within(1e-9));
    }

    @Test
    void chiSquarePutsOneIntoTheLastBin()
    {
        double[] values = new double[20];
        Arrays.fill(values, 0, 10, 0.0);
        Arrays.fill(values, 10, 20, 1.0);

        assertThat(service.chiSquareUniformity(values, 2)).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void chiSquareOfEmptyInputIsNaN()
    {
        assertThat(service.chiSquareUniformity(new double[0], 10)).isNaN();
    }

    @Test
    void chiSquareRejectsSingleBin()
    {
        assertThatThrownBy(() -> service.chiSquareUniformity(new double[] {0.5}, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @CsvSource({
            "16.919, 9, 0.0500",
            "21.666, 9, 0.0100",
            "3.841, 1, 0.0500",
            "18.307, 10, 0.0500"
    })
    void chiSquareSurvivalMatchesCriticalValues(double statistic, int df, double expected)
    {
        assertThat(service.chiSquareSurvival(statistic, df)).isCloseTo(expected, within(5e-4));
    }

    @Test
    void chiSquareSurvivalWithTwoDegreesOfFreedomIsExponential()
    {
        assertThat(service.chiSquareSurvival(9.0, 2)).isCloseTo(Math.exp(-4.5), within(1e-10));
    }

    @Test
    void chiSquareSurvivalEdgeCases()
    {
        assertThat(service.chiSquareSurvival(0.0, 9)).isEqualTo(1.0);
        assertThat(service.chiSquareSurvival(Double.NaN, 9)).isEqualTo(0.0);
        assertThat(service.chiSquareSurvival(10_000.0, 9)).isCloseTo(0.0, within(1e-12));
        assertThatThrownBy(() -> service.chiSquareSurvival(1.0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void logGammaMatchesFactorials()
    {
        assertThat(service.logGamma(1.0)).isCloseTo(0.0, within(1e-10));
        assertThat(service.logGamma(5.0)).isCloseTo(Math.log(24.0), within(1e-10));
        assertThat(service.logGamma(0.5)).isCloseTo(0.5 * Math.log(Math.PI), within(1e-10));
    }

    @Test
    void kolmogorovSmirnovAcceptsEvenlySpacedSample()
    {
        KolmogorovSmirnovResult result = service.kolmogorovSmirnovUniform(TestEntropyPools.evenlySpaced(100));

        assertThat(result.statistic()).isCloseTo(0.005, within(1e-12));
        assertThat(result.pValue()).isGreaterThan(0.99);
    }

    @Test
    void kolmogorovSmirnovRejectsDegenerateSample()
    {
        double[] values = new double[200];
        Arrays.fill(values, 0.01);

        KolmogorovSmirnovResult result = service.kolmogorovSmirnovUniform(values);

        assertThat(result.statistic()).isCloseTo(0.99, within(1e-12));
        assertThat(result.pValue()).isLessThan(1e-6);
    }

    @Test
    void kolmogorovSmirnovAcceptsSeededUniformDraws()
    {
        double[] values = new Random(42).doubles(2000).toArray();

        assertThat(service.kolmogorovSmirnovUniform(values).pValue()).isGreaterThan(0.001);
    }

    @Test
    void twoSampleKolmogorovSmirnovOnIdenticalSamplesIsZero()
    {
        double[] values = new Random(7).doubles(500).toArray();

        KolmogorovSmirnovResult result = service.kolmogorovSmirnovTwoSample(values, values.clone());

        assertThat(result.statistic()).isZero();
        assertThat(result.pValue()).isEqualTo(1.0);
    }

    @Test
    void twoSampleKolmogorovSmirnovSeparatesDisjointSamples()
    {
        double[] low = new Random(1).doubles(300, 0.0, 0.4).toArray();
        double[] high = new Random(2).doubles(300, 0.6, 1.0).toArray();

        KolmogorovSmirnovResult result = service.kolmogorovSmirnovTwoSample(low, high);

        assertThat(result.statistic()).isCloseTo(1.0, within(1e-12));
        assertThat(result.pValue()).isLessThan(1e-6);
    }

    @Test
    void kolmogorovSmirnovRejectsEmptySamples()
    {
        assertThatThrownBy(() -> service.kolmogorovSmirnovUniform(new double[0]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.kolmogorovSmirnovTwoSample(new double[] {0.1}, new double[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pearsonCorrelationOfLinearRelations()
    {
        double[] x = {1, 2, 3, 4, 5};
        double[] up = {3, 5, 7, 9, 11};
        double[] down = {-1, -2, -3, -4, -5};

        assertThat(service.pearsonCorrelation(x, up)).isCloseTo(1.0, within(1e-12));
        assertThat(service.pearsonCorrelation(x, down)).isCloseTo(-1.0, within(1e-12));
    }

    @Test
    void pearsonCorrelationWithoutVarianceIsZero()
    {
        assertThat(service.pearsonCorrelation(new double[] {1, 2, 3}, new double[] {4, 4, 4})).isZero();
    }

    @Test
    void pearsonCorrelationRejectsLengthMismatch()
    {
        assertThatThrownBy(() -> service.pearsonCorrelation(new double[] {1, 2}, new double[] {1}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("differ in length");
    }

    @Test
    void lagOneAutocorrelationOfAlternatingSequenceIsMinusOne()
    {
        double[] values = new double[50];
        for (int i = 0; i < values.length; i++) {
            values[i] = i % 2;
        }

        assertThat(service.lagOneAutocorrelation(values)).isCloseTo(-1.0, within(1e-12));
        assertThat(service.lagOneAutocorrelation(new double[] {0.1, 0.2})).isZero();
    }
}
