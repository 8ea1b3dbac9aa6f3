/* (C)2026 */
package com.ammann.randomness.service;

import jakarta.enterprise.context.ApplicationScoped;
import java.util.Arrays;
import org.jboss.logging.Logger;

/**
 * Goodness-of-fit and dependence statistics over sequences of values in [0,1].
 *
 * <p>Implements:
 * <ul>
 *   <li>Pearson chi-square statistic against a uniform histogram</li>
 *   <li>Chi-square survival function via the regularized upper incomplete gamma function</li>
 *   <li>One-sample Kolmogorov-Smirnov test against Uniform(0,1)</li>
 *   <li>Two-sample Kolmogorov-Smirnov test</li>
 *   <li>Pearson correlation and lag-1 autocorrelation</li>
 * </ul>
 *
 * <p>Kolmogorov-Smirnov p-values use the asymptotic Kolmogorov distribution with Stephens'
 * small-sample correction. All methods are stateless and thread-safe.
 */
@ApplicationScoped
public class UniformityStatisticsService
{

    private static final Logger LOG = Logger.getLogger(UniformityStatisticsService.class);

    private static final int MAX_ITERATIONS = 500;
    private static final double EPSILON = 1e-14;
    private static final double TINY = 1e-300;

    // Lanczos approximation coefficients (g = 7, n = 9)
    private static final double[] LANCZOS = {
            0.99999999999980993,
            676.5203681218851,
            -1259.1392167224028,
            771.32342877765313,
            -176.61502916214059,
            12.507343278686905,
            -0.13857109526572012,
            9.9843695780195716e-6,
            1.5056327351493116e-7
    };

    /**
     * Result of a Kolmogorov-Smirnov test.
     *
     * @param statistic maximum distance between the compared distribution functions
     * @param pValue    probability of a distance at least this large under the null hypothesis
     */
    public record KolmogorovSmirnovResult(double statistic, double pValue) {}

    /**
     * Computes the Pearson chi-square statistic of {@code values} against a uniform
     * distribution over {@code bins} equal-width bins spanning [0,1].
     *
     * <p>The right edge is inclusive, so a value of exactly 1.0 falls into the last bin. Values
     * outside [0,1] are not counted, while the expected count per bin stays
     * {@code values.length / bins}.
     *
     * @param values observations, expected in [0,1]
     * @param bins   number of bins, at least 2
     * @return chi-square statistic, or {@code NaN} for an empty input
     */
    public double chiSquareUniformity(double[] values, int bins)
    {
        if (bins < 2) {
            throw new IllegalArgumentException("At least two bins are required, got " + bins);
        }
        if (values.length == 0) {
            return Double.NaN;
        }

        long[] observed = new long[bins];
        for (double value : values) {
            if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
                continue;
            }
            int bin = Math.min((int) (value * bins), bins - 1);
            observed[bin]++;
        }

        double expected = (double) values.length / bins;
        double statistic = 0.0;
        for (long count : observed) {
            double diff = count - expected;
            statistic += diff * diff / expected;
        }
        return statistic;
    }

    /**
     * Upper tail probability {@code P(X >= statistic)} of a chi-square distribution.
     *
     * @param statistic        observed chi-square statistic
     * @param degreesOfFreedom degrees of freedom, positive
     * @return p-value in [0,1]; {@code 0.0} for a {@code NaN} statistic
     */
    public double chiSquareSurvival(double statistic, int degreesOfFreedom)
    {
        if (degreesOfFreedom <= 0) {
            throw new IllegalArgumentException("Degrees of freedom must be positive");
        }
        if (Double.isNaN(statistic)) {
            return 0.0;
        }
        if (statistic <= 0.0) {
            return 1.0;
        }
        return regularizedGammaQ(degreesOfFreedom / 2.0, statistic / 2.0);
    }

    /**
     * One-sample Kolmogorov-Smirnov test of {@code values} against Uniform(0,1).
     *
     * @param values sample, at least one value
     * @return statistic and p-value
     */
    public KolmogorovSmirnovResult kolmogorovSmirnovUniform(double[] values)
    {
        requireNonEmpty(values, "sample");
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;

        double d = 0.0;
        for (int i = 0; i < n; i++) {
            double cdf = Math.max(0.0, Math.min(1.0, sorted[i]));
            double above = (i + 1.0) / n - cdf;
            double below = cdf - (double) i / n;
            d = Math.max(d, Math.max(above, below));
        }

        double sqrtN = Math.sqrt(n);
        double p = kolmogorovSurvival((sqrtN + 0.12 + 0.11 / sqrtN) * d);
        LOG.debugf("KS uniformity: n=%d D=%.5f p=%.5f", Integer.valueOf(n), Double.valueOf(d), Double.valueOf(p));
        return new KolmogorovSmirnovResult(d, p);
    }

    /**
     * Two-sample Kolmogorov-Smirnov test: are {@code first} and {@code second} drawn from the
     * same distribution?
     *
     * @param first  first sample, at least one value
     * @param second second sample, at least one value
     * @return statistic and p-value
     */
    public KolmogorovSmirnovResult kolmogorovSmirnovTwoSample(double[] first, double[] second)
    {
        requireNonEmpty(first, "first sample");
        requireNonEmpty(second, "second sample");
        double[] a = first.clone();
        double[] b = second.clone();
        Arrays.sort(a);
        Arrays.sort(b);

        int i = 0;
        int j = 0;
        double d = 0.0;
        while (i < a.length && j < b.length) {
            double x = Math.min(a[i], b[j]);
            while (i < a.length && a[i] <= x) {
                i++;
            }
            while (j < b.length && b[j] <= x) {
                j++;
            }
            d = Math.max(d, Math.abs((double) i / a.length - (double) j / b.length));
        }

        double effective = Math.sqrt((double) a.length * b.length / (a.length + b.length));
        double p = kolmogorovSurvival((effective + 0.12 + 0.11 / effective) * d);
        return new KolmogorovSmirnovResult(d, p);
    }

    /**
     * Pearson product-moment correlation of two equally long sequences.
     *
     * @return correlation in [-1,1], or {@code 0.0} when either sequence has no variance
     */
    public double pearsonCorrelation(double[] x, double[] y)
    {
        if (x.length != y.length) {
            throw new IllegalArgumentException(
                    String.format("Sequences differ in length: %d vs %d", x.length, y.length));
        }
        if (x.length < 2) {
            return 0.0;
        }

        double meanX = Arrays.stream(x).average().orElse(0.0);
        double meanY = Arrays.stream(y).average().orElse(0.0);
        double covariance = 0.0;
        double varianceX = 0.0;
        double varianceY = 0.0;
        for (int k = 0; k < x.length; k++) {
            double dx = x[k] - meanX;
            double dy = y[k] - meanY;
            covariance += dx * dy;
            varianceX += dx * dx;
            varianceY += dy * dy;
        }

        if (varianceX == 0.0 || varianceY == 0.0) {
            return 0.0;
        }
        return covariance / Math.sqrt(varianceX * varianceY);
    }

    /**
     * Correlation between {@code values[i]} and {@code values[i + 1]}.
     */
    public double lagOneAutocorrelation(double[] values)
    {
        if (values.length < 3) {
            return 0.0;
        }
        return pearsonCorrelation(
                Arrays.copyOfRange(values, 0, values.length - 1),
                Arrays.copyOfRange(values, 1, values.length));
    }

    /**
     * Regularized upper incomplete gamma function Q(a, x) = 1 - P(a, x).
     *
     * <p>Uses the series expansion of P for {@code x < a + 1} and Lentz's continued fraction
     * for Q otherwise.
     */
    double regularizedGammaQ(double a, double x)
    {
        if (x < a + 1.0) {
            return 1.0 - gammaSeries(a, x);
        }
        return gammaContinuedFraction(a, x);
    }

    double logGamma(double x)
    {
        if (x < 0.5) {
            // Reflection formula
            return Math.log(Math.PI / Math.abs(Math.sin(Math.PI * x))) - logGamma(1.0 - x);
        }
        double z = x - 1.0;
        double sum = LANCZOS[0];
        double t = z + 7.5;
        for (int k = 1; k < LANCZOS.length; k++) {
            sum += LANCZOS[k] / (z + k);
        }
        return 0.5 * Math.log(2.0 * Math.PI) + (z + 0.5) * Math.log(t) - t + Math.log(sum);
    }

    private double gammaSeries(double a, double x)
    {
        double term = 1.0 / a;
        double sum = term;
        double denominator = a;
        for (int n = 0; n < MAX_ITERATIONS; n++) {
            denominator += 1.0;
            term *= x / denominator;
            sum += term;
            if (Math.abs(term) < Math.abs(sum) * EPSILON) {
                break;
            }
        }
        double result = sum * Math.exp(-x + a * Math.log(x) - logGamma(a));
        return Math.min(1.0, Math.max(0.0, result));
    }

    private double gammaContinuedFraction(double a, double x)
    {
        double b = x + 1.0 - a;
        double c = 1.0 / TINY;
        double d = 1.0 / b;
        double h = d;
        for (int i = 1; i <= MAX_ITERATIONS; i++) {
            double an = -i * (i - a);
            b += 2.0;
            d = an * d + b;
            if (Math.abs(d) < TINY) {
                d = TINY;
            }
            c = b + an / c;
            if (Math.abs(c) < TINY) {
                c = TINY;
            }
            d = 1.0 / d;
            double delta = d * c;
            h *= delta;
            if (Math.abs(delta - 1.0) < EPSILON) {
                break;
            }
        }
        double result = Math.exp(-x + a * Math.log(x) - logGamma(a)) * h;
        return Math.min(1.0, Math.max(0.0, result));
    }

    /**
     * Survival function of the Kolmogorov distribution,
     * {@code Q(lambda) = 2 * sum_{k>=1} (-1)^(k-1) exp(-2 k^2 lambda^2)}.
     */
    private double kolmogorovSurvival(double lambda)
    {
        if (lambda < 0.2) {
            // The alternating series converges poorly here; the true value is 1 to 15 digits
            return 1.0;
        }
        double a2 = -2.0 * lambda * lambda;
        double sign = 2.0;
        double sum = 0.0;
        double previousTerm = 0.0;
        for (int k = 1; k <= 100; k++) {
            double term = sign * Math.exp(a2 * k * k);
            sum += term;
            if (Math.abs(term) <= 1e-3 * previousTerm || Math.abs(term) <= 1e-10 * sum) {
                return Math.min(1.0, Math.max(0.0, sum));
            }
            sign = -sign;
            previousTerm = Math.abs(term);
        }
        return 1.0;
    }

    private static void requireNonEmpty(double[] values, String name)
    {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Kolmogorov-Smirnov " + name + " must not be empty");
        }
    }
}
