/* (C)2026 */
package com.ammann.randomness.enumeration;

/**
 * Verdict attached to the overall entropy quality, the mean of all per-source scores.
 *
 * <p>Levels are declared from strictest to loosest; a score maps to the first level whose
 * floor it reaches. {@link #CRITICAL} has a floor of zero and therefore catches everything else.
 */
public enum QualityStatus
{
    EXCELLENT(0.95),
    GOOD(0.85),
    WARNING(0.70),
    CRITICAL(0.0);

    private final double floor;

    QualityStatus(double floor) {
        this.floor = floor;
    }

    /**
     * Maps a mean quality score onto a verdict. NaN scores are treated as critical.
     *
     * @param meanScore mean of the per-source quality scores
     * @return the strictest level whose floor the score reaches
     */
    public static QualityStatus fromScore(double meanScore) {
        for (QualityStatus status : values()) {
            if (meanScore >= status.floor) {
                return status;
            }
        }
        return CRITICAL;
    }

    public double floor() { return floor; }
}
