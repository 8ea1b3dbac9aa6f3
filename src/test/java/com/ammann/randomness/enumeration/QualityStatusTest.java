package com.ammann.randomness.enumeration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class QualityStatusTest
{

    @ParameterizedTest
    @CsvSource({
            "1.00,EXCELLENT",
            "0.95,EXCELLENT",
            "0.90,GOOD",
            "0.85,GOOD",
            "0.75,WARNING",
            "0.70,WARNING",
            "0.40,CRITICAL",
            "0.00,CRITICAL"
    })
    void mapsScoresToStatuses(double score, QualityStatus expected)
    {
        assertThat(QualityStatus.fromScore(score)).isEqualTo(expected);
    }

    @Test
    void nanScoreIsCritical()
    {
        assertThat(QualityStatus.fromScore(Double.NaN)).isEqualTo(QualityStatus.CRITICAL);
    }
}
