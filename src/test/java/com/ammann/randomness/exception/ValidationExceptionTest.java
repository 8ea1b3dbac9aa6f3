package com.ammann.randomness.exception;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationExceptionTest
{

    @Test
    void buildsCountOutOfRangeMessage()
    {
        ValidationException ex = ValidationException.countOutOfRange("stochastic_jitter", 1001, 1, 1000);

        assertThat(ex.getMessage())
                .isEqualTo("Invalid count for stochastic_jitter: got 1001, expected a value between 1 and 1000");
    }

    @ParameterizedTest
    @CsvSource({
            "count,abc,an integer",
            "sources,'bogus,nope',one or more of"
    })
    void buildsInvalidParameterMessage(String param, String value, String expectedFragment)
    {
        ValidationException ex = ValidationException.invalidParameter(param, value, expectedFragment);
        assertThat(ex.getMessage()).contains(param, value, expectedFragment);
        assertThat(ex).isInstanceOf(ApiException.class);
    }
}
