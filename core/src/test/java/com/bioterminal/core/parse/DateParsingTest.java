package com.bioterminal.core.parse;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DateParsingTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2025-03-01T09:30:00Z            | 2025-03-01T09:30:00Z",
            "2025-03-01T18:30:00+09:00       | 2025-03-01T09:30:00Z",
            "Sat, 1 Mar 2025 09:30:00 GMT    | 2025-03-01T09:30:00Z",
            "2025-03-01T09:30:00             | 2025-03-01T09:30:00Z",
            "2025-03-01 09:30                | 2025-03-01T09:30:00Z",
            "2025-03-01                      | 2025-03-01T00:00:00Z",
            "March 1, 2025                   | 2025-03-01T00:00:00Z",
            "03/01/2025                      | 2025-03-01T00:00:00Z",
            "2025-03-01T09:30:00.000+0000    | 2025-03-01T09:30:00Z"
    })
    void parses_common_formats(String raw, String expected) {
        assertThat(DateParsing.parse(raw)).isEqualTo(Instant.parse(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "yesterday", "2025-13-45"})
    void unparseable_is_null(String raw) {
        assertThat(DateParsing.parse(raw)).isNull();
    }
}
