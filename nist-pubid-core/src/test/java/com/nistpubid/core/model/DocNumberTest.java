package com.nistpubid.core.model;

import com.nistpubid.core.exception.InvalidPubIdException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocNumberTest {

    @ParameterizedTest
    @ValueSource(strings = {"800-53", "800-38A", "1-1C", "85-3273", "140-3", "1800-25"})
    void of_validNumber_keepsValue(String value) {
        assertThat(DocNumber.of(value).value()).isEqualTo(value);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "SP", "800 53", "800-53r5", "800--53", "-800", "800-"})
    void of_invalidNumber_throws(String value) {
        assertThatThrownBy(() -> DocNumber.of(value))
            .isInstanceOf(InvalidPubIdException.class);
    }

    @ParameterizedTest
    @CsvSource({
        "800-38A, A",
        "1-1C, C",
        "800-53, ''",
        "46ABC, ABC"
    })
    void subSeries_returnsTrailingLetters(String value, String expected) {
        assertThat(DocNumber.of(value).subSeries()).isEqualTo(expected);
    }

    @Test
    void compareTo_comparesDigitRunsNumerically() {
        List<DocNumber> numbers = new ArrayList<>(List.of(
            DocNumber.of("800-53"), DocNumber.of("800-9"), DocNumber.of("80"), DocNumber.of("800-38A"), DocNumber.of("800-38")));

        numbers.sort(null);

        assertThat(numbers).extracting(DocNumber::value)
            .containsExactly("80", "800-9", "800-38", "800-38A", "800-53");
    }
}
