package com.tx.insights.matching;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TDD tests for GtinValidator.
 */
class GtinValidatorTest {

    @Nested
    class ValidationTests {

        @ParameterizedTest
        @ValueSource(strings = {"96385074", "036000291452", "4006381333931", "00012345600012"})
        void shouldAcceptValidCodesOfEveryLength(String code) {
            assertThat(GtinValidator.isValid(code)).isTrue();
        }

        @Test
        void shouldIgnoreSpacesAndHyphens() {
            assertThat(GtinValidator.isValid("400-638 1333931")).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"4006381333932", "40063813339A1", "40063813339", "123456789012345"})
        void shouldRejectBadChecksumsCharactersAndLengths(String code) {
            assertThat(GtinValidator.isValid(code)).isFalse();
        }

        @ParameterizedTest
        @NullAndEmptySource
        void shouldRejectMissingCodes(String code) {
            assertThat(GtinValidator.isValid(code)).isFalse();
        }
    }

    @Nested
    class CheckDigitTests {

        @Test
        void shouldComputeCheckDigit() {
            assertThat(GtinValidator.checkDigit("400638133393")).isEqualTo(1);
            assertThat(GtinValidator.checkDigit("03600029145")).isEqualTo(2);
        }

        @Test
        void shouldRejectNonDigitBody() {
            assertThatThrownBy(() -> GtinValidator.checkDigit("12a4"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class CanonicalTests {

        @Test
        void shouldStripLeadingZeros() {
            assertThat(GtinValidator.canonical("0036000291452")).isEqualTo("36000291452");
            assertThat(GtinValidator.canonical("0000")).isEqualTo("0");
        }

        @Test
        void shouldTreatPaddedCodesAsSameProduct() {
            assertThat(GtinValidator.sameProduct("036000291452", "0036000291452")).isTrue();
            assertThat(GtinValidator.sameProduct("036000291452", "4006381333931")).isFalse();
            assertThat(GtinValidator.sameProduct("4006381333932", "4006381333932")).isFalse();
        }

        @Test
        void shouldRecognizeGtinShapedValues() {
            assertThat(GtinValidator.looksLikeGtin("12345678")).isTrue();
            assertThat(GtinValidator.looksLikeGtin("1234567")).isFalse();
            assertThat(GtinValidator.looksLikeGtin("SKU-12345678")).isFalse();
        }
    }
}
