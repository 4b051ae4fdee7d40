package io.github.jakubt4.astrocat.angle;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AngleParserTest {

    @Test
    void rightAscensionConvertsHoursToDegrees() {
        final var degrees = AngleParser.rightAscension(new AngleInput.Sexagesimal("05 34 31.94"));

        assertThat(degrees).isEqualTo(83.6331);
    }

    @ParameterizedTest
    @CsvSource({
            "'00 00 00',       0.0",
            "'00 24 05.67',    6.0236",
            "'12 00 00',       180.0",
            "'18 07 20.6',     271.8358",
            "'  23   59  59 ', 359.9958"
    })
    void rightAscensionFollowsHourAngleFormula(final String text, final double expected) {
        assertThat(AngleParser.rightAscension(new AngleInput.Sexagesimal(text))).isEqualTo(expected);
    }

    @Test
    void declinationKeepsPositiveSign() {
        assertThat(AngleParser.declination(new AngleInput.Sexagesimal("+22 00 52.2"))).isEqualTo(22.0145);
        assertThat(AngleParser.declination(new AngleInput.Sexagesimal("22 00 52.2"))).isEqualTo(22.0145);
    }

    @Test
    void declinationSignAppliesToWholeAngle() {
        assertThat(AngleParser.declination(new AngleInput.Sexagesimal("-22 00 52.2"))).isEqualTo(-22.0145);
        assertThat(AngleParser.declination(new AngleInput.Sexagesimal("-72 04 52.6"))).isEqualTo(-72.0813);
    }

    @Test
    void declinationNegativeZeroDegreesStaysNegative() {
        assertThat(AngleParser.declination(new AngleInput.Sexagesimal("-00 30 00"))).isEqualTo(-0.5);
    }

    @Test
    void decimalDegreesAreOnlyRounded() {
        assertThat(AngleParser.rightAscension(new AngleInput.DecimalDegrees(83.63308333))).isEqualTo(83.6331);
        assertThat(AngleParser.declination(new AngleInput.DecimalDegrees(-22.01449))).isEqualTo(-22.0145);
    }

    @Test
    void decimalDegreesAreIdempotent() {
        final var once = AngleParser.declination(new AngleInput.DecimalDegrees(-41.23456789));
        final var twice = AngleParser.declination(new AngleInput.DecimalDegrees(once));

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void radiansAreConvertedToDegreesBeforeRounding() {
        assertThat(AngleParser.rightAscension(new AngleInput.Radians(Math.PI))).isEqualTo(180.0);
        assertThat(AngleParser.declination(new AngleInput.Radians(-Math.PI / 4))).isEqualTo(-45.0);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "05 34", "05 34 31.94 12", "05:34:31.94", "aa 34 31.94", "05 -34 31.94", "-05 34 31.94", "05 60 00"})
    void rightAscensionRejectsMalformedText(final String text) {
        assertThatThrownBy(() -> AngleParser.rightAscension(new AngleInput.Sexagesimal(text)))
                .isInstanceOf(AngleParseException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"bad value", "+22 00", "+22 +00 52.2", "+22 00 -52.2", "+22 00 60", "--22 00 52.2", "1d 00 00"})
    void declinationRejectsMalformedText(final String text) {
        assertThatThrownBy(() -> AngleParser.declination(new AngleInput.Sexagesimal(text)))
                .isInstanceOf(AngleParseException.class);
    }

    @Test
    void oversizedSexagesimalTokensAreRejected() {
        final var tooWide = "9".repeat(400);

        assertThatThrownBy(() -> AngleParser.rightAscension(new AngleInput.Sexagesimal(tooWide + " 00 00")))
                .isInstanceOf(AngleParseException.class)
                .hasMessageContaining("Non-finite hours");
        assertThatThrownBy(() -> AngleParser.declination(new AngleInput.Sexagesimal("-" + tooWide + " 00 00")))
                .isInstanceOf(AngleParseException.class)
                .hasMessageContaining("Non-finite degrees");
        // finite hours that overflow once scaled to degrees
        assertThatThrownBy(() -> AngleParser.rightAscension(new AngleInput.Sexagesimal("9".repeat(308) + " 00 00")))
                .isInstanceOf(AngleParseException.class)
                .hasMessageContaining("Non-finite angle");
    }

    @Test
    void negativeValuesRoundingToZeroComeOutAsPositiveZero() {
        final var fromText = AngleParser.declination(new AngleInput.Sexagesimal("-00 00 00.1"));
        final var fromDegrees = AngleParser.declination(new AngleInput.DecimalDegrees(-0.00001));

        assertThat(Math.copySign(1.0, fromText)).isEqualTo(1.0);
        assertThat(Math.copySign(1.0, fromDegrees)).isEqualTo(1.0);
    }

    @Test
    void absentOrNonFiniteValuesAreRejected() {
        assertThatThrownBy(() -> AngleParser.rightAscension(null))
                .isInstanceOf(AngleParseException.class)
                .hasMessageContaining("Missing right ascension");
        assertThatThrownBy(() -> AngleParser.declination(new AngleInput.DecimalDegrees(Double.NaN)))
                .isInstanceOf(AngleParseException.class)
                .hasMessageContaining("Non-finite");
    }
}
