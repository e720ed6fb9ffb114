package io.upstartproject.avrocanonical;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CanonicalNumbersTest {
  @Test
  void integralValuesHaveNoFraction() {
    assertThat(CanonicalNumbers.format(16)).isEqualTo("16");
    assertThat(CanonicalNumbers.format(-3)).isEqualTo("-3");
    assertThat(CanonicalNumbers.format(123456789)).isEqualTo("123456789");
    assertThat(CanonicalNumbers.format(1e20)).isEqualTo("100000000000000000000");
  }

  @Test
  void fractionsHaveNoTrailingZeros() {
    assertThat(CanonicalNumbers.format(0.5)).isEqualTo("0.5");
    assertThat(CanonicalNumbers.format(0.1)).isEqualTo("0.1");
    assertThat(CanonicalNumbers.format(-2.25)).isEqualTo("-2.25");
    assertThat(CanonicalNumbers.format(0.000001)).isEqualTo("0.000001");
  }

  @Test
  void extremeMagnitudesUseExponents() {
    assertThat(CanonicalNumbers.format(1e21)).isEqualTo("1e+21");
    assertThat(CanonicalNumbers.format(1.5e-7)).isEqualTo("1.5e-7");
    assertThat(CanonicalNumbers.format(-2.5e300)).isEqualTo("-2.5e+300");
    assertThat(CanonicalNumbers.format(Double.MAX_VALUE)).isEqualTo("1.7976931348623157e+308");
  }

  @Test
  void zeroKeepsItsSign() {
    assertThat(CanonicalNumbers.format(0.0)).isEqualTo("0");
    assertThat(CanonicalNumbers.format(-0.0)).isEqualTo("-0");
  }

  @ParameterizedTest
  @ValueSource(doubles = {0.1, 1.0 / 3, Math.PI, 2.0e-300, 6.02214076e23, 9007199254740993.0, 4.35, 1e-6, 1e-7})
  void renderedTextReadsBackAsTheSameDouble(double value) {
    assertThat(Double.parseDouble(CanonicalNumbers.format(value))).isEqualTo(value);
  }

  @Test
  void nonFiniteValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> CanonicalNumbers.format(Double.NaN));
    assertThrows(IllegalArgumentException.class, () -> CanonicalNumbers.format(Double.POSITIVE_INFINITY));
  }
}
