package io.upstartproject.avrocanonical;

import com.fasterxml.jackson.core.io.NumberOutput;

import java.math.BigDecimal;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Renders doubles as the shortest decimal text that reads back as the identical double.
 * <p/>
 * Integral values carry no fraction ({@code 16}, never {@code 16.0}), fractions carry no trailing zeros, and
 * exponent notation ({@code 1e+21}, {@code 1.5e-7}) is reserved for magnitudes outside [1e-6, 1e21).
 */
public final class CanonicalNumbers {
  private static final int MIN_PLAIN_EXPONENT = -6;
  private static final int MAX_PLAIN_EXPONENT = 20;

  private CanonicalNumbers() {
  }

  public static String format(double value) {
    checkArgument(Double.isFinite(value), "Cannot render non-finite number: %s", value);
    if (value == 0) {
      return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
    }

    // the fast writer (Schubfach) always emits the shortest round-tripping digits
    BigDecimal decimal = new BigDecimal(NumberOutput.toString(value, true)).stripTrailingZeros();
    int exponent = decimal.precision() - decimal.scale() - 1;
    if (exponent >= MIN_PLAIN_EXPONENT && exponent <= MAX_PLAIN_EXPONENT) {
      return decimal.toPlainString();
    }

    String digits = decimal.unscaledValue().abs().toString();
    StringBuilder out = new StringBuilder(digits.length() + 8);
    if (decimal.signum() < 0) out.append('-');
    out.append(digits.charAt(0));
    if (digits.length() > 1) out.append('.').append(digits, 1, digits.length());
    return out.append('e').append(exponent < 0 ? '-' : '+').append(Math.abs(exponent)).toString();
  }
}
