package ca.gc.cra.devlog.infrastructure.render;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;

/**
 * <strong>What:</strong> Compact text forms for numbers, durations and instants.
 * <p><strong>Why:</strong> Rendered lines favor the shortest unambiguous form: {@code 1.5} rather than
 * {@code 1.5E0}, {@code 250ms} rather than {@code PT0.25S}. Configuration accepts the same duration syntax.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility; formatters are immutable.</p>
 *
 * @since 0.1.0
 */
public final class CompactFormats {
  private static final int EXPONENT_THRESHOLD = 6;
  private static final long NANOS_PER_MICRO = 1_000L;
  private static final long NANOS_PER_MILLI = 1_000_000L;
  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private static final DateTimeFormatter TIME_VALUE = new DateTimeFormatterBuilder()
      .appendPattern("uuuu-MM-dd HH:mm:ss")
      .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
      .appendLiteral(' ')
      .appendOffset("+HHMM", "+0000")
      .appendLiteral(' ')
      .appendZoneText(TextStyle.SHORT)
      .toFormatter(Locale.ROOT);

  private CompactFormats() {}

  /**
   * Formats a double with the fewest digits that identify it, switching to exponent form for exponents below
   * -4 or at least 6.
   *
   * @param value number to format
   * @return e.g. {@code 1.5}, {@code 100}, {@code 1e+06}, {@code 1e-05}, {@code NaN}, {@code +Inf}
   */
  public static String formatFloat(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "+Inf" : "-Inf";
    }
    if (value == 0.0d) {
      return (Double.doubleToRawLongBits(value) < 0) ? "-0" : "0";
    }
    BigDecimal decimal = new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
    String digits = decimal.unscaledValue().toString();
    int decimalPoint = digits.length() - decimal.scale();
    int exponent = decimalPoint - 1;

    StringBuilder sb = new StringBuilder(digits.length() + 8);
    if (value < 0) {
      sb.append('-');
    }
    if (exponent < -4 || exponent >= EXPONENT_THRESHOLD) {
      sb.append(digits.charAt(0));
      if (digits.length() > 1) {
        sb.append('.').append(digits, 1, digits.length());
      }
      sb.append('e').append(exponent < 0 ? '-' : '+');
      int magnitude = Math.abs(exponent);
      if (magnitude < 10) {
        sb.append('0');
      }
      sb.append(magnitude);
    } else if (decimalPoint <= 0) {
      sb.append("0.");
      for (int i = decimalPoint; i < 0; i++) {
        sb.append('0');
      }
      sb.append(digits);
    } else if (decimalPoint >= digits.length()) {
      sb.append(digits);
      for (int i = digits.length(); i < decimalPoint; i++) {
        sb.append('0');
      }
    } else {
      sb.append(digits, 0, decimalPoint).append('.').append(digits, decimalPoint, digits.length());
    }
    return sb.toString();
  }

  /**
   * Formats a duration as hours, minutes and seconds with a trimmed fraction, or in a sub-second unit.
   * Durations beyond the signed 64-bit nanosecond range saturate.
   *
   * @param duration duration to format
   * @return e.g. {@code 0s}, {@code 42ns}, {@code 1.5µs}, {@code 250ms}, {@code 1.5s}, {@code 2m0s},
   *     {@code 1h30m0s}
   */
  public static String formatDuration(Duration duration) {
    long nanos = saturatedNanos(duration);
    if (nanos == 0L) {
      return "0s";
    }
    boolean negative = nanos < 0;
    // two's complement negation keeps Long.MIN_VALUE correct as an unsigned magnitude
    long magnitude = negative ? -nanos : nanos;
    StringBuilder sb = new StringBuilder(24);
    if (Long.compareUnsigned(magnitude, NANOS_PER_SECOND) < 0) {
      if (magnitude < NANOS_PER_MICRO) {
        sb.append(magnitude).append("ns");
      } else if (magnitude < NANOS_PER_MILLI) {
        appendFraction(sb, magnitude, 3);
        sb.append("µs");
      } else {
        appendFraction(sb, magnitude, 6);
        sb.append("ms");
      }
    } else {
      long seconds = Long.divideUnsigned(magnitude, NANOS_PER_SECOND);
      long fraction = Long.remainderUnsigned(magnitude, NANOS_PER_SECOND);
      long hours = seconds / 3600;
      long minutes = (seconds / 60) % 60;
      if (hours > 0) {
        sb.append(hours).append('h');
      }
      if (hours > 0 || minutes > 0) {
        sb.append(minutes).append('m');
      }
      sb.append(seconds % 60);
      appendTrimmedDigits(sb, fraction, 9);
      sb.append('s');
    }
    return negative ? "-" + sb : sb.toString();
  }

  /**
   * Formats a duration in seconds with exactly four decimals, e.g. {@code 0.2500}.
   * <p>The seconds are taken as a {@code double} and its exact binary value is rounded, so a decimal tie such as
   * 50&micro;s rounds by where the double actually lies ({@code 0.0001}).</p>
   */
  public static String seconds4(Duration duration) {
    double seconds = saturatedNanos(duration) / 1e9;
    return new BigDecimal(seconds)
        .setScale(4, RoundingMode.HALF_EVEN)
        .toPlainString();
  }

  /**
   * Parses {@code 1h30m}, {@code 250ms}, {@code 1.5s} and friends, or ISO-8601 text such as {@code PT0.5S}.
   * A bare {@code 0} is accepted. Units: {@code ns}, {@code us}/{@code µs}, {@code ms}, {@code s}, {@code m},
   * {@code h}.
   *
   * @param text duration text
   * @return parsed duration
   * @throws IllegalArgumentException when the text is not a duration
   */
  public static Duration parseDuration(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Duration must not be blank");
    }
    String trimmed = text.trim();
    String unsigned = trimmed.startsWith("-") || trimmed.startsWith("+") ? trimmed.substring(1) : trimmed;
    if (unsigned.startsWith("P") || unsigned.startsWith("p")) {
      try {
        return Duration.parse(trimmed);
      } catch (DateTimeException ex) {
        throw new IllegalArgumentException("Invalid duration: " + text, ex);
      }
    }
    boolean negative = trimmed.startsWith("-");
    if ("0".equals(unsigned)) {
      return Duration.ZERO;
    }
    BigDecimal totalNanos = BigDecimal.ZERO;
    int i = 0;
    while (i < unsigned.length()) {
      int numberStart = i;
      while (i < unsigned.length() && (Character.isDigit(unsigned.charAt(i)) || unsigned.charAt(i) == '.')) {
        i++;
      }
      if (i == numberStart) {
        throw new IllegalArgumentException("Invalid duration: " + text);
      }
      BigDecimal amount;
      try {
        amount = new BigDecimal(unsigned.substring(numberStart, i));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid duration: " + text, ex);
      }
      int unitStart = i;
      while (i < unsigned.length() && !Character.isDigit(unsigned.charAt(i)) && unsigned.charAt(i) != '.') {
        i++;
      }
      long unitNanos = unitNanos(unsigned.substring(unitStart, i), text);
      totalNanos = totalNanos.add(amount.multiply(BigDecimal.valueOf(unitNanos)));
    }
    try {
      long nanos = totalNanos.setScale(0, RoundingMode.DOWN).longValueExact();
      return Duration.ofNanos(negative ? -nanos : nanos);
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException("Duration out of range: " + text, ex);
    }
  }

  /**
   * Formats an instant as {@code 2024-03-01 12:00:00.5 +0000 UTC} in the given zone; the fraction is omitted
   * when zero and trimmed otherwise.
   */
  public static String formatTime(Instant instant, ZoneId zone) {
    return TIME_VALUE.format(instant.atZone(zone));
  }

  private static long unitNanos(String unit, String text) {
    switch (unit) {
      case "ns":
        return 1L;
      case "us":
      case "µs":
      case "μs":
        return NANOS_PER_MICRO;
      case "ms":
        return NANOS_PER_MILLI;
      case "s":
        return NANOS_PER_SECOND;
      case "m":
        return 60L * NANOS_PER_SECOND;
      case "h":
        return 3600L * NANOS_PER_SECOND;
      default:
        throw new IllegalArgumentException(
            unit.isEmpty() ? "Missing unit in duration: " + text : "Unknown unit " + unit + " in duration: " + text);
    }
  }

  private static long saturatedNanos(Duration duration) {
    try {
      return duration.toNanos();
    } catch (ArithmeticException ex) {
      return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }

  /** Appends {@code value / 10^scale} with its fraction trimmed of trailing zeros. */
  private static void appendFraction(StringBuilder sb, long value, int scale) {
    long divisor = 1L;
    for (int i = 0; i < scale; i++) {
      divisor *= 10L;
    }
    sb.append(value / divisor);
    appendTrimmedDigits(sb, value % divisor, scale);
  }

  private static void appendTrimmedDigits(StringBuilder sb, long fraction, int width) {
    if (fraction == 0L) {
      return;
    }
    String padded = String.format(Locale.ROOT, "%0" + width + "d", fraction);
    int end = padded.length();
    while (end > 0 && padded.charAt(end - 1) == '0') {
      end--;
    }
    sb.append('.').append(padded, 0, end);
  }
}
