package jobqueue.recurrence;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed-interval cadences. Accepted forms:
 * <ul>
 *   <li>ISO-8601 durations: {@code PT5M}, {@code P1DT12H}
 *   <li>plain seconds: {@code 90}
 *   <li>compact: {@code 30s}, {@code 5m}, {@code 2h}, {@code 1d}, {@code 1w}
 *   <li>unit pairs: {@code 5 minutes}, {@code 1 day 3 hours}
 * </ul>
 *
 * <p>The next slot is the previous slot plus the interval.
 */
public final class IntervalCadenceEvaluator implements CadenceEvaluator {
  private static final Pattern SECONDS = Pattern.compile("\\d+");
  private static final Pattern COMPACT = Pattern.compile("(\\d+)\\s*([smhdw])");

  private enum Unit {
    WEEK(Duration.ofDays(7)),
    DAY(Duration.ofDays(1)),
    HOUR(Duration.ofHours(1)),
    MINUTE(Duration.ofMinutes(1)),
    SECOND(Duration.ofSeconds(1));

    final Duration length;

    Unit(Duration length) {
      this.length = length;
    }

    static Unit parse(String word) {
      String singular = word.endsWith("s") ? word.substring(0, word.length() - 1) : word;
      for (Unit unit : values()) {
        if (unit.name().equalsIgnoreCase(singular)) {
          return unit;
        }
      }
      throw new IllegalArgumentException("Unsupported interval unit: " + word);
    }
  }

  @Override
  public void validate(String cadence) {
    parse(cadence);
  }

  @Override
  public Instant next(String cadence, Instant after) {
    Objects.requireNonNull(after, "after");
    return after.plus(parse(cadence));
  }

  /**
   * Parses an interval expression.
   *
   * @param cadence the expression
   * @return the interval, always positive
   * @throws IllegalArgumentException if the expression is malformed or not positive
   */
  public Duration parse(String cadence) {
    if (cadence == null || cadence.isBlank()) {
      throw new IllegalArgumentException("Interval must not be empty");
    }
    String s = cadence.trim().toLowerCase(Locale.ROOT);
    Duration interval;
    if (s.startsWith("p")) {
      try {
        interval = Duration.parse(s.toUpperCase(Locale.ROOT));
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("Invalid ISO-8601 interval: " + cadence, e);
      }
    } else if (SECONDS.matcher(s).matches()) {
      interval = Duration.ofSeconds(parseNumber(s, cadence));
    } else {
      Matcher compact = COMPACT.matcher(s);
      interval = compact.matches()
          ? compactUnit(compact.group(2).charAt(0)).length.multipliedBy(parseNumber(compact.group(1), cadence))
          : parsePairs(s, cadence);
    }
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("Interval must be positive: " + cadence);
    }
    return interval;
  }

  private static Unit compactUnit(char unit) {
    switch (unit) {
      case 's':
        return Unit.SECOND;
      case 'm':
        return Unit.MINUTE;
      case 'h':
        return Unit.HOUR;
      case 'd':
        return Unit.DAY;
      default:
        return Unit.WEEK;
    }
  }

  private static Duration parsePairs(String s, String original) {
    String[] parts = s.split("\\s+");
    if (parts.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Invalid interval, expected pairs like '3 minutes': " + original);
    }
    Set<Unit> seen = EnumSet.noneOf(Unit.class);
    Duration total = Duration.ZERO;
    for (int i = 0; i < parts.length; i += 2) {
      long amount = parseNumber(parts[i], original);
      Unit unit = Unit.parse(parts[i + 1]);
      if (!seen.add(unit)) {
        throw new IllegalArgumentException("Duplicate unit " + parts[i + 1] + " in: " + original);
      }
      total = total.plus(unit.length.multipliedBy(amount));
    }
    return total;
  }

  private static long parseNumber(String digits, String original) {
    try {
      return Long.parseLong(digits);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number '" + digits + "' in interval: " + original, e);
    }
  }
}
