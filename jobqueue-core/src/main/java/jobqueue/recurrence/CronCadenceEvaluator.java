package jobqueue.recurrence;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Calendar cadences written as cron expressions, evaluated with Quartz {@link CronExpression}.
 *
 * <p>Both the 5-field Unix form ({@code min hour dom month dow}) and the 6/7-field Quartz form
 * (with leading seconds, optional trailing year) are accepted. Quartz numbers days of the week
 * {@code 1=SUN..7=SAT}; names such as {@code MON-FRI} avoid the ambiguity. A {@code *} in one
 * day field is rewritten to Quartz's {@code ?} when the other day field is restricted.
 */
public final class CronCadenceEvaluator implements CadenceEvaluator {
  private final ZoneId zone;

  /** Evaluates expressions in UTC. */
  public CronCadenceEvaluator() {
    this(ZoneOffset.UTC);
  }

  public CronCadenceEvaluator(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  @Override
  public void validate(String cadence) {
    compile(cadence);
  }

  @Override
  public Instant next(String cadence, Instant after) {
    Objects.requireNonNull(after, "after");
    Date next = compile(cadence).getNextValidTimeAfter(Date.from(after));
    if (next == null) {
      throw new IllegalArgumentException("Cron expression has no run after " + after + ": " + cadence);
    }
    return next.toInstant();
  }

  /** Returns {@code true} if {@code cadence} parses as a cron expression. */
  public static boolean isCron(String cadence) {
    if (cadence == null || cadence.isBlank()) {
      return false;
    }
    return CronExpression.isValidExpression(normalize(cadence));
  }

  /**
   * Rewrites a 5- or 6-field cron expression into the Quartz dialect.
   *
   * @param cadence the expression
   * @return the Quartz expression; other field counts are returned trimmed but unchanged
   */
  static String normalize(String cadence) {
    String[] fields = cadence.trim().split("\\s+");
    if (fields.length == 5) {
      return quartz("0", fields[0], fields[1], fields[2], fields[3], fields[4], null);
    }
    if (fields.length == 6 || fields.length == 7) {
      return quartz(fields[0], fields[1], fields[2], fields[3], fields[4], fields[5],
          fields.length == 7 ? fields[6] : null);
    }
    return cadence.trim();
  }

  private static String quartz(String sec, String min, String hour, String dom, String month,
      String dow, String year) {
    if (!"?".equals(dom) && !"?".equals(dow)) {
      if ("*".equals(dow)) {
        dow = "?";
      } else if ("*".equals(dom)) {
        dom = "?";
      }
    }
    String expression = String.join(" ", sec, min, hour, dom, month, dow);
    return year == null ? expression : expression + " " + year;
  }

  private CronExpression compile(String cadence) {
    if (cadence == null || cadence.isBlank()) {
      throw new IllegalArgumentException("Cron expression must not be empty");
    }
    try {
      CronExpression expression = new CronExpression(normalize(cadence));
      expression.setTimeZone(TimeZone.getTimeZone(zone));
      return expression;
    } catch (ParseException e) {
      throw new IllegalArgumentException("Invalid cron expression: " + cadence, e);
    }
  }
}
