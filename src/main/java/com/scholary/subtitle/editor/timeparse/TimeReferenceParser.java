package com.scholary.subtitle.editor.timeparse;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts free-form time references into seconds.
 *
 * <p>Three rules are tried in order and the first one that succeeds wins:
 *
 * <ol>
 *   <li>Colon form: {@code MM:SS} or {@code HH:MM:SS}. A zero result is accepted.
 *   <li>Natural language: any of "2 hours", "5 min", "1.5 s" and friends, summed.
 *   <li>A bare number, read as seconds.
 * </ol>
 *
 * <p>Rules 2 and 3 must produce a strictly positive value; "0 seconds" is not a match. Digit runs
 * too long to represent as a finite double match no rule.
 */
@Component
public class TimeReferenceParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimeReferenceParser.class);

  private static final Pattern UNSIGNED_NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?|\\.\\d+");

  private static final Pattern HOURS_PATTERN =
      Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:hour|hr|h)");
  private static final Pattern MINUTES_PATTERN =
      Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:minute|min|m)");
  private static final Pattern SECONDS_PATTERN =
      Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:second|sec|s)");

  /**
   * Parse a time expression.
   *
   * @param text the expression, e.g. "1:30", "0:02:05", "1 minute 30 seconds" or "12.5"
   * @return the time in seconds
   * @throws TimeParseException if no rule matches
   */
  public double parse(String text) {
    if (text == null) {
      throw new TimeParseException(null);
    }
    String normalized = text.trim().toLowerCase(Locale.ROOT);

    Double colonSeconds = parseColonForm(normalized);
    if (colonSeconds != null) {
      if (Double.isFinite(colonSeconds)) {
        return colonSeconds;
      }
      throw new TimeParseException(text);
    }

    double total = parseNaturalLanguage(normalized);
    if (total == 0) {
      total = parseBareNumber(normalized);
    }

    if (total > 0 && Double.isFinite(total)) {
      return total;
    }
    throw new TimeParseException(text);
  }

  /**
   * Parse a time expression, falling back to a default for blank or unrecognized input.
   *
   * @param text the expression, may be null
   * @param defaultSeconds value returned when the expression cannot be parsed
   * @return the parsed time, or the default
   */
  public double parseOrDefault(String text, double defaultSeconds) {
    if (text == null || text.isBlank()) {
      return defaultSeconds;
    }
    try {
      return parse(text);
    } catch (TimeParseException e) {
      LOGGER.debug("Falling back to {}s: {}", defaultSeconds, e.getMessage());
      return defaultSeconds;
    }
  }

  private Double parseColonForm(String text) {
    String[] groups = text.split(":", -1);
    if (groups.length != 2 && groups.length != 3) {
      return null;
    }

    double[] values = new double[groups.length];
    for (int i = 0; i < groups.length; i++) {
      String group = groups[i].trim();
      if (!UNSIGNED_NUMBER.matcher(group).matches()) {
        return null;
      }
      values[i] = Double.parseDouble(group);
    }

    if (values.length == 2) {
      return values[0] * 60 + values[1];
    }
    return values[0] * 3600 + values[1] * 60 + values[2];
  }

  private double parseNaturalLanguage(String text) {
    return firstQuantity(HOURS_PATTERN, text) * 3600
        + firstQuantity(MINUTES_PATTERN, text) * 60
        + firstQuantity(SECONDS_PATTERN, text);
  }

  private double firstQuantity(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    if (matcher.find()) {
      return Double.parseDouble(matcher.group(1));
    }
    return 0;
  }

  // Signed input never yields a positive value, so only unsigned numbers are read.
  private double parseBareNumber(String text) {
    if (!UNSIGNED_NUMBER.matcher(text).matches()) {
      return 0;
    }
    return Double.parseDouble(text);
  }
}
