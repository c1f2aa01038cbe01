package io.sysvtz.parser;

import io.sysvtz.Span;
import io.sysvtz.TzException;

/**
 * Converts offset and time-of-day fragments of a recipe into seconds.
 *
 * <p>Both share the shape {@code h[:mm[:ss]]}: one or two hour digits, then exactly two digits
 * for minutes and for seconds. Offsets may carry a sign and allow hours up to 24; change times
 * are unsigned and stop at 23.
 *
 * <p>The recipe sign is the opposite of the offset's: "EST5" is five hours behind UT, so no sign
 * or "+" yields a negative offset and "-" a positive one.
 */
public final class OffsetCodec {
  /** Largest hour accepted in an offset. */
  public static final int MAX_OFFSET_HOUR = 24;

  /** Largest hour accepted in a change time. */
  public static final int MAX_CLOCK_HOUR = 23;

  /** Largest offset magnitude, 24:59:59. */
  public static final int MAX_OFFSET_SECONDS = 89999;

  private OffsetCodec() {}

  /**
   * Parses a standalone offset token such as "5", "-3:30" or "+04:15:30".
   *
   * @param token the offset token
   * @return the offset east of UT, in seconds
   * @throws TzException if the token is not a valid offset
   */
  public static int parseOffset(String token) throws TzException {
    return parseOffset(token, new Span(0, token.length()));
  }

  /**
   * Parses the offset occupying the given span of a recipe.
   *
   * @param input the recipe
   * @param span the location of the offset in the recipe
   * @return the offset east of UT, in seconds
   * @throws TzException if the fragment is not a valid offset
   */
  public static int parseOffset(String input, Span span) throws TzException {
    String token = input.substring(span.start(), span.end());
    int i = 0;
    boolean east = false;
    if (!token.isEmpty() && (token.charAt(0) == '+' || token.charAt(0) == '-')) {
      east = token.charAt(0) == '-';
      i = 1;
    }
    int magnitude = hms(token, i, MAX_OFFSET_HOUR, input, span, "offset");
    return east ? magnitude : -magnitude;
  }

  /**
   * Parses the change time occupying the given span of a recipe.
   *
   * @param input the recipe
   * @param span the location of the time in the recipe
   * @return the time of day in seconds
   * @throws TzException if the fragment is not a valid time of day
   */
  public static int parseClockTime(String input, Span span) throws TzException {
    String token = input.substring(span.start(), span.end());
    return hms(token, 0, MAX_CLOCK_HOUR, input, span, "time of day");
  }

  private static int hms(
      String token, int from, int maxHour, String input, Span span, String what)
      throws TzException {
    int[] fields = new int[3];
    int field = 0;
    int i = from;
    while (true) {
      int digitsStart = i;
      while (i < token.length() && isDigit(token.charAt(i))) {
        i++;
      }
      int digits = i - digitsStart;
      boolean widthOk = field == 0 ? digits >= 1 && digits <= 2 : digits == 2;
      if (!widthOk) {
        throw TzException.invalidRecipe("malformed " + what, span, input);
      }
      fields[field] = Integer.parseInt(token.substring(digitsStart, i));
      if (i == token.length()) {
        break;
      }
      if (token.charAt(i) != ':' || field == 2) {
        throw TzException.invalidRecipe("malformed " + what, span, input);
      }
      i++;
      field++;
    }

    if (fields[0] > maxHour) {
      throw TzException.invalidRecipe(what + " hour out of range", span, input);
    }
    if (fields[1] > 59 || fields[2] > 59) {
      throw TzException.invalidRecipe(what + " minutes or seconds out of range", span, input);
    }
    return fields[0] * 3600 + fields[1] * 60 + fields[2];
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
