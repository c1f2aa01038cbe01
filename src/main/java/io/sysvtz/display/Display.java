package io.sysvtz.display;

import io.sysvtz.ast.ChangeRule;
import io.sysvtz.ast.DayRule;
import io.sysvtz.ast.DstRules;
import io.sysvtz.ast.JulianDay;
import io.sysvtz.ast.MonthWeekDay;
import io.sysvtz.ast.PlainDay;
import io.sysvtz.ast.TimezoneDescriptor;
import io.sysvtz.parser.RecipeParser;

/**
 * Renders descriptors as canonical recipe strings.
 *
 * <p>The canonical form always spells out both change rules, drops leading zeros, writes the DST
 * offset only when it is not one hour ahead of standard, and writes a change time only when it is
 * not 02:00:00. Abbreviations are bracketed only when they contain something other than letters.
 */
public final class Display {
  private Display() {}

  /**
   * Renders a descriptor as a canonical recipe.
   *
   * @param descriptor the descriptor to render
   * @return the canonical recipe
   */
  public static String render(TimezoneDescriptor descriptor) {
    StringBuilder sb = new StringBuilder();
    int stdOffset = descriptor.stdOffsetSeconds();

    sb.append(renderAbbreviation(descriptor.stdAbbreviation()));
    sb.append(renderOffset(stdOffset));

    DstRules dst = descriptor.dst();
    if (dst == null) {
      return sb.toString();
    }

    sb.append(renderAbbreviation(dst.abbreviation()));
    if (dst.offsetSeconds() != stdOffset + RecipeParser.DEFAULT_DST_DELTA) {
      sb.append(renderOffset(dst.offsetSeconds()));
    }
    sb.append(',').append(renderChangeRule(dst.startRule(), stdOffset));
    sb.append(',').append(renderChangeRule(dst.endRule(), dst.offsetSeconds()));
    return sb.toString();
  }

  private static String renderAbbreviation(String abbreviation) {
    for (int i = 0; i < abbreviation.length(); i++) {
      char c = abbreviation.charAt(i);
      if (!((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z'))) {
        return "<" + abbreviation + ">";
      }
    }
    return abbreviation;
  }

  /** Recipe signs are inverted: a zone east of UT is written with "-". */
  private static String renderOffset(int offsetSeconds) {
    String sign = offsetSeconds > 0 ? "-" : "";
    return sign + renderHms(Math.abs(offsetSeconds));
  }

  private static String renderChangeRule(ChangeRule rule, int referenceOffset) {
    String day = renderDayRule(rule.dayRule());
    int clock = rule.clockSeconds(referenceOffset);
    if (clock == RecipeParser.DEFAULT_CHANGE_TIME) {
      return day;
    }
    return day + "/" + renderHms(clock);
  }

  private static String renderDayRule(DayRule rule) {
    if (rule instanceof JulianDay julian) {
      return "J" + julian.day();
    }
    if (rule instanceof PlainDay plain) {
      return Integer.toString(plain.day());
    }
    MonthWeekDay mwd = (MonthWeekDay) rule;
    return String.format("M%d.%d.%d", mwd.month(), mwd.week(), mwd.weekday());
  }

  private static String renderHms(int seconds) {
    int h = seconds / 3600;
    int m = seconds / 60 % 60;
    int s = seconds % 60;
    if (s != 0) {
      return String.format("%d:%02d:%02d", h, m, s);
    }
    if (m != 0) {
      return String.format("%d:%02d", h, m);
    }
    return Integer.toString(h);
  }
}
