package io.sysvtz.parser;

import io.sysvtz.Span;
import io.sysvtz.TzException;
import io.sysvtz.ast.ChangeRule;
import io.sysvtz.ast.DayRule;
import io.sysvtz.ast.DstRules;
import io.sysvtz.ast.JulianDay;
import io.sysvtz.ast.MonthWeekDay;
import io.sysvtz.ast.PlainDay;
import io.sysvtz.ast.TimezoneDescriptor;
import io.sysvtz.lexer.Lexer;
import io.sysvtz.lexer.Token;
import io.sysvtz.lexer.TokenKind;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser for System V timezone recipes.
 *
 * <p>Grammar, which must match the whole input:
 *
 * <pre>
 * recipe     := abbrev offset [ abbrev [offset] [ "," changerule "," changerule ] ]
 * abbrev     := ALPHA{3,} | "&lt;" (alnum | "+" | "-"){3,} "&gt;"
 * offset     := ["+"|"-"] hh [ ":" mm [ ":" ss ] ]
 * changerule := dayrule [ "/" hh [ ":" mm [ ":" ss ] ] ]
 * dayrule    := "J" n | n | "M" m "." w "." d
 * </pre>
 *
 * <p>A DST zone without rules gets the legacy pair M4.5.0 and M10.5.0 (last Sunday of April, last
 * Sunday of October). That pair is kept for compatibility with old ruleless recipes; it is not the
 * current rule of any jurisdiction.
 */
public final class RecipeParser {
  private static final Logger log = LoggerFactory.getLogger(RecipeParser.class);

  /** Change time used when a rule states none, 02:00:00. */
  public static final int DEFAULT_CHANGE_TIME = 7200;

  /** Distance of the DST offset from standard when the recipe states none. */
  public static final int DEFAULT_DST_DELTA = 3600;

  /** Legacy start day for ruleless DST recipes: last Sunday of April. */
  public static final DayRule DEFAULT_START_DAY = new MonthWeekDay(4, MonthWeekDay.LAST_WEEK, 0);

  /** Legacy end day for ruleless DST recipes: last Sunday of October. */
  public static final DayRule DEFAULT_END_DAY = new MonthWeekDay(10, MonthWeekDay.LAST_WEEK, 0);

  private static final int MIN_ABBREVIATION_LENGTH = 3;

  private final String input;
  private final List<Token> tokens;
  private int pos;

  private RecipeParser(String input, List<Token> tokens) {
    this.input = input;
    this.tokens = tokens;
    this.pos = 0;
  }

  /**
   * Parses a recipe into a TimezoneDescriptor.
   *
   * @param input the recipe string to parse
   * @return the parsed descriptor
   * @throws TzException if the input is not a valid recipe
   */
  public static TimezoneDescriptor parse(String input) throws TzException {
    if (input == null || input.isEmpty()) {
      throw TzException.invalidRecipe("empty input", new Span(0, 0), input == null ? "" : input);
    }

    try {
      List<Token> tokens = Lexer.tokenize(input);
      return new RecipeParser(input, tokens).parseRecipe();
    } catch (TzException e) {
      log.debug("Rejected timezone recipe: {}", e.getMessage());
      throw e;
    }
  }

  private TimezoneDescriptor parseRecipe() throws TzException {
    String stdAbbreviation = parseAbbreviation("standard");
    int stdOffset = parseOffset("standard");
    if (atEnd()) {
      return TimezoneDescriptor.fixed(input, stdAbbreviation, stdOffset);
    }

    String dstAbbreviation = parseAbbreviation("daylight-saving");
    int dstOffset = startsOffset() ? parseOffset("daylight-saving") : stdOffset + DEFAULT_DST_DELTA;

    ChangeRule startRule;
    ChangeRule endRule;
    if (atEnd()) {
      startRule = ChangeRule.of(DEFAULT_START_DAY, DEFAULT_CHANGE_TIME, stdOffset);
      endRule = ChangeRule.of(DEFAULT_END_DAY, DEFAULT_CHANGE_TIME, dstOffset);
    } else {
      expect(TokenKind.COMMA, "expected ',' before the DST start rule");
      // The start time is read in standard time, the end time in DST
      startRule = parseChangeRule(stdOffset);
      expect(TokenKind.COMMA, "expected ',' before the DST end rule");
      endRule = parseChangeRule(dstOffset);
      if (!atEnd()) {
        throw parseError(
            "unexpected trailing characters", new Span(peek().span().start(), input.length()));
      }
    }

    return new TimezoneDescriptor(
        input,
        null,
        stdAbbreviation,
        stdOffset,
        new DstRules(dstAbbreviation, dstOffset, startRule, endRule));
  }

  private String parseAbbreviation(String which) throws TzException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("expected " + which + " abbreviation", endSpan());
    }
    if (tok.kind() != TokenKind.WORD && tok.kind() != TokenKind.BRACKETED) {
      throw parseError("expected " + which + " abbreviation", tok.span());
    }
    if (tok.text().length() < MIN_ABBREVIATION_LENGTH) {
      throw parseError(
          which + " abbreviation must have at least " + MIN_ABBREVIATION_LENGTH + " characters",
          tok.span());
    }
    pos++;
    return tok.text();
  }

  private boolean startsOffset() {
    return check(TokenKind.PLUS) || check(TokenKind.MINUS) || check(TokenKind.NUMBER);
  }

  private int parseOffset(String which) throws TzException {
    Token first = peek();
    if (first == null) {
      throw parseError("expected " + which + " offset", endSpan());
    }
    if (first.kind() == TokenKind.PLUS || first.kind() == TokenKind.MINUS) {
      pos++;
    }
    Span span = first.span().to(parseTimeFields("expected " + which + " offset"));
    return OffsetCodec.parseOffset(input, span);
  }

  private ChangeRule parseChangeRule(int referenceOffset) throws TzException {
    DayRule dayRule = parseDayRule();
    int clockSeconds = DEFAULT_CHANGE_TIME;
    if (check(TokenKind.SLASH)) {
      pos++;
      Token first = peek();
      Span span = parseTimeFields("expected time of day after '/'");
      clockSeconds = OffsetCodec.parseClockTime(input, first.span().to(span));
    }
    return ChangeRule.of(dayRule, clockSeconds, referenceOffset);
  }

  /** Consumes NUMBER [":" NUMBER [":" NUMBER ...]] and returns the span of the last field. */
  private Span parseTimeFields(String message) throws TzException {
    Token last = expect(TokenKind.NUMBER, message);
    while (check(TokenKind.COLON)) {
      pos++;
      last = expect(TokenKind.NUMBER, "expected digits after ':'");
    }
    return last.span();
  }

  private DayRule parseDayRule() throws TzException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("expected day rule", endSpan());
    }

    if (tok.isWord("J")) {
      pos++;
      Token day = expect(TokenKind.NUMBER, "expected day number after 'J'");
      return new JulianDay(boundedNumber(day, 1, 365, "julian day"));
    }

    if (tok.isWord("M")) {
      pos++;
      int month =
          boundedNumber(expect(TokenKind.NUMBER, "expected month after 'M'"), 1, 12, "month");
      expect(TokenKind.DOT, "expected '.' after month");
      int week = boundedNumber(expect(TokenKind.NUMBER, "expected week"), 1, 5, "week");
      expect(TokenKind.DOT, "expected '.' after week");
      int weekday = boundedNumber(expect(TokenKind.NUMBER, "expected weekday"), 0, 6, "weekday");
      return new MonthWeekDay(month, week, weekday);
    }

    if (tok.kind() == TokenKind.NUMBER) {
      pos++;
      return new PlainDay(boundedNumber(tok, 0, 365, "day of year"));
    }

    throw parseError("malformed day rule", tok.span());
  }

  /** Reads a NUMBER token allowing any number of leading zeros. */
  private int boundedNumber(Token tok, int min, int max, String what) throws TzException {
    String digits = tok.text();
    int i = 0;
    while (i < digits.length() - 1 && digits.charAt(i) == '0') {
      i++;
    }
    String significant = digits.substring(i);
    // Anything longer than max's digits is out of range, and would overflow parseInt
    if (significant.length() > String.valueOf(max).length()) {
      throw parseError(what + " out of range", tok.span());
    }
    int value = Integer.parseInt(significant);
    if (value < min || value > max) {
      throw parseError(what + " out of range", tok.span());
    }
    return value;
  }

  // Helper methods

  private boolean atEnd() {
    return pos >= tokens.size();
  }

  private Token peek() {
    return pos < tokens.size() ? tokens.get(pos) : null;
  }

  private boolean check(TokenKind kind) {
    Token tok = peek();
    return tok != null && tok.kind() == kind;
  }

  private Token expect(TokenKind kind, String message) throws TzException {
    Token tok = peek();
    if (tok == null) {
      throw parseError(message, endSpan());
    }
    if (tok.kind() != kind) {
      throw parseError(message, tok.span());
    }
    pos++;
    return tok;
  }

  private Span endSpan() {
    return new Span(input.length(), input.length());
  }

  private TzException parseError(String message, Span span) {
    return TzException.invalidRecipe(message, span, input);
  }
}
