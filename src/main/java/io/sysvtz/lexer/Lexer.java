package io.sysvtz.lexer;

import io.sysvtz.Span;
import io.sysvtz.TzException;
import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizes recipe strings into a list of tokens.
 *
 * <p>Recipes contain no whitespace; any character outside ASCII letters, digits, the bracket
 * abbreviation syntax and {@code + - : . , /} is rejected.
 */
public final class Lexer {
  private final String input;
  private int pos;

  private Lexer(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Tokenizes the recipe string into a list of tokens.
   *
   * @param input the recipe string to tokenize
   * @return a list of tokens
   * @throws TzException if the input contains characters outside the recipe alphabet
   */
  public static List<Token> tokenize(String input) throws TzException {
    return new Lexer(input).doTokenize();
  }

  private List<Token> doTokenize() throws TzException {
    List<Token> tokens = new ArrayList<>();
    while (pos < input.length()) {
      int start = pos;
      char ch = input.charAt(pos);

      if (isAlpha(ch)) {
        tokens.add(lexWord());
        continue;
      }

      if (isDigit(ch)) {
        tokens.add(lexNumber());
        continue;
      }

      if (ch == '<') {
        tokens.add(lexBracketed());
        continue;
      }

      TokenKind kind = punctuation(ch);
      if (kind == null) {
        throw TzException.invalidRecipe(
            "unexpected character '" + ch + "'", new Span(start, start + 1), input);
      }
      pos++;
      tokens.add(Token.punct(kind, ch, new Span(start, pos)));
    }

    return tokens;
  }

  private Token lexWord() {
    int start = pos;
    while (pos < input.length() && isAlpha(input.charAt(pos))) {
      pos++;
    }
    return Token.word(input.substring(start, pos), new Span(start, pos));
  }

  private Token lexNumber() {
    int start = pos;
    while (pos < input.length() && isDigit(input.charAt(pos))) {
      pos++;
    }
    return Token.number(input.substring(start, pos), new Span(start, pos));
  }

  private Token lexBracketed() throws TzException {
    int start = pos;
    pos++; // skip '<'
    int contentStart = pos;
    while (pos < input.length() && isAbbrevChar(input.charAt(pos))) {
      pos++;
    }
    if (pos >= input.length() || input.charAt(pos) != '>') {
      throw TzException.invalidRecipe(
          "unterminated or invalid bracketed abbreviation", new Span(start, pos + 1), input);
    }
    String content = input.substring(contentStart, pos);
    pos++; // skip '>'
    return Token.bracketed(content, new Span(start, pos));
  }

  private static TokenKind punctuation(char c) {
    return switch (c) {
      case '+' -> TokenKind.PLUS;
      case '-' -> TokenKind.MINUS;
      case ':' -> TokenKind.COLON;
      case '.' -> TokenKind.DOT;
      case ',' -> TokenKind.COMMA;
      case '/' -> TokenKind.SLASH;
      default -> null;
    };
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAlpha(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
  }

  private static boolean isAbbrevChar(char c) {
    return isAlpha(c) || isDigit(c) || c == '+' || c == '-';
  }
}
