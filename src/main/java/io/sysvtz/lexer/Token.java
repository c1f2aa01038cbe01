package io.sysvtz.lexer;

import io.sysvtz.Span;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param span the location in the input
 * @param text the token text; for BRACKETED tokens the text between the brackets
 */
public record Token(TokenKind kind, Span span, String text) {
  /** Creates a letter-run token. */
  public static Token word(String text, Span span) {
    return new Token(TokenKind.WORD, span, text);
  }

  /** Creates a bracketed abbreviation token holding the text inside the brackets. */
  public static Token bracketed(String text, Span span) {
    return new Token(TokenKind.BRACKETED, span, text);
  }

  /** Creates a digit-run token. */
  public static Token number(String digits, Span span) {
    return new Token(TokenKind.NUMBER, span, digits);
  }

  /** Creates a single-character punctuation token. */
  public static Token punct(TokenKind kind, char ch, Span span) {
    return new Token(kind, span, String.valueOf(ch));
  }

  /**
   * Returns whether this is a word token with exactly the given text.
   *
   * @param word the expected text
   * @return true on a match
   */
  public boolean isWord(String word) {
    return kind == TokenKind.WORD && text.equals(word);
  }
}
