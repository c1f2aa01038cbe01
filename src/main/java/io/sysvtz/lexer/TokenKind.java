package io.sysvtz.lexer;

/** The type of token. */
public enum TokenKind {
  /** A run of ASCII letters (an abbreviation, or "J"/"M" in a day rule). */
  WORD,
  /** An angle-bracketed abbreviation such as "&lt;+0530&gt;". */
  BRACKETED,
  /** A run of decimal digits. */
  NUMBER,
  /** A "+" sign. */
  PLUS,
  /** A "-" sign. */
  MINUS,
  /** A ":" between hours, minutes and seconds. */
  COLON,
  /** A "." between the fields of an "M" day rule. */
  DOT,
  /** A "," before each change rule. */
  COMMA,
  /** A "/" between a day rule and its time of day. */
  SLASH
}
