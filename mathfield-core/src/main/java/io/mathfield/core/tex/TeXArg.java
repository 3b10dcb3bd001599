package io.mathfield.core.tex;

/** Delimiter pair wrapping one argument of a {@link TeXFunction}. */
public enum TeXArg {
  /** Braces, used by most templates (fraction numerator and denominator, exponents). */
  BRACES("{", "}"),
  /** Brackets, the optional degree of an n-th root. */
  BRACKETS("[", "]"),
  /** Parentheses, e.g. the argument of a base-n logarithm. */
  PARENTHESES("(", ")");

  private final String opening;
  private final String closing;

  TeXArg(String opening, String closing) {
    this.opening = opening;
    this.closing = closing;
  }

  public String opening() {
    return opening;
  }

  public String closing() {
    return closing;
  }

  /**
   * Resolves a slot from its delimiter pair, e.g. {@code "{}"}.
   *
   * @param s the opening and closing delimiter written together
   * @return the matching slot kind
   * @throws IllegalArgumentException if {@code s} names no delimiter pair
   */
  public static TeXArg fromSymbol(String s) {
    return switch (s) {
      case "{}" -> BRACES;
      case "[]" -> BRACKETS;
      case "()" -> PARENTHESES;
      default -> throw new IllegalArgumentException("Unknown argument delimiters: " + s);
    };
  }
}
