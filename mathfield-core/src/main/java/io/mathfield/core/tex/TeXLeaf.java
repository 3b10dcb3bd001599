package io.mathfield.core.tex;

import java.util.Objects;

/** Atomic markup token, possibly a multi-character command such as {@code \sin(}. */
public record TeXLeaf(String expression) implements TeX {

  public TeXLeaf {
    Objects.requireNonNull(expression, "expression");
  }

  @Override
  public Kind kind() {
    return Kind.LEAF;
  }

  @Override
  public String buildString(CursorColor cursorColor, TeXSyntax syntax) {
    return expression;
  }
}
