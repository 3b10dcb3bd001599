package io.mathfield.core.tex;

import java.util.Objects;

/**
 * Tokens the serializer emits that are not part of any fragment.
 *
 * @param placeholder token for an empty tree, e.g. {@code \Box}
 * @param cursorGlyph glyph wrapped in the cursor color directive, e.g. {@code \cursor}
 */
public record TeXSyntax(String placeholder, String cursorGlyph) {

  public static final TeXSyntax DEFAULT = new TeXSyntax("\\Box", "\\cursor");

  public TeXSyntax {
    Objects.requireNonNull(placeholder, "placeholder");
    Objects.requireNonNull(cursorGlyph, "cursorGlyph");
  }
}
