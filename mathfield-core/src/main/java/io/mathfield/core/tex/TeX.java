package io.mathfield.core.tex;

/**
 * One fragment of an expression under edit.
 *
 * <p>A fragment is either an atomic token ({@link TeXLeaf}), a command with nested argument trees
 * ({@link TeXFunction}) or the zero-width cursor ({@link CursorMarker}). Call sites that need to
 * treat the kinds differently switch over {@link #kind()}, so adding a kind is a compile-checked
 * change.
 */
public sealed interface TeX permits TeXLeaf, TeXFunction, CursorMarker {

  /** Discriminator for exhaustive dispatch over fragment kinds. */
  enum Kind {
    LEAF,
    FUNCTION,
    CURSOR
  }

  /** Returns the kind of this fragment. */
  Kind kind();

  /** Returns the markup text this fragment was created from (empty for the cursor). */
  String expression();

  /**
   * Serializes this fragment to markup.
   *
   * @param cursorColor color for the cursor glyph, or {@code null} when no cursor is rendered
   * @param syntax placeholder and cursor glyph tokens
   * @return the markup text
   * @throws IllegalStateException if this is a cursor and {@code cursorColor} is {@code null}
   */
  String buildString(CursorColor cursorColor, TeXSyntax syntax);
}
