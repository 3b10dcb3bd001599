package io.mathfield.core.tex;

/**
 * Zero-width cursor fragment.
 *
 * <p>Trees never store it among their fragments; it appears in {@link TeXNode#children()} at the
 * cursor position and is emitted by the serializer as a color directive around the cursor glyph.
 */
public record CursorMarker() implements TeX {

  public static final CursorMarker INSTANCE = new CursorMarker();

  @Override
  public Kind kind() {
    return Kind.CURSOR;
  }

  @Override
  public String expression() {
    return "";
  }

  @Override
  public String buildString(CursorColor cursorColor, TeXSyntax syntax) {
    if (cursorColor == null) {
      throw new IllegalStateException("CursorMarker.buildString() called without a cursor color");
    }
    return "\\textcolor{" + cursorColor.toHex() + "}{" + syntax.cursorGlyph() + "}";
  }

  @Override
  public String toString() {
    return "Cursor";
  }
}
