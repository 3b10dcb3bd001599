package io.mathfield.core.tex;

import java.util.Locale;

/** RGB color of the rendered cursor. */
public record CursorColor(int red, int green, int blue) {

  public static final CursorColor BLACK = new CursorColor(0, 0, 0);

  public CursorColor {
    checkChannel("red", red);
    checkChannel("green", green);
    checkChannel("blue", blue);
  }

  /**
   * Parses a hex color of the form {@code #rrggbb} (the leading {@code #} is optional).
   *
   * @param hex the color text
   * @return the parsed color
   * @throws IllegalArgumentException if {@code hex} is not a six-digit hex color
   */
  public static CursorColor parse(String hex) {
    if (hex == null) {
      throw new IllegalArgumentException("Color must not be null");
    }
    String digits = hex.startsWith("#") ? hex.substring(1) : hex;
    if (digits.length() != 6) {
      throw new IllegalArgumentException("Invalid color: " + hex);
    }
    try {
      int rgb = Integer.parseInt(digits, 16);
      return new CursorColor((rgb >> 16) & 0xff, (rgb >> 8) & 0xff, rgb & 0xff);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid color: " + hex, e);
    }
  }

  /** Returns the color as {@code #rrggbb} in lower case, the form the color directive expects. */
  public String toHex() {
    return String.format(Locale.ROOT, "#%02x%02x%02x", red, green, blue);
  }

  private static void checkChannel(String name, int value) {
    if (value < 0 || value > 255) {
      throw new IllegalArgumentException(name + " out of range [0, 255]: " + value);
    }
  }
}
