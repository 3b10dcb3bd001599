package io.mathfield.core;

import io.mathfield.core.tex.CursorColor;
import io.mathfield.core.tex.TeXSyntax;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rendering settings of a math field. Loads from {@code ~/.mathfield/mathfield.properties} by
 * default.
 */
public record MathFieldConfig(
    String placeholder, String cursorGlyph, CursorColor cursorColor, boolean placeholderWhenEmpty) {

  private static final Logger LOG = LoggerFactory.getLogger(MathFieldConfig.class);

  public MathFieldConfig {
    Objects.requireNonNull(placeholder, "placeholder");
    Objects.requireNonNull(cursorGlyph, "cursorGlyph");
    Objects.requireNonNull(cursorColor, "cursorColor");
  }

  /**
   * Creates the default configuration: {@code \Box} placeholder, {@code \cursor} glyph, black
   * cursor.
   *
   * @return default configuration
   */
  public static MathFieldConfig defaults() {
    return new MathFieldConfig(
        TeXSyntax.DEFAULT.placeholder(), TeXSyntax.DEFAULT.cursorGlyph(), CursorColor.BLACK, true);
  }

  /** Returns the serializer tokens of this configuration. */
  public TeXSyntax syntax() {
    return new TeXSyntax(placeholder, cursorGlyph);
  }

  /** Returns a copy using {@code color} for the cursor. */
  public MathFieldConfig withCursorColor(CursorColor color) {
    return new MathFieldConfig(placeholder, cursorGlyph, color, placeholderWhenEmpty);
  }

  /**
   * Loads configuration from the default location: {@code ~/.mathfield/mathfield.properties}.
   *
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static MathFieldConfig load() throws IOException {
    return load(getConfigPath());
  }

  /**
   * Loads configuration from {@code configPath}.
   *
   * @param configPath properties file to read
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static MathFieldConfig load(Path configPath) throws IOException {
    if (!Files.exists(configPath)) {
      LOG.debug("No configuration at {}, using defaults", configPath);
      return defaults();
    }

    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(configPath)) {
      props.load(reader);
    }

    return fromProperties(props);
  }

  /**
   * Saves this configuration to {@code configPath}, creating parent directories.
   *
   * @throws IOException if the file cannot be written
   */
  public void save(Path configPath) throws IOException {
    Path dir = configPath.toAbsolutePath().getParent();
    if (dir != null) {
      Files.createDirectories(dir);
    }
    try (var writer = Files.newBufferedWriter(configPath)) {
      toProperties().store(writer, "Math field configuration");
    }
  }

  /** Gets the path of the default configuration file. */
  public static Path getConfigPath() {
    String home = System.getProperty("user.home");
    return Path.of(home, ".mathfield", "mathfield.properties");
  }

  /**
   * Converts properties to a configuration. Missing keys take their defaults; an unparsable cursor
   * color is logged and replaced by the default color.
   *
   * @param props properties to convert
   * @return configuration object
   */
  public static MathFieldConfig fromProperties(Properties props) {
    MathFieldConfig defaults = defaults();
    String placeholder = props.getProperty("placeholder", defaults.placeholder());
    String cursorGlyph = props.getProperty("cursor.glyph", defaults.cursorGlyph());

    CursorColor cursorColor = defaults.cursorColor();
    String color = props.getProperty("cursor.color");
    if (color != null) {
      try {
        cursorColor = CursorColor.parse(color.trim());
      } catch (IllegalArgumentException e) {
        LOG.warn("Ignoring invalid cursor.color '{}': {}", color, e.getMessage());
      }
    }

    boolean placeholderWhenEmpty =
        Boolean.parseBoolean(props.getProperty("placeholderWhenEmpty", "true"));

    return new MathFieldConfig(placeholder, cursorGlyph, cursorColor, placeholderWhenEmpty);
  }

  /**
   * Converts this configuration to properties.
   *
   * @return properties representation
   */
  public Properties toProperties() {
    Properties props = new Properties();
    props.setProperty("placeholder", placeholder);
    props.setProperty("cursor.glyph", cursorGlyph);
    props.setProperty("cursor.color", cursorColor.toHex());
    props.setProperty("placeholderWhenEmpty", String.valueOf(placeholderWhenEmpty));
    return props;
  }
}
