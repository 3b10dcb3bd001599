package io.mathfield.core.tex;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CursorColorTest {

  @Test
  void formatsAsLowerCaseHex() {
    assertEquals("#0a0bff", new CursorColor(10, 11, 255).toHex());
  }

  @Test
  void parsesWithAndWithoutHash() {
    assertEquals(new CursorColor(0x12, 0x34, 0xab), CursorColor.parse("#1234AB"));
    assertEquals(new CursorColor(0x12, 0x34, 0xab), CursorColor.parse("1234ab"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "#12345", "#1234567", "#12345g", "red"})
  void rejectsMalformedColors(String text) {
    assertThrows(IllegalArgumentException.class, () -> CursorColor.parse(text));
  }

  @Test
  void rejectsChannelsOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> new CursorColor(256, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> new CursorColor(0, -1, 0));
  }
}
