package io.mathfield.shell;

import static org.junit.jupiter.api.Assertions.*;

import io.mathfield.core.MathFieldEditingController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CommandDispatcherTest {

  static class BufferIO implements CommandDispatcher.IO {
    final StringBuilder out = new StringBuilder();
    @Override public void println(String s) { out.append(s).append('\n'); }
    @Override public void error(String s) { out.append(s).append('\n'); }
    String text() { return out.toString(); }
    void clear() { out.setLength(0); }
  }

  private static final String CURSOR = "\\textcolor{#000000}{\\cursor}";

  MathFieldEditingController controller;
  BufferIO io;
  CommandDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    controller = new MathFieldEditingController();
    io = new BufferIO();
    dispatcher = new CommandDispatcher(controller, io);
  }

  @Test
  void editsPrintRenderedMarkup() {
    assertTrue(dispatcher.dispatch("leaf 2"));
    assertTrue(dispatcher.dispatch("leaf \\cdot"));
    assertTrue(dispatcher.dispatch("leaf x"));

    assertTrue(io.text().endsWith("2\\cdot x" + CURSOR + "\n"));
    assertEquals("2\\cdot x", controller.currentEditingValue(false));
  }

  @Test
  void functionTemplateWithSlots() {
    dispatcher.dispatch("fn \\sqrt [] {}");
    dispatcher.dispatch("leaf 3");
    dispatcher.dispatch("right");
    dispatcher.dispatch("leaf x");

    io.clear();
    dispatcher.dispatch("value");
    assertEquals("\\sqrt[3]{x}\n", io.text());
  }

  @Test
  void navigationAndDeletion() {
    dispatcher.dispatch("leaf a");
    dispatcher.dispatch("leaf b");
    dispatcher.dispatch("left");
    dispatcher.dispatch("del");

    io.clear();
    dispatcher.dispatch("show");
    assertEquals(CURSOR + "b\n", io.text());
  }

  @Test
  void wrapAndClear() {
    dispatcher.dispatch("leaf 1");
    dispatcher.dispatch("wrap \\frac {} {}");
    assertEquals("\\frac{1}{\\Box}", controller.currentEditingValue(false));

    dispatcher.dispatch("clear");
    assertTrue(controller.isEmpty());
  }

  @Test
  void pageTogglesKeyboardPage() {
    dispatcher.dispatch("page");
    assertTrue(io.text().contains("Keyboard page: 2"));
    assertTrue(controller.isSecondPage());
  }

  @Test
  void badSlotsReportErrorAndLeaveDocumentAlone() {
    assertTrue(dispatcher.dispatch("fn \\frac {} <>"));
    assertTrue(io.text().contains("Error: Unknown argument delimiters: <>"));
    assertTrue(controller.isEmpty());
  }

  @Test
  void missingArgumentsPrintUsage() {
    dispatcher.dispatch("leaf");
    dispatcher.dispatch("fn \\frac");
    dispatcher.dispatch("wrap");

    String text = io.text();
    assertTrue(text.contains("Usage: leaf <tex>"));
    assertTrue(text.contains("Usage: fn <name>"));
    assertTrue(text.contains("Usage: wrap <name>"));
  }

  @Test
  void unknownCommandIsNotHandled() {
    assertFalse(dispatcher.dispatch("frobnicate"));
    assertTrue(dispatcher.dispatch("   "));
  }

  @Test
  void helpListsCommands() {
    dispatcher.dispatch("help");
    for (String cmd : CommandDispatcher.COMMANDS) {
      assertTrue(io.text().contains(cmd), cmd);
    }
  }
}
