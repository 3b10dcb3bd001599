package io.mathfield.shell;

import io.mathfield.core.MathFieldEditingController;
import io.mathfield.core.tex.TeXArg;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Translates shell command lines into editing controller calls. */
public final class CommandDispatcher {

  /** Output sink for command results. */
  public interface IO {
    void println(String s);

    void error(String s);
  }

  static final String[] COMMANDS = {
    "leaf", "fn", "left", "right", "del", "clear", "wrap", "page", "show", "value", "help"
  };

  private final MathFieldEditingController controller;
  private final IO io;

  public CommandDispatcher(MathFieldEditingController controller, IO io) {
    this.controller = Objects.requireNonNull(controller, "controller");
    this.io = Objects.requireNonNull(io, "io");
  }

  public MathFieldEditingController controller() {
    return controller;
  }

  /**
   * Runs one command line.
   *
   * @param line the raw input; backslashes are taken literally
   * @return false if the command is unknown
   */
  public boolean dispatch(String line) {
    String trimmed = line.trim();
    if (trimmed.isEmpty()) return true;

    String[] parts = trimmed.split("\\s+", 2);
    String cmd = parts[0].toLowerCase(Locale.ROOT);
    String rest = parts.length > 1 ? parts[1].trim() : "";

    try {
      switch (cmd) {
        case "leaf" -> cmdLeaf(rest);
        case "fn" -> cmdFunction(rest);
        case "wrap" -> cmdWrap(rest);
        case "left" -> edit(controller::goBack);
        case "right" -> edit(controller::goNext);
        case "del" -> edit(() -> controller.goBack(true));
        case "clear" -> edit(controller::clear);
        case "page" -> {
          controller.togglePage();
          io.println("Keyboard page: " + (controller.isSecondPage() ? 2 : 1));
        }
        case "show" -> io.println(controller.render());
        case "value" -> io.println(controller.currentEditingValue(false));
        case "help" -> cmdHelp();
        default -> {
          return false;
        }
      }
      return true;
    } catch (Exception e) {
      io.error("Error: " + e.getMessage());
      return true;
    }
  }

  private void cmdLeaf(String tex) {
    if (tex.isEmpty()) {
      io.error("Usage: leaf <tex>");
      return;
    }
    edit(() -> controller.addLeaf(tex));
  }

  private void cmdFunction(String rest) {
    List<String> tokens = tokens(rest);
    if (tokens.size() < 2) {
      io.error("Usage: fn <name> <slot>... (slots: {} [] ())");
      return;
    }
    List<TeXArg> args = slots(tokens.subList(1, tokens.size()));
    edit(() -> controller.addFunction(tokens.get(0), args));
  }

  private void cmdWrap(String rest) {
    List<String> tokens = tokens(rest);
    if (tokens.size() < 2) {
      io.error("Usage: wrap <name> <slot>... (slots: {} [] ())");
      return;
    }
    List<TeXArg> args = slots(tokens.subList(1, tokens.size()));
    edit(() -> controller.wrapAll(tokens.get(0), args));
  }

  private void cmdHelp() {
    io.println("Commands:");
    io.println("  leaf <tex>             insert a token, e.g. 'leaf x' or 'leaf \\cdot'");
    io.println("  fn <name> <slot>...    insert a template, e.g. 'fn \\frac {} {}'");
    io.println("  wrap <name> <slot>...  move the whole expression into a new template");
    io.println("  left | right           move the cursor");
    io.println("  del                    delete left of the cursor");
    io.println("  clear                  start over");
    io.println("  page                   switch keyboard page");
    io.println("  show                   print the markup with the cursor");
    io.println("  value                  print the markup without the cursor");
    io.println("  help                   show this list");
    io.println("  exit | quit            leave the shell");
  }

  private void edit(Runnable action) {
    action.run();
    io.println(controller.render());
  }

  private static List<String> tokens(String rest) {
    return rest.isEmpty() ? List.of() : Arrays.asList(rest.split("\\s+"));
  }

  private static List<TeXArg> slots(List<String> symbols) {
    List<TeXArg> args = new ArrayList<>(symbols.size());
    for (String symbol : symbols) {
      args.add(TeXArg.fromSymbol(symbol));
    }
    return args;
  }
}
