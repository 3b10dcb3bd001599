package io.mathfield.shell;

import io.mathfield.core.MathFieldEditingController;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Interactive terminal editor for a math field document. */
public final class Shell implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Shell.class);

  private final Terminal terminal;
  private final LineReader lineReader;
  private final CommandDispatcher dispatcher;
  private boolean running = true;

  public Shell(MathFieldEditingController controller) throws IOException {
    this.terminal = TerminalBuilder.builder().system(true).build();

    CommandDispatcher.IO io =
        new CommandDispatcher.IO() {
          @Override
          public void println(String s) {
            terminal.writer().println(s);
            terminal.flush();
          }

          @Override
          public void error(String s) {
            terminal.writer().println(s);
            terminal.flush();
          }
        };
    this.dispatcher = new CommandDispatcher(controller, io);

    Path histPath = Paths.get(System.getProperty("user.home"), ".mathfield", "history");
    try {
      Files.createDirectories(histPath.getParent());
    } catch (IOException e) {
      LOG.warn("Cannot create history directory {}: {}", histPath.getParent(), e.getMessage());
    }

    // Markup is full of backslashes; keep them literal.
    DefaultParser parser = new DefaultParser();
    parser.setEscapeChars(null);

    this.lineReader =
        LineReaderBuilder.builder()
            .terminal(terminal)
            .variable(LineReader.HISTORY_FILE, histPath)
            .history(new DefaultHistory())
            .completer(new ShellCompleter())
            .parser(parser)
            .build();
  }

  public void run(boolean quiet) {
    if (!quiet) {
      printBanner();
    }

    while (running) {
      try {
        String input = lineReader.readLine("mathfield> ");
        if (input == null || input.isBlank()) continue;
        input = input.trim();

        if ("exit".equalsIgnoreCase(input) || "quit".equalsIgnoreCase(input)) {
          running = false;
          continue;
        }

        if (!dispatcher.dispatch(input)) {
          terminal.writer().println("Unknown command: " + input);
          terminal.writer().println("Type 'help' for available commands.");
          terminal.flush();
        }
      } catch (UserInterruptException e) {
        terminal.writer().println("^C");
        terminal.flush();
      } catch (EndOfFileException e) {
        running = false;
      }
    }
  }

  private void printBanner() {
    terminal.writer().println("Math field editor. Type 'help' for commands, 'exit' to quit.");
    terminal.writer().println(dispatcher.controller().render());
    terminal.flush();
  }

  @Override
  public void close() throws IOException {
    terminal.close();
  }
}
