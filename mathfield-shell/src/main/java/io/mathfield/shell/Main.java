package io.mathfield.shell;

import io.mathfield.core.MathFieldConfig;
import io.mathfield.core.MathFieldEditingController;
import io.mathfield.core.tex.CursorColor;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "mathfield",
    description = "Edit a math expression step by step and print its markup",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public final class Main implements Callable<Integer> {

  @CommandLine.Option(
      names = {"-c", "--config"},
      description = "Configuration file (default: ~/.mathfield/mathfield.properties)")
  private Path config;

  @CommandLine.Option(
      names = {"--color"},
      description = "Cursor color as #rrggbb, overrides the configuration")
  private String color;

  @CommandLine.Option(
      names = {"-e", "--execute"},
      description = "Command to run before the interactive session (repeatable)")
  private List<String> commands = new ArrayList<>();

  @CommandLine.Option(
      names = {"--batch"},
      description = "Run the --execute commands, print the final value and exit")
  private boolean batch;

  @CommandLine.Option(
      names = {"-q", "--quiet"},
      description = "Suppress banner (interactive mode)")
  private boolean quiet;

  private final PrintStream out;
  private final PrintStream err;
  private boolean commandFailed;

  public Main() {
    this(System.out, System.err);
  }

  Main(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    MathFieldConfig cfg = config != null ? MathFieldConfig.load(config) : MathFieldConfig.load();
    if (color != null) {
      try {
        cfg = cfg.withCursorColor(CursorColor.parse(color));
      } catch (IllegalArgumentException e) {
        err.println("Error: " + e.getMessage());
        return 2;
      }
    }

    MathFieldEditingController controller = new MathFieldEditingController(cfg);
    CommandDispatcher dispatcher =
        new CommandDispatcher(
            controller,
            new CommandDispatcher.IO() {
              @Override
              public void println(String s) {
                if (!batch) out.println(s);
              }

              @Override
              public void error(String s) {
                commandFailed = true;
                err.println(s);
              }
            });
    for (String command : commands) {
      if (!dispatcher.dispatch(command)) {
        err.println("Unknown command: " + command);
        return 1;
      }
      if (batch && commandFailed) {
        return 1;
      }
    }

    if (batch) {
      out.println(controller.currentEditingValue(cfg.placeholderWhenEmpty()));
      return 0;
    }

    try (Shell shell = new Shell(controller)) {
      shell.run(quiet);
      return 0;
    }
  }
}
