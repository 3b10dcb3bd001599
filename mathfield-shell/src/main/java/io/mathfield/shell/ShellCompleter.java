package io.mathfield.shell;

import java.util.List;
import java.util.Locale;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;

/** Completes command names and, for templates, argument slot delimiters. */
public final class ShellCompleter implements Completer {

  private static final String[] SHELL_COMMANDS = {"exit", "quit"};
  private static final String[] SLOTS = {"{}", "[]", "()"};

  @Override
  public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
    List<String> words = line.words();
    int wordIndex = line.wordIndex();
    String partial = line.word() == null ? "" : line.word();

    if (wordIndex == 0) {
      String prefix = partial.toLowerCase(Locale.ROOT);
      addMatching(CommandDispatcher.COMMANDS, prefix, candidates);
      addMatching(SHELL_COMMANDS, prefix, candidates);
      return;
    }

    String cmd = words.get(0).toLowerCase(Locale.ROOT);
    if (("fn".equals(cmd) || "wrap".equals(cmd)) && wordIndex >= 2) {
      addMatching(SLOTS, partial, candidates);
    }
  }

  private static void addMatching(String[] options, String prefix, List<Candidate> candidates) {
    for (String option : options) {
      if (option.startsWith(prefix)) {
        candidates.add(new Candidate(option));
      }
    }
  }
}
