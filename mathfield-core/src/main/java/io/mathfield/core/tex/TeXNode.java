package io.mathfield.core.tex;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Ordered list of sibling fragments plus the cursor position within it.
 *
 * <p>The document root has no parent; every other tree is an argument of a {@link TeXFunction}.
 * The cursor is the integer {@link #position()} together with a "set" flag. At most one tree of a
 * document has its cursor set at a time; the editing controller moves it between trees whenever an
 * operation returns {@link NavigationState#ENTERED_FUNCTION} or {@link NavigationState#END}.
 *
 * <p>Instances are not thread-safe. Edits are expected one at a time from a single controller.
 */
public final class TeXNode {

  /** Opening marker of a case-system block. */
  public static final String CASES_BEGIN = "\\begin{cases}";

  /** Closing marker of a case-system block. */
  public static final String CASES_END = "\\end{cases}";

  private static final Pattern TRAILING_COMMAND = Pattern.compile("\\\\[a-zA-Z]+$");

  private final List<TeX> children = new ArrayList<>();
  private TeXFunction parent;
  private int position;
  private boolean cursorSet;

  /** Creates an empty root tree. */
  public TeXNode() {
    this(null);
  }

  TeXNode(TeXFunction parent) {
    this.parent = parent;
  }

  /** Returns the function owning this tree as an argument, or {@code null} for a root. */
  public TeXFunction parent() {
    return parent;
  }

  void adoptedBy(TeXFunction function) {
    this.parent = function;
  }

  /** Returns the cursor position, between 0 and {@link #size()} inclusive. */
  public int position() {
    return position;
  }

  /**
   * Moves the insertion point while the cursor is not set.
   *
   * @throws IllegalStateException if the cursor is set
   * @throws IndexOutOfBoundsException if {@code position} is outside {@code [0, size()]}
   */
  public void setPosition(int position) {
    if (cursorSet) {
      throw new IllegalStateException("Cannot reposition while the cursor is set");
    }
    Objects.checkIndex(position, children.size() + 1);
    this.position = position;
  }

  public boolean isCursorSet() {
    return cursorSet;
  }

  /** Returns the number of fragments, not counting the cursor. */
  public int size() {
    return children.size();
  }

  public boolean isEmpty() {
    return children.isEmpty();
  }

  /** Returns the fragment at {@code index}, not counting the cursor. */
  public TeX get(int index) {
    return children.get(index);
  }

  /** Returns the fragments without the cursor, as a read-only view. */
  public List<TeX> fragments() {
    return Collections.unmodifiableList(children);
  }

  /**
   * Returns a snapshot of the sibling list as seen by a reader of the document: the fragments with
   * a {@link CursorMarker} at {@link #position()} while the cursor is set.
   */
  public List<TeX> children() {
    List<TeX> view = new ArrayList<>(children.size() + 1);
    view.addAll(children);
    if (cursorSet) {
      view.add(position, CursorMarker.INSTANCE);
    }
    return Collections.unmodifiableList(view);
  }

  /**
   * Returns the index of {@code tex} among the fragments, compared by identity.
   *
   * @return the index, or -1 if absent
   */
  public int indexOf(TeX tex) {
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == tex) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Places the cursor at the current position.
   *
   * @throws IllegalStateException if the cursor is already set
   */
  public void setCursor() {
    if (cursorSet) {
      throw new IllegalStateException("Cursor is already set");
    }
    cursorSet = true;
  }

  /**
   * Takes the cursor out of this tree, keeping the position.
   *
   * @throws IllegalStateException if the cursor is not set
   */
  public void removeCursor() {
    requireCursor();
    cursorSet = false;
  }

  /**
   * Returns whether the cursor is the last element of this sibling list.
   *
   * <p>Nested arguments are not considered: a cursor after a wide fraction is not necessarily at
   * the right edge of what is displayed.
   */
  public boolean cursorAtTheEnd() {
    return cursorSet && position == children.size();
  }

  /** Moves the cursor one fragment to the left. */
  public NavigationState shiftCursorLeft() {
    if (position == 0) {
      return NavigationState.END;
    }
    requireCursor();
    cursorSet = false;
    position--;
    return settleUnlessFunction(children.get(position));
  }

  /** Moves the cursor one fragment to the right. */
  public NavigationState shiftCursorRight() {
    if (position == children.size()) {
      return NavigationState.END;
    }
    requireCursor();
    cursorSet = false;
    position++;
    return settleUnlessFunction(children.get(position - 1));
  }

  /**
   * Inserts {@code tex} at the cursor position and advances the position past it.
   *
   * @throws IllegalArgumentException if {@code tex} is a cursor marker, use {@link #setCursor()}
   */
  public void addTeX(TeX tex) {
    Objects.requireNonNull(tex, "tex");
    switch (tex.kind()) {
      case CURSOR -> throw new IllegalArgumentException("Use setCursor() to place the cursor");
      case FUNCTION -> ((TeXFunction) tex).insertedInto(this);
      case LEAF -> {}
    }
    children.add(position, tex);
    position++;
  }

  /**
   * Deletes the fragment left of the cursor.
   *
   * <p>A function is never deleted from here: the call returns {@link
   * NavigationState#ENTERED_FUNCTION} and deletion continues inside its last argument. A leaf
   * carrying a case-system marker takes its whole block with it.
   */
  public NavigationState remove() {
    if (position == 0) {
      return NavigationState.END;
    }
    requireCursor();
    cursorSet = false;
    position--;
    TeX target = children.get(position);
    switch (target.kind()) {
      case FUNCTION -> {
        return NavigationState.ENTERED_FUNCTION;
      }
      case LEAF -> {
        if (hasCaseMarker((TeXLeaf) target)) {
          removeCaseSystem(position);
        } else {
          // leaves go whole, so a command like \sin( never leaves a dangling prefix
          children.remove(position);
        }
      }
      case CURSOR -> throw new IllegalStateException("Cursor stored as a fragment");
    }
    cursorSet = true;
    return NavigationState.SUCCESS;
  }

  /**
   * Deletes the fragment at {@code index} while the cursor is elsewhere, shifting the position when
   * the fragment lies before it.
   *
   * @throws IllegalStateException if the cursor is set
   */
  public TeX removeFragment(int index) {
    if (cursorSet) {
      throw new IllegalStateException("Cannot remove fragments directly while the cursor is set");
    }
    TeX removed = children.remove(index);
    if (index < position) {
      position--;
    }
    return removed;
  }

  /** Serializes without a cursor, rendering the placeholder when empty. */
  public String buildTeXString() {
    return buildTeXString(null, true);
  }

  public String buildTeXString(CursorColor cursorColor, boolean placeholderWhenEmpty) {
    return buildTeXString(cursorColor, placeholderWhenEmpty, TeXSyntax.DEFAULT);
  }

  /**
   * Serializes this tree and everything nested in it.
   *
   * <p>A space is emitted between two fragments when the left one ends in a letter command and the
   * right one starts with a letter or digit, so {@code \cdot} followed by {@code x} does not turn
   * into the command {@code \cdotx}.
   *
   * @param cursorColor color of the cursor, required when the cursor is set in this tree or below
   * @param placeholderWhenEmpty whether an empty tree yields the placeholder or the empty string;
   *     nested argument trees always use the placeholder
   * @param syntax placeholder and cursor glyph tokens
   * @return the markup text
   * @throws IllegalStateException if a set cursor is reached and {@code cursorColor} is null
   */
  public String buildTeXString(
      CursorColor cursorColor, boolean placeholderWhenEmpty, TeXSyntax syntax) {
    List<TeX> view = children();
    if (view.isEmpty()) {
      return placeholderWhenEmpty ? syntax.placeholder() : "";
    }
    StringBuilder sb = new StringBuilder();
    String previous = null;
    for (TeX tex : view) {
      String current = tex.buildString(cursorColor, syntax);
      if (previous != null && needsSpaceBetween(previous, current)) {
        sb.append(' ');
      }
      sb.append(current);
      previous = current;
    }
    return sb.toString();
  }

  static boolean needsSpaceBetween(String current, String next) {
    if (next.isEmpty() || !isAsciiAlphanumeric(next.charAt(0))) {
      return false;
    }
    return TRAILING_COMMAND.matcher(current).find();
  }

  private static boolean isAsciiAlphanumeric(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }

  private NavigationState settleUnlessFunction(TeX crossed) {
    return switch (crossed.kind()) {
      case FUNCTION -> NavigationState.ENTERED_FUNCTION;
      case LEAF -> {
        cursorSet = true;
        yield NavigationState.SUCCESS;
      }
      case CURSOR -> throw new IllegalStateException("Cursor stored as a fragment");
    };
  }

  private void requireCursor() {
    if (!cursorSet) {
      throw new IllegalStateException("Cursor is not set");
    }
  }

  private static boolean hasCaseMarker(TeXLeaf leaf) {
    String text = leaf.expression();
    return text.contains(CASES_BEGIN) || text.contains(CASES_END);
  }

  private void removeCaseSystem(int index) {
    Span span = caseSystemSpan(index);
    children.subList(span.start(), span.end() + 1).clear();
    position = span.start();
  }

  /**
   * Finds the outermost balanced case-system block containing {@code index} by pairing opening and
   * closing markers in reading order. Unmatched markers elsewhere in the list do not hide a
   * balanced block; an unmatched marker at {@code index} yields just {@code index}.
   */
  Span caseSystemSpan(int index) {
    Deque<Integer> open = new ArrayDeque<>();
    Span widest = null;
    for (int i = 0; i < children.size(); i++) {
      if (!(children.get(i) instanceof TeXLeaf leaf)) {
        continue;
      }
      String text = leaf.expression();
      int from = 0;
      while (true) {
        int begin = text.indexOf(CASES_BEGIN, from);
        int end = text.indexOf(CASES_END, from);
        if (begin < 0 && end < 0) {
          break;
        }
        if (begin >= 0 && (end < 0 || begin < end)) {
          open.push(i);
          from = begin + CASES_BEGIN.length();
        } else {
          if (!open.isEmpty()) {
            int start = open.pop();
            // matched pairs are nested, so the latest one around index is the outermost so far
            if (start <= index && index <= i) {
              widest = new Span(start, i);
            }
          }
          from = end + CASES_END.length();
        }
      }
    }
    return widest != null ? widest : new Span(index, index);
  }

  /** Inclusive range of sibling indices. */
  record Span(int start, int end) {}

  @Override
  public String toString() {
    return "TeXNode{children=" + children() + ", position=" + position + "}";
  }
}
