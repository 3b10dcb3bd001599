package io.mathfield.core.tex;

import java.util.List;

/**
 * Edit operations applied directly to a single {@link TeXNode} in property tests.
 *
 * <p>When a move or deletion reports {@link NavigationState#ENTERED_FUNCTION}, the caller is
 * expected to settle the tree again with {@link TeXNode#setCursor()}, standing in for the
 * controller that would otherwise descend into the function.
 */
sealed interface NodeAction {

  NavigationState apply(TeXNode node);

  /** Inserts a leaf. */
  record AddLeaf(String text) implements NodeAction {
    @Override
    public NavigationState apply(TeXNode node) {
      node.addTeX(new TeXLeaf(text));
      return NavigationState.SUCCESS;
    }

    @Override
    public String toString() {
      return "add(" + text + ")";
    }
  }

  /** Inserts an empty function template. */
  record AddFunction(String name, List<TeXArg> args) implements NodeAction {
    @Override
    public NavigationState apply(TeXNode node) {
      node.addTeX(new TeXFunction(name, args));
      return NavigationState.SUCCESS;
    }

    @Override
    public String toString() {
      return "add(" + name + args + ")";
    }
  }

  /** Moves the cursor left. */
  record ShiftLeft() implements NodeAction {
    @Override
    public NavigationState apply(TeXNode node) {
      return node.shiftCursorLeft();
    }

    @Override
    public String toString() {
      return "left";
    }
  }

  /** Moves the cursor right. */
  record ShiftRight() implements NodeAction {
    @Override
    public NavigationState apply(TeXNode node) {
      return node.shiftCursorRight();
    }

    @Override
    public String toString() {
      return "right";
    }
  }

  /** Deletes left of the cursor. */
  record Remove() implements NodeAction {
    @Override
    public NavigationState apply(TeXNode node) {
      return node.remove();
    }

    @Override
    public String toString() {
      return "remove";
    }
  }
}
