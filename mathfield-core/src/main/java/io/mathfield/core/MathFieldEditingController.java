package io.mathfield.core;

import io.mathfield.core.tex.CursorColor;
import io.mathfield.core.tex.NavigationState;
import io.mathfield.core.tex.TeX;
import io.mathfield.core.tex.TeXArg;
import io.mathfield.core.tex.TeXFunction;
import io.mathfield.core.tex.TeXLeaf;
import io.mathfield.core.tex.TeXNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives edits of a math field document in response to input events.
 *
 * <p>Holds the document root and the tree the cursor currently sits in. Each tree operation acts
 * on that current tree only; when it reports {@link NavigationState#ENTERED_FUNCTION} the
 * controller descends into an argument of the adjacent function, and when it reports {@link
 * NavigationState#END} inside an argument the controller moves to the neighbouring argument or
 * climbs out of the function.
 *
 * <p>Not thread-safe; input events must be dispatched one at a time.
 */
public final class MathFieldEditingController {
  private static final Logger LOG = LoggerFactory.getLogger(MathFieldEditingController.class);

  private final MathFieldConfig config;
  private final List<EditListener> listeners = new ArrayList<>();
  private TeXNode root;
  private TeXNode currentNode;
  private boolean secondPage;

  public MathFieldEditingController() {
    this(MathFieldConfig.defaults());
  }

  public MathFieldEditingController(MathFieldConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.root = new TeXNode();
    this.root.setCursor();
    this.currentNode = root;
  }

  public MathFieldConfig config() {
    return config;
  }

  public TeXNode root() {
    return root;
  }

  /** Returns the tree holding the cursor. */
  public TeXNode currentNode() {
    return currentNode;
  }

  public void addListener(EditListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(EditListener listener) {
    listeners.remove(listener);
  }

  /** Inserts an atomic token at the cursor. */
  public void addLeaf(String tex) {
    currentNode.addTeX(new TeXLeaf(tex));
    notifyListeners();
  }

  /**
   * Inserts a function template at the cursor and moves the cursor into its first argument.
   *
   * @param tex command name, e.g. {@code \frac}
   * @param args delimiters of the argument slots
   */
  public void addFunction(String tex, List<TeXArg> args) {
    TeXFunction function = new TeXFunction(tex, currentNode, args);
    currentNode.addTeX(function);
    currentNode.removeCursor();
    enter(function.argNodes().get(0), 0);
    notifyListeners();
  }

  /** Moves the cursor one step to the left. */
  public void goBack() {
    goBack(false);
  }

  /**
   * Moves the cursor one step to the left, or deletes the fragment left of it.
   *
   * @param deleteMode whether to delete (backspace) instead of moving
   */
  public void goBack(boolean deleteMode) {
    NavigationState state = deleteMode ? currentNode.remove() : currentNode.shiftCursorLeft();
    switch (state) {
      case SUCCESS -> notifyListeners();
      case ENTERED_FUNCTION -> {
        TeXFunction function = (TeXFunction) currentNode.get(currentNode.position());
        TeXNode last = function.argNodes().get(function.argNodes().size() - 1);
        enter(last, last.size());
        notifyListeners();
      }
      case END -> {
        if (leaveBackwards(deleteMode)) {
          notifyListeners();
        }
      }
    }
  }

  /** Moves the cursor one step to the right. */
  public void goNext() {
    switch (currentNode.shiftCursorRight()) {
      case SUCCESS -> notifyListeners();
      case ENTERED_FUNCTION -> {
        TeXFunction function = (TeXFunction) currentNode.get(currentNode.position() - 1);
        enter(function.argNodes().get(0), 0);
        notifyListeners();
      }
      case END -> {
        if (leaveForwards()) {
          notifyListeners();
        }
      }
    }
  }

  /** Discards the document and starts over with an empty root. */
  public void clear() {
    root = new TeXNode();
    root.setCursor();
    currentNode = root;
    LOG.debug("Document cleared");
    notifyListeners();
  }

  /**
   * Replaces the document with a single function whose first argument holds the previous content.
   * The cursor ends up right after the new function.
   *
   * @param tex command name
   * @param args delimiters of the argument slots
   */
  public void wrapAll(String tex, List<TeXArg> args) {
    Objects.requireNonNull(tex, "tex");
    // rejects null slots before the document is touched
    List<TeXArg> slots = List.copyOf(Objects.requireNonNull(args, "args"));
    if (slots.isEmpty()) {
      throw new IllegalArgumentException("A function needs at least one argument: " + tex);
    }
    currentNode.removeCursor();
    List<TeXNode> argNodes = new ArrayList<>(slots.size());
    argNodes.add(root);
    for (int i = 1; i < slots.size(); i++) {
      argNodes.add(new TeXNode());
    }
    TeXNode newRoot = new TeXNode();
    newRoot.addTeX(new TeXFunction(tex, newRoot, slots, argNodes));
    newRoot.setCursor();
    root = newRoot;
    currentNode = newRoot;
    LOG.debug("Document wrapped into {}", tex);
    notifyListeners();
  }

  /**
   * Adopts a tree built elsewhere, e.g. by parsing markup, as the new document. Unless the tree
   * already has its cursor set, the cursor goes to its end.
   *
   * @throws IllegalArgumentException if {@code tree} is an argument of a function
   */
  public void replaceRoot(TeXNode tree) {
    Objects.requireNonNull(tree, "tree");
    if (tree.parent() != null) {
      throw new IllegalArgumentException("Only a root tree can become the document");
    }
    if (!tree.isCursorSet()) {
      tree.setPosition(tree.size());
      tree.setCursor();
    }
    root = tree;
    currentNode = tree;
    LOG.debug("Document replaced ({} top-level fragments)", tree.size());
    notifyListeners();
  }

  /** Switches the keyboard between its first and second page. */
  public void togglePage() {
    secondPage = !secondPage;
    notifyListeners();
  }

  public boolean isSecondPage() {
    return secondPage;
  }

  /** Returns whether the document holds no fragments. */
  public boolean isEmpty() {
    return root.isEmpty();
  }

  /**
   * Returns the document markup without the cursor.
   *
   * @param placeholderWhenEmpty whether an empty document yields the placeholder
   */
  public String currentEditingValue(boolean placeholderWhenEmpty) {
    currentNode.removeCursor();
    try {
      return root.buildTeXString(null, placeholderWhenEmpty, config.syntax());
    } finally {
      currentNode.setCursor();
    }
  }

  /** Returns the document markup with the cursor in the configured color. */
  public String render() {
    return render(config.cursorColor());
  }

  /** Returns the document markup with the cursor in {@code cursorColor}. */
  public String render(CursorColor cursorColor) {
    Objects.requireNonNull(cursorColor, "cursorColor");
    return root.buildTeXString(cursorColor, config.placeholderWhenEmpty(), config.syntax());
  }

  private boolean leaveBackwards(boolean deleteMode) {
    TeXFunction function = currentNode.parent();
    if (function == null) {
      LOG.debug("Cursor already at the start of the document");
      return false;
    }
    currentNode.removeCursor();
    int index = function.indexOf(currentNode);
    if (index > 0) {
      TeXNode previous = function.argNodes().get(index - 1);
      enter(previous, previous.size());
      return true;
    }
    TeXNode container = container(function);
    int at = container.indexOf(function);
    if (deleteMode && function.isEmpty()) {
      container.removeFragment(at);
      LOG.debug("Removed empty {}", function.expression());
    }
    container.setPosition(at);
    container.setCursor();
    currentNode = container;
    LOG.debug("Left {} backwards", function.expression());
    return true;
  }

  private boolean leaveForwards() {
    TeXFunction function = currentNode.parent();
    if (function == null) {
      LOG.debug("Cursor already at the end of the document");
      return false;
    }
    currentNode.removeCursor();
    int index = function.indexOf(currentNode);
    if (index < function.argNodes().size() - 1) {
      enter(function.argNodes().get(index + 1), 0);
      return true;
    }
    TeXNode container = container(function);
    container.setPosition(container.indexOf(function) + 1);
    container.setCursor();
    currentNode = container;
    LOG.debug("Left {} forwards", function.expression());
    return true;
  }

  private static TeXNode container(TeXFunction function) {
    TeXNode container = function.parent();
    if (container == null || container.indexOf(function) < 0) {
      throw new IllegalStateException(function.expression() + " is not attached to a tree");
    }
    return container;
  }

  private void enter(TeXNode node, int position) {
    node.setPosition(position);
    node.setCursor();
    currentNode = node;
    if (LOG.isDebugEnabled()) {
      TeX owner = node.parent();
      LOG.debug("Cursor entered {} at {}", owner == null ? "root" : owner.expression(), position);
    }
  }

  private void notifyListeners() {
    for (EditListener listener : List.copyOf(listeners)) {
      listener.onEdit(this);
    }
  }
}
