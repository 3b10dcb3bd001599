package io.mathfield.core.tex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Markup command with one nested {@link TeXNode} per argument slot, e.g. {@code \frac{a}{b}}.
 *
 * <p>The function owns its argument trees; each of them points back at the function through
 * {@link TeXNode#parent()}. The function in turn knows the tree it was inserted into, which is how
 * the editing controller climbs out of an argument.
 */
public final class TeXFunction implements TeX {

  private final String expression;
  private final List<TeXArg> args;
  private final List<TeXNode> argNodes;
  private TeXNode parent;

  /** Creates a detached function with one empty argument tree per slot. */
  public TeXFunction(String expression, List<TeXArg> args) {
    this(expression, null, args, null);
  }

  /** Creates a function inside {@code parent} with one empty argument tree per slot. */
  public TeXFunction(String expression, TeXNode parent, List<TeXArg> args) {
    this(expression, parent, args, null);
  }

  /**
   * Creates a function, adopting already built argument trees when given.
   *
   * @param expression command name, e.g. {@code \frac}
   * @param parent tree containing this function, may be {@code null} until it is inserted
   * @param args delimiters of the argument slots, at least one
   * @param argNodes argument trees, one per slot and not owned by another function, or {@code null}
   *     to create empty ones
   * @throws IllegalArgumentException if there are no slots, the tree count does not match the slot
   *     count, or a tree is already owned elsewhere
   */
  public TeXFunction(String expression, TeXNode parent, List<TeXArg> args, List<TeXNode> argNodes) {
    this.expression = Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(args, "args");
    if (args.isEmpty()) {
      throw new IllegalArgumentException("A function needs at least one argument: " + expression);
    }
    if (argNodes != null && argNodes.size() != args.size()) {
      throw new IllegalArgumentException(
          "Expected "
              + args.size()
              + " argument trees for "
              + expression
              + " but got "
              + argNodes.size());
    }
    this.args = List.copyOf(args);
    this.parent = parent;

    List<TeXNode> nodes = new ArrayList<>(args.size());
    if (argNodes == null) {
      for (int i = 0; i < args.size(); i++) {
        nodes.add(new TeXNode(this));
      }
    } else {
      Map<TeXNode, Boolean> seen = new IdentityHashMap<>();
      for (TeXNode node : argNodes) {
        Objects.requireNonNull(node, "argument tree");
        if (node.parent() != null || seen.put(node, Boolean.TRUE) != null) {
          throw new IllegalArgumentException(
              "Argument tree of " + expression + " is already owned by another function");
        }
      }
      for (TeXNode node : argNodes) {
        node.adoptedBy(this);
        nodes.add(node);
      }
    }
    this.argNodes = Collections.unmodifiableList(nodes);
  }

  @Override
  public Kind kind() {
    return Kind.FUNCTION;
  }

  @Override
  public String expression() {
    return expression;
  }

  public List<TeXArg> args() {
    return args;
  }

  public List<TeXNode> argNodes() {
    return argNodes;
  }

  /** Returns the tree this function sits in, or {@code null} while detached. */
  public TeXNode parent() {
    return parent;
  }

  void insertedInto(TeXNode node) {
    this.parent = node;
  }

  /**
   * Returns the slot index of {@code node}, compared by identity.
   *
   * @return the index, or -1 if {@code node} is not an argument of this function
   */
  public int indexOf(TeXNode node) {
    for (int i = 0; i < argNodes.size(); i++) {
      if (argNodes.get(i) == node) {
        return i;
      }
    }
    return -1;
  }

  /** Returns whether every argument tree is empty. */
  public boolean isEmpty() {
    for (TeXNode node : argNodes) {
      if (!node.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String buildString(CursorColor cursorColor, TeXSyntax syntax) {
    StringBuilder sb = new StringBuilder(expression);
    for (int i = 0; i < args.size(); i++) {
      TeXArg arg = args.get(i);
      sb.append(arg.opening());
      sb.append(argNodes.get(i).buildTeXString(cursorColor, true, syntax));
      sb.append(arg.closing());
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "TeXFunction[" + expression + ", args=" + args + "]";
  }
}
