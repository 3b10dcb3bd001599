package io.mathfield.core.tex;

/** Outcome of moving the cursor or deleting within one {@link TeXNode}. */
public enum NavigationState {
  /** The move or deletion completed; the cursor is set at its new position. */
  SUCCESS,

  /** Already at the boundary of the sibling list in that direction; nothing changed. */
  END,

  /**
   * The fragment crossed is a {@link TeXFunction}. The cursor has been taken out of this tree and
   * the caller has to place it inside one of the function's argument trees.
   */
  ENTERED_FUNCTION
}
