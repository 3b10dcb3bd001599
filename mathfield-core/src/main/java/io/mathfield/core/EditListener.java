package io.mathfield.core;

/** Receives a callback after each edit that changed the document or the cursor. */
@FunctionalInterface
public interface EditListener {
  void onEdit(MathFieldEditingController controller);
}
