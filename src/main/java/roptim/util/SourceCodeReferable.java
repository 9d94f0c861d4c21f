package roptim.util;

/** Objects of this type refer to the original source code. */
public interface SourceCodeReferable {

  /** Returns the {@link SourceRange} this object refers to in the original source code. */
  SourceRange range();
}
