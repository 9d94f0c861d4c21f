package roptim.util;

import org.jetbrains.annotations.NotNull;

/** Position in a source file. Instances of this class are immutable. */
public class SourcePosition implements Comparable<SourcePosition> {

  public static final SourcePosition BEGIN_OF_PROGRAM = new SourcePosition(0, 1, 0);
  public final int offset;
  public final int line;
  public final int column;

  /**
   * @param offset number of characters read before this position
   * @param line 1-based line number
   * @param column 0-based column within {@code line}
   */
  public SourcePosition(int offset, int line, int column) {
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  public SourcePosition moveHorizontal(int length) {
    return new SourcePosition(offset + length, line, column + length);
  }

  @Override
  public String toString() {
    return "[" + line + ":" + column + "]";
  }

  @Override
  public int compareTo(@NotNull SourcePosition other) {
    return Integer.compare(offset, other.offset);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    SourcePosition that = (SourcePosition) o;

    return offset == that.offset && line == that.line && column == that.column;
  }

  @Override
  public int hashCode() {
    int result = offset;
    result = 31 * result + line;
    result = 31 * result + column;
    return result;
  }
}
