package roptim.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import java.util.List;

/**
 * A half-open interval in the concrete syntax, denoting the extent of some syntax element. In
 * particular, {@code end} is one beyond the last character of the syntax element.
 */
public class SourceRange {
  public static final SourceRange FIRST_CHAR = new SourceRange(SourcePosition.BEGIN_OF_PROGRAM, 1);
  public final SourcePosition begin;
  public final SourcePosition end; // exclusive!

  public SourceRange(SourcePosition begin, SourcePosition end) {
    this.begin = checkNotNull(begin);
    this.end = checkNotNull(end);
    checkArgument(begin.line <= end.line, "SourceRange ends before it begins");
    checkArgument(
        begin.line != end.line || begin.column <= end.column, "SourceRange ends before it begins");
  }

  public SourceRange(SourcePosition begin, int length) {
    this(begin, begin.moveHorizontal(length));
  }

  public String annotateSourceFileExcerpt(List<String> sourceFile) {
    StringBuilder sb = new StringBuilder();
    if (sourceFile.isEmpty()) {
      return "";
    }
    if (begin.line < end.line) {
      // we can only squiggle at the side
      int digits = (int) Math.floor(Math.log10(end.line)) + 1;
      // lines are 1-based
      int first = Math.max(begin.line, 1);
      int last = Math.min(end.line, sourceFile.size());
      for (int i = first; i <= last; ++i) {
        sb.append(String.format("%" + digits + "d|> %s", i, sourceFile.get(i - 1)));
        sb.append(System.lineSeparator());
      }
      return sb.toString();
    }
    int line0 = begin.line - 1;
    if (line0 >= sourceFile.size()) {
      // squiggle the EOF
      line0 = sourceFile.size() - 1;
      String prefix = String.format("%d| ", line0 + 1);
      String lastLine = sourceFile.get(line0);
      sb.append(prefix).append(lastLine).append(System.lineSeparator());
      sb.append(Strings.repeat(" ", prefix.length() + lastLine.length()));
      sb.append("^").append(System.lineSeparator());
    } else {
      String prefix = String.format("%d| ", line0 + 1);
      int squiggleLength = Math.max(1, end.column - begin.column);
      sb.append(prefix).append(sourceFile.get(line0)).append(System.lineSeparator());
      sb.append(Strings.repeat(" ", prefix.length() + begin.column));
      sb.append(Strings.repeat("^", squiggleLength));
      sb.append(System.lineSeparator());
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return String.format("%s-%s", begin, end);
  }
}
