package roptim.lexer;

import java.util.List;
import roptim.RoptimError;
import roptim.util.SourcePosition;
import roptim.util.SourceRange;

class LexerError extends RoptimError {

  private final SourceRange range;

  LexerError(SourcePosition position, String message) {
    super("Lexer error at " + position + ": " + message);
    this.range = new SourceRange(position, 1);
  }

  @Override
  public String getSourceReferencingMessage(List<String> sourceFile) {
    return getMessage()
        + System.lineSeparator()
        + System.lineSeparator()
        + range.annotateSourceFileExcerpt(sourceFile);
  }
}
