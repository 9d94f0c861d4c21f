package roptim.parser;

import java.util.Arrays;
import java.util.List;
import roptim.RoptimError;
import roptim.token.Terminal;
import roptim.token.Token;
import roptim.util.SourceRange;

class ParserError extends RoptimError {

  public final SourceRange range;

  ParserError(SourceRange range, String message) {
    super(String.format("Parser error at %s: %s", range, message));
    this.range = range;
  }

  ParserError(String rule, Terminal expectedTerminal, Token actualToken) {
    super(
        String.format(
            "Parser error at %s parsed via %s: expected %s but got %s",
            actualToken.range(), rule, expectedTerminal, actualToken));
    this.range = actualToken.range();
  }

  ParserError(String rule, Token unexpectedToken, Terminal[] expectedTerminals) {
    super(
        String.format(
            "Parser error at %s parsed via %s: unexpected %s, expected one of %s",
            unexpectedToken.range(),
            rule,
            unexpectedToken,
            Arrays.toString(expectedTerminals)));
    this.range = unexpectedToken.range();
  }

  @Override
  public String getSourceReferencingMessage(List<String> sourceFile) {
    return getMessage()
        + System.lineSeparator()
        + System.lineSeparator()
        + range.annotateSourceFileExcerpt(sourceFile);
  }
}
