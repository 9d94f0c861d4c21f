package roptim.token;

import java.util.Arrays;
import org.jetbrains.annotations.Nullable;
import roptim.util.SourceCodeReferable;
import roptim.util.SourceRange;

/** Instances of this class are immutable. */
public class Token implements SourceCodeReferable {

  public final Terminal terminal;
  public final String lexval;
  private final SourceRange range;

  public Token(Terminal terminal, SourceRange range, @Nullable String lexval) {
    this.terminal = terminal;
    this.range = range;
    this.lexval = lexval == null ? null : lexval.intern();
  }

  @Override
  public SourceRange range() {
    return range;
  }

  @Override
  public String toString() {
    switch (terminal) {
      case IDENT:
        return "identifier " + lexval;
      case NUMBER_LITERAL:
        return "number literal " + lexval;
      case STRING_LITERAL:
        return "string literal " + lexval;
      case EOF:
        return "EOF";
      default:
        return terminal.string.get();
    }
  }

  public boolean isOneOf(Terminal... terminals) {
    return Arrays.stream(terminals).anyMatch(t -> terminal == t);
  }

  public boolean isOperator() {
    return terminal.precedence.isPresent();
  }

  public int precedence() {
    if (!terminal.precedence.isPresent()) {
      throw new UnsupportedOperationException(terminal + " has no precedence");
    }
    return terminal.precedence.get();
  }

  public Terminal.Associativity associativity() {
    if (!terminal.associativity.isPresent()) {
      throw new UnsupportedOperationException(terminal + " has no associativity");
    }
    return terminal.associativity.get();
  }
}
