package roptim.token;

import static roptim.token.Terminal.Associativity.LEFT;
import static roptim.token.Terminal.Associativity.RIGHT;

import java.util.Optional;

/** Enum of terminals used by the Lexer. */
public enum Terminal {

  // keywords
  BREAK("break"),
  ELSE("else"),
  FALSE("FALSE"),
  FOR("for"),
  FUNCTION("function"),
  IF("if"),
  IN("in"),
  NEXT("next"),
  NULL("NULL"),
  REPEAT("repeat"),
  TRUE("TRUE"),
  WHILE("while"),

  // binary operators
  LEFT_ASSIGN("<-", RIGHT, 1),
  SUPER_ASSIGN("<<-", RIGHT, 1),
  EQUAL_SIGN("=", RIGHT, 1),
  OR("||", LEFT, 2),
  VECTOR_OR("|", LEFT, 2),
  AND("&&", LEFT, 3),
  VECTOR_AND("&", LEFT, 3),
  EQUALS("==", LEFT, 5),
  UNEQUALS("!=", LEFT, 5),
  LOWER("<", LEFT, 5),
  LOWER_EQUALS("<=", LEFT, 5),
  GREATER(">", LEFT, 5),
  GREATER_EQUALS(">=", LEFT, 5),
  PLUS("+", LEFT, 6),
  MINUS("-", LEFT, 6),
  MULTIPLY("*", LEFT, 7),
  DIVIDE("/", LEFT, 7),
  MODULO("%%", LEFT, 7),
  POWER("^", RIGHT, 9),

  // unary only
  INVERT("!"),

  // separators
  LPAREN("("),
  RPAREN(")"),
  LCURLY("{"),
  RCURLY("}"),
  COMMA(","),
  SEMICOLON(";"),
  NEWLINE("\\n"),

  // with dynamic string values (lexval in Token is not null for tokens of this types)
  IDENT,
  NUMBER_LITERAL,
  STRING_LITERAL,

  EOF;

  public enum Associativity {
    LEFT,
    RIGHT
  }

  public final Optional<String> string;
  final Optional<Associativity> associativity;
  final Optional<Integer> precedence;

  Terminal(String string, Associativity associativity, Integer precedence) {
    this.string = Optional.ofNullable(string);
    this.associativity = Optional.ofNullable(associativity);
    this.precedence = Optional.ofNullable(precedence);
    assert this.associativity.isPresent() == this.precedence.isPresent();
  }

  Terminal(String string) {
    this(string, null, null);
  }

  Terminal() {
    this(null, null, null);
  }

  public boolean hasLexval() {
    return !string.isPresent();
  }
}
