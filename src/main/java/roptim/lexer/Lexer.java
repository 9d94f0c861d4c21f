package roptim.lexer;

import static roptim.token.Terminal.*;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.io.CharStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Iterator;
import roptim.RoptimError;
import roptim.token.Terminal;
import roptim.token.Token;
import roptim.util.SourcePosition;
import roptim.util.SourceRange;

/** SLL(1) style lexer for the R subset understood by the optimizer. */
public class Lexer implements Iterator<Token> {

  static final ImmutableMap<String, Terminal> KEYWORDS =
      Maps.uniqueIndex(
          EnumSet.of(BREAK, ELSE, FALSE, FOR, FUNCTION, IF, IN, NEXT, NULL, REPEAT, TRUE, WHILE),
          t -> t.string.get());

  private static final int EOF_CHAR = -1;

  private final String input;
  private int index = -1;
  private int ch;
  private int line = 1;
  private int column = -1; // after calling nextChar the first time, this will be 0
  private SourcePosition tokenBegin;
  private Token eof;

  public Lexer(String input) {
    this.input = input;
    nextChar();
  }

  /** Decodes {@code input} as UTF-8. */
  public Lexer(InputStream input) {
    this(readFully(input));
  }

  private static String readFully(InputStream input) {
    try {
      return CharStreams.toString(new InputStreamReader(input, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new RoptimError(e);
    }
  }

  private void nextChar() {
    if (index >= 0 && ch == '\n') {
      line++;
      column = 0;
    } else {
      column++;
    }
    index++;
    ch = index < input.length() ? input.charAt(index) : EOF_CHAR;
  }

  private int peekChar() {
    return index + 1 < input.length() ? input.charAt(index + 1) : EOF_CHAR;
  }

  private SourcePosition currentPosition() {
    return new SourcePosition(index, line, column);
  }

  private Token scan() {
    skipWhitespaceAndComments();
    tokenBegin = currentPosition();
    if (isDigit(ch) || (ch == '.' && isDigit(peekChar()))) {
      return scanNumber();
    }
    if (isIdentifierStart(ch)) {
      return scanKeywordOrIdentifier();
    }
    switch (ch) {
      case EOF_CHAR:
        return (eof = createToken(EOF, ""));
      case '\n':
        nextChar();
        return createToken(NEWLINE, "\n");
      case '"':
      case '\'':
        return scanString();
      case '(':
        nextChar();
        return createToken(LPAREN);
      case ')':
        nextChar();
        return createToken(RPAREN);
      case '{':
        nextChar();
        return createToken(LCURLY);
      case '}':
        nextChar();
        return createToken(RCURLY);
      case ',':
        nextChar();
        return createToken(COMMA);
      case ';':
        nextChar();
        return createToken(SEMICOLON);
      case '+':
        nextChar();
        return createToken(PLUS);
      case '-':
        nextChar();
        return scanMinus();
      case '*':
        nextChar();
        return createToken(MULTIPLY);
      case '/':
        nextChar();
        return createToken(DIVIDE);
      case '^':
        nextChar();
        return createToken(POWER);
      case '%':
        nextChar();
        return scanPercent();
      case '<':
        nextChar();
        return scanLower();
      case '>':
        nextChar();
        return scanGreater();
      case '=':
        nextChar();
        return scanEqual();
      case '!':
        nextChar();
        return scanInvert();
      case '&':
        nextChar();
        return scanAnd();
      case '|':
        nextChar();
        return scanPipe();
      default:
        throw new LexerError(
            tokenBegin, String.format("tokens must not start with character '%c' (%d)", ch, ch));
    }
  }

  private void skipWhitespaceAndComments() {
    while (true) {
      if (ch == ' ' || ch == '\t' || ch == '\r' || ch == '\f') {
        nextChar();
      } else if (ch == '#') {
        while (ch != '\n' && ch != EOF_CHAR) {
          nextChar();
        }
      } else {
        return;
      }
    }
  }

  private static boolean isDigit(int ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isAlpha(int ch) {
    return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
  }

  private static boolean isIdentifierStart(int ch) {
    return isAlpha(ch) || ch == '.';
  }

  private static boolean isIdentifierPart(int ch) {
    return isAlpha(ch) || isDigit(ch) || ch == '.' || ch == '_';
  }

  private Token scanNumber() {
    StringBuilder builder = new StringBuilder();
    appendDigits(builder);
    if (ch == '.') {
      builder.append('.');
      nextChar();
      appendDigits(builder);
    }
    if (ch == 'e' || ch == 'E') {
      builder.append((char) ch);
      nextChar();
      if (ch == '+' || ch == '-') {
        builder.append((char) ch);
        nextChar();
      }
      if (!isDigit(ch)) {
        throw new LexerError(currentPosition(), "exponent of number literal has no digits");
      }
      appendDigits(builder);
    }
    if (ch == 'L') {
      builder.append('L');
      nextChar();
    }
    return createToken(NUMBER_LITERAL, builder.toString());
  }

  private void appendDigits(StringBuilder builder) {
    while (isDigit(ch)) {
      builder.append((char) ch);
      nextChar();
    }
  }

  /** The lexval of a string literal is its source text including the quotes. */
  private Token scanString() {
    int quote = ch;
    StringBuilder builder = new StringBuilder();
    builder.append((char) quote);
    nextChar();
    while (ch != quote) {
      if (ch == EOF_CHAR) {
        throw new LexerError(
            currentPosition(),
            "Reached EOF, but string literal starting at " + tokenBegin + " is not complete");
      }
      if (ch == '\\') {
        builder.append('\\');
        nextChar();
        if (ch == EOF_CHAR) {
          continue;
        }
      }
      builder.append((char) ch);
      nextChar();
    }
    builder.append((char) quote);
    nextChar();
    return createToken(STRING_LITERAL, builder.toString());
  }

  private Token scanMinus() {
    if (ch == '>') {
      throw new LexerError(tokenBegin, "right assignment '->' is not supported");
    }
    return createToken(MINUS);
  }

  private Token scanPercent() {
    if (ch == '%') {
      nextChar();
      return createToken(MODULO);
    }
    throw new LexerError(tokenBegin, "only the %% infix operator is supported");
  }

  private Token scanLower() {
    switch (ch) {
      case '-':
        nextChar();
        return createToken(LEFT_ASSIGN);
      case '<':
        if (peekChar() == '-') {
          nextChar();
          nextChar();
          return createToken(SUPER_ASSIGN);
        }
        throw new LexerError(tokenBegin, "unexpected '<<'");
      case '=':
        nextChar();
        return createToken(LOWER_EQUALS);
      default:
        return createToken(LOWER);
    }
  }

  private Token scanGreater() {
    if (ch == '=') {
      nextChar();
      return createToken(GREATER_EQUALS);
    }
    return createToken(GREATER);
  }

  private Token scanEqual() {
    if (ch == '=') {
      nextChar();
      return createToken(EQUALS);
    }
    return createToken(EQUAL_SIGN);
  }

  private Token scanInvert() {
    if (ch == '=') {
      nextChar();
      return createToken(UNEQUALS);
    }
    return createToken(INVERT);
  }

  private Token scanAnd() {
    if (ch == '&') {
      nextChar();
      return createToken(AND);
    }
    return createToken(VECTOR_AND);
  }

  private Token scanPipe() {
    if (ch == '|') {
      nextChar();
      return createToken(OR);
    }
    return createToken(VECTOR_OR);
  }

  private Token scanKeywordOrIdentifier() {
    StringBuilder builder = new StringBuilder();
    while (isIdentifierPart(ch)) {
      builder.append((char) ch);
      nextChar();
    }
    String word = builder.toString();
    Terminal keywordTerminal = KEYWORDS.get(word);
    if (keywordTerminal != null) {
      return createToken(keywordTerminal);
    }
    return createToken(IDENT, word);
  }

  private Token createToken(Terminal terminal, String content) {
    SourceRange range = new SourceRange(tokenBegin, Math.max(1, content.length()));
    return new Token(terminal, range, terminal.hasLexval() ? content : null);
  }

  private Token createToken(Terminal terminal) {
    return createToken(terminal, terminal.string.get());
  }

  @Override
  public boolean hasNext() {
    return eof == null;
  }

  @Override
  public Token next() {
    if (eof != null) {
      return eof;
    }
    return scan();
  }
}
