package roptim.parser;

import static roptim.token.Terminal.*;
import static roptim.token.Terminal.Associativity.*;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import roptim.ast.Block;
import roptim.ast.Expression;
import roptim.ast.Program;
import roptim.ast.Statement;
import roptim.token.Terminal;
import roptim.token.Token;
import roptim.util.LookAheadIterator;
import roptim.util.SourcePosition;
import roptim.util.SourceRange;

public class Parser {
  private static final Token EOF_TOKEN = new Token(EOF, SourceRange.FIRST_CHAR, null);
  private static final String RETURN_IDENTIFIER = "return";

  private final LookAheadIterator<Token> tokens;
  /*
   * Tracks the innermost bracket we are in: newlines are insignificant within parentheses and
   * separate statements within braces and at the top level.
   */
  private final Deque<Boolean> newlinesIgnored = new ArrayDeque<>();
  private Token currentToken;

  public Parser(Iterator<Token> tokens) {
    this.tokens = new LookAheadIterator<>(tokens);
  }

  private Token consumeToken() {
    Token eaten = currentToken;
    advance();
    while (isNewlineIgnored() && currentToken.terminal == NEWLINE) {
      advance();
    }
    return eaten;
  }

  private void advance() {
    if (tokens.hasNext()) {
      currentToken = tokens.next();
    } else if (currentToken == null) {
      currentToken = EOF_TOKEN;
    } else {
      // Just pretend there are infinitely many single character EOF tokens
      currentToken = new Token(EOF, new SourceRange(currentToken.range().end, 1), null);
    }
  }

  private boolean isNewlineIgnored() {
    return !newlinesIgnored.isEmpty() && newlinesIgnored.peek();
  }

  private Token expectAndConsume(Terminal terminal) {
    if (currentToken.terminal != terminal) {
      throw new ParserError(
          Thread.currentThread().getStackTrace()[2].getMethodName(), terminal, currentToken);
    }
    return consumeToken();
  }

  /** Consumes an opening bracket, entering a region with the given newline handling. */
  private Token open(Terminal terminal, boolean ignoreNewlines) {
    if (currentToken.terminal != terminal) {
      throw new ParserError(
          Thread.currentThread().getStackTrace()[2].getMethodName(), terminal, currentToken);
    }
    newlinesIgnored.push(ignoreNewlines);
    return consumeToken();
  }

  /** Consumes the closing bracket of the innermost region. */
  private Token close(Terminal terminal) {
    if (currentToken.terminal != terminal) {
      throw new ParserError(
          Thread.currentThread().getStackTrace()[2].getMethodName(), terminal, currentToken);
    }
    newlinesIgnored.pop();
    return consumeToken();
  }

  private <T> T unexpectCurrentToken(Terminal... expectedTerminals) {
    throw new ParserError(
        Thread.currentThread().getStackTrace()[2].getMethodName(), currentToken, expectedTerminals);
  }

  private boolean isCurrentTokenTypeOf(Terminal terminal) {
    return currentToken.terminal == terminal;
  }

  private boolean isCurrentTokenNotTypeOf(Terminal terminal) {
    return !isCurrentTokenTypeOf(terminal);
  }

  private boolean isCurrentTokenBinaryOperator() {
    return currentToken.isOperator();
  }

  private boolean isOperatorPrecedenceGreaterOrEqualThan(int precedence) {
    return currentToken.precedence() >= precedence;
  }

  /** Matches the current token and the tokens following it, one terminal each. */
  private boolean matchCurrentAndLookAhead(Terminal... terminals) {
    if (terminals.length == 0 || currentToken.terminal != terminals[0]) {
      return false;
    }
    for (int i = 1; i < terminals.length; i++) {
      if (tokens.lookAhead(i).orElse(EOF_TOKEN).terminal != terminals[i]) {
        return false;
      }
    }
    return true;
  }

  private void skipNewlines() {
    while (isCurrentTokenTypeOf(NEWLINE)) {
      consumeToken();
    }
  }

  private boolean isSeparator() {
    return currentToken.isOneOf(NEWLINE, SEMICOLON);
  }

  /** True if an {@code else} follows, possibly after some newlines. */
  private boolean isElseAhead() {
    if (isCurrentTokenTypeOf(ELSE)) {
      return true;
    }
    if (isCurrentTokenNotTypeOf(NEWLINE)) {
      return false;
    }
    int i = 1;
    while (tokens.lookAhead(i).orElse(EOF_TOKEN).terminal == NEWLINE) {
      i++;
    }
    return tokens.lookAhead(i).orElse(EOF_TOKEN).terminal == ELSE;
  }

  public Program parse() {
    consumeToken();
    return parseProgram();
  }

  /** Program -> Statements EOF */
  private Program parseProgram() {
    SourcePosition begin = SourcePosition.BEGIN_OF_PROGRAM;
    List<Statement> statements = parseStatements(EOF);
    SourcePosition end = expectAndConsume(EOF).range().end;
    return new Program(statements, new SourceRange(begin, end));
  }

  /** Statements -> Separator* (Statement (Separator+ Statement)*)? Separator* */
  private List<Statement> parseStatements(Terminal terminator) {
    List<Statement> statements = new ArrayList<>();
    while (true) {
      while (isSeparator()) {
        consumeToken();
      }
      if (isCurrentTokenTypeOf(terminator) || isCurrentTokenTypeOf(EOF)) {
        return statements;
      }
      statements.add(parseStatement());
      if (!isSeparator() && isCurrentTokenNotTypeOf(terminator)) {
        unexpectCurrentToken(NEWLINE, SEMICOLON, terminator);
      }
    }
  }

  /** Statement -> Block | If | While | Repeat | For | Terminator | Expression */
  private Statement parseStatement() {
    // Nesting depth of the source is bounded by the stack, which we accept.
    switch (currentToken.terminal) {
      case LCURLY:
        return parseBlock();
      case IF:
        return parseIfStatement();
      case WHILE:
        return parseWhileStatement();
      case REPEAT:
        return parseRepeatStatement();
      case FOR:
        return parseForStatement();
      case BREAK:
        return new Statement.Terminator(
            Statement.Terminator.Kind.BREAK, null, expectAndConsume(BREAK).range());
      case NEXT:
        return new Statement.Terminator(
            Statement.Terminator.Kind.NEXT, null, expectAndConsume(NEXT).range());
      default:
        if (isReturnCall()) {
          return parseReturnStatement();
        }
        return parseExpressionStatement();
    }
  }

  private boolean isReturnCall() {
    return matchCurrentAndLookAhead(IDENT, LPAREN)
        && RETURN_IDENTIFIER.equals(currentToken.lexval);
  }

  /** Block -> { Statements } */
  private Block parseBlock() {
    SourcePosition begin = open(LCURLY, false).range().begin;
    List<Statement> statements = parseStatements(RCURLY);
    SourcePosition end = close(RCURLY).range().end;
    return new Block(statements, new SourceRange(begin, end));
  }

  /** Body -> Statement, wrapped into a Block if it isn't one */
  private Block parseBody() {
    skipNewlines();
    Statement statement = parseStatement();
    if (statement instanceof Block) {
      return (Block) statement;
    }
    return new Block(ImmutableList.of(statement), statement.range());
  }

  /** Condition -> ( Expression ) */
  private Expression parseCondition() {
    open(LPAREN, true);
    Expression condition = parseExpression();
    close(RPAREN);
    return condition;
  }

  /** If -> if ( Expression ) Body (else Body)? */
  private Statement parseIfStatement() {
    SourcePosition begin = expectAndConsume(IF).range().begin;
    Expression condition = parseCondition();
    Block then = parseBody();
    SourcePosition end = then.range().end;
    Block else_ = null;
    if (isElseAhead()) {
      skipNewlines();
      expectAndConsume(ELSE);
      else_ = parseBody();
      end = else_.range().end;
    }
    return new Statement.If(condition, then, else_, new SourceRange(begin, end));
  }

  /** While -> while ( Expression ) Body */
  private Statement parseWhileStatement() {
    SourcePosition begin = expectAndConsume(WHILE).range().begin;
    Expression condition = parseCondition();
    Block body = parseBody();
    return new Statement.While(condition, body, new SourceRange(begin, body.range().end));
  }

  /** Repeat -> repeat Body */
  private Statement parseRepeatStatement() {
    SourcePosition begin = expectAndConsume(REPEAT).range().begin;
    Block body = parseBody();
    return new Statement.Repeat(body, new SourceRange(begin, body.range().end));
  }

  /** For -> for ( IDENT in Expression ) Body */
  private Statement parseForStatement() {
    SourcePosition begin = expectAndConsume(FOR).range().begin;
    open(LPAREN, true);
    String variable = expectAndConsume(IDENT).lexval;
    expectAndConsume(IN);
    Expression sequence = parseExpression();
    close(RPAREN);
    Block body = parseBody();
    return new Statement.For(variable, sequence, body, new SourceRange(begin, body.range().end));
  }

  /** Terminator -> return ( Expression? ) */
  private Statement parseReturnStatement() {
    SourcePosition begin = expectAndConsume(IDENT).range().begin;
    open(LPAREN, true);
    Expression payload = null;
    if (isCurrentTokenNotTypeOf(RPAREN)) {
      payload = parseExpression();
    }
    SourcePosition end = close(RPAREN).range().end;
    return new Statement.Terminator(
        Statement.Terminator.Kind.RETURN, payload, new SourceRange(begin, end));
  }

  /** ExpressionStatement -> Expression */
  private Statement parseExpressionStatement() {
    Expression expression = parseExpression();
    return new Statement.ExpressionStatement(expression, expression.range());
  }

  /** Expression is parsed with Precedence Climbing */
  private Expression parseExpression() {
    return parseExpressionWithPrecedenceClimbing(0);
  }

  private Expression parseExpressionWithPrecedenceClimbing(int minPrecedence) {
    Expression result = parseUnaryExpression();
    while (isCurrentTokenBinaryOperator()
        && isOperatorPrecedenceGreaterOrEqualThan(minPrecedence)) {
      Expression.BinOp operator = getBinaryOperator(currentToken);
      int precedence = currentToken.precedence();
      if (currentToken.associativity() == LEFT) {
        precedence++;
      }
      consumeToken();
      skipNewlines();
      Expression rhs = parseExpressionWithPrecedenceClimbing(precedence);
      SourcePosition begin = result.range().begin;
      SourcePosition end = rhs.range().end;
      result = new Expression.BinaryOperator(operator, result, rhs, new SourceRange(begin, end));
    }
    return result;
  }

  private Expression.BinOp getBinaryOperator(Token token) {
    switch (token.terminal) {
      case LEFT_ASSIGN:
        return Expression.BinOp.LEFT_ASSIGN;
      case SUPER_ASSIGN:
        return Expression.BinOp.SUPER_ASSIGN;
      case EQUAL_SIGN:
        return Expression.BinOp.EQUAL_ASSIGN;
      case OR:
        return Expression.BinOp.OR;
      case VECTOR_OR:
        return Expression.BinOp.VECTOR_OR;
      case AND:
        return Expression.BinOp.AND;
      case VECTOR_AND:
        return Expression.BinOp.VECTOR_AND;
      case EQUALS:
        return Expression.BinOp.EQ;
      case UNEQUALS:
        return Expression.BinOp.NEQ;
      case LOWER:
        return Expression.BinOp.LT;
      case LOWER_EQUALS:
        return Expression.BinOp.LEQ;
      case GREATER:
        return Expression.BinOp.GT;
      case GREATER_EQUALS:
        return Expression.BinOp.GEQ;
      case PLUS:
        return Expression.BinOp.PLUS;
      case MINUS:
        return Expression.BinOp.MINUS;
      case MULTIPLY:
        return Expression.BinOp.MULTIPLY;
      case DIVIDE:
        return Expression.BinOp.DIVIDE;
      case MODULO:
        return Expression.BinOp.MODULO;
      case POWER:
        return Expression.BinOp.POWER;
      default:
        throw new ParserError(token.range(), "Token is not a BinaryOperator");
    }
  }

  private Expression.UnOp getUnaryOperator(Token token) {
    switch (token.terminal) {
      case INVERT:
        return Expression.UnOp.NOT;
      case MINUS:
        return Expression.UnOp.NEGATE;
      case PLUS:
        return Expression.UnOp.PLUS;
      default:
        throw new ParserError(token.range(), "Token is not an UnaryOperator");
    }
  }

  /** UnaryExpression -> PostfixExpression | (! | - | +) Expression */
  private Expression parseUnaryExpression() {
    if (currentToken.isOneOf(INVERT, MINUS, PLUS)) {
      Expression.UnOp operator = getUnaryOperator(currentToken);
      SourcePosition begin = consumeToken().range().begin;
      skipNewlines();
      // '!' binds weaker than comparisons, '-' and '+' only weaker than '^'
      Expression operand = parseExpressionWithPrecedenceClimbing(operator.operandPrecedence);
      return new Expression.UnaryOperator(
          operator, operand, new SourceRange(begin, operand.range().end));
    }
    return parsePostfixExpression();
  }

  /** PostfixExpression -> PrimaryExpression (( Arguments ))* */
  private Expression parsePostfixExpression() {
    Expression expression = parsePrimaryExpression();
    while (isCurrentTokenTypeOf(LPAREN)) {
      expression = parseCall(expression);
    }
    return expression;
  }

  /** Call -> ( Arguments ) */
  private Expression parseCall(Expression function) {
    open(LPAREN, true);
    List<Expression.Argument> arguments = parseArguments();
    SourcePosition end = close(RPAREN).range().end;
    return new Expression.Call(
        function, arguments, new SourceRange(function.range().begin, end));
  }

  /** Arguments -> (Argument (, Argument)*)? */
  private List<Expression.Argument> parseArguments() {
    List<Expression.Argument> arguments = new ArrayList<>();
    if (isCurrentTokenNotTypeOf(RPAREN)) {
      arguments.add(parseArgument());
      while (isCurrentTokenTypeOf(COMMA)) {
        expectAndConsume(COMMA);
        arguments.add(parseArgument());
      }
    }
    return arguments;
  }

  /** Argument -> (IDENT =)? Expression */
  private Expression.Argument parseArgument() {
    String name = null;
    if (matchCurrentAndLookAhead(IDENT, EQUAL_SIGN)) {
      name = expectAndConsume(IDENT).lexval;
      expectAndConsume(EQUAL_SIGN);
    }
    return new Expression.Argument(name, parseExpression());
  }

  /**
   * PrimaryExpression -> TRUE | FALSE | NULL | NUMBER_LITERAL | STRING_LITERAL | IDENT | (
   * Expression ) | Function
   */
  private Expression parsePrimaryExpression() {
    Token token;
    switch (currentToken.terminal) {
      case TRUE:
        return new Expression.BooleanLiteral(true, expectAndConsume(TRUE).range());
      case FALSE:
        return new Expression.BooleanLiteral(false, expectAndConsume(FALSE).range());
      case NULL:
        return new Expression.NullLiteral(expectAndConsume(NULL).range());
      case NUMBER_LITERAL:
        token = expectAndConsume(NUMBER_LITERAL);
        return new Expression.NumericLiteral(token.lexval, token.range());
      case STRING_LITERAL:
        token = expectAndConsume(STRING_LITERAL);
        return new Expression.StringLiteral(token.lexval, token.range());
      case IDENT:
        token = expectAndConsume(IDENT);
        return new Expression.Variable(token.lexval, token.range());
      case LPAREN:
        open(LPAREN, true);
        Expression inner = parseExpression();
        close(RPAREN);
        return inner;
      case FUNCTION:
        return parseFunction();
      default:
        return unexpectCurrentToken(
            TRUE, FALSE, NULL, NUMBER_LITERAL, STRING_LITERAL, IDENT, LPAREN, FUNCTION);
    }
  }

  /** Function -> function ( Parameters? ) Body */
  private Expression parseFunction() {
    SourcePosition begin = expectAndConsume(FUNCTION).range().begin;
    open(LPAREN, true);
    List<Expression.Parameter> parameters = new ArrayList<>();
    if (isCurrentTokenNotTypeOf(RPAREN)) {
      parameters.add(parseParameter());
      while (isCurrentTokenTypeOf(COMMA)) {
        expectAndConsume(COMMA);
        parameters.add(parseParameter());
      }
    }
    close(RPAREN);
    Block body = parseBody();
    return new Expression.Function(parameters, body, new SourceRange(begin, body.range().end));
  }

  /** Parameter -> IDENT (= Expression)? */
  private Expression.Parameter parseParameter() {
    String name = expectAndConsume(IDENT).lexval;
    Expression defaultValue = null;
    if (isCurrentTokenTypeOf(EQUAL_SIGN)) {
      expectAndConsume(EQUAL_SIGN);
      defaultValue = parseExpression();
    }
    return new Expression.Parameter(name, defaultValue);
  }
}
