package roptim.util;

import static org.jooq.lambda.Seq.seq;

import com.google.common.base.Strings;
import java.util.stream.Collectors;
import roptim.ast.Block;
import roptim.ast.Expression;
import roptim.ast.Program;
import roptim.ast.Statement;

/**
 * An implementation of an AST visitor that pretty-prints the AST back to source code.
 *
 * <p>Instances of this class <em>are</em> stateful (e.g., current indentation level). It is very
 * cheap to create new instances of this class and therefore it is generally not advisable to reuse
 * instances.
 *
 * <p>Parentheses only appear where operator precedence requires them, so printing a parsed program
 * and parsing the output again yields the same tree.
 */
public class PrettyPrinter
    implements Program.Visitor<CharSequence>,
        Statement.Visitor<CharSequence>,
        Expression.Visitor<CharSequence> {

  private static final int PRIMARY_PRECEDENCE = 10;
  // Binds tighter than every assignment, so `f((a = 1))` is not mistaken for a named argument.
  private static final int ARGUMENT_PRECEDENCE = 2;

  private int indentLevel = 0;
  // True while printing an expression that more expression text follows, e.g. a callee or the
  // left operand of a binary operator. A function literal there would swallow that text.
  private boolean followedByExpression = false;

  public PrettyPrinter() {}

  private CharSequence indent() {
    return Strings.repeat("\t", indentLevel);
  }

  @Override
  public CharSequence visitProgram(Program that) {
    StringBuilder sb = new StringBuilder();
    for (Statement statement : that.statements) {
      sb.append(statement.acceptVisitor(this)).append(System.lineSeparator());
    }
    return sb;
  }

  @Override
  public CharSequence visitBlock(Block that) {
    StringBuilder sb = new StringBuilder("{");
    if (that.isEmpty()) {
      return sb.append(" }");
    }
    sb.append(System.lineSeparator());
    indentLevel++;
    that.statements
        .stream()
        .map(s -> s.acceptVisitor(this))
        .forEach(s -> sb.append(indent()).append(s).append(System.lineSeparator()));
    indentLevel--;
    return sb.append(indent()).append("}");
  }

  @Override
  public CharSequence visitIf(Statement.If that) {
    StringBuilder b = new StringBuilder("if (");
    b.append(print(that.condition, 0)).append(") ");
    b.append(that.then.acceptVisitor(this));
    if (!that.else_.isPresent()) {
      return b;
    }
    Block else_ = that.else_.get();
    b.append(" else ");
    // `else if` chains come back from the parser as an else block holding a single if
    if (else_.statements.size() == 1 && else_.statements.get(0) instanceof Statement.If) {
      return b.append(else_.statements.get(0).acceptVisitor(this));
    }
    return b.append(else_.acceptVisitor(this));
  }

  @Override
  public CharSequence visitWhile(Statement.While that) {
    return new StringBuilder("while (")
        .append(print(that.condition, 0))
        .append(") ")
        .append(that.body.acceptVisitor(this));
  }

  @Override
  public CharSequence visitRepeat(Statement.Repeat that) {
    return new StringBuilder("repeat ").append(that.body.acceptVisitor(this));
  }

  @Override
  public CharSequence visitFor(Statement.For that) {
    return new StringBuilder("for (")
        .append(that.variable)
        .append(" in ")
        .append(print(that.sequence, 0))
        .append(") ")
        .append(that.body.acceptVisitor(this));
  }

  @Override
  public CharSequence visitTerminator(Statement.Terminator that) {
    StringBuilder b = new StringBuilder(that.kind.string);
    if (that.kind != Statement.Terminator.Kind.RETURN) {
      return b;
    }
    b.append("(");
    that.payload.ifPresent(p -> b.append(print(p, 0)));
    return b.append(")");
  }

  @Override
  public CharSequence visitExpressionStatement(Statement.ExpressionStatement that) {
    return print(that.expression, 0);
  }

  /** Prints {@code expression}, parenthesized if it binds weaker than {@code minPrecedence}. */
  private CharSequence print(Expression expression, int minPrecedence) {
    return print(expression, minPrecedence, false);
  }

  /**
   * Like {@link #print(Expression, int)}, but {@code followed} tells whether more expression text
   * comes after the printed expression.
   */
  private CharSequence print(Expression expression, int minPrecedence, boolean followed) {
    boolean parenthesize =
        precedenceOf(expression) < minPrecedence
            || (followed && expression instanceof Expression.Function);
    boolean outer = followedByExpression;
    followedByExpression = followed && !parenthesize;
    CharSequence printed = expression.acceptVisitor(this);
    followedByExpression = outer;
    if (parenthesize) {
      return new StringBuilder("(").append(printed).append(")");
    }
    return printed;
  }

  private static int precedenceOf(Expression expression) {
    if (expression instanceof Expression.BinaryOperator) {
      return ((Expression.BinaryOperator) expression).op.precedence;
    }
    if (expression instanceof Expression.UnaryOperator) {
      return ((Expression.UnaryOperator) expression).op.operandPrecedence;
    }
    return PRIMARY_PRECEDENCE;
  }

  @Override
  public CharSequence visitBinaryOperator(Expression.BinaryOperator that) {
    int leftPrecedence = that.op.rightAssociative ? that.op.precedence + 1 : that.op.precedence;
    int rightPrecedence = that.op.rightAssociative ? that.op.precedence : that.op.precedence + 1;
    return new StringBuilder()
        .append(print(that.left, leftPrecedence, true))
        .append(" ")
        .append(that.op.string)
        .append(" ")
        .append(print(that.right, rightPrecedence, followedByExpression));
  }

  @Override
  public CharSequence visitUnaryOperator(Expression.UnaryOperator that) {
    return new StringBuilder(that.op.string)
        .append(print(that.expression, that.op.operandPrecedence, followedByExpression));
  }

  @Override
  public CharSequence visitCall(Expression.Call that) {
    StringBuilder b = new StringBuilder(print(that.function, PRIMARY_PRECEDENCE, true));
    b.append("(");
    b.append(
        seq(that.arguments)
            .map(
                a ->
                    a.name.map(n -> n + " = ").orElse("")
                        + print(a.value, ARGUMENT_PRECEDENCE))
            .collect(Collectors.joining(", ")));
    return b.append(")");
  }

  @Override
  public CharSequence visitFunction(Expression.Function that) {
    StringBuilder b = new StringBuilder("function(");
    b.append(
        seq(that.parameters)
            .map(
                p ->
                    p.name
                        + p.defaultValue
                            .map(d -> " = " + print(d, ARGUMENT_PRECEDENCE))
                            .orElse(""))
            .collect(Collectors.joining(", ")));
    return b.append(") ").append(that.body.acceptVisitor(this));
  }

  @Override
  public CharSequence visitBooleanLiteral(Expression.BooleanLiteral that) {
    return that.literal ? "TRUE" : "FALSE";
  }

  @Override
  public CharSequence visitNumericLiteral(Expression.NumericLiteral that) {
    return that.literal;
  }

  @Override
  public CharSequence visitStringLiteral(Expression.StringLiteral that) {
    return that.literal;
  }

  @Override
  public CharSequence visitNullLiteral(Expression.NullLiteral that) {
    return "NULL";
  }

  @Override
  public CharSequence visitVariable(Expression.Variable that) {
    return that.name;
  }
}
