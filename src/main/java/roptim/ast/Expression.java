package roptim.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import roptim.util.SourceRange;

public abstract class Expression extends Node {

  Expression(SourceRange range) {
    super(range);
  }

  public abstract <T> T acceptVisitor(Visitor<T> visitor);

  /** {@code TRUE} or {@code FALSE}. The identifiers {@code T} and {@code F} are variables. */
  public static class BooleanLiteral extends Expression {

    public final boolean literal;

    public BooleanLiteral(boolean literal, SourceRange range) {
      super(range);
      this.literal = literal;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitBooleanLiteral(this);
    }
  }

  /** Number literals are kept in their source spelling, e.g. {@code 1L} or {@code 2.5e3}. */
  public static class NumericLiteral extends Expression {

    public final String literal;

    public NumericLiteral(String literal, SourceRange range) {
      super(range);
      this.literal = literal;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitNumericLiteral(this);
    }
  }

  /** Holds the literal's source text, quotes and escapes included. */
  public static class StringLiteral extends Expression {

    public final String literal;

    public StringLiteral(String literal, SourceRange range) {
      super(range);
      this.literal = literal;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitStringLiteral(this);
    }
  }

  public static class NullLiteral extends Expression {

    public NullLiteral(SourceRange range) {
      super(range);
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitNullLiteral(this);
    }
  }

  public static class Variable extends Expression {

    public final String name;

    public Variable(String name, SourceRange range) {
      super(range);
      this.name = name;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitVariable(this);
    }
  }

  /** Assignments are binary operators too, see {@link BinOp#isAssignment()}. */
  public static class BinaryOperator extends Expression {
    public final BinOp op;
    public final Expression left;
    public final Expression right;

    public BinaryOperator(BinOp op, Expression left, Expression right, SourceRange range) {
      super(range);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitBinaryOperator(this);
    }
  }

  public static class UnaryOperator extends Expression {

    public final UnOp op;
    public final Expression expression;

    public UnaryOperator(UnOp op, Expression expression, SourceRange range) {
      super(range);
      this.op = op;
      this.expression = expression;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitUnaryOperator(this);
    }
  }

  public static class Call extends Expression {

    public final Expression function;
    public final List<Argument> arguments;

    public Call(Expression function, List<Argument> arguments, SourceRange range) {
      super(range);
      this.function = function;
      this.arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitCall(this);
    }
  }

  /** A positional ({@code f(x)}) or named ({@code f(n = x)}) call argument. */
  public static class Argument {
    public final Optional<String> name;
    public final Expression value;

    public Argument(@Nullable String name, Expression value) {
      this.name = Optional.ofNullable(name);
      this.value = value;
    }
  }

  /** A function definition, {@code function(params) body}. */
  public static class Function extends Expression {

    public final List<Parameter> parameters;
    public final Block body;

    public Function(List<Parameter> parameters, Block body, SourceRange range) {
      super(range);
      this.parameters = ImmutableList.copyOf(parameters);
      this.body = body;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitFunction(this);
    }
  }

  /** A formal parameter with an optional default value, {@code x} or {@code x = 1}. */
  public static class Parameter {
    public final String name;
    public final Optional<Expression> defaultValue;

    public Parameter(String name, @Nullable Expression defaultValue) {
      this.name = name;
      this.defaultValue = Optional.ofNullable(defaultValue);
    }
  }

  public enum UnOp {
    NOT("!", 4),
    NEGATE("-", 8),
    PLUS("+", 8);

    public final String string;
    /** The minimum precedence of binary operators that may appear unparenthesized as operand */
    public final int operandPrecedence;

    UnOp(String string, int operandPrecedence) {
      this.string = string;
      this.operandPrecedence = operandPrecedence;
    }
  }

  public enum BinOp {
    LEFT_ASSIGN("<-", 1, true),
    SUPER_ASSIGN("<<-", 1, true),
    EQUAL_ASSIGN("=", 1, true),
    OR("||", 2, false),
    VECTOR_OR("|", 2, false),
    AND("&&", 3, false),
    VECTOR_AND("&", 3, false),
    EQ("==", 5, false),
    NEQ("!=", 5, false),
    LT("<", 5, false),
    LEQ("<=", 5, false),
    GT(">", 5, false),
    GEQ(">=", 5, false),
    PLUS("+", 6, false),
    MINUS("-", 6, false),
    MULTIPLY("*", 7, false),
    DIVIDE("/", 7, false),
    MODULO("%%", 7, false),
    POWER("^", 9, true);

    public final String string;
    public final int precedence;
    public final boolean rightAssociative;

    BinOp(String string, int precedence, boolean rightAssociative) {
      this.string = string;
      this.precedence = precedence;
      this.rightAssociative = rightAssociative;
    }

    public boolean isAssignment() {
      return precedence == 1;
    }
  }

  public interface Visitor<T> {

    T visitBooleanLiteral(BooleanLiteral that);

    T visitNumericLiteral(NumericLiteral that);

    T visitStringLiteral(StringLiteral that);

    T visitNullLiteral(NullLiteral that);

    T visitVariable(Variable that);

    T visitBinaryOperator(BinaryOperator that);

    T visitUnaryOperator(UnaryOperator that);

    T visitCall(Call that);

    T visitFunction(Function that);
  }
}
