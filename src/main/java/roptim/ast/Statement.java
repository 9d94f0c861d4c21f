package roptim.ast;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import roptim.util.SourceCodeReferable;
import roptim.util.SourceRange;

/*
 * Everything that may appear as an element of a Block. Branches and loop bodies are always
 * Blocks: the parser wraps a lone statement (`if (a) b`) into a Block of its own, so every
 * consumer sees the same shape regardless of whether the source had braces.
 */
public interface Statement extends SourceCodeReferable {

  <T> T acceptVisitor(Statement.Visitor<T> visitor);

  class If extends Node implements Statement {
    public final Expression condition;
    public final Block then;
    public final Optional<Block> else_;

    public If(Expression condition, Block then, @Nullable Block else_, SourceRange range) {
      super(range);
      this.condition = condition;
      this.then = then;
      this.else_ = Optional.ofNullable(else_);
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitIf(this);
    }
  }

  class While extends Node implements Statement {
    public final Expression condition;
    public final Block body;

    public While(Expression condition, Block body, SourceRange range) {
      super(range);
      this.condition = condition;
      this.body = body;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitWhile(this);
    }
  }

  /** {@code repeat body}: loops until a {@code break} inside {@code body} is executed. */
  class Repeat extends Node implements Statement {
    public final Block body;

    public Repeat(Block body, SourceRange range) {
      super(range);
      this.body = body;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitRepeat(this);
    }
  }

  /** {@code for (variable in sequence) body} */
  class For extends Node implements Statement {
    public final String variable;
    public final Expression sequence;
    public final Block body;

    public For(String variable, Expression sequence, Block body, SourceRange range) {
      super(range);
      this.variable = variable;
      this.sequence = sequence;
      this.body = body;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitFor(this);
    }
  }

  /**
   * {@code return(payload)}, {@code break} or {@code next}. Control never reaches the statement
   * following a terminator in the same block.
   */
  class Terminator extends Node implements Statement {
    public final Kind kind;
    public final Optional<Expression> payload;

    public Terminator(Kind kind, @Nullable Expression payload, SourceRange range) {
      super(range);
      assert payload == null || kind == Kind.RETURN;
      this.kind = kind;
      this.payload = Optional.ofNullable(payload);
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitTerminator(this);
    }

    public enum Kind {
      RETURN("return"),
      BREAK("break"),
      NEXT("next");

      public final String string;

      Kind(String string) {
        this.string = string;
      }
    }
  }

  class ExpressionStatement extends Node implements Statement {

    public final Expression expression;

    public ExpressionStatement(Expression expression, SourceRange range) {
      super(range);
      this.expression = expression;
    }

    @Override
    public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
      return visitor.visitExpressionStatement(this);
    }
  }

  interface Visitor<T> {

    T visitBlock(Block that);

    T visitIf(If that);

    T visitWhile(While that);

    T visitRepeat(Repeat that);

    T visitFor(For that);

    T visitTerminator(Terminator that);

    T visitExpressionStatement(ExpressionStatement that);
  }
}
