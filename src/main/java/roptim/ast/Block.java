package roptim.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import roptim.util.SourceRange;

/** An ordered, possibly empty, sequence of statements. */
public class Block extends Node implements Statement {

  public final List<Statement> statements;

  public Block(List<? extends Statement> statements, SourceRange range) {
    super(range);
    this.statements = ImmutableList.copyOf(statements);
  }

  public static Block empty(SourceRange range) {
    return new Block(ImmutableList.of(), range);
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  @Override
  public <T> T acceptVisitor(Statement.Visitor<T> visitor) {
    return visitor.visitBlock(this);
  }
}
