package roptim.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import roptim.util.SourceRange;

/** A parsed script: its top-level statements in source order. */
public class Program extends Node {
  public final List<Statement> statements;

  public Program(List<? extends Statement> statements, SourceRange range) {
    super(range);
    this.statements = ImmutableList.copyOf(statements);
  }

  public <T> T acceptVisitor(Visitor<T> visitor) {
    return visitor.visitProgram(this);
  }

  public interface Visitor<T> {

    T visitProgram(Program that);
  }
}
