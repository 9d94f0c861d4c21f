package roptim.optimize;

import static com.google.common.base.Preconditions.checkNotNull;

import roptim.ast.Program;

/** The output of an {@link Optimizer}: the rewritten program and whether anything changed. */
public final class OptimizationResult {
  public final Program program;
  public final boolean changed;

  public OptimizationResult(Program program, boolean changed) {
    this.program = checkNotNull(program);
    this.changed = changed;
  }
}
