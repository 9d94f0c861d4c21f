package roptim.optimize;

import roptim.ast.Program;

public interface Optimizer {

  /**
   * Optimize the given program. Implementations must not mutate {@code program}.
   *
   * @param program given program
   * @return the optimized program; {@code changed} is true if the optimization changed it
   */
  OptimizationResult optimize(Program program);
}
