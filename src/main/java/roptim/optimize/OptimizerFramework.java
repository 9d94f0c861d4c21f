package roptim.optimize;

import static com.google.common.base.Preconditions.checkArgument;
import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.Iterables;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import org.jooq.lambda.Seq;
import org.pcollections.HashTreePMap;
import org.pcollections.HashTreePSet;
import org.pcollections.PMap;
import org.pcollections.PSet;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import roptim.ast.Program;

/**
 * Drives a set of {@link Optimizer}s to a fixed point. Each optimizer declares the optimizers it
 * depends on; whenever an optimizer reports a change, every optimizer depending on it is queued
 * again.
 */
public class OptimizerFramework {
  private static final Logger LOGGER = LoggerFactory.getLogger("OptimizerFramework");
  public static final int DEFAULT_MAX_RUNS_PER_OPTIMIZER = 100;

  private final Optimizer[] idToOptimizers;
  private final List<Integer>[] referrers;
  private final int maxRunsPerOptimizer;

  private OptimizerFramework(
      Optimizer[] idToOptimizers, List<Integer>[] referrers, int maxRunsPerOptimizer) {
    this.idToOptimizers = idToOptimizers;
    this.referrers = referrers;
    this.maxRunsPerOptimizer = maxRunsPerOptimizer;
  }

  /**
   * This will run each optimization at least once until a fixed-point is reached. Note that
   * first-registered Optimizers have a higher priority of being run.
   *
   * <p>An optimizer that keeps reporting changes is not run more than {@code
   * maxRunsPerOptimizer} times. Further requests to run it are dropped, while the remaining
   * optimizers still run to their fixed point.
   */
  public Program optimizeUntilFixedpoint(Program program) {
    SortedSet<Integer> toVisit = new TreeSet<>(Seq.range(0, idToOptimizers.length).toList());
    int[] runs = new int[idToOptimizers.length];
    while (!toVisit.isEmpty()) {
      int next = toVisit.first();
      toVisit.remove(next);

      Optimizer chosenOptimizer = idToOptimizers[next];
      if (runs[next]++ >= maxRunsPerOptimizer) {
        if (runs[next] == maxRunsPerOptimizer + 1) {
          LOGGER.warn(
              "{} did not reach a fixed point within {} runs, giving up on it",
              nameOf(chosenOptimizer),
              maxRunsPerOptimizer);
        }
        continue;
      }
      LOGGER.debug(nameOf(chosenOptimizer));
      OptimizationResult result = chosenOptimizer.optimize(program);
      program = result.program;
      if (result.changed) {
        // The optimizer changed something, so we enqueue all dependent optimizers
        List<Integer> needRerun = referrers[next];
        LOGGER.debug(
            " ... changed. Bumping "
                + Iterables.toString(seq(needRerun).map(i -> nameOf(idToOptimizers[i]))));
        toVisit.addAll(needRerun);
      }
    }
    return program;
  }

  private static String nameOf(Optimizer optimizer) {
    return optimizer.getClass().getSimpleName();
  }

  public static class Builder {
    private final PVector<Optimizer> idToOptimizers;
    private final PMap<Optimizer, PSet<Optimizer>> references;
    private final int maxRunsPerOptimizer;

    private Builder(
        PVector<Optimizer> idToOptimizers,
        PMap<Optimizer, PSet<Optimizer>> references,
        int maxRunsPerOptimizer) {
      this.idToOptimizers = idToOptimizers;
      this.references = references;
      this.maxRunsPerOptimizer = maxRunsPerOptimizer;
    }

    public Builder() {
      this(TreePVector.empty(), HashTreePMap.empty(), DEFAULT_MAX_RUNS_PER_OPTIMIZER);
    }

    public DependsOn add(Optimizer optimizer) {
      checkArgument(
          !references.containsKey(optimizer), "%s was already added", nameOf(optimizer));
      return new DependsOn(optimizer);
    }

    public Builder maxRunsPerOptimizer(int maxRuns) {
      checkArgument(maxRuns > 0, "maxRuns must be positive, was %s", maxRuns);
      return new Builder(idToOptimizers, references, maxRuns);
    }

    public OptimizerFramework build() {
      Optimizer[] idToOptimizers = seq(this.idToOptimizers).toArray(Optimizer[]::new);
      return new OptimizerFramework(
          idToOptimizers, invert(idToOptimizers, this.references), maxRunsPerOptimizer);
    }

    @SuppressWarnings("unchecked")
    private List<Integer>[] invert(
        Optimizer[] idToOptimizer, PMap<Optimizer, PSet<Optimizer>> edges) {
      List<Integer>[] inverted = (List<Integer>[]) new List[idToOptimizer.length];
      for (int i = 0; i < inverted.length; ++i) {
        Optimizer current = idToOptimizer[i];
        // all j which have current as a dependency
        inverted[i] =
            Seq.range(0, inverted.length)
                .filter(j -> edges.get(idToOptimizer[j]).contains(current))
                .toList();
      }
      return inverted;
    }

    public class DependsOn {
      private final Optimizer focus;

      private DependsOn(Optimizer focus) {
        this.focus = focus;
      }

      public Builder dependsOn(Optimizer... deps) {
        PSet<Optimizer> depsIds = HashTreePSet.from(Seq.of(deps).toList());
        return new Builder(
            idToOptimizers.plus(focus), references.plus(focus, depsIds), maxRunsPerOptimizer);
      }
    }
  }
}
