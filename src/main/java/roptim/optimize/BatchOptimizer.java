package roptim.optimize;

import static com.google.common.base.Preconditions.checkArgument;
import static org.jooq.lambda.Seq.seq;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import roptim.RoptimError;
import roptim.ast.Program;
import roptim.lexer.Lexer;
import roptim.parser.Parser;
import roptim.util.PrettyPrinter;

/**
 * Optimizes many independent scripts on a fixed pool of worker threads. Each script is parsed,
 * driven through an {@link OptimizerFramework} and printed again. No state is shared between
 * items, so the results do not depend on the number of workers.
 */
public class BatchOptimizer implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger("BatchOptimizer");

  private final OptimizerFramework framework;
  private final ListeningExecutorService executor;

  public BatchOptimizer(OptimizerFramework framework, int jobs) {
    checkArgument(jobs > 0, "jobs must be positive, was %s", jobs);
    this.framework = framework;
    this.executor = MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(jobs));
  }

  /**
   * Returns the optimized source of every element of {@code sources}, in the same order.
   *
   * @throws RoptimError the error of the first item (in input order) that failed to lex or parse
   */
  public List<String> optimizeAll(List<String> sources) {
    List<ListenableFuture<String>> futures = submitAll(sources);
    List<String> results = new ArrayList<>(futures.size());
    for (ListenableFuture<String> future : futures) {
      results.add(await(future));
    }
    return results;
  }

  /**
   * Schedules every element of {@code sources} and returns immediately. Callers that want to
   * report results as they become available, while still knowing which input failed, use this
   * together with {@link #await(ListenableFuture)}.
   */
  public List<ListenableFuture<String>> submitAll(List<String> sources) {
    LOGGER.debug("Optimizing {} sources", sources.size());
    return seq(sources).map(source -> executor.submit(() -> optimizeOne(source))).toList();
  }

  private String optimizeOne(String source) {
    Program program = new Parser(new Lexer(source)).parse();
    Program optimized = framework.optimizeUntilFixedpoint(program);
    return optimized.acceptVisitor(new PrettyPrinter()).toString();
  }

  /** Waits for {@code future}, rethrowing the item's own error if it failed. */
  public static String await(ListenableFuture<String> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RoptimError(e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new RoptimError(e);
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
