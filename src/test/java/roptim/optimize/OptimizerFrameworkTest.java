package roptim.optimize;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import roptim.ast.Program;
import roptim.lexer.Lexer;
import roptim.parser.Parser;
import roptim.util.PrettyPrinter;

public class OptimizerFrameworkTest {

  private static Program parse(String source) {
    return new Parser(new Lexer(source)).parse();
  }

  /** Records its invocations and reports a change for the first {@code changes} of them. */
  private static class RecordingOptimizer implements Optimizer {
    private final String name;
    private final List<String> log;
    private int changes;

    RecordingOptimizer(String name, List<String> log, int changes) {
      this.name = name;
      this.log = log;
      this.changes = changes;
    }

    @Override
    public OptimizationResult optimize(Program program) {
      log.add(name);
      return new OptimizationResult(program, changes-- > 0);
    }
  }

  @Test
  public void everyOptimizerRunsOnce_inRegistrationOrder() {
    List<String> log = new ArrayList<>();
    Optimizer a = new RecordingOptimizer("a", log, 0);
    Optimizer b = new RecordingOptimizer("b", log, 0);
    OptimizerFramework framework =
        new OptimizerFramework.Builder().add(a).dependsOn(b).add(b).dependsOn(a).build();

    framework.optimizeUntilFixedpoint(parse("x"));

    assertThat(log, is(equalTo(ImmutableList.of("a", "b"))));
  }

  @Test
  public void unchangedProgram_doesNotRequeue() {
    List<String> log = new ArrayList<>();
    Optimizer a = new RecordingOptimizer("a", log, 0);
    Optimizer b = new RecordingOptimizer("b", log, 0);
    OptimizerFramework framework =
        new OptimizerFramework.Builder().add(a).dependsOn(b).add(b).dependsOn(a).build();

    framework.optimizeUntilFixedpoint(parse("x"));
    framework.optimizeUntilFixedpoint(parse("y"));

    assertThat(log, is(equalTo(ImmutableList.of("a", "b", "a", "b"))));
  }

  @Test
  public void change_requeuesDependentOptimizers() {
    List<String> log = new ArrayList<>();
    Optimizer dependent = new RecordingOptimizer("dependent", log, 0);
    Optimizer changer = new RecordingOptimizer("changer", log, 1);
    Optimizer bystander = new RecordingOptimizer("bystander", log, 0);
    OptimizerFramework framework =
        new OptimizerFramework.Builder()
            .add(dependent)
            .dependsOn(changer)
            .add(bystander)
            .dependsOn()
            .add(changer)
            .dependsOn()
            .build();

    framework.optimizeUntilFixedpoint(parse("x"));

    assertThat(
        log, is(equalTo(ImmutableList.of("dependent", "bystander", "changer", "dependent"))));
  }

  @Test
  public void selfDependentOptimizer_runsUntilUnchanged() {
    List<String> log = new ArrayList<>();
    Optimizer a = new RecordingOptimizer("a", log, 3);
    OptimizerFramework framework = new OptimizerFramework.Builder().add(a).dependsOn(a).build();

    framework.optimizeUntilFixedpoint(parse("x"));

    assertThat(log, hasSize(4));
  }

  @Test
  public void optimizerThatAlwaysChanges_isStoppedAtRunLimit() {
    List<String> log = new ArrayList<>();
    Optimizer a = new RecordingOptimizer("a", log, Integer.MAX_VALUE);
    OptimizerFramework framework =
        new OptimizerFramework.Builder().maxRunsPerOptimizer(5).add(a).dependsOn(a).build();

    framework.optimizeUntilFixedpoint(parse("x"));

    assertThat(log, hasSize(5));
  }

  @Test
  public void runLimitOfOneOptimizer_doesNotStopTheOthers() {
    List<String> log = new ArrayList<>();
    Optimizer restless = new RecordingOptimizer("restless", log, Integer.MAX_VALUE);
    Optimizer calm = new RecordingOptimizer("calm", log, 0);
    OptimizerFramework framework =
        new OptimizerFramework.Builder()
            .maxRunsPerOptimizer(3)
            .add(restless)
            .dependsOn(restless)
            .add(calm)
            .dependsOn()
            .build();

    framework.optimizeUntilFixedpoint(parse("x"));

    assertThat(
        log, is(equalTo(ImmutableList.of("restless", "restless", "restless", "calm"))));
  }

  @Test(expected = IllegalArgumentException.class)
  public void addingTheSameOptimizerTwice_fails() {
    Optimizer dce = new DeadCodeElimination();
    new OptimizerFramework.Builder().add(dce).dependsOn().add(dce);
  }

  @Test
  public void deadCodeElimination_reachesFixpoint() {
    Optimizer dce = new DeadCodeElimination();
    OptimizerFramework framework = new OptimizerFramework.Builder().add(dce).dependsOn(dce).build();

    Program result =
        framework.optimizeUntilFixedpoint(
            parse("f <- function() {\n if (TRUE) { return(1) }\n 2\n}\nwhile (FALSE) x"));

    assertThat(
        result.acceptVisitor(new PrettyPrinter()).toString(),
        is(equalTo(String.format("f <- function() {%n\treturn(1)%n}%n"))));
  }
}
