package roptim.optimize;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAnd;
import static java.lang.String.format;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import org.junit.Before;
import org.junit.Test;
import roptim.ast.Block;
import roptim.ast.Program;
import roptim.ast.Statement;
import roptim.lexer.Lexer;
import roptim.parser.Parser;
import roptim.util.Either;
import roptim.util.PrettyPrinter;

public class DeadCodeEliminationTest {

  private DeadCodeElimination dce;

  @Before
  public void setup() {
    dce = new DeadCodeElimination();
  }

  private static Program parse(String source) {
    return new Parser(new Lexer(source)).parse();
  }

  private static Statement parseStatement(String source) {
    return parse(source).statements.get(0);
  }

  private static String print(Program program) {
    return program.acceptVisitor(new PrettyPrinter()).toString();
  }

  private static String print(Statement statement) {
    return statement.acceptVisitor(new PrettyPrinter()).toString();
  }

  @Test
  public void statementsAfterReturn_areDropped() {
    Block block = (Block) parseStatement("{ return(a); b <- 24; return(b) }");
    assertThat(print(dce.rewriteBlock(block)), is(format("{%n\treturn(a)%n}")));
  }

  @Test
  public void whileFalse_isRemoved() {
    Either<Statement, Block> result =
        dce.rewriteStatement(parseStatement("while (FALSE) { i <- i + 1 }"));
    assertThat(result.s, isEmpty());
    assertThat(result.t.get().isEmpty(), is(true));

    OptimizationResult program = dce.optimize(parse("a\nwhile (FALSE) { i <- i + 1 }\nb"));
    assertThat(print(program.program), is(format("a%nb%n")));
    assertThat(program.changed, is(true));
  }

  @Test
  public void ifFalse_isReplacedByElseBranch() {
    Block block = (Block) parseStatement("{ if (FALSE) { return(25) } else { return(a) } }");
    assertThat(print(dce.rewriteBlock(block)), is(format("{%n\treturn(a)%n}")));
  }

  @Test
  public void ifTrue_isSplicedAndTerminatorInBranchTruncatesEnclosingBlock() {
    Block block =
        (Block) parseStatement("{ if (TRUE) { return(1) } else { return(2) }; return(3) }");
    assertThat(print(dce.rewriteBlock(block)), is(format("{%n\treturn(1)%n}")));
  }

  @Test
  public void statementsAfterBreak_areDroppedInLoopBody() {
    Program program = parse("while (i > 0) { break; i <- i - 1 }");
    assertThat(
        print(dce.optimize(program).program), is(format("while (i > 0) {%n\tbreak%n}%n")));
  }

  @Test
  public void nothingToRemove_unchanged() {
    String source =
        format(
            "x <- 1%n"
                + "if (x > 0) {%n"
                + "\tprint(x)%n"
                + "} else {%n"
                + "\tx <- -x%n"
                + "}%n"
                + "while (x < 10) {%n"
                + "\tx <- x + 1%n"
                + "}%n");
    OptimizationResult result = dce.optimize(parse(source));
    assertThat(result.changed, is(false));
    assertThat(print(result.program), is(source));
  }

  @Test
  public void ifFalseWithoutElse_isRemoved() {
    OptimizationResult result = dce.optimize(parse("a\nif (FALSE) { b }\nc"));
    assertThat(print(result.program), is(format("a%nc%n")));
    assertThat(result.changed, is(true));
  }

  @Test
  public void ifTrueWithoutBraces_branchIsSpliced() {
    OptimizationResult result = dce.optimize(parse("if (TRUE) a else b\nc"));
    assertThat(print(result.program), is(format("a%nc%n")));
  }

  @Test
  public void whileTrue_isKept() {
    String source = format("while (TRUE) {%n\tbreak%n}%n");
    OptimizationResult result = dce.optimize(parse(source));
    assertThat(result.changed, is(false));
    assertThat(print(result.program), is(source));
  }

  @Test
  public void nonLiteralConditions_areNotEvaluated() {
    String source = format("if (T) {%n\ta%n}%nif (!FALSE) {%n\tb%n}%nwhile (1 == 2) { }%n");
    OptimizationResult result = dce.optimize(parse(source));
    assertThat(result.changed, is(false));
    assertThat(print(result.program), is(source));
  }

  @Test
  public void parenthesizedLiteral_isEvaluated() {
    OptimizationResult result = dce.optimize(parse("if ((FALSE)) a else b"));
    assertThat(print(result.program), is(format("b%n")));
  }

  @Test
  public void elseIfChain_collapsesToTakenBranch() {
    OptimizationResult result =
        dce.optimize(parse("if (x) { a } else if (FALSE) { b } else if (TRUE) { c } else { d }"));
    assertThat(print(result.program), is(format("if (x) {%n\ta%n} else {%n\tc%n}%n")));
  }

  @Test
  public void nestedBlocks_areFlattenedAndTruncated() {
    OptimizationResult result = dce.optimize(parse("{ a; { b; { next; c }; d }; e }\nf"));
    assertThat(print(result.program), is(format("a%nb%nnext%n")));
  }

  @Test
  public void topLevelTerminator_truncatesProgram() {
    OptimizationResult result = dce.optimize(parse("a\nreturn(1)\nb\nc"));
    assertThat(print(result.program), is(format("a%nreturn(1)%n")));
    assertThat(result.changed, is(true));
  }

  @Test
  public void functionBody_isRewritten() {
    OptimizationResult result =
        dce.optimize(parse("f <- function(x) {\n return(x)\n print(x)\n}"));
    assertThat(print(result.program), is(format("f <- function(x) {%n\treturn(x)%n}%n")));
    assertThat(result.changed, is(true));
  }

  @Test
  public void functionsNestedInExpressions_areRewritten() {
    OptimizationResult result =
        dce.optimize(
            parse(
                "lapply(xs, function(x) { if (FALSE) x })\n"
                    + "g <- function(a = function() { next; b }) a\n"
                    + "return(function() { return(1); 2 })"));
    assertThat(
        print(result.program),
        is(
            format(
                "lapply(xs, function(x) { })%n"
                    + "g <- function(a = function() {%n"
                    + "\tnext%n"
                    + "}) {%n"
                    + "\ta%n"
                    + "}%n"
                    + "return(function() {%n"
                    + "\treturn(1)%n"
                    + "})%n")));
  }

  @Test
  public void conditionContainingFunction_isRewritten() {
    OptimizationResult result = dce.optimize(parse("if (f(function() { break; 1 })) a"));
    assertThat(
        print(result.program),
        is(format("if (f(function() {%n\tbreak%n})) {%n\ta%n}%n")));
  }

  @Test
  public void repeatAndForBodies_areRewritten() {
    OptimizationResult result =
        dce.optimize(parse("repeat { break; a }\nfor (i in xs) { if (FALSE) b; next; c }"));
    assertThat(
        print(result.program),
        is(format("repeat {%n\tbreak%n}%nfor (i in xs) {%n\tnext%n}%n")));
  }

  @Test
  public void loopWhoseBodyBecomesEmpty_isKept() {
    OptimizationResult result = dce.optimize(parse("while (x) { if (FALSE) { a } }"));
    assertThat(print(result.program), is(format("while (x) { }%n")));
    assertThat(result.changed, is(true));
  }

  @Test
  public void unchangedExpressionStatements_keepTheirIdentity() {
    Statement statement = parseStatement("f(x + 1, y = g(2))");
    Either<Statement, Block> result = dce.rewriteStatement(statement);
    assertThat(result.s, isPresentAnd(sameInstance(statement)));
  }

  @Test
  public void emptyProgram_unchanged() {
    OptimizationResult result = dce.optimize(parse(""));
    assertThat(result.changed, is(false));
    assertThat(result.program.statements, is(empty()));
  }

  @Test
  public void emptyBlockRemoval_countsAsChange() {
    OptimizationResult result = dce.optimize(parse("a\n{ }"));
    assertThat(print(result.program), is(format("a%n")));
    assertThat(result.changed, is(true));
  }

  @Test
  public void secondRun_reportsNoChange() {
    Program once =
        dce.optimize(parse("if (TRUE) { a; return(1) } else b\nc\nwhile (FALSE) d")).program;
    OptimizationResult twice = dce.optimize(once);
    assertThat(twice.changed, is(false));
    assertThat(print(twice.program), is(print(once)));
    assertThat(print(once), is(format("a%nreturn(1)%n")));
  }
}
