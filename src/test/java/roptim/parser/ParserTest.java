package roptim.parser;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import org.junit.Test;
import roptim.RoptimError;
import roptim.ast.Block;
import roptim.ast.Expression;
import roptim.ast.Program;
import roptim.ast.Statement;
import roptim.lexer.Lexer;
import roptim.util.PrettyPrinter;

public class ParserTest {

  private static Program parse(String input) {
    return new Parser(new Lexer(input)).parse();
  }

  private static String reprint(String input) {
    return parse(input).acceptVisitor(new PrettyPrinter()).toString();
  }

  private static void assertDoesNotParse(String input) {
    try {
      parse(input);
    } catch (RoptimError e) {
      return;
    }
    throw new AssertionError("Parsed invalid input '" + input + "'");
  }

  @Test
  public void emptyInput_emptyProgram() {
    assertThat(parse("").statements, is(empty()));
    assertThat(parse("\n\n;\n").statements, is(empty()));
  }

  @Test
  public void newlinesAndSemicolonsSeparateStatements() {
    Program p = parse("a\nb; c\n\n d");
    assertThat(p.statements, hasSize(4));
  }

  @Test
  public void twoExpressionsOnOneLine_fails() {
    assertDoesNotParse("a b");
    assertDoesNotParse("{ a b }");
  }

  @Test
  public void newlineWithinParentheses_isIgnored() {
    Program p = parse("f(a,\n  b)\n(1 +\n 2)");
    assertThat(p.statements, hasSize(2));
  }

  @Test
  public void trailingOperator_continuesOnNextLine() {
    Program p = parse("x <- 1 +\n 2");
    assertThat(p.statements, hasSize(1));
  }

  @Test
  public void newlineBeforeOperator_endsStatement() {
    Program p = parse("x <- 1\n-2");
    assertThat(p.statements, hasSize(2));
  }

  @Test
  public void ifWithoutBraces_bodyIsWrappedInBlock() {
    Program p = parse("if (a) b else c");
    Statement.If ifStatement = (Statement.If) p.statements.get(0);
    assertThat(ifStatement.then.statements, hasSize(1));
    assertThat(ifStatement.else_.isPresent(), is(true));
    assertThat(ifStatement.else_.get().statements, hasSize(1));
  }

  @Test
  public void elseOnNextLine_belongsToIf() {
    Program p = parse("{\n if (a) {\n b\n }\n else {\n c\n }\n}");
    Block block = (Block) p.statements.get(0);
    assertThat(block.statements, hasSize(1));
    assertThat(((Statement.If) block.statements.get(0)).else_.isPresent(), is(true));
  }

  @Test
  public void returnCall_isTerminatorWithPayload() {
    Program p = parse("return(x + 1)");
    Statement.Terminator terminator = (Statement.Terminator) p.statements.get(0);
    assertThat(terminator.kind, is(Statement.Terminator.Kind.RETURN));
    assertThat(terminator.payload.isPresent(), is(true));
  }

  @Test
  public void returnWithoutArgument_isTerminatorWithoutPayload() {
    Statement.Terminator terminator = (Statement.Terminator) parse("return()").statements.get(0);
    assertThat(terminator.payload.isPresent(), is(false));
  }

  @Test
  public void returnNotCalled_isVariable() {
    Statement statement = parse("return").statements.get(0);
    assertThat(statement, is(instanceOf(Statement.ExpressionStatement.class)));
  }

  @Test
  public void breakAndNext_areTerminators() {
    Program p = parse("repeat { next; break }");
    Statement.Repeat repeat = (Statement.Repeat) p.statements.get(0);
    assertThat(
        ((Statement.Terminator) repeat.body.statements.get(0)).kind,
        is(Statement.Terminator.Kind.NEXT));
    assertThat(
        ((Statement.Terminator) repeat.body.statements.get(1)).kind,
        is(Statement.Terminator.Kind.BREAK));
  }

  @Test
  public void functionDefinition_isExpression() {
    Program p = parse("f <- function(x, y = 2) {\n return(x)\n}");
    Expression.BinaryOperator assignment =
        (Expression.BinaryOperator)
            ((Statement.ExpressionStatement) p.statements.get(0)).expression;
    assertThat(assignment.op, is(Expression.BinOp.LEFT_ASSIGN));
    Expression.Function function = (Expression.Function) assignment.right;
    assertThat(function.parameters, hasSize(2));
    assertThat(function.parameters.get(1).defaultValue.isPresent(), is(true));
    assertThat(function.body.statements, hasSize(1));
  }

  @Test
  public void namedArguments() {
    Expression.Call call =
        (Expression.Call)
            ((Statement.ExpressionStatement) parse("f(1, n = 2)").statements.get(0)).expression;
    assertThat(call.arguments.get(0).name.isPresent(), is(false));
    assertThat(call.arguments.get(1).name.get(), is("n"));
  }

  @Test
  public void operatorPrecedence() {
    assertThat(reprint("(1 + 2) * 3"), is(String.format("(1 + 2) * 3%n")));
    assertThat(reprint("1 + (2 * 3)"), is(String.format("1 + 2 * 3%n")));
    assertThat(reprint("a <- (b <- c)"), is(String.format("a <- b <- c%n")));
    assertThat(reprint("(2 ^ 3) ^ 4"), is(String.format("(2 ^ 3) ^ 4%n")));
    assertThat(reprint("-2 ^ 2"), is(String.format("-2 ^ 2%n")));
    assertThat(reprint("(-2) ^ 2"), is(String.format("(-2) ^ 2%n")));
    assertThat(reprint("!(a == b)"), is(String.format("!a == b%n")));
    assertThat(reprint("(!a) == b"), is(String.format("(!a) == b%n")));
    assertThat(reprint("a - (b - c)"), is(String.format("a - (b - c)%n")));
  }

  @Test
  public void unbalancedBraces_fail() {
    assertDoesNotParse("{ a");
    assertDoesNotParse("a }");
    assertDoesNotParse("f(a");
    assertDoesNotParse("if (a {}");
  }

  @Test
  public void danglingElse_fails() {
    assertDoesNotParse("else { a }");
  }

  @Test
  public void forLoop() {
    Statement.For loop = (Statement.For) parse("for (i in xs) print(i)").statements.get(0);
    assertThat(loop.variable, is("i"));
    assertThat(loop.body.statements, hasSize(1));
  }
}
