package amc;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class ExpressionTest {

  private static final Tokenizer.Pos POS = new Tokenizer.Pos("/test/file.amc", 0, 0);

  private static Expression parse(String source) throws CompilerException {
    return Expression.parse(source, POS);
  }

  private static void assertErrors(String errorSubstr, String source) {
    CompilerException ex = assertThrows(CompilerException.class, () -> parse(source));
    assertThat(ex).hasMessageThat().contains(errorSubstr);
  }

  @Test
  public void literals() throws CompilerException {
    assertThat(parse("'it\\'s'").<Expression.StringLiteral>cast().value()).isEqualTo("it's");
    assertThat(parse("-12").<Expression.NumberLiteral>cast().intValue()).isEqualTo(-12);
    assertThat(parse("1.5").<Expression.NumberLiteral>cast().isInteger()).isFalse();
    assertThat(parse("true").<Expression.BooleanLiteral>cast().value()).isTrue();
    assertThat(parse("undefined").type()).isEqualTo(Expression.Type.NULL);
  }

  @Test
  public void memberAndIndexPaths() throws CompilerException {
    Expression expr = parse("result.items[0][\"first name\"]");

    assertThat(expr.type()).isEqualTo(Expression.Type.INDEX);
    Expression.Index outer = expr.cast();
    assertThat(outer.index().<Expression.StringLiteral>cast().value()).isEqualTo("first name");

    Expression.Index inner = outer.object().cast();
    assertThat(inner.index().raw()).isEqualTo("0");

    Expression.Member member = inner.object().cast();
    assertThat(member.name()).isEqualTo("items");
    assertThat(member.object().<Expression.Identifier>cast().name()).isEqualTo("result");
  }

  @Test
  public void operatorPrecedence() throws CompilerException {
    Expression expr = parse("a < 1 || b == 'x' && !c");

    Expression.Binary or = expr.cast();
    assertThat(or.op()).isEqualTo(Expression.BinaryOperator.OR);
    assertThat(or.lhs().<Expression.Binary>cast().op())
        .isEqualTo(Expression.BinaryOperator.LESS_THAN);

    Expression.Binary and = or.rhs().cast();
    assertThat(and.op()).isEqualTo(Expression.BinaryOperator.AND);
    assertThat(and.lhs().<Expression.Binary>cast().op())
        .isEqualTo(Expression.BinaryOperator.EQUAL);
    assertThat(and.rhs().type()).isEqualTo(Expression.Type.UNARY);
  }

  @Test
  public void parenthesesOverridePrecedence() throws CompilerException {
    Expression.Binary and = parse("(a || b) && c").cast();

    assertThat(and.op()).isEqualTo(Expression.BinaryOperator.AND);
    assertThat(and.lhs().raw()).isEqualTo("(a || b)");
  }

  @Test
  public void ternariesNestToTheRight() throws CompilerException {
    Expression.Ternary ternary = parse("a ? 'x' : b ? 'y' : 'z'").cast();

    assertThat(ternary.condition().raw()).isEqualTo("a");
    assertThat(ternary.then().raw()).isEqualTo("'x'");
    assertThat(ternary.otherwise().type()).isEqualTo(Expression.Type.TERNARY);
  }

  @Test
  public void objectAndArrayLiterals() throws CompilerException {
    Expression expr = parse("{name: 'n', \"tags\": ['a', 'b',], count: 2, ok}");

    assertThat(expr.type()).isEqualTo(Expression.Type.OBJECT);
    Expression.ObjectLiteral object = expr.cast();
    assertThat(object.asMap().keySet()).containsExactly("name", "tags", "count", "ok").inOrder();
    assertThat(object.get("ok").get().type()).isEqualTo(Expression.Type.IDENTIFIER);
    assertThat(object.isLiteral()).isFalse();

    Expression literal = parse("{name: 'n', tags: ['a', 'b'], count: 2}");
    assertThat(literal.isLiteral()).isTrue();
    assertThat(literal.literalJson().toString())
        .isEqualTo("{\"name\":\"n\",\"tags\":[\"a\",\"b\"],\"count\":2}");
  }

  @Test
  public void rawKeepsSourceText() throws CompilerException {
    assertThat(parse("  user.name  ").raw()).isEqualTo("user.name");
  }

  @Test
  public void positionsFollowTheSource() throws CompilerException {
    Expression.Binary binary = parse("a\n  && b").cast();

    assertThat(binary.rhs().pos().lineNumber()).isEqualTo(1);
    assertThat(binary.rhs().pos().column()).isEqualTo(5);
  }

  @Test
  public void functionCallsAreRejected() {
    assertErrors("function calls are not supported", "foo(1)");
  }

  @Test
  public void malformedTernary() {
    assertErrors("malformed ternary: expected 'a ? b : c'", "a ? b");
  }

  @Test
  public void missingOperand() {
    assertErrors("binary operator '&&' is missing left or right arguments", "a &&");
  }

  @Test
  public void duplicateKeyInLiteralJson() throws CompilerException {
    Expression expr = parse("{a: 1, a: 2}");
    CompilerException ex = assertThrows(CompilerException.class, expr::literalJson);
    assertThat(ex).hasMessageThat().contains("duplicate key 'a'");
  }

  @Test
  public void unmatchedBracket() {
    assertErrors("unmatched '['", "a[0");
  }

  @Test
  public void templateSubstitution() {
    assertErrors("template substitutions are not supported", "`a ${b}`");
  }
}
