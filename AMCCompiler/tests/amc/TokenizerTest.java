package amc;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class TokenizerTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private ImmutableList<Tokenizer.Token> tokenize() throws CompilerException {
    return new Tokenizer("/test/file.amc", file.toString()).tokenize();
  }

  private void assertErrors(String errorSubstr) {
    CompilerException ex = assertThrows(CompilerException.class, this::tokenize);
    assertThat(ex).hasMessageThat().contains(errorSubstr);
  }

  private static void assertText(Tokenizer.Token token, String text) {
    assertThat(token.type()).isEqualTo(Tokenizer.Token.Type.TEXT);
    assertThat(token.<Tokenizer.Text>cast().text()).isEqualTo(text);
  }

  private static Tokenizer.OpenTag assertOpenTag(Tokenizer.Token token, String name) {
    assertThat(token.type()).isEqualTo(Tokenizer.Token.Type.OPEN_TAG);
    Tokenizer.OpenTag tag = token.cast();
    assertThat(tag.name()).isEqualTo(name);
    return tag;
  }

  private static void assertCloseTag(Tokenizer.Token token, String name) {
    assertThat(token.type()).isEqualTo(Tokenizer.Token.Type.CLOSE_TAG);
    assertThat(token.<Tokenizer.CloseTag>cast().name()).isEqualTo(name);
  }

  @Test
  public void textAndTags() throws CompilerException {
    println("<p>Hello <b>world</b></p>");

    ImmutableList<Tokenizer.Token> tokens = tokenize();

    assertThat(tokens).hasSize(7);
    assertOpenTag(tokens.get(0), "p");
    assertText(tokens.get(1), "Hello ");
    assertOpenTag(tokens.get(2), "b");
    assertText(tokens.get(3), "world");
    assertCloseTag(tokens.get(4), "b");
    assertCloseTag(tokens.get(5), "p");
    assertText(tokens.get(6), "\n\n");
  }

  @Test
  public void attributeKinds() throws CompilerException {
    println("<Loop max={3} counter=\"i\" ordered/>");

    ImmutableList<Tokenizer.Token> tokens = tokenize();

    Tokenizer.OpenTag tag = assertOpenTag(tokens.get(0), "Loop");
    assertThat(tag.selfClosing()).isTrue();
    assertThat(tag.attributes()).hasSize(3);

    Tokenizer.Attribute max = tag.attributes().get(0);
    assertThat(max.name()).isEqualTo("max");
    assertThat(max.kind()).isEqualTo(Tokenizer.Attribute.Kind.EXPRESSION);
    assertThat(max.value()).isEqualTo("3");

    Tokenizer.Attribute counter = tag.attributes().get(1);
    assertThat(counter.kind()).isEqualTo(Tokenizer.Attribute.Kind.STRING);
    assertThat(counter.value()).isEqualTo("i");

    Tokenizer.Attribute ordered = tag.attributes().get(2);
    assertThat(ordered.kind()).isEqualTo(Tokenizer.Attribute.Kind.FLAG);
    assertThat(ordered.value()).isEqualTo("true");
  }

  @Test
  public void nestedBracesInExpressionAttribute() throws CompilerException {
    println("<Call fn=\"f\" args={{a: {b: \"}\"}}}/>");

    Tokenizer.OpenTag tag = assertOpenTag(tokenize().get(0), "Call");
    assertThat(tag.attributes().get(1).value()).isEqualTo("{a: {b: \"}\"}}");
  }

  @Test
  public void interpolation() throws CompilerException {
    println("<p>Value: {result.status}</p>");

    ImmutableList<Tokenizer.Token> tokens = tokenize();

    assertText(tokens.get(1), "Value: ");
    assertThat(tokens.get(2).type()).isEqualTo(Tokenizer.Token.Type.INTERPOLATION);
    assertThat(tokens.get(2).<Tokenizer.Interpolation>cast().source()).isEqualTo("result.status");
    assertThat(tokens.get(2).pos().column()).isEqualTo(11);
  }

  @Test
  public void escapes() throws CompilerException {
    println("\\{a\\} \\<b\\> \\\\ \\n");

    ImmutableList<Tokenizer.Token> tokens = tokenize();

    assertThat(tokens).hasSize(1);
    assertText(tokens.get(0), "{a} <b> \\ \\n\n\n");
  }

  @Test
  public void comments() throws CompilerException {
    println("a<!-- <not a tag> -->b{/* {not} an expression */}c");

    ImmutableList<Tokenizer.Token> tokens = tokenize();

    assertThat(tokens).hasSize(1);
    assertText(tokens.get(0), "abc\n\n");
  }

  @Test
  public void rawTextElements() throws CompilerException {
    println("<Function name=\"f\">");
    println("  if (a < b) { return {x: 1}; }");
    println("</Function>");

    ImmutableList<Tokenizer.Token> tokens = tokenize();

    assertOpenTag(tokens.get(0), "Function");
    assertThat(tokens.get(1).<Tokenizer.Text>cast().raw()).isTrue();
    assertText(tokens.get(1), "\n  if (a < b) { return {x: 1}; }\n");
    assertCloseTag(tokens.get(2), "Function");
  }

  @Test
  public void positions() throws CompilerException {
    println("<p>");
    println("  <b>x</b>");
    println("</p>");

    ImmutableList<Tokenizer.Token> tokens = tokenize();

    Tokenizer.OpenTag bold = assertOpenTag(tokens.get(2), "b");
    assertThat(bold.pos().lineNumber()).isEqualTo(1);
    assertThat(bold.pos().column()).isEqualTo(3);
    assertThat(bold.pos().display()).isEqualTo("/test/file.amc@2:4");
  }

  @Test
  public void strayAngleBracket() {
    println("a < b");
    assertErrors("unexpected '<': use \\< for a literal angle bracket");
  }

  @Test
  public void strayBrace() {
    println("a } b");
    assertErrors("unexpected '}': use \\} for a literal brace");
  }

  @Test
  public void duplicateAttribute() {
    println("<p a=\"1\" a=\"2\">x</p>");
    assertErrors("duplicate attribute 'a' on <p>");
  }

  @Test
  public void unfinishedTag() {
    println("<p a=\"1\"");
    assertErrors("got unexpected EOF: unfinished tag");
  }

  @Test
  public void unterminatedExpression() {
    println("<p>{a.b</p>");
    assertErrors("unterminated expression: missing '}'");
  }

  @Test
  public void unclosedRawText() {
    println("<pre>text");
    assertErrors("unclosed raw text element <pre>");
  }
}
