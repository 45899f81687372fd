package amc;

import static com.google.common.truth.Truth.assertThat;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class DocumentValidatorTest {

  private static Document parse(String... lines) throws CompilerException {
    return new DocumentParser("/test/file.amc", ".claude", new FunctionRegistry())
        .parse(Arrays.asList(lines).stream().collect(Collectors.joining("\n")));
  }

  // Validates a runtime command declaring RESULT (ref result) on line 2.
  private static ImmutableList<Diagnostic> validate(String... body) throws CompilerException {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    lines.add("<RuntimeCommand name=\"c\" description=\"d\">");
    lines.add(
        "  <RuntimeVar name=\"RESULT\" ref=\"result\"",
        "      shape=\"{status: string, items: {name: string}[]}\"/>");
    lines.add(body);
    lines.add("</RuntimeCommand>");
    return new DocumentValidator(parse(lines.build().toArray(new String[0])))
        .computeDiagnostics();
  }

  @Test
  public void pathsInsideTheShape() throws CompilerException {
    assertThat(
            validate(
                "<p>{result.status} {result.items[0].name} {result.items.length}</p>",
                "<If condition={result.items[1]['name'] == 'x'}><p>y</p></If>"))
        .isEmpty();
  }

  @Test
  public void pathOutsideTheShape() throws CompilerException {
    ImmutableList<Diagnostic> diagnostics = validate("<p>Status: {result.stauts}</p>");

    assertThat(diagnostics).hasSize(1);
    Diagnostic warning = diagnostics.get(0);
    assertThat(warning.isError()).isFalse();
    assertThat(warning.message())
        .isEqualTo(
            "'$RESULT.stauts' is not part of the declared shape of 'result'"
                + " ({status: string, items: {name: string}[]})");
    assertThat(warning.pos().lineNumber()).isEqualTo(3);
    assertThat(warning.related().get().lineNumber()).isEqualTo(1);
  }

  @Test
  public void pathsInCallArguments() throws CompilerException {
    ImmutableList<Diagnostic> diagnostics =
        validate("<Call fn=\"f\" args={{name: result.items.name}}/>");

    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).message()).contains("'$RESULT.items.name'");
  }

  @Test
  public void untypedVariablesAcceptAnyPath() throws CompilerException {
    assertThat(validate("<RuntimeVar name=\"FLAG\"/>", "<p>{result.status} {FLAG.a[2].b}</p>"))
        .isEmpty();
  }

  @Test
  public void unusedVariable() throws CompilerException {
    ImmutableList<Diagnostic> diagnostics =
        validate("<RuntimeVar name=\"UNUSED\"/>", "<p>{result.status}</p>");

    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).message()).isEqualTo("runtime variable 'UNUSED' is never used");
  }

  @Test
  public void outputsCountAsUses() throws CompilerException {
    assertThat(
            validate(
                "<RuntimeVar name=\"ANSWER\"/>",
                "<RuntimeVar name=\"REVIEW\"/>",
                "<Call fn=\"f\" output=\"result\"/>",
                "<AskUser question=\"q\" output=\"ANSWER\">",
                "  <Option value=\"a\" label=\"A\"/>",
                "</AskUser>",
                "<SpawnAgent agent=\"a\" model=\"m\" description=\"d\" prompt=\"p\"",
                "    output=\"REVIEW\"/>"))
        .isEmpty();
  }

  @Test
  public void inertDocumentsAreNotChecked() throws CompilerException {
    Document document = parse("<Command name=\"c\" description=\"d\"><p>{a.b}</p></Command>");

    assertThat(new DocumentValidator(document).computeDiagnostics()).isEmpty();
  }

  @Test
  public void statusHandlerWithoutSpawnedAgent() throws CompilerException {
    ImmutableList<Diagnostic> diagnostics =
        validate("<OnStatus output=\"result\" status=\"SUCCESS\"><p>ok</p></OnStatus>");

    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).isError()).isFalse();
    assertThat(diagnostics.get(0).message())
        .isEqualTo("<OnStatus> checks 'RESULT', which no <SpawnAgent> in this document writes");
  }

  @Test
  public void statusHandlerOnAgentOutput() throws CompilerException {
    assertThat(
            validate(
                "<SpawnAgent agent=\"a\" model=\"m\" description=\"d\" prompt=\"p\"",
                "    output=\"result\"/>",
                "<OnStatus output=\"result\" status=\"ERROR\"><p>retry</p></OnStatus>"))
        .isEmpty();
  }

  @Test
  public void stateReadsAndAssignmentsCountAsUses() throws CompilerException {
    assertThat(
            validate(
                "<RuntimeVar name=\"PLAN\"/>",
                "<ReadState state=\"tasks\" output=\"result\"/>",
                "<Assign var=\"PLAN\" bash=\"cat PLAN.md\"/>"))
        .isEmpty();
  }
}
