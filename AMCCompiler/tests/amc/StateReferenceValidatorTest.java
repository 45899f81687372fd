package amc;

import static com.google.common.truth.Truth.assertThat;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class StateReferenceValidatorTest {

  private static Document parse(String file, String... lines) throws CompilerException {
    return new DocumentParser(file, ".claude", new FunctionRegistry())
        .parse(Arrays.asList(lines).stream().collect(Collectors.joining("\n")));
  }

  private static final String[] TASKS = {
    "<State name=\"tasks\" database=\".state/tasks.db\">",
    "  <Field name=\"phase\" default=\"plan\" values={['plan', 'build']}/>",
    "  <Field name=\"owner\"/>",
    "</State>"
  };

  private static ImmutableList<Diagnostic> validate(String... body) throws CompilerException {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    lines.add("<RuntimeCommand name=\"main\" description=\"d\">");
    lines.add("  <RuntimeVar name=\"OUT\"/>");
    lines.add(body);
    lines.add("</RuntimeCommand>");
    Document command = parse("/test/main.amc", lines.build().toArray(new String[0]));
    Document tasks = parse("/test/tasks.amc", TASKS);
    return new StateReferenceValidator(ImmutableList.of(tasks, command)).validate(command);
  }

  @Test
  public void knownStateAndFields() throws CompilerException {
    assertThat(
            validate(
                "<ReadState state=\"tasks\" field=\"phase\" output=\"OUT\"/>",
                "<WriteState state=\"tasks\" merge={{phase: 'build', owner: OUT}}/>"))
        .isEmpty();
  }

  @Test
  public void unknownState() throws CompilerException {
    ImmutableList<Diagnostic> diagnostics =
        validate("<ReadState state=\"session\" field=\"phase\" output=\"OUT\"/>");

    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).isError()).isFalse();
    assertThat(diagnostics.get(0).message())
        .isEqualTo("no state named 'session' is declared in this build");
  }

  @Test
  public void unknownField() throws CompilerException {
    ImmutableList<Diagnostic> diagnostics =
        validate("<WriteState state=\"tasks\" field=\"stage\" value=\"x\"/>");

    assertThat(diagnostics).hasSize(1);
    Diagnostic warning = diagnostics.get(0);
    assertThat(warning.message()).isEqualTo("state 'tasks' has no field 'stage'");
    assertThat(warning.pos().file()).isEqualTo("/test/main.amc");
    assertThat(warning.related().get().file()).isEqualTo("/test/tasks.amc");
  }

  @Test
  public void literalOutsideTheAllowedValues() throws CompilerException {
    ImmutableList<Diagnostic> diagnostics =
        validate(
            "<WriteState state=\"tasks\" field=\"phase\" value=\"ship\"/>",
            "<WriteState state=\"tasks\" field=\"phase\" value={OUT}/>");

    assertThat(diagnostics).hasSize(1);
    assertThat(diagnostics.get(0).message())
        .isEqualTo(
            "'ship' is not an allowed value of field 'phase'; expected one of [plan, build]");
    assertThat(diagnostics.get(0).related().get().lineNumber()).isEqualTo(1);
  }
}
