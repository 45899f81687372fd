package amc;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class RuntimeTransformTest {

  private static Document parse(String... lines) throws CompilerException {
    return new DocumentParser("/test/deploy.amc", ".claude", new FunctionRegistry())
        .parse(Arrays.asList(lines).stream().collect(Collectors.joining("\n")));
  }

  // Wraps body lines in a runtime command declaring RESULT (ref result) and FLAG.
  private static Document parseBody(String... body) throws CompilerException {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    lines.add("<RuntimeCommand name=\"deploy\" description=\"Deploy\">");
    lines.add(
        "  <RuntimeVar name=\"RESULT\" ref=\"result\"",
        "      shape=\"{status: string, count: number}\"/>");
    lines.add("  <RuntimeVar name=\"FLAG\"/>");
    lines.add(body);
    lines.add("</RuntimeCommand>");
    return parse(lines.build().toArray(new String[0]));
  }

  private static void assertErrors(String errorSubstr, String... body) {
    CompilerException ex = assertThrows(CompilerException.class, () -> parseBody(body));
    assertThat(ex).hasMessageThat().contains(errorSubstr);
  }

  // The body without variable declarations.
  private static ImmutableList<Block> statements(Document document) {
    return document
        .body()
        .stream()
        .filter(b -> b.type() != Block.Type.VARIABLE_DECLARATION)
        .collect(ImmutableList.toImmutableList());
  }

  private static RuntimeExpression condition(String expression) throws CompilerException {
    Document document = parseBody("<If condition={" + expression + "}><p>x</p></If>");
    return statements(document).get(0).<Block.Conditional>cast().condition();
  }

  @Test
  public void runtimeDetection() throws CompilerException {
    assertThat(parse("<RuntimeCommand name=\"a\" description=\"d\"/>").runtime()).isTrue();
    assertThat(parse("<Command name=\"a\" description=\"d\"><p>x</p></Command>").runtime())
        .isFalse();
    assertThat(
            parse(
                    "<Command name=\"a\" description=\"d\">",
                    "  <div><Return status=\"SUCCESS\"/></div>",
                    "</Command>")
                .runtime())
        .isTrue();
  }

  @Test
  public void variableDeclarations() throws CompilerException {
    Document document = parseBody();

    Block.VariableDeclaration result = document.body().get(0).cast();
    assertThat(result.name()).isEqualTo("RESULT");
    assertThat(result.ref()).isEqualTo("result");
    assertThat(result.shape().toString()).isEqualTo("{status: string, count: number}");

    Block.VariableDeclaration flag = document.body().get(1).cast();
    assertThat(flag.ref()).isEqualTo("FLAG");
    assertThat(flag.shape()).isEqualTo(Shape.any());
  }

  @Test
  public void comparison() throws CompilerException {
    RuntimeExpression expr = condition("result.status == 'ok'");

    assertThat(expr.type()).isEqualTo(RuntimeExpression.Type.COMPARISON);
    assertThat(expr.description()).isEqualTo("$RESULT.status equals 'ok'");
    assertThat(expr.filter(RuntimeExpression.FilterMode.ABSOLUTE))
        .isEqualTo("$RESULT.status == \"ok\"");
    assertThat(expr.filter(RuntimeExpression.FilterMode.RELATIVE)).isEqualTo(".status == \"ok\"");
    assertThat(expr.variables()).containsExactly("RESULT");
  }

  @Test
  public void logical() throws CompilerException {
    RuntimeExpression expr = condition("FLAG && !(result.count >= 3)");

    assertThat(expr.description()).isEqualTo("$FLAG AND (NOT $RESULT.count is at least 3)");
    assertThat(expr.filter(RuntimeExpression.FilterMode.ABSOLUTE))
        .isEqualTo("($FLAG) and (($RESULT.count >= 3) | not)");
    assertThat(expr.variables()).containsExactly("FLAG", "RESULT").inOrder();
  }

  @Test
  public void ternary() throws CompilerException {
    RuntimeExpression expr = condition("result.count > 1 ? 'many' : 'one'");

    assertThat(expr.description())
        .isEqualTo("if $RESULT.count is greater than 1 then 'many' else 'one' end");
    assertThat(expr.shellValue())
        .isEqualTo(
            "$(echo \"$RESULT\" | jq -r 'if .count > 1 then \"many\" else \"one\" end')");
  }

  @Test
  public void indexPaths() throws CompilerException {
    RuntimeExpression expr = condition("result['status'] != FLAG[0]");

    assertThat(expr.description()).isEqualTo("$RESULT.status does not equal $FLAG[0]");
    assertThat(expr.shellValue())
        .isEqualTo(
            "$(jq -n -r --argjson FLAG \"$FLAG\" --argjson RESULT \"$RESULT\""
                + " '$RESULT.status != $FLAG[0]')");
  }

  @Test
  public void callLowering() throws CompilerException {
    Document document =
        parseBody(
            "<Function name=\"check\" params=\"{env: string}\">",
            "  return {status: 'ok', count: 1};",
            "</Function>",
            "<Call fn=\"check\" args={{env: 'prod', previous: result.status}} output=\"result\"/>");

    assertThat(document.functions()).hasSize(1);
    FunctionDescriptor check = document.functions().get(0);
    assertThat(check.id()).isEqualTo("check");
    assertThat(check.body()).isEqualTo("return {status: 'ok', count: 1};");
    assertThat(check.sourceFile()).isEqualTo("/test/deploy.amc");

    Block.RuntimeCall call = statements(document).get(0).cast();
    assertThat(call.functionId()).isEqualTo("check");
    assertThat(call.argumentNames()).containsExactly("env", "previous").inOrder();
    assertThat(call.argumentValues().get(1).description()).isEqualTo("$RESULT.status");
    assertThat(call.output()).hasValue("RESULT");
  }

  @Test
  public void outputByNameOrExpression() throws CompilerException {
    Document document =
        parseBody(
            "<Call fn=\"a\" output=\"RESULT\"/>",
            "<Call fn=\"b\" output={result}/>");

    assertThat(statements(document).get(0).<Block.RuntimeCall>cast().output()).hasValue("RESULT");
    assertThat(statements(document).get(1).<Block.RuntimeCall>cast().output()).hasValue("RESULT");
  }

  @Test
  public void conditionalWithElse() throws CompilerException {
    Document document =
        parseBody(
            "<If condition={result.status == 'ok'}>",
            "  <p>All good: {result.count}</p>",
            "</If>",
            "<Else>",
            "  <Return status=\"ERROR\" message=\"failed\"/>",
            "</Else>");

    ImmutableList<Block> statements = statements(document);
    assertThat(statements).hasSize(1);
    Block.Conditional conditional = statements.get(0).cast();
    assertThat(conditional.thenBlocks()).hasSize(1);
    assertThat(conditional.hasElse()).isTrue();

    Block.Return ret = conditional.elseBlocks().get(0).cast();
    assertThat(ret.status()).hasValue(Block.ReturnStatus.ERROR);
    assertThat(ret.message()).hasValue("failed");
  }

  @Test
  public void breakTakesTheGuardingConditions() throws CompilerException {
    Document document =
        parseBody(
            "<Loop max={3} counter=\"i\">",
            "  <If condition={FLAG}>",
            "    <If condition={result.status == 'done'}>",
            "      <Break message=\"finished\"/>",
            "    </If>",
            "  </If>",
            "</Loop>");

    Block.Loop loop = statements(document).get(0).cast();
    assertThat(loop.max()).isEqualTo(3);
    assertThat(loop.counter()).hasValue("i");
    assertThat(loop.exitCondition().get().description())
        .isEqualTo("$FLAG AND $RESULT.status equals 'done'");
  }

  @Test
  public void breakInElseNegatesTheCondition() throws CompilerException {
    Document document =
        parseBody(
            "<Loop max={2}>",
            "  <If condition={FLAG}><p>again</p></If>",
            "  <Else><Break/></Else>",
            "</Loop>");

    Block.Loop loop = statements(document).get(0).cast();
    assertThat(loop.exitCondition().get().description()).isEqualTo("NOT $FLAG");
  }

  @Test
  public void breakWithExplicitCondition() throws CompilerException {
    Document document =
        parseBody(
            "<If condition={FLAG}>",
            "  <Loop max={5}>",
            "    <Break when={result.count > 2}/>",
            "  </Loop>",
            "</If>");

    Block.Conditional conditional = statements(document).get(0).cast();
    Block.Loop loop = conditional.thenBlocks().get(0).cast();
    assertThat(loop.exitCondition().get().description())
        .isEqualTo("$RESULT.count is greater than 2");
  }

  @Test
  public void askUser() throws CompilerException {
    Document document =
        parseBody(
            "<AskUser question=\"Continue?\" header=\"Confirm\" output=\"FLAG\" multiSelect>",
            "  <Option value=\"yes\" label=\"Yes\" description=\"Keep going\"/>",
            "  <Option value=\"no\" label=\"No\"/>",
            "</AskUser>");

    Block.AskUser ask = statements(document).get(0).cast();
    assertThat(ask.question()).isEqualTo("Continue?");
    assertThat(ask.header()).hasValue("Confirm");
    assertThat(ask.multiSelect()).isTrue();
    assertThat(ask.output()).isEqualTo("FLAG");
    assertThat(ask.options()).hasSize(2);
    assertThat(ask.options().get(1).description()).isEmpty();
  }

  @Test
  public void spawnAgentWithInput() throws CompilerException {
    Document document =
        parseBody(
            "<SpawnAgent agent=\"reviewer\" model=\"sonnet\" description=\"Review\"",
            "    input={{status: result.status, mode: 'strict'}} output=\"FLAG\"/>");

    Block.SpawnAgent spawn = statements(document).get(0).cast();
    assertThat(spawn.agent()).isEqualTo("reviewer");
    assertThat(spawn.prompt()).isEmpty();
    assertThat(spawn.input().stream().map(Block.InputField::name).collect(Collectors.toList()))
        .containsExactly("status", "mode")
        .inOrder();
    assertThat(spawn.output()).hasValue("FLAG");
    assertThat(spawn.loadFromFile()).isEmpty();
  }

  @Test
  public void spawnAgentLoadFromFile() throws CompilerException {
    Document document =
        parseBody(
            "<SpawnAgent agent=\"reviewer\" model=\"sonnet\" description=\"Review\"",
            "    prompt=\"Go\" loadFromFile/>",
            "<SpawnAgent agent=\"reviewer\" model=\"sonnet\" description=\"Review\"",
            "    prompt=\"Go\" loadFromFile=\"custom/reviewer.md\"/>");

    ImmutableList<Block> statements = statements(document);
    assertThat(statements.get(0).<Block.SpawnAgent>cast().loadFromFile())
        .hasValue(".claude/agents/reviewer.md");
    assertThat(statements.get(1).<Block.SpawnAgent>cast().loadFromFile())
        .hasValue("custom/reviewer.md");
  }

  @Test
  public void inertDocumentsKeepInterpolationsAsText() throws CompilerException {
    Document document =
        parse(
            "<Command name=\"c\" description=\"d\">",
            "  <p>Hello {name} and {'literal'}</p>",
            "</Command>");

    Block.Paragraph paragraph = document.body().get(0).cast();
    assertThat(paragraph.children()).hasSize(1);
    assertThat(paragraph.children().get(0).<Inline.Text>cast().value())
        .isEqualTo("Hello name and literal");
  }

  @Test
  public void undeclaredVariable() {
    assertErrors(
        "'missing' is not a declared runtime variable", "<If condition={missing}><p>x</p></If>");
  }

  @Test
  public void variableDeclaredTwice() {
    assertErrors("runtime variable 'FLAG' is declared twice", "<RuntimeVar name=\"FLAG\"/>");
  }

  @Test
  public void breakOutsideLoop() {
    assertErrors("<Break> is only valid inside a <Loop>", "<Break/>");
  }

  @Test
  public void twoBreaks() {
    assertErrors(
        "a <Loop> may contain at most one <Break>",
        "<Loop max={2}>",
        "  <If condition={FLAG}><Break/></If>",
        "  <Break/>",
        "</Loop>");
  }

  @Test
  public void loopMaxMustBePositive() {
    assertErrors("max must be at least 1", "<Loop max={0}><p>x</p></Loop>");
  }

  @Test
  public void spawnAgentPromptAndInput() {
    assertErrors(
        "<SpawnAgent> accepts only one of 'prompt' and 'input'",
        "<SpawnAgent agent=\"a\" model=\"m\" description=\"d\" prompt=\"p\" input={{x: 1}}/>");
  }

  @Test
  public void spawnAgentWithoutPromptOrInput() {
    assertErrors(
        "<SpawnAgent> requires either 'prompt' or 'input'",
        "<SpawnAgent agent=\"a\" model=\"m\" description=\"d\"/>");
  }

  @Test
  public void spawnAgentInputKeysAreUnique() {
    assertErrors(
        "duplicate key 'diff'",
        "<SpawnAgent agent=\"a\" model=\"m\" description=\"d\"",
        "    input={{diff: FLAG, diff: 'x'}}/>");
  }

  @Test
  public void unsupportedRuntimeExpression() {
    assertErrors(
        "unsupported runtime expression '{a: FLAG}'", "<If condition={{a: FLAG}}><p>x</p></If>");
  }

  @Test
  public void functionCallInCondition() {
    assertErrors("function calls are not supported", "<If condition={check(FLAG)}><p>x</p></If>");
  }

  @Test
  public void outputMustBeDeclared() {
    assertErrors(
        "output of <Call> must name a declared runtime variable",
        "<Call fn=\"a\" output=\"OTHER\"/>");
  }

  @Test
  public void askUserNeedsOptions() {
    assertErrors(
        "<AskUser> requires at least one <Option>",
        "<AskUser question=\"q\" output=\"FLAG\"></AskUser>");
  }

  @Test
  public void functionDeclaredTwice() {
    assertErrors(
        "function 'f' is declared twice",
        "<Function name=\"f\">return 1;</Function>",
        "<Function name=\"f\">return 2;</Function>");
  }

  @Test
  public void reservedFunctionNames() {
    assertErrors(
        "function name 'delete' is reserved in the runtime module",
        "<Function name=\"delete\">return 1;</Function>");
    assertErrors(
        "function name 'fs' is reserved in the runtime module",
        "<Function name=\"fs\">return 1;</Function>");
  }

  @Test
  public void elseWithoutIf() {
    assertErrors("<Else> is only valid immediately after an <If>", "<Else><p>x</p></Else>");
  }

  @Test
  public void assignTargets() throws CompilerException {
    Document document =
        parseBody(
            "<Assign var=\"result\" bash=\"cat out.json\"/>",
            "<Assign var={FLAG} env=\"CI\"/>",
            "<Assign var=\"PLAIN\" file=\"notes.md\" optional comment=\"Notes\"/>");

    ImmutableList<Block> statements = statements(document);
    Block.Assignment byRef = statements.get(0).<Block.Assign>cast().assignments().get(0);
    assertThat(byRef.variable()).isEqualTo("RESULT");
    assertThat(byRef.source()).isEqualTo(Block.AssignSource.BASH);
    assertThat(byRef.content()).isEqualTo("cat out.json");

    Block.Assignment byExpression = statements.get(1).<Block.Assign>cast().assignments().get(0);
    assertThat(byExpression.variable()).isEqualTo("FLAG");
    assertThat(byExpression.source()).isEqualTo(Block.AssignSource.ENV);

    Block.Assignment plain = statements.get(2).<Block.Assign>cast().assignments().get(0);
    assertThat(plain.variable()).isEqualTo("PLAIN");
    assertThat(plain.lenient()).isTrue();
    assertThat(plain.comment()).hasValue("Notes");
  }

  @Test
  public void assignmentsDoNotMakeRuntimeDocuments() throws CompilerException {
    Document document =
        parse(
            "<Command name=\"a\" description=\"d\">",
            "  <Assign var=\"DIR\" bash=\"pwd\"/>",
            "</Command>");

    assertThat(document.runtime()).isFalse();
    assertThat(document.body().get(0).type()).isEqualTo(Block.Type.ASSIGN);
  }

  @Test
  public void onStatusGuardsABreak() throws CompilerException {
    Document document =
        parseBody(
            "<Loop max={3}>",
            "  <SpawnAgent agent=\"planner\" model=\"sonnet\" description=\"Plan\"",
            "      prompt=\"Plan it\" output=\"result\"/>",
            "  <OnStatus output=\"result\" status=\"SUCCESS\">",
            "    <Break/>",
            "  </OnStatus>",
            "</Loop>");

    Block.Loop loop = statements(document).get(0).cast();
    Block.OnStatus onStatus = loop.children().get(1).cast();
    assertThat(onStatus.output()).isEqualTo("RESULT");
    assertThat(onStatus.status()).isEqualTo(Block.ReturnStatus.SUCCESS);
    assertThat(onStatus.children()).hasSize(1);
    assertThat(loop.exitCondition().get().description())
        .isEqualTo("$RESULT.status equals 'SUCCESS'");
  }

  @Test
  public void stateReadsAndWrites() throws CompilerException {
    Document document =
        parseBody(
            "<ReadState state=\"tasks\" field=\"phase\" output=\"result\"/>",
            "<WriteState state=\"tasks\" field=\"phase\" value={result.status}/>",
            "<WriteState state=\"tasks\" merge={{phase: 'done', count: 2}}/>");

    ImmutableList<Block> statements = statements(document);
    Block.ReadState read = statements.get(0).cast();
    assertThat(read.state()).isEqualTo("tasks");
    assertThat(read.field()).hasValue("phase");
    assertThat(read.output()).isEqualTo("RESULT");

    Block.WriteState single = statements.get(1).cast();
    assertThat(single.writes()).hasSize(1);
    assertThat(single.writes().get(0).field()).isEqualTo("phase");
    assertThat(single.writes().get(0).value().description()).isEqualTo("$RESULT.status");

    Block.WriteState merged = statements.get(2).cast();
    assertThat(
            merged
                .writes()
                .stream()
                .map(Block.StateWrite::field)
                .collect(Collectors.toList()))
        .containsExactly("phase", "count")
        .inOrder();
  }

  @Test
  public void stateWritesMakeRuntimeDocuments() throws CompilerException {
    assertThat(
            parse(
                    "<Command name=\"a\" description=\"d\">",
                    "  <WriteState state=\"tasks\" field=\"phase\" value=\"done\"/>",
                    "</Command>")
                .runtime())
        .isTrue();
  }

  @Test
  public void assignNeedsExactlyOneSource() {
    assertErrors(
        "<Assign> requires exactly one of 'bash', 'value', 'env' and 'file'",
        "<Assign var=\"X\" bash=\"pwd\" value=\"x\"/>");
    assertErrors(
        "<Assign> requires exactly one of 'bash', 'value', 'env' and 'file'",
        "<Assign var=\"X\"/>");
  }

  @Test
  public void invalidAssignments() {
    assertErrors("'optional' only applies to 'file'", "<Assign var=\"X\" bash=\"pwd\" optional/>");
    assertErrors("'raw' only applies to 'value'", "<Assign var=\"X\" env=\"HOME\" raw/>");
    assertErrors(
        "'1HOME' is not a valid environment variable name", "<Assign var=\"X\" env=\"1HOME\"/>");
    assertErrors(
        "var of <Assign> must name a declared runtime variable",
        "<Assign var={missing} value=\"x\"/>");
    assertErrors(
        "'my-dir' is not a valid shell variable name", "<Assign var=\"my-dir\" value=\"x\"/>");
    assertErrors(
        "<AssignGroup> expects <Assign> children, got <p>",
        "<AssignGroup><p>x</p></AssignGroup>");
  }

  @Test
  public void invalidReadFiles() {
    assertErrors(
        "'required' of file 'state' must be a boolean",
        "<ReadFiles files={{state: {path: 'STATE.md', required: 'no'}}}/>");
    assertErrors(
        "unknown key 'optional' in file 'state'",
        "<ReadFiles files={{state: {path: 'STATE.md', optional: true}}}/>");
    assertErrors(
        "file 'state' requires a string 'path'", "<ReadFiles files={{state: {required: true}}}/>");
  }

  @Test
  public void invalidOnStatus() {
    assertErrors(
        "<OnStatus> requires attribute 'status'",
        "<OnStatus output=\"result\"><p>x</p></OnStatus>");
    assertErrors(
        "unknown status 'DONE'",
        "<OnStatus output=\"result\" status=\"DONE\"><p>x</p></OnStatus>");
    assertErrors(
        "output of <OnStatus> must name a declared runtime variable",
        "<OnStatus output=\"missing\" status=\"ERROR\"><p>x</p></OnStatus>");
  }

  @Test
  public void invalidStateWrites() {
    assertErrors(
        "<WriteState> accepts either 'merge' or 'field' and 'value'",
        "<WriteState state=\"tasks\" field=\"a\" merge={{a: 1}}/>");
    assertErrors(
        "<WriteState> requires attribute 'value'", "<WriteState state=\"tasks\" field=\"a\"/>");
    assertErrors(
        "duplicate key 'a'", "<WriteState state=\"tasks\" merge={{a: 1, a: 2}}/>");
    assertErrors(
        "'a/b' is not a valid state name",
        "<ReadState state=\"a/b\" output=\"result\"/>");
  }
}
