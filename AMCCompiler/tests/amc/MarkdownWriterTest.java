package amc;

import static com.google.common.truth.Truth.assertThat;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class MarkdownWriterTest {

  private static final MarkdownWriter WRITER =
      new MarkdownWriter("node .claude/runtime/runtime.js");

  private static String lines(String... lines) {
    return Arrays.asList(lines).stream().collect(Collectors.joining("\n"));
  }

  private static Document parse(String root, String... body) throws CompilerException {
    return new DocumentParser("/test/file.amc", ".claude", new FunctionRegistry())
        .parse(root + "\n" + lines(body) + "\n</" + root.substring(1, root.indexOf(' ')) + ">");
  }

  private static String render(String... body) throws CompilerException {
    return WRITER.blocks(parse("<Command name=\"c\" description=\"d\">", body).body());
  }

  // A runtime command declaring RESULT (ref result) and FLAG.
  private static String renderRuntime(String... body) throws CompilerException {
    String root =
        lines(
            "<RuntimeCommand name=\"c\" description=\"d\">",
            "  <RuntimeVar name=\"RESULT\" ref=\"result\"",
            "      shape=\"{status: string, count: number}\"/>",
            "  <RuntimeVar name=\"FLAG\"/>");
    return WRITER.blocks(
        new DocumentParser("/test/file.amc", ".claude", new FunctionRegistry())
            .parse(root + "\n" + lines(body) + "\n</RuntimeCommand>")
            .body());
  }

  @Test
  public void headingsAndInlineFormatting() throws CompilerException {
    String markdown =
        render(
            "<h2>Title</h2>",
            "<p>Some <b>bold</b>, <i>italic</i>, <code>x</code>,",
            "  <a href=\"https://example.com\">a link</a> and <br/>more.</p>",
            "<Heading level={4}>Deep</Heading>",
            "<hr/>",
            "<blockquote><p>quoted</p><p>twice</p></blockquote>");

    assertThat(markdown)
        .isEqualTo(
            lines(
                "## Title",
                "",
                "Some **bold**, *italic*, `x`,[a link](https://example.com) and ",
                "more.",
                "",
                "#### Deep",
                "",
                "---",
                "",
                "> quoted",
                ">",
                "> twice"));
  }

  @Test
  public void looseTextBecomesParagraphs() throws CompilerException {
    assertThat(render("First line", "continues here.", "<hr/>", "Second."))
        .isEqualTo(lines("First line continues here.", "", "---", "", "Second."));
  }

  @Test
  public void nestedLists() throws CompilerException {
    String markdown =
        render(
            "<ul>",
            "  <li>one</li>",
            "  <li>two",
            "    <ol><li>nested</li><li>again</li></ol>",
            "  </li>",
            "</ul>");

    assertThat(markdown).isEqualTo(lines("- one", "- two", "  1. nested", "  2. again"));
  }

  @Test
  public void listComponent() throws CompilerException {
    assertThat(render("<List items={['a', 'b']} ordered/>")).isEqualTo(lines("1. a", "2. b"));
  }

  @Test
  public void htmlTable() throws CompilerException {
    String markdown =
        render(
            "<table>",
            "  <tr><th>Name</th><th align=\"right\">Count</th></tr>",
            "  <tr><td>a|b</td><td>1</td></tr>",
            "  <tr><td>c</td></tr>",
            "</table>");

    assertThat(markdown)
        .isEqualTo(lines("| Name | Count |", "| --- | ---: |", "| a\\|b | 1 |", "| c |  |"));
  }

  @Test
  public void tableComponent() throws CompilerException {
    String markdown =
        render(
            "<Table headers={['A', 'B']} rows={[['1', null], ['2', 3]]}",
            "    align={['left', 'center']} emptyCell=\"-\"/>");

    assertThat(markdown)
        .isEqualTo(lines("| A | B |", "| :--- | :---: |", "| 1 | - |", "| 2 | 3 |"));
  }

  @Test
  public void sectionsRenderAsXml() throws CompilerException {
    String markdown =
        render(
            "<Role>You review code.</Role>",
            "<div name=\"notes\" kind=\"extra\"><p>hi</p></div>",
            "<div><p>unwrapped</p></div>",
            "<SuccessCriteria items={['Tests pass', {text: 'Docs', checked: true}]}/>");

    assertThat(markdown)
        .isEqualTo(
            lines(
                "<role>",
                "You review code.",
                "</role>",
                "",
                "<notes kind=\"extra\">",
                "hi",
                "</notes>",
                "",
                "unwrapped",
                "",
                "<success_criteria>",
                "- [ ] Tests pass",
                "- [x] Docs",
                "</success_criteria>"));
  }

  @Test
  public void executionContextAndOfferNext() throws CompilerException {
    String markdown =
        render(
            "<ExecutionContext paths={['docs/plan.md', '@docs/state.md']}/>",
            "<OfferNext routes={[",
            "  {name: 'plan', path: '/plan', description: 'Make a plan'},",
            "  {name: 'ship', path: '/ship'}]}/>");

    assertThat(markdown)
        .isEqualTo(
            lines(
                "<execution_context>",
                "@docs/plan.md",
                "@docs/state.md",
                "</execution_context>",
                "",
                "<offer_next>",
                "- **plan** (`/plan`): Make a plan",
                "- **ship** (`/ship`)",
                "</offer_next>"));
  }

  @Test
  public void stepVariants() throws CompilerException {
    String markdown =
        render(
            "<Step number=\"1\" name=\"Setup\"><p>Install</p></Step>",
            "<Step number=\"2\" name=\"Run\" variant=\"bold\"><p>Go</p></Step>",
            "<Step number=\"3\" name=\"Check\" variant=\"xml\"><p>Verify</p></Step>");

    assertThat(markdown)
        .isEqualTo(
            lines(
                "## Step 1: Setup",
                "",
                "Install",
                "",
                "**Step 2: Run**",
                "",
                "Go",
                "",
                "<step number=\"3\" name=\"Check\">",
                "Verify",
                "</step>"));
  }

  @Test
  public void codeFenceOutgrowsContent() throws CompilerException {
    String markdown = render("<pre lang=\"md\">", "```", "x < y", "```", "</pre>");

    assertThat(markdown).isEqualTo(lines("````md", "```", "x < y", "```", "````"));
  }

  @Test
  public void rawMarkdownIsDedented() throws CompilerException {
    assertThat(render("<Markdown>", "  # Raw {x}", "    indented", "</Markdown>"))
        .isEqualTo(lines("# Raw {x}", "  indented"));
  }

  @Test
  public void documentAddsLeadingPartsAndTrailingNewline() throws CompilerException {
    Document document = parse("<Command name=\"c\" description=\"d\">", "<p>Hello</p>");

    assertThat(WRITER.document(ImmutableList.of("---\nname: c\n---"), document.body()))
        .isEqualTo("---\nname: c\n---\n\nHello\n");
    assertThat(WRITER.document(ImmutableList.of(), ImmutableList.of())).isEmpty();
  }

  @Test
  public void runtimeCall() throws CompilerException {
    String markdown =
        renderRuntime(
            "<Call fn=\"check\" args={{env: 'it\\'s', previous: result.status}}",
            "    output=\"result\"/>");

    assertThat(markdown)
        .isEqualTo(
            lines(
                "**Runtime Call**",
                "",
                "| Argument | Value |",
                "| --- | --- |",
                "| env | 'it's' |",
                "| previous | $RESULT.status |",
                "",
                "```bash",
                "RESULT=$(node .claude/runtime/runtime.js check"
                    + " '{\"env\":\"it'\"'\"'s\",\"previous\":'\"$(echo \"$RESULT\" | jq -c"
                    + " '.status')\"'}')",
                "```",
                "",
                "Store the result in `$RESULT`."));
  }

  @Test
  public void argumentsOverSeveralVariables() throws CompilerException {
    String markdown =
        renderRuntime("<Call fn=\"check\" args={{same: result.count == FLAG}}/>");

    assertThat(markdown)
        .contains(
            "node .claude/runtime/runtime.js check '{\"same\":'\"$(jq -n -c --argjson FLAG"
                + " \"$FLAG\" --argjson RESULT \"$RESULT\" '$RESULT.count == $FLAG')\"'}'");
  }

  @Test
  public void loopWithConditionalBreak() throws CompilerException {
    String markdown =
        renderRuntime(
            "<Loop max={3} counter=\"i\">",
            "  <Call fn=\"check\" output=\"result\"/>",
            "  <If condition={result.status == 'done'}>",
            "    <Break message=\"finished\"/>",
            "  </If>",
            "  <Else>",
            "    <p>Retry {result.count}</p>",
            "  </Else>",
            "</Loop>",
            "<Return status=\"SUCCESS\" message=\"All done\"/>");

    assertThat(markdown)
        .isEqualTo(
            lines(
                "**Loop up to 3 times (counter: $i):**",
                "",
                "**Runtime Call**",
                "",
                "```bash",
                "RESULT=$(node .claude/runtime/runtime.js check '{}')",
                "```",
                "",
                "Store the result in `$RESULT`.",
                "",
                "**If $RESULT.status equals 'done':**",
                "",
                "**Break loop:** finished",
                "",
                "**Otherwise:**",
                "",
                "Retry $RESULT.count",
                "",
                "Exit when $RESULT.status equals 'done'.",
                "",
                "**End command (SUCCESS)**: All done"));
  }

  @Test
  public void computedInterpolation() throws CompilerException {
    assertThat(renderRuntime("<p>Count: {result.count > 1 ? 'many' : 'one'}</p>"))
        .isEqualTo(
            "Count: $(echo \"$RESULT\" | jq -r 'if .count > 1 then \"many\" else \"one\" end')");
  }

  @Test
  public void askUser() throws CompilerException {
    String markdown =
        renderRuntime(
            "<AskUser question=\"Continue?\" header=\"Confirm\" output=\"FLAG\" multiSelect>",
            "  <Option value=\"yes\" label=\"Yes\" description=\"Keep going\"/>",
            "  <Option value=\"no\" label=\"No\"/>",
            "</AskUser>");

    assertThat(markdown)
        .isEqualTo(
            lines(
                "Use the AskUserQuestion tool:",
                "",
                "- Question: \"Continue?\"",
                "- Header: \"Confirm\"",
                "- Multi-select: true",
                "- Options:",
                "  - \"Yes\" (value: \"yes\") - Keep going",
                "  - \"No\" (value: \"no\")",
                "",
                "Store the user's response in `$FLAG`."));
  }

  @Test
  public void spawnAgentWithPrompt() throws CompilerException {
    String markdown =
        renderRuntime(
            "<SpawnAgent agent=\"reviewer\" model=\"sonnet\" description=\"Review\"",
            "    prompt={'Check the \"diff\"'}/>");

    assertThat(markdown)
        .isEqualTo(
            lines(
                "```",
                "Task(",
                "  prompt=\"Check the \\\"diff\\\"\",",
                "  subagent_type=\"reviewer\",",
                "  model=\"sonnet\",",
                "  description=\"Review\"",
                ")",
                "```"));
  }

  @Test
  public void spawnAgentWithInputLoadedFromFile() throws CompilerException {
    String markdown =
        renderRuntime(
            "<SpawnAgent agent=\"reviewer\" model=\"sonnet\" description=\"Review\"",
            "    input={{status: result.status, mode: 'strict'}} output=\"FLAG\" loadFromFile/>");

    assertThat(markdown)
        .isEqualTo(
            lines(
                "```",
                "Task(",
                "  prompt=\"First, read .claude/agents/reviewer.md for your role and"
                    + " instructions.\\n\\n<status>",
                "$RESULT.status",
                "</status>",
                "",
                "<mode>",
                "strict",
                "</mode>\",",
                "  subagent_type=\"general-purpose\",",
                "  model=\"sonnet\",",
                "  description=\"Review\"",
                ")",
                "```",
                "",
                "Store the agent's result in `$FLAG`."));
  }

  @Test
  public void assignments() throws CompilerException {
    String markdown =
        renderRuntime(
            "<AssignGroup>",
            "  <Assign var=\"PHASE_DIR\" bash=\"ls -d .planning/phases/01-*\"",
            "      comment=\"Find the phase\"/>",
            "  <Assign var={result} value=\"two words\"/>",
            "  <Assign var=\"MODE\" value=\"strict\"/>",
            "  <Assign var=\"HOME_DIR\" env=\"HOME\"/>",
            "  <Assign var=\"NOTES\" file=\"${PHASE_DIR}/NOTES.md\" optional/>",
            "</AssignGroup>",
            "<Assign var=\"FLAG\" value=\"a b\" raw/>");

    assertThat(markdown)
        .isEqualTo(
            lines(
                "```bash",
                "# Find the phase",
                "PHASE_DIR=$(ls -d .planning/phases/01-*)",
                "RESULT=\"two words\"",
                "MODE=strict",
                "HOME_DIR=$HOME",
                "NOTES=$(cat \"${PHASE_DIR}/NOTES.md\" 2>/dev/null)",
                "```",
                "",
                "```bash",
                "FLAG=a b",
                "```"));
  }

  @Test
  public void readFiles() throws CompilerException {
    assertThat(
            render(
                "<ReadFiles files={{",
                "  state: {path: '.planning/STATE.md'},",
                "  roadmapNotes: {path: '.planning/ROADMAP.md', required: false}",
                "}}/>"))
        .isEqualTo(
            lines(
                "```bash",
                "STATE_CONTENT=$(cat .planning/STATE.md)",
                "ROADMAP_NOTES_CONTENT=$(cat .planning/ROADMAP.md 2>/dev/null)",
                "```"));
  }

  @Test
  public void bashAndPromptTemplate() throws CompilerException {
    String markdown =
        render(
            "<Bash>",
            "  ls -la",
            "  echo {done}",
            "</Bash>",
            "<PromptTemplate>",
            "  <XmlSection><p>Research the phase.</p></XmlSection>",
            "  <DeviationRules><p>Ask first.</p></DeviationRules>",
            "</PromptTemplate>");

    assertThat(markdown)
        .isEqualTo(
            lines(
                "```bash",
                "ls -la",
                "echo {done}",
                "```",
                "",
                "```markdown",
                "<section>",
                "Research the phase.",
                "</section>",
                "",
                "<deviation_rules>",
                "Ask first.",
                "</deviation_rules>",
                "```"));
  }

  @Test
  public void onStatus() throws CompilerException {
    String markdown =
        renderRuntime(
            "<OnStatus output=\"result\" status=\"SUCCESS\">",
            "  <p>Plan ready.</p>",
            "</OnStatus>",
            "<OnStatus output=\"result\" status=\"BLOCKED\">",
            "  <Return status=\"BLOCKED\" message=\"Planner blocked\"/>",
            "</OnStatus>");

    assertThat(markdown)
        .isEqualTo(
            lines(
                "**On SUCCESS:**",
                "",
                "Plan ready.",
                "",
                "**On BLOCKED:**",
                "",
                "**End command (BLOCKED)**: Planner blocked"));
  }

  @Test
  public void stateReadsAndWrites() throws CompilerException {
    String markdown =
        renderRuntime(
            "<ReadState state=\"tasks\" output=\"result\"/>",
            "<ReadState state=\"tasks\" field=\"phase\" output=\"FLAG\"/>",
            "<WriteState state=\"tasks\" field=\"status\" value=\"in progress\"/>",
            "<WriteState state=\"tasks\" field=\"note\" value={'say \"hi\" to $USER'}/>",
            "<WriteState state=\"tasks\" merge={{status: result.status, count: 3, owner: FLAG}}/>");

    assertThat(markdown)
        .isEqualTo(
            lines(
                "Use skill `/tasks.read` and store result in `$RESULT`.",
                "",
                "Use skill `/tasks.read --field \"phase\"` and store result in `$FLAG`.",
                "",
                "Use skill `/tasks.write --field \"status\" --value \"in progress\"`.",
                "",
                "Use skill `/tasks.write --field \"note\" --value \"say \\\"hi\\\" to \\$USER\"`.",
                "",
                "Use skill `/tasks.write` once per field:",
                "",
                "- `/tasks.write --field \"status\" --value"
                    + " \"$(echo \"$RESULT\" | jq -r '.status')\"`",
                "- `/tasks.write --field \"count\" --value 3`",
                "- `/tasks.write --field \"owner\" --value \"$FLAG\"`"));
  }
}
