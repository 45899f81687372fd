package amc;

import static com.google.common.truth.Truth.assertThat;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

public class SqliteProviderTest {

  private final SqliteProvider provider = new SqliteProvider();

  private static Document.State parse(String... lines) throws CompilerException {
    return new DocumentParser("/test/session.amc", ".claude", new FunctionRegistry())
        .parse(Arrays.asList(lines).stream().collect(Collectors.joining("\n")))
        .cast();
  }

  private static Document.State session() throws CompilerException {
    return parse(
        "<State name=\"session\" description=\"Session state\" database=\".state/app.db\">",
        "  <Field name=\"phase\" default=\"plan\" values={['plan', 'build']}/>",
        "  <Field name=\"retries\" type=\"number\" default=\"0\"/>",
        "  <Field name=\"done\" type=\"boolean\" default={false}/>",
        "  <Field name=\"note\"/>",
        "  <Operation name=\"advance\">",
        "    UPDATE session SET phase = '$next', retries = retries + $step_size",
        "    WHERE rowid = 1",
        "  </Operation>",
        "  <Operation name=\"label\">",
        "    UPDATE session SET note = \"done\" WHERE rowid = 1",
        "  </Operation>",
        "</State>");
  }

  @Test
  public void init() throws CompilerException {
    String init = provider.init(session());

    assertThat(init)
        .startsWith(
            "---\n"
                + "name: session.init\n"
                + "description: Initialize session state table. Run once before using session"
                + " state.\n"
                + "allowed-tools:\n"
                + "  - Bash(sqlite3:*)\n"
                + "  - Bash(mkdir:*)\n"
                + "---\n\n"
                + "# Initialize Session State\n");
    assertThat(init)
        .contains(
            "mkdir -p \"$(dirname \".state/app.db\")\"\n"
                + "sqlite3 \".state/app.db\" <<'SQL'\n"
                + "CREATE TABLE IF NOT EXISTS session (\n"
                + "  phase TEXT DEFAULT 'plan' CHECK(phase IN ('plan', 'build')),\n"
                + "  retries INTEGER DEFAULT 0,\n"
                + "  done INTEGER DEFAULT 0,\n"
                + "  note TEXT\n"
                + ");\n"
                + "-- Insert default row if not exists\n"
                + "INSERT OR IGNORE INTO session (rowid) VALUES (1);\n"
                + "SQL\n");
    assertThat(init).endsWith("```\n");
  }

  @Test
  public void read() throws CompilerException {
    String read = provider.read(session());

    assertThat(read).contains("- `--field {name}`: Optional field to read (e.g., `phase`)");
    assertThat(read).contains("    --field) FIELD=\"$2\"; shift 2 ;;");
    assertThat(read)
        .contains("echo '{\"error\": \"State not initialized. Run /session:init first\"}'");
    assertThat(read)
        .contains("  sqlite3 -json \"$DB\" \"SELECT * FROM session WHERE rowid = 1\" | jq '.[0]'");
  }

  @Test
  public void write() throws CompilerException {
    String write = provider.write(session());

    assertThat(write).contains("SAFE_VALUE=$(printf '%s' \"$VALUE\" | sed \"s/'/''/g\")");
    assertThat(write)
        .contains("sqlite3 \"$DB\" \"UPDATE session SET $FIELD = '$SAFE_VALUE' WHERE rowid = 1\"");
  }

  @Test
  public void deleteResetsToDefaults() throws CompilerException {
    assertThat(provider.delete(session()))
        .contains(
            "sqlite3 \"$DB\" \"UPDATE session SET phase = 'plan', retries = 0, done = 0,"
                + " note = '' WHERE rowid = 1\"");
  }

  @Test
  public void customOperation() throws CompilerException {
    Document.State state = session();
    Document.StateOperation advance = state.operations().get(0);
    assertThat(advance.args()).containsExactly("next", "step_size").inOrder();

    String markdown = provider.operation(state, advance);

    assertThat(markdown).contains("name: session.advance\n");
    assertThat(markdown).contains("# Advance Session");
    assertThat(markdown)
        .contains("- `--next {value}`: next\n- `--step-size {value}`: step size");
    assertThat(markdown).contains("    --step-size) STEP_SIZE=\"$2\"; shift 2 ;;");
    assertThat(markdown)
        .contains("SAFE_STEP_SIZE=$(printf '%s' \"$STEP_SIZE\" | sed \"s/'/''/g\")");
    assertThat(markdown)
        .contains(
            "sqlite3 \"$DB\" \"UPDATE session SET phase = '$SAFE_NEXT', retries = retries +"
                + " $SAFE_STEP_SIZE\nWHERE rowid = 1\"");
  }

  @Test
  public void operationWithoutArguments() throws CompilerException {
    Document.State state = session();

    String markdown = provider.operation(state, state.operations().get(1));

    assertThat(markdown).contains("(no arguments)");
    assertThat(markdown).contains("# (no escaping needed)");
    assertThat(markdown).doesNotContain("# Parse arguments");
    assertThat(markdown)
        .contains("sqlite3 \"$DB\" \"UPDATE session SET note = \\\"done\\\" WHERE rowid = 1\"");
  }

  @Test
  public void generateOrdersBuiltinsFirst() throws CompilerException {
    assertThat(provider.generate(session()).keySet())
        .containsExactly("init", "read", "write", "delete", "advance", "label")
        .inOrder();
  }

  @Test
  public void helpers() {
    assertThat(SqliteProvider.escapeSql("it's")).isEqualTo("it''s");
    assertThat(SqliteProvider.cliFlag("max_items")).isEqualTo("--max-items");
    assertThat(SqliteProvider.shellVar("max_items")).isEqualTo("MAX_ITEMS");
  }
}
