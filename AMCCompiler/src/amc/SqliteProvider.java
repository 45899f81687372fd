package amc;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** State commands backed by the sqlite3 CLI. Every command prints the resulting row as JSON. */
public final class SqliteProvider implements StorageProvider {

  public static final String NAME = "sqlite";

  private static final Pattern PLACEHOLDER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String init(Document.State state) {
    String table = state.name();
    List<String> columns = new ArrayList<>();
    for (Document.StateField field : state.fields()) {
      StringBuilder column =
          new StringBuilder("  ").append(field.name()).append(' ').append(field.type().sqlType());
      if (field.defaultValue().isPresent()) {
        column.append(" DEFAULT ").append(sqlValue(field, field.defaultValue().get()));
      }
      if (!field.values().isEmpty()) {
        List<String> checks = new ArrayList<>();
        for (String value : field.values()) checks.add("'" + escapeSql(value) + "'");
        column
            .append(" CHECK(")
            .append(field.name())
            .append(" IN (")
            .append(Joiner.on(", ").join(checks))
            .append("))");
      }
      columns.add(column.toString());
    }

    return frontmatter(
            table + ".init",
            String.format(
                "Initialize %s state table. Run once before using %s state.", table, table),
            ImmutableList.of("Bash(sqlite3:*)", "Bash(mkdir:*)"))
        + "\n\n# Initialize "
        + capitalize(table)
        + " State\n\nCreate the SQLite table for "
        + table
        + " state.\n\n## Process\n\n"
        + MarkdownWriter.codeFence(
            "bash",
            Joiner.on('\n')
                .join(
                    "mkdir -p \"$(dirname \"" + state.database() + "\")\"",
                    "sqlite3 \"" + state.database() + "\" <<'SQL'",
                    "CREATE TABLE IF NOT EXISTS " + table + " (",
                    Joiner.on(",\n").join(columns),
                    ");",
                    "-- Insert default row if not exists",
                    "INSERT OR IGNORE INTO " + table + " (rowid) VALUES (1);",
                    "SQL",
                    "echo '{\"status\": \"initialized\", \"table\": \"" + table + "\"}'"))
        + "\n";
  }

  @Override
  public String read(Document.State state) {
    String table = state.name();
    return frontmatter(
            table + ".read",
            String.format("Read %s state. Returns current state as JSON.", table),
            ImmutableList.of("Bash(sqlite3:*)"))
        + "\n\n# Read "
        + capitalize(table)
        + " State\n\nRead the current "
        + table
        + " state from SQLite.\n\n## Arguments\n\n"
        + "- `--field {name}`: Optional field to read"
        + exampleField(state)
        + "\n\n## Process\n\n"
        + MarkdownWriter.codeFence(
            "bash",
            Joiner.on('\n')
                .join(
                    "DB=\"" + state.database() + "\"",
                    "",
                    argParser(ImmutableList.of("field")),
                    "",
                    tableCheck(table),
                    "",
                    "# Read state",
                    "if [ -z \"$FIELD\" ]; then",
                    "  " + selectRow(table),
                    "else",
                    "  sqlite3 -json \"$DB\" \"SELECT $FIELD FROM "
                        + table
                        + " WHERE rowid = 1\" | jq \".[0].$FIELD\"",
                    "fi"))
        + "\n";
  }

  @Override
  public String write(Document.State state) {
    String table = state.name();
    return frontmatter(
            table + ".write",
            String.format("Write to %s state. Updates fields in state.", table),
            ImmutableList.of("Bash(sqlite3:*)"))
        + "\n\n# Write "
        + capitalize(table)
        + " State\n\nUpdate "
        + table
        + " state fields in SQLite.\n\n## Arguments\n\n"
        + "- `--field {name}`: Field to update"
        + exampleField(state)
        + "\n- `--value {val}`: Value to set\n\n## Process\n\n"
        + MarkdownWriter.codeFence(
            "bash",
            Joiner.on('\n')
                .join(
                    "DB=\"" + state.database() + "\"",
                    "",
                    argParser(ImmutableList.of("field", "value")),
                    "",
                    "# Validate",
                    "if [ -z \"$FIELD\" ] || [ -z \"$VALUE\" ]; then",
                    "  echo '{\"error\": \"Both --field and --value required\"}'",
                    "  exit 1",
                    "fi",
                    "",
                    tableCheck(table),
                    "",
                    "# Escape value for SQL (double single quotes)",
                    escape("value"),
                    "",
                    "# Update and return new state",
                    "sqlite3 \"$DB\" \"UPDATE "
                        + table
                        + " SET $FIELD = '$SAFE_VALUE' WHERE rowid = 1\"",
                    selectRow(table)))
        + "\n";
  }

  @Override
  public String delete(Document.State state) {
    String table = state.name();
    List<String> resets = new ArrayList<>();
    for (Document.StateField field : state.fields()) {
      String value =
          field.defaultValue().orElse(field.type() == Document.FieldType.STRING ? "" : "0");
      resets.add(field.name() + " = " + sqlValue(field, value));
    }

    return frontmatter(
            table + ".delete",
            String.format("Reset %s state to defaults.", table),
            ImmutableList.of("Bash(sqlite3:*)"))
        + "\n\n# Reset "
        + capitalize(table)
        + " State\n\nReset "
        + table
        + " state to default values.\n\n## Process\n\n"
        + MarkdownWriter.codeFence(
            "bash",
            Joiner.on('\n')
                .join(
                    "DB=\"" + state.database() + "\"",
                    "",
                    tableCheck(table),
                    "",
                    "# Reset to defaults",
                    "sqlite3 \"$DB\" \"UPDATE "
                        + table
                        + " SET "
                        + Joiner.on(", ").join(resets)
                        + " WHERE rowid = 1\"",
                    selectRow(table)))
        + "\n";
  }

  @Override
  public String operation(Document.State state, Document.StateOperation operation) {
    String table = state.name();
    List<String> argDocs = new ArrayList<>();
    List<String> escapes = new ArrayList<>();
    for (String arg : operation.args()) {
      argDocs.add(String.format("- `%s {value}`: %s", cliFlag(arg), arg.replace('_', ' ')));
      escapes.add(escape(arg));
    }

    // Placeholders become the escaped shell variables; quoting stays with the template.
    Matcher matcher = PLACEHOLDER.matcher(operation.sql().trim());
    StringBuffer sql = new StringBuffer();
    while (matcher.find()) {
      matcher.appendReplacement(
          sql, Matcher.quoteReplacement("$SAFE_" + shellVar(matcher.group(1))));
    }
    matcher.appendTail(sql);

    List<String> script = new ArrayList<>();
    script.add("DB=\"" + state.database() + "\"");
    script.add("");
    if (!operation.args().isEmpty()) {
      script.add(argParser(operation.args()));
      script.add("");
    }
    script.add(tableCheck(table));
    script.add("");
    script.add("# Escape values for SQL");
    script.add(escapes.isEmpty() ? "# (no escaping needed)" : Joiner.on('\n').join(escapes));
    script.add("");
    script.add("# Execute operation");
    script.add("sqlite3 \"$DB\" \"" + doubleQuoted(sql.toString()) + "\"");
    script.add(selectRow(table));

    return frontmatter(
            table + "." + operation.name(),
            String.format("%s operation on %s state.", capitalize(operation.name()), table),
            ImmutableList.of("Bash(sqlite3:*)"))
        + "\n\n# "
        + capitalize(operation.name())
        + " "
        + capitalize(table)
        + "\n\nCustom operation on "
        + table
        + " state.\n\n## Arguments\n\n"
        + (argDocs.isEmpty() ? "(no arguments)" : Joiner.on('\n').join(argDocs))
        + "\n\n## Process\n\n"
        + MarkdownWriter.codeFence("bash", Joiner.on('\n').join(script))
        + "\n";
  }

  private static String frontmatter(String name, String description, List<String> tools) {
    return new Frontmatter()
        .put("name", name)
        .put("description", description)
        .putList("allowed-tools", tools)
        .render();
  }

  private static String exampleField(Document.State state) {
    return " (e.g., `" + state.fields().get(0).name() + "`)";
  }

  private static String argParser(List<String> args) {
    List<String> lines = new ArrayList<>();
    lines.add("# Parse arguments");
    for (String arg : args) lines.add(shellVar(arg) + "=\"\"");
    lines.add("while [[ $# -gt 0 ]]; do");
    lines.add("  case $1 in");
    for (String arg : args) {
      lines.add(String.format("    %s) %s=\"$2\"; shift 2 ;;", cliFlag(arg), shellVar(arg)));
    }
    lines.add("    *) shift ;;");
    lines.add("  esac");
    lines.add("done");
    return Joiner.on('\n').join(lines);
  }

  private static String tableCheck(String table) {
    return Joiner.on('\n')
        .join(
            "# Check table exists",
            "if ! sqlite3 \"$DB\" \"SELECT 1 FROM " + table + " LIMIT 1\" 2>/dev/null; then",
            "  echo '{\"error\": \"State not initialized. Run /" + table + ":init first\"}'",
            "  exit 1",
            "fi");
  }

  private static String selectRow(String table) {
    return "sqlite3 -json \"$DB\" \"SELECT * FROM " + table + " WHERE rowid = 1\" | jq '.[0]'";
  }

  private static String escape(String arg) {
    return String.format(
        "SAFE_%s=$(printf '%%s' \"$%s\" | sed \"s/'/''/g\")", shellVar(arg), shellVar(arg));
  }

  private static String sqlValue(Document.StateField field, String value) {
    return field.type() == Document.FieldType.STRING ? "'" + escapeSql(value) + "'" : value;
  }

  static String escapeSql(String value) {
    return value.replace("'", "''");
  }

  // Keeps the SQL literal inside a double-quoted shell word; $SAFE_ variables still expand.
  private static String doubleQuoted(String sql) {
    return sql.replace("\\", "\\\\").replace("\"", "\\\"").replace("`", "\\`");
  }

  static String cliFlag(String arg) {
    return "--" + arg.replace('_', '-');
  }

  static String shellVar(String arg) {
    return Ascii.toUpperCase(arg);
  }

  private static String capitalize(String text) {
    return text.isEmpty() ? text : Ascii.toUpperCase(text.substring(0, 1)) + text.substring(1);
  }
}
