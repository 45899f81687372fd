package amc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Renders blocks and inline content as Markdown. Blocks are separated by one blank line; the
 * output never depends on anything but the IR, so identical input renders identically.
 */
public final class MarkdownWriter {

  private final String runtimeCommand;

  // runtimeCommand prefixes every runtime call, e.g. "node .claude/runtime/runtime.js".
  public MarkdownWriter(String runtimeCommand) {
    this.runtimeCommand = runtimeCommand;
  }

  /** A full document body: blocks joined by blank lines, with one trailing newline. */
  public String document(List<String> leading, List<Block> blocks) {
    List<String> parts = new ArrayList<>(leading);
    parts.add(blocks(blocks, 0));
    String body = join(parts);
    return body.isEmpty() ? "" : body + "\n";
  }

  public String blocks(List<Block> blocks) {
    return blocks(blocks, 0);
  }

  private String blocks(List<Block> blocks, int depth) {
    List<String> parts = new ArrayList<>();
    for (Block block : blocks) parts.add(block(block, depth));
    return join(parts);
  }

  // Joins non-empty parts with a blank line.
  private static String join(List<String> parts) {
    return parts.stream().filter(p -> !p.isEmpty()).collect(Collectors.joining("\n\n"));
  }

  // depth is the list nesting level the block is rendered at.
  private String block(Block block, int depth) {
    switch (block.type()) {
      case HEADING:
        {
          Block.Heading heading = block.cast();
          int level = Math.max(1, Math.min(6, heading.level()));
          return Strings.repeat("#", level) + " " + inlines(heading.children());
        }
      case PARAGRAPH:
        return inlines(block.<Block.Paragraph>cast().children());
      case LIST:
        return list(block.cast(), depth);
      case CODE_BLOCK:
        {
          Block.CodeBlock code = block.cast();
          return codeFence(code.language().orElse(""), code.content());
        }
      case BLOCKQUOTE:
        return Splitter.on('\n')
            .splitToList(blocks(block.<Block.Blockquote>cast().children(), 0))
            .stream()
            .map(line -> line.isEmpty() ? ">" : "> " + line)
            .collect(Collectors.joining("\n"));
      case THEMATIC_BREAK:
        return "---";
      case TABLE:
        return table(block.cast());
      case XML_BLOCK:
        {
          Block.XmlBlock xml = block.cast();
          return xml(xml.name(), xml.attributes(), blocks(xml.children(), 0));
        }
      case RAW:
        return block.<Block.Raw>cast().content();
      case EXECUTION_CONTEXT:
        return executionContext(block.cast());
      case SUCCESS_CRITERIA:
        {
          List<String> lines = new ArrayList<>();
          for (Block.Criterion item : block.<Block.SuccessCriteria>cast().items()) {
            lines.add((item.checked() ? "- [x] " : "- [ ] ") + item.text());
          }
          return xml("success_criteria", ImmutableMap.of(), Joiner.on('\n').join(lines));
        }
      case OFFER_NEXT:
        {
          List<String> lines = new ArrayList<>();
          for (Block.Route route : block.<Block.OfferNext>cast().routes()) {
            lines.add(
                String.format("- **%s** (`%s`)", route.name(), route.path())
                    + route.description().map(d -> ": " + d).orElse(""));
          }
          return xml("offer_next", ImmutableMap.of(), Joiner.on('\n').join(lines));
        }
      case STEP:
        return step(block.cast());
      case ASSIGN:
        return assign(block.cast());
      case PROMPT_TEMPLATE:
        return codeFence("markdown", blocks(block.<Block.PromptTemplate>cast().children(), 0));
      case VARIABLE_DECLARATION:
        // Declarations only bind names; the reader sees the variable where it is used.
        return "";
      case RUNTIME_CALL:
        return runtimeCall(block.cast());
      case CONDITIONAL:
        {
          Block.Conditional conditional = block.cast();
          List<String> parts = new ArrayList<>();
          parts.add("**If " + conditional.condition().description() + ":**");
          parts.add(blocks(conditional.thenBlocks(), 0));
          if (conditional.hasElse()) {
            parts.add("**Otherwise:**");
            parts.add(blocks(conditional.elseBlocks(), 0));
          }
          return join(parts);
        }
      case LOOP:
        {
          Block.Loop loop = block.cast();
          List<String> parts = new ArrayList<>();
          parts.add(
              String.format(
                  "**Loop up to %d times%s:**",
                  loop.max(), loop.counter().map(c -> " (counter: $" + c + ")").orElse("")));
          parts.add(blocks(loop.children(), 0));
          loop.exitCondition()
              .ifPresent(c -> parts.add("Exit when " + c.description() + "."));
          return join(parts);
        }
      case BREAK:
        return block
            .<Block.Break>cast()
            .message()
            .map(m -> "**Break loop:** " + m)
            .orElse("**Break loop**");
      case RETURN:
        {
          Block.Return ret = block.cast();
          String head =
              "**End command" + ret.status().map(s -> " (" + s.name() + ")").orElse("") + "**";
          return head + ret.message().map(m -> ": " + m).orElse("");
        }
      case ASK_USER:
        return askUser(block.cast());
      case SPAWN_AGENT:
        return spawnAgent(block.cast());
      case ON_STATUS:
        {
          Block.OnStatus onStatus = block.cast();
          return join(
              ImmutableList.of(
                  "**On " + onStatus.status().name() + ":**",
                  blocks(onStatus.children(), 0)));
        }
      case READ_STATE:
        return readState(block.cast());
      case WRITE_STATE:
        return writeState(block.cast());
    }
    throw new IllegalStateException("Unhandled block type: " + block.type());
  }

  private String list(Block.ListBlock list, int depth) {
    String indent = Strings.repeat("  ", depth);
    String childIndent = indent + "  ";
    List<String> lines = new ArrayList<>();
    int number = 1;
    for (Block.ListItem item : list.items()) {
      String marker = list.ordered() ? (number++) + "." : "-";
      List<String> rest = new ArrayList<>();
      String first = "";
      for (int i = 0; i < item.children().size(); i++) {
        Block child = item.children().get(i);
        if (child.type() == Block.Type.LIST) {
          rest.add(list(child.cast(), depth + 1));
        } else if (i == 0) {
          first = indentTail(block(child, depth + 1), childIndent);
        } else {
          rest.add(indentAll(block(child, depth + 1), childIndent));
        }
      }
      lines.add(indent + marker + (first.isEmpty() ? "" : " " + first));
      lines.addAll(rest);
    }
    return Joiner.on('\n').join(lines);
  }

  // Continuation lines of a list item's first block stay inside the item.
  private static String indentTail(String text, String indent) {
    List<String> lines = Splitter.on('\n').splitToList(text);
    List<String> out = new ArrayList<>();
    out.add(lines.get(0));
    for (String line : lines.subList(1, lines.size())) {
      out.add(line.isEmpty() ? "" : indent + line);
    }
    return Joiner.on('\n').join(out);
  }

  private static String indentAll(String text, String indent) {
    return Splitter.on('\n')
        .splitToList(text)
        .stream()
        .map(line -> line.isEmpty() ? "" : indent + line)
        .collect(Collectors.joining("\n"));
  }

  /** A fence one backtick longer than any backtick run in the content, three at least. */
  static String codeFence(String language, String content) {
    int longest = 0;
    int run = 0;
    for (int i = 0; i < content.length(); i++) {
      run = content.charAt(i) == '`' ? run + 1 : 0;
      longest = Math.max(longest, run);
    }
    String fence = Strings.repeat("`", Math.max(3, longest + 1));
    return fence + language + "\n" + content + "\n" + fence;
  }

  private static String xml(String name, Map<String, String> attributes, String content) {
    StringBuilder sb = new StringBuilder("<").append(name);
    attributes.forEach(
        (k, v) ->
            sb.append(' ').append(k).append("=\"").append(v.replace("\"", "&quot;")).append('"'));
    sb.append(">\n");
    if (!content.isEmpty()) sb.append(content).append('\n');
    return sb.append("</").append(name).append('>').toString();
  }

  private String table(Block.Table table) {
    int columns = table.columnCount();
    List<String> lines = new ArrayList<>();
    if (table.header().isPresent()) {
      lines.add(tableRow(table.header().get(), columns, ""));
    } else {
      lines.add(tableRow(new Block.TableRow(ImmutableList.of()), columns, ""));
    }

    List<String> separators = new ArrayList<>();
    for (int i = 0; i < columns; i++) {
      Block.Align align = i < table.aligns().size() ? table.aligns().get(i) : Block.Align.NONE;
      switch (align) {
        case LEFT:
          separators.add(":---");
          break;
        case CENTER:
          separators.add(":---:");
          break;
        case RIGHT:
          separators.add("---:");
          break;
        default:
          separators.add("---");
      }
    }
    lines.add("| " + Joiner.on(" | ").join(separators) + " |");

    for (Block.TableRow row : table.rows()) {
      lines.add(tableRow(row, columns, table.emptyCell()));
    }
    return Joiner.on('\n').join(lines);
  }

  private String tableRow(Block.TableRow row, int columns, String emptyCell) {
    List<String> cells = new ArrayList<>();
    for (int i = 0; i < columns; i++) {
      String cell = i < row.cells().size() ? inlines(row.cells().get(i).children()) : "";
      if (cell.isEmpty()) cell = emptyCell;
      cells.add(cell.replace("|", "\\|").replace("\n", "<br>"));
    }
    return "| " + Joiner.on(" | ").join(cells) + " |";
  }

  private String executionContext(Block.ExecutionContext context) {
    List<String> lines = new ArrayList<>();
    for (String path : context.paths()) {
      lines.add(path.startsWith(context.prefix()) ? path : context.prefix() + path);
    }
    String children = blocks(context.children(), 0);
    if (!children.isEmpty()) lines.add(children);
    return xml("execution_context", ImmutableMap.of(), Joiner.on('\n').join(lines));
  }

  private String step(Block.Step step) {
    String body = blocks(step.children(), 0);
    switch (step.variant()) {
      case BOLD:
        return join(
            ImmutableList.of(
                String.format("**Step %s: %s**", step.number(), step.name()), body));
      case XML:
        return xml(
            "step",
            ImmutableMap.of("number", step.number(), "name", step.name()),
            body);
      default:
        return join(
            ImmutableList.of(String.format("## Step %s: %s", step.number(), step.name()), body));
    }
  }

  private static String assign(Block.Assign assign) {
    List<String> lines = new ArrayList<>();
    for (Block.Assignment assignment : assign.assignments()) {
      assignment.comment().ifPresent(c -> lines.add("# " + c));
      lines.add(assignment.variable() + "=" + assignedValue(assignment));
    }
    return codeFence("bash", Joiner.on('\n').join(lines));
  }

  private static final CharMatcher NEEDS_QUOTES =
      CharMatcher.whitespace().or(CharMatcher.is('$'));

  static String assignedValue(Block.Assignment assignment) {
    String content = assignment.content();
    switch (assignment.source()) {
      case BASH:
        return "$(" + content + ")";
      case VALUE:
        if (assignment.lenient() || !CharMatcher.whitespace().matchesAnyOf(content)) {
          return content;
        }
        return "\"" + content.replace("\"", "\\\"") + "\"";
      case ENV:
        return "$" + content;
      case FILE:
        {
          String path = NEEDS_QUOTES.matchesAnyOf(content) ? "\"" + content + "\"" : content;
          return "$(cat " + path + (assignment.lenient() ? " 2>/dev/null" : "") + ")";
        }
    }
    throw new IllegalStateException("Unhandled assignment source: " + assignment.source());
  }

  //
  // Runtime blocks
  //

  private String runtimeCall(Block.RuntimeCall call) {
    List<String> parts = new ArrayList<>();
    parts.add("**Runtime Call**");
    if (!call.argumentNames().isEmpty()) {
      List<String> rows = new ArrayList<>();
      rows.add("| Argument | Value |");
      rows.add("| --- | --- |");
      for (int i = 0; i < call.argumentNames().size(); i++) {
        rows.add(
            String.format(
                "| %s | %s |",
                call.argumentNames().get(i),
                call.argumentValues().get(i).description().replace("|", "\\|")));
      }
      parts.add(Joiner.on('\n').join(rows));
    }

    String invocation =
        String.format("%s %s %s", runtimeCommand, call.functionId(), argumentsWord(call));
    parts.add(
        codeFence(
            "bash",
            call.output().map(o -> o + "=$(" + invocation + ")").orElse(invocation)));
    if (call.output().isPresent()) {
      parts.add("Store the result in `$" + call.output().get() + "`.");
    }
    return join(parts);
  }

  /**
   * The arguments as one single-quoted shell word holding a JSON object. Values computed from
   * runtime variables are spliced in by closing the quote around a jq substitution.
   */
  static String argumentsWord(Block.RuntimeCall call) {
    StringBuilder json = new StringBuilder("'{");
    for (int i = 0; i < call.argumentNames().size(); i++) {
      if (i > 0) json.append(',');
      json.append(RuntimeExpression.escapeSingleQuotes(quoteJson(call.argumentNames().get(i))))
          .append(':');
      RuntimeExpression value = call.argumentValues().get(i);
      if (value.type() == RuntimeExpression.Type.LITERAL) {
        json.append(
            RuntimeExpression.escapeSingleQuotes(
                value.<RuntimeExpression.Literal>cast().value().toString()));
      } else {
        json.append("'\"").append(jsonSubstitution(value)).append("\"'");
      }
    }
    return json.append("}'").toString();
  }

  private static String quoteJson(String text) {
    return TextNode.valueOf(text).toString();
  }

  // A shell substitution printing the value as compact JSON.
  private static String jsonSubstitution(RuntimeExpression expr) {
    ImmutableSortedSet<String> vars = expr.variables();
    if (vars.size() == 1) {
      return String.format(
          "$(echo \"$%s\" | jq -c '%s')",
          vars.first(),
          RuntimeExpression.escapeSingleQuotes(
              expr.filter(RuntimeExpression.FilterMode.RELATIVE)));
    }
    String args =
        vars.stream()
            .map(v -> String.format("--argjson %s \"$%s\" ", v, v))
            .collect(Collectors.joining());
    return String.format(
        "$(jq -n -c %s'%s')",
        args,
        RuntimeExpression.escapeSingleQuotes(expr.filter(RuntimeExpression.FilterMode.ABSOLUTE)));
  }

  private static String askUser(Block.AskUser ask) {
    List<String> lines = new ArrayList<>();
    lines.add("Use the AskUserQuestion tool:");
    lines.add("");
    lines.add("- Question: \"" + ask.question() + "\"");
    ask.header().ifPresent(h -> lines.add("- Header: \"" + h + "\""));
    if (ask.multiSelect()) lines.add("- Multi-select: true");
    lines.add("- Options:");
    for (Block.Option option : ask.options()) {
      lines.add(
          String.format("  - \"%s\" (value: \"%s\")", option.label(), option.value())
              + option.description().map(d -> " - " + d).orElse(""));
    }
    lines.add("");
    lines.add("Store the user's response in `$" + ask.output() + "`.");
    return Joiner.on('\n').join(lines);
  }

  private static String spawnAgent(Block.SpawnAgent spawn) {
    String prompt;
    if (spawn.prompt().isPresent()) {
      prompt = spawn.prompt().get();
    } else {
      List<String> sections = new ArrayList<>();
      for (Block.InputField field : spawn.input()) {
        sections.add(
            String.format(
                "<%s>\n%s\n</%s>", field.name(), runtimeValue(field.value()), field.name()));
      }
      prompt = Joiner.on("\n\n").join(sections);
    }

    String agentType = spawn.agent();
    if (spawn.loadFromFile().isPresent()) {
      agentType = "general-purpose";
      prompt =
          "First, read "
              + spawn.loadFromFile().get()
              + " for your role and instructions.\\n\\n"
              + prompt;
    }

    String task =
        codeFence(
            "",
            "Task(\n"
                + "  prompt=\""
                + escapeQuotes(prompt)
                + "\",\n"
                + "  subagent_type=\""
                + escapeQuotes(agentType)
                + "\",\n"
                + "  model=\""
                + escapeQuotes(spawn.model())
                + "\",\n"
                + "  description=\""
                + escapeQuotes(spawn.description())
                + "\"\n"
                + ")");
    return spawn.output()
        .map(o -> task + "\n\nStore the agent's result in `$" + o + "`.")
        .orElse(task);
  }

  private static String readState(Block.ReadState read) {
    String command =
        "/" + read.state() + ".read" + read.field().map(f -> " --field \"" + f + "\"").orElse("");
    return String.format(
        "Use skill %s and store result in `$%s`.", inlineCode(command), read.output());
  }

  private static String writeState(Block.WriteState write) {
    String command = "/" + write.state() + ".write";
    if (write.writes().size() == 1) {
      return "Use skill " + inlineCode(command + " " + writeArguments(write.writes().get(0))) + ".";
    }
    List<String> lines = new ArrayList<>();
    lines.add("Use skill " + inlineCode(command) + " once per field:");
    lines.add("");
    for (Block.StateWrite field : write.writes()) {
      lines.add("- " + inlineCode(command + " " + writeArguments(field)));
    }
    return Joiner.on('\n').join(lines);
  }

  private static String writeArguments(Block.StateWrite write) {
    return String.format("--field \"%s\" --value %s", write.field(), shellArgument(write.value()));
  }

  /** A runtime value as one shell word: quoted text, a bare scalar or a quoted substitution. */
  static String shellArgument(RuntimeExpression value) {
    if (value.type() == RuntimeExpression.Type.LITERAL) {
      JsonNode json = value.<RuntimeExpression.Literal>cast().value();
      if (json.isTextual()) return "\"" + escapeDoubleQuoted(json.asText()) + "\"";
      if (json.isContainerNode()) {
        return "'" + RuntimeExpression.escapeSingleQuotes(json.toString()) + "'";
      }
      return json.toString();
    }
    if (value.type() == RuntimeExpression.Type.VAR_REF
        && value.<RuntimeExpression.VarRef>cast().path().isEmpty()) {
      return "\"$" + value.<RuntimeExpression.VarRef>cast().variable() + "\"";
    }
    return "\"" + value.shellValue() + "\"";
  }

  private static final CharMatcher DOUBLE_QUOTE_SPECIAL = CharMatcher.anyOf("\\\"$`");

  private static String escapeDoubleQuoted(String text) {
    StringBuilder sb = new StringBuilder();
    for (char c : text.toCharArray()) {
      if (DOUBLE_QUOTE_SPECIAL.matches(c)) sb.append('\\');
      sb.append(c);
    }
    return sb.toString();
  }

  private static String escapeQuotes(String text) {
    return text.replace("\"", "\\\"");
  }

  //
  // Inline content
  //

  public String inlines(List<Inline> inlines) {
    StringBuilder sb = new StringBuilder();
    for (Inline inline : inlines) {
      switch (inline.type()) {
        case TEXT:
          sb.append(inline.<Inline.Text>cast().value());
          break;
        case BOLD:
          sb.append("**").append(inlines(inline.<Inline.Bold>cast().children())).append("**");
          break;
        case ITALIC:
          sb.append('*').append(inlines(inline.<Inline.Italic>cast().children())).append('*');
          break;
        case CODE:
          sb.append(inlineCode(inline.<Inline.Code>cast().value()));
          break;
        case LINK:
          {
            Inline.Link link = inline.cast();
            sb.append('[')
                .append(inlines(link.children()))
                .append("](")
                .append(link.href())
                .append(')');
            break;
          }
        case LINE_BREAK:
          sb.append('\n');
          break;
        case RUNTIME_VALUE:
          sb.append(runtimeValue(inline.<Inline.RuntimeValue>cast().expression()));
          break;
      }
    }
    return sb.toString();
  }

  private static String inlineCode(String value) {
    if (value.indexOf('`') < 0) return "`" + value + "`";
    // Wrap in a longer backtick run, padded so edge backticks don't merge with it.
    int longest = 0;
    int run = 0;
    for (int i = 0; i < value.length(); i++) {
      run = value.charAt(i) == '`' ? run + 1 : 0;
      longest = Math.max(longest, run);
    }
    String ticks = Strings.repeat("`", longest + 1);
    return ticks + " " + value + " " + ticks;
  }

  /** How a runtime value reads in prose: $VAR.path, literal text or a shell substitution. */
  static String runtimeValue(RuntimeExpression expr) {
    switch (expr.type()) {
      case VAR_REF:
        return expr.<RuntimeExpression.VarRef>cast().reference();
      case LITERAL:
        return expr.<RuntimeExpression.Literal>cast().plainText();
      default:
        return expr.shellValue();
    }
  }
}
