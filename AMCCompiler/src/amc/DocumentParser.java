package amc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.CaseFormat;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Turns the element tree of one source file into a {@link Document}. Dispatch is by tag name
 * through fixed lookup tables; anything not in them is an error.
 */
public final class DocumentParser {

  @FunctionalInterface
  private interface RootParser {
    Document parse(DocumentParser parser, Markup.Element root) throws CompilerException;
  }

  @FunctionalInterface
  private interface BlockParser {
    void parse(DocumentParser parser, Markup.Element element, List<Block> out)
        throws CompilerException;
  }

  @FunctionalInterface
  private interface InlineParser {
    Inline parse(DocumentParser parser, Markup.Element element) throws CompilerException;
  }

  private static final ImmutableMap<String, RootParser> ROOTS =
      ImmutableMap.<String, RootParser>builder()
          .put("Command", DocumentParser::command)
          .put("RuntimeCommand", DocumentParser::command)
          .put("Agent", DocumentParser::agent)
          .put("Skill", DocumentParser::skill)
          .put("MCPConfig", DocumentParser::mcpConfig)
          .put("State", DocumentParser::state)
          .build();

  // Semantic sections render as XML wrappers named after the tag.
  private static final ImmutableSet<String> SECTIONS =
      ImmutableSet.of(
          "Role",
          "Objective",
          "Context",
          "Process",
          "Constraints",
          "Methodology",
          "Philosophy",
          "Output",
          "DeviationRules",
          "CommitRules",
          "WaveExecution",
          "CheckpointHandling");

  private static final ImmutableMap<String, BlockParser> BLOCKS = blockParsers();

  private static ImmutableMap<String, BlockParser> blockParsers() {
    ImmutableMap.Builder<String, BlockParser> builder = ImmutableMap.builder();
    for (int level = 1; level <= 6; level++) {
      builder.put("h" + level, DocumentParser::heading);
    }
    builder
        .put("Heading", DocumentParser::heading)
        .put("p", DocumentParser::paragraph)
        .put("ul", DocumentParser::list)
        .put("ol", DocumentParser::list)
        .put("List", DocumentParser::listComponent)
        .put("pre", DocumentParser::codeBlock)
        .put("blockquote", DocumentParser::blockquote)
        .put("hr", DocumentParser::thematicBreak)
        .put("table", DocumentParser::table)
        .put("Table", DocumentParser::tableComponent)
        .put("div", DocumentParser::div)
        .put("XmlBlock", DocumentParser::xmlBlock)
        .put("XmlSection", DocumentParser::xmlSection)
        .put("ExecutionContext", DocumentParser::executionContext)
        .put("SuccessCriteria", DocumentParser::successCriteria)
        .put("OfferNext", DocumentParser::offerNext)
        .put("Step", DocumentParser::step)
        .put("Markdown", DocumentParser::markdown)
        .put("Bash", DocumentParser::bash)
        .put("PromptTemplate", DocumentParser::promptTemplate)
        .put("RuntimeVar", DocumentParser::runtimeVar)
        .put("Function", DocumentParser::function)
        .put("Helper", DocumentParser::helper)
        .put("Call", (p, e, out) -> out.add(p.runtime.call(e)))
        .put("Loop", (p, e, out) -> out.add(p.runtime.loop(e, p::lowerBlocks)))
        .put("Break", (p, e, out) -> out.add(p.runtime.breakLoop(e)))
        .put("Return", (p, e, out) -> out.add(p.runtime.returnStatement(e)))
        .put("AskUser", (p, e, out) -> out.add(p.runtime.askUser(e)))
        .put("SpawnAgent", (p, e, out) -> out.add(p.runtime.spawnAgent(e)))
        .put("OnStatus", (p, e, out) -> out.add(p.runtime.onStatus(e, p::lowerBlocks)))
        .put("ReadState", (p, e, out) -> out.add(p.runtime.readState(e)))
        .put("WriteState", (p, e, out) -> out.add(p.runtime.writeState(e)))
        .put("Assign", (p, e, out) -> out.add(p.runtime.assign(e)))
        .put("AssignGroup", (p, e, out) -> out.add(p.runtime.assignGroup(e)))
        .put("ReadFiles", (p, e, out) -> out.add(p.runtime.readFiles(e)));
    for (String section : SECTIONS) {
      builder.put(section, DocumentParser::section);
    }
    return builder.build();
  }

  private static final ImmutableMap<String, InlineParser> INLINES =
      ImmutableMap.<String, InlineParser>builder()
          .put("b", (p, e) -> new Inline.Bold(p.lowerInlines(e.children(), false)))
          .put("strong", (p, e) -> new Inline.Bold(p.lowerInlines(e.children(), false)))
          .put("i", (p, e) -> new Inline.Italic(p.lowerInlines(e.children(), false)))
          .put("em", (p, e) -> new Inline.Italic(p.lowerInlines(e.children(), false)))
          .put("code", DocumentParser::inlineCode)
          .put("a", DocumentParser::link)
          .put("br", (p, e) -> new Inline.LineBreak())
          .build();

  // Elements that are only valid in one place.
  private static final ImmutableMap<String, String> PLACED =
      ImmutableMap.<String, String>builder()
          .put("li", "directly under <ul> or <ol>")
          .put("Else", "immediately after an <If>")
          .put("Option", "inside <AskUser>")
          .put("SkillFile", "directly under <Skill>")
          .put("SkillStatic", "directly under <Skill>")
          .put("Field", "directly under <State>")
          .put("Operation", "directly under <State>")
          .put("MCPServer", "directly under <MCPConfig>")
          .put("thead", "inside <table>")
          .put("tbody", "inside <table>")
          .put("tr", "inside <table>")
          .put("th", "inside <tr>")
          .put("td", "inside <tr>")
          .build();

  private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");
  private static final Pattern PLACEHOLDER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

  private final String file;
  private final String outputRoot;
  private final FunctionRegistry registry;
  private final List<Diagnostic> warnings = new ArrayList<>();
  private RuntimeTransform runtime;

  public DocumentParser(String file, String outputRoot, FunctionRegistry registry) {
    this.file = file;
    this.outputRoot = outputRoot;
    this.registry = registry;
  }

  public Document parse(String content) throws CompilerException {
    return parse(Markup.parse(file, content));
  }

  public Document parse(Markup.Element root) throws CompilerException {
    RootParser rootParser = ROOTS.get(root.name());
    if (rootParser == null) {
      throw new CompilerException(
          root.pos(),
          String.format(
              "unknown root element <%s>; expected one of %s",
              root.name(),
              Joiner.on(", ").join(ROOTS.keySet())));
    }

    runtime =
        new RuntimeTransform(
            file, RuntimeTransform.isRuntimeDocument(root), outputRoot, registry);
    runtime.declareVariables(root);
    Document document = rootParser.parse(this, root);
    runtime.registerFunctions();
    return document;
  }

  /** Non-fatal findings from the last parse. */
  public ImmutableList<Diagnostic> warnings() {
    return ImmutableList.copyOf(warnings);
  }

  private void warn(Tokenizer.Pos pos, String message) {
    warnings.add(Diagnostic.warning(pos, message));
  }

  //
  // Roots
  //

  private Document.Header header(Markup.Element root, boolean descriptionRequired)
      throws CompilerException {
    String name = Attributes.requiredString(root, "name");
    if (name.isEmpty() || name.contains("/") || name.contains("\\")) {
      throw new CompilerException(
          Attributes.valuePos(root, "name"),
          String.format("'%s' is not a valid document name", name));
    }
    Optional<String> description = Attributes.string(root, "description");
    if (descriptionRequired && !description.isPresent()) {
      throw Attributes.missing(root, "description");
    }
    return Document.Header.create(file, name, description, root.pos());
  }

  private Document.Content content(List<Block> blocks) {
    return new Document.Content(
        blocks, runtime.functions(), runtime.helpers(), runtime.active());
  }

  private Optional<String> folder(Markup.Element root) throws CompilerException {
    Optional<String> folder = Attributes.string(root, "folder");
    if (folder.isPresent()
        && (folder.get().startsWith("/")
            || Splitter.on('/').splitToList(folder.get()).contains(".."))) {
      throw new CompilerException(
          Attributes.valuePos(root, "folder"), "folder must be a relative path");
    }
    return folder;
  }

  private Document command(Markup.Element root) throws CompilerException {
    Attributes.checkAllowed(
        root,
        ImmutableSet.of(
            "name", "description", "allowedTools", "argumentHint", "model", "folder"));
    return new Document.Command(
        header(root, true),
        content(lowerBlocks(root.children())),
        Attributes.stringList(root, "allowedTools").orElse(ImmutableList.of()),
        Attributes.string(root, "argumentHint"),
        Attributes.string(root, "model"),
        folder(root));
  }

  private Document agent(Markup.Element root) throws CompilerException {
    Attributes.checkAllowed(
        root,
        ImmutableSet.of("name", "description", "tools", "color", "model", "input", "folder"));
    Optional<Shape> input = Optional.empty();
    Optional<Tokenizer.Pos> inputPos = Optional.empty();
    if (root.attribute("input").isPresent()) {
      input = Optional.of(Shape.fromAttribute(root.attribute("input").get()));
      inputPos = Optional.of(Attributes.valuePos(root, "input"));
      if (input.get().kind() != Shape.Kind.OBJECT) {
        throw new CompilerException(inputPos.get(), "an agent's input must be an object shape");
      }
    }
    return new Document.Agent(
        header(root, true),
        content(lowerBlocks(root.children())),
        Attributes.string(root, "tools"),
        Attributes.string(root, "color"),
        Attributes.string(root, "model"),
        input,
        inputPos,
        folder(root));
  }

  private Document skill(Markup.Element root) throws CompilerException {
    Attributes.checkAllowed(
        root,
        ImmutableSet.of(
            "name",
            "description",
            "disableModelInvocation",
            "userInvocable",
            "allowedTools",
            "argumentHint",
            "model",
            "context",
            "agent"));
    Document.SkillOptions.Builder options = Document.SkillOptions.builder();
    Attributes.bool(root, "disableModelInvocation").ifPresent(options::setDisableModelInvocation);
    Attributes.bool(root, "userInvocable").ifPresent(options::setUserInvocable);
    Attributes.stringList(root, "allowedTools").ifPresent(options::setAllowedTools);
    Attributes.string(root, "argumentHint").ifPresent(options::setArgumentHint);
    Attributes.string(root, "model").ifPresent(options::setModel);
    Attributes.string(root, "context").ifPresent(options::setContext);
    Attributes.string(root, "agent").ifPresent(options::setAgent);

    List<Markup.Node> body = new ArrayList<>();
    List<Document.SkillFile> files = new ArrayList<>();
    List<Document.SkillStatic> statics = new ArrayList<>();
    Map<String, Tokenizer.Pos> destinations = new LinkedHashMap<>();
    for (Markup.Node node : root.children()) {
      if (!node.isElement()) {
        body.add(node);
        continue;
      }

      Markup.Element element = node.cast();
      String dest;
      if (element.name().equals("SkillFile")) {
        Attributes.checkAllowed(element, ImmutableSet.of("name"));
        dest = relativePath(element, "name");
        files.add(new Document.SkillFile(dest, element.pos(), lowerBlocks(element.children())));
      } else if (element.name().equals("SkillStatic")) {
        Attributes.checkAllowed(element, ImmutableSet.of("src", "dest"));
        String src = relativePath(element, "src");
        dest = element.hasAttribute("dest") ? relativePath(element, "dest") : src;
        statics.add(Document.SkillStatic.create(src, dest, element.pos()));
      } else {
        body.add(node);
        continue;
      }

      if (dest.equals("SKILL.md") || destinations.containsKey(dest)) {
        throw new CompilerException(
            element.pos(),
            String.format("skill file '%s' is written twice", dest),
            destinations.getOrDefault(dest, root.pos()));
      }
      destinations.put(dest, element.pos());
    }

    return new Document.Skill(
        header(root, true), content(lowerBlocks(body)), options.build(), files, statics);
  }

  private static String relativePath(Markup.Element element, String attribute)
      throws CompilerException {
    String path = Attributes.requiredString(element, attribute);
    List<String> parts = Splitter.on('/').splitToList(path);
    if (path.isEmpty() || path.startsWith("/") || parts.contains("..") || parts.contains("")) {
      throw new CompilerException(
          Attributes.valuePos(element, attribute),
          String.format("'%s' must be a relative path inside the skill directory", path));
    }
    return path;
  }

  private Document mcpConfig(Markup.Element root) throws CompilerException {
    Attributes.checkAllowed(root, ImmutableSet.of("name"));
    String name = Attributes.string(root, "name").orElse("mcp");
    List<Document.McpServer> servers = new ArrayList<>();
    for (Markup.Element element : onlyChildren(root, "MCPServer")) {
      Attributes.checkAllowed(
          element, ImmutableSet.of("name", "type", "command", "args", "url", "headers", "env"));
      String type = Attributes.string(element, "type").orElse("stdio");
      Optional<String> command = Attributes.string(element, "command");
      Optional<String> url = Attributes.string(element, "url");
      switch (type) {
        case "stdio":
          if (!command.isPresent()) throw Attributes.missing(element, "command");
          break;
        case "http":
        case "sse":
          if (!url.isPresent()) throw Attributes.missing(element, "url");
          break;
        default:
          throw new CompilerException(
              Attributes.valuePos(element, "type"),
              String.format("unknown server type '%s'; expected stdio, http or sse", type));
      }
      servers.add(
          new Document.McpServer(
              Attributes.requiredString(element, "name"),
              element.pos(),
              type,
              command,
              Attributes.stringList(element, "args").orElse(ImmutableList.of()),
              url,
              stringMap(element, "headers"),
              stringMap(element, "env")));
    }
    return new Document.McpConfig(
        Document.Header.create(file, name, Optional.empty(), root.pos()), servers);
  }

  private static ImmutableMap<String, String> stringMap(Markup.Element element, String name)
      throws CompilerException {
    Optional<JsonNode> json = Attributes.json(element, name);
    if (!json.isPresent()) return ImmutableMap.of();
    if (!json.get().isObject()) {
      throw new CompilerException(
          Attributes.valuePos(element, name),
          String.format("attribute '%s' of <%s> must be an object", name, element.name()));
    }
    ImmutableMap.Builder<String, String> out = ImmutableMap.builder();
    json.get().fields().forEachRemaining(e -> out.put(e.getKey(), Attributes.asText(e.getValue())));
    return out.build();
  }

  private Document state(Markup.Element root) throws CompilerException {
    Attributes.checkAllowed(root, ImmutableSet.of("name", "description", "provider", "database"));
    String provider = Attributes.string(root, "provider").orElse(SqliteProvider.NAME);
    if (!StorageProvider.forName(provider).isPresent()) {
      throw new CompilerException(
          Attributes.valuePos(root, "provider"),
          String.format("unknown storage provider '%s'", provider));
    }
    String database = Attributes.requiredString(root, "database");

    List<Document.StateField> fields = new ArrayList<>();
    List<Document.StateOperation> operations = new ArrayList<>();
    Map<String, Tokenizer.Pos> names = new LinkedHashMap<>();
    for (Markup.Element element : onlyChildren(root, "Field", "Operation")) {
      String name = Attributes.requiredString(element, "name");
      if (element.name().equals("Field")) {
        Attributes.checkAllowed(element, ImmutableSet.of("name", "type", "default", "values"));
        fields.add(stateField(element, name));
        if (names.containsKey(name)) {
          throw new CompilerException(
              element.pos(), String.format("field '%s' is declared twice", name), names.get(name));
        }
        names.put(name, element.pos());
      } else {
        Attributes.checkAllowed(element, ImmutableSet.of("name"));
        if (StorageProvider.BUILTIN_OPERATIONS.contains(name)
            || operations.stream().anyMatch(o -> o.name().equals(name))) {
          throw new CompilerException(
              element.pos(), String.format("operation '%s' is already defined", name));
        }
        String sql = rawContent(element, true);
        Set<String> args = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(sql);
        while (matcher.find()) args.add(matcher.group(1));
        operations.add(
            Document.StateOperation.create(name, sql, ImmutableList.copyOf(args), element.pos()));
      }
    }
    if (fields.isEmpty()) {
      throw new CompilerException(root.pos(), "<State> requires at least one <Field>");
    }

    return new Document.State(header(root, false), provider, database, fields, operations);
  }

  private static Document.StateField stateField(Markup.Element element, String name)
      throws CompilerException {
    String typeName = Attributes.string(element, "type").orElse("string");
    Document.FieldType type;
    switch (typeName) {
      case "string":
        type = Document.FieldType.STRING;
        break;
      case "number":
        type = Document.FieldType.NUMBER;
        break;
      case "boolean":
        type = Document.FieldType.BOOLEAN;
        break;
      default:
        throw new CompilerException(
            Attributes.valuePos(element, "type"),
            String.format("unknown field type '%s'; expected string, number or boolean", typeName));
    }

    Optional<String> defaultValue = Attributes.string(element, "default");
    if (type == Document.FieldType.BOOLEAN && defaultValue.isPresent()) {
      defaultValue = Optional.of(defaultValue.get().equals("true") ? "1" : "0");
    } else if (type == Document.FieldType.NUMBER
        && defaultValue.isPresent()
        && !NUMBER.matcher(defaultValue.get()).matches()) {
      throw new CompilerException(
          Attributes.valuePos(element, "default"),
          String.format(
              "default '%s' of number field '%s' is not a number", defaultValue.get(), name));
    }
    ImmutableList<String> values =
        Attributes.stringList(element, "values").orElse(ImmutableList.of());
    if (defaultValue.isPresent() && !values.isEmpty() && !values.contains(defaultValue.get())) {
      throw new CompilerException(
          Attributes.valuePos(element, "default"),
          String.format("default '%s' is not one of the allowed values", defaultValue.get()));
    }
    return Document.StateField.create(name, type, defaultValue, values, element.pos());
  }

  // The element children of a container that only holds the given tags.
  private static ImmutableList<Markup.Element> onlyChildren(
      Markup.Element parent, String... names) throws CompilerException {
    ImmutableSet<String> allowed = ImmutableSet.copyOf(names);
    ImmutableList.Builder<Markup.Element> out = ImmutableList.builder();
    for (Markup.Node node : parent.children()) {
      if (node.isBlank()) continue;
      if (!node.isElement() || !allowed.contains(node.<Markup.Element>cast().name())) {
        throw new CompilerException(
            node.pos(),
            String.format(
                "<%s> expects %s children, got %s",
                parent.name(),
                allowed.stream().map(n -> "<" + n + ">").collect(Collectors.joining(" or ")),
                RuntimeTransform.describe(node)));
      }
      out.add(node.<Markup.Element>cast());
    }
    return out.build();
  }

  //
  // Blocks
  //

  private ImmutableList<Block> lowerBlocks(List<Markup.Node> nodes) throws CompilerException {
    List<Block> out = new ArrayList<>();
    List<Markup.Node> inline = new ArrayList<>();
    for (int i = 0; i < nodes.size(); i++) {
      Markup.Node node = nodes.get(i);
      if (!node.isElement() || INLINES.containsKey(node.<Markup.Element>cast().name())) {
        inline.add(node);
        continue;
      }

      flushParagraph(inline, out);
      Markup.Element element = node.cast();
      if (element.name().equals("If")) {
        Optional<Markup.Element> elseElement = Optional.empty();
        int next = i + 1;
        while (next < nodes.size() && nodes.get(next).isBlank()) next++;
        if (next < nodes.size()
            && nodes.get(next).isElement()
            && nodes.get(next).<Markup.Element>cast().name().equals("Else")) {
          elseElement = Optional.of(nodes.get(next).cast());
          i = next;
        }
        out.add(runtime.conditional(element, elseElement, this::lowerBlocks));
        continue;
      }

      BlockParser parser = BLOCKS.get(element.name());
      if (parser == null) throw unexpected(element);
      parser.parse(this, element, out);
    }
    flushParagraph(inline, out);
    return ImmutableList.copyOf(out);
  }

  private static CompilerException unexpected(Markup.Element element) {
    String placement = PLACED.get(element.name());
    if (placement != null) {
      return new CompilerException(
          element.pos(), String.format("<%s> is only valid %s", element.name(), placement));
    }
    return new CompilerException(
        element.pos(), String.format("unknown element <%s>", element.name()));
  }

  private void flushParagraph(List<Markup.Node> inline, List<Block> out)
      throws CompilerException {
    if (inline.isEmpty()) return;
    ImmutableList<Inline> children = lowerInlines(inline, true);
    if (!children.isEmpty()) out.add(new Block.Paragraph(children, inline.get(0).pos()));
    inline.clear();
  }

  private void heading(Markup.Element element, List<Block> out) throws CompilerException {
    int level;
    if (element.name().equals("Heading")) {
      Attributes.checkAllowed(element, ImmutableSet.of("level"));
      Optional<Integer> value = Attributes.integer(element, "level");
      if (!value.isPresent()) throw Attributes.missing(element, "level");
      level = value.get();
    } else {
      Attributes.checkAllowed(element, ImmutableSet.of());
      level = element.name().charAt(1) - '0';
    }
    out.add(new Block.Heading(level, lowerInlines(element.children(), true), element.pos()));
  }

  private void paragraph(Markup.Element element, List<Block> out) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of());
    ImmutableList<Inline> children = lowerInlines(element.children(), true);
    if (!children.isEmpty()) out.add(new Block.Paragraph(children, element.pos()));
  }

  private void warnStart(Markup.Element element) {
    if (element.hasAttribute("start")) {
      warn(
          element.attribute("start").get().namePos(),
          "ordered lists always start at 1; 'start' is ignored");
    }
  }

  private void list(Markup.Element element, List<Block> out) throws CompilerException {
    boolean ordered = element.name().equals("ol");
    Attributes.checkAllowed(element, ordered ? ImmutableSet.of("start") : ImmutableSet.of());
    warnStart(element);
    out.add(new Block.ListBlock(ordered, listItems(element), element.pos()));
  }

  private ImmutableList<Block.ListItem> listItems(Markup.Element element)
      throws CompilerException {
    ImmutableList.Builder<Block.ListItem> items = ImmutableList.builder();
    for (Markup.Element item : onlyChildren(element, "li")) {
      Attributes.checkAllowed(item, ImmutableSet.of());
      items.add(new Block.ListItem(lowerBlocks(item.children())));
    }
    return items.build();
  }

  private void listComponent(Markup.Element element, List<Block> out) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("items", "ordered", "start"));
    boolean ordered = Attributes.flag(element, "ordered");
    warnStart(element);

    Optional<ImmutableList<String>> items = Attributes.stringList(element, "items");
    if (!items.isPresent()) {
      out.add(new Block.ListBlock(ordered, listItems(element), element.pos()));
      return;
    }
    if (element.children().stream().anyMatch(n -> !n.isBlank())) {
      throw new CompilerException(
          element.pos(), "<List> takes either an items attribute or <li> children, not both");
    }

    Tokenizer.Pos pos = Attributes.valuePos(element, "items");
    ImmutableList.Builder<Block.ListItem> listItems = ImmutableList.builder();
    for (String item : items.get()) {
      listItems.add(
          new Block.ListItem(
              ImmutableList.of(
                  new Block.Paragraph(ImmutableList.of(new Inline.Text(item)), pos))));
    }
    out.add(new Block.ListBlock(ordered, listItems.build(), element.pos()));
  }

  private void codeBlock(Markup.Element element, List<Block> out) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("lang", "language"));
    Optional<String> language = Attributes.string(element, "lang");
    if (!language.isPresent()) language = Attributes.string(element, "language");
    out.add(new Block.CodeBlock(language, rawContent(element, false), element.pos()));
  }

  private void blockquote(Markup.Element element, List<Block> out) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of());
    out.add(new Block.Blockquote(lowerBlocks(element.children()), element.pos()));
  }

  private void thematicBreak(Markup.Element element, List<Block> out) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of());
    if (element.children().stream().anyMatch(n -> !n.isBlank())) {
      throw new CompilerException(element.pos(), "<hr> cannot have children");
    }
    out.add(new Block.ThematicBreak(element.pos()));
  }

  private void table(Markup.Element element, List<Block> out) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of());
    Optional<Markup.Element> headerRow = Optional.empty();
    List<Markup.Element> bodyRows = new ArrayList<>();
    for (Markup.Element child : onlyChildren(element, "thead", "tbody", "tr")) {
      Attributes.checkAllowed(child, ImmutableSet.of());
      switch (child.name()) {
        case "thead":
          {
            ImmutableList<Markup.Element> rows = onlyChildren(child, "tr");
            for (int i = 0; i < rows.size(); i++) {
              if (i == 0 && !headerRow.isPresent()) {
                headerRow = Optional.of(rows.get(i));
              } else {
                bodyRows.add(rows.get(i));
              }
            }
            break;
          }
        case "tbody":
          bodyRows.addAll(onlyChildren(child, "tr"));
          break;
        default:
          bodyRows.add(child);
      }
    }
    // Without a thead, a leading row of th cells is the header.
    if (!headerRow.isPresent()
        && !bodyRows.isEmpty()
        && !bodyRows.get(0).childElements().isEmpty()
        && bodyRows.get(0).childElements().stream().allMatch(c -> c.name().equals("th"))) {
      headerRow = Optional.of(bodyRows.remove(0));
    }

    Optional<Block.TableRow> header = Optional.empty();
    List<Block.Align> aligns = new ArrayList<>();
    if (headerRow.isPresent()) {
      header = Optional.of(tableRow(headerRow.get()));
      for (Markup.Element cell : headerRow.get().childElements()) {
        aligns.add(align(cell, Attributes.string(cell, "align")));
      }
    }
    List<Block.TableRow> rows = new ArrayList<>();
    for (Markup.Element row : bodyRows) rows.add(tableRow(row));
    out.add(checkedTable(header, rows, aligns, "", element.pos()));
  }

  private Block.TableRow tableRow(Markup.Element row) throws CompilerException {
    Attributes.checkAllowed(row, ImmutableSet.of());
    ImmutableList.Builder<Block.Paragraph> cells = ImmutableList.builder();
    for (Markup.Element cell : onlyChildren(row, "th", "td")) {
      Attributes.checkAllowed(cell, ImmutableSet.of("align"));
      cells.add(new Block.Paragraph(lowerInlines(cell.children(), true), cell.pos()));
    }
    return new Block.TableRow(cells.build());
  }

  private static Block.Align align(Markup.Element element, Optional<String> value)
      throws CompilerException {
    if (!value.isPresent()) return Block.Align.NONE;
    switch (value.get()) {
      case "left":
        return Block.Align.LEFT;
      case "center":
        return Block.Align.CENTER;
      case "right":
        return Block.Align.RIGHT;
      default:
        throw new CompilerException(
            Attributes.valuePos(element, "align"),
            String.format("unknown alignment '%s'; expected left, center or right", value.get()));
    }
  }

  private void tableComponent(Markup.Element element, List<Block> out) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("headers", "rows", "align", "emptyCell"));
    Tokenizer.Pos pos = element.pos();
    Optional<Block.TableRow> header =
        Attributes.stringList(element, "headers").map(h -> textRow(h, pos));

    List<Block.TableRow> rows = new ArrayList<>();
    Optional<JsonNode> json = Attributes.json(element, "rows");
    if (!json.isPresent()) throw Attributes.missing(element, "rows");
    if (!json.get().isArray()) {
      throw new CompilerException(
          Attributes.valuePos(element, "rows"), "rows must be an array of arrays");
    }
    for (JsonNode row : json.get()) {
      if (!row.isArray()) {
        throw new CompilerException(
            Attributes.valuePos(element, "rows"), "rows must be an array of arrays");
      }
      List<String> cells = new ArrayList<>();
      row.forEach(cell -> cells.add(cell.isNull() ? "" : Attributes.asText(cell)));
      rows.add(textRow(cells, pos));
    }

    List<Block.Align> aligns = new ArrayList<>();
    for (String align : Attributes.stringList(element, "align").orElse(ImmutableList.of())) {
      aligns.add(align(element, Optional.of(align)));
    }
    out.add(
        checkedTable(
            header, rows, aligns, Attributes.string(element, "emptyCell").orElse(""), pos));
  }

  private static Block.TableRow textRow(List<String> cells, Tokenizer.Pos pos) {
    return new Block.TableRow(
        cells
            .stream()
            .map(
                c ->
                    new Block.Paragraph(
                        c.isEmpty() ? ImmutableList.of() : ImmutableList.of(new Inline.Text(c)),
                        pos))
            .collect(ImmutableList.toImmutableList()));
  }

  private static Block.Table checkedTable(
      Optional<Block.TableRow> header,
      List<Block.TableRow> rows,
      List<Block.Align> aligns,
      String emptyCell,
      Tokenizer.Pos pos)
      throws CompilerException {
    if (header.isPresent()) {
      int columns = header.get().cells().size();
      for (int i = 0; i < rows.size(); i++) {
        if (rows.get(i).cells().size() > columns) {
          throw new CompilerException(
              pos,
              String.format(
                  "row %d has %d cells but the table has %d columns",
                  i + 1, rows.get(i).cells().size(), columns));
        }
      }
    }
    return new Block.Table(header, rows, aligns, emptyCell, pos);
  }

  private void div(Markup.Element element, List<Block> out) throws CompilerException {
    if (!element.hasAttribute("name")) {
      Attributes.checkAllowed(element, ImmutableSet.of());
      out.addAll(lowerBlocks(element.children()));
      return;
    }
    xmlBlock(element, out);
  }

  private void xmlBlock(Markup.Element element, List<Block> out) throws CompilerException {
    String name = Attributes.requiredString(element, "name");
    if (!CharMatcher.javaLetterOrDigit().or(CharMatcher.anyOf("_-")).matchesAllOf(name)
        || name.isEmpty()) {
      throw new CompilerException(
          Attributes.valuePos(element, "name"),
          String.format("'%s' is not a valid XML tag name", name));
    }
    out.add(
        new Block.XmlBlock(
            name,
            xmlAttributes(element, ImmutableSet.of("name")),
            lowerBlocks(element.children()),
            element.pos()));
  }

  // Like XmlBlock, with "section" as the default name.
  private void xmlSection(Markup.Element element, List<Block> out) throws CompilerException {
    if (element.hasAttribute("name")) {
      xmlBlock(element, out);
      return;
    }
    out.add(
        new Block.XmlBlock(
            "section",
            xmlAttributes(element, ImmutableSet.of()),
            lowerBlocks(element.children()),
            element.pos()));
  }

  private void section(Markup.Element element, List<Block> out) throws CompilerException {
    out.add(
        new Block.XmlBlock(
            CaseFormat.UPPER_CAMEL.to(CaseFormat.LOWER_UNDERSCORE, element.name()),
            xmlAttributes(element, ImmutableSet.of()),
            lowerBlocks(element.children()),
            element.pos()));
  }

  private static ImmutableMap<String, String> xmlAttributes(
      Markup.Element element, ImmutableSet<String> skip) throws CompilerException {
    ImmutableMap.Builder<String, String> out = ImmutableMap.builder();
    for (Tokenizer.Attribute attr : element.attributes()) {
      if (skip.contains(attr.name())) continue;
      out.put(attr.name(), Attributes.requiredString(element, attr.name()));
    }
    return out.build();
  }

  private void executionContext(Markup.Element element, List<Block> out)
      throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("paths", "prefix"));
    Optional<ImmutableList<String>> paths = Attributes.stringList(element, "paths");
    if (!paths.isPresent()) throw Attributes.missing(element, "paths");
    out.add(
        new Block.ExecutionContext(
            paths.get(),
            Attributes.string(element, "prefix").orElse("@"),
            lowerBlocks(element.children()),
            element.pos()));
  }

  private void successCriteria(Markup.Element element, List<Block> out)
      throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("items"));
    Optional<JsonNode> items = Attributes.json(element, "items");
    if (!items.isPresent()) throw Attributes.missing(element, "items");
    if (!items.get().isArray()) {
      throw new CompilerException(
          Attributes.valuePos(element, "items"), "items must be an array");
    }

    List<Block.Criterion> criteria = new ArrayList<>();
    for (JsonNode item : items.get()) {
      if (item.isObject() && item.has("text")) {
        criteria.add(
            new Block.Criterion(
                item.get("text").asText(), item.has("checked") && item.get("checked").asBoolean()));
      } else if (item.isValueNode() && !item.isNull()) {
        criteria.add(new Block.Criterion(item.asText(), false));
      } else {
        throw new CompilerException(
            Attributes.valuePos(element, "items"),
            "each item must be a string or {text, checked}");
      }
    }
    out.add(new Block.SuccessCriteria(criteria, element.pos()));
  }

  private void offerNext(Markup.Element element, List<Block> out) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("routes"));
    Optional<JsonNode> routes = Attributes.json(element, "routes");
    if (!routes.isPresent()) throw Attributes.missing(element, "routes");
    if (!routes.get().isArray()) {
      throw new CompilerException(
          Attributes.valuePos(element, "routes"), "routes must be an array");
    }

    List<Block.Route> out2 = new ArrayList<>();
    for (JsonNode route : routes.get()) {
      if (!route.isObject() || !route.has("name") || !route.has("path")) {
        throw new CompilerException(
            Attributes.valuePos(element, "routes"),
            "each route must be an object with name and path");
      }
      out2.add(
          new Block.Route(
              route.get("name").asText(),
              route.get("path").asText(),
              route.has("description")
                  ? Optional.of(route.get("description").asText())
                  : Optional.empty()));
    }
    out.add(new Block.OfferNext(out2, element.pos()));
  }

  private void step(Markup.Element element, List<Block> out) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("number", "name", "variant"));
    String variantName = Attributes.string(element, "variant").orElse("heading");
    Block.StepVariant variant;
    switch (variantName) {
      case "heading":
        variant = Block.StepVariant.HEADING;
        break;
      case "bold":
        variant = Block.StepVariant.BOLD;
        break;
      case "xml":
        variant = Block.StepVariant.XML;
        break;
      default:
        throw new CompilerException(
            Attributes.valuePos(element, "variant"),
            String.format("unknown step variant '%s'; expected heading, bold or xml", variantName));
    }
    out.add(
        new Block.Step(
            Attributes.requiredString(element, "number"),
            Attributes.requiredString(element, "name"),
            variant,
            lowerBlocks(element.children()),
            element.pos()));
  }

  private void markdown(Markup.Element element, List<Block> out) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of());
    out.add(new Block.Raw(rawContent(element, true), element.pos()));
  }

  private void bash(Markup.Element element, List<Block> out) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of());
    out.add(new Block.CodeBlock(Optional.of("bash"), rawContent(element, true), element.pos()));
  }

  private void promptTemplate(Markup.Element element, List<Block> out)
      throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of());
    out.add(new Block.PromptTemplate(lowerBlocks(element.children()), element.pos()));
  }

  private void runtimeVar(Markup.Element element, List<Block> out) {
    out.add(runtime.declaration(element));
  }

  private void function(Markup.Element element, List<Block> out) throws CompilerException {
    runtime.declareFunction(element, rawContent(element, true));
  }

  private void helper(Markup.Element element, List<Block> out) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("name"));
    runtime.declareHelper(rawContent(element, true));
  }

  //
  // Inline content
  //

  private ImmutableList<Inline> lowerInlines(List<Markup.Node> nodes, boolean trimEdges)
      throws CompilerException {
    List<Inline> out = new ArrayList<>();
    for (Markup.Node node : nodes) {
      switch (node.type()) {
        case TEXT:
          {
            String text = normalizeText(node.<Markup.Text>cast().text());
            if (!text.isEmpty()) out.add(new Inline.Text(text));
            break;
          }
        case INTERPOLATION:
          out.add(runtime.interpolate(node.cast()));
          break;
        default:
          {
            Markup.Element element = node.cast();
            InlineParser parser = INLINES.get(element.name());
            if (parser == null) {
              if (BLOCKS.containsKey(element.name()) || element.name().equals("If")) {
                throw new CompilerException(
                    element.pos(),
                    String.format("<%s> is not allowed inside inline content", element.name()));
              }
              throw unexpected(element);
            }
            out.add(parser.parse(this, element));
          }
      }
    }
    return trimEdges ? trim(mergeText(out)) : mergeText(out);
  }

  private static ImmutableList<Inline> mergeText(List<Inline> inlines) {
    List<Inline> out = new ArrayList<>();
    for (Inline inline : inlines) {
      int last = out.size() - 1;
      if (inline.type() == Inline.Type.TEXT
          && last >= 0
          && out.get(last).type() == Inline.Type.TEXT) {
        String merged =
            out.get(last).<Inline.Text>cast().value() + inline.<Inline.Text>cast().value();
        out.set(last, new Inline.Text(CharMatcher.is(' ').collapseFrom(merged, ' ')));
      } else {
        out.add(inline);
      }
    }
    return ImmutableList.copyOf(out);
  }

  private static ImmutableList<Inline> trim(ImmutableList<Inline> inlines) {
    List<Inline> out = new ArrayList<>(inlines);
    if (!out.isEmpty() && out.get(0).type() == Inline.Type.TEXT) {
      String text =
          CharMatcher.whitespace().trimLeadingFrom(out.get(0).<Inline.Text>cast().value());
      if (text.isEmpty()) {
        out.remove(0);
      } else {
        out.set(0, new Inline.Text(text));
      }
    }
    int last = out.size() - 1;
    if (last >= 0 && out.get(last).type() == Inline.Type.TEXT) {
      String text =
          CharMatcher.whitespace().trimTrailingFrom(out.get(last).<Inline.Text>cast().value());
      if (text.isEmpty()) {
        out.remove(last);
      } else {
        out.set(last, new Inline.Text(text));
      }
    }
    return ImmutableList.copyOf(out);
  }

  /**
   * Whitespace handling for text runs: whitespace touching a line break disappears, lines that
   * are only whitespace are dropped, and the remaining lines are joined by single spaces.
   */
  static String normalizeText(String text) {
    List<String> lines = Splitter.on('\n').splitToList(text);
    if (lines.size() == 1) return CharMatcher.whitespace().collapseFrom(text, ' ');

    List<String> kept = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      if (i > 0) line = CharMatcher.whitespace().trimLeadingFrom(line);
      if (i < lines.size() - 1) line = CharMatcher.whitespace().trimTrailingFrom(line);
      if (!line.isEmpty()) kept.add(line);
    }
    return CharMatcher.whitespace().collapseFrom(Joiner.on(' ').join(kept), ' ');
  }

  private Inline inlineCode(Markup.Element element) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of());
    StringBuilder sb = new StringBuilder();
    for (Inline inline : lowerInlines(element.children(), true)) {
      switch (inline.type()) {
        case TEXT:
          sb.append(inline.<Inline.Text>cast().value());
          break;
        case RUNTIME_VALUE:
          sb.append(MarkdownWriter.runtimeValue(inline.<Inline.RuntimeValue>cast().expression()));
          break;
        default:
          throw new CompilerException(element.pos(), "<code> may only contain text");
      }
    }
    return new Inline.Code(sb.toString());
  }

  private Inline link(Markup.Element element) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("href"));
    return new Inline.Link(
        Attributes.requiredString(element, "href"), lowerInlines(element.children(), true));
  }

  //
  // Raw text
  //

  /** The verbatim text of a raw-text element, optionally without its common indentation. */
  static String rawContent(Markup.Element element, boolean dedent) throws CompilerException {
    StringBuilder sb = new StringBuilder();
    for (Markup.Node node : element.children()) {
      if (node.type() != Markup.Node.Type.TEXT) {
        throw new CompilerException(
            node.pos(), String.format("<%s> may only contain text", element.name()));
      }
      sb.append(node.<Markup.Text>cast().text());
    }

    String text = sb.toString();
    if (text.startsWith("\n")) text = text.substring(1);
    int lastNewline = text.lastIndexOf('\n');
    if (lastNewline >= 0 && CharMatcher.whitespace().matchesAllOf(text.substring(lastNewline))) {
      text = text.substring(0, lastNewline);
    }
    return dedent ? dedent(text) : text;
  }

  static String dedent(String text) {
    List<String> lines = Splitter.on('\n').splitToList(text);
    int indent = Integer.MAX_VALUE;
    for (String line : lines) {
      if (CharMatcher.whitespace().matchesAllOf(line)) continue;
      indent = Math.min(indent, CharMatcher.anyOf(" \t").negate().indexIn(line));
    }
    if (indent == Integer.MAX_VALUE) return "";

    List<String> out = new ArrayList<>();
    for (String line : lines) {
      out.add(
          CharMatcher.whitespace().matchesAllOf(line)
              ? ""
              : CharMatcher.whitespace().trimTrailingFrom(line.substring(indent)));
    }
    return Joiner.on('\n').join(out);
  }
}
