package amc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.base.Ascii;
import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

/**
 * Lowers the runtime constructs of one document: variable declarations, functions, expressions
 * and control flow. One instance per document; not thread-safe.
 */
public final class RuntimeTransform {

  @FunctionalInterface
  interface BlockLowering {
    ImmutableList<Block> lower(List<Markup.Node> nodes) throws CompilerException;
  }

  // Tags whose presence turns a document into a runtime document.
  static final ImmutableSet<String> RUNTIME_TAGS =
      ImmutableSet.of(
          "RuntimeVar",
          "Function",
          "Helper",
          "Call",
          "If",
          "Else",
          "Loop",
          "Break",
          "Return",
          "AskUser",
          "SpawnAgent",
          "OnStatus",
          "ReadState",
          "WriteState");

  public static boolean isRuntimeDocument(Markup.Element root) {
    return root.name().equals("RuntimeCommand") || containsRuntimeTag(root);
  }

  private static boolean containsRuntimeTag(Markup.Element element) {
    for (Markup.Element child : element.childElements()) {
      if (RUNTIME_TAGS.contains(child.name()) || containsRuntimeTag(child)) return true;
    }
    return false;
  }

  private static final class LoopFrame {
    private final int conditionDepth;
    private Optional<Tokenizer.Pos> breakPos = Optional.empty();
    private Optional<RuntimeExpression> exitCondition = Optional.empty();

    private LoopFrame(int conditionDepth) {
      this.conditionDepth = conditionDepth;
    }
  }

  private final String file;
  private final boolean active;
  private final String outputRoot;
  private final FunctionRegistry registry;

  private final Map<String, Block.VariableDeclaration> variablesByRef = new LinkedHashMap<>();
  private final Map<String, Block.VariableDeclaration> variablesByName = new LinkedHashMap<>();
  private final Map<Markup.Element, Block.VariableDeclaration> declarations =
      new IdentityHashMap<>();
  private final Map<String, FunctionDescriptor> functions = new LinkedHashMap<>();
  private final List<String> helpers = new ArrayList<>();

  private final Deque<RuntimeExpression> conditions = new ArrayDeque<>();
  private final Deque<LoopFrame> loops = new ArrayDeque<>();

  public RuntimeTransform(
      String file, boolean active, String outputRoot, FunctionRegistry registry) {
    this.file = file;
    this.active = active;
    this.outputRoot = outputRoot;
    this.registry = registry;
  }

  public boolean active() {
    return active;
  }

  public ImmutableList<FunctionDescriptor> functions() {
    return ImmutableList.copyOf(functions.values());
  }

  public ImmutableList<String> helpers() {
    return ImmutableList.copyOf(helpers);
  }

  public Optional<Block.VariableDeclaration> variable(String ref) {
    return Optional.ofNullable(variablesByRef.get(ref));
  }

  // Variables are visible to the whole document, wherever they are declared.
  void declareVariables(Markup.Element element) throws CompilerException {
    for (Markup.Element child : element.childElements()) {
      if (child.name().equals("RuntimeVar")) {
        declareVariable(child);
      } else {
        declareVariables(child);
      }
    }
  }

  private void declareVariable(Markup.Element element) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("name", "ref", "shape"));
    String name = Attributes.requiredString(element, "name");
    String ref = Attributes.string(element, "ref").orElse(name);
    Shape shape =
        element.attribute("shape").isPresent()
            ? Shape.fromAttribute(element.attribute("shape").get())
            : Shape.any();
    if (!isShellName(name)) {
      throw new CompilerException(
          Attributes.valuePos(element, "name"),
          String.format("runtime variable name '%s' is not a valid shell variable name", name));
    }

    Block.VariableDeclaration previous =
        variablesByRef.containsKey(ref) ? variablesByRef.get(ref) : variablesByName.get(name);
    if (previous != null) {
      throw new CompilerException(
          element.pos(),
          String.format("runtime variable '%s' is declared twice", ref),
          previous.pos());
    }

    Block.VariableDeclaration decl =
        new Block.VariableDeclaration(name, ref, shape, element.pos());
    variablesByRef.put(ref, decl);
    variablesByName.put(name, decl);
    declarations.put(element, decl);
  }

  private static boolean isShellName(String name) {
    if (name.isEmpty() || Character.isDigit(name.charAt(0))) return false;
    return name.chars().allMatch(c -> c == '_' || (c < 128 && Character.isLetterOrDigit(c)));
  }

  Block.VariableDeclaration declaration(Markup.Element element) {
    return declarations.get(element);
  }

  void declareFunction(Markup.Element element, String body) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("name", "params", "returns"));
    String id = Attributes.requiredString(element, "name");
    if (!isShellName(id)) {
      throw new CompilerException(
          Attributes.valuePos(element, "name"),
          String.format("function name '%s' is not a valid identifier", id));
    }
    if (Bundler.RESERVED_NAMES.contains(id)) {
      throw new CompilerException(
          Attributes.valuePos(element, "name"),
          String.format("function name '%s' is reserved in the runtime module", id));
    }
    Optional<Shape> params = Optional.empty();
    if (element.attribute("params").isPresent()) {
      params = Optional.of(Shape.fromAttribute(element.attribute("params").get()));
    }
    Optional<Shape> returns = Optional.empty();
    if (element.attribute("returns").isPresent()) {
      returns = Optional.of(Shape.fromAttribute(element.attribute("returns").get()));
    }

    FunctionDescriptor previous = functions.get(id);
    if (previous != null) {
      throw new CompilerException(
          element.pos(), String.format("function '%s' is declared twice", id), previous.pos());
    }
    FunctionDescriptor descriptor =
        FunctionDescriptor.create(id, params, returns, body, file, element.pos());
    functions.put(id, descriptor);
  }

  // Called once the whole document lowered cleanly, so failed documents contribute nothing.
  void registerFunctions() {
    registry.registerAll(functions.values());
  }

  void declareHelper(String code) {
    helpers.add(code);
  }

  /** Lowers an expression with runtime semantics; unsupported forms are errors. */
  public RuntimeExpression lower(Expression expr) throws CompilerException {
    switch (expr.type()) {
      case STRING:
      case NUMBER:
      case BOOLEAN:
      case NULL:
        return new RuntimeExpression.Literal(expr.literalJson(), expr.pos());
      case OBJECT:
      case ARRAY:
        if (expr.isLiteral()) return new RuntimeExpression.Literal(expr.literalJson(), expr.pos());
        throw unsupported(expr);
      case IDENTIFIER:
      case MEMBER:
      case INDEX:
        return varRef(expr);
      case UNARY:
        {
          Expression.Unary unary = expr.cast();
          return new RuntimeExpression.Logical(
              RuntimeExpression.LogicalOperator.NOT,
              ImmutableList.of(lower(unary.operand())),
              expr.pos());
        }
      case BINARY:
        {
          Expression.Binary binary = expr.cast();
          RuntimeExpression lhs = lower(binary.lhs());
          RuntimeExpression rhs = lower(binary.rhs());
          if (binary.op().isLogical()) {
            return new RuntimeExpression.Logical(
                binary.op() == Expression.BinaryOperator.AND
                    ? RuntimeExpression.LogicalOperator.AND
                    : RuntimeExpression.LogicalOperator.OR,
                ImmutableList.of(lhs, rhs),
                expr.pos());
          }
          return new RuntimeExpression.Comparison(
              RuntimeExpression.ComparisonOperator.of(binary.op()), lhs, rhs, expr.pos());
        }
      case TERNARY:
        {
          Expression.Ternary ternary = expr.cast();
          return new RuntimeExpression.Ternary(
              lower(ternary.condition()),
              lower(ternary.then()),
              lower(ternary.otherwise()),
              expr.pos());
        }
      default:
        throw unsupported(expr);
    }
  }

  private static CompilerException unsupported(Expression expr) {
    return new CompilerException(
        expr.pos(),
        String.format(
            "unsupported runtime expression '%s': expected a literal, a variable path, a"
                + " comparison, a ternary or a logical expression",
            expr.raw()));
  }

  private RuntimeExpression.VarRef varRef(Expression expr) throws CompilerException {
    List<String> path = new ArrayList<>();
    Expression current = expr;
    while (current.type() != Expression.Type.IDENTIFIER) {
      if (current.type() == Expression.Type.MEMBER) {
        Expression.Member member = current.cast();
        path.add(member.name());
        current = member.object();
      } else if (current.type() == Expression.Type.INDEX) {
        Expression.Index index = current.cast();
        Expression key = index.index();
        if (key.type() == Expression.Type.STRING) {
          path.add(key.<Expression.StringLiteral>cast().value());
        } else if (key.type() == Expression.Type.NUMBER
            && key.<Expression.NumberLiteral>cast().isInteger()
            && !key.<Expression.NumberLiteral>cast().text().startsWith("-")) {
          path.add(key.<Expression.NumberLiteral>cast().text());
        } else {
          throw new CompilerException(
              key.pos(),
              String.format("index '%s' must be a string or a non-negative integer", key.raw()));
        }
        current = index.object();
      } else {
        throw unsupported(expr);
      }
    }

    String ref = current.<Expression.Identifier>cast().name();
    Block.VariableDeclaration decl = variablesByRef.get(ref);
    if (decl == null) {
      throw new CompilerException(
          current.pos(), String.format("'%s' is not a declared runtime variable", ref));
    }
    return new RuntimeExpression.VarRef(decl.name(), Lists.reverse(path), expr.pos());
  }

  /** An {expression} in text: a runtime value, or its source text in inert documents. */
  Inline interpolate(Markup.Interpolation interpolation) throws CompilerException {
    Expression expr = interpolation.parse();
    if (active) return new Inline.RuntimeValue(lower(expr));
    if (expr.type().isScalarLiteral()) {
      return new Inline.Text(Attributes.asText(expr.literalJson()));
    }
    return new Inline.Text(expr.raw());
  }

  /** Resolves an output attribute to the shell name of a declared variable. */
  Optional<String> output(Markup.Element element) throws CompilerException {
    Optional<Tokenizer.Attribute> attr = element.attribute("output");
    if (!attr.isPresent()) return Optional.empty();

    Block.VariableDeclaration decl;
    switch (attr.get().kind()) {
      case STRING:
        decl =
            variablesByRef.getOrDefault(
                attr.get().value(), variablesByName.get(attr.get().value()));
        break;
      case EXPRESSION:
        {
          Expression expr = Expression.parse(attr.get().value(), attr.get().valuePos());
          decl =
              expr.type() == Expression.Type.IDENTIFIER
                  ? variablesByRef.get(expr.<Expression.Identifier>cast().name())
                  : null;
          break;
        }
      default:
        decl = null;
    }
    if (decl == null) {
      throw new CompilerException(
          attr.get().valuePos(),
          String.format(
              "output of <%s> must name a declared runtime variable", element.name()));
    }
    return Optional.of(decl.name());
  }

  Block.RuntimeCall call(Markup.Element element) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("fn", "args", "output"));
    Tokenizer.Attribute fn = Attributes.required(element, "fn");
    String id;
    if (fn.kind() == Tokenizer.Attribute.Kind.EXPRESSION) {
      Expression expr = Expression.parse(fn.value(), fn.valuePos());
      if (expr.type() != Expression.Type.IDENTIFIER) {
        throw new CompilerException(fn.valuePos(), "fn must name a function");
      }
      id = expr.<Expression.Identifier>cast().name();
    } else {
      id = Attributes.requiredString(element, "fn");
    }

    List<String> names = new ArrayList<>();
    List<RuntimeExpression> values = new ArrayList<>();
    Optional<Expression> args = Attributes.expression(element, "args");
    if (args.isPresent()) {
      if (args.get().type() != Expression.Type.OBJECT) {
        throw new CompilerException(args.get().pos(), "args must be an object literal");
      }
      for (Map.Entry<String, Expression> entry :
          args.get().<Expression.ObjectLiteral>cast().asMap().entrySet()) {
        names.add(entry.getKey());
        values.add(lower(entry.getValue()));
      }
    }
    return new Block.RuntimeCall(id, names, values, output(element), element.pos());
  }

  Block.Conditional conditional(
      Markup.Element ifElement, Optional<Markup.Element> elseElement, BlockLowering lowering)
      throws CompilerException {
    Attributes.checkAllowed(ifElement, ImmutableSet.of("condition"));
    RuntimeExpression condition = lower(Attributes.requiredExpression(ifElement, "condition"));

    ImmutableList<Block> thenBlocks;
    conditions.push(condition);
    try {
      thenBlocks = lowering.lower(ifElement.children());
    } finally {
      conditions.pop();
    }

    Optional<ImmutableList<Block>> elseBlocks = Optional.empty();
    if (elseElement.isPresent()) {
      Attributes.checkAllowed(elseElement.get(), ImmutableSet.of());
      conditions.push(
          new RuntimeExpression.Logical(
              RuntimeExpression.LogicalOperator.NOT,
              ImmutableList.of(condition),
              elseElement.get().pos()));
      try {
        elseBlocks = Optional.of(lowering.lower(elseElement.get().children()));
      } finally {
        conditions.pop();
      }
    }
    return new Block.Conditional(condition, thenBlocks, elseBlocks, ifElement.pos());
  }

  Block.Loop loop(Markup.Element element, BlockLowering lowering) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("max", "counter"));
    Optional<Integer> max = Attributes.integer(element, "max");
    if (!max.isPresent()) throw Attributes.missing(element, "max");
    if (max.get() < 1) {
      throw new CompilerException(
          Attributes.valuePos(element, "max"), "max must be at least 1");
    }
    Optional<String> counter = Attributes.string(element, "counter");
    if (counter.isPresent() && !isShellName(counter.get())) {
      throw new CompilerException(
          Attributes.valuePos(element, "counter"),
          String.format("counter '%s' is not a valid shell variable name", counter.get()));
    }

    LoopFrame frame = new LoopFrame(conditions.size());
    ImmutableList<Block> children;
    loops.push(frame);
    try {
      children = lowering.lower(element.children());
    } finally {
      loops.pop();
    }
    return new Block.Loop(max.get(), counter, children, frame.exitCondition, element.pos());
  }

  Block.Break breakLoop(Markup.Element element) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("when", "message"));
    LoopFrame frame = loops.peek();
    if (frame == null) {
      throw new CompilerException(element.pos(), "<Break> is only valid inside a <Loop>");
    }
    if (frame.breakPos.isPresent()) {
      throw new CompilerException(
          element.pos(), "a <Loop> may contain at most one <Break>", frame.breakPos.get());
    }
    frame.breakPos = Optional.of(element.pos());

    Optional<Expression> when = Attributes.expression(element, "when");
    if (when.isPresent()) {
      frame.exitCondition = Optional.of(lower(when.get()));
    } else {
      // The conditions guarding the Break inside this loop, outermost first.
      List<RuntimeExpression> guards =
          Lists.reverse(
              ImmutableList.copyOf(conditions)
                  .subList(0, conditions.size() - frame.conditionDepth));
      Optional<RuntimeExpression> exit = Optional.empty();
      for (RuntimeExpression guard : guards) {
        exit =
            Optional.of(
                exit.isPresent()
                    ? new RuntimeExpression.Logical(
                        RuntimeExpression.LogicalOperator.AND,
                        ImmutableList.of(exit.get(), guard),
                        guard.pos())
                    : guard);
      }
      frame.exitCondition = exit;
    }
    return new Block.Break(Attributes.string(element, "message"), element.pos());
  }

  Block.Return returnStatement(Markup.Element element) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("status", "message"));
    return new Block.Return(
        status(element), Attributes.string(element, "message"), element.pos());
  }

  private static Optional<Block.ReturnStatus> status(Markup.Element element)
      throws CompilerException {
    Optional<String> statusText = Attributes.string(element, "status");
    if (!statusText.isPresent()) return Optional.empty();
    try {
      return Optional.of(Block.ReturnStatus.valueOf(statusText.get()));
    } catch (IllegalArgumentException ex) {
      throw new CompilerException(
          Attributes.valuePos(element, "status"),
          String.format(
              "unknown status '%s'; expected one of %s",
              statusText.get(),
              ImmutableList.copyOf(Block.ReturnStatus.values())));
    }
  }

  Block.AskUser askUser(Markup.Element element) throws CompilerException {
    Attributes.checkAllowed(
        element, ImmutableSet.of("question", "header", "output", "multiSelect"));
    String question = Attributes.requiredString(element, "question");
    Optional<String> header = Attributes.string(element, "header");
    Optional<String> output = output(element);
    if (!output.isPresent()) throw Attributes.missing(element, "output");

    List<Block.Option> options = new ArrayList<>();
    for (Markup.Node child : element.children()) {
      if (child.isBlank()) continue;
      if (!child.isElement() || !child.<Markup.Element>cast().name().equals("Option")) {
        throw new CompilerException(
            child.pos(),
            String.format("<AskUser> expects <Option> children, got %s", describe(child)));
      }
      Markup.Element option = child.cast();
      Attributes.checkAllowed(option, ImmutableSet.of("value", "label", "description"));
      options.add(
          new Block.Option(
              Attributes.requiredString(option, "value"),
              Attributes.requiredString(option, "label"),
              Attributes.string(option, "description")));
    }
    if (options.isEmpty()) {
      throw new CompilerException(element.pos(), "<AskUser> requires at least one <Option>");
    }
    return new Block.AskUser(
        question,
        header,
        options,
        output.get(),
        Attributes.flag(element, "multiSelect"),
        element.pos());
  }

  Block.SpawnAgent spawnAgent(Markup.Element element) throws CompilerException {
    Attributes.checkAllowed(
        element,
        ImmutableSet.of(
            "agent", "model", "description", "prompt", "input", "output", "loadFromFile"));
    String agent = Attributes.requiredString(element, "agent");
    String model = Attributes.requiredString(element, "model");
    String description = Attributes.requiredString(element, "description");
    Optional<String> prompt = Attributes.string(element, "prompt");

    boolean hasInput = element.hasAttribute("input");
    if (prompt.isPresent() == hasInput) {
      throw new CompilerException(
          element.pos(),
          hasInput
              ? "<SpawnAgent> accepts only one of 'prompt' and 'input'"
              : "<SpawnAgent> requires either 'prompt' or 'input'");
    }

    List<Block.InputField> input = new ArrayList<>();
    if (hasInput) {
      Expression expr = Attributes.requiredExpression(element, "input");
      if (expr.type() != Expression.Type.OBJECT) {
        throw new CompilerException(expr.pos(), "input of <SpawnAgent> must be an object literal");
      }
      for (Expression.ObjectLiteral.Entry entry :
          expr.<Expression.ObjectLiteral>cast().uniqueEntries()) {
        input.add(new Block.InputField(entry.key(), entry.keyPos(), lower(entry.value())));
      }
    }

    Optional<String> loadFromFile = Optional.empty();
    Optional<Tokenizer.Attribute> load = element.attribute("loadFromFile");
    if (load.isPresent()) {
      if (load.get().kind() == Tokenizer.Attribute.Kind.STRING) {
        loadFromFile = Optional.of(load.get().value());
      } else if (Attributes.flag(element, "loadFromFile")) {
        loadFromFile = Optional.of(outputRoot + "/agents/" + agent + ".md");
      }
    }

    return new Block.SpawnAgent(
        agent,
        model,
        description,
        prompt,
        input,
        output(element),
        loadFromFile,
        element.pos());
  }

  //
  // Shell assignments
  //

  private static final ImmutableSet<String> ASSIGN_SOURCES =
      ImmutableSet.of("bash", "value", "env", "file");

  Block.Assign assign(Markup.Element element) throws CompilerException {
    return new Block.Assign(ImmutableList.of(assignment(element)), element.pos());
  }

  Block.Assign assignGroup(Markup.Element element) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of());
    List<Block.Assignment> assignments = new ArrayList<>();
    for (Markup.Node child : element.children()) {
      if (child.isBlank()) continue;
      if (!child.isElement() || !child.<Markup.Element>cast().name().equals("Assign")) {
        throw new CompilerException(
            child.pos(),
            String.format("<AssignGroup> expects <Assign> children, got %s", describe(child)));
      }
      assignments.add(assignment(child.cast()));
    }
    if (assignments.isEmpty()) {
      throw new CompilerException(element.pos(), "<AssignGroup> requires at least one <Assign>");
    }
    return new Block.Assign(assignments, element.pos());
  }

  private Block.Assignment assignment(Markup.Element element) throws CompilerException {
    Attributes.checkAllowed(
        element,
        ImmutableSet.of("var", "bash", "value", "env", "file", "optional", "raw", "comment"));
    String variable = assignTarget(element);

    List<String> sources = new ArrayList<>();
    for (String source : ASSIGN_SOURCES) {
      if (element.hasAttribute(source)) sources.add(source);
    }
    if (sources.size() != 1) {
      throw new CompilerException(
          element.pos(), "<Assign> requires exactly one of 'bash', 'value', 'env' and 'file'");
    }
    String sourceName = sources.get(0);
    String content = Attributes.requiredString(element, sourceName);
    Block.AssignSource source = Block.AssignSource.valueOf(Ascii.toUpperCase(sourceName));

    if (source == Block.AssignSource.ENV && !isShellName(content)) {
      throw new CompilerException(
          Attributes.valuePos(element, "env"),
          String.format("'%s' is not a valid environment variable name", content));
    }
    if (element.hasAttribute("optional") && source != Block.AssignSource.FILE) {
      throw new CompilerException(
          Attributes.valuePos(element, "optional"), "'optional' only applies to 'file'");
    }
    if (element.hasAttribute("raw") && source != Block.AssignSource.VALUE) {
      throw new CompilerException(
          Attributes.valuePos(element, "raw"), "'raw' only applies to 'value'");
    }
    boolean lenient = Attributes.flag(element, "optional") || Attributes.flag(element, "raw");
    return new Block.Assignment(
        variable, source, content, lenient, Attributes.string(element, "comment"));
  }

  // A declared runtime variable by ref or name, or a plain shell variable.
  private String assignTarget(Markup.Element element) throws CompilerException {
    Tokenizer.Attribute attr = Attributes.required(element, "var");
    if (attr.kind() == Tokenizer.Attribute.Kind.EXPRESSION) {
      Expression expr = Expression.parse(attr.value(), attr.valuePos());
      Block.VariableDeclaration decl =
          expr.type() == Expression.Type.IDENTIFIER
              ? variablesByRef.get(expr.<Expression.Identifier>cast().name())
              : null;
      if (decl == null) {
        throw new CompilerException(
            attr.valuePos(),
            String.format("var of <%s> must name a declared runtime variable", element.name()));
      }
      return decl.name();
    }

    String name = Attributes.requiredString(element, "var");
    Block.VariableDeclaration decl = variablesByRef.getOrDefault(name, variablesByName.get(name));
    if (decl != null) return decl.name();
    if (!isShellName(name)) {
      throw new CompilerException(
          attr.valuePos(), String.format("'%s' is not a valid shell variable name", name));
    }
    return name;
  }

  /**
   * Reads a set of files into shell variables. Each key of {@code files} names one file and
   * becomes {@code KEY_CONTENT}; its value is {@code {path: "..", required: false}}.
   */
  Block.Assign readFiles(Markup.Element element) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("files"));
    Expression files = Attributes.requiredExpression(element, "files");
    if (files.type() != Expression.Type.OBJECT) {
      throw new CompilerException(files.pos(), "files of <ReadFiles> must be an object literal");
    }

    List<Block.Assignment> assignments = new ArrayList<>();
    for (Expression.ObjectLiteral.Entry entry :
        files.<Expression.ObjectLiteral>cast().uniqueEntries()) {
      Expression def = entry.value();
      if (def.type() != Expression.Type.OBJECT || !def.isLiteral()) {
        throw new CompilerException(
            def.pos(),
            String.format("file '%s' must be a literal {path, required} object", entry.key()));
      }
      JsonNode json = def.literalJson();
      for (String key : ImmutableList.copyOf(json.fieldNames())) {
        if (!key.equals("path") && !key.equals("required")) {
          throw new CompilerException(
              def.pos(),
              String.format("unknown key '%s' in file '%s'", key, entry.key()));
        }
      }
      if (!json.path("path").isTextual() || json.path("path").asText().isEmpty()) {
        throw new CompilerException(
            def.pos(), String.format("file '%s' requires a string 'path'", entry.key()));
      }
      if (json.has("required") && !json.get("required").isBoolean()) {
        throw new CompilerException(
            def.pos(), String.format("'required' of file '%s' must be a boolean", entry.key()));
      }

      String variable =
          CaseFormat.LOWER_CAMEL.to(CaseFormat.UPPER_UNDERSCORE, entry.key()) + "_CONTENT";
      if (!isShellName(variable)) {
        throw new CompilerException(
            entry.keyPos(),
            String.format("'%s' does not make a valid shell variable name", entry.key()));
      }
      assignments.add(
          new Block.Assignment(
              variable,
              Block.AssignSource.FILE,
              json.get("path").asText(),
              !json.path("required").asBoolean(true),
              Optional.empty()));
    }
    if (assignments.isEmpty()) {
      throw new CompilerException(element.pos(), "<ReadFiles> requires at least one file");
    }
    return new Block.Assign(assignments, element.pos());
  }

  //
  // Agent results and state
  //

  Block.OnStatus onStatus(Markup.Element element, BlockLowering lowering)
      throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("output", "status"));
    Optional<String> output = output(element);
    if (!output.isPresent()) throw Attributes.missing(element, "output");
    Optional<Block.ReturnStatus> status = status(element);
    if (!status.isPresent()) throw Attributes.missing(element, "status");

    // Guards a Break inside the handler like an If on the result's status would.
    conditions.push(
        new RuntimeExpression.Comparison(
            RuntimeExpression.ComparisonOperator.EQUAL,
            new RuntimeExpression.VarRef(output.get(), ImmutableList.of("status"), element.pos()),
            new RuntimeExpression.Literal(
                TextNode.valueOf(status.get().name()), element.pos()),
            element.pos()));
    ImmutableList<Block> children;
    try {
      children = lowering.lower(element.children());
    } finally {
      conditions.pop();
    }
    return new Block.OnStatus(output.get(), status.get(), children, element.pos());
  }

  Block.ReadState readState(Markup.Element element) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("state", "field", "output"));
    String state = stateName(element);
    Optional<String> output = output(element);
    if (!output.isPresent()) throw Attributes.missing(element, "output");
    return new Block.ReadState(
        state, Attributes.string(element, "field"), output.get(), element.pos());
  }

  Block.WriteState writeState(Markup.Element element) throws CompilerException {
    Attributes.checkAllowed(element, ImmutableSet.of("state", "field", "value", "merge"));
    String state = stateName(element);

    List<Block.StateWrite> writes = new ArrayList<>();
    if (element.hasAttribute("merge")) {
      if (element.hasAttribute("field") || element.hasAttribute("value")) {
        throw new CompilerException(
            element.pos(), "<WriteState> accepts either 'merge' or 'field' and 'value'");
      }
      Expression merge = Attributes.requiredExpression(element, "merge");
      if (merge.type() != Expression.Type.OBJECT) {
        throw new CompilerException(merge.pos(), "merge of <WriteState> must be an object literal");
      }
      for (Expression.ObjectLiteral.Entry entry :
          merge.<Expression.ObjectLiteral>cast().uniqueEntries()) {
        writes.add(new Block.StateWrite(entry.key(), entry.keyPos(), lower(entry.value())));
      }
      if (writes.isEmpty()) {
        throw new CompilerException(merge.pos(), "merge of <WriteState> writes no fields");
      }
    } else {
      String field = Attributes.requiredString(element, "field");
      Tokenizer.Attribute value = Attributes.required(element, "value");
      RuntimeExpression lowered;
      if (value.kind() == Tokenizer.Attribute.Kind.EXPRESSION) {
        lowered = lower(Expression.parse(value.value(), value.valuePos()));
      } else {
        lowered =
            new RuntimeExpression.Literal(
                TextNode.valueOf(Attributes.requiredString(element, "value")),
                value.valuePos());
      }
      writes.add(new Block.StateWrite(field, Attributes.valuePos(element, "field"), lowered));
    }
    return new Block.WriteState(state, writes, element.pos());
  }

  private static String stateName(Markup.Element element) throws CompilerException {
    String state = Attributes.requiredString(element, "state");
    if (state.isEmpty() || state.contains("/") || state.contains("\\")) {
      throw new CompilerException(
          Attributes.valuePos(element, "state"),
          String.format("'%s' is not a valid state name", state));
    }
    return state;
  }

  static String describe(Markup.Node node) {
    switch (node.type()) {
      case ELEMENT:
        return "<" + node.<Markup.Element>cast().name() + ">";
      case INTERPOLATION:
        return "an {expression}";
      default:
        return "text";
    }
  }
}
