package amc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import amc.processor.IrChild;
import amc.processor.IrNode;

/**
 * One rendered unit of a document body. Blocks may hold inline content, never the reverse, and
 * keep no references into the source tree beyond positions.
 */
public abstract class Block implements IrNodeInterface {

  public enum Type {
    HEADING,
    PARAGRAPH,
    LIST,
    CODE_BLOCK,
    BLOCKQUOTE,
    THEMATIC_BREAK,
    TABLE,
    XML_BLOCK,
    RAW,
    EXECUTION_CONTEXT,
    SUCCESS_CRITERIA,
    OFFER_NEXT,
    STEP,
    ASSIGN,
    PROMPT_TEMPLATE,

    // Runtime blocks
    VARIABLE_DECLARATION,
    RUNTIME_CALL,
    CONDITIONAL,
    LOOP,
    BREAK,
    RETURN,
    ASK_USER,
    SPAWN_AGENT,
    ON_STATUS,
    READ_STATE,
    WRITE_STATE;

    public boolean isRuntime() {
      return ordinal() >= VARIABLE_DECLARATION.ordinal();
    }
  }

  private final Type type;
  private final Tokenizer.Pos pos;

  private Block(Type type, Tokenizer.Pos pos) {
    this.type = type;
    this.pos = pos;
  }

  public Type type() {
    return type;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  @SuppressWarnings("unchecked")
  public <T extends Block> T cast() {
    return (T) this;
  }

  @IrNode
  public static final class Heading extends Block implements Block_Heading_IrNode {
    private final int level;
    private final ImmutableList<Inline> children;

    public Heading(int level, List<? extends Inline> children, Tokenizer.Pos pos) {
      super(Type.HEADING, pos);
      this.level = Math.max(1, Math.min(6, level));
      this.children = ImmutableList.copyOf(children);
    }

    public int level() {
      return level;
    }

    @IrChild
    @Override
    public ImmutableList<Inline> children() {
      return children;
    }
  }

  @IrNode
  public static final class Paragraph extends Block implements Block_Paragraph_IrNode {
    private final ImmutableList<Inline> children;

    public Paragraph(List<? extends Inline> children, Tokenizer.Pos pos) {
      super(Type.PARAGRAPH, pos);
      this.children = ImmutableList.copyOf(children);
    }

    @IrChild
    @Override
    public ImmutableList<Inline> children() {
      return children;
    }
  }

  @IrNode
  public static final class ListItem implements Block_ListItem_IrNode {
    private final ImmutableList<Block> children;

    public ListItem(List<? extends Block> children) {
      this.children = ImmutableList.copyOf(children);
    }

    @IrChild
    @Override
    public ImmutableList<Block> children() {
      return children;
    }
  }

  // Ordered lists always number from 1.
  @IrNode
  public static final class ListBlock extends Block implements Block_ListBlock_IrNode {
    private final boolean ordered;
    private final ImmutableList<ListItem> items;

    public ListBlock(boolean ordered, List<ListItem> items, Tokenizer.Pos pos) {
      super(Type.LIST, pos);
      this.ordered = ordered;
      this.items = ImmutableList.copyOf(items);
    }

    public boolean ordered() {
      return ordered;
    }

    @IrChild
    @Override
    public ImmutableList<ListItem> items() {
      return items;
    }
  }

  @IrNode
  public static final class CodeBlock extends Block implements Block_CodeBlock_IrNode {
    private final Optional<String> language;
    private final String content;

    public CodeBlock(Optional<String> language, String content, Tokenizer.Pos pos) {
      super(Type.CODE_BLOCK, pos);
      this.language = language;
      this.content = content;
    }

    public Optional<String> language() {
      return language;
    }

    public String content() {
      return content;
    }
  }

  @IrNode
  public static final class Blockquote extends Block implements Block_Blockquote_IrNode {
    private final ImmutableList<Block> children;

    public Blockquote(List<? extends Block> children, Tokenizer.Pos pos) {
      super(Type.BLOCKQUOTE, pos);
      this.children = ImmutableList.copyOf(children);
    }

    @IrChild
    @Override
    public ImmutableList<Block> children() {
      return children;
    }
  }

  @IrNode
  public static final class ThematicBreak extends Block implements Block_ThematicBreak_IrNode {
    public ThematicBreak(Tokenizer.Pos pos) {
      super(Type.THEMATIC_BREAK, pos);
    }
  }

  public enum Align {
    NONE,
    LEFT,
    CENTER,
    RIGHT;
  }

  @IrNode
  public static final class TableRow implements Block_TableRow_IrNode {
    private final ImmutableList<Paragraph> cells;

    public TableRow(List<Paragraph> cells) {
      this.cells = ImmutableList.copyOf(cells);
    }

    @IrChild
    @Override
    public ImmutableList<Paragraph> cells() {
      return cells;
    }
  }

  @IrNode
  public static final class Table extends Block implements Block_Table_IrNode {
    private final Optional<TableRow> header;
    private final ImmutableList<TableRow> rows;
    private final ImmutableList<Align> aligns;
    private final String emptyCell;

    public Table(
        Optional<TableRow> header,
        List<TableRow> rows,
        List<Align> aligns,
        String emptyCell,
        Tokenizer.Pos pos) {
      super(Type.TABLE, pos);
      this.header = header;
      this.rows = ImmutableList.copyOf(rows);
      this.aligns = ImmutableList.copyOf(aligns);
      this.emptyCell = emptyCell;
    }

    @IrChild
    @Override
    public Optional<TableRow> header() {
      return header;
    }

    @IrChild
    @Override
    public ImmutableList<TableRow> rows() {
      return rows;
    }

    public ImmutableList<Align> aligns() {
      return aligns;
    }

    public String emptyCell() {
      return emptyCell;
    }

    public int columnCount() {
      return header.isPresent()
          ? header.get().cells().size()
          : rows.stream().mapToInt(r -> r.cells().size()).max().orElse(0);
    }
  }

  // <name attr="value">children</name>
  @IrNode
  public static final class XmlBlock extends Block implements Block_XmlBlock_IrNode {
    private final String name;
    private final ImmutableMap<String, String> attributes;
    private final ImmutableList<Block> children;

    public XmlBlock(
        String name,
        Map<String, String> attributes,
        List<? extends Block> children,
        Tokenizer.Pos pos) {
      super(Type.XML_BLOCK, pos);
      this.name = name;
      this.attributes = ImmutableMap.copyOf(attributes);
      this.children = ImmutableList.copyOf(children);
    }

    public String name() {
      return name;
    }

    public ImmutableMap<String, String> attributes() {
      return attributes;
    }

    @IrChild
    @Override
    public ImmutableList<Block> children() {
      return children;
    }
  }

  @IrNode
  public static final class Raw extends Block implements Block_Raw_IrNode {
    private final String content;

    public Raw(String content, Tokenizer.Pos pos) {
      super(Type.RAW, pos);
      this.content = content;
    }

    public String content() {
      return content;
    }
  }

  @IrNode
  public static final class ExecutionContext extends Block
      implements Block_ExecutionContext_IrNode {
    private final ImmutableList<String> paths;
    private final String prefix;
    private final ImmutableList<Block> children;

    public ExecutionContext(
        List<String> paths, String prefix, List<? extends Block> children, Tokenizer.Pos pos) {
      super(Type.EXECUTION_CONTEXT, pos);
      this.paths = ImmutableList.copyOf(paths);
      this.prefix = prefix;
      this.children = ImmutableList.copyOf(children);
    }

    public ImmutableList<String> paths() {
      return paths;
    }

    public String prefix() {
      return prefix;
    }

    @IrChild
    @Override
    public ImmutableList<Block> children() {
      return children;
    }
  }

  public static final class Criterion {
    private final String text;
    private final boolean checked;

    public Criterion(String text, boolean checked) {
      this.text = text;
      this.checked = checked;
    }

    public String text() {
      return text;
    }

    public boolean checked() {
      return checked;
    }
  }

  @IrNode
  public static final class SuccessCriteria extends Block implements Block_SuccessCriteria_IrNode {
    private final ImmutableList<Criterion> items;

    public SuccessCriteria(List<Criterion> items, Tokenizer.Pos pos) {
      super(Type.SUCCESS_CRITERIA, pos);
      this.items = ImmutableList.copyOf(items);
    }

    public ImmutableList<Criterion> items() {
      return items;
    }
  }

  public static final class Route {
    private final String name;
    private final String path;
    private final Optional<String> description;

    public Route(String name, String path, Optional<String> description) {
      this.name = name;
      this.path = path;
      this.description = description;
    }

    public String name() {
      return name;
    }

    public String path() {
      return path;
    }

    public Optional<String> description() {
      return description;
    }
  }

  @IrNode
  public static final class OfferNext extends Block implements Block_OfferNext_IrNode {
    private final ImmutableList<Route> routes;

    public OfferNext(List<Route> routes, Tokenizer.Pos pos) {
      super(Type.OFFER_NEXT, pos);
      this.routes = ImmutableList.copyOf(routes);
    }

    public ImmutableList<Route> routes() {
      return routes;
    }
  }

  public enum StepVariant {
    HEADING,
    BOLD,
    XML;
  }

  @IrNode
  public static final class Step extends Block implements Block_Step_IrNode {
    private final String number;
    private final String name;
    private final StepVariant variant;
    private final ImmutableList<Block> children;

    public Step(
        String number,
        String name,
        StepVariant variant,
        List<? extends Block> children,
        Tokenizer.Pos pos) {
      super(Type.STEP, pos);
      this.number = number;
      this.name = name;
      this.variant = variant;
      this.children = ImmutableList.copyOf(children);
    }

    public String number() {
      return number;
    }

    public String name() {
      return name;
    }

    public StepVariant variant() {
      return variant;
    }

    @IrChild
    @Override
    public ImmutableList<Block> children() {
      return children;
    }
  }

  public enum AssignSource {
    BASH,
    VALUE,
    ENV,
    FILE;
  }

  // VAR=<source>, one line of a shell block.
  public static final class Assignment {
    private final String variable;
    private final AssignSource source;
    private final String content;
    private final boolean lenient;
    private final Optional<String> comment;

    public Assignment(
        String variable,
        AssignSource source,
        String content,
        boolean lenient,
        Optional<String> comment) {
      this.variable = variable;
      this.source = source;
      this.content = content;
      this.lenient = lenient;
      this.comment = comment;
    }

    public String variable() {
      return variable;
    }

    public AssignSource source() {
      return source;
    }

    // A command, a value, an environment variable name or a path.
    public String content() {
      return content;
    }

    // Files: a missing file yields an empty value. Values: written without quotes.
    public boolean lenient() {
      return lenient;
    }

    public Optional<String> comment() {
      return comment;
    }
  }

  @IrNode
  public static final class Assign extends Block implements Block_Assign_IrNode {
    private final ImmutableList<Assignment> assignments;

    public Assign(List<Assignment> assignments, Tokenizer.Pos pos) {
      super(Type.ASSIGN, pos);
      this.assignments = ImmutableList.copyOf(assignments);
    }

    public ImmutableList<Assignment> assignments() {
      return assignments;
    }
  }

  // Children rendered as Markdown source inside a fence, for prompts handed on verbatim.
  @IrNode
  public static final class PromptTemplate extends Block implements Block_PromptTemplate_IrNode {
    private final ImmutableList<Block> children;

    public PromptTemplate(List<? extends Block> children, Tokenizer.Pos pos) {
      super(Type.PROMPT_TEMPLATE, pos);
      this.children = ImmutableList.copyOf(children);
    }

    @IrChild
    @Override
    public ImmutableList<Block> children() {
      return children;
    }
  }

  // Declares a runtime variable. Renders nothing.
  @IrNode
  public static final class VariableDeclaration extends Block
      implements Block_VariableDeclaration_IrNode {
    private final String name;
    private final String ref;
    private final Shape shape;

    public VariableDeclaration(String name, String ref, Shape shape, Tokenizer.Pos pos) {
      super(Type.VARIABLE_DECLARATION, pos);
      this.name = name;
      this.ref = ref;
      this.shape = shape;
    }

    public String name() {
      return name;
    }

    // The identifier expressions use for this variable.
    public String ref() {
      return ref;
    }

    public Shape shape() {
      return shape;
    }
  }

  @IrNode
  public static final class RuntimeCall extends Block implements Block_RuntimeCall_IrNode {
    private final String functionId;
    private final ImmutableList<String> argumentNames;
    private final ImmutableList<RuntimeExpression> argumentValues;
    private final Optional<String> output;

    public RuntimeCall(
        String functionId,
        List<String> argumentNames,
        List<RuntimeExpression> argumentValues,
        Optional<String> output,
        Tokenizer.Pos pos) {
      super(Type.RUNTIME_CALL, pos);
      this.functionId = functionId;
      this.argumentNames = ImmutableList.copyOf(argumentNames);
      this.argumentValues = ImmutableList.copyOf(argumentValues);
      this.output = output;
    }

    public String functionId() {
      return functionId;
    }

    public ImmutableList<String> argumentNames() {
      return argumentNames;
    }

    @IrChild
    @Override
    public ImmutableList<RuntimeExpression> argumentValues() {
      return argumentValues;
    }

    // The runtime variable receiving the result.
    public Optional<String> output() {
      return output;
    }
  }

  // If, with an optional Else.
  @IrNode
  public static final class Conditional extends Block implements Block_Conditional_IrNode {
    private final RuntimeExpression condition;
    private final ImmutableList<Block> thenBlocks;
    private final Optional<ImmutableList<Block>> elseBlocks;

    public Conditional(
        RuntimeExpression condition,
        List<? extends Block> thenBlocks,
        Optional<? extends List<? extends Block>> elseBlocks,
        Tokenizer.Pos pos) {
      super(Type.CONDITIONAL, pos);
      this.condition = condition;
      this.thenBlocks = ImmutableList.copyOf(thenBlocks);
      if (elseBlocks.isPresent()) {
        this.elseBlocks = Optional.of(ImmutableList.<Block>copyOf(elseBlocks.get()));
      } else {
        this.elseBlocks = Optional.empty();
      }
    }

    @IrChild
    @Override
    public RuntimeExpression condition() {
      return condition;
    }

    @IrChild
    @Override
    public ImmutableList<Block> thenBlocks() {
      return thenBlocks;
    }

    public boolean hasElse() {
      return elseBlocks.isPresent();
    }

    @IrChild
    @Override
    public ImmutableList<Block> elseBlocks() {
      return elseBlocks.orElse(ImmutableList.of());
    }
  }

  @IrNode
  public static final class Loop extends Block implements Block_Loop_IrNode {
    private final int max;
    private final Optional<String> counter;
    private final ImmutableList<Block> children;
    private final Optional<RuntimeExpression> exitCondition;

    public Loop(
        int max,
        Optional<String> counter,
        List<? extends Block> children,
        Optional<RuntimeExpression> exitCondition,
        Tokenizer.Pos pos) {
      super(Type.LOOP, pos);
      this.max = max;
      this.counter = counter;
      this.children = ImmutableList.copyOf(children);
      this.exitCondition = exitCondition;
    }

    public int max() {
      return max;
    }

    public Optional<String> counter() {
      return counter;
    }

    @IrChild
    @Override
    public ImmutableList<Block> children() {
      return children;
    }

    @IrChild
    @Override
    public Optional<RuntimeExpression> exitCondition() {
      return exitCondition;
    }
  }

  @IrNode
  public static final class Break extends Block implements Block_Break_IrNode {
    private final Optional<String> message;

    public Break(Optional<String> message, Tokenizer.Pos pos) {
      super(Type.BREAK, pos);
      this.message = message;
    }

    public Optional<String> message() {
      return message;
    }
  }

  public enum ReturnStatus {
    SUCCESS,
    BLOCKED,
    NOT_FOUND,
    ERROR,
    CHECKPOINT;
  }

  @IrNode
  public static final class Return extends Block implements Block_Return_IrNode {
    private final Optional<ReturnStatus> status;
    private final Optional<String> message;

    public Return(Optional<ReturnStatus> status, Optional<String> message, Tokenizer.Pos pos) {
      super(Type.RETURN, pos);
      this.status = status;
      this.message = message;
    }

    public Optional<ReturnStatus> status() {
      return status;
    }

    public Optional<String> message() {
      return message;
    }
  }

  public static final class Option {
    private final String value;
    private final String label;
    private final Optional<String> description;

    public Option(String value, String label, Optional<String> description) {
      this.value = value;
      this.label = label;
      this.description = description;
    }

    public String value() {
      return value;
    }

    public String label() {
      return label;
    }

    public Optional<String> description() {
      return description;
    }
  }

  @IrNode
  public static final class AskUser extends Block implements Block_AskUser_IrNode {
    private final String question;
    private final Optional<String> header;
    private final ImmutableList<Option> options;
    private final String output;
    private final boolean multiSelect;

    public AskUser(
        String question,
        Optional<String> header,
        List<Option> options,
        String output,
        boolean multiSelect,
        Tokenizer.Pos pos) {
      super(Type.ASK_USER, pos);
      this.question = question;
      this.header = header;
      this.options = ImmutableList.copyOf(options);
      this.output = output;
      this.multiSelect = multiSelect;
    }

    public String question() {
      return question;
    }

    public Optional<String> header() {
      return header;
    }

    public ImmutableList<Option> options() {
      return options;
    }

    public String output() {
      return output;
    }

    public boolean multiSelect() {
      return multiSelect;
    }
  }

  // One <field>value</field> section of a spawned agent's prompt.
  @IrNode
  public static final class InputField implements Block_InputField_IrNode {
    private final String name;
    private final Tokenizer.Pos pos;
    private final RuntimeExpression value;

    public InputField(String name, Tokenizer.Pos pos, RuntimeExpression value) {
      this.name = name;
      this.pos = pos;
      this.value = value;
    }

    public String name() {
      return name;
    }

    public Tokenizer.Pos pos() {
      return pos;
    }

    @IrChild
    @Override
    public RuntimeExpression value() {
      return value;
    }
  }

  @IrNode
  public static final class SpawnAgent extends Block implements Block_SpawnAgent_IrNode {
    private final String agent;
    private final String model;
    private final String description;
    private final Optional<String> prompt;
    private final ImmutableList<InputField> input;
    private final Optional<String> output;
    private final Optional<String> loadFromFile;

    public SpawnAgent(
        String agent,
        String model,
        String description,
        Optional<String> prompt,
        List<InputField> input,
        Optional<String> output,
        Optional<String> loadFromFile,
        Tokenizer.Pos pos) {
      super(Type.SPAWN_AGENT, pos);
      this.agent = agent;
      this.model = model;
      this.description = description;
      this.prompt = prompt;
      this.input = ImmutableList.copyOf(input);
      this.output = output;
      this.loadFromFile = loadFromFile;
    }

    public String agent() {
      return agent;
    }

    public String model() {
      return model;
    }

    public String description() {
      return description;
    }

    public Optional<String> prompt() {
      return prompt;
    }

    @IrChild
    @Override
    public ImmutableList<InputField> input() {
      return input;
    }

    public Optional<String> output() {
      return output;
    }

    public Optional<String> loadFromFile() {
      return loadFromFile;
    }
  }

  // Instructions that apply when a spawned agent's result carries the given status.
  @IrNode
  public static final class OnStatus extends Block implements Block_OnStatus_IrNode {
    private final String output;
    private final ReturnStatus status;
    private final ImmutableList<Block> children;

    public OnStatus(
        String output, ReturnStatus status, List<? extends Block> children, Tokenizer.Pos pos) {
      super(Type.ON_STATUS, pos);
      this.output = output;
      this.status = status;
      this.children = ImmutableList.copyOf(children);
    }

    public String output() {
      return output;
    }

    public ReturnStatus status() {
      return status;
    }

    @IrChild
    @Override
    public ImmutableList<Block> children() {
      return children;
    }
  }

  @IrNode
  public static final class ReadState extends Block implements Block_ReadState_IrNode {
    private final String state;
    private final Optional<String> field;
    private final String output;

    public ReadState(String state, Optional<String> field, String output, Tokenizer.Pos pos) {
      super(Type.READ_STATE, pos);
      this.state = state;
      this.field = field;
      this.output = output;
    }

    public String state() {
      return state;
    }

    public Optional<String> field() {
      return field;
    }

    public String output() {
      return output;
    }
  }

  @IrNode
  public static final class StateWrite implements Block_StateWrite_IrNode {
    private final String field;
    private final Tokenizer.Pos pos;
    private final RuntimeExpression value;

    public StateWrite(String field, Tokenizer.Pos pos, RuntimeExpression value) {
      this.field = field;
      this.pos = pos;
      this.value = value;
    }

    public String field() {
      return field;
    }

    public Tokenizer.Pos pos() {
      return pos;
    }

    @IrChild
    @Override
    public RuntimeExpression value() {
      return value;
    }
  }

  // One field, or several merged in source order.
  @IrNode
  public static final class WriteState extends Block implements Block_WriteState_IrNode {
    private final String state;
    private final ImmutableList<StateWrite> writes;

    public WriteState(String state, List<StateWrite> writes, Tokenizer.Pos pos) {
      super(Type.WRITE_STATE, pos);
      this.state = state;
      this.writes = ImmutableList.copyOf(writes);
    }

    public String state() {
      return state;
    }

    @IrChild
    @Override
    public ImmutableList<StateWrite> writes() {
      return writes;
    }
  }
}
