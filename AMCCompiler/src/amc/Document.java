package amc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import amc.processor.IrChild;
import amc.processor.IrNode;

/** The root of one compiled source file. The root tag selects the kind. */
public abstract class Document implements IrNodeInterface {

  public enum Kind {
    COMMAND,
    AGENT,
    SKILL,
    MCP_CONFIG,
    STATE;
  }

  // Fields every document kind has.
  @AutoValue
  public abstract static class Header {
    public abstract String file();

    public abstract String name();

    public abstract Optional<String> description();

    public abstract Tokenizer.Pos pos();

    public static Header create(
        String file, String name, Optional<String> description, Tokenizer.Pos pos) {
      return new AutoValue_Document_Header(file, name, description, pos);
    }
  }

  private final Kind kind;
  private final Header header;
  private final ImmutableList<Block> children;
  private final ImmutableList<FunctionDescriptor> functions;
  private final ImmutableList<String> helpers;
  private final boolean runtime;

  private Document(
      Kind kind,
      Header header,
      List<Block> children,
      List<FunctionDescriptor> functions,
      List<String> helpers,
      boolean runtime) {
    this.kind = kind;
    this.header = header;
    this.children = ImmutableList.copyOf(children);
    this.functions = ImmutableList.copyOf(functions);
    this.helpers = ImmutableList.copyOf(helpers);
    this.runtime = runtime;
  }

  public Kind kind() {
    return kind;
  }

  public Header header() {
    return header;
  }

  public String file() {
    return header.file();
  }

  public String name() {
    return header.name();
  }

  public Optional<String> description() {
    return header.description();
  }

  public Tokenizer.Pos pos() {
    return header.pos();
  }

  public ImmutableList<Block> body() {
    return children;
  }

  // Functions this document declares for the runtime module.
  public ImmutableList<FunctionDescriptor> functions() {
    return functions;
  }

  // Shared helper code for the runtime module.
  public ImmutableList<String> helpers() {
    return helpers;
  }

  // Whether the runtime transform was active for this document.
  public boolean runtime() {
    return runtime;
  }

  @SuppressWarnings("unchecked")
  public <T extends Document> T cast() {
    return (T) this;
  }

  // Shared content; see the kinds below.
  public static final class Content {
    private final ImmutableList<Block> blocks;
    private final ImmutableList<FunctionDescriptor> functions;
    private final ImmutableList<String> helpers;
    private final boolean runtime;

    public Content(
        List<Block> blocks,
        List<FunctionDescriptor> functions,
        List<String> helpers,
        boolean runtime) {
      this.blocks = ImmutableList.copyOf(blocks);
      this.functions = ImmutableList.copyOf(functions);
      this.helpers = ImmutableList.copyOf(helpers);
      this.runtime = runtime;
    }

    public static Content of(List<Block> blocks) {
      return new Content(blocks, ImmutableList.of(), ImmutableList.of(), false);
    }
  }

  @IrNode
  public static final class Command extends Document implements Document_Command_IrNode {
    private final ImmutableList<String> allowedTools;
    private final Optional<String> argumentHint;
    private final Optional<String> model;
    private final Optional<String> folder;

    public Command(
        Header header,
        Content content,
        List<String> allowedTools,
        Optional<String> argumentHint,
        Optional<String> model,
        Optional<String> folder) {
      super(
          Kind.COMMAND,
          header,
          content.blocks,
          content.functions,
          content.helpers,
          content.runtime);
      this.allowedTools = ImmutableList.copyOf(allowedTools);
      this.argumentHint = argumentHint;
      this.model = model;
      this.folder = folder;
    }

    @IrChild
    @Override
    public ImmutableList<Block> children() {
      return body();
    }

    public ImmutableList<String> allowedTools() {
      return allowedTools;
    }

    public Optional<String> argumentHint() {
      return argumentHint;
    }

    public Optional<String> model() {
      return model;
    }

    public Optional<String> folder() {
      return folder;
    }
  }

  @IrNode
  public static final class Agent extends Document implements Document_Agent_IrNode {
    private final Optional<String> tools;
    private final Optional<String> color;
    private final Optional<String> model;
    private final Optional<Shape> input;
    private final Optional<Tokenizer.Pos> inputPos;
    private final Optional<String> folder;

    public Agent(
        Header header,
        Content content,
        Optional<String> tools,
        Optional<String> color,
        Optional<String> model,
        Optional<Shape> input,
        Optional<Tokenizer.Pos> inputPos,
        Optional<String> folder) {
      super(
          Kind.AGENT,
          header,
          content.blocks,
          content.functions,
          content.helpers,
          content.runtime);
      this.tools = tools;
      this.color = color;
      this.model = model;
      this.input = input;
      this.inputPos = inputPos;
      this.folder = folder;
    }

    @IrChild
    @Override
    public ImmutableList<Block> children() {
      return body();
    }

    // Space-separated, emitted as a single string.
    public Optional<String> tools() {
      return tools;
    }

    public Optional<String> color() {
      return color;
    }

    public Optional<String> model() {
      return model;
    }

    // The input contract spawn sites must cover.
    public Optional<Shape> input() {
      return input;
    }

    public Optional<Tokenizer.Pos> inputPos() {
      return inputPos;
    }

    public Optional<String> folder() {
      return folder;
    }
  }

  @IrNode
  public static final class SkillFile implements Document_SkillFile_IrNode {
    private final String name;
    private final Tokenizer.Pos pos;
    private final ImmutableList<Block> children;

    public SkillFile(String name, Tokenizer.Pos pos, List<Block> children) {
      this.name = name;
      this.pos = pos;
      this.children = ImmutableList.copyOf(children);
    }

    // Path relative to the skill directory.
    public String name() {
      return name;
    }

    public Tokenizer.Pos pos() {
      return pos;
    }

    @IrChild
    @Override
    public ImmutableList<Block> children() {
      return children;
    }
  }

  // A file copied verbatim into the skill directory.
  @AutoValue
  public abstract static class SkillStatic {
    public abstract String src();

    public abstract String dest();

    public abstract Tokenizer.Pos pos();

    public static SkillStatic create(String src, String dest, Tokenizer.Pos pos) {
      return new AutoValue_Document_SkillStatic(src, dest, pos);
    }
  }

  @AutoValue
  public abstract static class SkillOptions {
    public abstract Optional<Boolean> disableModelInvocation();

    public abstract Optional<Boolean> userInvocable();

    public abstract ImmutableList<String> allowedTools();

    public abstract Optional<String> argumentHint();

    public abstract Optional<String> model();

    public abstract Optional<String> context();

    public abstract Optional<String> agent();

    public static Builder builder() {
      return new AutoValue_Document_SkillOptions.Builder().setAllowedTools(ImmutableList.of());
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setDisableModelInvocation(Boolean value);

      public abstract Builder setUserInvocable(Boolean value);

      public abstract Builder setAllowedTools(List<String> value);

      public abstract Builder setArgumentHint(String value);

      public abstract Builder setModel(String value);

      public abstract Builder setContext(String value);

      public abstract Builder setAgent(String value);

      public abstract SkillOptions build();
    }
  }

  @IrNode
  public static final class Skill extends Document implements Document_Skill_IrNode {
    private final SkillOptions options;
    private final ImmutableList<SkillFile> files;
    private final ImmutableList<SkillStatic> statics;

    public Skill(
        Header header,
        Content content,
        SkillOptions options,
        List<SkillFile> files,
        List<SkillStatic> statics) {
      super(
          Kind.SKILL,
          header,
          content.blocks,
          content.functions,
          content.helpers,
          content.runtime);
      this.options = options;
      this.files = ImmutableList.copyOf(files);
      this.statics = ImmutableList.copyOf(statics);
    }

    @IrChild
    @Override
    public ImmutableList<Block> children() {
      return body();
    }

    public SkillOptions options() {
      return options;
    }

    @IrChild
    @Override
    public ImmutableList<SkillFile> files() {
      return files;
    }

    public ImmutableList<SkillStatic> statics() {
      return statics;
    }
  }

  public static final class McpServer {
    private final String name;
    private final Tokenizer.Pos pos;
    private final String type;
    private final Optional<String> command;
    private final ImmutableList<String> args;
    private final Optional<String> url;
    private final ImmutableMap<String, String> headers;
    private final ImmutableMap<String, String> env;

    public McpServer(
        String name,
        Tokenizer.Pos pos,
        String type,
        Optional<String> command,
        List<String> args,
        Optional<String> url,
        Map<String, String> headers,
        Map<String, String> env) {
      this.name = name;
      this.pos = pos;
      this.type = type;
      this.command = command;
      this.args = ImmutableList.copyOf(args);
      this.url = url;
      this.headers = ImmutableMap.copyOf(headers);
      this.env = ImmutableMap.copyOf(env);
    }

    public String name() {
      return name;
    }

    public Tokenizer.Pos pos() {
      return pos;
    }

    // stdio, http or sse
    public String type() {
      return type;
    }

    public Optional<String> command() {
      return command;
    }

    public ImmutableList<String> args() {
      return args;
    }

    public Optional<String> url() {
      return url;
    }

    public ImmutableMap<String, String> headers() {
      return headers;
    }

    public ImmutableMap<String, String> env() {
      return env;
    }
  }

  @IrNode
  public static final class McpConfig extends Document implements Document_McpConfig_IrNode {
    private final ImmutableList<McpServer> servers;

    public McpConfig(Header header, List<McpServer> servers) {
      super(
          Kind.MCP_CONFIG,
          header,
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          false);
      this.servers = ImmutableList.copyOf(servers);
    }

    public ImmutableList<McpServer> servers() {
      return servers;
    }
  }

  public enum FieldType {
    STRING("TEXT"),
    NUMBER("INTEGER"),
    BOOLEAN("INTEGER");

    private final String sqlType;

    FieldType(String sqlType) {
      this.sqlType = sqlType;
    }

    public String sqlType() {
      return sqlType;
    }
  }

  @AutoValue
  public abstract static class StateField {
    public abstract String name();

    public abstract FieldType type();

    public abstract Optional<String> defaultValue();

    // Allowed values, enforced with a CHECK constraint.
    public abstract ImmutableList<String> values();

    public abstract Tokenizer.Pos pos();

    public static StateField create(
        String name,
        FieldType type,
        Optional<String> defaultValue,
        List<String> values,
        Tokenizer.Pos pos) {
      return new AutoValue_Document_StateField(
          name, type, defaultValue, ImmutableList.copyOf(values), pos);
    }
  }

  // A custom operation: an SQL template whose $name placeholders become arguments.
  @AutoValue
  public abstract static class StateOperation {
    public abstract String name();

    public abstract String sql();

    public abstract ImmutableList<String> args();

    public abstract Tokenizer.Pos pos();

    public static StateOperation create(
        String name, String sql, List<String> args, Tokenizer.Pos pos) {
      return new AutoValue_Document_StateOperation(name, sql, ImmutableList.copyOf(args), pos);
    }
  }

  @IrNode
  public static final class State extends Document implements Document_State_IrNode {
    private final String provider;
    private final String database;
    private final ImmutableList<StateField> fields;
    private final ImmutableList<StateOperation> operations;

    public State(
        Header header,
        String provider,
        String database,
        List<StateField> fields,
        List<StateOperation> operations) {
      super(
          Kind.STATE,
          header,
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          false);
      this.provider = provider;
      this.database = database;
      this.fields = ImmutableList.copyOf(fields);
      this.operations = ImmutableList.copyOf(operations);
    }

    public String provider() {
      return provider;
    }

    public String database() {
      return database;
    }

    public ImmutableList<StateField> fields() {
      return fields;
    }

    public ImmutableList<StateOperation> operations() {
      return operations;
    }
  }
}
