package amc;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Turns one {@link Document} into its artifacts. MCP configurations and the state aggregate
 * span documents and are assembled by the build once every document is done.
 */
public final class Emitter {

  /** Supplies the bytes of a file a skill copies verbatim. */
  @FunctionalInterface
  public interface StaticFileLoader {
    byte[] load(String sourceFile, String path) throws IOException;
  }

  private final MarkdownWriter writer;
  private final StaticFileLoader loader;

  public Emitter(BuildOptions options, StaticFileLoader loader) {
    this.writer = new MarkdownWriter(options.runtimeCommand());
    this.loader = loader;
  }

  public ImmutableList<OutputFile> emit(Document document) throws CompilerException {
    switch (document.kind()) {
      case COMMAND:
        return ImmutableList.of(command(document.cast()));
      case AGENT:
        return ImmutableList.of(agent(document.cast()));
      case SKILL:
        return skill(document.cast());
      case STATE:
        return state(document.cast());
      case MCP_CONFIG:
        return ImmutableList.of();
    }
    throw new IllegalStateException("Unhandled document kind: " + document.kind());
  }

  private static String folderPath(String dir, Optional<String> folder, String name) {
    return dir + "/" + folder.map(f -> f + "/").orElse("") + name + ".md";
  }

  OutputFile command(Document.Command command) {
    Frontmatter frontmatter =
        new Frontmatter()
            .put("name", command.name())
            .put("description", command.description())
            .put("argument-hint", command.argumentHint())
            .put("model", command.model())
            .putList("allowed-tools", command.allowedTools());
    return OutputFile.text(
        folderPath("commands", command.folder(), command.name()),
        writer.document(ImmutableList.of(frontmatter.render()), command.body()),
        command.file());
  }

  OutputFile agent(Document.Agent agent) {
    // tools stays one space-separated string.
    Frontmatter frontmatter =
        new Frontmatter()
            .put("name", agent.name())
            .put("description", agent.description())
            .put("tools", agent.tools())
            .put("color", agent.color())
            .put("model", agent.model());
    return OutputFile.text(
        folderPath("agents", agent.folder(), agent.name()),
        writer.document(ImmutableList.of(frontmatter.render()), agent.body()),
        agent.file());
  }

  ImmutableList<OutputFile> skill(Document.Skill skill) throws CompilerException {
    Document.SkillOptions options = skill.options();
    Frontmatter frontmatter =
        new Frontmatter()
            .put("name", skill.name())
            .put("description", skill.description())
            .putBoolean("disable-model-invocation", options.disableModelInvocation())
            .putBoolean("user-invocable", options.userInvocable())
            .putList("allowed-tools", options.allowedTools())
            .put("argument-hint", options.argumentHint())
            .put("model", options.model())
            .put("context", options.context())
            .put("agent", options.agent());

    String dir = "skills/" + skill.name() + "/";
    ImmutableList.Builder<OutputFile> out = ImmutableList.builder();
    out.add(
        OutputFile.text(
            dir + "SKILL.md",
            writer.document(ImmutableList.of(frontmatter.render()), skill.body()),
            skill.file()));
    for (Document.SkillFile file : skill.files()) {
      out.add(
          OutputFile.text(
              dir + file.name(),
              writer.document(ImmutableList.of(), file.children()),
              skill.file()));
    }
    for (Document.SkillStatic file : skill.statics()) {
      byte[] content;
      try {
        content = loader.load(skill.file(), file.src());
      } catch (IOException ex) {
        throw new CompilerException(
            file.pos(),
            String.format("cannot read static file '%s': %s", file.src(), ex.getMessage()));
      }
      out.add(OutputFile.bytes(dir + file.dest(), content, skill.file()));
    }
    return out.build();
  }

  ImmutableList<OutputFile> state(Document.State state) throws CompilerException {
    StorageProvider provider =
        StorageProvider.forName(state.provider())
            .orElseThrow(
                () ->
                    new CompilerException(
                        state.pos(),
                        String.format("unknown storage provider '%s'", state.provider())));
    ImmutableList.Builder<OutputFile> out = ImmutableList.builder();
    for (Map.Entry<String, String> file : provider.generate(state).entrySet()) {
      out.add(
          OutputFile.text(
              "commands/" + state.name() + "." + file.getKey() + ".md",
              file.getValue(),
              state.file()));
    }
    return out.build();
  }

  /** The command that initializes every state in the build. */
  static OutputFile initAll(List<String> stateNames) {
    StringBuilder skills = new StringBuilder();
    StringBuilder invocations = new StringBuilder();
    for (String name : stateNames) {
      if (skills.length() > 0) {
        skills.append('\n');
        invocations.append("\n\n");
      }
      skills.append("- `/").append(name).append(":init`");
      invocations
          .append("# Initialize ")
          .append(name)
          .append(" state\necho \"Initializing ")
          .append(name)
          .append("...\"\n# Note: the agent invokes /")
          .append(name)
          .append(":init skill");
    }

    String frontmatter =
        new Frontmatter()
            .put("name", "init.all")
            .put(
                "description",
                "Initialize all state tables. Run once to set up all state storage.")
            .putList("allowed-tools", ImmutableList.of("Bash(sqlite3:*)", "Bash(mkdir:*)"))
            .render();
    String content =
        frontmatter
            + "\n\n# Initialize All State\n\n"
            + "Initialize all registered state tables in the project.\n\n"
            + "## State Skills\n\n"
            + "This skill orchestrates the following init skills:\n\n"
            + skills
            + "\n\n## Usage\n\n"
            + "Run this skill once when setting up a new project or after adding new state"
            + " definitions.\n\n"
            + "## Process\n\n"
            + "The following state tables will be initialized:\n\n"
            + invocations
            + "\n\n**Note:** This skill should invoke each state's init skill in sequence. Run"
            + " each `/{state}:init` skill listed above.\n";
    return OutputFile.text("commands/init.all.md", content, "");
  }
}
