package amc;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Checks spawn sites against the input contract of the agent they spawn. Only the presence of
 * required top-level fields is checked. Agents outside the build are not checked at all.
 */
public class ContractValidator extends ErrorCollectingValidator {

  private final ImmutableMap<String, Document.Agent> agents;
  private final boolean strict;

  public ContractValidator(List<Document> documents, boolean strict) {
    // The first agent of a name by source file is the one spawn sites refer to.
    Map<String, Document.Agent> agents = new TreeMap<>();
    documents
        .stream()
        .filter(d -> d.kind() == Document.Kind.AGENT)
        .sorted(Comparator.comparing(Document::file))
        .forEach(d -> agents.putIfAbsent(d.name(), d.cast()));
    this.agents = ImmutableMap.copyOf(agents);
    this.strict = strict;
  }

  /** The contract findings for one spawning document; errors when strict. */
  public ImmutableList<Diagnostic> validate(Document document) {
    ContractValidator visitor = new ContractValidator(agents, strict);
    document.accept(visitor, null);
    return visitor.diagnostics();
  }

  private ContractValidator(ImmutableMap<String, Document.Agent> agents, boolean strict) {
    this.agents = agents;
    this.strict = strict;
  }

  @Override
  public void visitImpl(Block.SpawnAgent spawn) {
    Document.Agent agent = agents.get(spawn.agent());
    // A literal prompt carries no typed input to check.
    if (agent == null || !agent.input().isPresent() || spawn.prompt().isPresent()) return;

    for (String field : agent.input().get().requiredFields()) {
      if (spawn.input().stream().noneMatch(f -> f.name().equals(field))) {
        String msg =
            String.format(
                "<SpawnAgent> of '%s' does not provide required input field '%s'",
                spawn.agent(), field);
        if (strict) {
          logError(spawn.pos(), msg, agent.inputPos());
        } else {
          logWarning(spawn.pos(), msg, agent.inputPos());
        }
      }
    }
  }
}
