package amc;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

// Warns about status handlers on variables that no spawned agent writes.
class OnStatusValidator extends ErrorCollectingValidator {

  private final Set<String> agentOutputs = new HashSet<>();
  private final List<Block.OnStatus> handlers = new ArrayList<>();

  @Override
  public void visitImpl(Block.SpawnAgent spawn) {
    spawn.output().ifPresent(agentOutputs::add);
    spawn.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Block.OnStatus onStatus) {
    handlers.add(onStatus);
    onStatus.visitChildren(this, null);
  }

  public void validate() {
    for (Block.OnStatus handler : handlers) {
      if (!agentOutputs.contains(handler.output())) {
        logWarning(
            handler.pos(),
            String.format(
                "<OnStatus> checks '%s', which no <SpawnAgent> in this document writes",
                handler.output()));
      }
    }
  }
}
