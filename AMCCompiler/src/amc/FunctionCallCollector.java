package amc;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Collects the runtime calls of one document. Once every document has registered its functions,
 * {@link #validate} checks each call against the build-wide registry.
 */
class FunctionCallCollector extends ErrorCollectingValidator {

  private final List<Block.RuntimeCall> calls = new ArrayList<>();

  @Override
  public void visitImpl(Block.RuntimeCall call) {
    calls.add(call);
  }

  public ImmutableList<Block.RuntimeCall> calls() {
    return ImmutableList.copyOf(calls);
  }

  public static ImmutableSet<String> calledFunctions(Document document) {
    FunctionCallCollector collector = new FunctionCallCollector();
    document.accept(collector, null);
    Set<String> out = new LinkedHashSet<>();
    collector.calls.forEach(c -> out.add(c.functionId()));
    return ImmutableSet.copyOf(out);
  }

  public ImmutableList<Diagnostic> validate(FunctionRegistry registry) {
    for (Block.RuntimeCall call : calls) {
      Optional<FunctionDescriptor> descriptor = registry.get(call.functionId());
      if (!descriptor.isPresent()) {
        logError(
            call.pos(),
            String.format("no function named '%s' is declared in this build", call.functionId()));
        continue;
      }

      Optional<Shape> params = descriptor.get().params();
      if (!params.isPresent() || params.get().kind() != Shape.Kind.OBJECT) continue;
      for (String field : params.get().requiredFields()) {
        if (!call.argumentNames().contains(field)) {
          logWarning(
              call.pos(),
              String.format(
                  "call to '%s' is missing required argument '%s'", call.functionId(), field),
              Optional.of(descriptor.get().pos()));
        }
      }
    }
    return diagnostics();
  }
}
