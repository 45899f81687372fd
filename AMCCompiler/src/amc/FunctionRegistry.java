package amc;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Build-wide function descriptors, keyed by id. Safe for concurrent registration from the
 * per-document workers; read only after all of them have finished.
 */
public final class FunctionRegistry {

  // The first declaration by source file wins, independent of registration order.
  private static final Comparator<FunctionDescriptor> PRECEDENCE =
      Comparator.comparing(FunctionDescriptor::sourceFile)
          .thenComparing(FunctionDescriptor::pos);

  // Every declaration of each id; the winner is picked when the registry is read.
  private final ConcurrentHashMap<String, ImmutableList<FunctionDescriptor>> declarations =
      new ConcurrentHashMap<>();

  public void register(FunctionDescriptor descriptor) {
    declarations.merge(
        descriptor.id(),
        ImmutableList.of(descriptor),
        (existing, added) ->
            ImmutableList.<FunctionDescriptor>builder().addAll(existing).addAll(added).build());
  }

  public void registerAll(Iterable<FunctionDescriptor> descriptors) {
    descriptors.forEach(this::register);
  }

  public Optional<FunctionDescriptor> get(String id) {
    ImmutableList<FunctionDescriptor> all = declarations.get(id);
    return all == null ? Optional.empty() : Optional.of(winner(all));
  }

  public boolean isEmpty() {
    return declarations.isEmpty();
  }

  /** A registry holding only the declarations made outside {@code files}. */
  public FunctionRegistry withoutFiles(Set<String> files) {
    FunctionRegistry out = new FunctionRegistry();
    for (ImmutableList<FunctionDescriptor> all : declarations.values()) {
      for (FunctionDescriptor descriptor : all) {
        if (!files.contains(descriptor.sourceFile())) out.register(descriptor);
      }
    }
    return out;
  }

  /** All winning descriptors, sorted by id. */
  public ImmutableSortedMap<String, FunctionDescriptor> snapshot() {
    ImmutableSortedMap.Builder<String, FunctionDescriptor> out =
        ImmutableSortedMap.naturalOrder();
    declarations.forEach((id, all) -> out.put(id, winner(all)));
    return out.build();
  }

  private static FunctionDescriptor winner(List<FunctionDescriptor> all) {
    return all.stream().min(PRECEDENCE).get();
  }

  /** Warnings for ids declared with different shapes or bodies. */
  public ImmutableList<Diagnostic> conflictWarnings() {
    ImmutableList.Builder<Diagnostic> out = ImmutableList.builder();
    for (Map.Entry<String, FunctionDescriptor> entry : snapshot().entrySet()) {
      FunctionDescriptor winner = entry.getValue();
      declarations
          .get(entry.getKey())
          .stream()
          .filter(d -> !d.sameStructure(winner))
          .sorted(PRECEDENCE)
          .distinct()
          .forEach(
              d ->
                  out.add(
                      Diagnostic.warning(
                          d.pos(),
                          String.format(
                              "function '%s' is declared differently elsewhere; the declaration"
                                  + " in %s is used",
                              d.id(),
                              winner.sourceFile()),
                          Optional.of(winner.pos()))));
    }
    return out.build();
  }
}
