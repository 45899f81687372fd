package amc;

import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Generates the command files that manage one {@link Document.State}. Every provider produces
 * the four built-in operations plus one file per custom operation.
 */
public interface StorageProvider {

  ImmutableSet<String> BUILTIN_OPERATIONS = ImmutableSet.of("init", "read", "write", "delete");

  static Optional<StorageProvider> forName(String name) {
    switch (name) {
      case SqliteProvider.NAME:
        return Optional.of(new SqliteProvider());
      default:
        return Optional.empty();
    }
  }

  String name();

  String init(Document.State state);

  String read(Document.State state);

  String write(Document.State state);

  String delete(Document.State state);

  String operation(Document.State state, Document.StateOperation operation);

  /** All files for {@code state}, keyed by operation name, built-ins first. */
  default ImmutableMap<String, String> generate(Document.State state) {
    ImmutableMap.Builder<String, String> out = ImmutableMap.builder();
    out.put("init", init(state));
    out.put("read", read(state));
    out.put("write", write(state));
    out.put("delete", delete(state));
    for (Document.StateOperation operation : state.operations()) {
      out.put(operation.name(), operation(state, operation));
    }
    return out.build();
  }
}
