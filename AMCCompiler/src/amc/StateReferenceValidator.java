package amc;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Checks state reads and writes against the State documents of the build: the state must
 * exist, named fields must belong to it, and literal writes must be allowed values.
 */
public class StateReferenceValidator extends ErrorCollectingValidator {

  private final ImmutableMap<String, Document.State> states;

  public StateReferenceValidator(List<Document> documents) {
    Map<String, Document.State> states = new TreeMap<>();
    documents
        .stream()
        .filter(d -> d.kind() == Document.Kind.STATE)
        .sorted(Comparator.comparing(Document::file))
        .forEach(d -> states.putIfAbsent(d.name(), d.cast()));
    this.states = ImmutableMap.copyOf(states);
  }

  private StateReferenceValidator(ImmutableMap<String, Document.State> states) {
    this.states = states;
  }

  public ImmutableList<Diagnostic> validate(Document document) {
    StateReferenceValidator visitor = new StateReferenceValidator(states);
    document.accept(visitor, null);
    return visitor.diagnostics();
  }

  @Override
  public void visitImpl(Block.ReadState read) {
    Optional<Document.State> state = state(read.state(), read.pos());
    if (state.isPresent() && read.field().isPresent()) {
      field(state.get(), read.field().get(), read.pos());
    }
  }

  @Override
  public void visitImpl(Block.WriteState write) {
    Optional<Document.State> state = state(write.state(), write.pos());
    if (!state.isPresent()) return;

    for (Block.StateWrite entry : write.writes()) {
      Optional<Document.StateField> field = field(state.get(), entry.field(), entry.pos());
      if (!field.isPresent()
          || field.get().values().isEmpty()
          || entry.value().type() != RuntimeExpression.Type.LITERAL) {
        continue;
      }
      String value = entry.value().<RuntimeExpression.Literal>cast().plainText();
      if (!field.get().values().contains(value)) {
        logWarning(
            entry.pos(),
            String.format(
                "'%s' is not an allowed value of field '%s'; expected one of %s",
                value, field.get().name(), field.get().values()),
            Optional.of(field.get().pos()));
      }
    }
  }

  private Optional<Document.State> state(String name, Tokenizer.Pos pos) {
    Document.State state = states.get(name);
    if (state == null) {
      logWarning(pos, String.format("no state named '%s' is declared in this build", name));
    }
    return Optional.ofNullable(state);
  }

  private Optional<Document.StateField> field(
      Document.State state, String name, Tokenizer.Pos pos) {
    Optional<Document.StateField> field =
        state.fields().stream().filter(f -> f.name().equals(name)).findFirst();
    if (!field.isPresent()) {
      logWarning(
          pos,
          String.format("state '%s' has no field '%s'", state.name(), name),
          Optional.of(state.pos()));
    }
    return field;
  }
}
