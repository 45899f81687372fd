package amc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

abstract class ErrorCollectingValidator extends VoidDefaultIrVisitor {
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  protected ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  protected void logError(Tokenizer.Pos pos, String msg) {
    logError(pos, msg, Optional.empty());
  }

  protected void logError(Tokenizer.Pos pos, String msg, Optional<Tokenizer.Pos> related) {
    diagnostics.add(Diagnostic.error(pos, msg, related));
  }

  protected void logError(CompilerException ex) {
    diagnostics.add(ex.toDiagnostic());
  }

  protected void logWarning(Tokenizer.Pos pos, String msg) {
    logWarning(pos, msg, Optional.empty());
  }

  protected void logWarning(Tokenizer.Pos pos, String msg, Optional<Tokenizer.Pos> related) {
    diagnostics.add(Diagnostic.warning(pos, msg, related));
  }

  protected void takeDiagnostics(ErrorCollectingValidator other) {
    diagnostics.addAll(other.diagnostics);
  }

  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(Diagnostic::isError);
  }

  public void printDiagnostics() {
    diagnostics.forEach(Diagnostic::print);
  }
}
