package amc;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** Checks that need a whole lowered document. Findings here never stop emission. */
public class DocumentValidator extends ErrorCollectingValidator {

  private final Document document;

  public DocumentValidator(Document document) {
    this.document = document;
  }

  public ImmutableList<Diagnostic> computeDiagnostics() {
    if (!document.runtime()) return diagnostics();

    RuntimeVariableCollector variables = new RuntimeVariableCollector();
    accept(variables);

    RuntimePathValidator paths = new RuntimePathValidator(variables);
    accept(paths);

    OnStatusValidator statuses = new OnStatusValidator();
    document.accept(statuses, null);
    statuses.validate();
    takeDiagnostics(statuses);

    ImmutableSet<String> used = paths.used();
    for (Block.VariableDeclaration decl : variables.declarations().values()) {
      if (!used.contains(decl.name())) {
        logWarning(decl.pos(), String.format("runtime variable '%s' is never used", decl.ref()));
      }
    }
    return diagnostics();
  }

  private void accept(ErrorCollectingValidator visitor) {
    document.accept(visitor, null);
    takeDiagnostics(visitor);
  }
}
