package amc;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Everything one build produced: the files, sorted by path, and every diagnostic. */
@AutoValue
public abstract class BuildResult {
  public abstract ImmutableList<OutputFile> files();

  public abstract ImmutableList<Diagnostic> diagnostics();

  public static BuildResult create(List<OutputFile> files, List<Diagnostic> diagnostics) {
    return new AutoValue_BuildResult(
        ImmutableList.copyOf(files), ImmutableList.copyOf(diagnostics));
  }

  public boolean hasErrors() {
    return diagnostics().stream().anyMatch(Diagnostic::isError);
  }

  public ImmutableList<Diagnostic> errors() {
    return diagnostics()
        .stream()
        .filter(Diagnostic::isError)
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Diagnostic> warnings() {
    return diagnostics()
        .stream()
        .filter(d -> !d.isError())
        .collect(ImmutableList.toImmutableList());
  }
}
