package amc;

import java.io.PrintStream;
import java.util.Comparator;
import java.util.Optional;

import com.google.auto.value.AutoValue;

/** A message for the author, attached to a source position. */
@AutoValue
public abstract class Diagnostic {
  public enum Severity {
    ERROR,
    WARNING;
  }

  public static final Comparator<Diagnostic> ORDER =
      Comparator.comparing(Diagnostic::pos)
          .thenComparing(Diagnostic::severity)
          .thenComparing(Diagnostic::message);

  public abstract Severity severity();

  public abstract Tokenizer.Pos pos();

  public abstract String message();

  // A second location, e.g. the declaration in another document.
  public abstract Optional<Tokenizer.Pos> related();

  public static Diagnostic error(Tokenizer.Pos pos, String message) {
    return error(pos, message, Optional.empty());
  }

  public static Diagnostic error(
      Tokenizer.Pos pos, String message, Optional<Tokenizer.Pos> related) {
    return new AutoValue_Diagnostic(Severity.ERROR, pos, message, related);
  }

  public static Diagnostic warning(Tokenizer.Pos pos, String message) {
    return warning(pos, message, Optional.empty());
  }

  public static Diagnostic warning(
      Tokenizer.Pos pos, String message, Optional<Tokenizer.Pos> related) {
    return new AutoValue_Diagnostic(Severity.WARNING, pos, message, related);
  }

  public boolean isError() {
    return severity() == Severity.ERROR;
  }

  public Diagnostic asError() {
    return error(pos(), message(), related());
  }

  public String render() {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("%s: %s %s", severity(), pos().display(), message()));
    related().ifPresent(r -> sb.append("\n  see: ").append(r.display()));
    return sb.toString();
  }

  public void print() {
    print(System.out);
  }

  public void print(PrintStream out) {
    out.println(render());
  }
}
