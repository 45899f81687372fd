package amc;

import java.util.Optional;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Tokenizer.Pos pos;
  private final String errorMsg;
  private final Optional<Tokenizer.Pos> related;

  public CompilerException(Tokenizer.Pos pos, String errorMsg) {
    this(pos, errorMsg, Optional.empty());
  }

  public CompilerException(Tokenizer.Pos pos, String errorMsg, Tokenizer.Pos related) {
    this(pos, errorMsg, Optional.of(related));
  }

  private CompilerException(Tokenizer.Pos pos, String errorMsg, Optional<Tokenizer.Pos> related) {
    super(errorMsg);
    this.pos = pos;
    this.errorMsg = errorMsg;
    this.related = related;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public Optional<Tokenizer.Pos> related() {
    return related;
  }

  public Diagnostic toDiagnostic() {
    return Diagnostic.error(pos, errorMsg, related);
  }

  public void print() {
    toDiagnostic().print();
  }
}
