package amc;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;

/**
 * A function extracted from a document into the runtime module. Descriptors are never mutated
 * after discovery.
 */
@AutoValue
public abstract class FunctionDescriptor {
  public abstract String id();

  public abstract Optional<Shape> params();

  public abstract Optional<Shape> returns();

  // The JavaScript body, without the surrounding function declaration.
  public abstract String body();

  // The document which declared this function.
  public abstract String sourceFile();

  public abstract Tokenizer.Pos pos();

  public static FunctionDescriptor create(
      String id,
      Optional<Shape> params,
      Optional<Shape> returns,
      String body,
      String sourceFile,
      Tokenizer.Pos pos) {
    return new AutoValue_FunctionDescriptor(id, params, returns, body, sourceFile, pos);
  }

  /** True if both declare the same shapes and the same body, ignoring whitespace. */
  public boolean sameStructure(FunctionDescriptor other) {
    return id().equals(other.id())
        && params().equals(other.params())
        && returns().equals(other.returns())
        && normalizedBody().equals(other.normalizedBody());
  }

  public String normalizedBody() {
    return normalize(body());
  }

  static String normalize(String code) {
    return CharMatcher.whitespace().trimAndCollapseFrom(code, ' ');
  }
}
