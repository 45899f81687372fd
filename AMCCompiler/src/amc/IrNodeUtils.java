package amc;

import java.util.Optional;

public final class IrNodeUtils {
  public static <V> V accept(IrNodeInterface obj, IrVisitor<V> visitor, V value) {
    return obj.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends IrNodeInterface> obj, IrVisitor<V> visitor, V value) {
    for (IrNodeInterface o : obj) {
      value = accept(o, visitor, value);
    }
    return value;
  }

  public static <V> V accept(
      Optional<? extends IrNodeInterface> obj, IrVisitor<V> visitor, V value) {
    return obj.map(o -> accept(o, visitor, value)).orElse(value);
  }

  private IrNodeUtils() {}
}
