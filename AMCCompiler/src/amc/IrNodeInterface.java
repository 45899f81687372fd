package amc;

public interface IrNodeInterface {
  <V> V accept(IrVisitor<V> visitor, V value);

  <V> V visitChildren(IrVisitor<V> visitor, V value);
}
