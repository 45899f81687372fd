package amc;

import java.util.List;

import com.google.common.collect.ImmutableList;

import amc.processor.IrChild;
import amc.processor.IrNode;

/** Inline content. Inline nodes never contain blocks. */
public abstract class Inline implements IrNodeInterface {

  public enum Type {
    TEXT,
    BOLD,
    ITALIC,
    CODE,
    LINK,
    LINE_BREAK,
    RUNTIME_VALUE;
  }

  private final Type type;

  private Inline(Type type) {
    this.type = type;
  }

  public Type type() {
    return type;
  }

  @SuppressWarnings("unchecked")
  public <T extends Inline> T cast() {
    return (T) this;
  }

  @IrNode
  public static final class Text extends Inline implements Inline_Text_IrNode {
    private final String value;

    public Text(String value) {
      super(Type.TEXT);
      this.value = value;
    }

    public String value() {
      return value;
    }
  }

  @IrNode
  public static final class Bold extends Inline implements Inline_Bold_IrNode {
    private final ImmutableList<Inline> children;

    public Bold(List<? extends Inline> children) {
      super(Type.BOLD);
      this.children = ImmutableList.copyOf(children);
    }

    @IrChild
    @Override
    public ImmutableList<Inline> children() {
      return children;
    }
  }

  @IrNode
  public static final class Italic extends Inline implements Inline_Italic_IrNode {
    private final ImmutableList<Inline> children;

    public Italic(List<? extends Inline> children) {
      super(Type.ITALIC);
      this.children = ImmutableList.copyOf(children);
    }

    @IrChild
    @Override
    public ImmutableList<Inline> children() {
      return children;
    }
  }

  @IrNode
  public static final class Code extends Inline implements Inline_Code_IrNode {
    private final String value;

    public Code(String value) {
      super(Type.CODE);
      this.value = value;
    }

    public String value() {
      return value;
    }
  }

  @IrNode
  public static final class Link extends Inline implements Inline_Link_IrNode {
    private final String href;
    private final ImmutableList<Inline> children;

    public Link(String href, List<? extends Inline> children) {
      super(Type.LINK);
      this.href = href;
      this.children = ImmutableList.copyOf(children);
    }

    public String href() {
      return href;
    }

    @IrChild
    @Override
    public ImmutableList<Inline> children() {
      return children;
    }
  }

  @IrNode
  public static final class LineBreak extends Inline implements Inline_LineBreak_IrNode {
    public LineBreak() {
      super(Type.LINE_BREAK);
    }
  }

  // {ctx.path} inside text of a runtime document.
  @IrNode
  public static final class RuntimeValue extends Inline implements Inline_RuntimeValue_IrNode {
    private final RuntimeExpression expression;

    public RuntimeValue(RuntimeExpression expression) {
      super(Type.RUNTIME_VALUE);
      this.expression = expression;
    }

    @IrChild
    @Override
    public RuntimeExpression expression() {
      return expression;
    }
  }
}
