package amc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

/** The element tree of one source file, as written by the author. */
public final class Markup {

  public abstract static class Node {
    public enum Type {
      ELEMENT,
      TEXT,
      INTERPOLATION;
    }

    private final Type type;
    private final Tokenizer.Pos pos;

    private Node(Type type, Tokenizer.Pos pos) {
      this.type = type;
      this.pos = pos;
    }

    public Type type() {
      return type;
    }

    public Tokenizer.Pos pos() {
      return pos;
    }

    public boolean isElement() {
      return type == Type.ELEMENT;
    }

    // Whitespace-only text, which carries nothing at block level.
    public boolean isBlank() {
      return type == Type.TEXT && CharMatcher.whitespace().matchesAllOf(((Text) this).text());
    }

    @SuppressWarnings("unchecked")
    public <T extends Node> T cast() {
      return (T) this;
    }
  }

  public static final class Element extends Node {
    private final String name;
    private final ImmutableList<Tokenizer.Attribute> attributes;
    private final ImmutableList<Node> children;

    public Element(
        String name,
        Tokenizer.Pos pos,
        List<Tokenizer.Attribute> attributes,
        List<? extends Node> children) {
      super(Type.ELEMENT, pos);
      this.name = name;
      this.attributes = ImmutableList.copyOf(attributes);
      this.children = ImmutableList.copyOf(children);
    }

    public String name() {
      return name;
    }

    public ImmutableList<Tokenizer.Attribute> attributes() {
      return attributes;
    }

    public Optional<Tokenizer.Attribute> attribute(String name) {
      return attributes.stream().filter(a -> a.name().equals(name)).findFirst();
    }

    public boolean hasAttribute(String name) {
      return attribute(name).isPresent();
    }

    public ImmutableList<Node> children() {
      return children;
    }

    public ImmutableList<Element> childElements() {
      return children
          .stream()
          .filter(Node::isElement)
          .map(n -> n.<Element>cast())
          .collect(ImmutableList.toImmutableList());
    }

    @Override
    public String toString() {
      return "<" + name + ">";
    }
  }

  public static final class Text extends Node {
    private final String text;
    private final boolean raw;

    public Text(String text, Tokenizer.Pos pos, boolean raw) {
      super(Type.TEXT, pos);
      this.text = text;
      this.raw = raw;
    }

    public String text() {
      return text;
    }

    public boolean raw() {
      return raw;
    }

    @Override
    public String toString() {
      return text;
    }
  }

  public static final class Interpolation extends Node {
    private final String source;

    public Interpolation(String source, Tokenizer.Pos pos) {
      super(Type.INTERPOLATION, pos);
      this.source = source;
    }

    public String source() {
      return source;
    }

    public Expression parse() throws CompilerException {
      return Expression.parse(source, pos());
    }

    @Override
    public String toString() {
      return "{" + source + "}";
    }
  }

  private static final class Frame {
    private final Tokenizer.OpenTag tag;
    private final List<Node> children = new ArrayList<>();

    private Frame(Tokenizer.OpenTag tag) {
      this.tag = tag;
    }
  }

  /** Tokenizes {@code content} and builds its single root element. */
  public static Element parse(String file, String content) throws CompilerException {
    return build(file, new Tokenizer(file, content).tokenize());
  }

  public static Element build(String file, List<Tokenizer.Token> tokens)
      throws CompilerException {
    List<Node> roots = new ArrayList<>();
    Deque<Frame> stack = new ArrayDeque<>();

    for (Tokenizer.Token token : tokens) {
      List<Node> siblings = stack.isEmpty() ? roots : stack.peek().children;
      switch (token.type()) {
        case OPEN_TAG:
          {
            Tokenizer.OpenTag open = token.cast();
            if (open.selfClosing()) {
              siblings.add(
                  new Element(open.name(), open.pos(), open.attributes(), ImmutableList.of()));
            } else {
              stack.push(new Frame(open));
            }
            break;
          }
        case CLOSE_TAG:
          {
            Tokenizer.CloseTag close = token.cast();
            if (stack.isEmpty()) {
              throw new CompilerException(
                  close.pos(), String.format("unexpected closing tag </%s>", close.name()));
            }

            Frame frame = stack.pop();
            if (!frame.tag.name().equals(close.name())) {
              throw new CompilerException(
                  close.pos(),
                  String.format(
                      "mismatched closing tag </%s>: expected </%s>",
                      close.name(), frame.tag.name()),
                  frame.tag.pos());
            }

            Element element =
                new Element(
                    frame.tag.name(), frame.tag.pos(), frame.tag.attributes(), frame.children);
            (stack.isEmpty() ? roots : stack.peek().children).add(element);
            break;
          }
        case TEXT:
          {
            Tokenizer.Text text = token.cast();
            siblings.add(new Text(text.text(), text.pos(), text.raw()));
            break;
          }
        case INTERPOLATION:
          {
            Tokenizer.Interpolation interpolation = token.cast();
            siblings.add(new Interpolation(interpolation.source(), interpolation.pos()));
            break;
          }
      }
    }

    if (!stack.isEmpty()) {
      Tokenizer.OpenTag open = stack.peek().tag;
      throw new CompilerException(open.pos(), String.format("unclosed tag <%s>", open.name()));
    }

    Element root = null;
    for (Node node : roots) {
      if (node.isBlank()) continue;
      if (!node.isElement()) {
        throw new CompilerException(node.pos(), "content outside of the root element");
      }
      if (root != null) {
        throw new CompilerException(
            node.pos(), "only one root element is allowed per file", root.pos());
      }
      root = node.cast();
    }

    if (root == null) {
      throw new CompilerException(new Tokenizer.Pos(file, 0, 0), "missing root element");
    }
    return root;
  }

  private Markup() {}
}
