package amc;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * The declared structure of a runtime value: {@code string}, {@code number}, {@code boolean},
 * {@code any}, {@code {field: shape, optional?: shape}} or {@code shape[]}.
 *
 * <p>Shapes only drive diagnostics. Nothing emitted depends on them.
 */
public final class Shape {
  public enum Kind {
    STRING,
    NUMBER,
    BOOLEAN,
    ANY,
    OBJECT,
    ARRAY;
  }

  public static final class Field {
    private final String name;
    private final Shape shape;
    private final boolean optional;

    private Field(String name, Shape shape, boolean optional) {
      this.name = name;
      this.shape = shape;
      this.optional = optional;
    }

    public String name() {
      return name;
    }

    public Shape shape() {
      return shape;
    }

    public boolean optional() {
      return optional;
    }
  }

  private static final Shape STRING_SHAPE = new Shape(Kind.STRING, ImmutableMap.of(), null);
  private static final Shape NUMBER_SHAPE = new Shape(Kind.NUMBER, ImmutableMap.of(), null);
  private static final Shape BOOLEAN_SHAPE = new Shape(Kind.BOOLEAN, ImmutableMap.of(), null);
  private static final Shape ANY_SHAPE = new Shape(Kind.ANY, ImmutableMap.of(), null);

  private static final ImmutableMap<String, Shape> PRIMITIVES =
      ImmutableMap.of(
          "string", STRING_SHAPE,
          "number", NUMBER_SHAPE,
          "boolean", BOOLEAN_SHAPE,
          "any", ANY_SHAPE);

  // Properties every array has, besides its elements.
  private static final ImmutableSet<String> ARRAY_PROPERTIES = ImmutableSet.of("length");

  public static Shape string() {
    return STRING_SHAPE;
  }

  public static Shape number() {
    return NUMBER_SHAPE;
  }

  public static Shape bool() {
    return BOOLEAN_SHAPE;
  }

  public static Shape any() {
    return ANY_SHAPE;
  }

  public static Shape arrayOf(Shape element) {
    return new Shape(Kind.ARRAY, ImmutableMap.of(), element);
  }

  public static Shape object(List<Field> fields) {
    return new Shape(
        Kind.OBJECT,
        fields.stream().collect(ImmutableMap.toImmutableMap(Field::name, f -> f)),
        null);
  }

  public static Field field(String name, Shape shape, boolean optional) {
    return new Field(name, shape, optional);
  }

  private final Kind kind;
  private final ImmutableMap<String, Field> fields;
  private final Shape element;

  private Shape(Kind kind, ImmutableMap<String, Field> fields, Shape element) {
    this.kind = kind;
    this.fields = fields;
    this.element = element;
  }

  public Kind kind() {
    return kind;
  }

  public ImmutableMap<String, Field> fields() {
    return fields;
  }

  public Optional<Shape> element() {
    return Optional.ofNullable(element);
  }

  public ImmutableList<String> requiredFields() {
    return fields
        .values()
        .stream()
        .filter(f -> !f.optional())
        .map(Field::name)
        .collect(ImmutableList.toImmutableList());
  }

  /** Follows {@code path} into this shape; empty if the path leaves the declared structure. */
  public Optional<Shape> resolve(List<String> path) {
    Shape current = this;
    for (String segment : path) {
      switch (current.kind) {
        case ANY:
          return Optional.of(ANY_SHAPE);
        case OBJECT:
          {
            Field field = current.fields.get(segment);
            if (field == null) return Optional.empty();
            current = field.shape();
            break;
          }
        case ARRAY:
          if (ARRAY_PROPERTIES.contains(segment)) {
            current = NUMBER_SHAPE;
          } else if (CharMatcher.inRange('0', '9').matchesAllOf(segment) && !segment.isEmpty()) {
            current = current.element;
          } else {
            return Optional.empty();
          }
          break;
        default:
          return Optional.empty();
      }
    }
    return Optional.of(current);
  }

  @Override
  public String toString() {
    switch (kind) {
      case OBJECT:
        return fields
            .values()
            .stream()
            .map(f -> f.name() + (f.optional() ? "?" : "") + ": " + f.shape())
            .collect(Collectors.joining(", ", "{", "}"));
      case ARRAY:
        return element + "[]";
      default:
        return kind.name().toLowerCase();
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Shape && o.toString().equals(toString());
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  /** Builds a shape from an attribute: a shape string, or an object literal of shape strings. */
  public static Shape fromAttribute(Tokenizer.Attribute attr) throws CompilerException {
    switch (attr.kind()) {
      case STRING:
        return parse(attr.value(), attr.valuePos());
      case EXPRESSION:
        return fromExpression(Expression.parse(attr.value(), attr.valuePos()));
      default:
        throw new CompilerException(attr.namePos(), "a shape is required here");
    }
  }

  public static Shape fromExpression(Expression expr) throws CompilerException {
    switch (expr.type()) {
      case STRING:
        {
          Expression.StringLiteral literal = expr.cast();
          return parse(literal.value(), expr.pos().addColumns(1));
        }
      case OBJECT:
        {
          ImmutableList.Builder<Field> fields = ImmutableList.builder();
          Expression.ObjectLiteral object = expr.cast();
          for (Expression.ObjectLiteral.Entry entry : object.entries()) {
            boolean optional = entry.key().endsWith("?");
            String name =
                optional ? entry.key().substring(0, entry.key().length() - 1) : entry.key();
            fields.add(new Field(name, fromExpression(entry.value()), optional));
          }
          return checkedObject(fields.build(), expr.pos());
        }
      case ARRAY:
        {
          Expression.ArrayLiteral array = expr.cast();
          if (array.elements().size() != 1) {
            throw new CompilerException(expr.pos(), "an array shape has exactly one element shape");
          }
          return arrayOf(fromExpression(array.elements().get(0)));
        }
      default:
        throw new CompilerException(
            expr.pos(), String.format("'%s' is not a shape", expr.raw()));
    }
  }

  private static Shape checkedObject(List<Field> fields, Tokenizer.Pos pos)
      throws CompilerException {
    Map<String, Long> counts =
        fields.stream().collect(Collectors.groupingBy(Field::name, Collectors.counting()));
    for (Map.Entry<String, Long> entry : counts.entrySet()) {
      if (entry.getValue() > 1) {
        throw new CompilerException(pos, String.format("duplicate field '%s'", entry.getKey()));
      }
    }
    return object(fields);
  }

  public static Shape parse(String text, Tokenizer.Pos pos) throws CompilerException {
    Parser parser = new Parser(text, pos);
    Shape shape = parser.parseShape();
    parser.skipWhitespace();
    if (!parser.atEnd()) {
      throw parser.error("unexpected trailing characters in shape");
    }
    return shape;
  }

  private static final class Parser {
    private final String text;
    private final Tokenizer.Pos pos;
    private int index = 0;

    private Parser(String text, Tokenizer.Pos pos) {
      this.text = text;
      this.pos = pos;
    }

    private boolean atEnd() {
      return index >= text.length();
    }

    private CompilerException error(String msg) {
      return new CompilerException(pos.addColumns(index), msg);
    }

    private void skipWhitespace() {
      while (!atEnd() && Character.isWhitespace(text.charAt(index))) index++;
    }

    private boolean consume(char ch) {
      skipWhitespace();
      if (!atEnd() && text.charAt(index) == ch) {
        index++;
        return true;
      }
      return false;
    }

    private void expect(char ch) throws CompilerException {
      if (!consume(ch)) throw error(String.format("expected '%c' in shape", ch));
    }

    private String name() throws CompilerException {
      skipWhitespace();
      int start = index;
      while (!atEnd()
          && (Character.isLetterOrDigit(text.charAt(index)) || text.charAt(index) == '_')) {
        index++;
      }
      if (start == index) throw error("expected a name in shape");
      return text.substring(start, index);
    }

    private Shape parseShape() throws CompilerException {
      Shape shape;
      if (consume('{')) {
        ImmutableList.Builder<Field> fields = ImmutableList.builder();
        Tokenizer.Pos objectPos = pos.addColumns(index - 1);
        if (!consume('}')) {
          do {
            if (consume('}')) {
              // Trailing separator.
              index--;
              break;
            }
            String name = name();
            boolean optional = consume('?');
            expect(':');
            fields.add(new Field(name, parseShape(), optional));
          } while (consume(',') || consume(';'));
          expect('}');
        }
        shape = checkedObject(fields.build(), objectPos);
      } else {
        String name = name();
        shape = PRIMITIVES.get(name);
        if (shape == null) throw error(String.format("unknown shape '%s'", name));
      }

      while (consume('[')) {
        expect(']');
        shape = arrayOf(shape);
      }
      return shape;
    }
  }
}
