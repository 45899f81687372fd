package amc;

import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

// Typed access to element attributes. Every failure names the attribute and the element.
final class Attributes {

  static CompilerException missing(Markup.Element element, String name) {
    return new CompilerException(
        element.pos(), String.format("<%s> requires attribute '%s'", element.name(), name));
  }

  private static CompilerException wrongKind(
      Markup.Element element, Tokenizer.Attribute attr, String expected) {
    return new CompilerException(
        attr.valuePos(),
        String.format(
            "attribute '%s' of <%s> must be %s", attr.name(), element.name(), expected));
  }

  static void checkAllowed(Markup.Element element, ImmutableSet<String> allowed)
      throws CompilerException {
    for (Tokenizer.Attribute attr : element.attributes()) {
      if (!allowed.contains(attr.name())) {
        throw new CompilerException(
            attr.namePos(),
            String.format("unknown attribute '%s' on <%s>", attr.name(), element.name()));
      }
    }
  }

  static Tokenizer.Attribute required(Markup.Element element, String name)
      throws CompilerException {
    Optional<Tokenizer.Attribute> attr = element.attribute(name);
    if (!attr.isPresent()) throw missing(element, name);
    return attr.get();
  }

  static Optional<Expression> expression(Markup.Element element, String name)
      throws CompilerException {
    Optional<Tokenizer.Attribute> attr = element.attribute(name);
    if (!attr.isPresent()) return Optional.empty();
    if (attr.get().kind() != Tokenizer.Attribute.Kind.EXPRESSION) {
      throw wrongKind(element, attr.get(), "an {expression}");
    }
    return Optional.of(Expression.parse(attr.get().value(), attr.get().valuePos()));
  }

  static Expression requiredExpression(Markup.Element element, String name)
      throws CompilerException {
    Optional<Expression> expr = expression(element, name);
    if (!expr.isPresent()) throw missing(element, name);
    return expr.get();
  }

  static Optional<String> string(Markup.Element element, String name) throws CompilerException {
    Optional<Tokenizer.Attribute> attr = element.attribute(name);
    if (!attr.isPresent()) return Optional.empty();

    switch (attr.get().kind()) {
      case STRING:
        return Optional.of(attr.get().value());
      case EXPRESSION:
        {
          Expression expr = Expression.parse(attr.get().value(), attr.get().valuePos());
          if (!expr.type().isScalarLiteral() || expr.type() == Expression.Type.NULL) {
            throw wrongKind(element, attr.get(), "a string");
          }
          return Optional.of(asText(expr.literalJson()));
        }
      default:
        throw wrongKind(element, attr.get(), "a string");
    }
  }

  static String requiredString(Markup.Element element, String name) throws CompilerException {
    Optional<String> value = string(element, name);
    if (!value.isPresent()) throw missing(element, name);
    return value.get();
  }

  static Optional<Boolean> bool(Markup.Element element, String name) throws CompilerException {
    Optional<Tokenizer.Attribute> attr = element.attribute(name);
    if (!attr.isPresent()) return Optional.empty();

    switch (attr.get().kind()) {
      case FLAG:
        return Optional.of(true);
      case STRING:
        if (attr.get().value().equals("true")) return Optional.of(true);
        if (attr.get().value().equals("false")) return Optional.of(false);
        throw wrongKind(element, attr.get(), "a boolean");
      default:
        {
          Expression expr = Expression.parse(attr.get().value(), attr.get().valuePos());
          if (expr.type() != Expression.Type.BOOLEAN) {
            throw wrongKind(element, attr.get(), "a boolean");
          }
          return Optional.of(expr.<Expression.BooleanLiteral>cast().value());
        }
    }
  }

  static boolean flag(Markup.Element element, String name) throws CompilerException {
    return bool(element, name).orElse(false);
  }

  static Optional<Integer> integer(Markup.Element element, String name)
      throws CompilerException {
    Optional<Tokenizer.Attribute> attr = element.attribute(name);
    if (!attr.isPresent()) return Optional.empty();

    switch (attr.get().kind()) {
      case STRING:
        try {
          return Optional.of(Integer.parseInt(attr.get().value().trim()));
        } catch (NumberFormatException ex) {
          throw wrongKind(element, attr.get(), "an integer");
        }
      case EXPRESSION:
        {
          Expression expr = Expression.parse(attr.get().value(), attr.get().valuePos());
          if (expr.type() != Expression.Type.NUMBER) {
            throw wrongKind(element, attr.get(), "an integer");
          }
          return Optional.of(expr.<Expression.NumberLiteral>cast().intValue());
        }
      default:
        throw wrongKind(element, attr.get(), "an integer");
    }
  }

  /** A literal JSON value; string attributes are JSON strings. */
  static Optional<JsonNode> json(Markup.Element element, String name) throws CompilerException {
    Optional<Tokenizer.Attribute> attr = element.attribute(name);
    if (!attr.isPresent()) return Optional.empty();

    switch (attr.get().kind()) {
      case STRING:
        return Optional.of(JsonNodeFactory.instance.textNode(attr.get().value()));
      case FLAG:
        return Optional.of(JsonNodeFactory.instance.booleanNode(true));
      default:
        return Optional.of(
            Expression.parse(attr.get().value(), attr.get().valuePos()).literalJson());
    }
  }

  static Optional<ImmutableList<String>> stringList(Markup.Element element, String name)
      throws CompilerException {
    Optional<JsonNode> json = json(element, name);
    if (!json.isPresent()) return Optional.empty();
    if (!json.get().isArray()) {
      throw wrongKind(element, element.attribute(name).get(), "an array of strings");
    }

    ImmutableList.Builder<String> out = ImmutableList.builder();
    for (JsonNode item : json.get()) {
      if (!item.isValueNode() || item.isNull()) {
        throw wrongKind(element, element.attribute(name).get(), "an array of strings");
      }
      out.add(item.asText());
    }
    return Optional.of(out.build());
  }

  static Tokenizer.Pos valuePos(Markup.Element element, String name) {
    return element.attribute(name).map(Tokenizer.Attribute::valuePos).orElse(element.pos());
  }

  static String asText(JsonNode node) {
    return node.isValueNode() ? node.asText() : node.toString();
  }

  private Attributes() {}
}
