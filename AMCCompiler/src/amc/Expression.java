package amc;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

// AST and infix parser for the expressions authors write inside {braces}
public abstract class Expression {

  public enum Type {
    // Intermediary nodes.
    // These don't exist in the final tree when parsing is complete.
    PUNCTUATION,
    OPERATOR,
    INDEX_SUFFIX,

    // Value atoms
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    IDENTIFIER,

    // Compounds
    MEMBER,
    INDEX,
    UNARY,
    BINARY,
    TERNARY,
    OBJECT,
    ARRAY;

    public boolean isIntermediary() {
      return this == PUNCTUATION || this == OPERATOR || this == INDEX_SUFFIX;
    }

    public boolean isScalarLiteral() {
      return this == STRING || this == NUMBER || this == BOOLEAN || this == NULL;
    }
  }

  public enum UnaryOperator {
    NOT("!");

    private final String repr;

    UnaryOperator(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }
  }

  public enum BinaryOperator {
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    EQUAL("=="),
    STRICT_EQUAL("==="),
    NOT_EQUAL("!="),
    STRICT_NOT_EQUAL("!=="),
    AND("&&"),
    OR("||");

    private final String repr;

    BinaryOperator(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }

    public boolean isLogical() {
      return this == AND || this == OR;
    }

    private static final ImmutableMap<String, BinaryOperator> REPR_MAP =
        Maps.uniqueIndex(Arrays.asList(values()), BinaryOperator::repr);

    public static Optional<BinaryOperator> parse(String atom) {
      return Optional.ofNullable(REPR_MAP.get(atom));
    }

    private static final ImmutableList<ImmutableSet<BinaryOperator>> ORDER_OF_OPERATIONS =
        ImmutableList.of(
            ImmutableSet.of(
                LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL),
            ImmutableSet.of(EQUAL, STRICT_EQUAL, NOT_EQUAL, STRICT_NOT_EQUAL),
            ImmutableSet.of(AND),
            ImmutableSet.of(OR));

    static {
      // Ensure each operator is listed exactly once.
      Verify.verify(
          Arrays.asList(values())
              .stream()
              .allMatch(b -> ORDER_OF_OPERATIONS.stream().filter(s -> s.contains(b)).count() == 1));
    }

    public static ImmutableList<ImmutableSet<BinaryOperator>> orderOfOperations() {
      return ORDER_OF_OPERATIONS;
    }
  }

  // Longest first, for greedy matching.
  private static final ImmutableList<String> OPERATOR_REPRS =
      ImmutableList.of("===", "!==", "==", "!=", "<=", ">=", "&&", "||", "<", ">", "!");

  private static final String PUNCTUATION_CHARS = "()[]{},:?.";

  // Parses a full expression
  public static Expression parse(String source, Tokenizer.Pos pos) throws CompilerException {
    List<Expression> atoms = new Lexer(source, pos).lex();
    if (atoms.isEmpty()) throw new CompilerException(pos, "empty expression");

    // Collapse bracketed groups, innermost first.
    ArrayDeque<Integer> stack = new ArrayDeque<>();
    for (int i = 0; i < atoms.size(); i++) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.PUNCTUATION) continue;

      Punctuation punct = expr.cast();
      if (punct.isOpen()) {
        stack.push(i);
      } else if (punct.isClose()) {
        if (stack.isEmpty()) {
          throw new CompilerException(punct.pos(), String.format("unmatched '%c'", punct.ch()));
        }

        int start = stack.pop();
        Punctuation open = atoms.get(start).cast();
        if (open.closer() != punct.ch()) {
          throw new CompilerException(
              punct.pos(),
              String.format("mismatched '%c': expected '%c'", punct.ch(), open.closer()),
              open.pos());
        }

        boolean followsValue = start > 0 && isValue(atoms.get(start - 1));
        Expression group =
            collapseGroup(open, punct, new ArrayList<>(atoms.subList(start + 1, i)), followsValue);
        atoms.subList(start + 1, i + 1).clear();
        atoms.set(start, group);
        i = start;
      }
    }

    if (!stack.isEmpty()) {
      Expression open = atoms.get(stack.pop());
      throw new CompilerException(
          open.pos(), String.format("unmatched '%c'", open.<Punctuation>cast().ch()));
    }

    return parseNoSeparators(atoms);
  }

  private static boolean isValue(Expression expr) {
    return !expr.type().isIntermediary() || expr.type() == Type.INDEX_SUFFIX;
  }

  private static Expression collapseGroup(
      Punctuation open, Punctuation close, List<Expression> inner, boolean followsValue)
      throws CompilerException {
    List<List<Expression>> parts = splitTopLevel(inner, ',');
    switch (open.ch()) {
      case '(':
        {
          if (followsValue) {
            throw new CompilerException(open.pos(), "function calls are not supported");
          }
          if (parts.size() != 1 || parts.get(0).isEmpty()) {
            throw new CompilerException(open.pos(), "expected a single expression in parentheses");
          }
          Expression expr = parseNoSeparators(parts.get(0));
          expr.widen(((Expression) open).start, ((Expression) close).end);
          return expr;
        }
      case '[':
        {
          if (followsValue) {
            if (parts.size() != 1 || parts.get(0).isEmpty()) {
              throw new CompilerException(open.pos(), "expected a single index expression");
            }
            return new IndexSuffix(parseNoSeparators(parts.get(0)), open, close);
          }

          ImmutableList.Builder<Expression> elements = ImmutableList.builder();
          for (int i = 0; i < parts.size(); i++) {
            if (parts.get(i).isEmpty()) {
              // A single trailing comma is allowed.
              if (i == parts.size() - 1 && (i > 0 || inner.isEmpty())) continue;
              throw new CompilerException(open.pos(), "empty array element");
            }
            elements.add(parseNoSeparators(parts.get(i)));
          }
          return new ArrayLiteral(elements.build(), open, close);
        }
      case '{':
        {
          ImmutableList.Builder<ObjectLiteral.Entry> entries = ImmutableList.builder();
          for (int i = 0; i < parts.size(); i++) {
            List<Expression> part = parts.get(i);
            if (part.isEmpty()) {
              if (i == parts.size() - 1 && (i > 0 || inner.isEmpty())) continue;
              throw new CompilerException(open.pos(), "empty object entry");
            }
            entries.add(parseEntry(part));
          }
          return new ObjectLiteral(entries.build(), open, close);
        }
      default:
        throw new IllegalStateException("not an opening bracket: " + open.ch());
    }
  }

  private static ObjectLiteral.Entry parseEntry(List<Expression> part) throws CompilerException {
    Expression key = part.get(0);
    String keyName;
    if (key.type() == Type.IDENTIFIER) {
      keyName = key.<Identifier>cast().name();
    } else if (key.type() == Type.STRING) {
      keyName = key.<StringLiteral>cast().value();
    } else {
      throw new CompilerException(key.pos(), "object keys must be identifiers or strings");
    }

    if (part.size() == 1) {
      if (key.type() != Type.IDENTIFIER) {
        throw new CompilerException(key.pos(), "expected ':' after object key");
      }
      // Shorthand {a} means {a: a}.
      return new ObjectLiteral.Entry(keyName, key.pos(), key);
    }

    Expression colon = part.get(1);
    if (colon.type() != Type.PUNCTUATION || colon.<Punctuation>cast().ch() != ':') {
      throw new CompilerException(colon.pos(), "expected ':' after object key");
    }
    if (part.size() == 2) {
      throw new CompilerException(colon.pos(), "missing value after ':'");
    }
    return new ObjectLiteral.Entry(
        keyName, key.pos(), parseNoSeparators(new ArrayList<>(part.subList(2, part.size()))));
  }

  // Nested groups are already collapsed, so every separator here is at the top level.
  private static List<List<Expression>> splitTopLevel(List<Expression> atoms, char separator) {
    List<List<Expression>> parts = new ArrayList<>();
    List<Expression> current = new ArrayList<>();
    for (Expression atom : atoms) {
      if (atom.type() == Type.PUNCTUATION && atom.<Punctuation>cast().ch() == separator) {
        parts.add(current);
        current = new ArrayList<>();
      } else {
        current.add(atom);
      }
    }
    parts.add(current);
    return parts;
  }

  private static void parseBinaryOperators(ImmutableSet<BinaryOperator> ops, List<Expression> atoms)
      throws CompilerException {
    for (int i = 0; i < atoms.size(); i++) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.OPERATOR) {
        continue;
      }

      OperatorAtom operator = expr.cast();
      if (!operator.isBinary() || !ops.contains(operator.binary())) continue;

      // Consume the previous and subsequent arguments.
      if (i - 1 < 0
          || i + 1 >= atoms.size()
          || !isValue(atoms.get(i - 1))
          || !isValue(atoms.get(i + 1))) {
        throw new CompilerException(
            operator.pos(),
            String.format(
                "binary operator '%s' is missing left or right arguments",
                operator.binary().repr()));
      }

      // Removal of 'i - 1' shifts 'i + 1' to 'i'
      atoms.set(i - 1, new Binary(atoms.remove(i - 1), operator.binary(), atoms.remove(i)));
      i--;
    }
  }

  private static Expression parseNoSeparators(List<Expression> atoms) throws CompilerException {
    Preconditions.checkArgument(!atoms.isEmpty());

    // Pass 1: member and index access, left to right.
    for (int i = 0; i < atoms.size(); i++) {
      Expression expr = atoms.get(i);
      if (expr.type() == Type.INDEX_SUFFIX) {
        Verify.verify(i > 0);
        IndexSuffix suffix = expr.cast();
        atoms.set(i - 1, new Index(atoms.get(i - 1), suffix));
        atoms.remove(i);
        i--;
      } else if (expr.type() == Type.PUNCTUATION && expr.<Punctuation>cast().ch() == '.') {
        if (i == 0 || !isValue(atoms.get(i - 1))) {
          throw new CompilerException(expr.pos(), "'.' must follow a value");
        }
        if (i + 1 >= atoms.size() || atoms.get(i + 1).type() != Type.IDENTIFIER) {
          throw new CompilerException(expr.pos(), "expected a property name after '.'");
        }
        Identifier name = atoms.remove(i + 1).cast();
        atoms.remove(i);
        atoms.set(i - 1, new Member(atoms.get(i - 1), name));
        i--;
      }
    }

    // Pass 2: prefix unary operators
    for (int i = atoms.size() - 1; i >= 0; i--) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.OPERATOR) continue;

      OperatorAtom operator = expr.cast();
      if (operator.isBinary()) continue;

      // Consume the subsequent argument.
      if (i + 1 >= atoms.size() || !isValue(atoms.get(i + 1))) {
        throw new CompilerException(operator.pos(), "unary operator has no argument");
      }
      atoms.set(i, new Unary(operator, atoms.remove(i + 1)));
    }

    // Pass 3: binary operators
    for (ImmutableSet<BinaryOperator> ops : BinaryOperator.orderOfOperations()) {
      parseBinaryOperators(ops, atoms);
    }

    // Pass 4: ternaries, which associate to the right.
    for (int i = atoms.size() - 1; i >= 0; i--) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.PUNCTUATION || expr.<Punctuation>cast().ch() != '?') continue;

      if (i == 0
          || i + 3 >= atoms.size()
          || !isValue(atoms.get(i - 1))
          || !isValue(atoms.get(i + 1))
          || atoms.get(i + 2).type() != Type.PUNCTUATION
          || atoms.get(i + 2).<Punctuation>cast().ch() != ':'
          || !isValue(atoms.get(i + 3))) {
        throw new CompilerException(expr.pos(), "malformed ternary: expected 'a ? b : c'");
      }

      Expression otherwise = atoms.remove(i + 3);
      atoms.remove(i + 2);
      Expression then = atoms.remove(i + 1);
      atoms.remove(i);
      atoms.set(i - 1, new Ternary(atoms.get(i - 1), then, otherwise));
      i--;
    }

    for (Expression atom : atoms) {
      if (atom.type() == Type.PUNCTUATION) {
        throw new CompilerException(
            atom.pos(), String.format("unexpected '%c'", atom.<Punctuation>cast().ch()));
      }
    }

    // In the end, we should be left with a single expression.
    if (atoms.size() > 1) {
      throw new CompilerException(
          atoms.get(1).pos(), "unexpected token: expected end of expression");
    }
    return atoms.get(0);
  }

  private static final class Lexer {
    private final String source;
    private final Tokenizer.Pos startPos;
    private final List<Expression> atoms = new ArrayList<>();
    private int index = 0;
    private int line = 0;
    private int col = 0;

    private Lexer(String source, Tokenizer.Pos startPos) {
      this.source = source;
      this.startPos = startPos;
    }

    private Tokenizer.Pos pos() {
      if (line == 0) return startPos.addColumns(col);
      return new Tokenizer.Pos(startPos.file(), startPos.lineNumber() + line, col);
    }

    private char peek(int ahead) {
      return index + ahead < source.length() ? source.charAt(index + ahead) : '\0';
    }

    private void advance(int n) {
      for (int i = 0; i < n; i++) {
        if (source.charAt(index++) == '\n') {
          line++;
          col = 0;
        } else {
          col++;
        }
      }
    }

    private List<Expression> lex() throws CompilerException {
      while (index < source.length()) {
        char ch = source.charAt(index);
        Tokenizer.Pos pos = pos();
        int start = index;

        if (Character.isWhitespace(ch)) {
          advance(1);
        } else if (ch == '"' || ch == '\'' || ch == '`') {
          String value = readString(ch, pos);
          atoms.add(new StringLiteral(value, source, start, index, pos));
        } else if (Character.isDigit(ch)
            || (ch == '-' && Character.isDigit(peek(1)) && minusIsSign())) {
          advance(1);
          while (Character.isDigit(peek(0)) || peek(0) == '.' || peek(0) == 'e' || peek(0) == 'E') {
            advance(1);
          }
          String text = source.substring(start, index);
          try {
            Double.parseDouble(text);
          } catch (NumberFormatException ex) {
            throw new CompilerException(pos, String.format("malformed number '%s'", text));
          }
          atoms.add(new NumberLiteral(text, source, start, index, pos));
        } else if (Character.isLetter(ch) || ch == '_' || ch == '$') {
          while (Character.isLetterOrDigit(peek(0)) || peek(0) == '_' || peek(0) == '$') {
            advance(1);
          }
          String word = source.substring(start, index);
          if (word.equals("true") || word.equals("false")) {
            atoms.add(new BooleanLiteral(Boolean.parseBoolean(word), source, start, index, pos));
          } else if (word.equals("null") || word.equals("undefined")) {
            atoms.add(new NullLiteral(source, start, index, pos));
          } else {
            atoms.add(new Identifier(word, source, start, index, pos));
          }
        } else if (PUNCTUATION_CHARS.indexOf(ch) >= 0) {
          advance(1);
          atoms.add(new Punctuation(ch, source, start, index, pos));
        } else {
          Optional<String> op =
              OPERATOR_REPRS.stream().filter(r -> source.startsWith(r, start)).findFirst();
          if (!op.isPresent()) {
            throw new CompilerException(pos, String.format("unexpected character '%c'", ch));
          }
          advance(op.get().length());
          atoms.add(new OperatorAtom(op.get(), source, start, index, pos));
        }
      }
      return atoms;
    }

    private boolean minusIsSign() {
      if (atoms.isEmpty()) return true;
      Expression last = atoms.get(atoms.size() - 1);
      if (last.type() == Type.OPERATOR) return true;
      return last.type() == Type.PUNCTUATION
          && "([{,:?".indexOf(last.<Punctuation>cast().ch()) >= 0;
    }

    private String readString(char quote, Tokenizer.Pos pos) throws CompilerException {
      StringBuilder value = new StringBuilder();
      advance(1);
      while (index < source.length()) {
        char ch = source.charAt(index);
        if (ch == quote) {
          advance(1);
          return value.toString();
        } else if (ch == '\\') {
          if (index + 1 >= source.length()) break;
          char escaped = source.charAt(index + 1);
          switch (escaped) {
            case 'n':
              value.append('\n');
              break;
            case 't':
              value.append('\t');
              break;
            default:
              value.append(escaped);
              break;
          }
          advance(2);
          continue;
        } else if (quote == '`' && ch == '$' && peek(1) == '{') {
          throw new CompilerException(pos(), "template substitutions are not supported");
        }
        value.append(ch);
        advance(1);
      }
      throw new CompilerException(pos, "unterminated string literal");
    }
  }

  private final Type type;
  private final String source;
  private final Tokenizer.Pos pos;
  private int start;
  private int end;

  private Expression(Type type, String source, int start, int end, Tokenizer.Pos pos) {
    this.type = type;
    this.source = source;
    this.start = start;
    this.end = end;
    this.pos = pos;
  }

  // A compound spanning from the first to the last of its parts.
  private Expression(Type type, Expression first, Expression last) {
    this(type, first.source, first.start, last.end, first.pos);
  }

  public Type type() {
    return type;
  }

  // The source text this expression was parsed from.
  public String raw() {
    return source.substring(start, end);
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  private void widen(int start, int end) {
    this.start = Math.min(this.start, start);
    this.end = Math.max(this.end, end);
  }

  @Override
  public String toString() {
    return raw();
  }

  // Literal values, and objects or arrays made only of literal values.
  public boolean isLiteral() {
    return type.isScalarLiteral();
  }

  public JsonNode literalJson() throws CompilerException {
    throw new CompilerException(pos(), String.format("expected a literal value, got '%s'", raw()));
  }

  @SuppressWarnings("unchecked")
  public <T extends Expression> T cast() {
    return (T) this;
  }

  public <T extends Expression> T cast(Class<T> clazz) {
    return cast();
  }

  private static final class Punctuation extends Expression {
    private final char ch;

    private Punctuation(char ch, String source, int start, int end, Tokenizer.Pos pos) {
      super(Type.PUNCTUATION, source, start, end, pos);
      this.ch = ch;
    }

    private char ch() {
      return ch;
    }

    private boolean isOpen() {
      return ch == '(' || ch == '[' || ch == '{';
    }

    private boolean isClose() {
      return ch == ')' || ch == ']' || ch == '}';
    }

    private char closer() {
      return ch == '(' ? ')' : ch == '[' ? ']' : '}';
    }
  }

  private static final class OperatorAtom extends Expression {
    private final String repr;

    private OperatorAtom(String repr, String source, int start, int end, Tokenizer.Pos pos) {
      super(Type.OPERATOR, source, start, end, pos);
      this.repr = repr;
    }

    private boolean isBinary() {
      return BinaryOperator.parse(repr).isPresent();
    }

    private BinaryOperator binary() {
      return BinaryOperator.parse(repr).get();
    }
  }

  private static final class IndexSuffix extends Expression {
    private final Expression index;

    private IndexSuffix(Expression index, Punctuation open, Punctuation close) {
      super(Type.INDEX_SUFFIX, open, close);
      this.index = index;
    }
  }

  public static final class StringLiteral extends Expression {
    private final String value;

    private StringLiteral(String value, String source, int start, int end, Tokenizer.Pos pos) {
      super(Type.STRING, source, start, end, pos);
      this.value = value;
    }

    public String value() {
      return value;
    }

    @Override
    public JsonNode literalJson() {
      return JsonNodeFactory.instance.textNode(value);
    }
  }

  public static final class NumberLiteral extends Expression {
    private final String text;

    private NumberLiteral(String text, String source, int start, int end, Tokenizer.Pos pos) {
      super(Type.NUMBER, source, start, end, pos);
      this.text = text;
    }

    public String text() {
      return text;
    }

    public boolean isInteger() {
      return text.chars().skip(text.startsWith("-") ? 1 : 0).allMatch(Character::isDigit);
    }

    public int intValue() throws CompilerException {
      if (!isInteger()) throw new CompilerException(pos(), "expected an integer");
      try {
        return Integer.parseInt(text);
      } catch (NumberFormatException ex) {
        throw new CompilerException(pos(), "integer out of range");
      }
    }

    @Override
    public JsonNode literalJson() {
      if (isInteger()) {
        return JsonNodeFactory.instance.numberNode(new BigInteger(text));
      }
      return JsonNodeFactory.instance.numberNode(new BigDecimal(text));
    }
  }

  public static final class BooleanLiteral extends Expression {
    private final boolean value;

    private BooleanLiteral(boolean value, String source, int start, int end, Tokenizer.Pos pos) {
      super(Type.BOOLEAN, source, start, end, pos);
      this.value = value;
    }

    public boolean value() {
      return value;
    }

    @Override
    public JsonNode literalJson() {
      return JsonNodeFactory.instance.booleanNode(value);
    }
  }

  public static final class NullLiteral extends Expression {
    private NullLiteral(String source, int start, int end, Tokenizer.Pos pos) {
      super(Type.NULL, source, start, end, pos);
    }

    @Override
    public JsonNode literalJson() {
      return JsonNodeFactory.instance.nullNode();
    }
  }

  public static final class Identifier extends Expression {
    private final String name;

    private Identifier(String name, String source, int start, int end, Tokenizer.Pos pos) {
      super(Type.IDENTIFIER, source, start, end, pos);
      this.name = name;
    }

    public String name() {
      return name;
    }
  }

  // object.name
  public static final class Member extends Expression {
    private final Expression object;
    private final String name;

    private Member(Expression object, Identifier name) {
      super(Type.MEMBER, object, name);
      this.object = object;
      this.name = name.name();
    }

    public Expression object() {
      return object;
    }

    public String name() {
      return name;
    }
  }

  // object[index]
  public static final class Index extends Expression {
    private final Expression object;
    private final Expression index;

    private Index(Expression object, IndexSuffix suffix) {
      super(Type.INDEX, object, suffix);
      this.object = object;
      this.index = suffix.index;
    }

    public Expression object() {
      return object;
    }

    public Expression index() {
      return index;
    }
  }

  public static final class Unary extends Expression {
    private final UnaryOperator op;
    private final Expression operand;

    private Unary(OperatorAtom op, Expression operand) {
      super(Type.UNARY, op, operand);
      this.op = UnaryOperator.NOT;
      this.operand = operand;
    }

    public UnaryOperator op() {
      return op;
    }

    public Expression operand() {
      return operand;
    }
  }

  public static final class Binary extends Expression {
    private final Expression lhs;
    private final BinaryOperator op;
    private final Expression rhs;

    private Binary(Expression lhs, BinaryOperator op, Expression rhs) {
      super(Type.BINARY, lhs, rhs);
      this.lhs = lhs;
      this.op = op;
      this.rhs = rhs;
    }

    public Expression lhs() {
      return lhs;
    }

    public BinaryOperator op() {
      return op;
    }

    public Expression rhs() {
      return rhs;
    }
  }

  public static final class Ternary extends Expression {
    private final Expression condition;
    private final Expression then;
    private final Expression otherwise;

    private Ternary(Expression condition, Expression then, Expression otherwise) {
      super(Type.TERNARY, condition, otherwise);
      this.condition = condition;
      this.then = then;
      this.otherwise = otherwise;
    }

    public Expression condition() {
      return condition;
    }

    public Expression then() {
      return then;
    }

    public Expression otherwise() {
      return otherwise;
    }
  }

  public static final class ObjectLiteral extends Expression {
    public static final class Entry {
      private final String key;
      private final Tokenizer.Pos keyPos;
      private final Expression value;

      private Entry(String key, Tokenizer.Pos keyPos, Expression value) {
        this.key = key;
        this.keyPos = keyPos;
        this.value = value;
      }

      public String key() {
        return key;
      }

      public Tokenizer.Pos keyPos() {
        return keyPos;
      }

      public Expression value() {
        return value;
      }
    }

    private final ImmutableList<Entry> entries;

    private ObjectLiteral(ImmutableList<Entry> entries, Punctuation open, Punctuation close) {
      super(Type.OBJECT, open, close);
      this.entries = entries;
    }

    public ImmutableList<Entry> entries() {
      return entries;
    }

    public Optional<Expression> get(String key) {
      return entries.stream().filter(e -> e.key().equals(key)).map(Entry::value).findFirst();
    }

    /** The entries, which must have distinct keys. */
    public ImmutableList<Entry> uniqueEntries() throws CompilerException {
      for (Entry entry : entries) {
        if (entries.stream().filter(e -> e.key().equals(entry.key())).count() > 1) {
          throw new CompilerException(
              entry.keyPos(), String.format("duplicate key '%s'", entry.key()));
        }
      }
      return entries;
    }

    public ImmutableMap<String, Expression> asMap() throws CompilerException {
      ImmutableMap.Builder<String, Expression> builder = ImmutableMap.builder();
      for (Entry entry : uniqueEntries()) builder.put(entry.key(), entry.value());
      return builder.build();
    }

    @Override
    public boolean isLiteral() {
      return entries.stream().allMatch(e -> e.value().isLiteral());
    }

    @Override
    public JsonNode literalJson() throws CompilerException {
      ObjectNode node = JsonNodeFactory.instance.objectNode();
      for (Map.Entry<String, Expression> entry : asMap().entrySet()) {
        node.set(entry.getKey(), entry.getValue().literalJson());
      }
      return node;
    }
  }

  public static final class ArrayLiteral extends Expression {
    private final ImmutableList<Expression> elements;

    private ArrayLiteral(ImmutableList<Expression> elements, Punctuation open, Punctuation close) {
      super(Type.ARRAY, open, close);
      this.elements = elements;
    }

    public ImmutableList<Expression> elements() {
      return elements;
    }

    @Override
    public boolean isLiteral() {
      return elements.stream().allMatch(Expression::isLiteral);
    }

    @Override
    public JsonNode literalJson() throws CompilerException {
      ArrayNode node = JsonNodeFactory.instance.arrayNode();
      for (Expression element : elements) {
        node.add(element.literalJson());
      }
      return node;
    }
  }
}
