package amc;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;

/** Produces a tokenization of a markup source file. */
public class Tokenizer {
  public static class Pos implements Comparable<Pos> {
    private static final Pos INTERNAL = new Pos("<internal>", -1, -1);

    public static Pos internal() {
      return INTERNAL;
    }

    private final String file;
    private final int lineNumber;
    private final int column;

    public Pos(String file, int lineNumber, int column) {
      this.file = file;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    public String file() {
      return file;
    }

    public int lineNumber() {
      return lineNumber;
    }

    public int column() {
      return column;
    }

    public Pos addColumns(int columns) {
      return new Pos(file, lineNumber, column + columns);
    }

    public Pos addLines(int lines) {
      return new Pos(file, lineNumber + lines, 0);
    }

    /** Renders the position the way diagnostics print it, with 1-based line and column. */
    public String display() {
      return String.format("%s@%d:%d", file, lineNumber + 1, column + 1);
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.<Pos, String>comparing(p -> p.file())
          .thenComparing(Pos::lineNumber)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Pos)) return false;
      Pos that = (Pos) o;
      return file.equals(that.file) && lineNumber == that.lineNumber && column == that.column;
    }

    @Override
    public int hashCode() {
      return (file.hashCode() * 31 + lineNumber) * 31 + column;
    }

    @Override
    public String toString() {
      return display();
    }
  }

  // name="string", name={expression} or a bare name.
  @AutoValue
  public abstract static class Attribute {
    public enum Kind {
      STRING,
      EXPRESSION,
      FLAG;
    }

    public abstract String name();

    public abstract Pos namePos();

    public abstract Kind kind();

    // The string value, or the expression source, or "true" for a flag.
    public abstract String value();

    public abstract Pos valuePos();

    public static Attribute create(
        String name, Pos namePos, Kind kind, String value, Pos valuePos) {
      return new AutoValue_Tokenizer_Attribute(name, namePos, kind, value, valuePos);
    }
  }

  public abstract static class Token {
    public enum Type {
      OPEN_TAG,
      CLOSE_TAG,
      TEXT,
      INTERPOLATION;
    }

    private final Type type;
    private final Pos pos;

    private Token(Type type, Pos pos) {
      this.type = type;
      this.pos = pos;
    }

    public Type type() {
      return type;
    }

    public Pos pos() {
      return pos;
    }

    @SuppressWarnings("unchecked")
    public <T extends Token> T cast() {
      return (T) this;
    }
  }

  // <name attr...> or <name attr... />
  public static final class OpenTag extends Token {
    private final String name;
    private final ImmutableList<Attribute> attributes;
    private final boolean selfClosing;

    public OpenTag(String name, Pos pos, List<Attribute> attributes, boolean selfClosing) {
      super(Type.OPEN_TAG, pos);
      this.name = name;
      this.attributes = ImmutableList.copyOf(attributes);
      this.selfClosing = selfClosing;
    }

    public String name() {
      return name;
    }

    public ImmutableList<Attribute> attributes() {
      return attributes;
    }

    public boolean selfClosing() {
      return selfClosing;
    }

    @Override
    public String toString() {
      return "<" + name + (selfClosing ? "/>" : ">");
    }
  }

  public static final class CloseTag extends Token {
    private final String name;

    public CloseTag(String name, Pos pos) {
      super(Type.CLOSE_TAG, pos);
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public String toString() {
      return "</" + name + ">";
    }
  }

  public static final class Text extends Token {
    private final String text;
    private final boolean raw;

    public Text(String text, Pos pos, boolean raw) {
      super(Type.TEXT, pos);
      this.text = text;
      this.raw = raw;
    }

    public String text() {
      return text;
    }

    // Raw text keeps its whitespace exactly.
    public boolean raw() {
      return raw;
    }

    @Override
    public String toString() {
      return "[text: " + text + "]";
    }
  }

  // {expression}
  public static final class Interpolation extends Token {
    private final String source;

    public Interpolation(String source, Pos pos) {
      super(Type.INTERPOLATION, pos);
      this.source = source;
    }

    public String source() {
      return source;
    }

    @Override
    public String toString() {
      return "{" + source + "}";
    }
  }

  // Elements whose content is taken verbatim up to the matching close tag.
  public static final ImmutableSet<String> RAW_TEXT_TAGS =
      ImmutableSet.of("pre", "Markdown", "Bash", "Function", "Helper", "Operation");

  private static final CharMatcher NAME_START = CharMatcher.inRange('a', 'z')
      .or(CharMatcher.inRange('A', 'Z'))
      .or(CharMatcher.is('_'));
  private static final CharMatcher NAME_PART =
      NAME_START.or(CharMatcher.inRange('0', '9')).or(CharMatcher.anyOf("-."));

  private enum State {
    TEXT,
    TAG_NAME,
    TAG_ATTRIBUTES,
    ATTRIBUTE_NAME,
    ATTRIBUTE_EQUALS,
    ATTRIBUTE_VALUE,
    TAG_SELF_CLOSE,
    CLOSE_TAG_NAME,
    CLOSE_TAG_END;
  }

  private final String file;
  private final ImmutableList<String> lines;
  private int line = 0;
  private int col = -1; // In the initial state we have not read anything yet.
  private char ch = ' ';
  private State state = State.TEXT;

  private StringBuilder word = new StringBuilder();
  private Pos wordPos = null;

  private String tagName = null;
  private Pos tagNamePos = null;
  private String attributeName = null;
  private Pos attributeNamePos = null;
  private final List<Attribute> attributes = new ArrayList<>();

  private final ImmutableList.Builder<Token> tokensBuilder = ImmutableList.builder();

  public Tokenizer(String file, String content) {
    this.file = file;
    this.lines =
        ImmutableList.copyOf(Iterables.transform(Splitter.on('\n').split(content), s -> s + "\n"));
  }

  public ImmutableList<Token> tokenize() throws CompilerException {
    while (advance()) {
      switch (state) {
        case TEXT:
          {
            if (ch == '<') {
              if (canPeek(3) && peek() == '!' && peek(2) == '-' && peek(3) == '-') {
                skipHtmlComment();
              } else if (canPeek() && peek() == '/') {
                closeText();
                advance();
                state = State.CLOSE_TAG_NAME;
              } else if (canPeek() && NAME_START.matches(peek())) {
                closeText();
                state = State.TAG_NAME;
              } else {
                throw error("unexpected '<': use \\< for a literal angle bracket");
              }
              break;
            } else if (ch == '{') {
              if (canPeek(2) && peek() == '/' && peek(2) == '*') {
                skipExpressionComment();
              } else {
                closeText();
                Pos pos = pos().addColumns(1);
                tokensBuilder.add(new Interpolation(readExpression(), pos));
              }
              break;
            } else if (ch == '}') {
              throw error("unexpected '}': use \\} for a literal brace");
            }

            if (word.length() == 0) {
              wordPos = pos();
            }
            if (!readEscapeChar()) {
              word.append(ch);
            }
            break;
          }
        case TAG_NAME:
          {
            if (word.length() == 0) {
              tagNamePos = pos();
            }
            if (NAME_PART.matches(ch)) {
              word.append(ch);
              break;
            }

            tagName = takeWord();
            state = State.TAG_ATTRIBUTES;
            handleTagAttributes();
            break;
          }
        case TAG_ATTRIBUTES:
          {
            handleTagAttributes();
            break;
          }
        case ATTRIBUTE_NAME:
          {
            if (NAME_PART.matches(ch)) {
              word.append(ch);
              break;
            }

            attributeName = takeWord();
            state = State.ATTRIBUTE_EQUALS;
            handleAttributeEquals();
            break;
          }
        case ATTRIBUTE_EQUALS:
          {
            handleAttributeEquals();
            break;
          }
        case ATTRIBUTE_VALUE:
          {
            if (Character.isWhitespace(ch)) break;

            if (ch == '"' || ch == '\'') {
              Pos valuePos = pos().addColumns(1);
              addAttribute(Attribute.Kind.STRING, readQuoted(ch), valuePos);
            } else if (ch == '{') {
              Pos valuePos = pos().addColumns(1);
              addAttribute(Attribute.Kind.EXPRESSION, readExpression(), valuePos);
            } else {
              throw error("expected '\"' or '{' after '='");
            }
            state = State.TAG_ATTRIBUTES;
            break;
          }
        case TAG_SELF_CLOSE:
          {
            if (ch != '>') throw error("expected '>' after '/'");
            closeOpenTag(true);
            break;
          }
        case CLOSE_TAG_NAME:
          {
            if (word.length() == 0) {
              if (!NAME_START.matches(ch)) throw error("expected a tag name after '</'");
              tagNamePos = pos();
            }
            if (NAME_PART.matches(ch)) {
              word.append(ch);
              break;
            }

            tagName = takeWord();
            state = State.CLOSE_TAG_END;
            handleCloseTagEnd();
            break;
          }
        case CLOSE_TAG_END:
          {
            handleCloseTagEnd();
            break;
          }
      }
    }

    if (state != State.TEXT) {
      throw new CompilerException(
          new Pos(file, lines.size() - 1, lines.get(lines.size() - 1).length() - 1),
          "got unexpected EOF: unfinished tag");
    }
    closeText();

    return tokensBuilder.build();
  }

  private void handleTagAttributes() throws CompilerException {
    if (Character.isWhitespace(ch)) {
      return;
    } else if (ch == '>') {
      closeOpenTag(false);
    } else if (ch == '/') {
      state = State.TAG_SELF_CLOSE;
    } else if (NAME_START.matches(ch)) {
      attributeNamePos = pos();
      word.append(ch);
      state = State.ATTRIBUTE_NAME;
    } else {
      throw error(String.format("unexpected '%c' in tag <%s>", ch, tagName));
    }
  }

  private void handleAttributeEquals() throws CompilerException {
    if (Character.isWhitespace(ch)) {
      return;
    } else if (ch == '=') {
      state = State.ATTRIBUTE_VALUE;
      return;
    }

    // A bare attribute is a flag.
    addAttribute(Attribute.Kind.FLAG, "true", attributeNamePos);
    state = State.TAG_ATTRIBUTES;
    handleTagAttributes();
  }

  private void handleCloseTagEnd() throws CompilerException {
    if (Character.isWhitespace(ch)) return;
    if (ch != '>') throw error(String.format("expected '>' to close </%s", tagName));

    tokensBuilder.add(new CloseTag(tagName, tagNamePos));
    tagName = null;
    tagNamePos = null;
    state = State.TEXT;
  }

  private void addAttribute(Attribute.Kind kind, String value, Pos valuePos)
      throws CompilerException {
    for (Attribute attr : attributes) {
      if (attr.name().equals(attributeName)) {
        throw new CompilerException(
            attributeNamePos,
            String.format("duplicate attribute '%s' on <%s>", attributeName, tagName));
      }
    }
    attributes.add(Attribute.create(attributeName, attributeNamePos, kind, value, valuePos));
    attributeName = null;
    attributeNamePos = null;
  }

  private void closeOpenTag(boolean selfClosing) throws CompilerException {
    tokensBuilder.add(new OpenTag(tagName, tagNamePos, attributes, selfClosing));
    attributes.clear();
    state = State.TEXT;

    if (!selfClosing && RAW_TEXT_TAGS.contains(tagName)) {
      readRawText(tagName);
    }
    tagName = null;
    tagNamePos = null;
  }

  // Consumes everything up to, but not including, the matching close tag.
  private void readRawText(String name) throws CompilerException {
    String closing = "</" + name;
    Pos start = null;
    StringBuilder raw = new StringBuilder();
    while (true) {
      if (!canPeek()) {
        throw new CompilerException(
            tagNamePos, String.format("unclosed raw text element <%s>", name));
      }
      if (lookingAt(closing)) break;

      advance();
      if (start == null) start = pos();
      raw.append(ch);
    }

    tokensBuilder.add(new Text(raw.toString(), start == null ? pos() : start, true));
  }

  // True if the characters after the current one spell out {@code text}.
  private boolean lookingAt(String text) {
    if (!canPeek(text.length())) return false;
    for (int i = 0; i < text.length(); i++) {
      if (peek(i + 1) != text.charAt(i)) return false;
    }
    return true;
  }

  private String readQuoted(char quote) throws CompilerException {
    Pos start = pos();
    StringBuilder value = new StringBuilder();
    while (advance()) {
      if (ch == quote) return value.toString();
      value.append(ch);
    }
    throw new CompilerException(start, "unterminated attribute string");
  }

  // Reads an expression body after '{' up to the matching '}'; the closing brace is consumed.
  private String readExpression() throws CompilerException {
    Pos start = pos();
    StringBuilder source = new StringBuilder();
    int depth = 1;
    while (advance()) {
      if (ch == '"' || ch == '\'' || ch == '`') {
        char quote = ch;
        source.append(ch);
        boolean closed = false;
        while (advance()) {
          source.append(ch);
          if (ch == '\\' && canPeek()) {
            advance();
            source.append(ch);
          } else if (ch == quote) {
            closed = true;
            break;
          }
        }
        if (!closed) throw new CompilerException(start, "unterminated string in expression");
        continue;
      }

      if (ch == '{') {
        depth++;
      } else if (ch == '}' && --depth == 0) {
        String expr = source.toString();
        if (expr.trim().isEmpty()) throw new CompilerException(start, "empty expression");
        return expr;
      }
      source.append(ch);
    }
    throw new CompilerException(start, "unterminated expression: missing '}'");
  }

  private void skipHtmlComment() throws CompilerException {
    Pos start = pos();
    advance(3);
    while (advance()) {
      if (ch == '-' && lookingAt("->")) {
        advance(2);
        return;
      }
    }
    throw new CompilerException(start, "unterminated comment");
  }

  private void skipExpressionComment() throws CompilerException {
    Pos start = pos();
    advance(2);
    while (advance()) {
      if (ch == '*' && lookingAt("/}")) {
        advance(2);
        return;
      }
    }
    throw new CompilerException(start, "unterminated comment");
  }

  private boolean readEscapeChar() {
    if (ch != '\\' || !canPeek()) {
      return false;
    }

    char next = peek();
    if (next != '{' && next != '}' && next != '<' && next != '>' && next != '\\') {
      // Any other backslash is literal.
      return false;
    }

    advance();
    word.append(ch);
    return true;
  }

  private String takeWord() {
    String result = word.toString();
    word = new StringBuilder();
    return result;
  }

  private void closeText() {
    if (word.length() > 0) {
      tokensBuilder.add(new Text(takeWord(), wordPos, false));
    }
    wordPos = null;
  }

  private CompilerException error(String msg) {
    return new CompilerException(pos(), msg);
  }

  private boolean canPeek() {
    return canPeek(1);
  }

  private boolean canPeek(int ahead) {
    if (line >= lines.size()) {
      return false;
    }

    int nCol = col + ahead;
    int nLine = line;
    while (nCol >= lines.get(nLine).length()) {
      nCol -= lines.get(nLine).length();
      if (++nLine == lines.size()) return false;
    }
    return true;
  }

  private char peek() {
    return peek(1);
  }

  private char peek(int ahead) {
    int nCol = col + ahead;
    int nLine = line;
    while (nCol >= lines.get(nLine).length()) {
      nCol -= lines.get(nLine++).length();
    }
    return lines.get(nLine).charAt(nCol);
  }

  private boolean advance() {
    return advance(1);
  }

  private boolean advance(int ahead) {
    if (line >= lines.size()) return false;

    col += ahead;
    while (col >= lines.get(line).length()) {
      col -= lines.get(line).length();
      if (++line == lines.size()) return false;
    }

    ch = lines.get(line).charAt(col);
    return true;
  }

  private Pos pos() {
    return new Pos(file, line, col);
  }
}
