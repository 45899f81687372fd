package amc;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import amc.processor.IrChild;
import amc.processor.IrNode;

/**
 * A lowered runtime expression. Each form renders a human-readable description and a jq filter;
 * {@link #shellValue()} wraps the filter into a shell substitution over the referenced variables.
 */
public abstract class RuntimeExpression implements IrNodeInterface {

  public enum Type {
    LITERAL,
    VAR_REF,
    COMPARISON,
    TERNARY,
    LOGICAL;
  }

  // Whether variable references render as $VAR.path or, with a single variable piped in, .path
  public enum FilterMode {
    ABSOLUTE,
    RELATIVE;
  }

  private final Type type;
  private final Tokenizer.Pos pos;

  private RuntimeExpression(Type type, Tokenizer.Pos pos) {
    this.type = type;
    this.pos = pos;
  }

  public Type type() {
    return type;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  @SuppressWarnings("unchecked")
  public <T extends RuntimeExpression> T cast() {
    return (T) this;
  }

  /** Prose for contexts that are read, not executed. */
  public abstract String description();

  /** A jq filter computing this expression. */
  public abstract String filter(FilterMode mode);

  protected abstract void collectVariables(Set<String> out);

  public ImmutableSortedSet<String> variables() {
    Set<String> out = new TreeSet<>();
    collectVariables(out);
    return ImmutableSortedSet.copyOf(out);
  }

  /** The value as a shell word: a literal, or a jq substitution over the referenced variables. */
  public String shellValue() {
    ImmutableSortedSet<String> vars = variables();
    if (vars.isEmpty()) {
      if (type == Type.LITERAL) return this.<Literal>cast().plainText();
      return String.format("$(jq -n -r '%s')", escapeSingleQuotes(filter(FilterMode.ABSOLUTE)));
    } else if (vars.size() == 1) {
      return String.format(
          "$(echo \"$%s\" | jq -r '%s')",
          vars.first(), escapeSingleQuotes(filter(FilterMode.RELATIVE)));
    }

    String args =
        vars.stream()
            .map(v -> String.format("--argjson %s \"$%s\"", v, v))
            .collect(Collectors.joining(" "));
    return String.format(
        "$(jq -n -r %s '%s')", args, escapeSingleQuotes(filter(FilterMode.ABSOLUTE)));
  }

  /** Makes {@code text} safe inside a single-quoted shell word. */
  public static String escapeSingleQuotes(String text) {
    return text.replace("'", "'\"'\"'");
  }

  // Composite operands are parenthesized in filters.
  private static String operandFilter(RuntimeExpression expr, FilterMode mode) {
    String filter = expr.filter(mode);
    return expr.type == Type.LITERAL || expr.type == Type.VAR_REF ? filter : "(" + filter + ")";
  }

  @IrNode
  public static final class Literal extends RuntimeExpression
      implements RuntimeExpression_Literal_IrNode {
    private final JsonNode value;

    public Literal(JsonNode value, Tokenizer.Pos pos) {
      super(Type.LITERAL, pos);
      this.value = value;
    }

    public JsonNode value() {
      return value;
    }

    // The literal as it reads in text: strings unquoted, everything else as JSON.
    public String plainText() {
      return value.isTextual() ? value.asText() : value.toString();
    }

    @Override
    public String description() {
      return value.isTextual() ? "'" + value.asText() + "'" : value.toString();
    }

    @Override
    public String filter(FilterMode mode) {
      return value.toString();
    }

    @Override
    protected void collectVariables(Set<String> out) {}
  }

  // A runtime variable and a path into its value.
  @IrNode
  public static final class VarRef extends RuntimeExpression
      implements RuntimeExpression_VarRef_IrNode {
    private static final CharMatcher IDENTIFIER =
        CharMatcher.inRange('a', 'z')
            .or(CharMatcher.inRange('A', 'Z'))
            .or(CharMatcher.inRange('0', '9'))
            .or(CharMatcher.is('_'));

    private final String variable;
    private final ImmutableList<String> path;

    public VarRef(String variable, List<String> path, Tokenizer.Pos pos) {
      super(Type.VAR_REF, pos);
      this.variable = variable;
      this.path = ImmutableList.copyOf(path);
    }

    // The shell variable name.
    public String variable() {
      return variable;
    }

    public ImmutableList<String> path() {
      return path;
    }

    public String pathSuffix() {
      StringBuilder sb = new StringBuilder();
      for (String segment : path) {
        if (!segment.isEmpty() && CharMatcher.inRange('0', '9').matchesAllOf(segment)) {
          sb.append('[').append(segment).append(']');
        } else if (!segment.isEmpty()
            && IDENTIFIER.matchesAllOf(segment)
            && !Character.isDigit(segment.charAt(0))) {
          sb.append('.').append(segment);
        } else {
          sb.append(".[\"").append(segment.replace("\"", "\\\"")).append("\"]");
        }
      }
      return sb.toString();
    }

    /** $VAR.path, the way prose refers to the value. */
    public String reference() {
      return "$" + variable + pathSuffix();
    }

    @Override
    public String description() {
      return reference();
    }

    @Override
    public String filter(FilterMode mode) {
      if (mode == FilterMode.RELATIVE) {
        String suffix = pathSuffix();
        return suffix.isEmpty() ? "." : suffix.startsWith("[") ? "." + suffix : suffix;
      }
      return reference();
    }

    @Override
    protected void collectVariables(Set<String> out) {
      out.add(variable);
    }
  }

  public enum ComparisonOperator {
    EQUAL("equals", "=="),
    NOT_EQUAL("does not equal", "!="),
    LESS_THAN("is less than", "<"),
    LESS_THAN_OR_EQUAL("is at most", "<="),
    GREATER_THAN("is greater than", ">"),
    GREATER_THAN_OR_EQUAL("is at least", ">=");

    private final String phrase;
    private final String jq;

    ComparisonOperator(String phrase, String jq) {
      this.phrase = phrase;
      this.jq = jq;
    }

    public String phrase() {
      return phrase;
    }

    public String jq() {
      return jq;
    }

    public static ComparisonOperator of(Expression.BinaryOperator op) {
      switch (op) {
        case EQUAL:
        case STRICT_EQUAL:
          return EQUAL;
        case NOT_EQUAL:
        case STRICT_NOT_EQUAL:
          return NOT_EQUAL;
        case LESS_THAN:
          return LESS_THAN;
        case LESS_THAN_OR_EQUAL:
          return LESS_THAN_OR_EQUAL;
        case GREATER_THAN:
          return GREATER_THAN;
        case GREATER_THAN_OR_EQUAL:
          return GREATER_THAN_OR_EQUAL;
        default:
          throw new IllegalArgumentException("not a comparison: " + op);
      }
    }
  }

  @IrNode
  public static final class Comparison extends RuntimeExpression
      implements RuntimeExpression_Comparison_IrNode {
    private final ComparisonOperator op;
    private final RuntimeExpression lhs;
    private final RuntimeExpression rhs;

    public Comparison(
        ComparisonOperator op, RuntimeExpression lhs, RuntimeExpression rhs, Tokenizer.Pos pos) {
      super(Type.COMPARISON, pos);
      this.op = op;
      this.lhs = lhs;
      this.rhs = rhs;
    }

    public ComparisonOperator op() {
      return op;
    }

    @IrChild
    @Override
    public RuntimeExpression lhs() {
      return lhs;
    }

    @IrChild
    @Override
    public RuntimeExpression rhs() {
      return rhs;
    }

    @Override
    public String description() {
      return lhs.description() + " " + op.phrase() + " " + rhs.description();
    }

    @Override
    public String filter(FilterMode mode) {
      return operandFilter(lhs, mode) + " " + op.jq() + " " + operandFilter(rhs, mode);
    }

    @Override
    protected void collectVariables(Set<String> out) {
      lhs.collectVariables(out);
      rhs.collectVariables(out);
    }
  }

  @IrNode
  public static final class Ternary extends RuntimeExpression
      implements RuntimeExpression_Ternary_IrNode {
    private final RuntimeExpression condition;
    private final RuntimeExpression then;
    private final RuntimeExpression otherwise;

    public Ternary(
        RuntimeExpression condition,
        RuntimeExpression then,
        RuntimeExpression otherwise,
        Tokenizer.Pos pos) {
      super(Type.TERNARY, pos);
      this.condition = condition;
      this.then = then;
      this.otherwise = otherwise;
    }

    @IrChild
    @Override
    public RuntimeExpression condition() {
      return condition;
    }

    @IrChild
    @Override
    public RuntimeExpression then() {
      return then;
    }

    @IrChild
    @Override
    public RuntimeExpression otherwise() {
      return otherwise;
    }

    @Override
    public String description() {
      return String.format(
          "if %s then %s else %s end",
          condition.description(), then.description(), otherwise.description());
    }

    @Override
    public String filter(FilterMode mode) {
      return String.format(
          "if %s then %s else %s end",
          condition.filter(mode), then.filter(mode), otherwise.filter(mode));
    }

    @Override
    protected void collectVariables(Set<String> out) {
      condition.collectVariables(out);
      then.collectVariables(out);
      otherwise.collectVariables(out);
    }
  }

  public enum LogicalOperator {
    AND,
    OR,
    NOT;
  }

  @IrNode
  public static final class Logical extends RuntimeExpression
      implements RuntimeExpression_Logical_IrNode {
    private final LogicalOperator op;
    private final ImmutableList<RuntimeExpression> operands;

    public Logical(LogicalOperator op, List<RuntimeExpression> operands, Tokenizer.Pos pos) {
      super(Type.LOGICAL, pos);
      Preconditions.checkArgument(
          op == LogicalOperator.NOT ? operands.size() == 1 : operands.size() == 2,
          "wrong operand count for %s",
          op);
      this.op = op;
      this.operands = ImmutableList.copyOf(operands);
    }

    public LogicalOperator op() {
      return op;
    }

    @IrChild
    @Override
    public ImmutableList<RuntimeExpression> operands() {
      return operands;
    }

    private static String operandDescription(RuntimeExpression expr) {
      return expr.type() == Type.LOGICAL ? "(" + expr.description() + ")" : expr.description();
    }

    @Override
    public String description() {
      if (op == LogicalOperator.NOT) {
        return "NOT " + operandDescription(operands.get(0));
      }
      return operands
          .stream()
          .map(Logical::operandDescription)
          .collect(Collectors.joining(" " + op.name() + " "));
    }

    @Override
    public String filter(FilterMode mode) {
      switch (op) {
        case NOT:
          return "(" + operands.get(0).filter(mode) + ") | not";
        case AND:
          return "("
              + operands.get(0).filter(mode)
              + ") and ("
              + operands.get(1).filter(mode)
              + ")";
        default:
          return "(" + operands.get(0).filter(mode) + ") or (" + operands.get(1).filter(mode) + ")";
      }
    }

    @Override
    protected void collectVariables(Set<String> out) {
      operands.forEach(o -> o.collectVariables(out));
    }
  }
}
