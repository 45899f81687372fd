package amc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** A YAML frontmatter block. Keys keep insertion order; absent optional fields are skipped. */
public final class Frontmatter {

  private static final CharMatcher SPECIAL_FIRST = CharMatcher.anyOf("-?:,[]{}#&*!|>'\"%@`");
  private static final ImmutableSet<String> RESERVED =
      ImmutableSet.of("true", "false", "null", "yes", "no", "on", "off", "y", "n", "~");
  private static final Pattern NUMERIC =
      Pattern.compile("[-+]?(\\d[\\d_]*)?(\\.\\d*)?([eE][-+]?\\d+)?|0x[0-9a-fA-F]+|0o[0-7]+");

  private final List<String> lines = new ArrayList<>();

  @CanIgnoreReturnValue
  public Frontmatter put(String key, String value) {
    lines.add(key + ": " + scalar(value));
    return this;
  }

  @CanIgnoreReturnValue
  public Frontmatter put(String key, Optional<String> value) {
    if (value.isPresent()) put(key, value.get());
    return this;
  }

  @CanIgnoreReturnValue
  public Frontmatter putBoolean(String key, Optional<Boolean> value) {
    if (value.isPresent()) lines.add(key + ": " + value.get());
    return this;
  }

  // Empty lists are omitted.
  @CanIgnoreReturnValue
  public Frontmatter putList(String key, List<String> values) {
    if (values.isEmpty()) return this;
    lines.add(key + ":");
    for (String value : values) lines.add("  - " + scalar(value));
    return this;
  }

  public String render() {
    return "---\n" + Joiner.on('\n').join(lines) + "\n---";
  }

  /** A plain scalar where YAML reads it back unchanged; otherwise a single-quoted one. */
  static String scalar(String value) {
    if (CharMatcher.anyOf("\n\r\t").matchesAnyOf(value)) {
      return "\""
          + value
              .replace("\\", "\\\\")
              .replace("\"", "\\\"")
              .replace("\n", "\\n")
              .replace("\r", "\\r")
              .replace("\t", "\\t")
          + "\"";
    }
    return needsQuotes(value) ? "'" + value.replace("'", "''") + "'" : value;
  }

  private static boolean needsQuotes(String value) {
    if (value.isEmpty()) return true;
    if (CharMatcher.whitespace().matches(value.charAt(0))
        || CharMatcher.whitespace().matches(value.charAt(value.length() - 1))) {
      return true;
    }
    if (SPECIAL_FIRST.matches(value.charAt(0))) return true;
    if (value.contains(": ") || value.endsWith(":") || value.contains(" #")) return true;
    if (RESERVED.contains(value.toLowerCase())) return true;
    return NUMERIC.matcher(value).matches();
  }
}
