package amc;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

@AutoValue
public abstract class BuildOptions {

  private static final CharMatcher SHELL_SAFE =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("._-/+@%:,="));

  public enum BundleStrategy {
    SINGLE_ENTRY,
    CODE_SPLIT;
  }

  // Artifact paths are relative to this directory.
  public abstract String outputRoot();

  // The command that runs the runtime module, e.g. node.
  public abstract String runtimeEntry();

  public abstract BundleStrategy bundleStrategy();

  // Whether contract violations at spawn sites are errors.
  public abstract boolean strict();

  public abstract int threads();

  /** The prefix of every runtime call line. */
  public String runtimeCommand() {
    return runtimeEntry() + " " + shellWord(outputRoot() + "/" + Bundler.ENTRY_PATH);
  }

  // Single-quotes a word unless every character is safe unquoted.
  static String shellWord(String word) {
    if (!word.isEmpty() && SHELL_SAFE.matchesAllOf(word)) return word;
    return "'" + word.replace("'", "'\"'\"'") + "'";
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_BuildOptions.Builder()
        .setOutputRoot(".claude")
        .setRuntimeEntry("node")
        .setBundleStrategy(BundleStrategy.SINGLE_ENTRY)
        .setStrict(false)
        .setThreads(Runtime.getRuntime().availableProcessors());
  }

  public static BuildOptions defaults() {
    return builder().build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setOutputRoot(String value);

    public abstract Builder setRuntimeEntry(String value);

    public abstract Builder setBundleStrategy(BundleStrategy value);

    public abstract Builder setStrict(boolean value);

    public abstract Builder setThreads(int value);

    abstract BuildOptions autoBuild();

    public BuildOptions build() {
      BuildOptions options = autoBuild();
      Preconditions.checkArgument(options.threads() > 0, "threads must be positive");
      Preconditions.checkArgument(
          !options.outputRoot().isEmpty() && !options.outputRoot().endsWith("/"),
          "output root must be a non-empty path without a trailing slash");
      return options;
    }
  }
}
