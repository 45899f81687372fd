package amc;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.google.auto.value.AutoValue;
import com.google.common.io.ByteSource;

/** One generated artifact, addressed relative to the output root. */
@AutoValue
public abstract class OutputFile {
  public abstract String path();

  public abstract ByteSource content();

  // The source file the artifact was generated from, or "" for build-wide artifacts.
  public abstract String source();

  public String text() {
    try {
      return content().asCharSource(StandardCharsets.UTF_8).read();
    } catch (IOException ex) {
      // In-memory sources never fail to read.
      throw new IllegalStateException(ex);
    }
  }

  public static OutputFile text(String path, String text, String source) {
    return bytes(path, text.getBytes(StandardCharsets.UTF_8), source);
  }

  public static OutputFile bytes(String path, byte[] content, String source) {
    return new AutoValue_OutputFile(path, ByteSource.wrap(content.clone()), source);
  }
}
