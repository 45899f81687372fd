package amc;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.io.Files;

public class CompilerMain {

  private static final Logger logger = LoggerFactory.getLogger(CompilerMain.class);

  private static final String USAGE =
      "Usage: $COMPILER [--out dir] [--strict] [--code-split] [--threads n] source...";

  public static void main(String[] args) throws IOException, InterruptedException {
    BuildOptions.Builder options = BuildOptions.builder();
    List<File> inputs = new ArrayList<>();
    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--out":
          options.setOutputRoot(flagValue(args, ++i));
          break;
        case "--strict":
          options.setStrict(true);
          break;
        case "--code-split":
          options.setBundleStrategy(BuildOptions.BundleStrategy.CODE_SPLIT);
          break;
        case "--threads":
          try {
            options.setThreads(Integer.parseInt(flagValue(args, ++i)));
          } catch (NumberFormatException ex) {
            usage("--threads expects a number");
          }
          break;
        default:
          if (args[i].startsWith("--")) usage("unknown flag " + args[i]);
          inputs.add(new File(args[i]));
      }
    }
    if (inputs.isEmpty()) usage("no sources given");

    BuildOptions buildOptions;
    try {
      buildOptions = options.build();
    } catch (IllegalArgumentException ex) {
      usage(ex.getMessage());
      return;
    }

    List<BuildDriver.Source> sources = new ArrayList<>();
    for (File f : inputs) {
      sources.add(
          BuildDriver.Source.create(f.getPath(), Files.asCharSource(f, StandardCharsets.UTF_8)));
    }

    BuildResult result =
        new BuildDriver(buildOptions, CompilerMain::loadStatic).build(sources);
    result.diagnostics().forEach(Diagnostic::print);

    // Files of failed documents are already withheld; everything else is still written.
    File root = new File(buildOptions.outputRoot());
    List<Diagnostic> writeErrors = writeFiles(root, result.files());
    writeErrors.forEach(Diagnostic::print);
    logger.info("Wrote {} file(s) to {}", result.files().size() - writeErrors.size(), root);

    if (result.hasErrors() || !writeErrors.isEmpty()) {
      System.out.println("Compilation failed.  See errors above.");
      System.exit(1);
    }
    System.out.println("Compilation succeeded!");
  }

  // A file that cannot be written is reported against its source; the others are still written.
  static List<Diagnostic> writeFiles(File root, List<OutputFile> files) {
    List<Diagnostic> errors = new ArrayList<>();
    for (OutputFile file : files) {
      File target = new File(root, file.path());
      try {
        Files.createParentDirs(target);
        file.content().copyTo(Files.asByteSink(target));
      } catch (IOException ex) {
        String source = file.source().isEmpty() ? file.path() : file.source();
        errors.add(
            Diagnostic.error(
                new Tokenizer.Pos(source, 0, 0),
                String.format("cannot write %s: %s", target.getPath(), ex.getMessage())));
      }
    }
    return errors;
  }

  // Static skill files are resolved against the directory of the skill's source.
  private static byte[] loadStatic(String sourceFile, String path) throws IOException {
    File dir = new File(sourceFile).getAbsoluteFile().getParentFile();
    return Files.toByteArray(new File(dir, path));
  }

  private static String flagValue(String[] args, int i) {
    if (i >= args.length) usage(args[i - 1] + " expects a value");
    return args[i];
  }

  private static void usage(String problem) {
    System.err.println(problem);
    System.err.println(USAGE);
    System.exit(1);
  }
}
