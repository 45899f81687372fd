package amc;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.io.CharSource;
import com.google.common.util.concurrent.Futures;

/**
 * Compiles a set of sources into artifacts. Documents are parsed, validated and emitted
 * concurrently; everything that spans documents runs after all of them are done.
 */
public final class BuildDriver {

  private static final Logger logger = LoggerFactory.getLogger(BuildDriver.class);

  /** One source file. The content is read by the worker that compiles it. */
  @AutoValue
  public abstract static class Source {
    public abstract String file();

    public abstract CharSource content();

    public static Source create(String file, CharSource content) {
      return new AutoValue_BuildDriver_Source(file, content);
    }

    public static Source of(String file, String content) {
      return create(file, CharSource.wrap(content));
    }
  }

  // The outcome of one document's worker.
  private static final class Unit {
    private final String file;
    private final Optional<Document> document;
    private final ImmutableList<OutputFile> files;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private boolean failed;

    private Unit(String file, Optional<Document> document, List<OutputFile> files) {
      this.file = file;
      this.document = document;
      this.files = ImmutableList.copyOf(files);
      this.failed = !document.isPresent();
    }

    private void report(List<Diagnostic> findings) {
      diagnostics.addAll(findings);
      if (findings.stream().anyMatch(Diagnostic::isError)) failed = true;
    }
  }

  private final BuildOptions options;
  private final Emitter emitter;

  public BuildDriver(BuildOptions options, Emitter.StaticFileLoader loader) {
    this.options = options;
    this.emitter = new Emitter(options, loader);
  }

  public BuildResult build(List<Source> sources) throws InterruptedException {
    FunctionRegistry registry = new FunctionRegistry();

    List<Source> ordered = new ArrayList<>(sources);
    ordered.sort(Comparator.comparing(Source::file));

    List<Unit> units = new ArrayList<>();
    ExecutorService executor = Executors.newFixedThreadPool(options.threads());
    try {
      List<Callable<Unit>> tasks = new ArrayList<>();
      for (Source source : ordered) tasks.add(() -> compile(source, registry));
      // invokeAll returns once every task is done; nothing below runs before that.
      for (Future<Unit> future : executor.invokeAll(tasks)) {
        units.add(Futures.getDone(future));
      }
    } catch (ExecutionException ex) {
      throw new IllegalStateException("worker failed unexpectedly", ex.getCause());
    } finally {
      executor.shutdownNow();
    }

    checkContracts(units);
    checkStateReferences(units);
    FunctionRegistry live = checkCalls(units, registry);
    List<Diagnostic> diagnostics = new ArrayList<>(live.conflictWarnings());

    List<Document> documents = new ArrayList<>();
    List<OutputFile> files = new ArrayList<>();
    for (Unit unit : units) {
      diagnostics.addAll(unit.diagnostics);
      if (unit.failed) {
        logger.warn("{} failed; its artifacts are withheld", unit.file);
        continue;
      }
      documents.add(unit.document.get());
      files.addAll(unit.files);
    }

    files.addAll(aggregates(documents, diagnostics));

    ImmutableList<OutputFile> runtime =
        new Bundler(options.bundleStrategy()).bundle(live, documents);
    if (!runtime.isEmpty()) {
      logger.info(
          "Bundled {} function(s) into {} runtime file(s)",
          live.snapshot().size(),
          runtime.size());
    }
    files.addAll(runtime);

    ImmutableList<OutputFile> unique = uniquePaths(files, diagnostics);
    diagnostics.sort(Diagnostic.ORDER);
    return BuildResult.create(unique, diagnostics);
  }

  private Unit compile(Source source, FunctionRegistry registry) {
    String file = source.file();
    List<Diagnostic> diagnostics = new ArrayList<>();
    Unit unit;
    try {
      String content = source.content().read();
      logger.debug("Parsing {}", file);
      DocumentParser parser = new DocumentParser(file, options.outputRoot(), registry);
      Document document = parser.parse(content);
      diagnostics.addAll(parser.warnings());

      logger.debug("Validating {}", file);
      diagnostics.addAll(new DocumentValidator(document).computeDiagnostics());

      logger.debug("Emitting {}", file);
      ImmutableList<OutputFile> files = emitter.emit(document);
      logger.info("Compiled {} ({} file(s))", file, files.size());
      unit = new Unit(file, Optional.of(document), files);
    } catch (IOException ex) {
      diagnostics.add(
          Diagnostic.error(
              new Tokenizer.Pos(file, 0, 0), "cannot read source: " + ex.getMessage()));
      unit = new Unit(file, Optional.empty(), ImmutableList.of());
    } catch (CompilerException ex) {
      diagnostics.add(ex.toDiagnostic());
      unit = new Unit(file, Optional.empty(), ImmutableList.of());
    }
    unit.diagnostics.addAll(diagnostics);
    return unit;
  }

  /**
   * Checks every call against the functions of the documents that are still emitted, and
   * returns the registry of those functions. A document that fails here takes its functions
   * with it, which can strand the calls of others, so the check repeats until no further
   * document fails.
   */
  private static FunctionRegistry checkCalls(List<Unit> units, FunctionRegistry declared) {
    while (true) {
      Set<String> failedFiles = new HashSet<>();
      for (Unit unit : units) {
        if (unit.failed) failedFiles.add(unit.file);
      }
      FunctionRegistry live = declared.withoutFiles(failedFiles);

      Map<Unit, ImmutableList<Diagnostic>> findings = new LinkedHashMap<>();
      boolean failures = false;
      for (Unit unit : units) {
        if (unit.failed) continue;
        FunctionCallCollector calls = new FunctionCallCollector();
        unit.document.get().accept(calls, null);
        ImmutableList<Diagnostic> found = calls.validate(live);
        findings.put(unit, found);
        failures |= found.stream().anyMatch(Diagnostic::isError);
      }

      if (!failures) {
        findings.forEach(Unit::report);
        return live;
      }
      findings.forEach(
          (unit, found) -> {
            if (found.stream().anyMatch(Diagnostic::isError)) unit.report(found);
          });
    }
  }

  private void checkContracts(List<Unit> units) {
    List<Document> documents = new ArrayList<>();
    for (Unit unit : units) {
      if (!unit.failed) documents.add(unit.document.get());
    }

    ContractValidator contracts = new ContractValidator(documents, options.strict());
    for (Unit unit : units) {
      if (unit.failed) continue;
      unit.report(contracts.validate(unit.document.get()));
    }
  }

  private static void checkStateReferences(List<Unit> units) {
    List<Document> documents = new ArrayList<>();
    for (Unit unit : units) {
      if (!unit.failed) documents.add(unit.document.get());
    }

    StateReferenceValidator states = new StateReferenceValidator(documents);
    for (Unit unit : units) {
      if (unit.failed) continue;
      unit.report(states.validate(unit.document.get()));
    }
  }

  // State and MCP artifacts collect every document of their kind.
  private static List<OutputFile> aggregates(
      List<Document> documents, List<Diagnostic> diagnostics) {
    List<OutputFile> out = new ArrayList<>();

    List<String> states = new ArrayList<>();
    McpConfigWriter mcp = new McpConfigWriter();
    for (Document document : documents) {
      switch (document.kind()) {
        case STATE:
          states.add(document.name());
          break;
        case MCP_CONFIG:
          mcp.add(document.cast());
          break;
        default:
          break;
      }
    }

    if (!states.isEmpty()) {
      states.sort(Comparator.naturalOrder());
      out.add(Emitter.initAll(states));
    }
    if (!mcp.isEmpty()) out.add(mcp.write());
    diagnostics.addAll(mcp.warnings());
    return out;
  }

  // Two documents may not write the same path; the one from the first source file is kept.
  private static ImmutableList<OutputFile> uniquePaths(
      List<OutputFile> files, List<Diagnostic> diagnostics) {
    Map<String, OutputFile> byPath = new HashMap<>();
    for (OutputFile file : files) {
      OutputFile existing = byPath.putIfAbsent(file.path(), file);
      if (existing != null) {
        diagnostics.add(
            Diagnostic.warning(
                new Tokenizer.Pos(file.source(), 0, 0),
                String.format(
                    "%s is also generated from %s; this copy is dropped",
                    file.path(),
                    existing.source())));
      }
    }
    return byPath
        .values()
        .stream()
        .sorted(Comparator.comparing(OutputFile::path))
        .collect(ImmutableList.toImmutableList());
  }
}
