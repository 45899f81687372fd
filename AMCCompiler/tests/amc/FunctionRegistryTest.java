package amc;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

public class FunctionRegistryTest {

  private static FunctionDescriptor function(String id, String file, int line, String body) {
    return FunctionDescriptor.create(
        id, Optional.empty(), Optional.empty(), body, file, new Tokenizer.Pos(file, line, 2));
  }

  @Test
  public void firstSourceFileWinsInAnyOrder() {
    FunctionDescriptor a = function("f", "/src/a.amc", 3, "return 1;");
    FunctionDescriptor b = function("f", "/src/b.amc", 1, "return 2;");

    FunctionRegistry forward = new FunctionRegistry();
    forward.register(a);
    forward.register(b);
    FunctionRegistry backward = new FunctionRegistry();
    backward.register(b);
    backward.register(a);

    assertThat(forward.get("f")).hasValue(a);
    assertThat(backward.get("f")).hasValue(a);
    assertThat(forward.conflictWarnings()).isEqualTo(backward.conflictWarnings());
  }

  @Test
  public void conflictWarning() {
    FunctionDescriptor a = function("f", "/src/a.amc", 3, "return 1;");
    FunctionDescriptor b = function("f", "/src/b.amc", 1, "return 2;");
    FunctionRegistry registry = new FunctionRegistry();
    registry.registerAll(ImmutableList.of(b, a));

    ImmutableList<Diagnostic> warnings = registry.conflictWarnings();

    assertThat(warnings).hasSize(1);
    Diagnostic warning = warnings.get(0);
    assertThat(warning.isError()).isFalse();
    assertThat(warning.pos()).isEqualTo(b.pos());
    assertThat(warning.related()).hasValue(a.pos());
    assertThat(warning.message())
        .isEqualTo(
            "function 'f' is declared differently elsewhere; the declaration in /src/a.amc is"
                + " used");
  }

  @Test
  public void identicalDeclarationsDoNotConflict() {
    FunctionRegistry registry = new FunctionRegistry();
    registry.register(function("f", "/src/a.amc", 0, "const x = 1;\nreturn x;"));
    registry.register(function("f", "/src/b.amc", 0, "const x = 1;   return x;"));

    assertThat(registry.conflictWarnings()).isEmpty();
    assertThat(registry.get("f").get().sourceFile()).isEqualTo("/src/a.amc");
  }

  @Test
  public void differentShapesConflict() throws CompilerException {
    Tokenizer.Pos pos = new Tokenizer.Pos("/src/b.amc", 0, 0);
    FunctionRegistry registry = new FunctionRegistry();
    registry.register(function("f", "/src/a.amc", 0, "return 1;"));
    registry.register(
        FunctionDescriptor.create(
            "f",
            Optional.of(Shape.parse("{x: number}", pos)),
            Optional.empty(),
            "return 1;",
            "/src/b.amc",
            pos));

    assertThat(registry.conflictWarnings()).hasSize(1);
  }

  @Test
  public void withoutFilesPicksTheWinnerAgain() {
    FunctionDescriptor a = function("f", "/src/a.amc", 3, "return 1;");
    FunctionDescriptor b = function("f", "/src/b.amc", 1, "return 2;");
    FunctionDescriptor onlyA = function("g", "/src/a.amc", 5, "return 3;");
    FunctionRegistry registry = new FunctionRegistry();
    registry.registerAll(ImmutableList.of(a, b, onlyA));

    FunctionRegistry rest = registry.withoutFiles(ImmutableSet.of("/src/a.amc"));

    assertThat(rest.get("f")).hasValue(b);
    assertThat(rest.get("g")).isEmpty();
    assertThat(rest.conflictWarnings()).isEmpty();
    assertThat(registry.get("f")).hasValue(a);
    assertThat(registry.conflictWarnings()).hasSize(1);
  }

  @Test
  public void snapshotIsSortedById() {
    FunctionRegistry registry = new FunctionRegistry();
    assertThat(registry.isEmpty()).isTrue();
    registry.register(function("zeta", "/src/a.amc", 0, "return 1;"));
    registry.register(function("alpha", "/src/a.amc", 1, "return 2;"));
    registry.register(function("mid", "/src/b.amc", 0, "return 3;"));

    assertThat(registry.isEmpty()).isFalse();
    assertThat(registry.snapshot().keySet()).containsExactly("alpha", "mid", "zeta").inOrder();
    assertThat(registry.get("missing")).isEmpty();
  }

  @Test
  public void concurrentRegistrationIsDeterministic() throws Exception {
    List<FunctionDescriptor> descriptors = new ArrayList<>();
    for (int file = 0; file < 20; file++) {
      for (int fn = 0; fn < 10; fn++) {
        descriptors.add(
            function("fn" + fn, String.format("/src/%02d.amc", file), 0, "return " + file + ";"));
      }
    }

    FunctionRegistry registry = new FunctionRegistry();
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (FunctionDescriptor descriptor : ImmutableList.copyOf(descriptors).reverse()) {
        futures.add(executor.submit(() -> registry.register(descriptor)));
      }
      for (Future<?> future : futures) future.get();
    } finally {
      executor.shutdown();
    }

    assertThat(registry.snapshot()).hasSize(10);
    for (FunctionDescriptor winner : registry.snapshot().values()) {
      assertThat(winner.sourceFile()).isEqualTo("/src/00.amc");
    }
    assertThat(registry.conflictWarnings()).hasSize(10 * 19);
  }
}
