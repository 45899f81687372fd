package amc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Writes the runtime module for every function in the build. Call sites address functions by
 * id only, so both strategies expose the same registry behind the same entry point.
 */
public final class Bundler {

  static final String ENTRY_PATH = "runtime/runtime.js";
  static final String CHUNK_DIR = "runtime/chunks/";
  static final String COMMON_CHUNK = "common.mjs";

  // Node built-ins a body may use without importing them, keyed by the identifier it uses.
  private static final ImmutableMap<String, String> NODE_MODULES =
      ImmutableMap.of("fs", "fs/promises", "path", "path");

  // Ids a function cannot take: JavaScript reserved words and the injected module bindings.
  static final ImmutableSet<String> RESERVED_NAMES =
      ImmutableSet.<String>builder()
          .add("await", "break", "case", "catch", "class", "const", "continue", "debugger")
          .add("default", "delete", "do", "else", "enum", "export", "extends", "false")
          .add("finally", "for", "function", "if", "implements", "import", "in", "instanceof")
          .add("interface", "let", "new", "null", "package", "private", "protected", "public")
          .add("return", "static", "super", "switch", "this", "throw", "true", "try")
          .add("typeof", "var", "void", "while", "with", "yield", "arguments", "eval")
          .addAll(NODE_MODULES.keySet())
          .build();

  private static final Pattern TOP_LEVEL_NAME =
      Pattern.compile(
          "^(?:export\\s+)?(?:async\\s+)?(?:function\\s*\\*?|const|let|var|class)\\s+"
              + "([A-Za-z_$][A-Za-z0-9_$]*)",
          Pattern.MULTILINE);

  private static final CharMatcher FILE_NAME_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("._-"));

  private final BuildOptions.BundleStrategy strategy;

  public Bundler(BuildOptions.BundleStrategy strategy) {
    this.strategy = strategy;
  }

  /**
   * The runtime artifacts for {@code documents}, which must be in a stable order. Nothing is
   * written when the build declares no functions.
   */
  public ImmutableList<OutputFile> bundle(FunctionRegistry registry, List<Document> documents) {
    ImmutableSortedMap<String, FunctionDescriptor> functions = registry.snapshot();
    if (functions.isEmpty()) return ImmutableList.of();

    ImmutableList<String> helpers = helpers(documents);
    switch (strategy) {
      case CODE_SPLIT:
        return codeSplit(functions, helpers, documents);
      default:
        return ImmutableList.of(
            OutputFile.text(ENTRY_PATH, singleEntry(functions.values(), helpers), ""));
    }
  }

  // Helper code in document order, once per distinct text.
  static ImmutableList<String> helpers(List<Document> documents) {
    Map<String, String> byNormalized = new LinkedHashMap<>();
    for (Document document : documents) {
      for (String helper : document.helpers()) {
        byNormalized.putIfAbsent(FunctionDescriptor.normalize(helper), helper);
      }
    }
    return ImmutableList.copyOf(byNormalized.values());
  }

  static String function(FunctionDescriptor descriptor) {
    return "async function "
        + descriptor.id()
        + "(args) {\n"
        + indent(descriptor.body(), "  ")
        + "\n}";
  }

  // The Node modules the given code refers to, in a fixed order.
  static ImmutableSet<String> nodeModules(Iterable<String> code) {
    Set<String> out = new TreeSet<>();
    for (String text : code) {
      for (String name : NODE_MODULES.keySet()) {
        if (Pattern.compile("(?<![A-Za-z0-9_$.])" + name + "\\.").matcher(text).find()) {
          out.add(name);
        }
      }
    }
    return ImmutableSet.copyOf(out);
  }

  //
  // Single entry
  //

  private static String singleEntry(
      Iterable<FunctionDescriptor> functions, List<String> helpers) {
    List<String> code = new ArrayList<>(helpers);
    List<String> names = new ArrayList<>();
    for (FunctionDescriptor descriptor : functions) {
      code.add(function(descriptor));
      names.add(descriptor.id());
    }

    StringBuilder sb = new StringBuilder();
    sb.append("#!/usr/bin/env node\n");
    sb.append(
        "// Generated runtime module."
            + " Usage: node runtime.js <functionName> '<jsonArgs>'\n");
    sb.append('\n');
    for (String module : nodeModules(code)) {
      sb.append(
          String.format("const %s = require('%s');\n", module, NODE_MODULES.get(module)));
    }
    // Functions get their own scope so their ids never collide with the dispatcher's locals.
    sb.append("\n(async () => {\n");
    sb.append("  const registry = (() => {\n");
    sb.append(indent(Joiner.on("\n\n").join(code), "    ")).append("\n\n");
    sb.append("    return {\n");
    for (String name : names) sb.append("      ").append(name).append(",\n");
    sb.append("    };\n");
    sb.append("  })();\n");
    sb.append("  const load = async (fnName) => registry[fnName];\n\n");
    sb.append(indent(DISPATCH, "  ")).append('\n');
    sb.append("})();\n");
    return sb.toString();
  }

  private static final String DISPATCH =
      Joiner.on('\n')
          .join(
              "const [, , fnName, argsJson] = process.argv;",
              "if (!fnName) {",
              "  console.error('Usage: node runtime.js <functionName> <jsonArgs>');",
              "  console.error('Available functions:', Object.keys(registry).join(', '));",
              "  process.exit(1);",
              "}",
              "if (!Object.prototype.hasOwnProperty.call(registry, fnName)) {",
              "  console.error(`Unknown function: ${fnName}`);",
              "  console.error('Available functions:', Object.keys(registry).join(', '));",
              "  process.exit(1);",
              "}",
              "",
              "let args = {};",
              "if (argsJson) {",
              "  try {",
              "    args = JSON.parse(argsJson);",
              "  } catch (e) {",
              "    console.error(`Invalid JSON args: ${e.message}`);",
              "    process.exit(1);",
              "  }",
              "}",
              "",
              "try {",
              "  const fn = await load(fnName);",
              "  const result = await fn(args);",
              "  console.log(JSON.stringify(result));",
              "} catch (e) {",
              "  console.error(`Function error: ${e.message}`);",
              "  process.exit(1);",
              "}");

  //
  // Code split
  //

  private ImmutableList<OutputFile> codeSplit(
      ImmutableSortedMap<String, FunctionDescriptor> functions,
      List<String> helpers,
      List<Document> documents) {
    // Which documents declare or call each function.
    Map<String, Set<String>> users = new TreeMap<>();
    for (Document document : documents) {
      Set<String> ids = new LinkedHashSet<>();
      ids.addAll(
          document.functions().stream().map(FunctionDescriptor::id).collect(Collectors.toList()));
      ids.addAll(FunctionCallCollector.calledFunctions(document));
      for (String id : ids) {
        if (functions.containsKey(id)) {
          users.computeIfAbsent(id, k -> new TreeSet<>()).add(chunkName(document.name()));
        }
      }
    }

    SortedMap<String, List<FunctionDescriptor>> chunks = new TreeMap<>();
    Map<String, String> chunkOf = new TreeMap<>();
    for (FunctionDescriptor descriptor : functions.values()) {
      Set<String> used = users.getOrDefault(descriptor.id(), ImmutableSet.of());
      String chunk = used.size() == 1 ? used.iterator().next() : COMMON_CHUNK;
      chunks.computeIfAbsent(chunk, k -> new ArrayList<>()).add(descriptor);
      chunkOf.put(descriptor.id(), chunk);
    }

    ImmutableList<String> helperNames = topLevelNames(helpers);
    ImmutableList.Builder<OutputFile> out = ImmutableList.builder();
    out.add(OutputFile.text(ENTRY_PATH, dispatcher(chunkOf), ""));
    out.add(
        OutputFile.text(
            CHUNK_DIR + COMMON_CHUNK,
            common(chunks.getOrDefault(COMMON_CHUNK, ImmutableList.of()), helpers, helperNames),
            ""));
    for (Map.Entry<String, List<FunctionDescriptor>> chunk : chunks.entrySet()) {
      if (chunk.getKey().equals(COMMON_CHUNK)) continue;
      out.add(
          OutputFile.text(
              CHUNK_DIR + chunk.getKey(), chunk(chunk.getValue(), helperNames), ""));
    }
    return out.build();
  }

  static String chunkName(String documentName) {
    return FILE_NAME_CHARS.negate().replaceFrom(documentName, '_') + ".mjs";
  }

  static ImmutableList<String> topLevelNames(List<String> code) {
    Set<String> names = new LinkedHashSet<>();
    for (String text : code) {
      Matcher matcher = TOP_LEVEL_NAME.matcher(text);
      while (matcher.find()) names.add(matcher.group(1));
    }
    return ImmutableList.copyOf(names);
  }

  private static String imports(List<String> code) {
    StringBuilder sb = new StringBuilder();
    for (String module : nodeModules(code)) {
      sb.append(
          String.format("import * as %s from '%s';\n", module, NODE_MODULES.get(module)));
    }
    return sb.toString();
  }

  private static String common(
      List<FunctionDescriptor> functions, List<String> helpers, List<String> helperNames) {
    List<String> code = new ArrayList<>(helpers);
    for (FunctionDescriptor descriptor : functions) code.add("export " + function(descriptor));

    StringBuilder sb = new StringBuilder("// Generated runtime chunk: shared code.\n");
    String imports = imports(code);
    if (!imports.isEmpty()) sb.append('\n').append(imports);
    if (!code.isEmpty()) sb.append('\n').append(Joiner.on("\n\n").join(code)).append('\n');
    if (!helperNames.isEmpty()) {
      sb.append("\nexport { ").append(Joiner.on(", ").join(helperNames)).append(" };\n");
    }
    return sb.toString();
  }

  private static String chunk(List<FunctionDescriptor> functions, List<String> helperNames) {
    List<String> code = new ArrayList<>();
    for (FunctionDescriptor descriptor : functions) code.add("export " + function(descriptor));

    StringBuilder sb =
        new StringBuilder("// Generated runtime chunk: ")
            .append(functions.get(0).sourceFile())
            .append('\n');
    String imports = imports(code);
    if (!imports.isEmpty()) sb.append('\n').append(imports);
    if (!helperNames.isEmpty()) {
      sb.append(
          String.format(
              "%simport { %s } from './%s';\n",
              imports.isEmpty() ? "\n" : "",
              Joiner.on(", ").join(helperNames),
              COMMON_CHUNK));
    }
    sb.append('\n').append(Joiner.on("\n\n").join(code)).append('\n');
    return sb.toString();
  }

  private static String dispatcher(Map<String, String> chunkOf) {
    StringBuilder sb = new StringBuilder();
    sb.append("#!/usr/bin/env node\n");
    sb.append(
        "// Generated runtime dispatcher."
            + " Usage: node runtime.js <functionName> '<jsonArgs>'\n");
    sb.append('\n');
    sb.append("const path = require('path');\n");
    sb.append("const { pathToFileURL } = require('url');\n");
    sb.append('\n');
    sb.append("const registry = {\n");
    chunkOf.forEach((id, chunk) -> sb.append(String.format("  %s: '%s',\n", id, chunk)));
    sb.append("};\n\n");
    sb.append("async function load(fnName) {\n");
    sb.append("  const file = path.join(__dirname, 'chunks', registry[fnName]);\n");
    sb.append("  const chunk = await import(pathToFileURL(file).href);\n");
    sb.append("  return chunk[fnName];\n");
    sb.append("}\n\n");
    sb.append("(async () => {\n");
    sb.append(indent(DISPATCH, "  ")).append('\n');
    sb.append("})();\n");
    return sb.toString();
  }

  private static String indent(String text, String prefix) {
    return Splitter.on('\n')
        .splitToList(text)
        .stream()
        .map(line -> line.isEmpty() ? "" : prefix + line)
        .collect(Collectors.joining("\n"));
  }
}
