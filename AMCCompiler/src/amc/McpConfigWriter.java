package amc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

/** Collects the servers of every MCP configuration into one {@code mcp.json}. */
final class McpConfigWriter {

  static final String PATH = "mcp.json";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  // Two-space indentation everywhere and "key": value, as JSON.stringify(x, null, 2) writes it.
  private static final DefaultPrettyPrinter PRINTER =
      new DefaultPrettyPrinter()
          .withSeparators(
              Separators.createDefaultInstance()
                  .withObjectFieldValueSpacing(Separators.Spacing.AFTER))
          .withArrayIndenter(new DefaultIndenter("  ", "\n"))
          .withObjectIndenter(new DefaultIndenter("  ", "\n"));

  private final Map<String, Document.McpServer> servers = new LinkedHashMap<>();
  private final List<Diagnostic> warnings = new ArrayList<>();

  // Configurations must be added in a stable order; the first server of a name wins.
  void add(Document.McpConfig config) {
    for (Document.McpServer server : config.servers()) {
      Document.McpServer existing = servers.get(server.name());
      if (existing != null) {
        warnings.add(
            Diagnostic.warning(
                server.pos(),
                String.format(
                    "MCP server '%s' is already defined; this one is ignored", server.name()),
                Optional.of(existing.pos())));
        continue;
      }
      servers.put(server.name(), server);
    }
  }

  boolean isEmpty() {
    return servers.isEmpty();
  }

  ImmutableList<Diagnostic> warnings() {
    return ImmutableList.copyOf(warnings);
  }

  OutputFile write() {
    ObjectNode root = MAPPER.createObjectNode();
    ObjectNode mcpServers = root.putObject("mcpServers");
    for (Document.McpServer server : servers.values()) {
      mcpServers.set(server.name(), serverJson(server));
    }
    try {
      return OutputFile.text(PATH, MAPPER.writer(PRINTER).writeValueAsString(root) + "\n", "");
    } catch (JsonProcessingException ex) {
      // A tree of strings always serializes.
      throw new IllegalStateException(ex);
    }
  }

  private static ObjectNode serverJson(Document.McpServer server) {
    ObjectNode json = MAPPER.createObjectNode();
    // stdio is the default and is left implicit.
    if (!server.type().equals("stdio")) json.put("type", server.type());
    server.command().ifPresent(c -> json.put("command", c));
    if (!server.args().isEmpty()) {
      ArrayNode args = json.putArray("args");
      server.args().forEach(args::add);
    }
    server.url().ifPresent(u -> json.put("url", u));
    if (!server.headers().isEmpty()) {
      ObjectNode headers = json.putObject("headers");
      server.headers().forEach(headers::put);
    }
    if (!server.env().isEmpty()) {
      ObjectNode env = json.putObject("env");
      server.env().forEach(env::put);
    }
    return json;
  }
}
