package amc;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

// Gathers the runtime variables a document declares, keyed by shell name.
class RuntimeVariableCollector extends ErrorCollectingValidator {

  private final Map<String, Block.VariableDeclaration> declarations = new LinkedHashMap<>();

  @Override
  public void visitImpl(Block.VariableDeclaration declaration) {
    declarations.putIfAbsent(declaration.name(), declaration);
  }

  public ImmutableMap<String, Block.VariableDeclaration> declarations() {
    return ImmutableMap.copyOf(declarations);
  }

  public Optional<Block.VariableDeclaration> declaration(String name) {
    return Optional.ofNullable(declarations.get(name));
  }
}
