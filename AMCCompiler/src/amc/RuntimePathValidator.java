package amc;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Warns about variable paths that leave the declared shape, and records which variables the
 * document reads or writes.
 */
class RuntimePathValidator extends ErrorCollectingValidator {

  private final RuntimeVariableCollector variables;
  private final Set<String> used = new HashSet<>();

  public RuntimePathValidator(RuntimeVariableCollector variables) {
    this.variables = variables;
  }

  public ImmutableSet<String> used() {
    return ImmutableSet.copyOf(used);
  }

  @Override
  public void visitImpl(RuntimeExpression.VarRef ref) {
    used.add(ref.variable());
    Optional<Block.VariableDeclaration> decl = variables.declaration(ref.variable());
    if (!decl.isPresent()) return;

    if (!decl.get().shape().resolve(ref.path()).isPresent()) {
      logWarning(
          ref.pos(),
          String.format(
              "'%s' is not part of the declared shape of '%s' (%s)",
              ref.reference(), decl.get().ref(), decl.get().shape()),
          Optional.of(decl.get().pos()));
    }
  }

  @Override
  public void visitImpl(Block.RuntimeCall call) {
    call.output().ifPresent(used::add);
    call.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Block.AskUser askUser) {
    used.add(askUser.output());
  }

  @Override
  public void visitImpl(Block.SpawnAgent spawn) {
    spawn.output().ifPresent(used::add);
    spawn.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Block.OnStatus onStatus) {
    used.add(onStatus.output());
    onStatus.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Block.ReadState read) {
    used.add(read.output());
  }

  @Override
  public void visitImpl(Block.Assign assign) {
    for (Block.Assignment assignment : assign.assignments()) {
      if (variables.declaration(assignment.variable()).isPresent()) {
        used.add(assignment.variable());
      }
    }
  }
}
