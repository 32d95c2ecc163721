package com.github.smc;

/**
 * Closed family of model nodes. Consumers walk it through {@link ModelVisitor}, so adding a node
 * kind breaks every visitor at compile time instead of being silently skipped.
 */
public sealed interface ModelNode
    permits StateMachine, State, Transition, EventDeclaration, CommandDeclaration {

  SourceLocation getLocation();

  <R> R accept(ModelVisitor<R> visitor);
}
