package com.github.smc;

/**
 * Read-only traversal over the model. Printer, summary, checker and generator all implement this
 * rather than poking at node fields in their own walk order.
 */
public interface ModelVisitor<R> {

  R visitStateMachine(StateMachine machine);

  R visitEvent(EventDeclaration event);

  R visitCommand(CommandDeclaration command);

  R visitState(State state);

  R visitTransition(Transition transition);
}
