package com.github.smc;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import javax.lang.model.SourceVersion;
import javax.lang.model.element.Modifier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.smc.CompilerException.Code;
import com.palantir.javapoet.ClassName;
import com.palantir.javapoet.FieldSpec;
import com.palantir.javapoet.JavaFile;
import com.palantir.javapoet.MethodSpec;
import com.palantir.javapoet.TypeName;
import com.palantir.javapoet.TypeSpec;

/**
 * Generates Java sources implementing a state machine with the state pattern. For a machine named
 * {@code door} the output is, in this order:
 *
 * <pre>
 * DoorActions   interface, one void method per action, one boolean method per guard variable
 * DoorState     abstract base, one handler per event falling back to "unhandled" (or reset)
 * XxxState      one final singleton per state, overriding the handlers of its outgoing events
 * DoorContext   owns the current state, fires events, carries UnhandledEventException
 * </pre>
 *
 * The output is a pure function of the model. The generator does not trust that the checker ran:
 * a model it cannot turn into correct code is refused with a {@link GenerationException}.
 */
public final class StateMachineGenerator implements ModelVisitor<Void> {
  private static final Logger logger =
      LogManager.getLogger(StateMachineGenerator.class.getSimpleName());

  // no-arg methods of Object that generated action or guard methods must not redeclare
  private static final Set<String> objectMethods = Set.of("getClass", "hashCode", "toString",
      "notify", "notifyAll", "wait", "clone", "finalize");

  private final String targetPackage;
  private final String indent;

  // per run state, reset by generate()
  private StateMachine machine;
  private ClassName actionsName;
  private ClassName baseName;
  private ClassName contextName;
  private Map<String, ClassName> stateClassNames;
  private Set<String> actions;
  private Set<String> guardVariables;
  private Set<String> events;
  private Set<String> resetEvents;
  private List<TypeSpec> stateUnits;

  public StateMachineGenerator(final CompilerConfiguration config) {
    this.targetPackage = config.getTargetPackage();
    this.indent = config.getIndent();
  }

  public GeneratedSources generate(final StateMachine machine) throws GenerationException {
    this.machine = machine;
    final String prefix = ucfirst(machine.getName());
    actionsName = ClassName.get(targetPackage, prefix + "Actions");
    baseName = ClassName.get(targetPackage, prefix + "State");
    contextName = ClassName.get(targetPackage, prefix + "Context");
    stateClassNames = new LinkedHashMap<>();
    actions = new LinkedHashSet<>();
    guardVariables = new LinkedHashSet<>();
    events = new LinkedHashSet<>();
    resetEvents = new LinkedHashSet<>(machine.getResetEvents());
    stateUnits = new ArrayList<>();

    validate();
    machine.walk(this);

    final List<JavaFile> files = new ArrayList<>();
    files.add(file(actionsInterface()));
    files.add(file(baseClass()));
    for (final TypeSpec stateUnit : stateUnits) {
      files.add(file(stateUnit));
    }
    files.add(file(contextClass()));
    if (logger.isDebugEnabled()) {
      logger.debug("[c:" + machine.getName() + "] generated " + files.size()
          + " compilation units for " + stateUnits.size() + " states");
    }
    return new GeneratedSources(files, new ArrayList<>(stateClassNames.values()),
        contextName);
  }

  ///// fail-fast model validation /////
  private void validate() throws GenerationException {
    final Set<String> reserved =
        Set.of(actionsName.simpleName(), baseName.simpleName(), contextName.simpleName());
    final Map<String, String> classToState = new HashMap<>();
    State initial = null;
    for (final State state : machine.getStates()) {
      if (stateClassNames.containsKey(state.getName())) {
        throw new GenerationException(Code.DUPLICATE_STATE, state.getName(),
            "State " + state.getName() + " is declared more than once");
      }
      final ClassName className =
          ClassName.get(targetPackage, ucfirst(state.getName()) + "State");
      final String clashing = classToState.put(className.simpleName(), state.getName());
      if (clashing != null || reserved.contains(className.simpleName())) {
        throw new GenerationException(Code.NAME_CLASH, state.getName(), "State "
            + state.getName() + " would be generated as " + className.simpleName()
            + ", which is already taken");
      }
      stateClassNames.put(state.getName(), className);
      if (state.isInitial()) {
        if (initial != null) {
          throw new GenerationException(Code.MULTIPLE_INITIAL_STATES, state.getName(),
              "States " + initial.getName() + " and " + state.getName() + " are both initial");
        }
        initial = state;
      }
      for (final String action : state.getEntryActions()) {
        requireMethodName(action);
      }
      for (final String action : state.getExitActions()) {
        requireMethodName(action);
      }
    }
    if (initial == null) {
      throw new GenerationException(Code.MISSING_INITIAL_STATE, machine.getName(),
          "Machine " + machine.getName() + " has no initial state");
    }
    for (final CommandDeclaration command : machine.getCommands()) {
      requireMethodName(command.getName());
    }

    // declared, reset and transition events all get a handler in the base class
    final Set<String> allEvents = new LinkedHashSet<>();
    for (final EventDeclaration event : machine.getEvents()) {
      allEvents.add(event.getName());
    }
    allEvents.addAll(machine.getResetEvents());
    for (final Transition transition : machine.getTransitions()) {
      allEvents.add(transition.getEvent());
    }
    final Map<String, String> handlerToEvent = new HashMap<>();
    for (final String event : allEvents) {
      final String other = handlerToEvent.putIfAbsent(handlerName(event), event);
      if (other != null) {
        throw new GenerationException(Code.NAME_CLASH, event, "Events " + other + " and "
            + event + " map onto the same handler " + handlerName(event));
      }
    }

    final Set<String> guardNames = new HashSet<>();
    for (final Transition transition : machine.getTransitions()) {
      for (final String end : List.of(transition.getSource(), transition.getTarget())) {
        if (!stateClassNames.containsKey(end)) {
          throw new GenerationException(Code.UNRESOLVED_STATE, end, "Transition "
              + transition.getSource() + " --" + transition.getEvent() + "--> "
              + transition.getTarget() + " references undeclared state " + end);
        }
      }
      if (transition.getAction().isPresent()) {
        requireMethodName(transition.getAction().get());
      }
      if (transition.getGuard().isPresent()) {
        for (final String variable : GuardAnalysis.variables(transition.getGuard().get())) {
          requireMethodName(variable);
          guardNames.add(variable);
        }
      }
    }

    for (final List<Transition> group : ModelChecker.groupBySourceAndEvent(machine).values()) {
      int unguarded = 0;
      final List<Guard> guards = new ArrayList<>();
      for (final Transition transition : group) {
        if (!transition.isGuarded()) {
          unguarded++;
        } else if (guards.contains(transition.getGuard().get())) {
          unguarded = 2;
        } else {
          guards.add(transition.getGuard().get());
        }
        if (unguarded > 1) {
          throw new GenerationException(Code.DUPLICATE_TRANSITION, transition.getEvent(),
              "In state " + transition.getSource() + ": event " + transition.getEvent()
                  + " has transitions that cannot be told apart");
        }
      }
    }

    final Set<String> actionNames = new HashSet<>();
    for (final CommandDeclaration command : machine.getCommands()) {
      actionNames.add(command.getName());
    }
    for (final State state : machine.getStates()) {
      actionNames.addAll(state.getEntryActions());
      actionNames.addAll(state.getExitActions());
    }
    for (final Transition transition : machine.getTransitions()) {
      transition.getAction().ifPresent(actionNames::add);
    }
    for (final String guardName : guardNames) {
      if (actionNames.contains(guardName)) {
        throw new GenerationException(Code.NAME_CLASH, guardName,
            guardName + " is used both as an action and as a guard variable");
      }
    }
  }

  private static void requireMethodName(final String name) throws GenerationException {
    if (!SourceVersion.isName(name)) {
      throw new GenerationException(Code.INVALID_IDENTIFIER, name,
          name + " is a reserved word in Java");
    }
    if (objectMethods.contains(name)) {
      throw new GenerationException(Code.NAME_CLASH, name,
          name + " clashes with java.lang.Object#" + name + "()");
    }
  }

  ///// model walk /////
  @Override
  public Void visitStateMachine(StateMachine machine) {
    events.addAll(machine.getResetEvents());
    return null;
  }

  @Override
  public Void visitEvent(EventDeclaration event) {
    events.add(event.getName());
    return null;
  }

  @Override
  public Void visitCommand(CommandDeclaration command) {
    actions.add(command.getName());
    return null;
  }

  @Override
  public Void visitState(State state) {
    actions.addAll(state.getEntryActions());
    actions.addAll(state.getExitActions());
    stateUnits.add(stateClass(state));
    return null;
  }

  @Override
  public Void visitTransition(Transition transition) {
    events.add(transition.getEvent());
    transition.getAction().ifPresent(actions::add);
    if (transition.getGuard().isPresent()) {
      guardVariables.addAll(GuardAnalysis.variables(transition.getGuard().get()));
    }
    return null;
  }

  ///// type builders /////
  private TypeSpec actionsInterface() {
    final TypeSpec.Builder builder = TypeSpec.interfaceBuilder(actionsName)
        .addModifiers(Modifier.PUBLIC)
        .addJavadoc("Actions and guard conditions of state machine $L.\n", machine.getName());
    for (final String action : actions) {
      builder.addMethod(MethodSpec.methodBuilder(action)
          .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
          .build());
    }
    for (final String variable : guardVariables) {
      builder.addMethod(MethodSpec.methodBuilder(variable)
          .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
          .returns(TypeName.BOOLEAN)
          .build());
    }
    return builder.build();
  }

  private TypeSpec baseClass() {
    final TypeSpec.Builder builder = TypeSpec.classBuilder(baseName)
        .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
        .addJavadoc("Base of all states of state machine $L. Events a state does not handle end up"
            + " here.\n", machine.getName())
        .addMethod(MethodSpec.constructorBuilder().build())
        .addMethod(MethodSpec.methodBuilder("name")
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .returns(String.class)
            .build())
        .addMethod(MethodSpec.methodBuilder("enter")
            .addParameter(contextName, "context")
            .build())
        .addMethod(MethodSpec.methodBuilder("exit")
            .addParameter(contextName, "context")
            .build());
    for (final String event : events) {
      final MethodSpec.Builder handler = MethodSpec.methodBuilder(handlerName(event))
          .addParameter(contextName, "context");
      if (resetEvents.contains(event)) {
        handler.addStatement("context.reset()");
      } else {
        handler.addStatement("context.unhandled($S)", event);
      }
      builder.addMethod(handler.build());
    }
    builder.addMethod(MethodSpec.methodBuilder("toString")
        .addAnnotation(Override.class)
        .addModifiers(Modifier.PUBLIC)
        .returns(String.class)
        .addStatement("return name()")
        .build());
    return builder.build();
  }

  private TypeSpec stateClass(final State state) {
    final ClassName className = stateClassNames.get(state.getName());
    final TypeSpec.Builder builder = TypeSpec.classBuilder(className)
        .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
        .superclass(baseName)
        .addJavadoc("State $L of state machine $L.\n", state.getName(), machine.getName())
        .addField(FieldSpec.builder(className, "INSTANCE", Modifier.STATIC, Modifier.FINAL)
            .initializer("new $T()", className)
            .build())
        .addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build())
        .addMethod(MethodSpec.methodBuilder("name")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class)
            .addStatement("return $S", state.getName())
            .build());
    if (!state.getEntryActions().isEmpty()) {
      builder.addMethod(actionsMethod("enter", state.getEntryActions()));
    }
    if (!state.getExitActions().isEmpty()) {
      builder.addMethod(actionsMethod("exit", state.getExitActions()));
    }

    final Map<String, List<Transition>> byEvent = new LinkedHashMap<>();
    for (final Transition transition : machine.getOutgoingTransitions(state.getName())) {
      byEvent.computeIfAbsent(transition.getEvent(), event -> new ArrayList<>()).add(transition);
    }
    for (final Map.Entry<String, List<Transition>> entry : byEvent.entrySet()) {
      builder.addMethod(handler(entry.getKey(), entry.getValue()));
    }
    return builder.build();
  }

  private MethodSpec actionsMethod(final String name, final List<String> stateActions) {
    final MethodSpec.Builder method = MethodSpec.methodBuilder(name)
        .addAnnotation(Override.class)
        .addParameter(contextName, "context");
    for (final String action : stateActions) {
      method.addStatement("context.actions().$N()", action);
    }
    return method.build();
  }

  /**
   * Guarded transitions are tried in declaration order, then the unguarded one; with no unguarded
   * transition the base class decides (unhandled or reset).
   */
  private MethodSpec handler(final String event, final List<Transition> transitions) {
    final MethodSpec.Builder method = MethodSpec.methodBuilder(handlerName(event))
        .addAnnotation(Override.class)
        .addParameter(contextName, "context");
    Transition fallback = null;
    for (final Transition transition : transitions) {
      if (!transition.isGuarded()) {
        fallback = transition;
        continue;
      }
      method.beginControlFlow("if ($L)",
          transition.getGuard().get().accept(new GuardCodeWriter()));
      fire(method, transition);
      method.addStatement("return");
      method.endControlFlow();
    }
    if (fallback != null) {
      fire(method, fallback);
    } else {
      method.addStatement("super.$N(context)", handlerName(event));
    }
    return method.build();
  }

  private void fire(final MethodSpec.Builder method, final Transition transition) {
    method.addStatement("context.leave()");
    if (transition.getAction().isPresent()) {
      method.addStatement("context.actions().$N()", transition.getAction().get());
    }
    method.addStatement("context.enter($T.INSTANCE)", stateClassNames.get(transition.getTarget()));
  }

  private TypeSpec contextClass() {
    final ClassName exceptionName = contextName.nestedClass("UnhandledEventException");
    final ClassName initialName =
        stateClassNames.get(machine.getInitialState().get().getName());

    final TypeSpec exception = TypeSpec.classBuilder(exceptionName)
        .addModifiers(Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
        .superclass(IllegalStateException.class)
        .addField(FieldSpec.builder(long.class, "serialVersionUID", Modifier.PRIVATE,
            Modifier.STATIC, Modifier.FINAL).initializer("1L").build())
        .addField(String.class, "stateName", Modifier.PRIVATE, Modifier.FINAL)
        .addField(String.class, "event", Modifier.PRIVATE, Modifier.FINAL)
        .addMethod(MethodSpec.constructorBuilder()
            .addParameter(String.class, "stateName")
            .addParameter(String.class, "event")
            .addStatement("super($S + event + $S + stateName)", "Event ",
                " is not handled in state ")
            .addStatement("this.stateName = stateName")
            .addStatement("this.event = event")
            .build())
        .addMethod(MethodSpec.methodBuilder("getStateName")
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class)
            .addStatement("return stateName")
            .build())
        .addMethod(MethodSpec.methodBuilder("getEvent")
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class)
            .addStatement("return event")
            .build())
        .build();

    final TypeSpec.Builder builder = TypeSpec.classBuilder(contextName)
        .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
        .addJavadoc("Runs state machine $L. Not thread-safe.\n", machine.getName())
        .addField(actionsName, "actions", Modifier.PRIVATE, Modifier.FINAL)
        .addField(baseName, "state", Modifier.PRIVATE)
        .addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addParameter(actionsName, "actions")
            .addStatement("this.actions = $T.requireNonNull(actions)", Objects.class)
            .addStatement("this.state = $T.INSTANCE", initialName)
            .addStatement("this.state.enter(this)")
            .build())
        .addMethod(MethodSpec.methodBuilder("getState")
            .addModifiers(Modifier.PUBLIC)
            .returns(baseName)
            .addStatement("return state")
            .build())
        .addMethod(MethodSpec.methodBuilder("actions")
            .returns(actionsName)
            .addStatement("return actions")
            .build())
        .addMethod(MethodSpec.methodBuilder("leave")
            .addStatement("state.exit(this)")
            .build())
        .addMethod(MethodSpec.methodBuilder("enter")
            .addParameter(baseName, "next")
            .addStatement("state = next")
            .addStatement("next.enter(this)")
            .build())
        .addMethod(MethodSpec.methodBuilder("reset")
            .addModifiers(Modifier.PUBLIC)
            .addStatement("leave()")
            .addStatement("enter($T.INSTANCE)", initialName)
            .build())
        .addMethod(MethodSpec.methodBuilder("unhandled")
            .addParameter(String.class, "event")
            .addStatement("throw new $T(state.name(), event)", exceptionName)
            .build());

    final MethodSpec.Builder dispatcher = MethodSpec.methodBuilder("fire")
        .addModifiers(Modifier.PUBLIC)
        .addParameter(String.class, "event")
        .beginControlFlow("switch (event)");
    for (final String event : events) {
      final String fireName = "fire" + ucfirst(event);
      builder.addMethod(MethodSpec.methodBuilder(fireName)
          .addModifiers(Modifier.PUBLIC)
          .addStatement("state.$N(this)", handlerName(event))
          .build());
      dispatcher.addCode("case $S:\n$>", event)
          .addStatement("$N()", fireName)
          .addStatement("break")
          .addCode("$<");
    }
    dispatcher.addCode("default:\n$>")
        .addStatement("throw new $T($S + event)", IllegalArgumentException.class,
            "Unknown event: ")
        .addCode("$<")
        .endControlFlow();

    return builder.addMethod(dispatcher.build()).addType(exception).build();
  }

  private JavaFile file(final TypeSpec type) {
    return JavaFile.builder(targetPackage, type)
        .addFileComment("Generated from state machine $L. Do not edit.", machine.getName())
        .indent(indent)
        .skipJavaLangImports(true)
        .build();
  }

  private static String handlerName(final String event) {
    return "on" + ucfirst(event);
  }

  /**
   * @param input The input to adjust
   * @return The input with the first letter uppercase
   */
  static String ucfirst(final String input) {
    return input.substring(0, 1).toUpperCase(Locale.ROOT) + input.substring(1);
  }

  /**
   * Renders a guard as a Java boolean expression over the actions interface, with the same
   * minimal parenthesization rules as {@link ModelPrinter#printGuard(Guard)}.
   */
  private static final class GuardCodeWriter implements GuardVisitor<String> {
    @Override
    public String visitReference(Guard.Reference reference) {
      return "context.actions()." + reference.getName() + "()";
    }

    @Override
    public String visitConstant(Guard.Constant constant) {
      return Boolean.toString(constant.getValue());
    }

    @Override
    public String visitNot(Guard.Not not) {
      return "!" + operand(not.getOperand(), 3, false);
    }

    @Override
    public String visitAnd(Guard.And and) {
      return operand(and.getLeft(), 2, false) + " && " + operand(and.getRight(), 2, true);
    }

    @Override
    public String visitOr(Guard.Or or) {
      return operand(or.getLeft(), 1, false) + " || " + operand(or.getRight(), 1, true);
    }

    private String operand(final Guard child, final int parentPrecedence, final boolean right) {
      final String text = child.accept(this);
      final boolean wrap = right ? child.precedence() <= parentPrecedence
          : child.precedence() < parentPrecedence;
      return wrap ? "(" + text + ")" : text;
    }
  }
}
