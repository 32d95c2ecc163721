package com.github.smc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of ModelChecker.
 */
public class ModelCheckerTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private final ModelChecker checker = new ModelChecker();

  @Test
  public void testValidMachinesAreClean() throws SyntaxException {
    for (final String fixture : List.of(Fixtures.MISS_GRANT, Fixtures.IDLE_RUNNING,
        Fixtures.GUARDED_ALARM)) {
      assertEquals(fixture, List.of(), checker.check(Fixtures.parse(fixture)));
    }
  }

  @Test
  public void testDuplicateEventTransitionIsReportedOnce() throws SyntaxException {
    final List<Diagnostic> diagnostics = checker.check(Fixtures.parse(Fixtures.DUPLICATE_EVENT));
    assertEquals(1, diagnostics.size());
    final Diagnostic diagnostic = diagnostics.get(0);
    assertEquals(DiagnosticCode.DUPLICATE_TRANSITION, diagnostic.getCode());
    assertTrue(diagnostic.isError());
    assertEquals(Optional.of("A"), diagnostic.getStateName());
    assertEquals(Optional.of("event"), diagnostic.getEventName());
    assertEquals("In state A: event event redeclared", diagnostic.getMessage());
    assertEquals(new SourceLocation(5, 5), diagnostic.getLocation());
    assertEquals("5:5: error SM105: In state A: event event redeclared", diagnostic.toString());
    assertTrue(ModelChecker.hasErrors(diagnostics));
  }

  @Test
  public void testUndeclaredState() throws SyntaxException {
    final List<Diagnostic> diagnostics = checker.check(Fixtures.parse(Fixtures.UNDECLARED_STATE));
    assertEquals(1, diagnostics.size());
    assertEquals(DiagnosticCode.UNDECLARED_STATE, diagnostics.get(0).getCode());
    assertEquals(Optional.of("nowhere"), diagnostics.get(0).getStateName());
    assertEquals(Optional.of("go"), diagnostics.get(0).getEventName());
    assertEquals("Transition on go references undeclared state nowhere",
        diagnostics.get(0).getMessage());
  }

  @Test
  public void testUndeclaredSourceBeforeTarget() throws SyntaxException {
    final List<Diagnostic> diagnostics =
        check("machine m initial state a end transition x on go => y");
    assertEquals(List.of(DiagnosticCode.UNDECLARED_STATE, DiagnosticCode.UNDECLARED_STATE),
        codes(diagnostics));
    assertEquals(Optional.of("x"), diagnostics.get(0).getStateName());
    assertEquals(Optional.of("y"), diagnostics.get(1).getStateName());
  }

  @Test
  public void testDuplicateState() throws SyntaxException {
    final List<Diagnostic> diagnostics = check("machine m initial state a end state a end");
    assertEquals(List.of(DiagnosticCode.DUPLICATE_STATE), codes(diagnostics));
    assertEquals(new SourceLocation(1, 31), diagnostics.get(0).getLocation());
  }

  @Test
  public void testMissingInitialState() throws SyntaxException {
    final List<Diagnostic> diagnostics =
        check("machine m state a on go => b end state b on back => a end");
    assertEquals(List.of(DiagnosticCode.MISSING_INITIAL_STATE), codes(diagnostics));
    assertEquals(new SourceLocation(1, 1), diagnostics.get(0).getLocation());
  }

  @Test
  public void testMultipleInitialStates() throws SyntaxException {
    final List<Diagnostic> diagnostics =
        check("machine m initial state a on go => b end initial state b on go => a end");
    assertEquals(List.of(DiagnosticCode.MULTIPLE_INITIAL_STATES), codes(diagnostics));
    assertEquals("State b marked initial, but a already is", diagnostics.get(0).getMessage());
  }

  @Test
  public void testMultipleInitialStatesReportedOnce() throws SyntaxException {
    final List<Diagnostic> diagnostics =
        check("machine m initial state a end initial state b end initial state c end");
    final List<Diagnostic> initials = new ArrayList<>();
    for (final Diagnostic diagnostic : diagnostics) {
      if (diagnostic.getCode() == DiagnosticCode.MULTIPLE_INITIAL_STATES) {
        initials.add(diagnostic);
      }
    }
    assertEquals(1, initials.size());
    assertEquals("State b marked initial, but a already is", initials.get(0).getMessage());
  }

  @Test
  public void testSelfTransitionWithoutAction() throws SyntaxException {
    final List<Diagnostic> diagnostics =
        check("machine m initial state a on poke => a on kick / bump => a end");
    assertEquals(List.of(DiagnosticCode.SELF_TRANSITION_NO_EFFECT), codes(diagnostics));
    assertEquals(Optional.of("poke"), diagnostics.get(0).getEventName());
    assertEquals("In state a: event poke has no effect", diagnostics.get(0).getMessage());
  }

  @Test
  public void testDeclarationRulesInOrder() throws SyntaxException {
    final List<Diagnostic> diagnostics = check("machine m\n"
        + "events go G1 go G2 end\n"
        + "resetEvents stop end\n"
        + "commands ring R1 ring R2 end\n"
        + "initial state a entry { buzz } on go => b on jump / ring => b end\n"
        + "state b end\n");
    assertEquals(List.of(DiagnosticCode.DUPLICATE_EVENT, DiagnosticCode.DUPLICATE_COMMAND,
        DiagnosticCode.UNDECLARED_EVENT, DiagnosticCode.UNDECLARED_COMMAND,
        DiagnosticCode.UNDECLARED_RESET_EVENT), codes(diagnostics));
    assertEquals(new SourceLocation(3, 13), diagnostics.get(4).getLocation());
    assertEquals(Optional.of("jump"), diagnostics.get(2).getEventName());
  }

  @Test
  public void testUndeclaredNamesIgnoredWithoutDeclarations() throws SyntaxException {
    assertEquals(List.of(), check("machine m initial state a on go / ring => b end state b end"));
  }

  @Test
  public void testGuardedAlternativesAndFallback() throws SyntaxException {
    assertEquals(List.of(), check("machine m initial state a on e [x] => b on e => c end"
        + " state b end state c end"));
  }

  @Test
  public void testIdenticalGuardsAreDuplicates() throws SyntaxException {
    final List<Diagnostic> diagnostics = check("machine m initial state a"
        + " on e [x && y] => b on e [x && y] => c end state b end state c end");
    assertEquals(List.of(DiagnosticCode.DUPLICATE_TRANSITION), codes(diagnostics));
  }

  @Test
  public void testOverlappingGuardsWarn() throws SyntaxException {
    final List<Diagnostic> diagnostics = check("machine m initial state a"
        + " on e [x] => b on e [y] => c on e [!x && !y] => d end"
        + " state b end state c end state d end");
    assertEquals(List.of(DiagnosticCode.OVERLAPPING_GUARDS), codes(diagnostics));
    assertEquals(Diagnostic.Severity.WARNING, diagnostics.get(0).getSeverity());
    assertFalse(ModelChecker.hasErrors(diagnostics));
  }

  @Test
  public void testUnreachableStateWarns() throws SyntaxException {
    final List<Diagnostic> diagnostics =
        check("machine m initial state a end state b on go / ping => b end");
    assertEquals(List.of(DiagnosticCode.UNREACHABLE_STATE), codes(diagnostics));
    assertEquals(Optional.of("b"), diagnostics.get(0).getStateName());
    assertFalse(diagnostics.get(0).isError());
  }

  @Test
  public void testChecksAreDeterministic() throws SyntaxException {
    final String text = "machine m\nstate a on e => b on e => c end\ninitial state a end\n"
        + "initial state z on e [p] => a on e [q] => a end\ntransition q on e => q\n";
    final List<Diagnostic> first = check(text);
    assertFalse(first.isEmpty());
    for (int i = 0; i < 5; i++) {
      assertEquals(first, check(text));
    }
  }

  @Test
  public void testDiagnosticsSurviveRoundTrip() throws SyntaxException {
    final StateMachine machine = Fixtures.parse(Fixtures.DUPLICATE_EVENT);
    final String dump = new ModelPrinter(CompilerConfiguration.defaults()).print(machine);
    assertEquals(codes(checker.check(machine)),
        codes(checker.check(StateMachineParser.parse(dump))));
  }

  private List<Diagnostic> check(final String text) throws SyntaxException {
    return checker.check(StateMachineParser.parse(text));
  }

  private static List<DiagnosticCode> codes(final List<Diagnostic> diagnostics) {
    final List<DiagnosticCode> codes = new ArrayList<>();
    for (final Diagnostic diagnostic : diagnostics) {
      codes.add(diagnostic.getCode());
    }
    return codes;
  }
}
