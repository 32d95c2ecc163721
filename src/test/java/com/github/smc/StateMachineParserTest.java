package com.github.smc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Optional;

import org.junit.Test;

import com.github.smc.CompilerException.Code;

/**
 * Tests to maintain the sanity and correctness of StateMachineParser.
 */
public class StateMachineParserTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testMissGrantController() throws SyntaxException {
    final StateMachine machine = Fixtures.parse(Fixtures.MISS_GRANT);
    assertEquals("missGrant", machine.getName());
    assertEquals(5, machine.getEvents().size());
    assertEquals("D1CL", machine.getEvents().get(0).getCode());
    assertEquals(List.of("doorOpened"), machine.getResetEvents());
    assertEquals(4, machine.getCommands().size());
    assertEquals(5, machine.getStates().size());
    assertEquals(6, machine.getTransitions().size());

    final State idle = machine.getInitialState().get();
    assertEquals("idle", idle.getName());
    assertEquals(List.of("unlockDoor", "lockPanel"), idle.getEntryActions());
    assertTrue(idle.getExitActions().isEmpty());

    final List<Transition> fromActive = machine.getOutgoingTransitions("active");
    assertEquals(2, fromActive.size());
    assertEquals("drawerOpened", fromActive.get(0).getEvent());
    assertEquals("waitingForLight", fromActive.get(0).getTarget());
    assertFalse(fromActive.get(0).isGuarded());
    assertEquals(Optional.empty(), fromActive.get(0).getAction());
  }

  @Test
  public void testForwardReferencesAreKeptAsWritten() throws SyntaxException {
    final StateMachine machine = StateMachineParser.parse(
        "machine m\ntransition later on go => later\ninitial state first on go => later end\n"
            + "state later end\n");
    assertEquals(2, machine.getTransitions().size());
    assertEquals("later", machine.getTransitions().get(0).getSource());
    assertEquals(new SourceLocation(2, 1), machine.getTransitions().get(0).getLocation());
    assertEquals("first", machine.getTransitions().get(1).getSource());
    assertEquals(new SourceLocation(3, 21), machine.getTransitions().get(1).getLocation());
    assertTrue(machine.findState("later").isPresent());
  }

  @Test
  public void testUndeclaredNamesStillParse() throws SyntaxException {
    final StateMachine machine = Fixtures.parse(Fixtures.UNDECLARED_STATE);
    assertEquals("nowhere", machine.getTransitions().get(0).getTarget());
    assertFalse(machine.findState("nowhere").isPresent());
  }

  @Test
  public void testTransitionTail() throws SyntaxException {
    final StateMachine machine = StateMachineParser.parse(
        "machine m initial state a on e [x && !y] / act => b end state b end");
    final Transition transition = machine.getTransitions().get(0);
    assertEquals("e", transition.getEvent());
    assertEquals(Optional.of("act"), transition.getAction());
    assertEquals("b", transition.getTarget());
    assertEquals(new Guard.And(new Guard.Reference("x"), new Guard.Not(new Guard.Reference("y"))),
        transition.getGuard().get());
  }

  @Test
  public void testGuardPrecedenceAndAssociativity() throws SyntaxException {
    final Guard a = new Guard.Reference("a");
    final Guard b = new Guard.Reference("b");
    final Guard c = new Guard.Reference("c");
    // && binds tighter than ||
    assertEquals(new Guard.Or(a, new Guard.And(b, c)), guardOf("a || b && c"));
    assertEquals(new Guard.Or(new Guard.And(a, b), c), guardOf("a && b || c"));
    // left associative
    assertEquals(new Guard.Or(new Guard.Or(a, b), c), guardOf("a || b || c"));
    // parentheses regroup
    assertEquals(new Guard.Or(a, new Guard.Or(b, c)), guardOf("a || (b || c)"));
    assertEquals(new Guard.Not(new Guard.And(a, new Guard.Constant(true))),
        guardOf("!(a && true)"));
    assertNotEquals(guardOf("a && b"), guardOf("b && a"));
  }

  @Test
  public void testEntryAndExitClauses() throws SyntaxException {
    final StateMachine machine = StateMachineParser.parse(
        "machine m initial state a exit { x } entry { y z } end");
    final State state = machine.getStates().get(0);
    assertEquals(List.of("y", "z"), state.getEntryActions());
    assertEquals(List.of("x"), state.getExitActions());
  }

  @Test
  public void testDuplicateClause() {
    final SyntaxException problem =
        syntaxError("machine m\ninitial state a\n  entry { x }\n  entry { y }\nend\n");
    assertEquals(Code.DUPLICATE_CLAUSE, problem.getCode());
    assertEquals(4, problem.getLine());
    assertEquals(3, problem.getColumn());
    assertEquals("entry", problem.getToken());
  }

  @Test
  public void testMissingArrow() {
    final SyntaxException problem = syntaxError("machine m\nstate a\n  on go b\nend\n");
    assertEquals(Code.UNEXPECTED_TOKEN, problem.getCode());
    assertEquals(3, problem.getLine());
    assertEquals(9, problem.getColumn());
    assertEquals("b", problem.getToken());
    assertTrue(problem.getMessage().startsWith("3:9: expected '=>'"));
  }

  @Test
  public void testKeywordAsIdentifier() {
    final SyntaxException problem = syntaxError("machine m\nstate end\n");
    assertEquals(Code.UNEXPECTED_TOKEN, problem.getCode());
    assertEquals(2, problem.getLine());
    assertEquals(7, problem.getColumn());
    assertTrue(problem.getMessage().contains("reserved keyword"));
  }

  @Test
  public void testUnterminatedState() {
    final SyntaxException problem = syntaxError("machine m\ninitial state a\n  on go => b\n");
    assertEquals(Code.UNEXPECTED_END_OF_INPUT, problem.getCode());
    assertEquals(4, problem.getLine());
    assertEquals("", problem.getToken());
  }

  @Test
  public void testMissingHeader() {
    final SyntaxException problem = syntaxError("state a end");
    assertEquals(Code.UNEXPECTED_TOKEN, problem.getCode());
    assertEquals(1, problem.getLine());
    assertEquals(1, problem.getColumn());
  }

  @Test
  public void testEmptyGuard() {
    final SyntaxException problem = syntaxError("machine m state a on e [] => a end");
    assertEquals(Code.UNEXPECTED_TOKEN, problem.getCode());
    assertEquals("]", problem.getToken());
  }

  @Test
  public void testEventWithoutCode() {
    final SyntaxException problem = syntaxError("machine m events opened end");
    assertEquals(Code.UNEXPECTED_TOKEN, problem.getCode());
    assertEquals("end", problem.getToken());
  }

  private static Guard guardOf(final String guard) throws SyntaxException {
    return StateMachineParser.parse("machine m state s on e [" + guard + "] => s end")
        .getTransitions().get(0).getGuard().get();
  }

  private static SyntaxException syntaxError(final String text) {
    try {
      StateMachineParser.parse(text);
    } catch (SyntaxException problem) {
      return problem;
    }
    fail("expected a syntax error for: " + text);
    return null;
  }
}
