package com.github.smc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.smc.CompilerConfiguration.CompilerConfigurationBuilder;
import com.github.smc.CompilerException.Code;
import com.palantir.javapoet.ClassName;

/**
 * Tests to maintain the sanity and correctness of StateMachineGenerator.
 */
public class StateMachineGeneratorTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Test
  public void testOneUnitPerState() throws Exception {
    final StateMachine machine = Fixtures.parse(Fixtures.MISS_GRANT);
    final GeneratedSources sources = generator("com.example.door").generate(machine);

    assertEquals(machine.getStates().size() + 3, sources.getFiles().size());
    final List<String> stateUnits = new ArrayList<>();
    for (final ClassName stateUnit : sources.getStateUnits()) {
      assertEquals("com.example.door", stateUnit.packageName());
      stateUnits.add(stateUnit.simpleName());
    }
    assertEquals(List.of("IdleState", "ActiveState", "WaitingForLightState",
        "WaitingForDrawerState", "UnlockedPanelState"), stateUnits);
    assertEquals("MissGrantContext", sources.getContextName().simpleName());
  }

  @Test
  public void testGeneratedShape() throws Exception {
    final String text =
        generator("com.example.door").generate(Fixtures.parse(Fixtures.MISS_GRANT)).toString();
    assertTrue(text.contains("package com.example.door;"));
    assertTrue(text.contains("public interface MissGrantActions"));
    assertTrue(text.contains("void unlockDoor();"));
    assertTrue(text.contains("public abstract class MissGrantState"));
    assertTrue(text.contains("context.reset();"));
    assertTrue(text.contains("context.unhandled(\"lightOn\");"));
    assertTrue(text.contains("public final class IdleState extends MissGrantState"));
    assertTrue(text.contains("static final IdleState INSTANCE = new IdleState();"));
    assertTrue(text.contains("context.actions().unlockDoor();"));
    assertTrue(text.contains("context.enter(ActiveState.INSTANCE);"));
    assertTrue(text.contains("public final class MissGrantContext"));
    assertTrue(text.contains("public void fireDoorClosed()"));
    assertTrue(text.contains("case \"doorClosed\":"));
    assertTrue(text.contains("class UnhandledEventException extends IllegalStateException"));
  }

  @Test
  public void testGuardsBecomeConditions() throws Exception {
    final String text =
        generator("").generate(Fixtures.parse(Fixtures.GUARDED_ALARM)).toString();
    assertFalse(text.contains("package "));
    assertTrue(text.contains("boolean armed();"));
    assertTrue(text.contains("boolean muted();"));
    assertTrue(text.contains("void ring();"));
    assertTrue(text.contains("if (context.actions().armed() && !context.actions().muted())"));
    assertTrue(text.contains("if (!context.actions().armed() || context.actions().muted())"));
    assertTrue(text.contains("super.onSensor(context);"));
  }

  @Test
  public void testIndentIsConfigurable() throws Exception {
    final CompilerConfiguration config =
        CompilerConfigurationBuilder.newBuilder().indent("  ").build();
    final String text = new StateMachineGenerator(config)
        .generate(Fixtures.parse(Fixtures.IDLE_RUNNING)).toString();
    assertTrue(text.contains("\n  public String name() {\n    return \"Idle\";\n  }\n"));
  }

  @Test
  public void testGenerationIsDeterministic() throws Exception {
    final StateMachine machine = Fixtures.parse(Fixtures.MISS_GRANT);
    final String first = generator("p").generate(machine).toString();
    assertEquals(first, generator("p").generate(machine).toString());
    assertEquals(first, generator("p").generate(Fixtures.parse(Fixtures.MISS_GRANT)).toString());
  }

  @Test
  public void testWriteTo() throws Exception {
    final Path root = temporaryFolder.newFolder().toPath();
    generator("com.example.engine").generate(Fixtures.parse(Fixtures.IDLE_RUNNING)).writeTo(root);
    final Path packageDir = root.resolve("com/example/engine");
    for (final String unit : List.of("EngineActions", "EngineState", "IdleState", "RunningState",
        "EngineContext")) {
      assertTrue(unit, Files.isRegularFile(packageDir.resolve(unit + ".java")));
    }
  }

  @Test
  public void testRefusesDuplicateTransition() throws Exception {
    final GenerationException problem = refused(Fixtures.load(Fixtures.DUPLICATE_EVENT));
    assertEquals(Code.DUPLICATE_TRANSITION, problem.getCode());
    assertEquals("event", problem.getIdentifier());

    assertEquals(Code.DUPLICATE_TRANSITION, refused("machine m initial state a"
        + " on e [x] => b on e [x] => a end state b end").getCode());
  }

  @Test
  public void testRefusesUnresolvedState() throws Exception {
    final GenerationException problem = refused(Fixtures.load(Fixtures.UNDECLARED_STATE));
    assertEquals(Code.UNRESOLVED_STATE, problem.getCode());
    assertEquals("nowhere", problem.getIdentifier());
  }

  @Test
  public void testRefusesBrokenStateSets() throws Exception {
    assertEquals(Code.DUPLICATE_STATE,
        refused("machine m initial state a end state a end").getCode());
    assertEquals(Code.MISSING_INITIAL_STATE, refused("machine m state a end").getCode());
    assertEquals(Code.MULTIPLE_INITIAL_STATES,
        refused("machine m initial state a end initial state b end").getCode());
  }

  @Test
  public void testRefusesJavaKeywords() throws Exception {
    final GenerationException problem =
        refused("machine m initial state a on go / class => a end");
    assertEquals(Code.INVALID_IDENTIFIER, problem.getCode());
    assertEquals("class", problem.getIdentifier());
    assertEquals(Code.INVALID_IDENTIFIER,
        refused("machine m initial state a on go [int] => a end").getCode());
    // declared commands become action methods even when no transition uses them
    final GenerationException command =
        refused("machine m commands int I1 end initial state a end");
    assertEquals(Code.INVALID_IDENTIFIER, command.getCode());
    assertEquals("int", command.getIdentifier());
  }

  @Test
  public void testRefusesNameClashes() throws Exception {
    // idle and Idle both become IdleState
    assertEquals(Code.NAME_CLASH,
        refused("machine m initial state idle on go => Idle end state Idle end").getCode());
    // state m would shadow the base class MState
    assertEquals(Code.NAME_CLASH, refused("machine m initial state m end").getCode());
    assertEquals(Code.NAME_CLASH,
        refused("machine m initial state a on go [ready] / ready => b end state b end")
            .getCode());
    assertEquals(Code.NAME_CLASH,
        refused("machine m initial state a on go => b on Go => b end state b end").getCode());
    assertEquals(Code.NAME_CLASH,
        refused("machine m initial state a entry { toString } end").getCode());
    // declared and reset events get handlers whether or not a transition fires them
    assertEquals(Code.NAME_CLASH,
        refused("machine m events go G1 Go G2 end initial state a end").getCode());
    assertEquals(Code.NAME_CLASH,
        refused("machine m resetEvents go Go end initial state a end").getCode());
  }

  @Test
  public void testClassNamesIgnoreDefaultLocale() throws Exception {
    final StateMachine machine =
        StateMachineParser.parse("machine m initial state idle on go => idle end");
    final String expected = generator("p").generate(machine).toString();
    final Locale saved = Locale.getDefault();
    try {
      // dotted capital I under Turkish case rules
      Locale.setDefault(new Locale("tr"));
      final String generated = generator("p").generate(machine).toString();
      assertTrue(generated.contains("final class IdleState"));
      assertEquals(expected, generated);
    } finally {
      Locale.setDefault(saved);
    }
  }

  private static StateMachineGenerator generator(final String targetPackage)
      throws CompilerException {
    return new StateMachineGenerator(
        CompilerConfigurationBuilder.newBuilder().targetPackage(targetPackage).build());
  }

  private static GenerationException refused(final String text) throws CompilerException {
    try {
      generator("p").generate(StateMachineParser.parse(text));
    } catch (GenerationException problem) {
      return problem;
    }
    fail("expected the generator to refuse: " + text);
    return null;
  }
}
