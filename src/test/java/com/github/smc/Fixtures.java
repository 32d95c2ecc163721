package com.github.smc;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads {@code .sm} sources from src/test/resources/fixtures.
 */
final class Fixtures {
  static final String MISS_GRANT = "miss_grant_controller.sm";
  static final String DUPLICATE_EVENT = "invalid_duplicate_event.sm";
  static final String UNDECLARED_STATE = "invalid_undeclared_state.sm";
  static final String IDLE_RUNNING = "idle_running.sm";
  static final String GUARDED_ALARM = "guarded_alarm.sm";

  static String load(final String name) {
    try (InputStream stream = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
      if (stream == null) {
        throw new IllegalArgumentException("No fixture named " + name);
      }
      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ioException) {
      throw new UncheckedIOException(ioException);
    }
  }

  static StateMachine parse(final String name) throws SyntaxException {
    return StateMachineParser.parse(load(name));
  }

  private Fixtures() {}
}
