package ca.gc.cra.devlog.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class LogContextTest {

  @Test
  void typedViewsReadRecognizedKeys() {
    Source source = new Source("run", "app/Main.java", 3);
    LogContext context = LogContext.empty()
        .withSql("SELECT 1")
        .withRows(4)
        .withDuration(Duration.ofMillis(12))
        .withSource(source);

    assertEquals("SELECT 1", context.sql().orElseThrow());
    assertEquals(4L, context.rows().getAsLong());
    assertEquals(Duration.ofMillis(12), context.duration().orElseThrow());
    assertEquals(source, context.source().orElseThrow());
  }

  @Test
  void wrongTypesAreIgnoredByTypedViews() {
    LogContext context = LogContext.empty()
        .withValue(ContextKeys.SQL, 42)
        .withValue(ContextKeys.ROWS, "many")
        .withValue(ContextKeys.DURATION, "slow");

    assertTrue(context.sql().isEmpty());
    assertTrue(context.rows().isEmpty());
    assertTrue(context.duration().isEmpty());
    assertEquals(42, context.value(ContextKeys.SQL).orElseThrow());
  }

  @Test
  void derivationLeavesOriginalUntouched() {
    LogContext base = LogContext.empty().withValue("a", 1);
    LogContext derived = base.withValue("b", 2);

    assertEquals(List.of("a"), List.copyOf(base.asMap().keySet()));
    assertEquals(List.of("a", "b"), List.copyOf(derived.asMap().keySet()));
  }

  @Test
  void nullRemovesKey() {
    LogContext context = LogContext.empty().withValue("a", 1);

    assertTrue(context.withValue("a", null).value("a").isEmpty());
    assertSame(context, context.withValue("b", null));
  }

  @Test
  void blankKeysAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> LogContext.empty().withValue(" ", 1));
  }
}
