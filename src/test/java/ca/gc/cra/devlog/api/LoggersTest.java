package ca.gc.cra.devlog.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.devlog.application.StructuredLogger;
import ca.gc.cra.devlog.config.HandlerOptions;
import ca.gc.cra.devlog.domain.LogContext;
import ca.gc.cra.devlog.infrastructure.json.JsonHandler;
import ca.gc.cra.devlog.infrastructure.middleware.ContextEnrichingHandler;
import ca.gc.cra.devlog.infrastructure.render.DevHandler;
import ca.gc.cra.devlog.testutil.JsonLines;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LoggersTest {

  @AfterEach
  void resetDefault() {
    Loggers.reset();
  }

  @Test
  void productionStackEnrichesJson() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    HandlerOptions options = HandlerOptions.builder()
        .output(out)
        .addCxtAttr("requestId")
        .zone(ZoneOffset.UTC)
        .build();

    StructuredLogger logger = Loggers.production(options);
    logger.info(LogContext.empty().withValue("requestId", "r-9").withSql("SELECT 1"), "served");

    ContextEnrichingHandler handler = assertInstanceOf(ContextEnrichingHandler.class, logger.handler());
    assertInstanceOf(JsonHandler.class, handler.next());
    Map<String, Object> line = JsonLines.parse(out.toString(StandardCharsets.UTF_8)).get(0);
    assertEquals("served", line.get("msg"));
    assertEquals("r-9", line.get("requestId"));
    assertEquals("SELECT 1", line.get("sql"));
  }

  @Test
  void developmentStackRendersConsoleLines() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    HandlerOptions options = HandlerOptions.builder().output(out).color(false).build();

    StructuredLogger logger = Loggers.development(options);
    logger.warn("careful", "n", 2);

    assertInstanceOf(DevHandler.class, logger.handler());
    assertTrue(out.toString(StandardCharsets.UTF_8).endsWith("WARN careful n=2\n"));
  }

  @Test
  void installHappensOnce() {
    HandlerOptions options = HandlerOptions.builder().output(new ByteArrayOutputStream()).build();

    StructuredLogger installed = Loggers.initDevLogger(options);

    assertSame(installed, Loggers.getLogger());
    assertThrows(IllegalStateException.class, () -> Loggers.initLogger(options));
    assertSame(installed, Loggers.getLogger());
  }

  @Test
  void lazyDefaultCanBeReplaced() {
    StructuredLogger fallback = Loggers.getLogger();
    assertSame(fallback, Loggers.getLogger());
    assertInstanceOf(ContextEnrichingHandler.class, fallback.handler());

    StructuredLogger installed = Loggers.install(
        Loggers.development(HandlerOptions.builder().output(new ByteArrayOutputStream()).build()));

    assertNotSame(fallback, installed);
    assertSame(installed, Loggers.getLogger());
  }
}
